/**
 * Pure mapping from reminder and rollover rows to the schedule they should have.
 */
package reconciler.compile;
