/**
 * Scheduler-side value types: schedule specs, units of work and schedule handles.
 */
package reconciler.schedule;
