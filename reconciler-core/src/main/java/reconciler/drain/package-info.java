/**
 * The claim-and-process loop shared by the outbox and inbox, and its retry policy.
 */
package reconciler.drain;
