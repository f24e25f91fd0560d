/**
 * Applies outbox intents to the external scheduler.
 */
package reconciler.reconcile;
