/**
 * Inbox path: scheduler callbacks in, storage updates and follow-up intents out.
 */
package reconciler.feedback;
