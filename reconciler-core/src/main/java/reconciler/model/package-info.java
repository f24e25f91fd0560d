/**
 * Domain rows and queue rows exchanged between storage, the compiler and the drainers.
 */
package reconciler.model;
