/**
 * Service provider interfaces: storage, the external scheduler and metrics.
 */
package reconciler.spi;
