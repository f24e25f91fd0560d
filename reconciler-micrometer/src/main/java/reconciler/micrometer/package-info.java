/**
 * Micrometer bridge for exporting reconciler metrics to Prometheus, Grafana, and other backends.
 *
 * @see reconciler.micrometer.MicrometerMetricsExporter
 */
package reconciler.micrometer;
