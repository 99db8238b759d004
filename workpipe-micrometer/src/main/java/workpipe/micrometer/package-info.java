/**
 * Micrometer bridge for exporting pipeline and rate-limit metrics to Prometheus, Grafana, and
 * other backends.
 *
 * @see workpipe.micrometer.MicrometerMetricsExporter
 */
package workpipe.micrometer;
