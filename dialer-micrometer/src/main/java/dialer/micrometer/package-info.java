/**
 * Micrometer bridge for exporting dialer metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link dialer.micrometer.MicrometerMetricsExporter} implements the
 * {@link dialer.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see dialer.micrometer.MicrometerMetricsExporter
 */
package dialer.micrometer;
