/**
 * Service provider interfaces for the dialer.
 *
 * <p>{@link dialer.spi.PeerRegistry} answers connectivity questions,
 * {@link dialer.spi.PeerConnector} performs the actual dial for the default queue, and
 * {@link dialer.spi.MetricsExporter} exports counters and gauges.
 */
package dialer.spi;
