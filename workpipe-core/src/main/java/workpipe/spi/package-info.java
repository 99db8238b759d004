/**
 * Service Provider Interfaces (SPI) for extending workpipe.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in connection provisioning and metrics.
 *
 * @see workpipe.spi.ConnectionProvider
 * @see workpipe.spi.MetricsExporter
 */
package workpipe.spi;
