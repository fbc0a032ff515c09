/**
 * Micrometer binding for the bridge's {@link chatbridge.spi.MetricsExporter}.
 */
package chatbridge.micrometer;
