/**
 * Micrometer bridge for exporting pipeline metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link dailymsg.micrometer.MicrometerMetricsExporter} implements the
 * {@link dailymsg.spi.MetricsExporter} SPI using Micrometer counters, a gauge and a timer.
 *
 * @see dailymsg.micrometer.MicrometerMetricsExporter
 */
package dailymsg.micrometer;
