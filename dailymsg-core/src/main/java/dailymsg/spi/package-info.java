/**
 * Service provider interfaces for persistence, connections and metrics.
 *
 * <p>{@link dailymsg.spi.DeliveryStore} and {@link dailymsg.spi.BucketStore} are the only
 * paths through which delivery rows and rate-limit buckets change. JDBC implementations
 * live in {@code dailymsg-jdbc}.
 *
 * @see dailymsg.spi.DeliveryStore
 * @see dailymsg.spi.BucketStore
 * @see dailymsg.spi.MetricsExporter
 */
package dailymsg.spi;
