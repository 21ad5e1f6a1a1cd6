package dailymsg.spi;

import dailymsg.model.RateLimitBucket;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Shared persistence for rate-limit buckets used by
 * {@link dailymsg.ratelimit.DistributedRateLimiter}.
 *
 * <p>Writes are compare-and-set on the bucket's version so that concurrent processes
 * never apply two debits computed from the same snapshot.
 *
 * @see dailymsg.jdbc.store.JdbcBucketStore
 */
public interface BucketStore {

    Optional<RateLimitBucket> find(Connection conn, String resource);

    /**
     * Creates the bucket row if absent.
     *
     * @return {@code true} if this call created it
     */
    boolean insertIfAbsent(Connection conn, RateLimitBucket bucket);

    /**
     * Writes new state only if the stored version still equals {@code expectedVersion};
     * the stored version is incremented on success.
     *
     * @return {@code true} if the write was applied
     */
    boolean compareAndSet(Connection conn, String resource, long expectedVersion,
                          double tokens, Instant lastRefillAt);
}
