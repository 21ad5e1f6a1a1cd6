package dailymsg.ratelimit;

import dailymsg.model.RateLimitBucket;
import dailymsg.spi.BucketStore;
import dailymsg.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RateLimiter} whose bucket state lives in a shared store, so every process
 * drawing on the same resource sees one bucket.
 *
 * <p>Each acquisition reads {@code (tokens, lastRefillAt, version)}, applies the
 * {@link TokenBucket} arithmetic and writes the result with a compare-and-set on
 * {@code version}. A conflicting write by another process makes the CAS fail and the
 * acquisition is recomputed from a fresh snapshot, so two processes can never both
 * spend tokens computed from the same state. After {@code maxCasAttempts} conflicts
 * the call is denied with a short retry hint.
 *
 * <p>Denials do not write: the refill is a function of the stored timestamp, so
 * skipping the write loses nothing.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class DistributedRateLimiter implements RateLimiter {
    private static final Logger logger = Logger.getLogger(DistributedRateLimiter.class.getName());

    private final ConnectionProvider connectionProvider;
    private final BucketStore bucketStore;
    private final Map<String, BucketSpec> specs;
    private final Clock clock;
    private final int maxCasAttempts;
    private final Duration contentionRetryAfter;

    private DistributedRateLimiter(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.bucketStore = Objects.requireNonNull(builder.bucketStore, "bucketStore");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.specs.isEmpty()) {
            throw new IllegalArgumentException("At least one bucket must be configured");
        }
        if (builder.maxCasAttempts < 1) {
            throw new IllegalArgumentException("maxCasAttempts must be >= 1");
        }
        Objects.requireNonNull(builder.contentionRetryAfter, "contentionRetryAfter");
        if (builder.contentionRetryAfter.isNegative() || builder.contentionRetryAfter.isZero()) {
            throw new IllegalArgumentException("contentionRetryAfter must be positive");
        }
        this.specs = Map.copyOf(builder.specs);
        this.maxCasAttempts = builder.maxCasAttempts;
        this.contentionRetryAfter = builder.contentionRetryAfter;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Acquisition tryAcquire(String resource, int cost) {
        BucketSpec spec = resource == null ? null : specs.get(resource);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown rate-limit resource: " + resource);
        }
        spec.checkCost(resource, cost);

        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            for (int attempt = 0; attempt < maxCasAttempts; attempt++) {
                Instant now = clock.instant();
                Optional<RateLimitBucket> current = bucketStore.find(conn, resource);
                if (current.isEmpty()) {
                    bucketStore.insertIfAbsent(conn, new RateLimitBucket(resource, spec.capacity(), now, 0L));
                    continue;
                }
                RateLimitBucket bucket = current.get();
                TokenBucket.Outcome outcome = TokenBucket.apply(spec, bucket.tokens(), bucket.lastRefillAt(), now, cost);
                if (!outcome.acquisition().allowed()) {
                    return outcome.acquisition();
                }
                if (bucketStore.compareAndSet(conn, resource, bucket.version(),
                    outcome.tokens(), outcome.lastRefillAt())) {
                    return outcome.acquisition();
                }
            }
        } catch (SQLException | RuntimeException e) {
            throw new RateLimitUnavailableException("Rate-limit state unavailable for resource " + resource, e);
        }
        logger.log(Level.FINE, "Bucket {0} still contended after {1} CAS attempts",
            new Object[]{resource, maxCasAttempts});
        return Acquisition.denied(contentionRetryAfter);
    }

    /**
     * Builder for {@link DistributedRateLimiter}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private BucketStore bucketStore;
        private final Map<String, BucketSpec> specs = new LinkedHashMap<>();
        private Clock clock;
        private int maxCasAttempts = 10;
        private Duration contentionRetryAfter = Duration.ofMillis(50);

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder bucketStore(BucketStore bucketStore) {
            this.bucketStore = bucketStore;
            return this;
        }

        /**
         * Configures one resource. At least one is required.
         */
        public Builder bucket(String resource, BucketSpec spec) {
            specs.put(Objects.requireNonNull(resource, "resource"), Objects.requireNonNull(spec, "spec"));
            return this;
        }

        public Builder buckets(Map<String, BucketSpec> buckets) {
            buckets.forEach(this::bucket);
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Optional. Defaults to {@code 10}. Must be &ge; 1.
         */
        public Builder maxCasAttempts(int maxCasAttempts) {
            this.maxCasAttempts = maxCasAttempts;
            return this;
        }

        /**
         * Retry hint returned when the bucket stays contended. Optional. Defaults to 50 ms.
         */
        public Builder contentionRetryAfter(Duration contentionRetryAfter) {
            this.contentionRetryAfter = contentionRetryAfter;
            return this;
        }

        public DistributedRateLimiter build() {
            return new DistributedRateLimiter(this);
        }
    }
}
