package dailymsg.ratelimit;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory {@link RateLimiter} guarded by one monitor per bucket.
 *
 * <p>State is not shared between processes: N processes each running a
 * {@code LocalRateLimiter} may together reach N times the configured rate. Use it only
 * for single-process deployments and tests; otherwise use {@link DistributedRateLimiter}.
 */
public final class LocalRateLimiter implements RateLimiter {
    private final Map<String, LocalBucket> buckets;
    private final Clock clock;

    public LocalRateLimiter(Map<String, BucketSpec> specs) {
        this(specs, Clock.systemUTC());
    }

    public LocalRateLimiter(Map<String, BucketSpec> specs, Clock clock) {
        Objects.requireNonNull(specs, "specs");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (specs.isEmpty()) {
            throw new IllegalArgumentException("At least one bucket must be configured");
        }
        Instant now = clock.instant();
        Map<String, LocalBucket> map = new LinkedHashMap<>();
        specs.forEach((name, spec) -> map.put(name, new LocalBucket(Objects.requireNonNull(spec, name), now)));
        this.buckets = Map.copyOf(map);
    }

    @Override
    public Acquisition tryAcquire(String resource, int cost) {
        LocalBucket bucket = resource == null ? null : buckets.get(resource);
        if (bucket == null) {
            throw new IllegalArgumentException("Unknown rate-limit resource: " + resource);
        }
        bucket.spec.checkCost(resource, cost);
        return bucket.acquire(clock.instant(), cost);
    }

    private static final class LocalBucket {
        private final BucketSpec spec;
        private double tokens;
        private Instant lastRefillAt;

        LocalBucket(BucketSpec spec, Instant now) {
            this.spec = spec;
            this.tokens = spec.capacity();
            this.lastRefillAt = now;
        }

        synchronized Acquisition acquire(Instant now, int cost) {
            TokenBucket.Outcome outcome = TokenBucket.apply(spec, tokens, lastRefillAt, now, cost);
            tokens = outcome.tokens();
            lastRefillAt = outcome.lastRefillAt();
            return outcome.acquisition();
        }
    }
}
