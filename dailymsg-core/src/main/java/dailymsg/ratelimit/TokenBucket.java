package dailymsg.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Refill-and-debit arithmetic shared by the local and distributed limiters.
 *
 * <p>Pure functions over a snapshot; callers are responsible for applying the
 * resulting state atomically.
 */
final class TokenBucket {

    private TokenBucket() {
    }

    /**
     * Result of applying one acquisition to a snapshot.
     *
     * @param acquisition  outcome for the caller
     * @param tokens       tokens left after refill and (if allowed) debit
     * @param lastRefillAt refill timestamp to store
     */
    record Outcome(Acquisition acquisition, double tokens, Instant lastRefillAt) {
    }

    /**
     * Refills {@code tokens} for the time between {@code lastRefillAt} and {@code now},
     * capped at capacity, then debits {@code cost} if enough tokens are present.
     * A clock that moved backwards adds nothing and keeps the later timestamp.
     */
    static Outcome apply(BucketSpec spec, double tokens, Instant lastRefillAt, Instant now, int cost) {
        Instant refillAt = now.isAfter(lastRefillAt) ? now : lastRefillAt;
        double elapsedSeconds = Duration.between(lastRefillAt, refillAt).toNanos() / 1_000_000_000.0;
        double available = Math.min(spec.capacity(), tokens + elapsedSeconds * spec.refillPerSecond());

        if (available >= cost) {
            return new Outcome(Acquisition.granted(), available - cost, refillAt);
        }
        return new Outcome(Acquisition.denied(retryAfter(spec, cost - available)), available, refillAt);
    }

    private static Duration retryAfter(BucketSpec spec, double deficit) {
        if (spec.refillPerSecond() <= 0) {
            return Acquisition.NEVER;
        }
        long millis = (long) Math.ceil(deficit * 1000.0 / spec.refillPerSecond());
        return Duration.ofMillis(Math.max(1L, millis));
    }
}
