package dailymsg.ratelimit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Outcome of {@link RateLimiter#tryAcquire}.
 *
 * @param allowed    whether the tokens were debited
 * @param retryAfter zero when allowed; otherwise the estimated wait until enough tokens accrue
 */
public record Acquisition(boolean allowed, Duration retryAfter) {

    /**
     * Retry hint for a bucket that never refills.
     */
    public static final Duration NEVER = ChronoUnit.FOREVER.getDuration();

    private static final Acquisition GRANTED = new Acquisition(true, Duration.ZERO);

    public Acquisition {
        Objects.requireNonNull(retryAfter, "retryAfter");
        if (retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be >= 0");
        }
    }

    public static Acquisition granted() {
        return GRANTED;
    }

    public static Acquisition denied(Duration retryAfter) {
        return new Acquisition(false, retryAfter);
    }
}
