package dailymsg.delivery;

import java.time.Duration;
import java.util.Objects;

/**
 * Signals that a rate limiter denied a token for an attempt in progress.
 *
 * <p>Never surfaces from {@link DeliveryWorker#tick()}: the worker catches it, returns the
 * row to PENDING at {@code now + min(retryAfter, maxThrottleDelay)} and does not count
 * an attempt.
 */
public class ThrottledException extends RuntimeException {
  private final String resource;
  private final Duration retryAfter;

  public ThrottledException(String resource, Duration retryAfter) {
    super("Rate limit for '" + resource + "' exhausted, retry after " + retryAfter);
    this.resource = Objects.requireNonNull(resource, "resource");
    this.retryAfter = Objects.requireNonNull(retryAfter, "retryAfter");
  }

  public String resource() {
    return resource;
  }

  public Duration retryAfter() {
    return retryAfter;
  }
}
