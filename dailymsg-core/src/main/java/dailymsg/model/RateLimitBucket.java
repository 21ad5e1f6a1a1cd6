package dailymsg.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted token-bucket state for one named resource.
 *
 * <p>Capacity and refill rate are configuration, not state; only the current token
 * count, the last refill instant and an optimistic-lock version are stored.
 *
 * @param resource     resource name, e.g. {@code sms}
 * @param tokens       tokens available as of {@code lastRefillAt}
 * @param lastRefillAt instant the token count was last brought up to date
 * @param version      compare-and-set counter, incremented on every write
 */
public record RateLimitBucket(String resource, double tokens, Instant lastRefillAt, long version) {

  public RateLimitBucket {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(lastRefillAt, "lastRefillAt");
  }
}
