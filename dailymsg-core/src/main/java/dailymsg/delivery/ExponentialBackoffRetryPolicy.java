package dailymsg.delivery;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with additive jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, plus a
 * random jitter in {@code [0, 20%)} of the capped delay. The jitter is added after the
 * cap, so the longest possible delay is just under {@code 1.2 * maxDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  static final double JITTER_FRACTION = 0.2;

  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay before jitter (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long capped = cappedDelayMs(attempts);
    long jitter = (long) (capped * JITTER_FRACTION * ThreadLocalRandom.current().nextDouble());
    return capped + jitter;
  }

  /**
   * Delay for {@code attempts} before jitter is applied.
   */
  long cappedDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    if (attempts >= 63) {
      return maxDelayMs;
    }
    long shift = 1L << (attempts - 1);
    // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
    if (shift > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * shift);
  }
}
