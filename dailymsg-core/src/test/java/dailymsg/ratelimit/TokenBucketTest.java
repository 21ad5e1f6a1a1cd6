package dailymsg.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTest {
  private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

  @Test
  void debitsWhenEnoughTokens() {
    TokenBucket.Outcome outcome = TokenBucket.apply(new BucketSpec(5, 1.0), 5, T0, T0, 2);

    assertTrue(outcome.acquisition().allowed());
    assertEquals(3.0, outcome.tokens(), 1e-9);
    assertEquals(T0, outcome.lastRefillAt());
  }

  @Test
  void refillIsCappedAtCapacity() {
    TokenBucket.Outcome outcome = TokenBucket.apply(new BucketSpec(5, 1.0), 4, T0, T0.plusSeconds(60), 1);

    assertTrue(outcome.acquisition().allowed());
    assertEquals(4.0, outcome.tokens(), 1e-9);
  }

  @Test
  void deniedReportsTimeUntilDeficitRefills() {
    TokenBucket.Outcome outcome = TokenBucket.apply(new BucketSpec(10, 2.0), 0.5, T0, T0, 2);

    assertFalse(outcome.acquisition().allowed());
    assertEquals(Duration.ofMillis(750), outcome.acquisition().retryAfter());
    assertEquals(0.5, outcome.tokens(), 1e-9);
  }

  @Test
  void zeroRefillNeverRecovers() {
    TokenBucket.Outcome outcome = TokenBucket.apply(new BucketSpec(3, 0), 0, T0, T0.plusSeconds(3600), 1);

    assertFalse(outcome.acquisition().allowed());
    assertEquals(Acquisition.NEVER, outcome.acquisition().retryAfter());
  }

  @Test
  void clockMovingBackwardsAddsNothing() {
    TokenBucket.Outcome outcome = TokenBucket.apply(new BucketSpec(5, 1.0), 1, T0, T0.minusSeconds(30), 1);

    assertTrue(outcome.acquisition().allowed());
    assertEquals(0.0, outcome.tokens(), 1e-9);
    assertEquals(T0, outcome.lastRefillAt());
  }

  @Test
  void retryAfterIsAtLeastOneMillisecond() {
    TokenBucket.Outcome outcome = TokenBucket.apply(new BucketSpec(5, 1_000_000.0), 0.9999999, T0, T0, 1);

    assertFalse(outcome.acquisition().allowed());
    assertEquals(Duration.ofMillis(1), outcome.acquisition().retryAfter());
  }
}
