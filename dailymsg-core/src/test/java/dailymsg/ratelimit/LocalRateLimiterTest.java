package dailymsg.ratelimit;

import dailymsg.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LocalRateLimiterTest {
  private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));

  @Test
  void newBucketStartsFull() {
    LocalRateLimiter limiter = new LocalRateLimiter(Map.of("sms", new BucketSpec(3, 1.0)), clock);

    assertTrue(limiter.tryAcquire("sms", 1).allowed());
    assertTrue(limiter.tryAcquire("sms", 1).allowed());
    assertTrue(limiter.tryAcquire("sms", 1).allowed());
    Acquisition denied = limiter.tryAcquire("sms", 1);
    assertFalse(denied.allowed());
    assertEquals(Duration.ofSeconds(1), denied.retryAfter());
  }

  @Test
  void refillsOverTime() {
    LocalRateLimiter limiter = new LocalRateLimiter(Map.of("sms", new BucketSpec(2, 2.0)), clock);
    assertTrue(limiter.tryAcquire("sms", 2).allowed());
    assertFalse(limiter.tryAcquire("sms", 1).allowed());

    clock.advance(Duration.ofMillis(500));

    assertTrue(limiter.tryAcquire("sms", 1).allowed());
    assertFalse(limiter.tryAcquire("sms", 1).allowed());
  }

  @Test
  void bucketsAreIndependent() {
    LocalRateLimiter limiter = new LocalRateLimiter(
        Map.of("sms", new BucketSpec(1, 0), "generation", new BucketSpec(1, 0)), clock);

    assertTrue(limiter.tryAcquire("sms", 1).allowed());
    assertTrue(limiter.tryAcquire("generation", 1).allowed());
    assertEquals(Acquisition.NEVER, limiter.tryAcquire("sms", 1).retryAfter());
  }

  @Test
  void rejectsUnknownResource() {
    LocalRateLimiter limiter = new LocalRateLimiter(Map.of("sms", BucketSpec.perSecond(5)), clock);

    assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire("email", 1));
    assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire(null, 1));
  }

  @Test
  void rejectsCostOutsideCapacity() {
    LocalRateLimiter limiter = new LocalRateLimiter(Map.of("sms", BucketSpec.perSecond(5)), clock);

    assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire("sms", 0));
    assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire("sms", 6));
  }

  @Test
  void rejectsEmptyConfiguration() {
    assertThrows(IllegalArgumentException.class, () -> new LocalRateLimiter(Map.of(), clock));
  }

  @Test
  void concurrentCallersNeverExceedCapacity() throws Exception {
    LocalRateLimiter limiter = new LocalRateLimiter(Map.of("sms", new BucketSpec(50, 0)), clock);
    AtomicInteger allowed = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        futures.add(pool.submit(() -> {
          for (int j = 0; j < 100; j++) {
            if (limiter.tryAcquire("sms", 1).allowed()) {
              allowed.incrementAndGet();
            }
          }
        }));
      }
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(50, allowed.get());
  }

  @Test
  void perMinuteSpecRefillsAtRatePerSecond() {
    BucketSpec spec = BucketSpec.perMinute(120);

    assertEquals(120, spec.capacity());
    assertEquals(2.0, spec.refillPerSecond(), 1e-9);
  }

  @Test
  void specRejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> new BucketSpec(0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> new BucketSpec(1, -1.0));
    assertThrows(IllegalArgumentException.class, () -> new BucketSpec(1, Double.NaN));
  }
}
