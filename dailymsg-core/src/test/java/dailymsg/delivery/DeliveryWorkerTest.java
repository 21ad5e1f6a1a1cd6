package dailymsg.delivery;

import dailymsg.GeneratedMessage;
import dailymsg.Generator;
import dailymsg.InMemoryDeliveryStore;
import dailymsg.InMemoryHistoryStore;
import dailymsg.InMemorySubscriberDirectory;
import dailymsg.MutableClock;
import dailymsg.NoopConnections;
import dailymsg.SendException;
import dailymsg.Sender;
import dailymsg.model.DeliveryStatus;
import dailymsg.model.ScheduledDelivery;
import dailymsg.model.Subscriber;
import dailymsg.ratelimit.BucketSpec;
import dailymsg.ratelimit.LocalRateLimiter;
import dailymsg.ratelimit.RateLimitUnavailableException;
import dailymsg.ratelimit.RateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryWorkerTest {
  private static final LocalDate DAY = LocalDate.of(2024, 6, 1);
  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);
  private final InMemoryDeliveryStore store = new InMemoryDeliveryStore();
  private final InMemoryHistoryStore history = new InMemoryHistoryStore();
  private final InMemorySubscriberDirectory directory = new InMemorySubscriberDirectory()
      .add(new Subscriber("s1", "+15550001", "UTC", 12, 17, true))
      .add(new Subscriber("s2", "+15550002", "UTC", 12, 17, true));
  private final AtomicInteger generated = new AtomicInteger();
  private final List<String> sentTo = Collections.synchronizedList(new ArrayList<>());
  private final List<String> seenHistory = Collections.synchronizedList(new ArrayList<>());

  private final Generator generator = (subscriberId, recent) -> {
    seenHistory.addAll(recent);
    int n = generated.incrementAndGet();
    return new GeneratedMessage("Good morning #" + n, "fp-" + n);
  };
  private final Sender sender = (phone, content) -> {
    sentTo.add(phone);
    return "receipt-" + sentTo.size();
  };

  private DeliveryWorker worker;

  @AfterEach
  void tearDown() {
    if (worker != null) {
      worker.close();
    }
  }

  private DeliveryWorker.Builder builder() {
    return DeliveryWorker.builder()
        .connectionProvider(NoopConnections.provider())
        .deliveryStore(store)
        .subscriberDirectory(directory)
        .generator(generator)
        .sender(sender)
        .historyStore(history)
        .rateLimiter(new LocalRateLimiter(
            Map.of("generation", new BucketSpec(100, 0), "sms", new BucketSpec(100, 0)), clock))
        .retryPolicy(attempts -> 1000L)
        .ownerId("test-worker")
        .clock(clock);
  }

  private ScheduledDelivery due(String id, String subscriberId) {
    ScheduledDelivery row = ScheduledDelivery.pending(id, subscriberId, DAY, NOW,
        Instant.parse("2024-06-01T17:00:00Z"), NOW.minusSeconds(3600));
    store.put(row);
    return row;
  }

  @Test
  void generatesSendsAndRecordsHistory() {
    history.record("s1", "fp-old");
    due("d1", "s1");
    worker = builder().build();

    TickResult result = worker.tick();

    assertEquals(1, result.claimed());
    assertEquals(1, result.sent());
    ScheduledDelivery row = store.get("d1");
    assertEquals(DeliveryStatus.SENT, row.status());
    assertEquals(1, row.attempts());
    assertEquals("receipt-1", row.receiptId());
    assertEquals("Good morning #1", row.content());
    assertEquals("fp-1", row.contentFingerprint());
    assertNull(row.claimedBy());
    assertEquals(List.of("+15550001"), sentTo);
    assertEquals(List.of("fp-old"), seenHistory);
    assertEquals(List.of("fp-1", "fp-old"), history.recentFingerprints("s1", 10));
  }

  @Test
  void retriesSendFailuresWithoutRegenerating() {
    AtomicInteger calls = new AtomicInteger();
    Sender flaky = (phone, content) -> {
      if (calls.incrementAndGet() <= 2) {
        throw new SendException("gateway 503");
      }
      return "receipt-ok";
    };
    due("d1", "s1");
    worker = builder().sender(flaky).build();

    TickResult first = worker.tick();
    assertEquals(1, first.retried());
    ScheduledDelivery afterFirst = store.get("d1");
    assertEquals(DeliveryStatus.PENDING, afterFirst.status());
    assertEquals(1, afterFirst.attempts());
    assertEquals(NOW.plusMillis(1000), afterFirst.nextAttemptAt());
    assertTrue(afterFirst.lastError().contains("gateway 503"));
    assertEquals("Good morning #1", afterFirst.content());

    assertEquals(0, worker.tick().claimed(), "not due before backoff elapses");

    clock.advance(Duration.ofSeconds(1));
    assertEquals(1, worker.tick().retried());
    clock.advance(Duration.ofSeconds(1));
    assertEquals(1, worker.tick().sent());

    ScheduledDelivery row = store.get("d1");
    assertEquals(DeliveryStatus.SENT, row.status());
    assertEquals(3, row.attempts());
    assertEquals("receipt-ok", row.receiptId());
    assertEquals(1, generated.get());
  }

  @Test
  void failsAfterMaxAttemptsAndIsNeverReclaimed() {
    due("d1", "s1");
    worker = builder()
        .maxAttempts(2)
        .sender((phone, content) -> {
          throw new SendException("invalid number");
        })
        .build();

    assertEquals(1, worker.tick().retried());
    clock.advance(Duration.ofSeconds(1));
    assertEquals(1, worker.tick().failed());
    clock.advance(Duration.ofHours(1));
    assertEquals(0, worker.tick().claimed());

    ScheduledDelivery row = store.get("d1");
    assertEquals(DeliveryStatus.FAILED, row.status());
    assertEquals(2, row.attempts());
    assertTrue(row.lastError().contains("invalid number"));
  }

  @Test
  void maxAttemptsOfOneFailsImmediately() {
    due("d1", "s1");
    worker = builder()
        .maxAttempts(1)
        .generator((id, recent) -> {
          throw new dailymsg.GenerationException("model overloaded");
        })
        .build();

    assertEquals(1, worker.tick().failed());
    assertEquals(DeliveryStatus.FAILED, store.get("d1").status());
    assertEquals(1, store.get("d1").attempts());
  }

  @Test
  void throttledRowIsReleasedWithoutCountingAnAttempt() {
    due("d1", "s1");
    due("d2", "s2");
    worker = builder()
        .rateLimiter(new LocalRateLimiter(
            Map.of("generation", new BucketSpec(10, 0), "sms", new BucketSpec(1, 0)), clock))
        .maxThrottleDelay(Duration.ofSeconds(60))
        .build();

    TickResult result = worker.tick();

    assertEquals(2, result.claimed());
    assertEquals(1, result.sent());
    assertEquals(1, result.throttled());
    ScheduledDelivery throttled = store.all().stream()
        .filter(r -> r.status() == DeliveryStatus.PENDING).findFirst().orElseThrow();
    assertEquals(0, throttled.attempts());
    assertEquals(NOW.plusSeconds(60), throttled.nextAttemptAt());
    assertNotNull(throttled.content(), "generated content is kept for the next attempt");
    assertNull(throttled.claimedBy());
    assertEquals(1, sentTo.size());
  }

  @Test
  void throttleDelayFollowsRetryAfterBelowCap() {
    due("d1", "s1");
    worker = builder()
        .rateLimiter(new LocalRateLimiter(
            Map.of("generation", new BucketSpec(1, 0.5), "sms", new BucketSpec(1, 1)), clock))
        .build();
    assertEquals(1, worker.tick().sent());

    due("d2", "s2");
    TickResult result = worker.tick();

    assertEquals(1, result.throttled());
    assertEquals(NOW.plusSeconds(2), store.get("d2").nextAttemptAt());
    assertNull(store.get("d2").content());
  }

  @Test
  void elapsedWindowFailsWithoutCallingCollaborators() {
    due("d1", "s1");
    clock.set(Instant.parse("2024-06-01T17:00:00Z"));
    worker = builder().build();

    TickResult result = worker.tick();

    assertEquals(1, result.failed());
    ScheduledDelivery row = store.get("d1");
    assertEquals(DeliveryStatus.FAILED, row.status());
    assertEquals(DeliveryWorker.WINDOW_ELAPSED, row.lastError());
    assertEquals(0, row.attempts());
    assertEquals(0, generated.get());
    assertTrue(sentTo.isEmpty());
  }

  @Test
  void windowClosingDuringGenerationKeepsSendToken() {
    due("d1", "s1");
    LocalRateLimiter limiter = new LocalRateLimiter(
        Map.of("generation", new BucketSpec(100, 0), "sms", new BucketSpec(1, 0)), clock);
    Generator slow = (subscriberId, recent) -> {
      clock.set(Instant.parse("2024-06-01T17:00:00Z"));
      return new GeneratedMessage("late", "fp-late");
    };
    worker = builder().generator(slow).rateLimiter(limiter).build();

    worker.tick();

    ScheduledDelivery row = store.get("d1");
    assertEquals(DeliveryStatus.FAILED, row.status());
    assertEquals(DeliveryWorker.WINDOW_ELAPSED, row.lastError());
    assertTrue(sentTo.isEmpty());
    assertTrue(limiter.tryAcquire("sms", 1).allowed());
  }

  @Test
  void inactiveOrMissingSubscriberIsCancelled() {
    directory.add(new Subscriber("gone", "+15550009", "UTC", 12, 17, false));
    due("d1", "gone");
    due("d2", "unknown");
    worker = builder().build();

    TickResult result = worker.tick();

    assertEquals(2, result.cancelled());
    assertEquals(DeliveryStatus.CANCELLED, store.get("d1").status());
    assertEquals(DeliveryStatus.CANCELLED, store.get("d2").status());
    assertEquals(0, generated.get());
  }

  @Test
  void cancelDuringGenerationPreventsSend() {
    due("d1", "s1");
    Generator cancelling = (subscriberId, recent) -> {
      store.cancel(null, "d1");
      return new GeneratedMessage("hello", "fp");
    };
    worker = builder().generator(cancelling).build();

    worker.tick();

    ScheduledDelivery row = store.get("d1");
    assertEquals(DeliveryStatus.CANCELLED, row.status());
    assertNull(row.content());
    assertTrue(sentTo.isEmpty());
  }

  @Test
  void generatorTimeoutCountsAsFailedAttempt() {
    due("d1", "s1");
    worker = builder()
        .callTimeout(Duration.ofMillis(100))
        .claimTimeout(Duration.ofSeconds(1))
        .generator((subscriberId, recent) -> {
          try {
            Thread.sleep(5_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return new GeneratedMessage("late", "fp");
        })
        .build();

    TickResult result = worker.tick();

    assertEquals(1, result.retried());
    ScheduledDelivery row = store.get("d1");
    assertEquals(1, row.attempts());
    assertTrue(row.lastError().contains("timed out"), row.lastError());
    assertNull(row.content());
  }

  @Test
  void rateLimiterOutageCountsAsFailedAttempt() {
    due("d1", "s1");
    RateLimiter down = (resource, cost) -> {
      throw new RateLimitUnavailableException("bucket table unreachable", null);
    };
    worker = builder().rateLimiter(down).build();

    assertEquals(1, worker.tick().retried());
    assertEquals(1, store.get("d1").attempts());
  }

  @Test
  void recoversStaleClaims() {
    Instant claimedAt = NOW.minus(Duration.ofMinutes(11));
    ScheduledDelivery noContent = due("d1", "s1");
    store.put(new ScheduledDelivery("d1", "s1", DAY, NOW, noContent.windowEndsAt(), NOW,
        DeliveryStatus.IN_PROGRESS, 0, null, null, null, null, "dead-worker:1", claimedAt, noContent.createdAt()));
    store.put(new ScheduledDelivery("d2", "s2", DAY, NOW, noContent.windowEndsAt(), NOW,
        DeliveryStatus.IN_PROGRESS, 0, null, "hi", "fp", null, "dead-worker:2", claimedAt, noContent.createdAt()));
    worker = builder().build();

    TickResult result = worker.tick();

    assertEquals(2, result.recovered());
    assertEquals(1, result.sent(), "released claim without content is delivered in the same tick");
    assertEquals(DeliveryStatus.SENT, store.get("d1").status());
    ScheduledDelivery unknown = store.get("d2");
    assertEquals(DeliveryStatus.FAILED, unknown.status());
    assertEquals(DeliveryWorker.CLAIM_EXPIRED, unknown.lastError());
    assertEquals(List.of("+15550001"), sentTo);
  }

  @Test
  void freshClaimsAreLeftAlone() {
    ScheduledDelivery row = due("d1", "s1");
    store.put(new ScheduledDelivery("d1", "s1", DAY, NOW, row.windowEndsAt(), NOW,
        DeliveryStatus.IN_PROGRESS, 0, null, null, null, null, "other:1", NOW.minusSeconds(60), row.createdAt()));
    worker = builder().build();

    TickResult result = worker.tick();

    assertEquals(0, result.recovered());
    assertEquals(0, result.claimed());
    assertEquals("other:1", store.get("d1").claimedBy());
  }

  @Test
  void closedWorkerDoesNothing() {
    due("d1", "s1");
    worker = builder().build();
    worker.close();

    assertEquals(TickResult.empty(), worker.tick());
    assertEquals(DeliveryStatus.PENDING, store.get("d1").status());
  }

  @Test
  void rejectsClaimTimeoutShorterThanTwoCalls() {
    assertThrows(IllegalArgumentException.class, () -> builder()
        .callTimeout(Duration.ofSeconds(30))
        .claimTimeout(Duration.ofSeconds(60))
        .build());
  }

  @Test
  void requiresCollaborators() {
    assertThrows(NullPointerException.class, () -> builder().sender(null).build());
    assertThrows(NullPointerException.class, () -> builder().rateLimiter(null).build());
  }
}
