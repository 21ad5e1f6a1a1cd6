package dailymsg.delivery;

import dailymsg.DeliveryException;
import dailymsg.GeneratedMessage;
import dailymsg.GenerationException;
import dailymsg.Generator;
import dailymsg.HistoryStore;
import dailymsg.SendException;
import dailymsg.Sender;
import dailymsg.SubscriberDirectory;
import dailymsg.model.DeliveryStatus;
import dailymsg.model.ScheduledDelivery;
import dailymsg.model.Subscriber;
import dailymsg.ratelimit.Acquisition;
import dailymsg.ratelimit.RateLimitUnavailableException;
import dailymsg.ratelimit.RateLimiter;
import dailymsg.spi.ConnectionProvider;
import dailymsg.spi.DeliveryStore;
import dailymsg.spi.MetricsExporter;
import dailymsg.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claims due deliveries and drives each one through generate, rate-limit and send.
 *
 * <p>One {@link #tick()} is one synchronous cycle:
 * <ol>
 *   <li>stale IN_PROGRESS claims older than {@code claimTimeout} are recovered;</li>
 *   <li>up to {@code batchSize} PENDING rows with {@code nextAttemptAt <= now} are read;</li>
 *   <li>each row is claimed with a compare-and-set on its status, and claimed rows are
 *       processed in parallel on a bounded pool;</li>
 *   <li>the tick returns once every claimed row reached a new state.</li>
 * </ol>
 *
 * <p>The claim is the only mutual-exclusion point. Every later write presents the claim
 * token, so a row that was cancelled or recovered while a slow call was in flight is
 * never overwritten. Rate-limit denials return the row to PENDING without counting an
 * attempt; generator and sender failures (including timeouts) count one attempt and are
 * retried with backoff until {@code maxAttempts} is reached.
 *
 * <p>The worker has no internal timer. Call {@link #tick()} from a host scheduler, or use
 * {@link dailymsg.trigger.PipelineTrigger}. Create instances via {@link #builder()}.
 *
 * @see DeliveryWorker.Builder
 */
public final class DeliveryWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryWorker.class.getName());

  static final String WINDOW_ELAPSED = "delivery window elapsed";
  static final String CLAIM_EXPIRED = "claim expired, delivery outcome unknown";

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final SubscriberDirectory subscriberDirectory;
  private final Generator generator;
  private final Sender sender;
  private final HistoryStore historyStore;
  private final RateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final int batchSize;
  private final Duration callTimeout;
  private final Duration claimTimeout;
  private final Duration maxThrottleDelay;
  private final int historyLimit;
  private final String generationResource;
  private final String sendResource;
  private final int generationCost;
  private final String ownerId;
  private final Clock clock;
  private final MetricsExporter metrics;

  private final ExecutorService workers;
  private final ExecutorService calls;
  private final AtomicLong claimSequence = new AtomicLong();
  private volatile boolean closed;

  private DeliveryWorker(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.subscriberDirectory = Objects.requireNonNull(builder.subscriberDirectory, "subscriberDirectory");
    this.generator = Objects.requireNonNull(builder.generator, "generator");
    this.sender = Objects.requireNonNull(builder.sender, "sender");
    this.historyStore = Objects.requireNonNull(builder.historyStore, "historyStore");
    this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(30_000, 30 * 60_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.ownerId = builder.ownerId != null
        ? builder.ownerId : "worker-" + UUID.randomUUID().toString().substring(0, 8);
    this.generationResource = Objects.requireNonNull(builder.generationResource, "generationResource");
    this.sendResource = Objects.requireNonNull(builder.sendResource, "sendResource");
    this.callTimeout = Objects.requireNonNull(builder.callTimeout, "callTimeout");
    this.maxThrottleDelay = Objects.requireNonNull(builder.maxThrottleDelay, "maxThrottleDelay");
    this.claimTimeout = builder.claimTimeout;

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.historyLimit < 0) {
      throw new IllegalArgumentException("historyLimit must be >= 0");
    }
    if (builder.generationCost < 1) {
      throw new IllegalArgumentException("generationCost must be >= 1");
    }
    if (callTimeout.isNegative() || callTimeout.isZero()) {
      throw new IllegalArgumentException("callTimeout must be positive");
    }
    if (maxThrottleDelay.isNegative() || maxThrottleDelay.isZero()) {
      throw new IllegalArgumentException("maxThrottleDelay must be positive");
    }
    // a claim may legitimately stay open for one generation and one send call
    if (claimTimeout != null && claimTimeout.compareTo(callTimeout.multipliedBy(2)) <= 0) {
      throw new IllegalArgumentException("claimTimeout must exceed twice the callTimeout");
    }
    this.maxAttempts = builder.maxAttempts;
    this.batchSize = builder.batchSize;
    this.historyLimit = builder.historyLimit;
    this.generationCost = builder.generationCost;

    this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("dailymsg-worker-"));
    this.calls = Executors.newCachedThreadPool(new DaemonThreadFactory("dailymsg-call-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String ownerId() {
    return ownerId;
  }

  /**
   * Runs one delivery cycle and waits for every claimed row to settle.
   *
   * @return counters for this cycle; {@link TickResult#empty()} once the worker is closed
   */
  public TickResult tick() {
    if (closed) {
      return TickResult.empty();
    }
    Tally tally = new Tally();
    try {
      Instant now = clock.instant();
      tally.recovered = recoverStaleClaims(now);

      List<ScheduledDelivery> due = fetchDue(now);
      if (due == null) {
        return tally.toResult();
      }
      metrics.recordDueBacklog(due.size());
      if (due.isEmpty()) {
        return tally.toResult();
      }

      List<Future<Outcome>> futures = new ArrayList<>(due.size());
      for (ScheduledDelivery row : due) {
        futures.add(workers.submit(() -> process(row)));
      }
      for (Future<Outcome> future : futures) {
        tally.add(await(future));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Delivery tick interrupted; unfinished rows stay claimed until recovery");
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Delivery tick failed", t);
    }
    TickResult result = tally.toResult();
    if (result.claimed() > 0 || result.recovered() > 0) {
      logger.log(Level.INFO, "Delivery tick: {0}", result);
    }
    return result;
  }

  private Outcome await(Future<Outcome> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      logger.log(Level.SEVERE, "Delivery task failed", e.getCause());
      return Outcome.ABANDONED;
    }
  }

  private int recoverStaleClaims(Instant now) {
    if (claimTimeout == null) {
      return 0;
    }
    Instant claimedBefore = now.minus(claimTimeout);
    int released = update("release stale claims", "*",
        conn -> deliveryStore.releaseStaleClaims(conn, claimedBefore));
    int failed = update("fail stale claims", "*",
        conn -> deliveryStore.failStaleClaims(conn, claimedBefore, CLAIM_EXPIRED));
    int recovered = Math.max(0, released) + Math.max(0, failed);
    if (failed > 0) {
      logger.log(Level.SEVERE, "{0} stale claim(s) claimed before {1} had generated content; "
          + "marked FAILED with unknown outcome", new Object[]{failed, claimedBefore});
      for (int i = 0; i < failed; i++) {
        metrics.incrementFailed();
      }
    }
    if (released > 0) {
      logger.log(Level.WARNING, "Released {0} stale claim(s) claimed before {1}",
          new Object[]{released, claimedBefore});
    }
    if (recovered > 0) {
      metrics.recordStaleClaimsRecovered(recovered);
    }
    return recovered;
  }

  /**
   * Returns {@code null} on failure, to distinguish from an empty result.
   */
  private List<ScheduledDelivery> fetchDue(Instant now) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deliveryStore.findDue(conn, now, batchSize);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch due deliveries", e);
      return null;
    }
  }

  private Outcome process(ScheduledDelivery row) {
    String token = ownerId + ":" + claimSequence.incrementAndGet();
    if (!claim(row.id(), token)) {
      return Outcome.LOST;
    }
    metrics.incrementClaimed();
    try {
      return deliver(row.id(), token);
    } catch (RuntimeException e) {
      // row stays IN_PROGRESS until stale-claim recovery picks it up
      logger.log(Level.SEVERE, "Unexpected failure processing deliveryId=" + row.id(), e);
      return Outcome.ABANDONED;
    }
  }

  private boolean claim(String id, String token) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deliveryStore.claim(conn, id, token, clock.instant());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Claim failed for deliveryId=" + id + "; treating as lost", e);
      return false;
    }
  }

  private Outcome deliver(String id, String token) {
    Optional<ScheduledDelivery> loaded = reload(id);
    if (loaded.isEmpty()) {
      return Outcome.ABANDONED;
    }
    ScheduledDelivery current = loaded.get();
    Outcome ownership = checkOwnership(current, token);
    if (ownership != null) {
      return ownership;
    }
    if (windowElapsed(current)) {
      return expire(current, token);
    }

    Subscriber subscriber;
    try {
      subscriber = subscriberDirectory.findSubscriber(current.subscriberId()).orElse(null);
    } catch (RuntimeException e) {
      return handleFailure(current, token,
          new DeliveryException("Subscriber lookup failed: " + e.getMessage(), e));
    }
    if (subscriber == null || !subscriber.active()) {
      return cancelInactive(current, subscriber == null ? "missing" : "inactive");
    }

    String phoneNumber = subscriber.phoneNumber();
    try {
      String content = current.content();
      String fingerprint = current.contentFingerprint();
      if (content == null) {
        acquire(generationResource, generationCost);
        GeneratedMessage message = generate(current.subscriberId());
        int stored = update("store content", id,
            conn -> deliveryStore.storeContent(conn, id, token, message.content(), message.fingerprint()));
        if (stored <= 0) {
          return Outcome.ABANDONED;
        }
        content = message.content();
        fingerprint = message.fingerprint();
      }

      Optional<ScheduledDelivery> beforeSend = reload(id);
      if (beforeSend.isEmpty()) {
        return Outcome.ABANDONED;
      }
      ownership = checkOwnership(beforeSend.get(), token);
      if (ownership != null) {
        return ownership;
      }
      if (windowElapsed(current)) {
        return expire(current, token);
      }
      acquire(sendResource, 1);
      String messageText = content;
      String receiptId = callWithTimeout(() -> sender.send(phoneNumber, messageText),
          "send", SendException::new);
      return markSent(current, token, receiptId, fingerprint);
    } catch (ThrottledException e) {
      return release(current, token, e);
    } catch (DeliveryException e) {
      return handleFailure(current, token, e);
    }
  }

  /**
   * Returns the outcome to stop with if this worker no longer owns the row,
   * or {@code null} to continue.
   */
  private Outcome checkOwnership(ScheduledDelivery current, String token) {
    if (current.status() == DeliveryStatus.CANCELLED) {
      logger.log(Level.FINE, "Delivery {0} cancelled after claim; aborting", current.id());
      metrics.incrementCancelled();
      return Outcome.CANCELLED;
    }
    if (current.status() != DeliveryStatus.IN_PROGRESS || !token.equals(current.claimedBy())) {
      logger.log(Level.WARNING, "Delivery {0} no longer held by {1} (status {2})",
          new Object[]{current.id(), token, current.status()});
      return Outcome.ABANDONED;
    }
    return null;
  }

  private boolean windowElapsed(ScheduledDelivery current) {
    return !clock.instant().isBefore(current.windowEndsAt());
  }

  private GeneratedMessage generate(String subscriberId) throws DeliveryException {
    GeneratedMessage message = callWithTimeout(
        () -> generator.generateMessage(subscriberId, historyStore.recentFingerprints(subscriberId, historyLimit)),
        "generation", GenerationException::new);
    if (message == null) {
      throw new GenerationException("Generator returned no message for subscriber " + subscriberId);
    }
    return message;
  }

  private void acquire(String resource, int cost) throws DeliveryException {
    Acquisition acquisition;
    try {
      acquisition = rateLimiter.tryAcquire(resource, cost);
    } catch (RateLimitUnavailableException e) {
      throw new DeliveryException("Rate limiter unavailable for " + resource, e);
    }
    if (!acquisition.allowed()) {
      throw new ThrottledException(resource, acquisition.retryAfter());
    }
  }

  private <T> T callWithTimeout(Callable<T> call, String action,
      BiFunction<String, Throwable, ? extends DeliveryException> failure) throws DeliveryException {
    Future<T> future = calls.submit(call);
    try {
      return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw failure.apply(action + " timed out after " + callTimeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof DeliveryException) {
        throw (DeliveryException) cause;
      }
      throw failure.apply(action + " failed: " + cause, cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw failure.apply(action + " interrupted", e);
    }
  }

  private Outcome markSent(ScheduledDelivery current, String token, String receiptId, String fingerprint) {
    String id = current.id();
    Instant now = clock.instant();
    int updated = update("mark SENT", id, conn -> deliveryStore.markSent(conn, id, token, receiptId, now));
    if (updated == 0) {
      logger.log(Level.WARNING, "Delivery {0} was sent but its claim was lost before it could be marked SENT", id);
    }
    metrics.incrementSent();
    metrics.recordSendLatencyMs(Math.max(0L, Duration.between(current.scheduledAt(), now).toMillis()));
    if (fingerprint != null) {
      try {
        historyStore.record(current.subscriberId(), fingerprint);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to record history for subscriber " + current.subscriberId(), e);
      }
    }
    return Outcome.SENT;
  }

  private Outcome release(ScheduledDelivery current, String token, ThrottledException throttled) {
    String id = current.id();
    Duration delay = throttled.retryAfter().compareTo(maxThrottleDelay) < 0
        ? throttled.retryAfter() : maxThrottleDelay;
    Instant nextAt = clock.instant().plus(delay);
    int updated = update("release throttled claim", id, conn -> deliveryStore.release(conn, id, token, nextAt));
    if (updated <= 0) {
      return Outcome.ABANDONED;
    }
    metrics.incrementThrottled(throttled.resource());
    logger.log(Level.FINE, "Delivery {0} throttled on {1}; due again at {2}",
        new Object[]{id, throttled.resource(), nextAt});
    return Outcome.THROTTLED;
  }

  private Outcome handleFailure(ScheduledDelivery current, String token, DeliveryException failure) {
    String id = current.id();
    int attempts = current.attempts() + 1;
    String error = describe(failure);
    if (attempts < maxAttempts) {
      Instant nextAt = clock.instant().plusMillis(retryPolicy.computeDelayMs(attempts));
      int updated = update("mark RETRY", id, conn -> deliveryStore.markRetry(conn, id, token, nextAt, error));
      if (updated <= 0) {
        return Outcome.ABANDONED;
      }
      metrics.incrementRetried();
      logger.log(Level.WARNING, "Delivery " + id + " attempt " + attempts + " failed; retrying at " + nextAt,
          failure);
      return Outcome.RETRIED;
    }
    int updated = update("mark FAILED", id, conn -> deliveryStore.markFailed(conn, id, token, error));
    if (updated <= 0) {
      return Outcome.ABANDONED;
    }
    metrics.incrementFailed();
    logger.log(Level.SEVERE, "Delivery moved to FAILED after max attempts: " + id,
        new TerminalFailureException(id, current.subscriberId(), attempts, error, failure));
    return Outcome.FAILED;
  }

  private Outcome expire(ScheduledDelivery current, String token) {
    String id = current.id();
    int updated = update("mark window elapsed", id,
        conn -> deliveryStore.markExpired(conn, id, token, WINDOW_ELAPSED));
    if (updated <= 0) {
      return Outcome.ABANDONED;
    }
    metrics.incrementFailed();
    logger.log(Level.SEVERE, "Delivery moved to FAILED: " + id,
        new TerminalFailureException(id, current.subscriberId(), current.attempts(), WINDOW_ELAPSED, null));
    return Outcome.FAILED;
  }

  private Outcome cancelInactive(ScheduledDelivery current, String reason) {
    String id = current.id();
    int updated = update("cancel", id, conn -> deliveryStore.cancel(conn, id));
    if (updated <= 0) {
      return Outcome.ABANDONED;
    }
    metrics.incrementCancelled();
    logger.log(Level.INFO, "Delivery {0} cancelled: subscriber {1} is {2}",
        new Object[]{id, current.subscriberId(), reason});
    return Outcome.CANCELLED;
  }

  private Optional<ScheduledDelivery> reload(String id) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<ScheduledDelivery> row = deliveryStore.findById(conn, id);
      if (row.isEmpty()) {
        logger.log(Level.WARNING, "Claimed delivery {0} disappeared", id);
      }
      return row;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to reload deliveryId=" + id, e);
      return Optional.empty();
    }
  }

  /**
   * Runs a single-row write. Returns the update count, or {@code -1} if the write failed;
   * failures are logged and the row is left for stale-claim recovery.
   */
  private int update(String action, String id, SqlUpdate op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.execute(conn);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for deliveryId=" + id, e);
      return -1;
    }
  }

  private static String describe(Throwable failure) {
    String message = failure.getMessage();
    return failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }

  @FunctionalInterface
  private interface SqlUpdate {
    int execute(Connection conn) throws SQLException;
  }

  private enum Outcome {
    LOST, ABANDONED, SENT, RETRIED, FAILED, CANCELLED, THROTTLED
  }

  private static final class Tally {
    int claimed;
    int sent;
    int retried;
    int failed;
    int cancelled;
    int throttled;
    int recovered;

    void add(Outcome outcome) {
      if (outcome == Outcome.LOST) {
        return;
      }
      claimed++;
      switch (outcome) {
        case SENT:
          sent++;
          break;
        case RETRIED:
          retried++;
          break;
        case FAILED:
          failed++;
          break;
        case CANCELLED:
          cancelled++;
          break;
        case THROTTLED:
          throttled++;
          break;
        default:
          break;
      }
    }

    TickResult toResult() {
      return new TickResult(claimed, sent, retried, failed, cancelled, throttled, recovered);
    }
  }

  /**
   * Stops the worker pools. In-flight external calls are interrupted; their rows stay
   * IN_PROGRESS until stale-claim recovery.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    workers.shutdownNow();
    calls.shutdownNow();
    try {
      workers.awaitTermination(5, TimeUnit.SECONDS);
      calls.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Builder for {@link DeliveryWorker}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryStore deliveryStore;
    private SubscriberDirectory subscriberDirectory;
    private Generator generator;
    private Sender sender;
    private HistoryStore historyStore;
    private RateLimiter rateLimiter;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private int batchSize = 100;
    private int workerCount = 4;
    private Duration callTimeout = Duration.ofSeconds(30);
    private Duration claimTimeout = Duration.ofMinutes(10);
    private Duration maxThrottleDelay = Duration.ofSeconds(60);
    private int historyLimit = 20;
    private String generationResource = "generation";
    private String sendResource = "sms";
    private int generationCost = 1;
    private String ownerId;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the connection provider for obtaining JDBC connections.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param deliveryStore persistence for delivery rows
     * @return this builder
     */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /**
     * <b>Required.</b> Used to look up the phone number and active flag at send time.
     *
     * @param subscriberDirectory the subscriber directory
     * @return this builder
     */
    public Builder subscriberDirectory(SubscriberDirectory subscriberDirectory) {
      this.subscriberDirectory = subscriberDirectory;
      return this;
    }

    /** <b>Required.</b> */
    public Builder generator(Generator generator) {
      this.generator = generator;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sender(Sender sender) {
      this.sender = sender;
      return this;
    }

    /** <b>Required.</b> */
    public Builder historyStore(HistoryStore historyStore) {
      this.historyStore = historyStore;
      return this;
    }

    /**
     * <b>Required.</b> Must know the generation and send resources.
     *
     * @param rateLimiter the rate limiter gating external calls
     * @return this builder
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 30 s base
     * and a 30 min cap.
     *
     * @param retryPolicy the retry delay strategy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the attempt budget per delivery. The attempt that reaches it finalizes
     * the row as FAILED.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param batchSize maximum rows claimed per tick
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the number of rows processed in parallel within one tick.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
     *
     * @param workerCount worker pool size
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the timeout applied to each generator and sender call. A call that exceeds it
     * counts as a failed attempt.
     *
     * <p>Optional. Defaults to 30 s.
     *
     * @param callTimeout per-call timeout
     * @return this builder
     */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /**
     * Sets how long an IN_PROGRESS claim may stay open before another tick recovers it,
     * or {@code null} to disable recovery.
     *
     * <p>Optional. Defaults to 10 min. Must exceed twice the call timeout.
     *
     * @param claimTimeout claim expiry
     * @return this builder
     */
    public Builder claimTimeout(Duration claimTimeout) {
      this.claimTimeout = claimTimeout;
      return this;
    }

    /**
     * Caps the delay applied when a rate limiter denies a token.
     *
     * <p>Optional. Defaults to 60 s.
     *
     * @param maxThrottleDelay maximum throttle delay
     * @return this builder
     */
    public Builder maxThrottleDelay(Duration maxThrottleDelay) {
      this.maxThrottleDelay = maxThrottleDelay;
      return this;
    }

    /**
     * Optional. Defaults to {@code 20}.
     *
     * @param historyLimit number of recent fingerprints passed to the generator
     * @return this builder
     */
    public Builder historyLimit(int historyLimit) {
      this.historyLimit = historyLimit;
      return this;
    }

    /**
     * Optional. Defaults to {@code "generation"}.
     */
    public Builder generationResource(String generationResource) {
      this.generationResource = generationResource;
      return this;
    }

    /**
     * Optional. Defaults to {@code "sms"}.
     */
    public Builder sendResource(String sendResource) {
      this.sendResource = sendResource;
      return this;
    }

    /**
     * Tokens taken from the generation resource per message. Optional. Defaults to {@code 1}.
     */
    public Builder generationCost(int generationCost) {
      this.generationCost = generationCost;
      return this;
    }

    /**
     * Sets the prefix of claim tokens written by this worker (for example a hostname or
     * pod name).
     *
     * <p>Optional. Defaults to {@code worker-} plus a random suffix.
     *
     * @param ownerId unique identifier for this worker instance
     * @return this builder
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the worker and starts its (idle) thread pools.
     *
     * @return a new {@link DeliveryWorker}
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric or duration setting is out of range
     */
    public DeliveryWorker build() {
      return new DeliveryWorker(this);
    }
  }
}
