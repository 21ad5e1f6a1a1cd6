package dailymsg.trigger;

import dailymsg.delivery.DeliveryWorker;
import dailymsg.schedule.Scheduler;
import dailymsg.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host-side timer that drives a {@link Scheduler} and a {@link DeliveryWorker}.
 *
 * <p>Calls {@link DeliveryWorker#tick()} with a fixed delay between runs, and
 * {@link Scheduler#scheduleDay(LocalDate)} once at start and then every day at
 * {@code scheduleAt} (UTC). Each scheduling run covers the current UTC date and the next
 * one: subscriber-local dates east of UTC begin before the UTC date does, so a window early
 * in such a day may already have closed by the time its UTC date comes round. Scheduling is
 * idempotent and skips closed windows, so overlapping runs only fill gaps.
 *
 * <p>Neither component depends on this class; hosts with their own job runner call
 * them directly. Create instances via {@link #builder()}.
 */
public final class PipelineTrigger implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PipelineTrigger.class.getName());

  private final Scheduler scheduler;
  private final DeliveryWorker worker;
  private final Duration tickInterval;
  private final LocalTime scheduleAt;
  private final Clock clock;

  private ScheduledExecutorService executor;
  private volatile ScheduledFuture<?> tickTask;
  private volatile ScheduledFuture<?> dailyTask;
  private volatile boolean closed;

  private PipelineTrigger(Builder builder) {
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.worker = Objects.requireNonNull(builder.worker, "worker");
    this.tickInterval = Objects.requireNonNull(builder.tickInterval, "tickInterval");
    this.scheduleAt = Objects.requireNonNull(builder.scheduleAt, "scheduleAt");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (tickInterval.isNegative() || tickInterval.isZero()) {
      throw new IllegalArgumentException("tickInterval must be positive");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts both schedules. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PipelineTrigger has been closed");
    }
    if (tickTask != null) {
      return;
    }
    executor = Executors.newScheduledThreadPool(2, new DaemonThreadFactory("dailymsg-trigger-"));
    dailyTask = executor.schedule(this::runDailyAndReschedule, 0, TimeUnit.MILLISECONDS);
    tickTask = executor.scheduleWithFixedDelay(
        this::runTickOnce, tickInterval.toMillis(), tickInterval.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one worker tick. May be invoked directly for testing.
   */
  public void runTickOnce() {
    if (closed) {
      return;
    }
    try {
      worker.tick();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Delivery tick failed", t);
    }
  }

  /**
   * Schedules the current UTC date and the day after. May be invoked directly for testing.
   */
  public void runScheduleOnce() {
    if (closed) {
      return;
    }
    LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    scheduleDay(today);
    scheduleDay(today.plusDays(1));
  }

  private void scheduleDay(LocalDate day) {
    try {
      scheduler.scheduleDay(day);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Scheduling failed for " + day, t);
    }
  }

  private void runDailyAndReschedule() {
    runScheduleOnce();
    synchronized (this) {
      if (closed || executor == null) {
        return;
      }
      long delayMs = delayUntilNext(clock.instant(), scheduleAt).toMillis();
      dailyTask = executor.schedule(this::runDailyAndReschedule, delayMs, TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Time from {@code now} to the next occurrence of {@code at} in UTC, strictly in the future.
   */
  static Duration delayUntilNext(Instant now, LocalTime at) {
    ZonedDateTime utcNow = now.atZone(ZoneOffset.UTC);
    ZonedDateTime next = utcNow.toLocalDate().atTime(at).atZone(ZoneOffset.UTC);
    if (!next.isAfter(utcNow)) {
      next = next.plusDays(1);
    }
    return Duration.between(utcNow, next);
  }

  /** Cancels both schedules and shuts down the trigger thread. The worker is not closed. */
  @Override
  public synchronized void close() {
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    if (dailyTask != null) {
      dailyTask.cancel(false);
      dailyTask = null;
    }
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link PipelineTrigger}. */
  public static final class Builder {
    private Scheduler scheduler;
    private DeliveryWorker worker;
    private Duration tickInterval = Duration.ofMinutes(1);
    private LocalTime scheduleAt = LocalTime.of(0, 5);
    private Clock clock;

    private Builder() {}

    /** <b>Required.</b> Must have a subscriber directory. */
    public Builder scheduler(Scheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /** <b>Required.</b> */
    public Builder worker(DeliveryWorker worker) {
      this.worker = worker;
      return this;
    }

    /**
     * Sets the delay between the end of one tick and the start of the next.
     *
     * <p>Optional. Defaults to 1 min.
     */
    public Builder tickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
      return this;
    }

    /**
     * Sets the UTC time of day for the daily scheduling run.
     *
     * <p>Optional. Defaults to 00:05.
     */
    public Builder scheduleAt(LocalTime scheduleAt) {
      this.scheduleAt = scheduleAt;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public PipelineTrigger build() {
      return new PipelineTrigger(this);
    }
  }
}
