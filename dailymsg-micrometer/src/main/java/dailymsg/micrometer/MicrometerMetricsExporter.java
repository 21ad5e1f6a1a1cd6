package dailymsg.micrometer;

import dailymsg.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dailymsg.schedule.created} - delivery rows created</li>
 *   <li>{@code dailymsg.schedule.skipped} - subscribers skipped by the scheduler</li>
 *   <li>{@code dailymsg.delivery.claimed} - rows claimed by a worker</li>
 *   <li>{@code dailymsg.delivery.sent} - messages sent</li>
 *   <li>{@code dailymsg.delivery.retried} - failed attempts that will be retried</li>
 *   <li>{@code dailymsg.delivery.failed} - rows finalized FAILED</li>
 *   <li>{@code dailymsg.delivery.cancelled} - claimed rows found cancelled</li>
 *   <li>{@code dailymsg.delivery.throttled} - rate-limit releases, tagged {@code resource}</li>
 *   <li>{@code dailymsg.delivery.stale.recovered} - stale claims recovered</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code dailymsg.delivery.due} - rows due at the start of the last tick</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code dailymsg.delivery.latency} - delay from scheduled time to successful send</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter scheduled;
  private final Counter scheduleSkipped;
  private final Counter claimed;
  private final Counter sent;
  private final Counter retried;
  private final Counter failed;
  private final Counter cancelled;
  private final Counter staleRecovered;
  private final Gauge dueGauge;
  private final Timer sendLatency;
  private final Map<String, Counter> throttled = new ConcurrentHashMap<>();

  private final AtomicInteger due = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "dailymsg"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "dailymsg");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "promo.dailymsg"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.scheduled = counter(".schedule.created", "Delivery rows created by the scheduler");
    this.scheduleSkipped = counter(".schedule.skipped", "Subscribers skipped by the scheduler");
    this.claimed = counter(".delivery.claimed", "Delivery rows claimed by a worker");
    this.sent = counter(".delivery.sent", "Messages sent");
    this.retried = counter(".delivery.retried", "Failed attempts that will be retried");
    this.failed = counter(".delivery.failed", "Deliveries finalized as FAILED");
    this.cancelled = counter(".delivery.cancelled", "Claimed deliveries found cancelled");
    this.staleRecovered = counter(".delivery.stale.recovered", "Stale IN_PROGRESS claims recovered");

    this.dueGauge = Gauge.builder(namePrefix + ".delivery.due", due, AtomicInteger::get)
        .description("Deliveries due at the start of the last tick")
        .register(registry);
    this.sendLatency = Timer.builder(namePrefix + ".delivery.latency")
        .description("Delay between scheduled time and successful send")
        .register(registry);
  }

  private Counter counter(String suffix, String description) {
    return Counter.builder(namePrefix + suffix)
        .description(description)
        .register(registry);
  }

  @Override
  public void incrementScheduled() {
    if (closed) return;
    scheduled.increment();
  }

  @Override
  public void incrementScheduleSkipped() {
    if (closed) return;
    scheduleSkipped.increment();
  }

  @Override
  public void incrementClaimed() {
    if (closed) return;
    claimed.increment();
  }

  @Override
  public void incrementSent() {
    if (closed) return;
    sent.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementCancelled() {
    if (closed) return;
    cancelled.increment();
  }

  @Override
  public void incrementThrottled(String resource) {
    if (closed) return;
    throttled.computeIfAbsent(resource, r -> Counter.builder(namePrefix + ".delivery.throttled")
        .description("Attempts released because a rate limit denied a token")
        .tag("resource", r)
        .register(registry)).increment();
  }

  @Override
  public void recordStaleClaimsRecovered(int count) {
    if (closed) return;
    staleRecovered.increment(count);
  }

  @Override
  public void recordDueBacklog(int due) {
    if (closed) return;
    this.due.set(due);
  }

  @Override
  public void recordSendLatencyMs(long latencyMs) {
    if (closed) return;
    sendLatency.record(Duration.ofMillis(latencyMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the pipeline is shut down to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(scheduled, scheduleSkipped, claimed, sent, retried,
        failed, cancelled, staleRecovered, dueGauge, sendLatency));
    meters.addAll(throttled.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
