package dailymsg.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void schedulerCounters() {
    exporter.incrementScheduled();
    exporter.incrementScheduled();
    exporter.incrementScheduleSkipped();

    assertEquals(2.0, counter("dailymsg.schedule.created").count());
    assertEquals(1.0, counter("dailymsg.schedule.skipped").count());
  }

  @Test
  void deliveryOutcomeCounters() {
    exporter.incrementClaimed();
    exporter.incrementClaimed();
    exporter.incrementSent();
    exporter.incrementRetried();
    exporter.incrementFailed();
    exporter.incrementCancelled();

    assertEquals(2.0, counter("dailymsg.delivery.claimed").count());
    assertEquals(1.0, counter("dailymsg.delivery.sent").count());
    assertEquals(1.0, counter("dailymsg.delivery.retried").count());
    assertEquals(1.0, counter("dailymsg.delivery.failed").count());
    assertEquals(1.0, counter("dailymsg.delivery.cancelled").count());
  }

  @Test
  void throttledIsTaggedByResource() {
    exporter.incrementThrottled("sms");
    exporter.incrementThrottled("sms");
    exporter.incrementThrottled("generation");

    assertEquals(2.0, registry.find("dailymsg.delivery.throttled").tag("resource", "sms").counter().count());
    assertEquals(1.0, registry.find("dailymsg.delivery.throttled").tag("resource", "generation").counter().count());
  }

  @Test
  void staleRecoveryAddsCount() {
    exporter.recordStaleClaimsRecovered(3);

    assertEquals(3.0, counter("dailymsg.delivery.stale.recovered").count());
  }

  @Test
  void dueGaugeTracksLastBacklog() {
    exporter.recordDueBacklog(42);
    exporter.recordDueBacklog(7);

    Gauge gauge = registry.find("dailymsg.delivery.due").gauge();
    assertNotNull(gauge);
    assertEquals(7.0, gauge.value());
  }

  @Test
  void latencyTimerRecords() {
    exporter.recordSendLatencyMs(1500);

    Timer timer = registry.find("dailymsg.delivery.latency").timer();
    assertNotNull(timer);
    assertEquals(1, timer.count());
    assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customPrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "promo.sms");
    custom.incrementSent();

    assertEquals(1.0, counter("promo.sms.delivery.sent").count());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "dailymsg."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void closeRemovesMetersAndStopsRecording() {
    exporter.incrementThrottled("sms");
    exporter.close();

    assertNull(registry.find("dailymsg.delivery.sent").counter());
    assertNull(registry.find("dailymsg.delivery.throttled").counter());
    assertNull(registry.find("dailymsg.delivery.due").gauge());
    exporter.incrementSent();
    assertNull(registry.find("dailymsg.delivery.sent").counter());
  }

  private Counter counter(String name) {
    Counter counter = registry.find(name).counter();
    assertNotNull(counter, "missing counter " + name);
    return counter;
  }
}
