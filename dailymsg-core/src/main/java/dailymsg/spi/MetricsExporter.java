package dailymsg.spi;

/**
 * Observability hook for exporting scheduler, worker and rate-limiter counters.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of delivery rows created by the scheduler.
     */
    void incrementScheduled();

    /**
     * Increments the count of subscribers the scheduler skipped (existing row,
     * invalid timezone, closed window, inactive).
     */
    void incrementScheduleSkipped();

    /**
     * Increments the count of rows claimed by a worker.
     */
    void incrementClaimed();

    /**
     * Increments the count of messages sent successfully.
     */
    void incrementSent();

    /**
     * Increments the count of failed attempts that will be retried.
     */
    void incrementRetried();

    /**
     * Increments the count of rows that ended in terminal FAILED.
     */
    void incrementFailed();

    /**
     * Increments the count of rows cancelled before sending.
     */
    void incrementCancelled();

    /**
     * Increments the count of attempts released because a rate limit denied a token.
     *
     * @param resource the rate-limited resource
     */
    void incrementThrottled(String resource);

    /**
     * Records the number of stale IN_PROGRESS claims recovered in one tick.
     */
    default void recordStaleClaimsRecovered(int count) {
    }

    /**
     * Records how many rows were due at the start of the last tick.
     */
    default void recordDueBacklog(int due) {
    }

    /**
     * Records the delay between a row's scheduled time and its successful send.
     *
     * @param latencyMs delay in milliseconds (always non-negative)
     */
    default void recordSendLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementScheduled() {
        }

        @Override
        public void incrementScheduleSkipped() {
        }

        @Override
        public void incrementClaimed() {
        }

        @Override
        public void incrementSent() {
        }

        @Override
        public void incrementRetried() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void incrementCancelled() {
        }

        @Override
        public void incrementThrottled(String resource) {
        }
    }
}
