package dailymsg.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the daily message pipeline.
 *
 * @see DailyMsgAutoConfiguration
 */
@ConfigurationProperties(prefix = "dailymsg")
public class DailyMsgProperties {

    /**
     * Prefix prepended to the {@code scheduled_delivery}, {@code rate_limit_bucket} and
     * {@code message_history} table names.
     */
    private String tablePrefix = "";

    /**
     * Timeout applied to every JDBC statement.
     */
    private Duration queryTimeout = Duration.ofSeconds(10);

    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final RateLimit rateLimit = new RateLimit();
    private final History history = new History();
    private final Trigger trigger = new Trigger();
    private final Metrics metrics = new Metrics();

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public History getHistory() {
        return history;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        private int batchSize = 100;
        private int workerCount = 4;
        private int maxAttempts = 5;
        private Duration callTimeout = Duration.ofSeconds(30);
        private Duration claimTimeout = Duration.ofMinutes(10);
        private Duration maxThrottleDelay = Duration.ofSeconds(60);
        private int historyLimit = 20;
        private int generationCost = 1;
        private String generationResource = "generation";
        private String sendResource = "sms";
        private String ownerId = "";

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public Duration getClaimTimeout() {
            return claimTimeout;
        }

        public void setClaimTimeout(Duration claimTimeout) {
            this.claimTimeout = claimTimeout;
        }

        public Duration getMaxThrottleDelay() {
            return maxThrottleDelay;
        }

        public void setMaxThrottleDelay(Duration maxThrottleDelay) {
            this.maxThrottleDelay = maxThrottleDelay;
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }

        public int getGenerationCost() {
            return generationCost;
        }

        public void setGenerationCost(int generationCost) {
            this.generationCost = generationCost;
        }

        public String getGenerationResource() {
            return generationResource;
        }

        public void setGenerationResource(String generationResource) {
            this.generationResource = generationResource;
        }

        public String getSendResource() {
            return sendResource;
        }

        public void setSendResource(String sendResource) {
            this.sendResource = sendResource;
        }

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(30);
        private Duration maxDelay = Duration.ofMinutes(30);

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class RateLimit {
        /**
         * Where bucket state lives. {@code LOCAL} is only correct for a single process.
         */
        private Mode mode = Mode.DISTRIBUTED;
        private int maxCasAttempts = 10;
        private final Map<String, Bucket> buckets = new LinkedHashMap<>();

        public RateLimit() {
            buckets.put("generation", new Bucket(100, 100 / 60.0));
            buckets.put("sms", new Bucket(5, 5));
        }

        public Mode getMode() {
            return mode;
        }

        public void setMode(Mode mode) {
            this.mode = mode;
        }

        public int getMaxCasAttempts() {
            return maxCasAttempts;
        }

        public void setMaxCasAttempts(int maxCasAttempts) {
            this.maxCasAttempts = maxCasAttempts;
        }

        public Map<String, Bucket> getBuckets() {
            return buckets;
        }
    }

    public enum Mode {
        LOCAL,
        DISTRIBUTED
    }

    public static class Bucket {
        private int capacity = 1;
        private double refillPerSecond = 1.0;

        public Bucket() {
        }

        public Bucket(int capacity, double refillPerSecond) {
            this.capacity = capacity;
            this.refillPerSecond = refillPerSecond;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public double getRefillPerSecond() {
            return refillPerSecond;
        }

        public void setRefillPerSecond(double refillPerSecond) {
            this.refillPerSecond = refillPerSecond;
        }
    }

    public static class History {
        private Duration retention = Duration.ofDays(7);

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Trigger {
        private boolean enabled = false;
        private Duration tickInterval = Duration.ofMinutes(1);
        /**
         * UTC time of day of the daily scheduling run, {@code HH:mm}.
         */
        private String scheduleAt = "00:05";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public String getScheduleAt() {
            return scheduleAt;
        }

        public void setScheduleAt(String scheduleAt) {
            this.scheduleAt = scheduleAt;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "dailymsg";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
