package workpipe.spring.boot;

import workpipe.pipeline.EventChannel;
import workpipe.pipeline.ExecutionStrategy;
import workpipe.pipeline.PipelineRunner;
import workpipe.ratelimit.RateLimitConfig;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for workpipe.
 *
 * @see WorkPipeAutoConfiguration
 */
@ConfigurationProperties(prefix = "workpipe")
public class WorkPipeProperties {

    private final Queue queue = new Queue();
    private final RateLimit rateLimit = new RateLimit();
    private final Runner runner = new Runner();
    private final Events events = new Events();
    private final Metrics metrics = new Metrics();

    public Queue getQueue() {
        return queue;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Runner getRunner() {
        return runner;
    }

    public Events getEvents() {
        return events;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Backend {
        MEMORY,
        JDBC
    }

    public static class Queue {
        /**
         * Worker identity written to claim rows. A random id is used when unset.
         */
        private String ownerId;
        private Duration claimExpiry = Duration.ofMinutes(90);
        private String itemTable = "work_item";
        private String claimTable = "work_claim";

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }

        public Duration getClaimExpiry() {
            return claimExpiry;
        }

        public void setClaimExpiry(Duration claimExpiry) {
            this.claimExpiry = claimExpiry;
        }

        public String getItemTable() {
            return itemTable;
        }

        public void setItemTable(String itemTable) {
            this.itemTable = itemTable;
        }

        public String getClaimTable() {
            return claimTable;
        }

        public void setClaimTable(String claimTable) {
            this.claimTable = claimTable;
        }
    }

    public static class RateLimit {
        /**
         * Where per-domain state lives. JDBC shares it between processes.
         */
        private Backend backend = Backend.JDBC;
        private Duration baseDelay = RateLimitConfig.DEFAULT_BASE_DELAY;
        private Duration minDelay = RateLimitConfig.DEFAULT_MIN_DELAY;
        private Duration maxDelay = RateLimitConfig.DEFAULT_MAX_DELAY;
        private double backoffMultiplier = RateLimitConfig.DEFAULT_BACKOFF_MULTIPLIER;
        private double recoveryMultiplier = RateLimitConfig.DEFAULT_RECOVERY_MULTIPLIER;
        private int recoveryThreshold = RateLimitConfig.DEFAULT_RECOVERY_THRESHOLD;
        private Duration forbiddenWindow = RateLimitConfig.DEFAULT_FORBIDDEN_WINDOW;
        private int forbiddenThreshold = RateLimitConfig.DEFAULT_FORBIDDEN_THRESHOLD;
        private Duration retryAfterCap = RateLimitConfig.DEFAULT_RETRY_AFTER_CAP;
        private String stateTable = "rate_limit_state";
        private String forbiddenTable = "rate_limit_forbidden";
        private final Gate gate = new Gate();

        public Backend getBackend() {
            return backend;
        }

        public void setBackend(Backend backend) {
            this.backend = backend;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMinDelay() {
            return minDelay;
        }

        public void setMinDelay(Duration minDelay) {
            this.minDelay = minDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public double getRecoveryMultiplier() {
            return recoveryMultiplier;
        }

        public void setRecoveryMultiplier(double recoveryMultiplier) {
            this.recoveryMultiplier = recoveryMultiplier;
        }

        public int getRecoveryThreshold() {
            return recoveryThreshold;
        }

        public void setRecoveryThreshold(int recoveryThreshold) {
            this.recoveryThreshold = recoveryThreshold;
        }

        public Duration getForbiddenWindow() {
            return forbiddenWindow;
        }

        public void setForbiddenWindow(Duration forbiddenWindow) {
            this.forbiddenWindow = forbiddenWindow;
        }

        public int getForbiddenThreshold() {
            return forbiddenThreshold;
        }

        public void setForbiddenThreshold(int forbiddenThreshold) {
            this.forbiddenThreshold = forbiddenThreshold;
        }

        public Duration getRetryAfterCap() {
            return retryAfterCap;
        }

        public void setRetryAfterCap(Duration retryAfterCap) {
            this.retryAfterCap = retryAfterCap;
        }

        public String getStateTable() {
            return stateTable;
        }

        public void setStateTable(String stateTable) {
            this.stateTable = stateTable;
        }

        public String getForbiddenTable() {
            return forbiddenTable;
        }

        public void setForbiddenTable(String forbiddenTable) {
            this.forbiddenTable = forbiddenTable;
        }

        public Gate getGate() {
            return gate;
        }
    }

    public static class Gate {
        private int maxRetries = 3;
        private long backoffBaseMs = 1000;
        private long backoffMaxMs = 30_000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBackoffBaseMs() {
            return backoffBaseMs;
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
        }

        public long getBackoffMaxMs() {
            return backoffMaxMs;
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }
    }

    public static class Runner {
        private ExecutionStrategy strategy = ExecutionStrategy.WIDE;
        private int chunkSize = PipelineRunner.DEFAULT_CHUNK_SIZE;
        private long limit;
        private long recheckIntervalMs = PipelineRunner.DEFAULT_RECHECK_INTERVAL_MS;
        private long shutdownTimeoutMs = 30_000;
        /**
         * Delay between scheduled runs. The runner is not scheduled when unset.
         */
        private Duration scheduleInterval;

        public ExecutionStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(ExecutionStrategy strategy) {
            this.strategy = strategy;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public long getLimit() {
            return limit;
        }

        public void setLimit(long limit) {
            this.limit = limit;
        }

        public long getRecheckIntervalMs() {
            return recheckIntervalMs;
        }

        public void setRecheckIntervalMs(long recheckIntervalMs) {
            this.recheckIntervalMs = recheckIntervalMs;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }

        public Duration getScheduleInterval() {
            return scheduleInterval;
        }

        public void setScheduleInterval(Duration scheduleInterval) {
            this.scheduleInterval = scheduleInterval;
        }
    }

    public static class Events {
        private int capacity = EventChannel.DEFAULT_CAPACITY;
        private long offerTimeoutMs = EventChannel.DEFAULT_OFFER_TIMEOUT_MS;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public long getOfferTimeoutMs() {
            return offerTimeoutMs;
        }

        public void setOfferTimeoutMs(long offerTimeoutMs) {
            this.offerTimeoutMs = offerTimeoutMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "workpipe";

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
