package reconciler.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the schedule reconciler, bound from {@code reconciler.*}.
 *
 * @see ReconcilerAutoConfiguration
 */
@ConfigurationProperties(prefix = "reconciler")
public class ReconcilerProperties {

    /**
     * Whether to create and start the reconciler.
     */
    private boolean enabled = true;

    /**
     * Table holding reminder definitions.
     */
    private String reminderTable = "reminders";

    /**
     * Table holding tasks and their rollover rules.
     */
    private String taskTable = "tasks";

    /**
     * How long shutdown waits for an in-flight batch.
     */
    private Duration drainTimeout = Duration.ofSeconds(30);

    private final Queue outbox = new Queue("reconcile_outbox", 200, 50);
    private final Queue inbox = new Queue("reconcile_inbox", 100, 10);
    private final Retry retry = new Retry();
    private final Sweep sweep = new Sweep();
    private final Gateway gateway = new Gateway();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getReminderTable() {
        return reminderTable;
    }

    public void setReminderTable(String reminderTable) {
        this.reminderTable = reminderTable;
    }

    public String getTaskTable() {
        return taskTable;
    }

    public void setTaskTable(String taskTable) {
        this.taskTable = taskTable;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Queue getOutbox() {
        return outbox;
    }

    public Queue getInbox() {
        return inbox;
    }

    public Retry getRetry() {
        return retry;
    }

    public Sweep getSweep() {
        return sweep;
    }

    public Gateway getGateway() {
        return gateway;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /** Knobs of one drained queue table. */
    public static class Queue {
        private String tableName;
        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize;
        private int concurrency;
        private Duration lease = Duration.ofSeconds(30);

        Queue(String tableName, int batchSize, int concurrency) {
            this.tableName = tableName;
            this.batchSize = batchSize;
            this.concurrency = concurrency;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getLease() {
            return lease;
        }

        public void setLease(Duration lease) {
            this.lease = lease;
        }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(300);
        /**
         * Failed attempts after which a row is quarantined.
         */
        private int maxAttempts = 20;

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

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Sweep {
        private Duration interval = Duration.ofSeconds(60);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Gateway {
        private Duration callTimeout = Duration.ofSeconds(10);
        /**
         * Describe calls made while a freshly written schedule is not yet visible.
         */
        private int describeAttempts = 6;
        private Duration describeBackoff = Duration.ofMillis(150);
        private int maxConcurrentCalls = 64;

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public int getDescribeAttempts() {
            return describeAttempts;
        }

        public void setDescribeAttempts(int describeAttempts) {
            this.describeAttempts = describeAttempts;
        }

        public Duration getDescribeBackoff() {
            return describeBackoff;
        }

        public void setDescribeBackoff(Duration describeBackoff) {
            this.describeBackoff = describeBackoff;
        }

        public int getMaxConcurrentCalls() {
            return maxConcurrentCalls;
        }

        public void setMaxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = maxConcurrentCalls;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "reconciler";

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
