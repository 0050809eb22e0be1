package uploadqueue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the upload queue.
 *
 * @see UploadQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "upload-queue")
public class UploadQueueProperties {

    /**
     * Database table holding pending uploads.
     */
    private String tableName = "pending_upload";

    /**
     * Failed attempts after which a record is kept but no longer attempted.
     */
    private int maxRetries = 5;

    /**
     * Whether to create the pending upload table on startup if it is missing. This also
     * disables H2's write delay so each enqueue is on disk when it returns. Skipped with
     * a warning when the DataSource is not an H2 database.
     */
    private boolean initializeSchema = true;

    private final Scheduler scheduler = new Scheduler();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Scheduler {
        private long intervalMs = 30000;
        private boolean requireOnline = true;
        private long drainTimeoutMs = 5000;
        private boolean autoStart = true;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public boolean isRequireOnline() {
            return requireOnline;
        }

        public void setRequireOnline(boolean requireOnline) {
            this.requireOnline = requireOnline;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public static class Retry {
        private boolean backoffEnabled = false;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 300000;

        public boolean isBackoffEnabled() {
            return backoffEnabled;
        }

        public void setBackoffEnabled(boolean backoffEnabled) {
            this.backoffEnabled = backoffEnabled;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "upload.queue";

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
