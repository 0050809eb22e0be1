package uploadqueue.scheduler;

import uploadqueue.process.PassResult;
import uploadqueue.process.UploadProcessor;
import uploadqueue.spi.MetricsExporter;
import uploadqueue.spi.NetworkMonitor;
import uploadqueue.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides when passes run: once at startup, on a fixed interval while online, and
 * whenever the network monitor reports a reconnect.
 *
 * <p>All scheduled passes run on a single daemon thread. A trigger that arrives while a
 * pass is running or already queued is dropped rather than queued behind it; the next
 * pass sees every record anyway.
 *
 * <p>{@link #stop()} never interrupts a running pass. It waits up to
 * {@code drainTimeoutMs} for the pass to finish, after which the scheduler may be
 * started again. {@link #close()} stops permanently.
 *
 * <p>This class is thread-safe. The lifecycle methods are synchronized.
 *
 * @see UploadScheduler.Builder
 */
public final class UploadScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(UploadScheduler.class.getName());

    public static final long DEFAULT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_DRAIN_TIMEOUT_MS = 5_000L;

    private final UploadProcessor processor;
    private final NetworkMonitor networkMonitor;
    private final MetricsExporter metrics;
    private final long intervalMs;
    private final boolean requireOnline;
    private final long drainTimeoutMs;
    private final AtomicBoolean queued = new AtomicBoolean(false);

    private volatile ScheduledExecutorService executor;
    private ScheduledFuture<?> tickTask;
    private NetworkMonitor.Registration reconnectRegistration;
    private volatile boolean closed;

    private UploadScheduler(Builder builder) {
        this.processor = Objects.requireNonNull(builder.processor, "processor");
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.drainTimeoutMs < 0L) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.networkMonitor = builder.networkMonitor != null ? builder.networkMonitor : NetworkMonitor.ALWAYS_ONLINE;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.intervalMs = builder.intervalMs;
        this.requireOnline = builder.requireOnline;
        this.drainTimeoutMs = builder.drainTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduler: submits a startup pass, schedules the interval tick and
     * subscribes to reconnect events. Calling it again while started is a no-op.
     *
     * <p>The startup pass runs regardless of connectivity, since handlers report their
     * own failures.
     *
     * @return the startup pass, completing exceptionally if the store failed; an
     * already-completed {@link PassResult#notRun()} if the scheduler was already started
     * @throws IllegalStateException if the scheduler has been closed
     */
    public synchronized CompletableFuture<PassResult> start() {
        if (closed) {
            throw new IllegalStateException("UploadScheduler has been closed");
        }
        if (executor != null) {
            return CompletableFuture.completedFuture(PassResult.notRun());
        }
        ScheduledExecutorService ex =
                Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("upload-queue-scheduler-"));
        executor = ex;

        CompletableFuture<PassResult> startup = CompletableFuture.supplyAsync(() -> processor.runPass(null), ex);
        startup.whenComplete((result, failure) -> {
            if (failure != null) {
                logger.log(Level.SEVERE, "Startup upload pass failed", failure);
            }
        });
        tickTask = ex.scheduleWithFixedDelay(() -> tick(ex), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        reconnectRegistration = networkMonitor.onBecameOnline(this::onReconnect);
        logger.log(Level.INFO, "Upload scheduler started (interval {0} ms, requireOnline {1})",
                new Object[]{intervalMs, requireOnline});
        return startup;
    }

    /**
     * Asks for a pass as soon as possible on the scheduler thread.
     *
     * @return {@code true} if a pass was queued; {@code false} if the scheduler is not
     * running or a pass is already running or queued
     */
    public boolean requestPass() {
        ScheduledExecutorService ex = executor;
        if (ex == null) {
            return false;
        }
        if (processor.isRunning() || !queued.compareAndSet(false, true)) {
            metrics.incrementPassDropped();
            logger.fine("Upload pass already running or queued; trigger dropped");
            return false;
        }
        try {
            ex.execute(() -> {
                queued.set(false);
                runScheduledPass(ex);
            });
            return true;
        } catch (RejectedExecutionException e) {
            queued.set(false);
            return false;
        }
    }

    public boolean isStarted() {
        return executor != null;
    }

    private void tick(ScheduledExecutorService owner) {
        if (requireOnline && !networkMonitor.isOnline()) {
            logger.fine("Offline; skipping interval upload pass");
            return;
        }
        runScheduledPass(owner);
    }

    private void onReconnect() {
        logger.info("Back online; requesting upload pass");
        requestPass();
    }

    /**
     * Runs a pass unless the scheduler was stopped (or restarted) after the task was queued.
     */
    private void runScheduledPass(ScheduledExecutorService owner) {
        if (executor != owner) {
            logger.fine("Scheduler stopped; discarding queued upload pass");
            return;
        }
        try {
            processor.runPass(null);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Scheduled upload pass failed", t);
        }
    }

    /**
     * Stops scheduling new passes. Triggers still queued are discarded; a pass already
     * running is allowed to finish, and this method waits up to {@code drainTimeoutMs}
     * for it. The scheduler can be started again.
     */
    public synchronized void stop() {
        if (reconnectRegistration != null) {
            reconnectRegistration.close();
            reconnectRegistration = null;
        }
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        ScheduledExecutorService ex = executor;
        if (ex == null) {
            return;
        }
        executor = null;
        ex.shutdown();
        try {
            if (!ex.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warning("Upload pass still running after " + drainTimeoutMs
                        + " ms; it will finish in the background");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Upload scheduler stopped");
    }

    /**
     * Stops the scheduler permanently.
     */
    @Override
    public synchronized void close() {
        stop();
        closed = true;
    }

    /**
     * Builder for {@link UploadScheduler}.
     */
    public static final class Builder {
        private UploadProcessor processor;
        private NetworkMonitor networkMonitor;
        private MetricsExporter metrics;
        private long intervalMs = DEFAULT_INTERVAL_MS;
        private boolean requireOnline = true;
        private long drainTimeoutMs = DEFAULT_DRAIN_TIMEOUT_MS;

        private Builder() {
        }

        /**
         * Sets the processor whose passes are scheduled.
         *
         * <p><b>Required.</b>
         *
         * @param processor the upload processor
         * @return this builder
         */
        public Builder processor(UploadProcessor processor) {
            this.processor = processor;
            return this;
        }

        /**
         * Sets the connectivity signal gating the interval tick and firing reconnect passes.
         *
         * <p>Optional. Defaults to {@link NetworkMonitor#ALWAYS_ONLINE}.
         *
         * @param networkMonitor the network monitor
         * @return this builder
         */
        public Builder networkMonitor(NetworkMonitor networkMonitor) {
            this.networkMonitor = networkMonitor;
            return this;
        }

        /**
         * Sets the metrics exporter used to count dropped triggers.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the delay between the end of one interval pass and the next tick.
         *
         * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
         *
         * @param intervalMs tick interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Whether interval ticks are skipped while the network monitor reports offline.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param requireOnline {@code false} to run interval passes regardless of connectivity
         * @return this builder
         */
        public Builder requireOnline(boolean requireOnline) {
            this.requireOnline = requireOnline;
            return this;
        }

        /**
         * Sets how long {@link UploadScheduler#stop()} waits for a running pass.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
         *
         * @param drainTimeoutMs wait in milliseconds
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Builds the scheduler. Call {@link UploadScheduler#start()} to begin.
         *
         * @return a new {@link UploadScheduler}
         * @throws NullPointerException     if {@code processor} is null
         * @throws IllegalArgumentException if {@code intervalMs <= 0} or {@code drainTimeoutMs < 0}
         */
        public UploadScheduler build() {
            return new UploadScheduler(this);
        }
    }
}
