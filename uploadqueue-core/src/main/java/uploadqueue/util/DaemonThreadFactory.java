package uploadqueue.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for the queue's background work: named daemon threads with a
 * sequential suffix ({@code <prefix>1}, {@code <prefix>2}, ...), so a scheduler
 * never keeps the JVM alive on its own.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    }
}
