package express.mvp.relay.core;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for connection handler threads.
 *
 * <p>Threads are named {@code {prefix}-{counter}} and carry an uncaught-exception handler that
 * logs the failure, so a handler that dies unexpectedly is reported without affecting the accept
 * thread or other handlers.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Multiple threads can call {@link #newThread(Runnable)}
 * concurrently.
 *
 * @see WorkerPool
 */
public final class WorkerThreadFactory implements ThreadFactory {

    private static final Logger LOGGER = Logger.getLogger(WorkerThreadFactory.class.getName());

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    /** Base name prefix for created threads. */
    private final String namePrefix;

    /** Whether created threads should be daemon threads. */
    private final boolean daemon;

    /**
     * Creates a factory for daemon threads with the given name prefix.
     *
     * @param namePrefix the prefix for thread names
     */
    public WorkerThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory with configurable daemon status.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads should be daemon threads
     */
    public WorkerThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    /**
     * Creates a new, unstarted thread that will execute the given runnable.
     *
     * @param runnable the task to execute
     * @return a new platform thread (not started)
     */
    @Override
    public Thread newThread(Runnable runnable) {
        long count = threadCount.incrementAndGet();
        Thread thread = new Thread(runnable, namePrefix + "-" + count);
        thread.setDaemon(daemon);
        thread.setUncaughtExceptionHandler(
                (t, e) -> LOGGER.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
        return thread;
    }

    /**
     * Returns the number of threads created by this factory.
     *
     * @return the total count of threads created
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    /**
     * Returns the name prefix used for thread naming.
     *
     * @return the name prefix
     */
    public String getNamePrefix() {
        return namePrefix;
    }

    /**
     * Returns whether this factory creates daemon threads.
     *
     * @return true if daemon threads are created
     */
    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "WorkerThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
