package express.mvp.relay.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-per-connection worker pool for {@link ConnectionHandler}s.
 *
 * <p>Each submitted task runs on its own platform thread taken from a cached pool, so a client
 * that blocks in a read stalls only its own handler. Idle threads are reused for later
 * connections.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌──────────────┐  submit()  ┌─────────────────────────────────────────────┐
 * │ accept loop  │──────────▶ │                 WorkerPool                  │
 * └──────────────┘            │  ┌───────────┐ ┌───────────┐ ┌───────────┐  │
 *                             │  │ handler-1 │ │ handler-2 │ │ handler-N │  │
 *                             │  └───────────┘ └───────────┘ └───────────┘  │
 *                             └─────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Failure Isolation</h2>
 *
 * <p>A task that throws is counted as failed and logged; the exception is captured by the
 * returned {@link Future} and never reaches the submitting thread or other tasks.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * WorkerPool workers = WorkerPool.builder()
 *     .namePrefix("relay-handler")
 *     .build();
 *
 * workers.submit(new ConnectionHandler(slot, peers, settings));
 *
 * workers.shutdown(Duration.ofSeconds(5));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Tasks can be submitted from any thread concurrently.
 *
 * @see WorkerThreadFactory
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WorkerPool.class.getName());

    /** The underlying executor service. */
    private final ExecutorService executor;

    /** Factory used for creating worker threads. */
    private final WorkerThreadFactory threadFactory;

    /** Whether the pool has been shut down. */
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /** Counter for submitted tasks. */
    private final AtomicLong submittedTasks = new AtomicLong(0);

    /** Counter for completed tasks. */
    private final AtomicLong completedTasks = new AtomicLong(0);

    /** Counter for failed tasks (threw exception). */
    private final AtomicLong failedTasks = new AtomicLong(0);

    /** Counter for rejected tasks (submitted after shutdown). */
    private final AtomicLong rejectedTasks = new AtomicLong(0);

    private WorkerPool(WorkerThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Creates a new builder for configuring the worker pool.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a worker pool with the given name prefix.
     *
     * @param namePrefix the prefix for worker thread names
     * @return a new worker pool
     */
    public static WorkerPool create(String namePrefix) {
        return builder().namePrefix(namePrefix).build();
    }

    /**
     * Submits a task for execution on its own worker thread.
     *
     * @param task the task to execute
     * @return a Future representing the pending completion, or null if the pool is shut down
     * @throws NullPointerException if task is null
     */
    public Future<?> submit(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");

        if (shutdown.get()) {
            rejectedTasks.incrementAndGet();
            return null;
        }

        submittedTasks.incrementAndGet();

        try {
            return executor.submit(() -> {
                try {
                    task.run();
                    completedTasks.incrementAndGet();
                } catch (RuntimeException | Error e) {
                    failedTasks.incrementAndGet();
                    LOGGER.log(Level.SEVERE, "Worker task failed", e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            submittedTasks.decrementAndGet();
            rejectedTasks.incrementAndGet();
            return null;
        }
    }

    /**
     * Initiates an orderly shutdown: running tasks continue, new tasks are rejected.
     *
     * <p>Invocation has no additional effect if already shut down.
     *
     * @param timeout maximum time to wait for running tasks to finish
     * @return true if all tasks finished before the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        if (!shutdown.compareAndSet(false, true)) {
            return executor.isTerminated();
        }

        executor.shutdown();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Rejects new tasks and interrupts running ones without waiting.
     */
    public void shutdownNow() {
        shutdown.set(true);
        executor.shutdownNow();
    }

    /**
     * Returns whether this pool has been shut down.
     *
     * @return true if shutdown has been initiated
     */
    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Returns whether all tasks have finished following shutdown.
     *
     * @return true if terminated
     */
    public boolean isTerminated() {
        return executor.isTerminated();
    }

    /**
     * Returns the approximate number of tasks currently running.
     *
     * @return the active task count
     */
    public long getActiveTasks() {
        return submittedTasks.get() - completedTasks.get() - failedTasks.get();
    }

    /**
     * Returns a snapshot of the pool's statistics.
     *
     * @return the current statistics
     */
    public Stats getStats() {
        return new Stats(
                submittedTasks.get(),
                completedTasks.get(),
                failedTasks.get(),
                rejectedTasks.get(),
                threadFactory.getThreadCount());
    }

    @Override
    public void close() {
        shutdownNow();
    }

    @Override
    public String toString() {
        return "WorkerPool["
                + "submitted=" + submittedTasks.get()
                + ", completed=" + completedTasks.get()
                + ", failed=" + failedTasks.get()
                + ", threads=" + threadFactory.getThreadCount()
                + ", shutdown=" + shutdown.get()
                + "]";
    }

    /**
     * Builder for creating {@link WorkerPool} instances.
     */
    public static final class Builder {

        private String namePrefix = "relay-handler";
        private boolean daemon = true;

        private Builder() {}

        /**
         * Sets the name prefix for worker threads.
         *
         * @param namePrefix the prefix for thread names
         * @return this builder
         */
        public Builder namePrefix(String namePrefix) {
            this.namePrefix = Objects.requireNonNull(namePrefix);
            return this;
        }

        /**
         * Sets whether worker threads should be daemon threads.
         *
         * @param daemon true for daemon threads
         * @return this builder
         */
        public Builder daemon(boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        /**
         * Builds the worker pool.
         *
         * @return a new WorkerPool
         */
        public WorkerPool build() {
            return new WorkerPool(new WorkerThreadFactory(namePrefix, daemon));
        }
    }

    /**
     * Immutable snapshot of worker pool statistics.
     *
     * @param submitted number of tasks submitted
     * @param completed number of tasks completed successfully
     * @param failed number of tasks that threw exceptions
     * @param rejected number of tasks rejected after shutdown
     * @param threads number of threads created
     */
    public record Stats(long submitted, long completed, long failed, long rejected, long threads) {

        @Override
        public String toString() {
            return String.format(
                    "Stats[submitted=%d, completed=%d, failed=%d, rejected=%d, threads=%d]",
                    submitted, completed, failed, rejected, threads);
        }
    }
}
