package express.mvp.relay.core;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * Tests for {@link WorkerPool}.
 */
@Timeout(10)
@SuppressFBWarnings(
        value = {"THROWS_METHOD_THROWS_CLAUSE_BASIC_EXCEPTION"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class WorkerPoolTest {

    private WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null && !pool.isShutdown()) {
            pool.shutdownNow();
        }
    }

    // ========== Creation Tests ==========

    @Test
    @DisplayName("Create pool using builder")
    void createWithBuilder() {
        pool = WorkerPool.builder().namePrefix("test-worker").daemon(true).build();
        assertFalse(pool.isShutdown());
        assertEquals(new WorkerPool.Stats(0, 0, 0, 0, 0), pool.getStats());
    }

    // ========== Task Submission Tests ==========

    @Test
    @DisplayName("Tasks run on named worker threads")
    void runsOnNamedThread() throws Exception {
        pool = WorkerPool.create("chat");
        AtomicReference<String> threadName = new AtomicReference<>();

        pool.submit(() -> threadName.set(Thread.currentThread().getName())).get(5, TimeUnit.SECONDS);

        assertTrue(threadName.get().startsWith("chat-"), threadName.get());
    }

    @Test
    @DisplayName("Long-running tasks do not block each other")
    void tasksRunConcurrently() throws Exception {
        pool = WorkerPool.create("chat");
        int tasks = 20;
        CountDownLatch allStarted = new CountDownLatch(tasks);
        CountDownLatch release = new CountDownLatch(1);

        for (int i = 0; i < tasks; i++) {
            pool.submit(() -> {
                allStarted.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        assertTrue(allStarted.await(5, TimeUnit.SECONDS));
        assertEquals(tasks, pool.getActiveTasks());
        release.countDown();
        assertTrue(pool.shutdown(Duration.ofSeconds(5)));
        assertEquals(tasks, pool.getStats().completed());
    }

    @Test
    @DisplayName("A failing task is counted and isolated")
    void failingTask() throws Exception {
        pool = WorkerPool.create("chat");

        Future<?> failed = pool.submit(() -> {
            throw new IllegalStateException("boom");
        });
        ExecutionException e =
                assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());

        pool.submit(() -> { }).get(5, TimeUnit.SECONDS);

        WorkerPool.Stats stats = pool.getStats();
        assertEquals(2, stats.submitted());
        assertEquals(1, stats.failed());
        assertEquals(1, stats.completed());
    }

    // ========== Shutdown Tests ==========

    @Test
    @DisplayName("Submissions after shutdown are rejected")
    void rejectsAfterShutdown() throws Exception {
        pool = WorkerPool.create("chat");
        assertTrue(pool.shutdown(Duration.ofSeconds(1)));

        assertNull(pool.submit(() -> { }));
        assertEquals(1, pool.getStats().rejected());
        assertTrue(pool.isShutdown());
        assertTrue(pool.isTerminated());
    }

    @Test
    @DisplayName("shutdownNow interrupts running tasks")
    void shutdownNowInterrupts() throws Exception {
        pool = WorkerPool.create("chat");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        pool.submit(() -> {
            started.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
        });

        assertTrue(started.await(5, TimeUnit.SECONDS));
        pool.shutdownNow();
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Submit rejects null")
    void submitNull() {
        pool = WorkerPool.create("chat");
        assertThrows(NullPointerException.class, () -> pool.submit(null));
    }
}
