package express.mvp.relay.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link WorkerThreadFactory}.
 */
class WorkerThreadFactoryTest {

    @Test
    @DisplayName("Threads are numbered from 1 under the prefix")
    void namesThreads() {
        WorkerThreadFactory factory = new WorkerThreadFactory("relay-handler");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("relay-handler-1", first.getName());
        assertEquals("relay-handler-2", second.getName());
        assertEquals(2, factory.getThreadCount());
    }

    @Test
    @DisplayName("Daemon flag is applied")
    void daemonFlag() {
        assertTrue(new WorkerThreadFactory("d").newThread(() -> { }).isDaemon());
        assertFalse(new WorkerThreadFactory("n", false).newThread(() -> { }).isDaemon());
        assertFalse(new WorkerThreadFactory("n", false).isDaemon());
    }

    @Test
    @DisplayName("Threads are platform threads with an uncaught-exception handler")
    void uncaughtHandler() {
        Thread thread = new WorkerThreadFactory("x").newThread(() -> { });

        assertNotNull(thread.getUncaughtExceptionHandler());
        assertNotSame(thread.getThreadGroup(), thread.getUncaughtExceptionHandler());
        assertEquals(Thread.State.NEW, thread.getState());
    }

    @Test
    @DisplayName("Uncaught exceptions do not escape the worker thread")
    void uncaughtExceptionIsContained() throws InterruptedException {
        Thread thread = new WorkerThreadFactory("x").newThread(() -> {
            throw new IllegalStateException("boom");
        });
        thread.start();
        thread.join(5000);

        assertFalse(thread.isAlive());
    }

    @Test
    @DisplayName("toString includes the prefix")
    void toStringIncludesPrefix() {
        WorkerThreadFactory factory = new WorkerThreadFactory("chat");
        assertEquals("chat", factory.getNamePrefix());
        assertTrue(factory.toString().contains("chat"));
    }
}
