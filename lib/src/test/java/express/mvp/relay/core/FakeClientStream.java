package express.mvp.relay.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory {@link ClientStream} for handler and pool tests.
 *
 * <p>Reads are served from a queue of chunks; {@link #endOfStream()} or {@link #close()} makes the
 * next read return -1. Writes are recorded one entry per call.
 */
final class FakeClientStream implements ClientStream {

    private static final byte[] EOF = new byte[0];

    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final List<byte[]> written = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final PeerAddress address;

    private volatile boolean failWrites;
    private volatile IOException readFailure;
    private volatile CountDownLatch closeGate;
    private final CountDownLatch closeEntered = new CountDownLatch(1);

    FakeClientStream() {
        this(new PeerAddress("127.0.0.1", 50000));
    }

    FakeClientStream(PeerAddress address) {
        this.address = address;
    }

    /** Queues one chunk to be returned by a single read. */
    FakeClientStream receive(String chunk) {
        inbound.add(chunk.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    /** Makes the next read, after any queued chunks, return -1. */
    FakeClientStream endOfStream() {
        inbound.add(EOF);
        return this;
    }

    /** Makes the next read, after any queued chunks, throw {@code failure}. */
    FakeClientStream failReadWith(IOException failure) {
        readFailure = failure;
        inbound.add(EOF);
        return this;
    }

    FakeClientStream failWrites() {
        failWrites = true;
        return this;
    }

    /** Makes {@link #close()} block until {@code gate} opens, like a slow socket close. */
    FakeClientStream blockCloseUntil(CountDownLatch gate) {
        closeGate = gate;
        return this;
    }

    /** Counted down when {@link #close()} is first entered. */
    CountDownLatch closeEntered() {
        return closeEntered;
    }

    /** Returns every write so far, decoded as UTF-8. */
    synchronized List<String> writes() {
        List<String> result = new ArrayList<>();
        for (byte[] data : written) {
            result.add(new String(data, StandardCharsets.UTF_8));
        }
        return result;
    }

    @Override
    public int read(byte[] buffer) throws IOException {
        byte[] chunk;
        try {
            chunk = inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while reading", e);
        }
        if (chunk == EOF) {
            inbound.add(EOF);
            IOException failure = readFailure;
            if (failure != null && !closed.get()) {
                throw failure;
            }
            return -1;
        }
        int length = Math.min(chunk.length, buffer.length);
        System.arraycopy(chunk, 0, buffer, 0, length);
        return length;
    }

    @Override
    public synchronized void write(byte[] data) throws IOException {
        if (closed.get()) {
            throw new IOException("Stream closed");
        }
        if (failWrites) {
            throw new IOException("Broken pipe");
        }
        written.add(data.clone());
    }

    @Override
    public PeerAddress remoteAddress() {
        return address;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        closeEntered.countDown();
        CountDownLatch gate = closeGate;
        if (gate != null) {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (closed.compareAndSet(false, true)) {
            inbound.add(EOF);
        }
    }
}
