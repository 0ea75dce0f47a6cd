package express.mvp.relay.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PeerView}.
 */
@DisplayName("PeerView")
class PeerViewTest {

    @Test
    @DisplayName("Live view follows joins and leaves")
    void liveFollowsPool() {
        ConnectionPoolImpl pool = new ConnectionPoolImpl(3);
        ConnectionSlot self = pool.findOrCreateEmptySlot();
        self.attach(new FakeClientStream());
        PeerView view = PeerView.live(pool, self.id());

        assertTrue(view.peers().isEmpty());

        FakeClientStream peerStream = new FakeClientStream();
        ConnectionSlot peer = pool.findOrCreateEmptySlot();
        peer.attach(peerStream);
        assertEquals(List.of(peer), view.peers());

        peer.release(peerStream);
        assertTrue(view.peers().isEmpty());
    }

    @Test
    @DisplayName("Snapshot view is frozen at creation")
    void snapshotIsFrozen() {
        ConnectionSlot a = new ConnectionSlot(0);
        List<ConnectionSlot> source = new ArrayList<>(List.of(a));
        PeerView view = PeerView.snapshot(source);

        source.add(new ConnectionSlot(1));

        assertEquals(List.of(a), view.peers());
        assertThrows(UnsupportedOperationException.class, () -> view.peers().clear());
    }

    @Test
    @DisplayName("Live view requires a pool")
    void liveRequiresPool() {
        assertThrows(NullPointerException.class, () -> PeerView.live(null, 0));
    }
}
