package express.mvp.relay.core;

import static org.junit.jupiter.api.Assertions.*;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PeerAddress}.
 */
@DisplayName("PeerAddress")
class PeerAddressTest {

    @Test
    @DisplayName("IPv4 octets are shown unsigned")
    void unsignedOctets() {
        byte[] octets = {(byte) 192, (byte) 168, 0, (byte) 255};
        assertEquals("192.168.0.255", PeerAddress.format(octets, "fallback"));
    }

    @Test
    @DisplayName("Non-IPv4 addresses use the fallback")
    void fallback() {
        assertEquals("::1", PeerAddress.format(new byte[16], "::1"));
    }

    @Test
    @DisplayName("Creates from an inet socket address")
    void fromSocketAddress() {
        PeerAddress address = PeerAddress.of(new InetSocketAddress("127.0.0.1", 7000));
        assertEquals("127.0.0.1", address.host());
        assertEquals(7000, address.port());
        assertEquals("127.0.0.1:7000", address.toString());
    }

    @Test
    @DisplayName("Unresolved addresses keep the host string")
    void unresolved() {
        PeerAddress address = PeerAddress.of(InetSocketAddress.createUnresolved("chat.local", 99));
        assertEquals("chat.local:99", address.toString());
    }

    @Test
    @DisplayName("Unknown address types map to UNKNOWN")
    void unknown() {
        assertSame(PeerAddress.UNKNOWN, PeerAddress.of(null));
        assertSame(PeerAddress.UNKNOWN, PeerAddress.of(new SocketAddress() {}));
        assertEquals("unknown", PeerAddress.UNKNOWN.toString());
    }
}
