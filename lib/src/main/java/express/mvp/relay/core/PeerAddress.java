package express.mvp.relay.core;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * Displayable remote endpoint of a client connection.
 *
 * <p>IPv4 endpoints render as four dotted unsigned octets followed by the port, for example
 * {@code 192.168.0.7:51234}. Other address families fall back to the host string.
 *
 * @param host the textual host (dotted quad for IPv4)
 * @param port the remote port, or -1 if unknown
 */
public record PeerAddress(String host, int port) {

    /** Placeholder for streams whose remote endpoint is not known. */
    public static final PeerAddress UNKNOWN = new PeerAddress("unknown", -1);

    public PeerAddress {
        Objects.requireNonNull(host, "host must not be null");
    }

    /**
     * Creates a peer address from a socket address.
     *
     * @param address the remote socket address (may be null)
     * @return the peer address, or {@link #UNKNOWN} if {@code address} is not an inet address
     */
    public static PeerAddress of(SocketAddress address) {
        if (!(address instanceof InetSocketAddress)) {
            return UNKNOWN;
        }
        InetSocketAddress inet = (InetSocketAddress) address;
        InetAddress ip = inet.getAddress();
        if (ip == null) {
            return new PeerAddress(inet.getHostString(), inet.getPort());
        }
        return new PeerAddress(format(ip.getAddress(), inet.getHostString()), inet.getPort());
    }

    /**
     * Formats raw address bytes for display.
     *
     * @param octets the raw address bytes
     * @param fallback text to use when the address is not IPv4
     * @return dotted unsigned octets for a 4-byte address, otherwise {@code fallback}
     */
    static String format(byte[] octets, String fallback) {
        if (octets.length != 4) {
            return fallback;
        }
        return (octets[0] & 0xFF)
                + "."
                + (octets[1] & 0xFF)
                + "."
                + (octets[2] & 0xFF)
                + "."
                + (octets[3] & 0xFF);
    }

    @Override
    public String toString() {
        return port < 0 ? host : host + ":" + port;
    }
}
