/**
 * Blocking {@code java.net} socket implementation of the relay's transport boundary.
 *
 * <p>{@link express.mvp.relay.core.net.SocketClientListener} binds and accepts; each accepted
 * socket is wrapped in a {@link express.mvp.relay.core.net.SocketClientStream}.
 */
package express.mvp.relay.core.net;
