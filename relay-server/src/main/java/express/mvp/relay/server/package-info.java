/**
 * Server-side runtime for the chat relay.
 *
 * <p>Provides the {@link express.mvp.relay.server.RelayServer} accept loop, its configuration and
 * the {@link express.mvp.relay.server.RelayServerMain} command-line entry point.
 */
package express.mvp.relay.server;
