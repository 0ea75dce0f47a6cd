/**
 * Core of the chat relay: connection slots, the slot pool and the per-connection handler.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.relay.core.ConnectionSlot} - One reusable slot with a stable id
 *   <li>{@link express.mvp.relay.core.ConnectionPool} - Growable, never-shrinking set of slots
 *   <li>{@link express.mvp.relay.core.ConnectionHandler} - Greets, echoes and broadcasts for one
 *       client
 *   <li>{@link express.mvp.relay.core.PeerView} - Live or frozen set of broadcast targets
 *   <li>{@link express.mvp.relay.core.WorkerPool} - One worker thread per connection
 *   <li>{@link express.mvp.relay.core.ClientListener} and {@link
 *       express.mvp.relay.core.ClientStream} - Transport boundary
 * </ul>
 *
 * <h2>Threading Model</h2>
 *
 * <p>A single accept thread obtains slots and starts one handler per accepted client. Handlers
 * never wait on the accept thread and the accept thread never waits on handlers.
 */
package express.mvp.relay.core;
