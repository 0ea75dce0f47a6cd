/**
 * Message framing for relayed text.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.relay.core.framing.MessageFramer} - Decodes reads into messages and
 *       encodes messages for delivery
 *   <li>{@link express.mvp.relay.core.framing.ChunkFramer} - One read is one message
 *   <li>{@link express.mvp.relay.core.framing.LineFramer} - Newline-delimited messages
 *   <li>{@link express.mvp.relay.core.framing.Framing} - Configuration switch between the two
 * </ul>
 */
package express.mvp.relay.core.framing;
