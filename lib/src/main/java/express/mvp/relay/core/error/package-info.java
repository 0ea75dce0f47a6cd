/**
 * Error classification for the relay.
 *
 * <p>Failures are contained at the narrowest scope that can absorb them:
 *
 * <ul>
 *   <li>Startup failures (bind, listen) surface as {@link express.mvp.relay.core.RelayException}
 *       and stop the process
 *   <li>A failed accept is logged; the accept loop continues unless the error is {@code FATAL}
 *   <li>Read and send failures end the affected session only
 *   <li>Farewell sends and stream closes are best-effort and only logged
 * </ul>
 *
 * @see express.mvp.relay.core.error.ErrorClassifier
 */
package express.mvp.relay.core.error;
