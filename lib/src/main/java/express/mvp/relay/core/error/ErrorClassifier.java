package express.mvp.relay.core.error;

import express.mvp.relay.core.PoolExhaustedException;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import java.util.concurrent.RejectedExecutionException;

/**
 * Classifies exceptions into {@link ErrorCategory} values.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>JVM errors and security violations are {@code FATAL}
 *   <li>Timeouts are {@code TIMEOUT}
 *   <li>Resource exhaustion (by type, then by message) is {@code RESOURCE}
 *   <li>Socket and channel failures are {@code NETWORK}
 *   <li>Otherwise the cause chain is inspected, defaulting to {@code UNKNOWN}
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try {
 *     stream = listener.accept();
 * } catch (IOException e) {
 *     if (ErrorClassifier.classify(e).isFatal()) {
 *         stopAccepting();
 *     }
 * }
 * }</pre>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies an exception into an error category.
     *
     * @param throwable the exception to classify
     * @return the error category
     */
    public static ErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.UNKNOWN;
        }

        if (throwable instanceof OutOfMemoryError) {
            return ErrorCategory.RESOURCE;
        }
        if (throwable instanceof VirtualMachineError
                || throwable instanceof LinkageError
                || throwable instanceof SecurityException) {
            return ErrorCategory.FATAL;
        }

        if (throwable instanceof SocketTimeoutException) {
            return ErrorCategory.TIMEOUT;
        }

        if (isResourceError(throwable)) {
            return ErrorCategory.RESOURCE;
        }

        if (isNetworkError(throwable)) {
            return ErrorCategory.NETWORK;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return classify(cause);
        }

        return ErrorCategory.UNKNOWN;
    }

    private static boolean isResourceError(Throwable t) {
        if (t instanceof RejectedExecutionException) return true;
        if (t instanceof PoolExhaustedException) return true;

        String msg = lowerMessage(t);
        return msg != null
                && (msg.contains("too many open files")
                        || msg.contains("unable to create native thread")
                        || msg.contains("no buffer space"));
    }

    private static boolean isNetworkError(Throwable t) {
        if (t instanceof SocketException) return true;
        if (t instanceof ClosedChannelException) return true;
        if (t instanceof EOFException) return true;

        if (t instanceof IOException) {
            String msg = lowerMessage(t);
            return msg != null
                    && (msg.contains("connection")
                            || msg.contains("broken pipe")
                            || msg.contains("stream closed")
                            || msg.contains("socket"));
        }
        return false;
    }

    private static String lowerMessage(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? null : msg.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns a one-line description of an exception and its category, for log messages.
     *
     * @param throwable the exception to describe
     * @return text of the form {@code CATEGORY: Type: message}
     */
    public static String describeError(Throwable throwable) {
        if (throwable == null) {
            return "null exception";
        }
        return classify(throwable).name()
                + ": "
                + throwable.getClass().getSimpleName()
                + ": "
                + throwable.getMessage();
    }
}
