package app.jira.dispatch;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

import javax.net.ssl.SSLException;

import app.jira.dispatch.result.FailureReason;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import reactor.netty.http.client.PrematureCloseException;

/**
 * Network-level failure of an HTTP exchange, classified as transient or permanent.
 */
public class TransportException extends RuntimeException {

    private final FailureReason reason;
    private final boolean transientFailure;

    public TransportException(FailureReason reason, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.transientFailure = transientFailure;
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * Timeouts, resets and refused connections may succeed on a second attempt; TLS and DNS
     * failures will not.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    public static TransportException classify(Throwable error) {
        if (error instanceof TransportException transport) {
            return transport;
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof ReadTimeoutException
                    || current instanceof ConnectTimeoutException) {
                return new TransportException(FailureReason.TIMEOUT, true, "Request timed out", error);
            }
            if (current instanceof SSLException) {
                return new TransportException(FailureReason.TLS_ERROR, false,
                        "TLS failure: " + current.getMessage(), error);
            }
            if (current instanceof UnknownHostException) {
                return new TransportException(FailureReason.DNS_FAILURE, false,
                        "Cannot resolve host: " + current.getMessage(), error);
            }
            if (current instanceof ConnectException) {
                return new TransportException(FailureReason.CONNECTION_REFUSED, true,
                        "Connection refused: " + current.getMessage(), error);
            }
            if (current instanceof PrematureCloseException || isReset(current)) {
                return new TransportException(FailureReason.CONNECTION_RESET, true,
                        "Connection reset: " + current.getMessage(), error);
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return new TransportException(FailureReason.IO_ERROR, false,
                "Request failed: " + error.getMessage(), error);
    }

    private static boolean isReset(Throwable error) {
        if (!(error instanceof IOException) || error.getMessage() == null) {
            return false;
        }
        String message = error.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("connection reset") || message.contains("broken pipe");
    }
}
