package app.jira.dispatch.result;

import java.time.Duration;

/**
 * Failed invocation. The original status code and message are kept verbatim.
 *
 * @param kind       failure category
 * @param reason     finer cause, may be {@code null}
 * @param statusCode HTTP status for remote failures, {@code null} otherwise
 * @param message    human readable description
 * @param retryable  whether repeating the call may succeed
 * @param retryAfter server supplied delay hint, {@code null} when absent
 */
public record Failure(FailureKind kind,
                      FailureReason reason,
                      Integer statusCode,
                      String message,
                      boolean retryable,
                      Duration retryAfter) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return false;
    }

    public static Failure notFound(String toolId) {
        return new Failure(FailureKind.NOT_FOUND, null, null, "Unknown tool '%s'".formatted(toolId), false, null);
    }

    public static Failure validation(FailureReason reason, String message) {
        return new Failure(FailureKind.VALIDATION_ERROR, reason, null, message, false, null);
    }

    public static Failure transport(FailureReason reason, String message, boolean retryable) {
        return new Failure(FailureKind.TRANSPORT_ERROR, reason, null, message, retryable, null);
    }

    public static Failure clientError(int statusCode, String message) {
        return new Failure(FailureKind.CLIENT_ERROR, null, statusCode, message, false, null);
    }

    public static Failure rateLimited(String message, Duration retryAfter) {
        return new Failure(FailureKind.CLIENT_ERROR, FailureReason.RATE_LIMITED, 429, message, true, retryAfter);
    }

    public static Failure serverError(int statusCode, String message, Duration retryAfter) {
        return new Failure(FailureKind.SERVER_ERROR, null, statusCode, message, true, retryAfter);
    }

    public static Failure unexpectedStatus(int statusCode, String message) {
        return new Failure(FailureKind.UNEXPECTED_STATUS, null, statusCode, message, false, null);
    }

    public static Failure decode(FailureReason reason, Integer statusCode, String message) {
        return new Failure(FailureKind.DECODE_ERROR, reason, statusCode, message, false, null);
    }

    public static Failure stalled(String message) {
        return new Failure(FailureKind.PAGINATION_ERROR, FailureReason.STALLED, null, message, false, null);
    }

    public static Failure timeout(String message) {
        return new Failure(FailureKind.TIMEOUT, FailureReason.TIMEOUT, null, message, true, null);
    }

    public static Failure cancelled(String message) {
        return new Failure(FailureKind.CANCELLED, null, null, message, false, null);
    }

    public static Failure taskEnded(FailureReason reason, String message) {
        return new Failure(FailureKind.TASK_FAILED, reason, null, message, false, null);
    }
}
