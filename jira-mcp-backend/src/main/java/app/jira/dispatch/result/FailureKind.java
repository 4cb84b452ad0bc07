package app.jira.dispatch.result;

public enum FailureKind {
    /** Unknown tool id. */
    NOT_FOUND,
    /** Arguments rejected locally; nothing was sent. */
    VALIDATION_ERROR,
    /** Network or TLS failure after the retry budget was spent. */
    TRANSPORT_ERROR,
    CLIENT_ERROR,
    SERVER_ERROR,
    /** 1xx/3xx answers the operation does not account for. */
    UNEXPECTED_STATUS,
    DECODE_ERROR,
    PAGINATION_ERROR,
    /** Polling deadline elapsed; the remote task may still finish. */
    TIMEOUT,
    /** Caller aborted the invocation. */
    CANCELLED,
    /** Remote task ended as failed or cancelled. */
    TASK_FAILED
}
