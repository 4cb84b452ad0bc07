package app.jira.dispatch.result;

/**
 * Finer-grained cause within a {@link FailureKind}.
 */
public enum FailureReason {
    MISSING_REQUIRED,
    WRONG_TYPE,
    UNKNOWN_PARAMETER,
    TIMEOUT,
    CONNECTION_REFUSED,
    CONNECTION_RESET,
    TLS_ERROR,
    DNS_FAILURE,
    IO_ERROR,
    RATE_LIMITED,
    STALLED,
    TASK_FAILED,
    TASK_CANCELLED,
    UNMAPPED_STATUS,
    MISSING_TASK_ID
}
