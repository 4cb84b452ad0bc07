package app.jira.dispatch;

import app.jira.dispatch.result.FailureReason;

/**
 * Raised by the binder when an argument bag does not fit the operation. Nothing has been sent.
 */
public class ValidationException extends RuntimeException {

    private final FailureReason reason;
    private final String parameter;

    public ValidationException(FailureReason reason, String parameter, String message) {
        super(message);
        this.reason = reason;
        this.parameter = parameter;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getParameter() {
        return parameter;
    }
}
