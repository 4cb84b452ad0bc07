package app.jira.dispatch.result;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of one tool invocation: either a {@link Success} or a typed {@link Failure}.
 * Instances are immutable and never represent an ambiguous empty outcome.
 */
public sealed interface ToolResult permits Success, Failure {

    boolean isSuccess();

    @JsonIgnore
    default boolean isFailure() {
        return !isSuccess();
    }
}
