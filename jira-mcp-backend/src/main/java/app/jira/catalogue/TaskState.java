package app.jira.catalogue;

import java.util.Locale;

/**
 * Normalized lifecycle of a remote long-running task.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public static TaskState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new CatalogueException("Task state must not be blank");
        }
        try {
            return TaskState.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new CatalogueException("Unknown task state '%s'".formatted(raw), ex);
        }
    }
}
