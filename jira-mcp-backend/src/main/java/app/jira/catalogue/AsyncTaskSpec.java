package app.jira.catalogue;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.util.StringUtils;

/**
 * Marks an operation as starting a remote task and describes how to follow it.
 * <p>
 * Status vocabularies differ between operation families, so each operation carries its own
 * mapping from the service-reported status string to a {@link TaskState}.
 *
 * @param statusTool      tool id of the status-check operation
 * @param taskIdField     field of the initiating response holding the task id
 * @param taskIdParameter parameter of the status-check operation that receives the task id
 * @param statusField     field of the status response holding the status string
 * @param statuses        service status string to task state, matched case-insensitively
 */
public record AsyncTaskSpec(String statusTool,
                            String taskIdField,
                            String taskIdParameter,
                            String statusField,
                            Map<String, TaskState> statuses) {

    public static final String DEFAULT_TASK_ID_FIELD = "taskId";
    public static final String DEFAULT_STATUS_FIELD = "status";

    public AsyncTaskSpec {
        if (!StringUtils.hasText(statusTool)) {
            throw new CatalogueException("Async task spec needs a status tool");
        }
        taskIdField = StringUtils.hasText(taskIdField) ? taskIdField.trim() : DEFAULT_TASK_ID_FIELD;
        taskIdParameter = StringUtils.hasText(taskIdParameter) ? taskIdParameter.trim() : taskIdField;
        statusField = StringUtils.hasText(statusField) ? statusField.trim() : DEFAULT_STATUS_FIELD;
        if (statuses == null || statuses.isEmpty()) {
            throw new CatalogueException("Async task spec for '%s' declares no status mapping".formatted(statusTool));
        }
        Map<String, TaskState> normalized = new LinkedHashMap<>();
        statuses.forEach((status, state) -> normalized.put(status.trim().toUpperCase(Locale.ROOT), state));
        statuses = Map.copyOf(normalized);
    }

    public Optional<TaskState> stateOf(String reportedStatus) {
        if (reportedStatus == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(statuses.get(reportedStatus.trim().toUpperCase(Locale.ROOT)));
    }
}
