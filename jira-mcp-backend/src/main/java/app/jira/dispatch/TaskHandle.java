package app.jira.dispatch;

import java.net.URI;
import java.util.Optional;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;

import app.jira.catalogue.AsyncTaskSpec;
import app.jira.catalogue.OperationDescriptor;
import app.jira.dispatch.result.ResultBody;
import app.jira.dispatch.result.Success;

/**
 * Remote task started by an asynchronous operation, polled through {@code statusOperation}.
 */
public record TaskHandle(String taskId,
                         OperationDescriptor initiatingOperation,
                         OperationDescriptor statusOperation) {

    public TaskHandle {
        if (!StringUtils.hasText(taskId)) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        if (initiatingOperation == null || !initiatingOperation.isAsync()) {
            throw new IllegalArgumentException("Initiating operation must declare an async task");
        }
    }

    public AsyncTaskSpec spec() {
        return initiatingOperation.asyncTask();
    }

    /**
     * Finds the task id in an initiating response: the configured field of a JSON object,
     * a JSON string holding the task URL, or the {@code Location} header.
     */
    public static Optional<String> extractTaskId(Success initiated, AsyncTaskSpec spec) {
        if (initiated.body() instanceof ResultBody.JsonBody json) {
            JsonNode body = json.json();
            if (body.isObject()) {
                String id = JsonFields.text(body, spec.taskIdField());
                if (id != null) {
                    return Optional.of(id.trim());
                }
            } else if (body.isTextual()) {
                Optional<String> fromUrl = lastSegment(body.asText());
                if (fromUrl.isPresent()) {
                    return fromUrl;
                }
            }
        }
        return lastSegment(initiated.headers().getFirst(HttpHeaders.LOCATION));
    }

    static Optional<String> lastSegment(String location) {
        if (!StringUtils.hasText(location)) {
            return Optional.empty();
        }
        String path;
        try {
            path = URI.create(location.trim()).getPath();
        } catch (IllegalArgumentException ex) {
            path = location.trim();
        }
        if (path == null) {
            return Optional.empty();
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        return StringUtils.hasText(segment) ? Optional.of(segment) : Optional.empty();
    }
}
