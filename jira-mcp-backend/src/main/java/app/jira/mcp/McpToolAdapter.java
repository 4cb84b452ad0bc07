package app.jira.mcp;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.jira.catalogue.InputSchemas;
import app.jira.catalogue.OperationDescriptor;
import app.jira.catalogue.OperationRegistry;
import app.jira.dispatch.ToolDispatcher;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.FailureReason;
import app.jira.dispatch.result.ToolResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Publishes every catalogue operation as an MCP tool backed by the dispatcher.
 * <p>
 * Operations that start remote tasks are awaited before the call returns. Results are sent
 * back as the JSON envelope, with {@code isError} set for failures.
 */
@Slf4j
public class McpToolAdapter {

    private final ToolDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Duration callTimeout;

    public McpToolAdapter(ToolDispatcher dispatcher, ObjectMapper objectMapper, Duration callTimeout) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.callTimeout = callTimeout;
    }

    public List<McpServerFeatures.SyncToolSpecification> toolSpecifications() {
        OperationRegistry registry = dispatcher.registry();
        return registry.all().stream()
                .map(this::toSpecification)
                .toList();
    }

    McpServerFeatures.SyncToolSpecification toSpecification(OperationDescriptor descriptor) {
        McpSchema.Tool tool = new McpSchema.Tool(descriptor.toolId(), description(descriptor), inputSchema(descriptor));
        return new McpServerFeatures.SyncToolSpecification(tool,
                (exchange, arguments) -> call(descriptor, arguments));
    }

    McpSchema.CallToolResult call(OperationDescriptor descriptor, Map<String, Object> arguments) {
        Map<String, Object> bag = arguments == null ? Map.of() : arguments;
        Mono<ToolResult> invocation = descriptor.isAsync()
                ? dispatcher.invokeAsync(descriptor.toolId(), bag, null, null)
                : dispatcher.invoke(descriptor.toolId(), bag);
        ToolResult result;
        try {
            result = invocation.block(callTimeout);
        } catch (IllegalStateException ex) {
            log.warn("MCP call to {} exceeded {}", descriptor.toolId(), callTimeout);
            result = Failure.timeout("Tool call '%s' exceeded %s".formatted(descriptor.toolId(), callTimeout));
        }
        if (result == null) {
            result = Failure.transport(FailureReason.IO_ERROR,
                    "Tool call '%s' produced no result".formatted(descriptor.toolId()), false);
        }
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(render(result))), result.isFailure());
    }

    private String render(ToolResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize tool result", ex);
        }
    }

    private String inputSchema(OperationDescriptor descriptor) {
        try {
            return objectMapper.writeValueAsString(InputSchemas.forOperation(objectMapper, descriptor));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize input schema of " + descriptor.toolId(), ex);
        }
    }

    private static String description(OperationDescriptor descriptor) {
        String summary = descriptor.description() != null
                ? descriptor.description()
                : "%s %s".formatted(descriptor.method().name(), descriptor.pathTemplate());
        if (descriptor.isAsync()) {
            return summary + " Waits for the started task to finish.";
        }
        return summary;
    }
}
