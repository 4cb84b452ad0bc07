package app.jira.api;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.convert.DurationStyle;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.jira.catalogue.InputSchemas;
import app.jira.catalogue.OperationDescriptor;
import app.jira.dispatch.ToolDispatcher;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.ToolResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public ToolController(ToolDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    public Flux<ToolSummary> listTools() {
        return Flux.fromIterable(dispatcher.registry().all()).map(this::toSummary);
    }

    @GetMapping("/{toolId}")
    public Mono<ToolSummary> getTool(@PathVariable String toolId) {
        return Mono.justOrEmpty(dispatcher.registry().find(toolId))
                .map(this::toSummary)
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Unknown tool '%s'".formatted(toolId))));
    }

    @PostMapping("/{toolId}")
    public Mono<ResponseEntity<ToolResult>> invoke(@PathVariable String toolId,
                                                   @RequestBody(required = false) Map<String, Object> arguments) {
        return dispatcher.invoke(toolId, arguments(arguments)).map(ToolController::toResponse);
    }

    @PostMapping(value = "/{toolId}/pages", produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<ToolResult> invokePaginated(@PathVariable String toolId,
                                            @RequestParam(required = false) Integer pageLimit,
                                            @RequestBody(required = false) Map<String, Object> arguments) {
        return dispatcher.invokePaginated(toolId, arguments(arguments), pageLimit);
    }

    @PostMapping("/{toolId}/await")
    public Mono<ResponseEntity<ToolResult>> invokeAsync(@PathVariable String toolId,
                                                        @RequestParam(required = false) String pollInterval,
                                                        @RequestParam(required = false) String maxWait,
                                                        @RequestBody(required = false) Map<String, Object> arguments) {
        return dispatcher.invokeAsync(toolId, arguments(arguments), duration(pollInterval), duration(maxWait))
                .map(ToolController::toResponse);
    }

    @GetMapping("/{toolId}/tasks/{taskId}")
    public Mono<ResponseEntity<ToolResult>> resumeTask(@PathVariable String toolId,
                                                       @PathVariable String taskId,
                                                       @RequestParam(required = false) String pollInterval,
                                                       @RequestParam(required = false) String maxWait) {
        return dispatcher.resumeTask(toolId, taskId, duration(pollInterval), duration(maxWait))
                .map(ToolController::toResponse);
    }

    static ResponseEntity<ToolResult> toResponse(ToolResult result) {
        if (!(result instanceof Failure failure)) {
            return ResponseEntity.ok(result);
        }
        HttpStatus status = switch (failure.kind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(result);
    }

    private ToolSummary toSummary(OperationDescriptor descriptor) {
        return ToolSummary.builder()
                .name(descriptor.toolId())
                .description(descriptor.description())
                .method(descriptor.method().name())
                .path(descriptor.pathTemplate())
                .pagination(descriptor.pagination().mode().name().toLowerCase(Locale.ROOT))
                .async(descriptor.isAsync())
                .statusTool(descriptor.isAsync() ? descriptor.asyncTask().statusTool() : null)
                .responseKind(descriptor.responseKind().name().toLowerCase(Locale.ROOT))
                .inputSchema(InputSchemas.forOperation(objectMapper, descriptor))
                .build();
    }

    private static Map<String, Object> arguments(Map<String, Object> arguments) {
        return arguments == null ? Map.of() : arguments;
    }

    private static Duration duration(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return DurationStyle.detectAndParse(value.trim());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid duration '%s'".formatted(value));
        }
    }
}
