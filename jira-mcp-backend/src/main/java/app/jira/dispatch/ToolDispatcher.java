package app.jira.dispatch;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Service;

import app.jira.catalogue.AsyncTaskSpec;
import app.jira.catalogue.OperationDescriptor;
import app.jira.catalogue.OperationRegistry;
import app.jira.catalogue.UnknownToolException;
import app.jira.config.DispatchProperties;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.FailureReason;
import app.jira.dispatch.result.Success;
import app.jira.dispatch.result.ToolResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point for tool invocations.
 * <p>
 * Every call yields result envelopes; unknown tools, binding problems and transport failures
 * never surface as error signals. Lookup and binding happen before any network call.
 */
@Service
@Slf4j
public class ToolDispatcher {

    private final OperationRegistry registry;
    private final ParameterBinder binder;
    private final RequestExecutor executor;
    private final ResponseNormalizer normalizer;
    private final PaginationWalker paginationWalker;
    private final AsyncTaskPoller taskPoller;
    private final DispatchProperties properties;

    public ToolDispatcher(OperationRegistry registry,
                          ParameterBinder binder,
                          RequestExecutor executor,
                          ResponseNormalizer normalizer,
                          PaginationWalker paginationWalker,
                          AsyncTaskPoller taskPoller,
                          DispatchProperties properties) {
        this.registry = registry;
        this.binder = binder;
        this.executor = executor;
        this.normalizer = normalizer;
        this.paginationWalker = paginationWalker;
        this.taskPoller = taskPoller;
        this.properties = properties;
    }

    public Mono<ToolResult> invoke(String toolId, Map<String, ?> arguments) {
        return invoke(toolId, arguments, CancellationSignal.create());
    }

    public Mono<ToolResult> invoke(String toolId, Map<String, ?> arguments, CancellationSignal cancellation) {
        Mono<ToolResult> call = Mono.defer(() -> {
            Prepared prepared = prepare(toolId, arguments);
            if (prepared.failure() != null) {
                return Mono.just(prepared.failure());
            }
            return execute(prepared.request());
        });
        return cancellation.guard(call, () -> Failure.cancelled("Invocation of '%s' was cancelled".formatted(toolId)))
                .doOnNext(result -> logOutcome(toolId, result))
                .onErrorResume(ex -> Mono.just(unexpected(toolId, ex)));
    }

    public Flux<ToolResult> invokePaginated(String toolId, Map<String, ?> arguments, Integer pageLimit) {
        return invokePaginated(toolId, arguments, pageLimit, CancellationSignal.create());
    }

    /**
     * Streams one envelope per page. A failed page, a stalled cursor or a cancellation is
     * emitted as the final element.
     */
    public Flux<ToolResult> invokePaginated(String toolId, Map<String, ?> arguments, Integer pageLimit,
                                            CancellationSignal cancellation) {
        if (pageLimit != null && pageLimit < 1) {
            return Flux.just(Failure.validation(FailureReason.WRONG_TYPE,
                    "pageLimit must be at least 1, got %d".formatted(pageLimit)));
        }
        Flux<ToolResult> pages = Flux.defer(() -> {
            Prepared prepared = prepare(toolId, arguments);
            if (prepared.failure() != null) {
                return Flux.just(prepared.failure());
            }
            return paginationWalker.paginate(prepared.descriptor(), prepared.request(), pageLimit);
        });
        return Flux.defer(() -> {
            AtomicBoolean interrupted = new AtomicBoolean();
            return pages
                    .takeUntilOther(cancellation.onCancel().thenReturn(Boolean.TRUE)
                            .doOnNext(ignored -> interrupted.set(true)))
                    .concatWith(Mono.fromSupplier(() -> interrupted.get()
                            ? Failure.cancelled("Pagination of '%s' was cancelled".formatted(toolId))
                            : null));
        }).onErrorResume(ex -> Mono.just(unexpected(toolId, ex)));
    }

    public Mono<ToolResult> invokeAsync(String toolId, Map<String, ?> arguments,
                                        Duration pollInterval, Duration maxWait) {
        return invokeAsync(toolId, arguments, pollInterval, maxWait, CancellationSignal.create());
    }

    /**
     * Starts the operation and, when it launches a remote task, waits for the task to end.
     * Synchronous operations return their result unchanged.
     */
    public Mono<ToolResult> invokeAsync(String toolId, Map<String, ?> arguments,
                                        Duration pollInterval, Duration maxWait,
                                        CancellationSignal cancellation) {
        return invoke(toolId, arguments, cancellation).flatMap(result -> {
            if (!(result instanceof Success success)) {
                return Mono.just(result);
            }
            OperationDescriptor descriptor = registry.resolve(toolId);
            AsyncTaskSpec spec = descriptor.asyncTask();
            if (spec == null) {
                return Mono.just(result);
            }
            return TaskHandle.extractTaskId(success, spec)
                    .map(taskId -> await(descriptor, taskId, pollInterval, maxWait, cancellation))
                    .orElseGet(() -> Mono.just(Failure.decode(FailureReason.MISSING_TASK_ID, success.statusCode(),
                            "Response of '%s' carries no task id".formatted(toolId))));
        }).onErrorResume(ex -> Mono.just(unexpected(toolId, ex)));
    }

    public Mono<ToolResult> resumeTask(String toolId, String taskId, Duration pollInterval, Duration maxWait) {
        return resumeTask(toolId, taskId, pollInterval, maxWait, CancellationSignal.create());
    }

    /**
     * Polls a task started earlier by {@code toolId}, for instance after a {@code TIMEOUT} result.
     */
    public Mono<ToolResult> resumeTask(String toolId, String taskId, Duration pollInterval, Duration maxWait,
                                       CancellationSignal cancellation) {
        return Mono.defer(() -> {
            OperationDescriptor descriptor;
            try {
                descriptor = registry.resolve(toolId);
            } catch (UnknownToolException ex) {
                return Mono.just(Failure.notFound(toolId));
            }
            if (!descriptor.isAsync()) {
                return Mono.just(Failure.validation(null,
                        "Tool '%s' does not start remote tasks".formatted(toolId)));
            }
            if (taskId == null || taskId.isBlank()) {
                return Mono.just(Failure.validation(FailureReason.MISSING_REQUIRED, "taskId is required"));
            }
            return await(descriptor, taskId.trim(), pollInterval, maxWait, cancellation);
        }).onErrorResume(ex -> Mono.just(unexpected(toolId, ex)));
    }

    public OperationRegistry registry() {
        return registry;
    }

    private Mono<ToolResult> await(OperationDescriptor descriptor, String taskId,
                                   Duration pollInterval, Duration maxWait, CancellationSignal cancellation) {
        OperationDescriptor statusOperation = registry.resolve(descriptor.asyncTask().statusTool());
        TaskHandle handle = new TaskHandle(taskId, descriptor, statusOperation);
        log.debug("Waiting for task {} started by {}", taskId, descriptor.toolId());
        return taskPoller.awaitTask(handle,
                pollInterval != null ? pollInterval : properties.getPollInterval(),
                maxWait != null ? maxWait : properties.getMaxWait(),
                cancellation);
    }

    private Mono<ToolResult> execute(BoundRequest request) {
        return executor.execute(request)
                .map(raw -> normalizer.normalize(raw, request.operation()))
                .onErrorResume(TransportException.class, ex -> Mono.just(normalizer.transportFailure(ex)));
    }

    private Prepared prepare(String toolId, Map<String, ?> arguments) {
        OperationDescriptor descriptor;
        try {
            descriptor = registry.resolve(toolId);
        } catch (UnknownToolException ex) {
            return Prepared.failed(Failure.notFound(toolId));
        }
        try {
            return new Prepared(descriptor, binder.bind(descriptor, arguments == null ? Map.of() : arguments), null);
        } catch (ValidationException ex) {
            return Prepared.failed(Failure.validation(ex.getReason(), ex.getMessage()));
        }
    }

    private void logOutcome(String toolId, ToolResult result) {
        if (result instanceof Failure failure) {
            log.warn("Tool {} failed: {} {} {}", toolId, failure.kind(),
                    failure.statusCode() != null ? failure.statusCode() : "", failure.message());
        } else if (log.isDebugEnabled()) {
            log.debug("Tool {} succeeded with HTTP {}", toolId, ((Success) result).statusCode());
        }
    }

    private Failure unexpected(String toolId, Throwable ex) {
        log.error("Unexpected error while dispatching {}", toolId, ex);
        return Failure.transport(FailureReason.IO_ERROR,
                "Unexpected error while dispatching '%s': %s".formatted(toolId, ex.getMessage()), false);
    }

    private record Prepared(OperationDescriptor descriptor, BoundRequest request, Failure failure) {

        static Prepared failed(Failure failure) {
            return new Prepared(null, null, failure);
        }
    }
}
