package app.jira.dispatch;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

import app.jira.catalogue.AsyncTaskSpec;
import app.jira.catalogue.TaskState;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.FailureReason;
import app.jira.dispatch.result.ResultBody;
import app.jira.dispatch.result.Success;
import app.jira.dispatch.result.ToolResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Polls the status operation of a remote task until it reaches a terminal state.
 * <p>
 * The first poll is issued immediately, later ones {@code pollInterval} after the previous poll
 * completed. Only one poll is in flight at a time.
 */
@Component
@Slf4j
public class AsyncTaskPoller {

    private final ParameterBinder binder;
    private final RequestExecutor executor;
    private final ResponseNormalizer normalizer;

    public AsyncTaskPoller(ParameterBinder binder, RequestExecutor executor, ResponseNormalizer normalizer) {
        this.binder = binder;
        this.executor = executor;
        this.normalizer = normalizer;
    }

    /**
     * A status check that fails with a retryable failure (429, 5xx, transient transport error) is
     * polled again; other failed checks end the wait.
     *
     * @return the final status response on success; a {@code TASK_FAILED} failure when the task
     * failed or was cancelled remotely; a retryable {@code TIMEOUT} failure when {@code maxWait}
     * elapsed first, after which the same handle can be polled again
     */
    public Mono<ToolResult> awaitTask(TaskHandle handle, Duration pollInterval, Duration maxWait,
                                      CancellationSignal cancellation) {
        Mono<ToolResult> polling = Mono.defer(() -> pollOnce(handle))
                .repeatWhen(completions -> completions.delayElements(pollInterval))
                .filter(Poll::terminal)
                .next()
                .map(Poll::result)
                .timeout(maxWait, Mono.fromSupplier(() -> {
                    log.warn("Task {} of {} still running after {}", handle.taskId(),
                            handle.initiatingOperation().toolId(), maxWait);
                    return Failure.timeout("Task '%s' did not finish within %s; it may still complete remotely"
                            .formatted(handle.taskId(), maxWait));
                }));
        return cancellation.guard(polling,
                () -> Failure.cancelled("Waiting for task '%s' was cancelled".formatted(handle.taskId())));
    }

    public Mono<ToolResult> awaitTask(TaskHandle handle, Duration pollInterval, Duration maxWait) {
        return awaitTask(handle, pollInterval, maxWait, CancellationSignal.create());
    }

    private Mono<Poll> pollOnce(TaskHandle handle) {
        AsyncTaskSpec spec = handle.spec();
        BoundRequest request;
        try {
            request = binder.bind(handle.statusOperation(), Map.of(spec.taskIdParameter(), handle.taskId()));
        } catch (ValidationException ex) {
            return Mono.just(new Poll(true, Failure.validation(ex.getReason(), ex.getMessage())));
        }
        return executor.execute(request)
                .map(raw -> normalizer.normalize(raw, handle.statusOperation()))
                .onErrorResume(TransportException.class, ex -> Mono.just(normalizer.transportFailure(ex)))
                .map(result -> interpret(handle, result));
    }

    private Poll interpret(TaskHandle handle, ToolResult result) {
        if (!(result instanceof Success success)) {
            if (result instanceof Failure failure && failure.retryable()) {
                log.warn("Status check of task {} failed, polling again: {} {}", handle.taskId(),
                        failure.kind(), failure.message());
                return new Poll(false, result);
            }
            return new Poll(true, result);
        }
        AsyncTaskSpec spec = handle.spec();
        JsonNode body = success.body() instanceof ResultBody.JsonBody json ? json.json() : null;
        String reported = JsonFields.text(body, spec.statusField());
        Optional<TaskState> state = spec.stateOf(reported);
        if (state.isEmpty()) {
            return new Poll(true, Failure.decode(FailureReason.UNMAPPED_STATUS, success.statusCode(),
                    "Task '%s' reported unknown status '%s'".formatted(handle.taskId(), reported)));
        }
        log.debug("Task {} is {} ({})", handle.taskId(), state.get(), reported);
        switch (state.get()) {
            case SUCCEEDED:
                return new Poll(true, success);
            case FAILED:
                return new Poll(true, Failure.taskEnded(FailureReason.TASK_FAILED,
                        "Task '%s' failed with status '%s'".formatted(handle.taskId(), reported)));
            case CANCELLED:
                return new Poll(true, Failure.taskEnded(FailureReason.TASK_CANCELLED,
                        "Task '%s' was cancelled remotely".formatted(handle.taskId())));
            default:
                return new Poll(false, success);
        }
    }

    private record Poll(boolean terminal, ToolResult result) {
    }
}
