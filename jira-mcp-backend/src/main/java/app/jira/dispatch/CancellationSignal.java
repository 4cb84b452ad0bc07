package app.jira.dispatch;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Caller-owned switch that aborts an in-flight invocation.
 * <p>
 * Cancelling disposes the guarded work, which closes the HTTP exchange or stops the poll loop,
 * and the guarded {@link Mono} completes with the fallback result instead.
 */
public final class CancellationSignal {

    private final Sinks.Empty<Void> sink = Sinks.empty();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            sink.tryEmitEmpty();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Mono<Void> onCancel() {
        return sink.asMono();
    }

    public <T> Mono<T> guard(Mono<T> work, Supplier<? extends T> onCancelled) {
        return Mono.defer(() -> {
            if (isCancelled()) {
                return Mono.fromSupplier(onCancelled);
            }
            Mono<T> cancellation = onCancel().then(Mono.fromSupplier(onCancelled));
            return Mono.firstWithSignal(work, cancellation);
        });
    }
}
