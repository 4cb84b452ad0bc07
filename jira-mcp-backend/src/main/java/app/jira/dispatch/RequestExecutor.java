package app.jira.dispatch;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;

import app.jira.auth.CredentialProvider;
import app.jira.catalogue.BodySpec;
import app.jira.catalogue.OperationDescriptor;
import app.jira.catalogue.ResponseKind;
import app.jira.config.DispatchProperties;
import app.jira.config.JiraProperties;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Sends bound requests to the Jira site.
 * <p>
 * Each attempt asks the credential provider for a fresh credential and is bounded by the
 * request timeout. Transient transport failures are retried with exponential backoff and
 * jitter, but only for operations whose replay cannot duplicate side effects. 429 answers are
 * retried for every operation after the {@code Retry-After} delay, unless that delay exceeds
 * {@code maxRetryAfter}; 5xx answers only for retry-safe operations. Cancelling the returned
 * {@link Mono} aborts the in-flight exchange.
 */
@Component
@Slf4j
public class RequestExecutor {

    private static final byte[] NO_BODY = new byte[0];

    private final WebClient webClient;
    private final CredentialProvider credentialProvider;
    private final DispatchProperties properties;
    private final String baseUrl;
    private final Clock clock;

    public RequestExecutor(WebClient jiraWebClient,
                           CredentialProvider credentialProvider,
                           JiraProperties jiraProperties,
                           DispatchProperties properties) {
        this(jiraWebClient, credentialProvider, jiraProperties.baseUrl(), properties, Clock.systemUTC());
    }

    RequestExecutor(WebClient webClient,
                    CredentialProvider credentialProvider,
                    String baseUrl,
                    DispatchProperties properties,
                    Clock clock) {
        this.webClient = webClient;
        this.credentialProvider = credentialProvider;
        this.baseUrl = baseUrl;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return the raw response for any HTTP status, or an error signal carrying a
     * {@link TransportException} once the retry budget is spent
     */
    public Mono<RawResponse> execute(BoundRequest request) {
        OperationDescriptor operation = request.operation();

        Mono<RawResponse> attempt = Mono.defer(() -> exchangeOnce(request))
                .timeout(properties.getRequestTimeout())
                .onErrorMap(TransportException::classify);

        if (operation.isRetrySafe() && properties.getMaxTransportRetries() > 0) {
            attempt = attempt.retryWhen(Retry.backoff(properties.getMaxTransportRetries(), properties.getMinBackoff())
                    .maxBackoff(properties.getMaxBackoff())
                    .jitter(properties.getJitter())
                    .filter(error -> error instanceof TransportException transport && transport.isTransient())
                    .doBeforeRetry(signal -> log.warn("Retrying {} after transport failure (attempt {}): {}",
                            operation.toolId(), signal.totalRetries() + 1, signal.failure().getMessage()))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
        }

        return attempt
                .flatMap(response -> shouldRetry(response, operation)
                        ? Mono.<RawResponse>error(new RetryableStatusException(response))
                        : Mono.just(response))
                .retryWhen(statusRetry(operation))
                .onErrorResume(RetryableStatusException.class, ex -> Mono.just(ex.response));
    }

    private Mono<RawResponse> exchangeOnce(BoundRequest request) {
        OperationDescriptor operation = request.operation();
        HttpHeaders outgoing = new HttpHeaders();
        outgoing.setAccept(acceptFor(operation.responseKind()));
        outgoing.addAll(request.headers());
        credentialProvider.currentAuthentication().applyTo(outgoing);

        URI uri = URI.create(baseUrl + request.relativeUri());
        log.debug("{} {} ({})", request.method(), uri, operation.toolId());

        WebClient.RequestBodySpec spec = webClient.method(request.method())
                .uri(uri)
                .headers(headers -> headers.putAll(outgoing));

        WebClient.RequestHeadersSpec<?> headersSpec = spec;
        if (request.hasBody()) {
            BodySpec body = operation.body();
            MediaType mediaType = MediaType.parseMediaType(
                    body != null ? body.mediaType() : BodySpec.DEFAULT_MEDIA_TYPE);
            headersSpec = spec.contentType(mediaType).bodyValue(bodyValue(request.body(), mediaType));
        }

        return headersSpec.exchangeToMono(response -> response.bodyToMono(byte[].class)
                .defaultIfEmpty(NO_BODY)
                .map(bytes -> new RawResponse(response.statusCode().value(),
                        response.headers().asHttpHeaders(), bytes)));
    }

    private boolean shouldRetry(RawResponse response, OperationDescriptor operation) {
        if (response.statusCode() == 429) {
            return true;
        }
        return response.statusCode() >= 500 && response.statusCode() < 600 && operation.isRetrySafe();
    }

    private Retry statusRetry(OperationDescriptor operation) {
        int maxRetries = properties.getMaxStatusRetries();
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long retries = signal.totalRetries();
            if (!(failure instanceof RetryableStatusException retryable) || retries >= maxRetries) {
                return Mono.error(failure);
            }
            Duration delay = delayFor(retryable.response, retries);
            if (delay.compareTo(properties.getMaxRetryAfter()) > 0) {
                log.warn("Not retrying {}: HTTP {} asks to wait {} s, limit is {} s", operation.toolId(),
                        retryable.response.statusCode(), delay.toSeconds(), properties.getMaxRetryAfter().toSeconds());
                return Mono.error(failure);
            }
            log.warn("Retrying {} after HTTP {} in {} ms", operation.toolId(),
                    retryable.response.statusCode(), delay.toMillis());
            return Mono.delay(delay).thenReturn(retries);
        }));
    }

    Duration delayFor(RawResponse response, long retries) {
        Duration backoff = properties.getMinBackoff().multipliedBy(1L << Math.min(retries, 16));
        if (backoff.compareTo(properties.getMaxBackoff()) > 0) {
            backoff = properties.getMaxBackoff();
        }
        Duration retryAfter = response.retryAfter(clock);
        return retryAfter != null && retryAfter.compareTo(backoff) > 0 ? retryAfter : backoff;
    }

    private static Object bodyValue(JsonNode body, MediaType mediaType) {
        if (body.isTextual() && !mediaType.getSubtype().contains("json")) {
            return body.asText();
        }
        return body;
    }

    private static List<MediaType> acceptFor(ResponseKind kind) {
        return kind == ResponseKind.BINARY ? List.of(MediaType.ALL) : List.of(MediaType.APPLICATION_JSON);
    }

    /**
     * Carries a retryable HTTP answer through the retry operator; unwrapped once retries are spent.
     */
    private static final class RetryableStatusException extends RuntimeException {

        private final transient RawResponse response;

        private RetryableStatusException(RawResponse response) {
            super("HTTP " + response.statusCode(), null, false, false);
            this.response = response;
        }
    }
}
