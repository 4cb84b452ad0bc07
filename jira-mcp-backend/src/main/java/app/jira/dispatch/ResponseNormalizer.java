package app.jira.dispatch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.jira.catalogue.OperationDescriptor;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.ResultBody;
import app.jira.dispatch.result.Success;
import app.jira.dispatch.result.ToolResult;

/**
 * Turns raw HTTP answers into result envelopes according to the operation's response kind.
 */
@Component
public class ResponseNormalizer {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    ResponseNormalizer(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ToolResult normalize(RawResponse response, OperationDescriptor descriptor) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return success(response, descriptor);
        }
        if (status >= 300 && status < 400 && descriptor.isAsync()
                && response.headers().getFirst(HttpHeaders.LOCATION) != null) {
            // task launched; its status URL is in Location
            return new Success(status, ResultBody.EmptyBody.INSTANCE, response.headers());
        }
        String message = errorMessage(response);
        if (status == 429) {
            return Failure.rateLimited(message, response.retryAfter(clock));
        }
        if (status >= 400 && status < 500) {
            return Failure.clientError(status, message);
        }
        if (status >= 500 && status < 600) {
            return Failure.serverError(status, message, response.retryAfter(clock));
        }
        return Failure.unexpectedStatus(status, message);
    }

    public Failure transportFailure(TransportException ex) {
        return Failure.transport(ex.getReason(), ex.getMessage(), ex.isTransient());
    }

    private ToolResult success(RawResponse response, OperationDescriptor descriptor) {
        switch (descriptor.responseKind()) {
            case EMPTY:
                return new Success(response.statusCode(), ResultBody.EmptyBody.INSTANCE, response.headers());
            case BINARY:
                MediaType contentType = response.contentType();
                return new Success(response.statusCode(),
                        new ResultBody.BinaryBody(response.body(),
                                contentType != null ? contentType.toString() : MediaType.APPLICATION_OCTET_STREAM_VALUE),
                        response.headers());
            default:
                if (!response.hasBody()) {
                    return new Success(response.statusCode(), ResultBody.EmptyBody.INSTANCE, response.headers());
                }
                try {
                    JsonNode json = objectMapper.readTree(response.body());
                    return new Success(response.statusCode(), new ResultBody.JsonBody(json), response.headers());
                } catch (IOException ex) {
                    return Failure.decode(null, response.statusCode(),
                            "Response of '%s' is not valid JSON: %s".formatted(descriptor.toolId(), ex.getMessage()));
                }
        }
    }

    /**
     * Jira reports errors as {@code errorMessages[]} plus a field keyed {@code errors{}} map.
     * Anything else is returned as the raw body text, or the reason phrase for empty bodies.
     */
    String errorMessage(RawResponse response) {
        if (!response.hasBody()) {
            return response.reasonPhrase();
        }
        String body = new String(response.body(), StandardCharsets.UTF_8);
        if (!StringUtils.hasText(body)) {
            return response.reasonPhrase();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            List<String> messages = new ArrayList<>();
            root.path("errorMessages").forEach(message -> messages.add(message.asText()));
            root.path("errors").fields()
                    .forEachRemaining(entry -> messages.add(entry.getKey() + ": " + entry.getValue().asText()));
            if (root.hasNonNull("message") && messages.isEmpty()) {
                messages.add(root.get("message").asText());
            }
            if (!messages.isEmpty()) {
                return String.join("; ", messages);
            }
        } catch (IOException ignored) {
            // not JSON, keep the body as is
        }
        return body;
    }
}
