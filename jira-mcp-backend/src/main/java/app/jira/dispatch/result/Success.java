package app.jira.dispatch.result;

import org.springframework.http.HttpHeaders;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Successful invocation carrying the decoded body.
 *
 * @param statusCode HTTP status code returned by the service
 * @param body       decoded payload
 * @param headers    response headers, kept for callers that follow {@code Location} or similar
 */
public record Success(int statusCode, ResultBody body, @JsonIgnore HttpHeaders headers) implements ToolResult {

    public Success {
        body = body == null ? ResultBody.EmptyBody.INSTANCE : body;
        headers = headers == null ? HttpHeaders.EMPTY : HttpHeaders.readOnlyHttpHeaders(headers);
    }

    public Success(int statusCode, ResultBody body) {
        this(statusCode, body, HttpHeaders.EMPTY);
    }

    @Override
    public boolean isSuccess() {
        return true;
    }
}
