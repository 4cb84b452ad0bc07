package app.jira.dispatch;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

/**
 * Status, headers and undecoded body of one HTTP exchange.
 */
public record RawResponse(int statusCode, HttpHeaders headers, byte[] body) {

    private static final byte[] NO_BODY = new byte[0];

    public RawResponse {
        headers = headers == null ? HttpHeaders.EMPTY : headers;
        body = body == null ? NO_BODY : body;
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    public MediaType contentType() {
        return headers.getContentType();
    }

    public String reasonPhrase() {
        HttpStatus status = HttpStatus.resolve(statusCode);
        return status != null ? status.getReasonPhrase() : "HTTP " + statusCode;
    }

    /**
     * Delay requested through {@code Retry-After}, either delta-seconds or an HTTP date.
     *
     * @return the delay, or {@code null} when the header is absent or unparseable
     */
    public Duration retryAfter(Clock clock) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return Duration.ofSeconds(Math.max(0, seconds));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration delay = Duration.between(clock.instant(), at.toInstant());
                return delay.isNegative() ? Duration.ZERO : delay;
            } catch (DateTimeParseException notDate) {
                return null;
            }
        }
    }
}
