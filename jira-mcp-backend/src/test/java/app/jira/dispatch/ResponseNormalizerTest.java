package app.jira.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.jira.catalogue.OperationDescriptor;
import app.jira.catalogue.ParameterSpec;
import app.jira.catalogue.ResponseKind;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.FailureKind;
import app.jira.dispatch.result.FailureReason;
import app.jira.dispatch.result.ResultBody;
import app.jira.dispatch.result.Success;
import app.jira.dispatch.result.ToolResult;

class ResponseNormalizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private ResponseNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ResponseNormalizer(new ObjectMapper(), CLOCK);
    }

    @Test
    void decodesJsonSuccess() {
        ToolResult result = normalizer.normalize(json(200, "{\"key\":\"ABC-1\"}"), descriptor(ResponseKind.JSON));

        assertThat(result).isInstanceOfSatisfying(Success.class, success -> {
            assertThat(success.statusCode()).isEqualTo(200);
            assertThat(((ResultBody.JsonBody) success.body()).json().get("key").asText()).isEqualTo("ABC-1");
        });
    }

    @Test
    void emptyKindYieldsEmptyMarker() {
        ToolResult result = normalizer.normalize(new RawResponse(204, null, null), descriptor(ResponseKind.EMPTY));

        assertThat(result).isEqualTo(new Success(204, ResultBody.EmptyBody.INSTANCE));
    }

    @Test
    void jsonOperationWithoutBodyIsEmptySuccess() {
        ToolResult result = normalizer.normalize(new RawResponse(201, null, null), descriptor(ResponseKind.JSON));

        assertThat(result).isInstanceOfSatisfying(Success.class,
                success -> assertThat(success.body()).isEqualTo(ResultBody.EmptyBody.INSTANCE));
    }

    @Test
    void binaryKindKeepsBytesAndContentType() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.IMAGE_PNG);
        RawResponse raw = new RawResponse(200, headers, new byte[] {1, 2, 3});

        ToolResult result = normalizer.normalize(raw, descriptor(ResponseKind.BINARY));

        assertThat(result).isInstanceOfSatisfying(Success.class, success ->
                assertThat(success.body()).isEqualTo(new ResultBody.BinaryBody(new byte[] {1, 2, 3}, "image/png")));
    }

    @Test
    void malformedJsonIsDecodeError() {
        ToolResult result = normalizer.normalize(json(200, "{\"key\":"), descriptor(ResponseKind.JSON));

        assertThat(result).isInstanceOfSatisfying(Failure.class, failure -> {
            assertThat(failure.kind()).isEqualTo(FailureKind.DECODE_ERROR);
            assertThat(failure.retryable()).isFalse();
        });
    }

    @Test
    void clientErrorFlattensJiraErrorBody() {
        String body = "{\"errorMessages\":[\"Issue does not exist\"],\"errors\":{\"summary\":\"required\"}}";

        ToolResult result = normalizer.normalize(json(404, body), descriptor(ResponseKind.JSON));

        assertThat(result).isEqualTo(Failure.clientError(404, "Issue does not exist; summary: required"));
    }

    @Test
    void nonJsonErrorBodyIsKeptVerbatim() {
        RawResponse raw = new RawResponse(400, null, "Bad things happened".getBytes(StandardCharsets.UTF_8));

        Failure failure = (Failure) normalizer.normalize(raw, descriptor(ResponseKind.JSON));

        assertThat(failure.message()).isEqualTo("Bad things happened");
        assertThat(failure.statusCode()).isEqualTo(400);
    }

    @Test
    void emptyErrorBodyFallsBackToReasonPhrase() {
        Failure failure = (Failure) normalizer.normalize(new RawResponse(403, null, null), descriptor(ResponseKind.JSON));

        assertThat(failure.message()).isEqualTo("Forbidden");
        assertThat(failure.kind()).isEqualTo(FailureKind.CLIENT_ERROR);
    }

    @Test
    void rateLimitIsRetryableWithHint() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "Wed, 01 May 2024 10:00:30 GMT");

        Failure failure = (Failure) normalizer.normalize(new RawResponse(429, headers, null), descriptor(ResponseKind.JSON));

        assertThat(failure.reason()).isEqualTo(FailureReason.RATE_LIMITED);
        assertThat(failure.retryable()).isTrue();
        assertThat(failure.retryAfter()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void serverErrorIsRetryable() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "5");

        Failure failure = (Failure) normalizer.normalize(
                new RawResponse(503, headers, "{\"message\":\"down for maintenance\"}".getBytes(StandardCharsets.UTF_8)),
                descriptor(ResponseKind.JSON));

        assertThat(failure.kind()).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(failure.retryable()).isTrue();
        assertThat(failure.message()).isEqualTo("down for maintenance");
        assertThat(failure.retryAfter()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void redirectIsUnexpectedForSynchronousOperations() {
        HttpHeaders headers = new HttpHeaders();
        headers.setLocation(java.net.URI.create("https://example.atlassian.net/elsewhere"));

        Failure failure = (Failure) normalizer.normalize(new RawResponse(303, headers, null), descriptor(ResponseKind.JSON));

        assertThat(failure.kind()).isEqualTo(FailureKind.UNEXPECTED_STATUS);
        assertThat(failure.statusCode()).isEqualTo(303);
    }

    @Test
    void unparseableRetryAfterIsIgnored() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "soon");

        assertThat(new RawResponse(429, headers, null).retryAfter(CLOCK)).isNull();
    }

    private static RawResponse json(int status, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new RawResponse(status, headers, body.getBytes(StandardCharsets.UTF_8));
    }

    private static OperationDescriptor descriptor(ResponseKind kind) {
        return new OperationDescriptor("get_issue", HttpMethod.GET, "/rest/api/3/issue/{issueIdOrKey}",
                List.of(ParameterSpec.path("issueIdOrKey")), null, null, null, kind, null, null);
    }
}
