package app.jira.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import app.jira.catalogue.AsyncTaskSpec;
import app.jira.catalogue.BodySpec;
import app.jira.catalogue.OperationDescriptor;
import app.jira.catalogue.OperationRegistry;
import app.jira.catalogue.PaginationSpec;
import app.jira.catalogue.ParameterSpec;
import app.jira.catalogue.ParameterType;
import app.jira.catalogue.ResponseKind;
import app.jira.catalogue.TaskState;
import app.jira.dispatch.ToolDispatcher;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.FailureReason;
import app.jira.dispatch.result.ResultBody;
import app.jira.dispatch.result.Success;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@WebFluxTest(ToolController.class)
@AutoConfigureWebTestClient
class ToolControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        OperationDescriptor getIssue = new OperationDescriptor("get_issue", HttpMethod.GET,
                "/rest/api/3/issue/{issueIdOrKey}",
                List.of(ParameterSpec.path("issueIdOrKey"),
                        ParameterSpec.query("fields", ParameterType.ARRAY, false)),
                null, PaginationSpec.NONE, null, ResponseKind.JSON, null, "Returns an issue.");
        OperationDescriptor progress = new OperationDescriptor("get_bulk_operation_progress",
                HttpMethod.GET, "/rest/api/3/bulk/queue/{taskId}",
                List.of(ParameterSpec.path("taskId")),
                null, PaginationSpec.NONE, null, ResponseKind.JSON, null, null);
        OperationDescriptor bulkDelete = new OperationDescriptor("submit_bulk_delete",
                HttpMethod.POST, "/rest/api/3/bulk/issues/delete",
                List.of(), BodySpec.json(true), PaginationSpec.NONE,
                new AsyncTaskSpec("get_bulk_operation_progress", "taskId", "taskId", "status",
                        Map.of("COMPLETE", TaskState.SUCCEEDED, "FAILED", TaskState.FAILED)),
                ResponseKind.JSON, null, "Deletes issues in bulk.");
        when(dispatcher.registry()).thenReturn(new OperationRegistry(List.of(getIssue, progress, bulkDelete)));
    }

    @Test
    void listsToolsWithInputSchemas() {
        webTestClient.get()
                .uri("/api/tools")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(3)
                .jsonPath("$[0].name").isEqualTo("get_issue")
                .jsonPath("$[0].inputSchema.required[0]").isEqualTo("issueIdOrKey")
                .jsonPath("$[0].inputSchema.properties.fields.type").isEqualTo("array")
                .jsonPath("$[0].inputSchema.additionalProperties").isEqualTo(false)
                .jsonPath("$[2].async").isEqualTo(true)
                .jsonPath("$[2].statusTool").isEqualTo("get_bulk_operation_progress");
    }

    @Test
    void unknownToolDescriptionIsNotFound() {
        webTestClient.get()
                .uri("/api/tools/{toolId}", "get_isue")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void returnsSuccessEnvelope() {
        when(dispatcher.invoke(eq("get_issue"), anyMap())).thenReturn(Mono.just(new Success(200,
                new ResultBody.JsonBody(JsonNodeFactory.instance.objectNode().put("key", "ABC-1")))));

        webTestClient.post()
                .uri("/api/tools/{toolId}", "get_issue")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("issueIdOrKey", "ABC-1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.statusCode").isEqualTo(200)
                .jsonPath("$.body.kind").isEqualTo("json")
                .jsonPath("$.body.json.key").isEqualTo("ABC-1");

        verify(dispatcher).invoke("get_issue", Map.of("issueIdOrKey", "ABC-1"));
    }

    @Test
    void mapsFailuresToHttpStatus() {
        when(dispatcher.invoke(eq("get_issue"), anyMap()))
                .thenReturn(Mono.just(Failure.validation(FailureReason.MISSING_REQUIRED,
                        "Missing required parameter 'issueIdOrKey'")));
        when(dispatcher.invoke(eq("nope"), anyMap())).thenReturn(Mono.just(Failure.notFound("nope")));
        when(dispatcher.invoke(eq("get_bulk_operation_progress"), anyMap()))
                .thenReturn(Mono.just(Failure.clientError(404, "Issue does not exist")));

        webTestClient.post().uri("/api/tools/get_issue").exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.reason").isEqualTo("MISSING_REQUIRED");
        webTestClient.post().uri("/api/tools/nope").exchange()
                .expectStatus().isNotFound();
        webTestClient.post().uri("/api/tools/get_bulk_operation_progress").exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.statusCode").isEqualTo(404);
    }

    @Test
    void awaitsTaskWithParsedDurations() {
        when(dispatcher.invokeAsync(eq("submit_bulk_delete"), anyMap(), any(), any()))
                .thenReturn(Mono.just(Failure.timeout("Task 10641 still running")));

        webTestClient.post()
                .uri("/api/tools/submit_bulk_delete/await?pollInterval=500ms&maxWait=PT2M")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("body", Map.of("selectedIssueIdsOrKeys", List.of("ABC-1"))))
                .exchange()
                .expectStatus().isEqualTo(504);

        verify(dispatcher).invokeAsync(eq("submit_bulk_delete"), anyMap(),
                eq(Duration.ofMillis(500)), eq(Duration.ofMinutes(2)));
    }

    @Test
    void rejectsMalformedDuration() {
        webTestClient.post()
                .uri("/api/tools/submit_bulk_delete/await?maxWait=soon")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(dispatcher);
    }

    @Test
    void resumesTaskWithDefaults() {
        when(dispatcher.resumeTask(eq("submit_bulk_delete"), eq("10641"), isNull(), isNull()))
                .thenReturn(Mono.just(new Success(200, ResultBody.EmptyBody.INSTANCE)));

        webTestClient.get()
                .uri("/api/tools/submit_bulk_delete/tasks/10641")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.body.kind").isEqualTo("empty");
    }

    @Test
    void streamsPagesAsNdjson() {
        when(dispatcher.invokePaginated(eq("get_issue"), anyMap(), eq(2))).thenReturn(Flux.just(
                new Success(200, ResultBody.EmptyBody.INSTANCE),
                Failure.serverError(503, "Service unavailable", null)));

        webTestClient.post()
                .uri("/api/tools/get_issue/pages?pageLimit=2")
                .accept(MediaType.APPLICATION_NDJSON)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_NDJSON)
                .expectBody(String.class)
                .value(body -> {
                    List<String> lines = body.lines().toList();
                    assertThat(lines).hasSize(2);
                    assertThat(lines.get(1)).contains("SERVER_ERROR");
                });
    }
}
