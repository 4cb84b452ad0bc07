package app.jira.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import app.jira.catalogue.CatalogueLoader;
import app.jira.catalogue.OperationRegistry;
import app.jira.dispatch.ToolDispatcher;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.FailureReason;
import app.jira.dispatch.result.ResultBody;
import app.jira.dispatch.result.Success;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import reactor.core.publisher.Mono;

class McpToolAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ToolDispatcher dispatcher;
    private OperationRegistry registry;
    private McpToolAdapter adapter;

    @BeforeEach
    void setUp() {
        registry = new CatalogueLoader(objectMapper).load(new ClassPathResource("catalogue/jira-cloud.json"));
        dispatcher = mock(ToolDispatcher.class);
        when(dispatcher.registry()).thenReturn(registry);
        adapter = new McpToolAdapter(dispatcher, objectMapper, Duration.ofSeconds(2));
    }

    @Test
    void publishesOneToolPerOperation() {
        List<McpServerFeatures.SyncToolSpecification> specifications = adapter.toolSpecifications();

        assertThat(specifications).hasSize(registry.size());
        McpSchema.Tool getIssue = specifications.stream()
                .map(McpServerFeatures.SyncToolSpecification::tool)
                .filter(tool -> tool.name().equals("get_issue"))
                .findFirst()
                .orElseThrow();
        assertThat(getIssue.inputSchema().type()).isEqualTo("object");
        assertThat(getIssue.inputSchema().required()).containsExactly("issueIdOrKey");
        assertThat(getIssue.inputSchema().properties()).containsKeys("issueIdOrKey", "fields", "expand");
    }

    @Test
    void rendersSuccessEnvelope() throws Exception {
        when(dispatcher.invoke(eq("get_issue"), anyMap())).thenReturn(Mono.just(new Success(200,
                new ResultBody.JsonBody(JsonNodeFactory.instance.objectNode().put("key", "ABC-1")))));

        McpSchema.CallToolResult result = adapter.call(registry.resolve("get_issue"), Map.of("issueIdOrKey", "ABC-1"));

        assertThat(result.isError()).isFalse();
        JsonNode envelope = objectMapper.readTree(((McpSchema.TextContent) result.content().get(0)).text());
        assertThat(envelope.path("statusCode").asInt()).isEqualTo(200);
        assertThat(envelope.path("body").path("json").path("key").asText()).isEqualTo("ABC-1");
    }

    @Test
    void flagsFailuresAsErrors() throws Exception {
        when(dispatcher.invoke(eq("get_issue"), anyMap())).thenReturn(Mono.just(
                Failure.validation(FailureReason.MISSING_REQUIRED, "Missing required parameter 'issueIdOrKey'")));

        McpSchema.CallToolResult result = adapter.call(registry.resolve("get_issue"), null);

        assertThat(result.isError()).isTrue();
        JsonNode envelope = objectMapper.readTree(((McpSchema.TextContent) result.content().get(0)).text());
        assertThat(envelope.path("kind").asText()).isEqualTo("VALIDATION_ERROR");
        assertThat(envelope.path("reason").asText()).isEqualTo("MISSING_REQUIRED");
    }

    @Test
    void awaitsTaskStartingOperations() {
        when(dispatcher.invokeAsync(eq("submit_bulk_delete"), anyMap(), isNull(), isNull()))
                .thenReturn(Mono.just(new Success(200, ResultBody.EmptyBody.INSTANCE)));

        McpSchema.CallToolResult result = adapter.call(registry.resolve("submit_bulk_delete"),
                Map.of("body", Map.of("selectedIssueIdsOrKeys", List.of("ABC-1"))));

        assertThat(result.isError()).isFalse();
        verify(dispatcher, never()).invoke(eq("submit_bulk_delete"), anyMap());
    }

    @Test
    void reportsTimeoutWhenCallOutlivesLimit() throws Exception {
        when(dispatcher.invoke(eq("get_current_user"), anyMap())).thenReturn(Mono.never());
        McpToolAdapter impatient = new McpToolAdapter(dispatcher, objectMapper, Duration.ofMillis(50));

        McpSchema.CallToolResult result = impatient.call(registry.resolve("get_current_user"), Map.of());

        assertThat(result.isError()).isTrue();
        JsonNode envelope = objectMapper.readTree(((McpSchema.TextContent) result.content().get(0)).text());
        assertThat(envelope.path("kind").asText()).isEqualTo("TIMEOUT");
    }
}
