package app.jira.mcp.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.jira.dispatch.ToolDispatcher;
import app.jira.mcp.McpToolAdapter;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.WebFluxSseServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(McpProperties.class)
@ConditionalOnProperty(prefix = "jira.mcp", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class McpServerConfig {

    @Bean
    public WebFluxSseServerTransportProvider mcpTransportProvider(ObjectMapper objectMapper, McpProperties properties) {
        return new WebFluxSseServerTransportProvider(objectMapper, properties.messageEndpoint(), properties.sseEndpoint());
    }

    @Bean
    public RouterFunction<?> mcpRouterFunction(WebFluxSseServerTransportProvider transportProvider) {
        return transportProvider.getRouterFunction();
    }

    @Bean
    public McpToolAdapter mcpToolAdapter(ToolDispatcher dispatcher, ObjectMapper objectMapper,
                                         McpProperties properties) {
        return new McpToolAdapter(dispatcher, objectMapper, properties.callTimeout());
    }

    @Bean
    public McpSyncServer mcpSyncServer(WebFluxSseServerTransportProvider transportProvider,
                                       McpToolAdapter toolAdapter,
                                       McpProperties properties) {
        var tools = toolAdapter.toolSpecifications();
        log.info("Publishing {} MCP tools at {}", tools.size(), properties.sseEndpoint());
        return McpServer.sync(transportProvider)
                .serverInfo(properties.serverName(), properties.serverVersion())
                .capabilities(McpSchema.ServerCapabilities.builder().tools(true).build())
                .tools(tools)
                .build();
    }
}
