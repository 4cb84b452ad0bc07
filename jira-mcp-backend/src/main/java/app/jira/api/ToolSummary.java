package app.jira.api;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Builder;

/**
 * Catalogue entry as listed to REST clients.
 */
@Builder
public record ToolSummary(
        String name,
        String description,
        String method,
        String path,
        String pagination,
        boolean async,
        String statusTool,
        String responseKind,
        JsonNode inputSchema
) {}
