package app.jira.catalogue;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.core.io.Resource;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads an OpenAPI 3 style document into operation descriptors.
 * <p>
 * Only the parts the dispatcher needs are read: operation ids, parameters, request bodies,
 * 2xx response media types and the {@code x-pagination}, {@code x-async-task},
 * {@code x-response-kind}, {@code x-idempotent}, {@code x-tool-name} and
 * {@code x-body-argument} extensions. Any malformed entry fails the whole load.
 */
@Slf4j
public class CatalogueLoader {

    private static final List<String> METHODS = List.of("get", "put", "post", "delete", "patch", "head", "options");

    private final ObjectMapper objectMapper;

    public CatalogueLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OperationRegistry load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new CatalogueException("Catalogue resource %s does not exist".formatted(resource));
        }
        try (InputStream in = resource.getInputStream()) {
            OperationRegistry registry = load(objectMapper.readTree(in));
            log.info("Loaded {} operations from catalogue {}", registry.size(), resource.getDescription());
            return registry;
        } catch (IOException ex) {
            throw new CatalogueException("Failed to read catalogue %s: %s".formatted(resource, ex.getMessage()), ex);
        }
    }

    public OperationRegistry load(JsonNode document) {
        if (document == null || !document.path("paths").isObject()) {
            throw new CatalogueException("Catalogue document has no 'paths' object");
        }
        List<OperationDescriptor> descriptors = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> paths = document.get("paths").fields();
        while (paths.hasNext()) {
            Map.Entry<String, JsonNode> pathEntry = paths.next();
            String template = pathEntry.getKey();
            JsonNode pathItem = pathEntry.getValue();
            List<JsonNode> sharedParameters = elements(pathItem.path("parameters"));
            for (String method : METHODS) {
                JsonNode operation = pathItem.get(method);
                if (operation == null) {
                    continue;
                }
                descriptors.add(toDescriptor(template, method, operation, sharedParameters));
            }
        }
        return new OperationRegistry(descriptors);
    }

    private OperationDescriptor toDescriptor(String template, String method, JsonNode operation,
                                             List<JsonNode> sharedParameters) {
        String toolId = toolId(operation, method, template);
        try {
            List<ParameterSpec> parameters = new ArrayList<>();
            for (JsonNode parameter : sharedParameters) {
                parameters.add(toParameter(parameter));
            }
            for (JsonNode parameter : elements(operation.path("parameters"))) {
                parameters.add(toParameter(parameter));
            }
            return new OperationDescriptor(
                    toolId,
                    HttpMethod.valueOf(method.toUpperCase(Locale.ROOT)),
                    template,
                    parameters,
                    toBody(operation),
                    toPagination(operation.get("x-pagination")),
                    toAsyncTask(operation.get("x-async-task")),
                    responseKind(operation),
                    operation.hasNonNull("x-idempotent") ? operation.get("x-idempotent").asBoolean() : null,
                    description(operation));
        } catch (CatalogueException ex) {
            throw new CatalogueException("Invalid catalogue entry %s %s (%s): %s"
                    .formatted(method.toUpperCase(Locale.ROOT), template, toolId, ex.getMessage()), ex);
        }
    }

    private ParameterSpec toParameter(JsonNode node) {
        String name = text(node, "name");
        if (node.has("$ref")) {
            throw new CatalogueException("Parameter references are not supported: " + node.get("$ref").asText());
        }
        JsonNode schema = node.path("schema");
        List<String> allowed = new ArrayList<>();
        elements(schema.path("enum")).forEach(value -> allowed.add(value.asText()));
        return new ParameterSpec(
                name,
                ParameterLocation.fromString(text(node, "in")),
                node.path("required").asBoolean(false),
                ParameterType.fromSchema(text(schema, "type"), !allowed.isEmpty()),
                allowed,
                text(node, "description"));
    }

    private BodySpec toBody(JsonNode operation) {
        JsonNode requestBody = operation.get("requestBody");
        if (requestBody == null || requestBody.isNull()) {
            return null;
        }
        String mediaType = null;
        String schemaRef = null;
        Iterator<Map.Entry<String, JsonNode>> content = requestBody.path("content").fields();
        if (content.hasNext()) {
            Map.Entry<String, JsonNode> first = content.next();
            mediaType = first.getKey();
            schemaRef = text(first.getValue().path("schema"), "$ref");
        }
        return new BodySpec(text(operation, "x-body-argument"),
                requestBody.path("required").asBoolean(false),
                schemaRef,
                mediaType);
    }

    private PaginationSpec toPagination(JsonNode node) {
        if (node == null || node.isNull()) {
            return PaginationSpec.NONE;
        }
        return new PaginationSpec(
                PaginationMode.fromString(text(node, "mode")),
                text(node, "offsetParameter"),
                text(node, "limitParameter"),
                text(node, "itemsField"),
                text(node, "totalField"),
                text(node, "lastPageField"),
                text(node, "cursorParameter"),
                text(node, "cursorField"),
                node.path("defaultPageSize").asInt(0));
    }

    private AsyncTaskSpec toAsyncTask(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        Map<String, TaskState> statuses = new LinkedHashMap<>();
        node.path("statuses").fields()
                .forEachRemaining(entry -> statuses.put(entry.getKey(), TaskState.fromString(entry.getValue().asText())));
        return new AsyncTaskSpec(
                text(node, "statusTool"),
                text(node, "taskIdField"),
                text(node, "taskIdParameter"),
                text(node, "statusField"),
                statuses);
    }

    private ResponseKind responseKind(JsonNode operation) {
        if (operation.hasNonNull("x-response-kind")) {
            return ResponseKind.fromString(operation.get("x-response-kind").asText());
        }
        JsonNode responses = operation.path("responses");
        Iterator<Map.Entry<String, JsonNode>> entries = responses.fields();
        boolean sawSuccess = false;
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getKey().startsWith("2")) {
                continue;
            }
            sawSuccess = true;
            Iterator<String> mediaTypes = entry.getValue().path("content").fieldNames();
            if (mediaTypes.hasNext()) {
                String mediaType = mediaTypes.next().toLowerCase(Locale.ROOT);
                return mediaType.contains("json") ? ResponseKind.JSON : ResponseKind.BINARY;
            }
        }
        return sawSuccess ? ResponseKind.EMPTY : ResponseKind.JSON;
    }

    static String toolId(JsonNode operation, String method, String template) {
        String explicit = text(operation, "x-tool-name");
        if (StringUtils.hasText(explicit)) {
            return explicit.trim();
        }
        String operationId = text(operation, "operationId");
        if (!StringUtils.hasText(operationId)) {
            throw new CatalogueException("Operation %s %s has neither operationId nor x-tool-name"
                    .formatted(method.toUpperCase(Locale.ROOT), template));
        }
        return toSnakeCase(operationId.trim());
    }

    static String toSnakeCase(String camel) {
        StringBuilder builder = new StringBuilder(camel.length() + 8);
        char previous = 0;
        for (int i = 0; i < camel.length(); i++) {
            char current = camel.charAt(i);
            if (current == '-' || current == ' ' || current == '.') {
                current = '_';
            }
            if (Character.isUpperCase(current)) {
                boolean nextIsLower = i + 1 < camel.length() && Character.isLowerCase(camel.charAt(i + 1));
                if (builder.length() > 0 && previous != '_'
                        && (Character.isLowerCase(previous) || Character.isDigit(previous) || nextIsLower)) {
                    builder.append('_');
                }
                builder.append(Character.toLowerCase(current));
            } else {
                builder.append(current);
            }
            previous = current;
        }
        return builder.toString();
    }

    private static String description(JsonNode operation) {
        String summary = text(operation, "summary");
        return StringUtils.hasText(summary) ? summary : text(operation, "description");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> result = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(result::add);
        }
        return result;
    }
}
