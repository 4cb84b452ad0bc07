package app.jira.catalogue;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;

/**
 * Immutable metadata describing how to build and interpret one remote operation.
 *
 * @param toolId      unique tool name
 * @param method      HTTP method
 * @param pathTemplate path with {@code {name}} placeholders
 * @param parameters  declared parameters, in declaration order
 * @param body        body declaration, {@code null} when the operation takes none
 * @param pagination  paging behaviour, {@link PaginationSpec#NONE} for single-shot operations
 * @param asyncTask   task-following behaviour, {@code null} for synchronous operations
 * @param responseKind how successful bodies are decoded
 * @param idempotent  explicit idempotency marker, {@code null} to derive it from the method
 * @param description free text shown to tool clients
 */
public record OperationDescriptor(String toolId,
                                  HttpMethod method,
                                  String pathTemplate,
                                  List<ParameterSpec> parameters,
                                  BodySpec body,
                                  PaginationSpec pagination,
                                  AsyncTaskSpec asyncTask,
                                  ResponseKind responseKind,
                                  Boolean idempotent,
                                  String description) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");
    private static final Set<HttpMethod> SAFE_METHODS = Set.of(
            HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS, HttpMethod.PUT, HttpMethod.DELETE);

    public OperationDescriptor {
        if (!StringUtils.hasText(toolId)) {
            throw new CatalogueException("Operation tool id must not be blank");
        }
        if (method == null) {
            throw new CatalogueException("Operation '%s' has no HTTP method".formatted(toolId));
        }
        if (!StringUtils.hasText(pathTemplate) || !pathTemplate.startsWith("/")) {
            throw new CatalogueException("Operation '%s' needs an absolute path template".formatted(toolId));
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        pagination = pagination == null ? PaginationSpec.NONE : pagination;
        responseKind = responseKind == null ? ResponseKind.JSON : responseKind;
        validate(toolId, pathTemplate, parameters, body, pagination);
    }

    public Optional<BodySpec> bodySpec() {
        return Optional.ofNullable(body);
    }

    public Optional<AsyncTaskSpec> asyncTaskSpec() {
        return Optional.ofNullable(asyncTask);
    }

    public boolean isPaginated() {
        return pagination.isPaginated();
    }

    public boolean isAsync() {
        return asyncTask != null;
    }

    /**
     * Whether a request may be replayed after a transport failure without duplicating side effects.
     */
    public boolean isRetrySafe() {
        if (idempotent != null) {
            return idempotent;
        }
        return SAFE_METHODS.contains(method);
    }

    public Optional<ParameterSpec> parameter(String name, ParameterLocation location) {
        return parameters.stream()
                .filter(spec -> spec.location() == location && spec.name().equals(name))
                .findFirst();
    }

    public boolean declaresArgument(String name) {
        if (body != null && body.argumentName().equals(name)) {
            return true;
        }
        return parameters.stream().anyMatch(spec -> spec.name().equals(name));
    }

    static Set<String> placeholders(String pathTemplate) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(pathTemplate);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static void validate(String toolId,
                                 String pathTemplate,
                                 List<ParameterSpec> parameters,
                                 BodySpec body,
                                 PaginationSpec pagination) {
        Map<ParameterLocation, Set<String>> seen = new EnumMap<>(ParameterLocation.class);
        for (ParameterSpec spec : parameters) {
            if (!seen.computeIfAbsent(spec.location(), key -> new HashSet<>()).add(spec.name())) {
                throw new CatalogueException("Operation '%s' declares %s parameter '%s' twice"
                        .formatted(toolId, spec.location(), spec.name()));
            }
        }

        Set<String> placeholders = placeholders(pathTemplate);
        Set<String> pathParameters = seen.getOrDefault(ParameterLocation.PATH, Set.of());
        for (String placeholder : placeholders) {
            if (!pathParameters.contains(placeholder)) {
                throw new CatalogueException("Operation '%s' has placeholder {%s} without a path parameter"
                        .formatted(toolId, placeholder));
            }
        }
        for (String pathParameter : pathParameters) {
            if (!placeholders.contains(pathParameter)) {
                throw new CatalogueException("Operation '%s' declares path parameter '%s' missing from %s"
                        .formatted(toolId, pathParameter, pathTemplate));
            }
        }

        if (body != null && parameters.stream().anyMatch(spec -> spec.name().equals(body.argumentName()))) {
            throw new CatalogueException("Operation '%s' body argument '%s' collides with a parameter"
                    .formatted(toolId, body.argumentName()));
        }

        Set<String> queryParameters = seen.getOrDefault(ParameterLocation.QUERY, Set.of());
        switch (pagination.mode()) {
            case OFFSET_LIMIT -> {
                requireQuery(toolId, queryParameters, pagination.offsetParameter());
                requireQuery(toolId, queryParameters, pagination.limitParameter());
            }
            case CURSOR_TOKEN -> requireQuery(toolId, queryParameters, pagination.cursorParameter());
            default -> {
            }
        }
    }

    private static void requireQuery(String toolId, Set<String> queryParameters, String name) {
        if (!queryParameters.contains(name)) {
            throw new CatalogueException("Paginated operation '%s' does not declare query parameter '%s'"
                    .formatted(toolId, name));
        }
    }
}
