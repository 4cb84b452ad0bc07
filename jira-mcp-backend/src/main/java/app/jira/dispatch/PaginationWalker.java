package app.jira.dispatch;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

import app.jira.catalogue.OperationDescriptor;
import app.jira.catalogue.PaginationMode;
import app.jira.catalogue.PaginationSpec;
import app.jira.catalogue.ParameterLocation;
import app.jira.dispatch.result.Failure;
import app.jira.dispatch.result.ResultBody;
import app.jira.dispatch.result.Success;
import app.jira.dispatch.result.ToolResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Walks paginated operations one page at a time.
 * <p>
 * Pages are fetched strictly in sequence and only on demand. A failed page is emitted as the
 * last element and ends the walk; pages already emitted stay valid.
 */
@Component
@Slf4j
public class PaginationWalker {

    private final RequestExecutor executor;
    private final ResponseNormalizer normalizer;

    public PaginationWalker(RequestExecutor executor, ResponseNormalizer normalizer) {
        this.executor = executor;
        this.normalizer = normalizer;
    }

    /**
     * @param pageLimit maximum number of pages to fetch, {@code null} for no limit
     */
    public Flux<ToolResult> paginate(OperationDescriptor descriptor, BoundRequest template, Integer pageLimit) {
        PaginationSpec spec = descriptor.pagination();
        if (!spec.isPaginated()) {
            return fetch(template).flux();
        }
        return Flux.defer(() -> {
            Walk walk = new Walk(descriptor, spec, pageLimit);
            BoundRequest first = walk.firstRequest(template);
            return fetchStep(walk, first)
                    .expand(step -> step.next() == null ? Mono.empty() : fetchStep(walk, step.next()))
                    .concatMapIterable(Step::results);
        });
    }

    private Mono<Step> fetchStep(Walk walk, BoundRequest request) {
        return fetch(request).map(result -> walk.advance(request, result));
    }

    private Mono<ToolResult> fetch(BoundRequest request) {
        return executor.execute(request)
                .map(raw -> normalizer.normalize(raw, request.operation()))
                .onErrorResume(TransportException.class, ex -> Mono.just(normalizer.transportFailure(ex)));
    }

    /**
     * Items of one page: the configured items field, or the body itself when it is an array.
     */
    public static List<JsonNode> items(ToolResult page, PaginationSpec spec) {
        List<JsonNode> items = new ArrayList<>();
        JsonNode array = itemsNode(page, spec);
        if (array != null) {
            array.forEach(items::add);
        }
        return items;
    }

    private static JsonNode itemsNode(ToolResult page, PaginationSpec spec) {
        if (!(page instanceof Success success) || !(success.body() instanceof ResultBody.JsonBody json)) {
            return null;
        }
        JsonNode body = json.json();
        if (body.isArray()) {
            return body;
        }
        JsonNode items = JsonFields.at(body, spec.itemsField());
        return items.isArray() ? items : null;
    }

    private record Step(List<ToolResult> results, BoundRequest next) {
    }

    /**
     * Per-walk state; touched only from the sequential {@code expand} chain.
     */
    private static final class Walk {

        private final OperationDescriptor descriptor;
        private final PaginationSpec spec;
        private final Integer pageLimit;
        private final Set<String> seenTokens = new HashSet<>();
        private int pages;

        private Walk(OperationDescriptor descriptor, PaginationSpec spec, Integer pageLimit) {
            this.descriptor = descriptor;
            this.spec = spec;
            this.pageLimit = pageLimit;
        }

        BoundRequest firstRequest(BoundRequest template) {
            BoundRequest request = template;
            if (request.queryParam(spec.limitParameter()) == null
                    && descriptor.parameter(spec.limitParameter(), ParameterLocation.QUERY).isPresent()) {
                request = request.withQueryParam(spec.limitParameter(), String.valueOf(spec.defaultPageSize()));
            }
            if (spec.mode() == PaginationMode.CURSOR_TOKEN) {
                String initial = request.queryParam(spec.cursorParameter());
                if (initial != null) {
                    seenTokens.add(initial);
                }
            }
            return request;
        }

        Step advance(BoundRequest request, ToolResult result) {
            pages++;
            if (!(result instanceof Success success)) {
                log.warn("Page {} of {} failed, ending walk", pages, descriptor.toolId());
                return new Step(List.of(result), null);
            }
            if (pageLimit != null && pages >= pageLimit) {
                return new Step(List.of(result), null);
            }
            if (spec.mode() == PaginationMode.CURSOR_TOKEN) {
                return nextByCursor(request, success);
            }
            return nextByOffset(request, success);
        }

        private Step nextByOffset(BoundRequest request, Success page) {
            JsonNode body = page.body() instanceof ResultBody.JsonBody json ? json.json() : null;
            JsonNode itemsNode = itemsNode(page, spec);
            if (body == null || itemsNode == null) {
                return new Step(List.of(page), null);
            }
            int count = itemsNode.size();
            if (count == 0 || JsonFields.at(body, spec.lastPageField()).asBoolean(false)) {
                return new Step(List.of(page), null);
            }
            long requested = parse(request.queryParam(spec.offsetParameter()), 0);
            long reported = number(body, spec.offsetParameter(), requested);
            if (reported < requested) {
                log.warn("Offset of {} went back from {} to {} after {} pages", descriptor.toolId(),
                        requested, reported, pages);
                return new Step(List.of(page, Failure.stalled(
                        "Pagination of '%s' stalled: requested offset %d but the service answered offset %d"
                                .formatted(descriptor.toolId(), requested, reported))), null);
            }
            long pageSize = number(body, spec.limitParameter(),
                    parse(request.queryParam(spec.limitParameter()), spec.defaultPageSize()));
            if (count < pageSize) {
                return new Step(List.of(page), null);
            }
            long nextOffset = reported + count;
            JsonNode total = JsonFields.at(body, spec.totalField());
            if (total.isNumber() && nextOffset >= total.asLong()) {
                return new Step(List.of(page), null);
            }
            return new Step(List.of(page), request.withQueryParam(spec.offsetParameter(), String.valueOf(nextOffset)));
        }

        private Step nextByCursor(BoundRequest request, Success page) {
            JsonNode body = page.body() instanceof ResultBody.JsonBody json ? json.json() : null;
            String token = JsonFields.text(body, spec.cursorField());
            if (token == null || JsonFields.at(body, spec.lastPageField()).asBoolean(false)) {
                return new Step(List.of(page), null);
            }
            if (!seenTokens.add(token)) {
                log.warn("Cursor of {} did not advance after {} pages", descriptor.toolId(), pages);
                return new Step(List.of(page, Failure.stalled(
                        "Pagination of '%s' stalled: cursor '%s' was returned twice".formatted(descriptor.toolId(), token))),
                        null);
            }
            return new Step(List.of(page), request.withQueryParam(spec.cursorParameter(), token));
        }

        private static long number(JsonNode body, String field, long fallback) {
            JsonNode value = JsonFields.at(body, field);
            return value.canConvertToLong() && value.isNumber() ? value.asLong() : fallback;
        }

        private static long parse(String value, long fallback) {
            if (value == null) {
                return fallback;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException ex) {
                return fallback;
            }
        }
    }
}
