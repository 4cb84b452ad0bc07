package app.jira.dispatch;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.util.CollectionUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriUtils;

import com.fasterxml.jackson.databind.JsonNode;

import app.jira.catalogue.OperationDescriptor;
import app.jira.catalogue.ParameterLocation;
import app.jira.catalogue.ParameterSpec;

/**
 * Ready-to-send request derived from a descriptor and an argument bag.
 * <p>
 * {@code path} is already percent-encoded; query values are kept raw, in declaration order,
 * and encoded once by {@link #relativeUri()}.
 */
public record BoundRequest(OperationDescriptor operation,
                           HttpMethod method,
                           String path,
                           MultiValueMap<String, String> queryParams,
                           HttpHeaders headers,
                           JsonNode body) {

    public BoundRequest {
        queryParams = CollectionUtils.unmodifiableMultiValueMap(new LinkedMultiValueMap<>(queryParams));
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(headers);
        headers = HttpHeaders.readOnlyHttpHeaders(copy);
    }

    public String relativeUri() {
        if (queryParams.isEmpty()) {
            return path;
        }
        StringBuilder builder = new StringBuilder(path).append('?');
        boolean first = true;
        for (Map.Entry<String, List<String>> entry : queryParams.entrySet()) {
            for (String value : entry.getValue()) {
                if (!first) {
                    builder.append('&');
                }
                builder.append(encode(entry.getKey())).append('=').append(encode(value));
                first = false;
            }
        }
        return builder.toString();
    }

    public String queryParam(String name) {
        return queryParams.getFirst(name);
    }

    /**
     * Copy with one query parameter replaced, used when advancing a page cursor.
     */
    public BoundRequest withQueryParam(String name, String value) {
        LinkedMultiValueMap<String, String> updated = new LinkedMultiValueMap<>(queryParams);
        if (value == null) {
            updated.remove(name);
        } else {
            updated.put(name, List.of(value));
        }
        LinkedMultiValueMap<String, String> ordered = new LinkedMultiValueMap<>();
        operation.parameters().stream()
                .filter(spec -> spec.location() == ParameterLocation.QUERY)
                .map(ParameterSpec::name)
                .filter(updated::containsKey)
                .forEach(key -> ordered.put(key, updated.get(key)));
        updated.forEach(ordered::putIfAbsent);
        return new BoundRequest(operation, method, path, ordered, headers, body);
    }

    public boolean hasBody() {
        return body != null;
    }

    // '+' is legal in a query but decoded as a space by most servers
    private static String encode(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8).replace("+", "%2B");
    }
}
