package app.jira.dispatch;

import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Field lookup by dotted path ({@code "progress.status"}) on decoded response bodies.
 */
final class JsonFields {

    private JsonFields() {
    }

    static JsonNode at(JsonNode root, String path) {
        if (root == null || !StringUtils.hasText(path)) {
            return MissingNode.getInstance();
        }
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            current = current.path(segment);
        }
        return current;
    }

    static String text(JsonNode root, String path) {
        JsonNode value = at(root, path);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return StringUtils.hasText(text) ? text : null;
    }
}
