package app.jira.catalogue;

import java.util.Locale;

/**
 * How a successful response body is decoded.
 */
public enum ResponseKind {
    JSON,
    BINARY,
    EMPTY;

    public static ResponseKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return JSON;
        }
        try {
            return ResponseKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new CatalogueException("Unsupported response kind '%s'".formatted(raw), ex);
        }
    }
}
