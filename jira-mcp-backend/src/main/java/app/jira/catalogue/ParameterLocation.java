package app.jira.catalogue;

import java.util.Locale;

/**
 * Where a bound parameter value is placed on the outgoing request.
 */
public enum ParameterLocation {
    PATH,
    QUERY,
    HEADER;

    public static ParameterLocation fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new CatalogueException("Parameter location must not be blank");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "path" -> PATH;
            case "query" -> QUERY;
            case "header" -> HEADER;
            default -> throw new CatalogueException("Unsupported parameter location '%s'".formatted(raw));
        };
    }
}
