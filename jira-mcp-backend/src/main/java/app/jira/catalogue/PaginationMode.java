package app.jira.catalogue;

import java.util.Locale;

public enum PaginationMode {
    NONE,
    OFFSET_LIMIT,
    CURSOR_TOKEN;

    public static PaginationMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "offset", "offset_limit", "offset-limit" -> OFFSET_LIMIT;
            case "cursor", "cursor_token", "cursor-token", "token" -> CURSOR_TOKEN;
            default -> throw new CatalogueException("Unsupported pagination mode '%s'".formatted(raw));
        };
    }
}
