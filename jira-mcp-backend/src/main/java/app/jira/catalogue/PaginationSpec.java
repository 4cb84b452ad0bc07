package app.jira.catalogue;

import org.springframework.util.StringUtils;

/**
 * Describes how an operation pages through its results.
 * <p>
 * Offset/limit operations advance {@code offsetParameter} by the page size and read items from
 * {@code itemsField}; cursor operations send {@code cursorParameter} with the token read from
 * {@code cursorField}. Field names that a response does not carry are simply ignored.
 */
public record PaginationSpec(PaginationMode mode,
                             String offsetParameter,
                             String limitParameter,
                             String itemsField,
                             String totalField,
                             String lastPageField,
                             String cursorParameter,
                             String cursorField,
                             int defaultPageSize) {

    public static final PaginationSpec NONE =
            new PaginationSpec(PaginationMode.NONE, null, null, null, null, null, null, null, 0);

    public static final String DEFAULT_OFFSET_PARAMETER = "startAt";
    public static final String DEFAULT_LIMIT_PARAMETER = "maxResults";
    public static final String DEFAULT_ITEMS_FIELD = "values";
    public static final String DEFAULT_TOTAL_FIELD = "total";
    public static final String DEFAULT_LAST_PAGE_FIELD = "isLast";
    public static final String DEFAULT_CURSOR_PARAMETER = "nextPageToken";
    public static final String DEFAULT_CURSOR_FIELD = "nextPageToken";
    public static final int DEFAULT_PAGE_SIZE = 50;

    public PaginationSpec {
        mode = mode == null ? PaginationMode.NONE : mode;
        if (mode != PaginationMode.NONE) {
            offsetParameter = orDefault(offsetParameter, DEFAULT_OFFSET_PARAMETER);
            limitParameter = orDefault(limitParameter, DEFAULT_LIMIT_PARAMETER);
            itemsField = orDefault(itemsField, DEFAULT_ITEMS_FIELD);
            totalField = orDefault(totalField, DEFAULT_TOTAL_FIELD);
            lastPageField = orDefault(lastPageField, DEFAULT_LAST_PAGE_FIELD);
            cursorParameter = orDefault(cursorParameter, DEFAULT_CURSOR_PARAMETER);
            cursorField = orDefault(cursorField, DEFAULT_CURSOR_FIELD);
            if (defaultPageSize <= 0) {
                defaultPageSize = DEFAULT_PAGE_SIZE;
            }
        }
    }

    public static PaginationSpec offset(String itemsField) {
        return new PaginationSpec(PaginationMode.OFFSET_LIMIT, null, null, itemsField, null, null, null, null, 0);
    }

    public static PaginationSpec cursor(String itemsField) {
        return new PaginationSpec(PaginationMode.CURSOR_TOKEN, null, null, itemsField, null, null, null, null, 0);
    }

    public boolean isPaginated() {
        return mode != PaginationMode.NONE;
    }

    private static String orDefault(String value, String fallback) {
        return StringUtils.hasText(value) ? value.trim() : fallback;
    }
}
