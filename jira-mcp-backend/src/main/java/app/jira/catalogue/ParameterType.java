package app.jira.catalogue;

import java.util.Locale;

/**
 * Primitive types a parameter value is coerced to before it is placed on the request.
 */
public enum ParameterType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ENUM("string"),
    ARRAY("array");

    private final String schemaType;

    ParameterType(String schemaType) {
        this.schemaType = schemaType;
    }

    /**
     * JSON schema type name used when the parameter is described to tool clients.
     */
    public String schemaType() {
        return schemaType;
    }

    public static ParameterType fromSchema(String type, boolean hasEnum) {
        if (type == null || type.isBlank()) {
            return hasEnum ? ENUM : STRING;
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "string" -> hasEnum ? ENUM : STRING;
            case "integer" -> INTEGER;
            case "number" -> NUMBER;
            case "boolean" -> BOOLEAN;
            case "array" -> ARRAY;
            default -> throw new CatalogueException("Unsupported parameter type '%s'".formatted(type));
        };
    }
}
