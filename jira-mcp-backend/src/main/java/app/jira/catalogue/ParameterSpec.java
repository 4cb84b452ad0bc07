package app.jira.catalogue;

import java.util.List;

import org.springframework.util.StringUtils;

/**
 * A single declared parameter of an operation.
 *
 * @param name          argument name, also the wire name
 * @param location      where the value goes on the request
 * @param required      whether the caller must supply it
 * @param type          primitive type the value is coerced to
 * @param allowedValues permitted values for {@link ParameterType#ENUM}, empty otherwise
 * @param description   free text shown to tool clients, may be {@code null}
 */
public record ParameterSpec(String name,
                            ParameterLocation location,
                            boolean required,
                            ParameterType type,
                            List<String> allowedValues,
                            String description) {

    public ParameterSpec {
        if (!StringUtils.hasText(name)) {
            throw new CatalogueException("Parameter name must not be blank");
        }
        if (location == null || type == null) {
            throw new CatalogueException("Parameter '%s' needs a location and a type".formatted(name));
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (type == ParameterType.ENUM && allowedValues.isEmpty()) {
            throw new CatalogueException("Enum parameter '%s' declares no values".formatted(name));
        }
        // path segments can never be omitted
        if (location == ParameterLocation.PATH) {
            required = true;
        }
    }

    public static ParameterSpec path(String name) {
        return new ParameterSpec(name, ParameterLocation.PATH, true, ParameterType.STRING, List.of(), null);
    }

    public static ParameterSpec query(String name, ParameterType type, boolean required) {
        return new ParameterSpec(name, ParameterLocation.QUERY, required, type, List.of(), null);
    }

    public static ParameterSpec header(String name, boolean required) {
        return new ParameterSpec(name, ParameterLocation.HEADER, required, ParameterType.STRING, List.of(), null);
    }
}
