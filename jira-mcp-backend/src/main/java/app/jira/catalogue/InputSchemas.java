package app.jira.catalogue;

import java.util.Locale;

import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the JSON schema that describes an operation's argument bag to tool clients.
 * Additional properties are rejected, mirroring the binder's strict mode.
 */
public final class InputSchemas {

    private InputSchemas() {
    }

    public static ObjectNode forOperation(ObjectMapper objectMapper, OperationDescriptor descriptor) {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = objectMapper.createArrayNode();

        for (ParameterSpec parameter : descriptor.parameters()) {
            ObjectNode property = properties.putObject(parameter.name());
            property.put("type", parameter.type().schemaType());
            if (parameter.type() == ParameterType.ARRAY) {
                property.putObject("items").put("type", "string");
            }
            if (parameter.type() == ParameterType.ENUM) {
                ArrayNode values = property.putArray("enum");
                parameter.allowedValues().forEach(values::add);
            }
            String description = StringUtils.hasText(parameter.description())
                    ? parameter.description()
                    : "%s parameter".formatted(parameter.location().name().toLowerCase(Locale.ROOT));
            property.put("description", description);
            if (parameter.required()) {
                required.add(parameter.name());
            }
        }

        BodySpec body = descriptor.body();
        if (body != null) {
            ObjectNode property = properties.putObject(body.argumentName());
            property.put("description", StringUtils.hasText(body.schemaRef())
                    ? "Request body (%s)".formatted(body.schemaRef())
                    : "Request body");
            if (body.required()) {
                required.add(body.argumentName());
            }
        }

        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        schema.put("additionalProperties", false);
        return schema;
    }
}
