package app.jira.dispatch;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.jira.catalogue.BodySpec;
import app.jira.catalogue.OperationDescriptor;
import app.jira.catalogue.ParameterSpec;
import app.jira.catalogue.ParameterType;
import app.jira.dispatch.result.FailureReason;

/**
 * Partitions a loosely typed argument bag into path, query, header and body parts.
 * <p>
 * Binding is strict: every key must match a declared parameter or the body argument, every
 * required parameter must be present, and every value must coerce to its declared type.
 * The body is passed through structurally.
 */
@Component
public class ParameterBinder {

    private final ObjectMapper objectMapper;

    public ParameterBinder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ValidationException when the arguments do not fit {@code descriptor}
     */
    public BoundRequest bind(OperationDescriptor descriptor, Map<String, ?> arguments) {
        Map<String, ?> args = arguments == null ? Map.of() : arguments;

        for (String key : args.keySet()) {
            if (!descriptor.declaresArgument(key)) {
                throw new ValidationException(FailureReason.UNKNOWN_PARAMETER, key,
                        "Unknown parameter '%s' for tool '%s'".formatted(key, descriptor.toolId()));
            }
        }

        String path = descriptor.pathTemplate();
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        HttpHeaders headers = new HttpHeaders();

        for (ParameterSpec spec : descriptor.parameters()) {
            Object raw = args.get(spec.name());
            if (raw == null) {
                if (spec.required()) {
                    throw new ValidationException(FailureReason.MISSING_REQUIRED, spec.name(),
                            "Missing required %s parameter '%s' for tool '%s'".formatted(
                                    spec.location().name().toLowerCase(Locale.ROOT), spec.name(), descriptor.toolId()));
                }
                continue;
            }
            List<String> values = coerce(spec, raw);
            switch (spec.location()) {
                case PATH -> path = path.replace("{" + spec.name() + "}",
                        UriUtils.encodePathSegment(single(spec, values), StandardCharsets.UTF_8));
                case QUERY -> query.put(spec.name(), values);
                case HEADER -> headers.put(spec.name(), values);
            }
        }

        return new BoundRequest(descriptor, descriptor.method(), path, query, headers, bindBody(descriptor, args));
    }

    private JsonNode bindBody(OperationDescriptor descriptor, Map<String, ?> args) {
        BodySpec body = descriptor.body();
        if (body == null) {
            return null;
        }
        Object raw = args.get(body.argumentName());
        if (raw == null) {
            if (body.required()) {
                throw new ValidationException(FailureReason.MISSING_REQUIRED, body.argumentName(),
                        "Missing required body '%s' for tool '%s'".formatted(body.argumentName(), descriptor.toolId()));
            }
            return null;
        }
        if (raw instanceof JsonNode node) {
            return node;
        }
        try {
            return objectMapper.valueToTree(raw);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(FailureReason.WRONG_TYPE, body.argumentName(),
                    "Body '%s' for tool '%s' cannot be serialized: %s".formatted(
                            body.argumentName(), descriptor.toolId(), ex.getMessage()));
        }
    }

    List<String> coerce(ParameterSpec spec, Object raw) {
        Object value = raw instanceof JsonNode node ? unwrap(node) : raw;
        if (spec.type() == ParameterType.ARRAY) {
            List<String> values = new ArrayList<>();
            if (value instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element != null) {
                        values.add(scalar(spec, element instanceof JsonNode node ? unwrap(node) : element));
                    }
                }
            } else if (value instanceof Object[] array) {
                for (Object element : array) {
                    if (element != null) {
                        values.add(scalar(spec, element));
                    }
                }
            } else {
                values.add(scalar(spec, value));
            }
            return values;
        }
        if (value instanceof Collection<?> || value instanceof Map<?, ?> || value instanceof Object[]) {
            throw wrongType(spec, raw);
        }
        return List.of(switch (spec.type()) {
            case INTEGER -> integer(spec, value);
            case NUMBER -> number(spec, value);
            case BOOLEAN -> bool(spec, value);
            case ENUM -> enumValue(spec, value);
            default -> scalar(spec, value);
        });
    }

    private String integer(ParameterSpec spec, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        try {
            BigDecimal decimal = value instanceof Number number
                    ? new BigDecimal(number.toString())
                    : new BigDecimal(value.toString().trim());
            return decimal.toBigIntegerExact().toString();
        } catch (NumberFormatException | ArithmeticException ex) {
            throw wrongType(spec, value);
        }
    }

    private String number(ParameterSpec spec, Object value) {
        try {
            BigDecimal decimal = value instanceof Number number
                    ? new BigDecimal(number.toString())
                    : new BigDecimal(value.toString().trim());
            return decimal.stripTrailingZeros().toPlainString();
        } catch (NumberFormatException ex) {
            throw wrongType(spec, value);
        }
    }

    private String bool(ParameterSpec spec, Object value) {
        if (value instanceof Boolean bool) {
            return bool.toString();
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("false")) {
                return normalized;
            }
        }
        throw wrongType(spec, value);
    }

    private String enumValue(ParameterSpec spec, Object value) {
        String text = scalar(spec, value);
        if (!spec.allowedValues().contains(text)) {
            throw new ValidationException(FailureReason.WRONG_TYPE, spec.name(),
                    "Parameter '%s' must be one of %s but was '%s'".formatted(spec.name(), spec.allowedValues(), text));
        }
        return text;
    }

    private String scalar(ParameterSpec spec, Object value) {
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || value instanceof Enum<?>) {
            return value.toString();
        }
        throw wrongType(spec, value);
    }

    private static String single(ParameterSpec spec, List<String> values) {
        if (values.size() != 1 || values.get(0).isEmpty()) {
            throw new ValidationException(FailureReason.WRONG_TYPE, spec.name(),
                    "Path parameter '%s' needs exactly one non-empty value".formatted(spec.name()));
        }
        return values.get(0);
    }

    private static Object unwrap(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isArray()) {
            List<Object> elements = new ArrayList<>();
            node.forEach(elements::add);
            return elements;
        }
        return node;
    }

    private static ValidationException wrongType(ParameterSpec spec, Object value) {
        return new ValidationException(FailureReason.WRONG_TYPE, spec.name(),
                "Parameter '%s' expects %s but got %s".formatted(spec.name(),
                        spec.type().name().toLowerCase(Locale.ROOT), value == null ? "null" : value.getClass().getSimpleName()));
    }
}
