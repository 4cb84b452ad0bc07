package app.jira.catalogue;

import org.springframework.util.StringUtils;

/**
 * Request body declaration. The body is taken from a single argument and passed through
 * structurally; the remote service validates its shape.
 *
 * @param argumentName argument bag key holding the body
 * @param required     whether the body must be supplied
 * @param schemaRef    schema reference from the catalogue, informational only
 * @param mediaType    content type the body is sent with
 */
public record BodySpec(String argumentName, boolean required, String schemaRef, String mediaType) {

    public static final String DEFAULT_ARGUMENT = "body";
    public static final String DEFAULT_MEDIA_TYPE = "application/json";

    public BodySpec {
        argumentName = StringUtils.hasText(argumentName) ? argumentName.trim() : DEFAULT_ARGUMENT;
        mediaType = StringUtils.hasText(mediaType) ? mediaType.trim() : DEFAULT_MEDIA_TYPE;
    }

    public static BodySpec json(boolean required) {
        return new BodySpec(DEFAULT_ARGUMENT, required, null, DEFAULT_MEDIA_TYPE);
    }
}
