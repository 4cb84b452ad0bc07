package app.jira.dispatch.result;

import java.util.Arrays;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded payload of a successful response.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ResultBody.JsonBody.class, name = "json"),
        @JsonSubTypes.Type(value = ResultBody.BinaryBody.class, name = "binary"),
        @JsonSubTypes.Type(value = ResultBody.EmptyBody.class, name = "empty")
})
public sealed interface ResultBody permits ResultBody.JsonBody, ResultBody.BinaryBody, ResultBody.EmptyBody {

    record JsonBody(JsonNode json) implements ResultBody {
    }

    /**
     * Opaque bytes (attachments, avatars) with the content type the service declared.
     */
    record BinaryBody(byte[] bytes, String contentType) implements ResultBody {

        public BinaryBody {
            bytes = bytes == null ? new byte[0] : bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        public int size() {
            return bytes.length;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof BinaryBody that
                    && Arrays.equals(bytes, that.bytes)
                    && Objects.equals(contentType, that.contentType);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(bytes) + Objects.hashCode(contentType);
        }

        @Override
        public String toString() {
            return "BinaryBody[size=" + bytes.length + ", contentType=" + contentType + "]";
        }
    }

    /**
     * Marker for successful responses that carry no payload (204 and friends).
     */
    record EmptyBody() implements ResultBody {

        public static final EmptyBody INSTANCE = new EmptyBody();
    }
}
