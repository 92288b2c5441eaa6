package com.ryuqq.bridge.adapter.http.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;

/**
 * Shared Jackson mapper for HTTP bodies.
 *
 * <p>Unknown request fields are ignored and null response fields are omitted.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private JsonSupport() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName() + " to JSON", e);
        }
    }

    /**
     * @throws MalformedBodyException if the body is empty or not valid JSON for {@code type}
     */
    public static <T> T read(InputStream body, Class<T> type) throws IOException {
        try {
            T value = MAPPER.readValue(body, type);
            if (value == null) {
                throw new MalformedBodyException("Request body is required");
            }
            return value;
        } catch (com.fasterxml.jackson.core.JsonParseException
                 | com.fasterxml.jackson.databind.exc.MismatchedInputException e) {
            throw new MalformedBodyException("Invalid JSON body: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Request body could not be parsed.
     */
    public static final class MalformedBodyException extends IOException {

        public MalformedBodyException(String message) {
            super(message);
        }

        public MalformedBodyException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
