package com.ryuqq.bridge.adapter.http.json;

/**
 * Request and response bodies of the knowledge routes.
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class KnowledgeMessages {

    private KnowledgeMessages() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Body of {@code POST /search} and {@code POST /find}. {@code limit} defaults to 5.
     */
    public record SearchRequest(String query, Integer limit) {

        public static final int DEFAULT_LIMIT = 5;

        public int limitOrDefault() {
            return limit == null ? DEFAULT_LIMIT : limit;
        }
    }

    /**
     * Body of {@code POST /add}.
     */
    public record AddRequest(String path) {
    }

    /**
     * Body of {@code POST /augment}. {@code limit} defaults to 3.
     */
    public record AugmentRequest(String message, Integer limit) {

        public static final int DEFAULT_LIMIT = 3;

        public int limitOrDefault() {
            return limit == null ? DEFAULT_LIMIT : limit;
        }
    }

    public record ResultResponse(String result) {
    }

    public record ErrorResponse(String error) {
    }

    /**
     * {@code ready} and {@code message} are omitted when null.
     */
    public record StatusResponse(String status, Boolean ready, String message) {

        public static StatusResponse ok() {
            return new StatusResponse("ok", Boolean.TRUE, null);
        }

        public static StatusResponse disabled(String message) {
            return new StatusResponse("disabled", null, message);
        }
    }
}
