package com.ryuqq.bridge.core.model;

/**
 * A conversation session known to the backend.
 *
 * @param sessionId session identifier (required)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record SessionInfo(String sessionId) {

    public SessionInfo {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
    }

    public static SessionInfo of(String sessionId) {
        return new SessionInfo(sessionId);
    }
}
