package com.ryuqq.bridge.core.model;

/**
 * A memory entry matched by a search.
 *
 * @param content memory text (required, may be empty)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record MemoryHit(String content) {

    public MemoryHit {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    public static MemoryHit of(String content) {
        return new MemoryHit(content);
    }
}
