package com.ryuqq.bridge.core.model;

import java.util.List;

/**
 * Result of a backend {@code search} or {@code find}.
 *
 * <p>Null lists are normalized to empty lists, so consumers never need to check for
 * missing fields.</p>
 *
 * @param total total number of matches reported by the backend (0 or more)
 * @param memories matched memories (never null)
 * @param resources matched resources (never null)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record SearchResult(
    int total,
    List<MemoryHit> memories,
    List<ResourceHit> resources
) {

    public SearchResult {
        if (total < 0) {
            throw new IllegalArgumentException("total must be non-negative (current: " + total + ")");
        }
        memories = memories == null ? List.of() : List.copyOf(memories);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public static SearchResult empty() {
        return new SearchResult(0, List.of(), List.of());
    }

    public boolean isEmpty() {
        return memories.isEmpty() && resources.isEmpty();
    }
}
