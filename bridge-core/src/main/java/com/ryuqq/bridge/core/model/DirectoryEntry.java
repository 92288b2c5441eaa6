package com.ryuqq.bridge.core.model;

/**
 * One entry of a backend directory listing.
 *
 * @param name entry name (required)
 * @param directory whether the entry is a directory
 * @param size size in bytes (0 or more)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record DirectoryEntry(
    String name,
    boolean directory,
    long size
) {

    public DirectoryEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative (current: " + size + ")");
        }
    }
}
