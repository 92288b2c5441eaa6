package com.ryuqq.bridge.core.model;

import java.util.List;

/**
 * Result of a backend {@code addResource}.
 *
 * @param status backend status text (required)
 * @param errors errors reported during ingestion (never null, empty on success)
 * @param rootUri URI of the ingested resource (optional)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record AddResourceResult(
    String status,
    List<String> errors,
    String rootUri
) {

    public AddResourceResult {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status cannot be null or blank");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static AddResourceResult success(String status, String rootUri) {
        return new AddResourceResult(status, List.of(), rootUri);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
