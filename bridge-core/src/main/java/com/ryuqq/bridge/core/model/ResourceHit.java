package com.ryuqq.bridge.core.model;

/**
 * A resource matched by a search.
 *
 * <p>Only {@code uri} is guaranteed by the backend. {@code title}, {@code abstractText} and
 * {@code content} are {@code null} when the backend did not provide them; callers use the
 * accessor helpers below instead of checking each field.</p>
 *
 * @param uri resource URI (required)
 * @param title display title (optional)
 * @param abstractText short abstract (optional)
 * @param content matched content (optional)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record ResourceHit(
    String uri,
    String title,
    String abstractText,
    String content
) {

    public ResourceHit {
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
    }

    public static ResourceHit of(String uri, String content) {
        return new ResourceHit(uri, null, null, content);
    }

    /**
     * Content when present and non-empty, otherwise the abstract, otherwise an empty string.
     *
     * @return text to display for this hit
     */
    public String contentOrAbstract() {
        if (content != null && !content.isEmpty()) {
            return content;
        }
        return abstractText == null ? "" : abstractText;
    }

    /**
     * Title when present, otherwise the URI.
     *
     * @return label for this hit
     */
    public String titleOrUri() {
        return title == null ? uri : title;
    }
}
