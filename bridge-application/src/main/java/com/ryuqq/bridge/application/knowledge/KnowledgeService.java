package com.ryuqq.bridge.application.knowledge;

import java.util.concurrent.CompletableFuture;

/**
 * Knowledge base operations exposed to asynchronous callers.
 *
 * <p>Every method returns a future that always completes normally with display text.
 * Timeouts, backend failures and a not-ready bridge are reported as text, never as an
 * exceptional completion. Argument errors (null text, non-positive limit) are thrown
 * immediately as {@link IllegalArgumentException}.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public interface KnowledgeService {

    int DEFAULT_SEARCH_LIMIT = 5;
    int DEFAULT_FIND_LIMIT = 10;
    int DEFAULT_CONTEXT_LIMIT = 3;
    String DEFAULT_DIRECTORY_URI = "viking://resources/";
    String NOT_READY_MESSAGE = "Knowledge base not initialized";

    /**
     * @return true if calls will reach the backend
     */
    boolean isReady();

    default CompletableFuture<String> search(String query) {
        return search(query, DEFAULT_SEARCH_LIMIT);
    }

    /**
     * Semantic search over memories and resources.
     *
     * @param query search text
     * @param limit maximum hits (positive)
     * @return formatted hits, or a degraded message
     */
    CompletableFuture<String> search(String query, int limit);

    default CompletableFuture<String> find(String query) {
        return find(query, DEFAULT_FIND_LIMIT);
    }

    /**
     * Deep search.
     *
     * @param query search text
     * @param limit maximum hits (positive)
     * @return formatted hits, or a degraded message
     */
    CompletableFuture<String> find(String query, int limit);

    /**
     * Adds a local file and waits for it to be indexed.
     *
     * @param path local file path
     * @return confirmation, or a degraded message
     */
    CompletableFuture<String> addResource(String path);

    default CompletableFuture<String> listDirectory() {
        return listDirectory(DEFAULT_DIRECTORY_URI);
    }

    /**
     * @param uri directory uri
     * @return one line per child, or a degraded message
     */
    CompletableFuture<String> listDirectory(String uri);

    /**
     * @param uri resource uri
     * @return content (truncated), or a degraded message
     */
    CompletableFuture<String> read(String uri);

    /**
     * @param uri resource uri
     * @return abstract, or a degraded message
     */
    CompletableFuture<String> abstractOf(String uri);

    /**
     * @return session list, or a degraded message
     */
    CompletableFuture<String> listSessions();

    default CompletableFuture<String> retrieveContext(String query) {
        return retrieveContext(query, DEFAULT_CONTEXT_LIMIT);
    }

    /**
     * Retrieves context for prompt augmentation.
     *
     * @param query search text
     * @param limit maximum hits requested from the backend (positive)
     * @return context text, or an empty string when nothing is available
     */
    CompletableFuture<String> retrieveContext(String query, int limit);
}
