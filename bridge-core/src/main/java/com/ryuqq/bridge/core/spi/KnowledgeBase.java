package com.ryuqq.bridge.core.spi;

import com.ryuqq.bridge.core.model.AddResourceResult;
import com.ryuqq.bridge.core.model.DirectoryEntry;
import com.ryuqq.bridge.core.model.SearchResult;
import com.ryuqq.bridge.core.model.SessionInfo;

import java.time.Duration;
import java.util.List;

/**
 * Knowledge base backend SPI.
 *
 * <p>Implementations are <strong>not</strong> required to be thread-safe. The bridge guarantees
 * that a backend instance is created, initialized, used and closed on a single worker thread,
 * and that at most one method runs at any instant.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * factory.create() ─► initialize() ─► search/find/read/... (serially) ─► close()
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Calls before {@link #initialize()} or after {@link #close()} must fail with
 *       {@link IllegalStateException}</li>
 *   <li>Any exception may be thrown from an operation; the bridge delivers it to the caller</li>
 *   <li>{@link #close()} must be safe to call more than once</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public interface KnowledgeBase extends AutoCloseable {

    /**
     * Prepares the backend. Called once, on the worker thread, before any operation.
     *
     * @throws Exception if the backend cannot be prepared
     */
    void initialize() throws Exception;

    /**
     * Semantic search over memories and resources.
     *
     * @param query search text
     * @param limit maximum number of hits per category (positive)
     * @return search result
     * @throws Exception backend failure
     */
    SearchResult search(String query, int limit) throws Exception;

    /**
     * Deep search. Same shape as {@link #search(String, int)}, wider matching.
     *
     * @param query search text
     * @param limit maximum number of resource hits (positive)
     * @return search result
     * @throws Exception backend failure
     */
    SearchResult find(String query, int limit) throws Exception;

    /**
     * Adds a local file as a resource.
     *
     * @param path local file path
     * @param waitForIndexing whether to block until the resource is searchable
     * @param timeout maximum indexing wait when {@code waitForIndexing} is true
     * @return add result
     * @throws Exception backend failure
     */
    AddResourceResult addResource(String path, boolean waitForIndexing, Duration timeout) throws Exception;

    /**
     * Lists the direct children of a directory uri.
     *
     * @param uri directory uri
     * @return entries, empty when the directory has no children
     * @throws Exception backend failure, including an unknown uri
     */
    List<DirectoryEntry> listDirectory(String uri) throws Exception;

    /**
     * Reads the full content of a resource.
     *
     * @param uri resource uri
     * @return content
     * @throws Exception backend failure, including an unknown uri
     */
    String read(String uri) throws Exception;

    /**
     * Returns the short abstract of a resource.
     *
     * @param uri resource uri
     * @return abstract text
     * @throws Exception backend failure, including an unknown uri
     */
    String abstractOf(String uri) throws Exception;

    /**
     * Lists known conversation sessions.
     *
     * @return sessions in backend order
     * @throws Exception backend failure
     */
    List<SessionInfo> listSessions() throws Exception;

    /**
     * Releases backend resources. Idempotent.
     */
    @Override
    void close();
}
