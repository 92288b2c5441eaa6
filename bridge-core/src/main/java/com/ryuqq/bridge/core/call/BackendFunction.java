package com.ryuqq.bridge.core.call;

import com.ryuqq.bridge.core.spi.KnowledgeBase;

/**
 * Unit of backend work.
 *
 * <p>The backend handle is passed in by the worker, so implementations never hold a reference
 * to it outside of {@link #apply(KnowledgeBase)}.</p>
 *
 * @param <T> result type
 *
 * @author Bridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BackendFunction<T> {

    /**
     * Runs the work against the backend. Called only from the worker thread.
     *
     * @param backend initialized backend handle
     * @return result of the work (may be null)
     * @throws Exception any failure raised by the backend
     */
    T apply(KnowledgeBase backend) throws Exception;
}
