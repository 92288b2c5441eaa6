package com.ryuqq.bridge.core.spi;

/**
 * Creates the backend on the worker thread.
 *
 * <p>The worker calls {@link #create()} lazily, then {@link KnowledgeBase#initialize()}.
 * Both may throw; the worker then enters its init-failed state.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface KnowledgeBaseFactory {

    /**
     * @return a new, uninitialized backend
     * @throws Exception if the backend cannot be constructed
     */
    KnowledgeBase create() throws Exception;
}
