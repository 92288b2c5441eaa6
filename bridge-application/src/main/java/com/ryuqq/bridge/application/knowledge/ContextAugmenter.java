package com.ryuqq.bridge.application.knowledge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Prepends knowledge base context to a user message.
 *
 * <p>Falls back to the original message whenever no context is available.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class ContextAugmenter {

    private static final Logger log = LoggerFactory.getLogger(ContextAugmenter.class);

    static final String CONTEXT_HEADER = "[The following context was retrieved from the knowledge base for reference]";
    static final String CONTEXT_FOOTER = "[End of context]";

    private final KnowledgeService knowledgeService;

    public ContextAugmenter(KnowledgeService knowledgeService) {
        if (knowledgeService == null) {
            throw new IllegalArgumentException("knowledgeService cannot be null");
        }
        this.knowledgeService = knowledgeService;
    }

    public CompletableFuture<String> augment(String message) {
        return augment(message, KnowledgeService.DEFAULT_CONTEXT_LIMIT);
    }

    /**
     * @param message user message
     * @param limit maximum hits to retrieve (positive)
     * @return augmented message, or {@code message} unchanged when there is no context
     */
    public CompletableFuture<String> augment(String message, int limit) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (!knowledgeService.isReady()) {
            return CompletableFuture.completedFuture(message);
        }
        return knowledgeService.retrieveContext(message, limit)
            .thenApply(context -> wrap(context, message))
            .exceptionally(e -> {
                log.warn("Context retrieval failed, using original message", e);
                return message;
            });
    }

    private static String wrap(String context, String message) {
        if (context == null || context.isEmpty()) {
            return message;
        }
        return CONTEXT_HEADER + "\n" + context + "\n" + CONTEXT_FOOTER + "\n\n" + message;
    }
}
