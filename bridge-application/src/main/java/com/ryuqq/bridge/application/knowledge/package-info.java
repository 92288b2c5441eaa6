/**
 * Knowledge operations on top of the bridge.
 *
 * <ul>
 *   <li>{@link com.ryuqq.bridge.application.knowledge.KnowledgeService} - port used by HTTP routes and integrations</li>
 *   <li>{@link com.ryuqq.bridge.application.knowledge.DefaultKnowledgeService} - per-operation timeouts and degraded values</li>
 *   <li>{@link com.ryuqq.bridge.application.knowledge.ResultFormatter} - display text for backend results</li>
 *   <li>{@link com.ryuqq.bridge.application.knowledge.ContextAugmenter} - prompt augmentation</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.bridge.application.knowledge;
