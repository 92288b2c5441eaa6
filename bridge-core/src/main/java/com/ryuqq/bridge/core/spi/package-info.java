/**
 * Service Provider Interfaces for the knowledge bridge.
 *
 * <h2>SPI Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.core.spi.KnowledgeBase} - non-thread-safe knowledge base backend</li>
 *   <li>{@link com.ryuqq.bridge.core.spi.KnowledgeBaseFactory} - creates the backend on the worker thread</li>
 *   <li>{@link com.ryuqq.bridge.core.spi.DispatchQueue} - multi-producer, single-consumer FIFO</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>{@code DispatchQueue} implementations must be thread-safe. {@code KnowledgeBase}
 * implementations need not be: the bridge confines every backend call to one worker thread.</p>
 *
 * @since 1.0.0
 * @author Bridge Team
 */
package com.ryuqq.bridge.core.spi;
