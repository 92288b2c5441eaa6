package com.ryuqq.bridge.core.spi;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * FIFO hand-off between many producers and a single consumer.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: {@link #enqueue(Object)} is callable from any thread</li>
 *   <li>Unbounded: {@link #enqueue(Object)} never blocks</li>
 *   <li>FIFO: items are dequeued in the order they were enqueued</li>
 *   <li>Exactly-once: each item is dequeued at most once</li>
 * </ul>
 *
 * @param <E> element type
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public interface DispatchQueue<E> {

    /**
     * Appends an item. Never blocks.
     *
     * @param item item to append
     * @throws IllegalArgumentException if item is null
     */
    void enqueue(E item);

    /**
     * Removes the head, waiting up to the given time for one to arrive.
     *
     * @param timeout maximum wait
     * @param unit unit of {@code timeout}
     * @return the head item, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<E> dequeue(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * @return number of items currently waiting
     */
    int size();
}
