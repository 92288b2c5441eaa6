package com.ryuqq.bridge.adapter.inmemory.queue;

import com.ryuqq.bridge.core.spi.DispatchQueue;

import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link DispatchQueue} backed by {@link LinkedBlockingQueue}.
 *
 * <p><strong>Characteristics:</strong></p>
 * <ul>
 *   <li><strong>enqueue:</strong> O(1), never blocks (unbounded capacity)</li>
 *   <li><strong>dequeue:</strong> blocks the consumer up to the given timeout</li>
 *   <li><strong>ordering:</strong> strict FIFO across all producers</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * DispatchQueue&lt;DispatchItem&gt; queue = new LinkedDispatchQueue&lt;&gt;();
 *
 * // any thread
 * queue.enqueue(pendingCall);
 *
 * // worker thread only
 * Optional&lt;DispatchItem&gt; next = queue.dequeue(60, TimeUnit.SECONDS);
 * </pre>
 *
 * @param <E> element type
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class LinkedDispatchQueue<E> implements DispatchQueue<E> {

    private final LinkedBlockingQueue<E> queue;

    public LinkedDispatchQueue() {
        this.queue = new LinkedBlockingQueue<>();
    }

    @Override
    public void enqueue(E item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        // 무제한 큐이므로 offer는 항상 성공
        queue.offer(item);
    }

    @Override
    public Optional<E> dequeue(long timeout, TimeUnit unit) throws InterruptedException {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout cannot be negative, but was: " + timeout);
        }
        return Optional.ofNullable(queue.poll(timeout, unit));
    }

    @Override
    public int size() {
        return queue.size();
    }

    /**
     * Removes all waiting items (for testing purposes).
     */
    public void clear() {
        queue.clear();
    }
}
