package com.ryuqq.bridge.core.call;

/**
 * Poison item that asks the worker to stop.
 *
 * <p>Once consumed, the worker exits and processes no further items. Because the queue is FIFO,
 * every call enqueued before the sentinel is still served.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public enum Sentinel implements DispatchItem {
    INSTANCE
}
