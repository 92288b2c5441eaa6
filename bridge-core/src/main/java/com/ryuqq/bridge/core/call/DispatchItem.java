package com.ryuqq.bridge.core.call;

/**
 * Element of the dispatch queue: either a real call or the shutdown sentinel.
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public sealed interface DispatchItem permits PendingCall, Sentinel {
}
