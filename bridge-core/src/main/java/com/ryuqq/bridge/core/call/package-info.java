/**
 * Call model: what callers submit and what the worker consumes.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.core.call.Operation} - immutable unit of work (name, args, backend function)</li>
 *   <li>{@link com.ryuqq.bridge.core.call.BackendFunction} - function receiving the worker-owned backend handle</li>
 *   <li>{@link com.ryuqq.bridge.core.call.PendingCall} - write-once handle for one in-flight operation</li>
 *   <li>{@link com.ryuqq.bridge.core.call.Sentinel} - poison item requesting worker shutdown</li>
 *   <li>{@link com.ryuqq.bridge.core.call.DispatchItem} - sealed queue element type</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * <pre>
 * Bridge (submit) ── creates ──► PendingCall ── enqueue ──► DispatchQueue
 *                                                              │
 *                                     Worker ◄── dequeue ──────┘
 *                                       │
 *                                       └── complete(result) / fail(error)  (exactly once)
 * </pre>
 *
 * @since 1.0.0
 * @author Bridge Team
 */
package com.ryuqq.bridge.core.call;
