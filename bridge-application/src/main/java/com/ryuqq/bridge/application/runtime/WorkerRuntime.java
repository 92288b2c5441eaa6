package com.ryuqq.bridge.application.runtime;

import com.ryuqq.bridge.core.statemachine.WorkerState;

import java.time.Duration;

/**
 * Dedicated worker that owns the backend and drains the dispatch queue.
 *
 * <p><strong>Runtime Flow:</strong></p>
 * <pre>
 * start()
 *   ↓
 * worker thread:
 *   1. Create + initialize backend (READY or INIT_FAILED)
 *   2. while (true):
 *        item = queue.dequeue(pollTimeout)
 *        - empty    → continue
 *        - Sentinel → break
 *        - call     → RUNNING, execute, complete/fail, READY
 *   3. Close backend, STOPPED
 * </pre>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>At most one operation runs against the backend at any instant</li>
 *   <li>Calls are served in the order they were enqueued</li>
 *   <li>Each dequeued call is completed exactly once</li>
 *   <li>A failing call never stops the loop</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public interface WorkerRuntime {

    /**
     * Launches the worker thread.
     *
     * @throws IllegalStateException if already started
     */
    void start();

    /**
     * @return true once the backend is initialized and until the worker stops
     */
    boolean isReady();

    /**
     * @return current lifecycle state
     */
    WorkerState getState();

    /**
     * Blocks until the backend is initialized, initialization fails or the timeout elapses.
     *
     * <p>For bootstrap code and tests. Request paths use {@link #isReady()}.</p>
     *
     * @param timeout maximum wait
     * @return true if the worker is ready
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitReady(Duration timeout) throws InterruptedException;

    /**
     * Enqueues the shutdown sentinel. Idempotent.
     */
    void requestStop();

    /**
     * Waits for the worker thread to exit.
     *
     * @param timeout maximum wait
     * @return true if the worker has stopped
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;
}
