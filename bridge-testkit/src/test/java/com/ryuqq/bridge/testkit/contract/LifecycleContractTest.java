package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.core.call.PendingCall;
import com.ryuqq.bridge.core.model.SearchResult;
import com.ryuqq.bridge.core.outcome.CallOutcome;
import com.ryuqq.bridge.core.outcome.NotReady;
import com.ryuqq.bridge.core.statemachine.WorkerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Worker Lifecycle.
 *
 * <p>Validates readiness gating, initialization failure, and shutdown draining.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Before start: NotReady, nothing queued, backend untouched</li>
 *   <li>Initialization failure: never ready, NotReady for callers</li>
 *   <li>Close: calls queued before the stop signal drain, backend closed on the worker</li>
 *   <li>Items queued after the stop signal is consumed are never executed</li>
 *   <li>After close: NotReady, worker not reactivated</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
class LifecycleContractTest extends AbstractContractTest {

    @Test
    void testLifecycle_BeforeStart_NotReadyWithoutQueueing() {
        // When
        CallOutcome<SearchResult> outcome = await(bridge.submit(search("early"), DEFAULT_TIMEOUT));

        // Then
        assertTrue(outcome.isNotReady(), "Expected not-ready outcome but was " + outcome);
        assertEquals(NotReady.DEFAULT_REASON, ((NotReady<SearchResult>) outcome).reason());
        assertEquals(0, bridge.queueSize());
        assertFalse(backend.isInitialized());
        assertTrue(backend.getStarted().isEmpty());
    }

    @Test
    void testLifecycle_InitializationFails_NeverReady() throws InterruptedException {
        // Given
        backend.failInitialization("data directory unreadable");

        // When
        bridge.start();
        boolean ready = bridge.awaitReady(Duration.ofSeconds(2));

        // Then
        assertFalse(ready);
        assertEquals(WorkerState.INIT_FAILED, bridge.getState());
        assertTrue(await(bridge.submit(search("q"), DEFAULT_TIMEOUT)).isNotReady());
        assertTrue(backend.getStarted().isEmpty());
    }

    @Test
    void testLifecycle_Close_DrainsQueuedCallsThenClosesBackendOnWorker() throws InterruptedException {
        // Given
        backend.delay("first", 100);
        startBridge();
        List<CompletableFuture<CallOutcome<SearchResult>>> futures = new ArrayList<>();
        futures.add(bridge.submit(search("first"), DEFAULT_TIMEOUT));
        futures.add(bridge.submit(search("second"), DEFAULT_TIMEOUT));
        futures.add(bridge.submit(search("third"), DEFAULT_TIMEOUT));

        // When
        bridge.close();

        // Then: no new work is accepted, but queued work drains
        assertFalse(bridge.isReady());
        assertTrue(await(bridge.submit(search("late"), DEFAULT_TIMEOUT)).isNotReady());
        for (CompletableFuture<CallOutcome<SearchResult>> future : futures) {
            assertTrue(await(future).isCompleted());
        }
        assertTrue(bridge.awaitTermination(DEFAULT_TIMEOUT));
        assertEquals(List.of("first", "second", "third"), backend.getCompleted());
        assertTrue(backend.isClosed());
        assertEquals("knowledge-worker", backend.getClosingThread());
        assertEquals(WorkerState.STOPPED, bridge.getState());
    }

    @Test
    void testLifecycle_ItemAfterConsumedStopSignal_NeverExecuted() throws InterruptedException {
        // Given
        startBridge();
        bridge.close();
        assertTrue(bridge.awaitTermination(DEFAULT_TIMEOUT));

        // When: an item reaches the queue behind the already-consumed stop signal
        PendingCall<SearchResult> stray = PendingCall.of(search("stray"));
        queue.enqueue(stray);
        sleep(POLL_TIMEOUT_MS * 3);

        // Then
        assertFalse(stray.isCompleted());
        assertEquals(1, queue.size());
        assertTrue(backend.getStarted().isEmpty());
    }

    @Test
    void testLifecycle_StartAfterClose_Rejected() throws InterruptedException {
        // Given
        startBridge();
        bridge.close();
        assertTrue(bridge.awaitTermination(DEFAULT_TIMEOUT));

        // When & Then
        assertThrows(IllegalStateException.class, () -> bridge.start());
        assertFalse(bridge.isReady());
    }

    @Test
    void testLifecycle_CloseIsIdempotent() throws InterruptedException {
        // Given
        startBridge();

        // When
        bridge.close();
        bridge.close();

        // Then
        assertTrue(bridge.awaitTermination(DEFAULT_TIMEOUT));
        assertEquals(WorkerState.STOPPED, bridge.getState());
    }
}
