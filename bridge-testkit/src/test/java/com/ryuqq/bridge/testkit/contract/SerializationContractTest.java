package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.core.model.SearchResult;
import com.ryuqq.bridge.core.outcome.CallOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Serialized Execution.
 *
 * <p>Validates that the backend only ever runs one call at a time, on the worker thread,
 * in submission order, regardless of how many callers submit concurrently.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Concurrent submissions from many threads never overlap</li>
 *   <li>Submissions from one caller execute in FIFO order</li>
 *   <li>A slow call submitted first finishes before a fast call submitted second</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
class SerializationContractTest extends AbstractContractTest {

    private static final int CALLERS = 10;
    private static final int CALLS_PER_CALLER = 5;

    @Test
    void testSerialization_ConcurrentCallers_NeverOverlap() throws Exception {
        // Given
        for (int caller = 0; caller < CALLERS; caller++) {
            for (int call = 0; call < CALLS_PER_CALLER; call++) {
                backend.delay(key(caller, call), 2);
            }
        }
        startBridge();
        ExecutorService callers = Executors.newFixedThreadPool(CALLERS);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<List<CallOutcome<SearchResult>>>> futures = new ArrayList<>();

        // When: all callers submit at once
        for (int caller = 0; caller < CALLERS; caller++) {
            int callerId = caller;
            futures.add(callers.submit(() -> {
                startLatch.await();
                List<CompletableFuture<CallOutcome<SearchResult>>> pending = new ArrayList<>();
                for (int call = 0; call < CALLS_PER_CALLER; call++) {
                    pending.add(bridge.submit(search(key(callerId, call)), DEFAULT_TIMEOUT));
                }
                List<CallOutcome<SearchResult>> outcomes = new ArrayList<>();
                for (CompletableFuture<CallOutcome<SearchResult>> future : pending) {
                    outcomes.add(await(future));
                }
                return outcomes;
            }));
        }
        startLatch.countDown();
        callers.shutdown();
        assertTrue(callers.awaitTermination(30, TimeUnit.SECONDS), "Callers should finish");

        // Then: every call completed with its own result, one at a time, on the worker thread
        for (int caller = 0; caller < CALLERS; caller++) {
            List<CallOutcome<SearchResult>> outcomes = futures.get(caller).get();
            for (int call = 0; call < CALLS_PER_CALLER; call++) {
                CallOutcome<SearchResult> outcome = outcomes.get(call);
                assertTrue(outcome.isCompleted(), "Expected completed outcome but was " + outcome);
                assertEquals("memory for " + key(caller, call),
                    outcome.orElse(null).memories().get(0).content());
            }
        }
        assertEquals(CALLERS * CALLS_PER_CALLER, backend.getCompleted().size());
        for (int caller = 0; caller < CALLERS; caller++) {
            String prefix = "caller-" + caller + "-";
            List<String> expected = new ArrayList<>();
            for (int call = 0; call < CALLS_PER_CALLER; call++) {
                expected.add(key(caller, call));
            }
            assertEquals(expected, backend.getStarted().stream().filter(k -> k.startsWith(prefix)).collect(Collectors.toList()),
                "Each caller's calls must run in the order it submitted them");
        }
        assertEquals(1, backend.getMaxConcurrency(), "Backend calls must never overlap");
        assertEquals(Set.of("knowledge-worker"), backend.getExecutingThreads());
    }

    @Test
    void testSerialization_SingleCaller_ExecutesInSubmissionOrder() {
        // Given
        startBridge();
        List<String> keys = new ArrayList<>();
        List<CompletableFuture<CallOutcome<SearchResult>>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < 20; i++) {
            String key = "q-" + i;
            keys.add(key);
            futures.add(bridge.submit(search(key), DEFAULT_TIMEOUT));
        }
        futures.forEach(this::await);

        // Then
        assertEquals(keys, backend.getStarted());
        assertEquals(keys, backend.getCompleted());
    }

    @Test
    void testSerialization_SlowThenFast_SlowFinishesFirst() {
        // Given
        backend.delay("A", 50).delay("B", 10);
        startBridge();

        // When
        CompletableFuture<CallOutcome<SearchResult>> first = bridge.submit(search("A"), DEFAULT_TIMEOUT);
        CompletableFuture<CallOutcome<SearchResult>> second = bridge.submit(search("B"), DEFAULT_TIMEOUT);
        CallOutcome<SearchResult> outcomeB = await(second);
        CallOutcome<SearchResult> outcomeA = await(first);

        // Then: A ran to completion before B started, each caller got its own result
        assertEquals(List.of("A", "B"), backend.getStarted());
        assertEquals(List.of("A", "B"), backend.getCompleted());
        assertEquals("memory for A", outcomeA.orElse(null).memories().get(0).content());
        assertEquals("memory for B", outcomeB.orElse(null).memories().get(0).content());
    }

    private static String key(int caller, int call) {
        return "caller-" + caller + "-call-" + call;
    }
}
