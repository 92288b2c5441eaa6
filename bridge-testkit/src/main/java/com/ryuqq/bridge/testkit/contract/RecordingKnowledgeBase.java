package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.core.model.AddResourceResult;
import com.ryuqq.bridge.core.model.DirectoryEntry;
import com.ryuqq.bridge.core.model.MemoryHit;
import com.ryuqq.bridge.core.model.SearchResult;
import com.ryuqq.bridge.core.model.SessionInfo;
import com.ryuqq.bridge.core.spi.KnowledgeBase;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Instrumented {@link KnowledgeBase} for contract tests.
 *
 * <p>Every backend call is keyed by its first argument (query, path or uri; the method name
 * for argument-less calls). The recorder tracks:</p>
 * <ul>
 *   <li>start order of calls ({@link #getStarted()})</li>
 *   <li>completion order, recorded after any scripted latency ({@link #getCompleted()})</li>
 *   <li>maximum number of calls in flight at once ({@link #getMaxConcurrency()})</li>
 *   <li>names of the threads that executed calls ({@link #getExecutingThreads()})</li>
 * </ul>
 *
 * <p>Latency and failures are scripted per key with {@link #delay(String, long)} and
 * {@link #failOn(String, String)}. State is safe to read from the test thread while the
 * worker is writing it.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public class RecordingKnowledgeBase implements KnowledgeBase {

    private final List<String> started = new CopyOnWriteArrayList<>();
    private final List<String> completed = new CopyOnWriteArrayList<>();
    private final Set<String> executingThreads = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> latencies = new ConcurrentHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxConcurrency = new AtomicInteger();

    private volatile String initializationFailure;
    private volatile boolean initialized;
    private volatile boolean closed;
    private volatile String closingThread;

    /**
     * Makes every call keyed {@code key} sleep for {@code millis} before returning.
     */
    public RecordingKnowledgeBase delay(String key, long millis) {
        latencies.put(key, millis);
        return this;
    }

    /**
     * Makes every call keyed {@code key} throw {@link IllegalStateException} with {@code message}.
     */
    public RecordingKnowledgeBase failOn(String key, String message) {
        failures.put(key, message);
        return this;
    }

    /**
     * Makes {@link #initialize()} throw {@link IllegalStateException} with {@code message}.
     */
    public RecordingKnowledgeBase failInitialization(String message) {
        this.initializationFailure = message;
        return this;
    }

    @Override
    public void initialize() {
        executingThreads.add(Thread.currentThread().getName());
        if (initializationFailure != null) {
            throw new IllegalStateException(initializationFailure);
        }
        initialized = true;
    }

    @Override
    public SearchResult search(String query, int limit) throws InterruptedException {
        record(query);
        return new SearchResult(1, List.of(MemoryHit.of("memory for " + query)), List.of());
    }

    @Override
    public SearchResult find(String query, int limit) throws InterruptedException {
        record(query);
        return new SearchResult(1, List.of(MemoryHit.of("found " + query)), List.of());
    }

    @Override
    public AddResourceResult addResource(String path, boolean waitForIndexing, Duration timeout)
            throws InterruptedException {
        record(path);
        return AddResourceResult.success("success", "viking://resources/" + path);
    }

    @Override
    public List<DirectoryEntry> listDirectory(String uri) throws InterruptedException {
        record(uri);
        return List.of();
    }

    @Override
    public String read(String uri) throws InterruptedException {
        record(uri);
        return "content of " + uri;
    }

    @Override
    public String abstractOf(String uri) throws InterruptedException {
        record(uri);
        return "abstract of " + uri;
    }

    @Override
    public List<SessionInfo> listSessions() throws InterruptedException {
        record("listSessions");
        return List.of();
    }

    @Override
    public void close() {
        closed = true;
        closingThread = Thread.currentThread().getName();
    }

    public List<String> getStarted() {
        return new ArrayList<>(started);
    }

    public List<String> getCompleted() {
        return new ArrayList<>(completed);
    }

    public int getMaxConcurrency() {
        return maxConcurrency.get();
    }

    public Set<String> getExecutingThreads() {
        return Set.copyOf(executingThreads);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getClosingThread() {
        return closingThread;
    }

    private void record(String key) throws InterruptedException {
        executingThreads.add(Thread.currentThread().getName());
        started.add(key);
        maxConcurrency.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            Long latency = latencies.get(key);
            if (latency != null) {
                Thread.sleep(latency);
            }
            String failure = failures.get(key);
            if (failure != null) {
                throw new IllegalStateException(failure);
            }
            completed.add(key);
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
