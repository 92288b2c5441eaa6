package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.application.runtime.WorkerRuntime;
import com.ryuqq.bridge.core.call.DispatchItem;
import com.ryuqq.bridge.core.call.Operation;
import com.ryuqq.bridge.core.call.PendingCall;
import com.ryuqq.bridge.core.call.Sentinel;
import com.ryuqq.bridge.core.exception.BackendInitializationException;
import com.ryuqq.bridge.core.exception.BackendOperationException;
import com.ryuqq.bridge.core.spi.DispatchQueue;
import com.ryuqq.bridge.core.spi.KnowledgeBase;
import com.ryuqq.bridge.core.spi.KnowledgeBaseFactory;
import com.ryuqq.bridge.core.statemachine.WorkerState;
import com.ryuqq.bridge.core.statemachine.WorkerTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 전용 워커 스레드 기반 WorkerRuntime 구현체.
 *
 * <p>백엔드를 생성/초기화/사용/종료하는 모든 작업을 하나의 스레드에서 수행합니다.
 * 백엔드 핸들은 워커 스레드의 지역 변수로만 존재하며 외부로 노출되지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>백엔드 생성 및 initialize() (성공 → READY, 실패 → INIT_FAILED)</li>
 *   <li>큐에서 항목을 꺼냄 (최대 pollTimeoutMs 대기)</li>
 *   <li>Sentinel → 루프 종료</li>
 *   <li>PendingCall → RUNNING, 작업 실행, complete/fail, READY</li>
 *   <li>종료 시 백엔드 close (오류는 WARN 로그만)</li>
 * </ol>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>작업 오류 → BackendOperationException으로 감싸 호출자에게 전달, 루프는 계속</li>
 *   <li>초기화 실패 후 꺼낸 호출 → BackendInitializationException으로 실패 처리</li>
 *   <li>루프 자체 오류 → ERROR 로그 후 계속</li>
 *   <li>큐 대기 중 인터럽트 → 종료 요청으로 간주</li>
 *   <li>작업이 던진 InterruptedException 또는 남긴 인터럽트 플래그 → 해당 호출의 실패로만 처리, 플래그는 지움</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class WorkerLoop implements WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final DispatchQueue<DispatchItem> queue;
    private final KnowledgeBaseFactory backendFactory;
    private final WorkerConfig config;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch initialized = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private volatile WorkerState state = WorkerState.UNINITIALIZED;
    private volatile boolean ready;

    /**
     * WorkerLoop 생성자.
     *
     * @param queue 디스패치 큐 (이 워커가 유일한 소비자)
     * @param backendFactory 워커 스레드에서 호출될 백엔드 팩토리
     * @param config 워커 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public WorkerLoop(DispatchQueue<DispatchItem> queue, KnowledgeBaseFactory backendFactory, WorkerConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (backendFactory == null) {
            throw new IllegalArgumentException("backendFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = queue;
        this.backendFactory = backendFactory;
        this.config = config;
    }

    @Override
    public void start() {
        if (stopRequested.get()) {
            throw new IllegalStateException("Worker already stopped");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker already started");
        }
        Thread thread = new Thread(this::run, config.threadName());
        thread.setDaemon(config.daemon());
        thread.start();
        log.info("Worker thread {} started (pollTimeoutMs={})", config.threadName(), config.pollTimeoutMs());
    }

    @Override
    public boolean isReady() {
        return ready && state.isServing();
    }

    @Override
    public WorkerState getState() {
        return state;
    }

    @Override
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        return initialized.await(timeout.toMillis(), TimeUnit.MILLISECONDS) && ready;
    }

    @Override
    public void requestStop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        ready = false;
        queue.enqueue(Sentinel.INSTANCE);
        log.info("Stop requested for worker {} ({} items ahead of sentinel)", config.threadName(), queue.size() - 1);
        if (!started.get()) {
            termination.complete(null);
        }
    }

    /**
     * 워커 종료 후 실행할 작업 등록. 이미 종료됐거나 시작 전에 정지 요청된 경우 즉시 실행됩니다.
     *
     * @param action 종료 후 작업
     */
    void whenTerminated(Runnable action) {
        termination.thenRun(action);
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (!started.get()) {
            return true;
        }
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 워커 스레드 본문.
     */
    private void run() {
        KnowledgeBase backend = null;
        Exception initFailure = null;
        try {
            try {
                backend = createBackend();
                moveTo(WorkerState.READY);
                ready = true;
                // requestStop과 경합한 경우 준비 상태를 되돌림
                if (stopRequested.get()) {
                    ready = false;
                }
                log.info("Knowledge base initialized on {}", Thread.currentThread().getName());
            } catch (Exception e) {
                initFailure = e;
                moveTo(WorkerState.INIT_FAILED);
                log.error("Knowledge base initialization failed, queued calls will be failed", e);
            } finally {
                initialized.countDown();
            }

            drain(backend, initFailure);
        } finally {
            ready = false;
            closeBackend(backend);
            if (!state.isTerminal()) {
                moveTo(WorkerState.STOPPED);
            }
            terminated.countDown();
            log.info("Worker thread {} stopped", Thread.currentThread().getName());
            termination.complete(null);
        }
    }

    private KnowledgeBase createBackend() throws Exception {
        KnowledgeBase backend = backendFactory.create();
        if (backend == null) {
            throw new IllegalStateException("backendFactory returned null");
        }
        try {
            backend.initialize();
        } catch (Exception e) {
            closeBackend(backend);
            throw e;
        }
        return backend;
    }

    private void drain(KnowledgeBase backend, Exception initFailure) {
        while (true) {
            Optional<DispatchItem> next;
            try {
                next = queue.dequeue(config.pollTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Worker interrupted, stopping with {} items left in queue", queue.size());
                return;
            } catch (RuntimeException e) {
                log.error("Dequeue failed, continuing", e);
                continue;
            }

            if (next.isEmpty()) {
                log.debug("No calls within {}ms, waiting again", config.pollTimeoutMs());
                continue;
            }

            DispatchItem item = next.get();
            if (item instanceof Sentinel) {
                log.info("Sentinel received, stopping worker");
                return;
            }

            PendingCall<?> call = (PendingCall<?>) item;
            try {
                process(call, backend, initFailure);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                log.error("Worker loop fault while handling {}", call, t);
            }
        }
    }

    /**
     * PendingCall 하나를 처리. 결과 또는 오류를 정확히 한 번 기록합니다.
     */
    private <T> void process(PendingCall<T> call, KnowledgeBase backend, Exception initFailure) {
        Operation<T> operation = call.getOperation();
        if (backend == null) {
            call.fail(new BackendInitializationException(operation.name(), initFailure));
            return;
        }

        moveTo(WorkerState.RUNNING);
        long startNanos = System.nanoTime();
        try {
            T result = operation.function().apply(backend);
            call.complete(result);
            log.debug("Call {} {} completed in {}ms (queued {}ms)", call.getCallId().getValue(), operation,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos),
                Math.max(0, System.currentTimeMillis() - call.getSubmittedAt()));
        } catch (Throwable t) {
            log.error("Call {} {} failed", call.getCallId().getValue(), operation, t);
            call.fail(new BackendOperationException(operation.name(), t));
            if (t instanceof VirtualMachineError) {
                throw (VirtualMachineError) t;
            }
        } finally {
            // 작업이 남긴 인터럽트 플래그가 다음 dequeue를 종료 신호로 만들지 않도록 지움
            if (Thread.interrupted()) {
                log.warn("Call {} {} left the worker interrupted, flag cleared", call.getCallId().getValue(), operation);
            }
            moveTo(WorkerState.READY);
        }
    }

    private void closeBackend(KnowledgeBase backend) {
        if (backend == null) {
            return;
        }
        try {
            backend.close();
        } catch (Exception e) {
            log.warn("Closing knowledge base failed", e);
        }
    }

    private void moveTo(WorkerState next) {
        state = WorkerTransition.transition(state, next);
    }
}
