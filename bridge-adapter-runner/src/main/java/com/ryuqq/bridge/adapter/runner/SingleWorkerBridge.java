package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.application.bridge.Bridge;
import com.ryuqq.bridge.core.call.DispatchItem;
import com.ryuqq.bridge.core.call.Operation;
import com.ryuqq.bridge.core.call.PendingCall;
import com.ryuqq.bridge.core.exception.BackendOperationException;
import com.ryuqq.bridge.core.outcome.CallOutcome;
import com.ryuqq.bridge.core.outcome.Completed;
import com.ryuqq.bridge.core.outcome.Failed;
import com.ryuqq.bridge.core.outcome.NotReady;
import com.ryuqq.bridge.core.outcome.TimedOut;
import com.ryuqq.bridge.core.spi.DispatchQueue;
import com.ryuqq.bridge.core.spi.KnowledgeBaseFactory;
import com.ryuqq.bridge.core.statemachine.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 단일 워커 기반 Bridge 구현체.
 *
 * <p>호출자 스레드는 PendingCall을 큐에 넣고 즉시 반환합니다. 대기는 완료 신호의 사본에
 * {@code orTimeout}을 걸어 future 합성으로 처리하므로, 폴링하거나 스레드를 점유하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SingleWorkerBridge bridge = new SingleWorkerBridge(
 *     new LinkedDispatchQueue&lt;&gt;(), InMemoryKnowledgeBase::new, new WorkerConfig());
 * bridge.start();
 * bridge.awaitReady(Duration.ofSeconds(5));
 *
 * bridge.submit(Operation.of("read", kb -&gt; kb.read(uri)), Duration.ofSeconds(15))
 *     .thenAccept(outcome -&gt; ...);
 *
 * bridge.close(); // 큐에 남은 작업 처리 후 종료
 * </pre>
 *
 * <p><strong>완료 통지:</strong> 결과는 워커 스레드가 아닌 콜백 스레드 풀에서 호출자에게 전달됩니다.
 * 호출자의 후속 작업({@code thenApply}, {@code thenAccept} 등)이 느려도 워커와 다른 호출자에게 영향을 주지 않습니다.
 * 콜백 풀은 워커가 종료된 뒤 정리됩니다.</p>
 *
 * <p><strong>타임아웃 정책:</strong> 시간 초과된 호출은 큐에서 제거되지 않고 나중에 정확히 한 번
 * 실행되지만, 그 결과는 버려집니다.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class SingleWorkerBridge implements Bridge {

    private static final Logger log = LoggerFactory.getLogger(SingleWorkerBridge.class);

    private final DispatchQueue<DispatchItem> queue;
    private final WorkerLoop worker;
    private final ExecutorService callbackExecutor;
    private final Executor callbacks;

    /**
     * SingleWorkerBridge 생성자.
     *
     * @param queue 디스패치 큐
     * @param backendFactory 백엔드 팩토리 (워커 스레드에서 호출)
     * @param config 워커 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public SingleWorkerBridge(DispatchQueue<DispatchItem> queue, KnowledgeBaseFactory backendFactory, WorkerConfig config) {
        this.worker = new WorkerLoop(queue, backendFactory, config);
        this.queue = queue;
        this.callbackExecutor = Executors.newCachedThreadPool(callbackThreadFactory(config.threadName()));
        this.callbacks = this::dispatchCallback;
        this.worker.whenTerminated(callbackExecutor::shutdown);
    }

    /**
     * 워커 스레드 시작.
     *
     * @throws IllegalStateException 이미 시작했거나 종료된 경우
     */
    public void start() {
        worker.start();
    }

    /**
     * 백엔드 초기화 완료까지 대기 (부트스트랩/테스트 전용).
     *
     * @param timeout 최대 대기 시간
     * @return 준비 완료 시 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        return worker.awaitReady(timeout);
    }

    /**
     * 워커 종료까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 종료된 경우 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return worker.awaitTermination(timeout);
    }

    public WorkerState getState() {
        return worker.getState();
    }

    /**
     * @return 큐에서 대기 중인 항목 수 (진단용)
     */
    public int queueSize() {
        return queue.size();
    }

    @Override
    public <T> CompletableFuture<CallOutcome<T>> submit(Operation<T> operation, Duration timeout) {
        validateInput(operation, timeout);

        if (!worker.isReady()) {
            log.debug("Rejecting {}: knowledge base not ready (state={})", operation, worker.getState());
            return CompletableFuture.completedFuture(NotReady.of());
        }

        PendingCall<T> call = PendingCall.of(operation);
        queue.enqueue(call);

        return call.awaitable()
            .orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS)
            .handleAsync((value, error) -> toOutcome(call, timeout, value, error), callbacks);
    }

    @Override
    public boolean isReady() {
        return worker.isReady();
    }

    @Override
    public void close() {
        worker.requestStop();
    }

    /**
     * 워커 종료 후(콜백 풀 정리 후)에 도착한 타임아웃 통지는 완료 스레드에서 직접 실행합니다.
     */
    private void dispatchCallback(Runnable task) {
        try {
            callbackExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            task.run();
        }
    }

    private static ThreadFactory callbackThreadFactory(String workerThreadName) {
        AtomicInteger sequence = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, workerThreadName + "-callback-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void validateInput(Operation<?> operation, Duration timeout) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    private <T> CallOutcome<T> toOutcome(PendingCall<T> call, Duration timeout, T value, Throwable error) {
        if (error == null) {
            return Completed.of(value);
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String name = call.getOperation().name();
        if (cause instanceof TimeoutException) {
            log.warn("Call {} {} timed out after {}ms, result will be discarded",
                call.getCallId().getValue(), call.getOperation(), timeout.toMillis());
            return TimedOut.of(name, timeout);
        }
        if (cause instanceof BackendOperationException backendError) {
            return Failed.of(backendError);
        }
        return Failed.of(new BackendOperationException(name, cause));
    }
}
