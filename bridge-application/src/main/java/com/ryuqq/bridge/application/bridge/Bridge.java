package com.ryuqq.bridge.application.bridge;

import com.ryuqq.bridge.core.call.Operation;
import com.ryuqq.bridge.core.outcome.CallOutcome;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 비동기 호출자와 단일 스레드 백엔드 사이의 실행 조정자.
 *
 * <p>제출된 Operation은 큐에 들어가 전용 워커 스레드에서 제출 순서대로 하나씩 실행됩니다.
 * 호출자는 스레드를 점유하지 않고 결과 future를 기다립니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Operation&lt;SearchResult&gt; op = Operation.of("search", backend -&gt; backend.search("java", 5));
 * bridge.submit(op, Duration.ofSeconds(15))
 *     .thenAccept(outcome -&gt; {
 *         if (outcome instanceof Completed&lt;SearchResult&gt; completed) {
 *             render(completed.value());
 *         }
 *     });
 * </pre>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public interface Bridge extends AutoCloseable {

    /**
     * Operation을 제출하고 결과 future 반환.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>준비되지 않은 경우 → 즉시 {@code NotReady} (큐에 넣지 않음)</li>
     *   <li>PendingCall 생성 후 큐에 추가</li>
     *   <li>완료 시 → {@code Completed} 또는 {@code Failed}</li>
     *   <li>timeout 초과 시 → {@code TimedOut} (작업은 큐에 남아 나중에 한 번 실행됨)</li>
     * </ol>
     *
     * <p>반환된 future는 예외로 완료되지 않습니다.</p>
     *
     * @param operation 실행할 작업
     * @param timeout 호출자 대기 시간 (양수)
     * @param <T> 결과 타입
     * @return 결과 future
     * @throws IllegalArgumentException operation 또는 timeout이 null이거나 timeout이 양수가 아닌 경우
     */
    <T> CompletableFuture<CallOutcome<T>> submit(Operation<T> operation, Duration timeout);

    /**
     * 호출을 받을 수 있는지 확인.
     *
     * @return 백엔드가 초기화되었고 종료 요청이 없는 경우 true
     */
    boolean isReady();

    /**
     * 종료 요청. 이미 큐에 있는 작업은 모두 처리된 후 워커가 멈춥니다.
     *
     * <p>여러 번 호출해도 안전합니다.</p>
     */
    @Override
    void close();
}
