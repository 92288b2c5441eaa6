package com.ryuqq.bridge.core.outcome;

/**
 * 브리지 호출 결과.
 *
 * <p>CallOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Completed}: 워커가 작업을 실행하고 결과를 기록함</li>
 *   <li>{@link Failed}: 백엔드 작업이 오류를 발생시킴</li>
 *   <li>{@link TimedOut}: 호출자의 대기 시간 초과 (작업은 큐에 남아 나중에 실행될 수 있음)</li>
 *   <li>{@link NotReady}: 브리지가 호출을 받을 수 없는 상태 (큐에 들어가지 않음)</li>
 * </ul>
 *
 * <p><strong>처리 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Completed&lt;SearchResult&gt; completed) {
 *     render(completed.value());
 * } else if (outcome instanceof TimedOut&lt;SearchResult&gt; timedOut) {
 *     return "timed out after " + timedOut.timeout();
 * }
 * </pre>
 *
 * @param <T> 결과 타입
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public sealed interface CallOutcome<T> permits Completed, Failed, TimedOut, NotReady {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isCompleted() {
        return this instanceof Completed;
    }

    /**
     * 백엔드 오류인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 대기 시간 초과인지 확인.
     *
     * @return 타임아웃 여부
     */
    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }

    /**
     * 준비되지 않은 상태였는지 확인.
     *
     * @return NotReady 여부
     */
    default boolean isNotReady() {
        return this instanceof NotReady;
    }

    /**
     * 성공이면 결과 값, 아니면 대체 값 반환.
     *
     * @param fallback 대체 값
     * @return 결과 값 또는 fallback
     */
    default T orElse(T fallback) {
        if (this instanceof Completed<T> completed) {
            return completed.value();
        }
        return fallback;
    }
}
