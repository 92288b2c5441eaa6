package com.ryuqq.bridge.core.outcome;

import java.time.Duration;

/**
 * 호출자 대기 시간 초과.
 *
 * <p>오류가 아니라 degraded 결과입니다. 작업은 큐에서 제거되지 않으며
 * 워커가 나중에 실행할 수 있지만, 그 결과는 이 호출자에게 전달되지 않습니다.</p>
 *
 * @param <T> 결과 타입
 * @param operationName 작업 이름
 * @param timeout 적용된 대기 시간
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record TimedOut<T>(
    String operationName,
    Duration timeout
) implements CallOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operationName 또는 timeout이 null인 경우
     */
    public TimedOut {
        if (operationName == null) {
            throw new IllegalArgumentException("operationName cannot be null");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
    }

    public static <T> TimedOut<T> of(String operationName, Duration timeout) {
        return new TimedOut<>(operationName, timeout);
    }
}
