package com.ryuqq.bridge.core.outcome;

/**
 * 브리지가 준비되지 않아 호출이 큐에 들어가지 않음.
 *
 * @param <T> 결과 타입
 * @param reason 사유 (null/blank 불가)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record NotReady<T>(String reason) implements CallOutcome<T> {

    /**
     * 기본 사유 메시지.
     */
    public static final String DEFAULT_REASON = "Knowledge base not initialized";

    public NotReady {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public static <T> NotReady<T> of() {
        return new NotReady<>(DEFAULT_REASON);
    }
}
