package com.ryuqq.bridge.core.outcome;

/**
 * 성공 결과.
 *
 * @param <T> 결과 타입
 * @param value 작업 결과 (null 허용)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record Completed<T>(T value) implements CallOutcome<T> {

    public static <T> Completed<T> of(T value) {
        return new Completed<>(value);
    }
}
