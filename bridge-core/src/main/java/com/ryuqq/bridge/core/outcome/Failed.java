package com.ryuqq.bridge.core.outcome;

import com.ryuqq.bridge.core.exception.BackendOperationException;

/**
 * 백엔드 작업 실패.
 *
 * <p>워커에서 작업이 오류를 발생시킨 경우이며, 원인 예외를 그대로 보존합니다.
 * 초기화 실패 후 처리된 호출도 이 결과가 됩니다.</p>
 *
 * @param <T> 결과 타입
 * @param error 실패 원인 (null 불가)
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public record Failed<T>(BackendOperationException error) implements CallOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Failed {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    public static <T> Failed<T> of(BackendOperationException error) {
        return new Failed<>(error);
    }

    /**
     * 오류 메시지.
     *
     * @return 원인 예외의 메시지
     */
    public String message() {
        return error.getMessage();
    }
}
