package com.ryuqq.bridge.core.call;

import com.ryuqq.bridge.core.model.CallId;

import java.util.concurrent.CompletableFuture;

/**
 * 진행 중인 호출 하나를 나타내는 핸들.
 *
 * <p>Bridge가 제출 시 생성하며, 큐에 들어간 이후 결과/오류 기록 권한은 워커로 넘어갑니다.
 * 호출자는 {@link #awaitable()}로 얻은 읽기 전용 사본만 관찰합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>완료 신호는 false → true로 정확히 한 번만 전이</li>
 *   <li>결과 또는 오류 중 하나만 기록 (둘 다 불가)</li>
 *   <li>호출자가 사본을 완료/취소해도 원본 신호에는 영향 없음</li>
 * </ul>
 *
 * @param <T> 결과 타입
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class PendingCall<T> implements DispatchItem {

    private final CallId callId;
    private final Operation<T> operation;
    private final long submittedAt;
    private final CompletableFuture<T> completion;

    private PendingCall(CallId callId, Operation<T> operation, long submittedAt) {
        if (callId == null) {
            throw new IllegalArgumentException("callId cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        this.callId = callId;
        this.operation = operation;
        this.submittedAt = submittedAt;
        this.completion = new CompletableFuture<>();
    }

    /**
     * 새 PendingCall 생성 (UUID 기반 CallId, 현재 시각).
     *
     * @param operation 실행할 Operation
     * @param <T> 결과 타입
     * @return PendingCall 인스턴스
     * @throws IllegalArgumentException operation이 null인 경우
     */
    public static <T> PendingCall<T> of(Operation<T> operation) {
        return new PendingCall<>(CallId.random(), operation, System.currentTimeMillis());
    }

    /**
     * 결과 기록 및 완료 신호 (워커 전용).
     *
     * @param result 실행 결과 (null 허용)
     * @return 이번 호출로 완료된 경우 true, 이미 완료되어 있던 경우 false
     */
    public boolean complete(T result) {
        return completion.complete(result);
    }

    /**
     * 오류 기록 및 완료 신호 (워커 전용).
     *
     * @param error 실패 원인
     * @return 이번 호출로 완료된 경우 true, 이미 완료되어 있던 경우 false
     * @throws IllegalArgumentException error가 null인 경우
     */
    public boolean fail(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return completion.completeExceptionally(error);
    }

    /**
     * 완료 여부 확인.
     *
     * @return 결과 또는 오류가 기록된 경우 true
     */
    public boolean isCompleted() {
        return completion.isDone();
    }

    /**
     * 호출자용 대기 핸들.
     *
     * <p>원본 신호의 사본을 반환하므로, 호출자가 타임아웃을 걸거나 완료시켜도
     * 워커의 기록에는 영향을 주지 않습니다.</p>
     *
     * @return 원본 완료 신호를 따르는 새 future
     */
    public CompletableFuture<T> awaitable() {
        return completion.copy();
    }

    public CallId getCallId() {
        return callId;
    }

    public Operation<T> getOperation() {
        return operation;
    }

    public long getSubmittedAt() {
        return submittedAt;
    }

    @Override
    public String toString() {
        return "PendingCall{callId=" + callId.getValue() + ", operation=" + operation
            + ", completed=" + completion.isDone() + "}";
    }
}
