package com.ryuqq.bridge.core.statemachine;

/**
 * 워커의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNINITIALIZED
 *    │
 *    ├─► READY ◄──► RUNNING
 *    │     │           │
 *    │     └─────┬─────┘
 *    │           ▼
 *    ├──────► STOPPED
 *    │           ▲
 *    └─► INIT_FAILED
 * </pre>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public enum WorkerState {

    /**
     * 백엔드 생성 전.
     */
    UNINITIALIZED,

    /**
     * 백엔드 초기화 완료, 다음 호출 대기.
     */
    READY,

    /**
     * 작업 실행 중 (한 번에 하나).
     */
    RUNNING,

    /**
     * 백엔드 초기화 실패. 이후 호출은 모두 실패 처리.
     */
    INIT_FAILED,

    /**
     * 종료 (Sentinel 처리 완료).
     */
    STOPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED;
    }

    /**
     * 호출을 실행할 수 있는 상태인지 확인.
     *
     * @return READY 또는 RUNNING인 경우 true
     */
    public boolean isServing() {
        return this == READY || this == RUNNING;
    }
}
