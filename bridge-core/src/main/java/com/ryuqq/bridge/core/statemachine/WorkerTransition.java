package com.ryuqq.bridge.core.statemachine;

/**
 * 워커 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>UNINITIALIZED → READY (초기화 성공)</li>
 *   <li>UNINITIALIZED → INIT_FAILED (초기화 실패)</li>
 *   <li>UNINITIALIZED → STOPPED (초기화 전 종료)</li>
 *   <li>READY → RUNNING, RUNNING → READY</li>
 *   <li>READY / RUNNING / INIT_FAILED → STOPPED</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
public final class WorkerTransition {

    // Utility class - prevent instantiation
    private WorkerTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkerState from, WorkerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case UNINITIALIZED -> to == WorkerState.READY
                || to == WorkerState.INIT_FAILED
                || to == WorkerState.STOPPED;
            case READY -> to == WorkerState.RUNNING || to == WorkerState.STOPPED;
            case RUNNING -> to == WorkerState.READY || to == WorkerState.STOPPED;
            case INIT_FAILED -> to == WorkerState.STOPPED;
            case STOPPED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkerState transition(WorkerState current, WorkerState next) {
        validate(current, next);
        return next;
    }
}
