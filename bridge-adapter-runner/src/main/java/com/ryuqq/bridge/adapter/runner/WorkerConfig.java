package com.ryuqq.bridge.adapter.runner;

/**
 * WorkerLoop 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollTimeoutMs: 큐가 비어 있을 때 한 번에 대기하는 최대 시간 (기본 60000ms)</li>
 *   <li>threadName: 워커 스레드 이름 (기본 knowledge-worker)</li>
 *   <li>daemon: 데몬 스레드 여부 (기본 true, JVM 종료를 막지 않음)</li>
 * </ul>
 *
 * <p>pollTimeoutMs는 처리 지연에 영향을 주지 않습니다. 대기 중 항목이 도착하면 즉시 깨어납니다.</p>
 *
 * @author Bridge Team
 * @since 1.0.0
 * @param pollTimeoutMs 큐 대기 시간 (밀리초, 양수여야 함)
 * @param threadName 워커 스레드 이름 (null/blank 불가)
 * @param daemon 데몬 스레드 여부
 */
public record WorkerConfig(
    long pollTimeoutMs,
    String threadName,
    boolean daemon
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollTimeoutMs=60000ms, threadName=knowledge-worker, daemon=true</p>
     */
    public WorkerConfig() {
        this(60_000, "knowledge-worker", true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerConfig {
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "pollTimeoutMs must be positive (current: " + pollTimeoutMs + ")"
            );
        }
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
    }

    /**
     * pollTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new WorkerConfig(pollTimeoutMs, threadName, daemon);
    }

    /**
     * threadName만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withThreadName(String threadName) {
        return new WorkerConfig(pollTimeoutMs, threadName, daemon);
    }

    /**
     * daemon만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withDaemon(boolean daemon) {
        return new WorkerConfig(pollTimeoutMs, threadName, daemon);
    }
}
