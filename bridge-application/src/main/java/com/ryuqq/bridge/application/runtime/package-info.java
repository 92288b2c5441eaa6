/**
 * WorkerRuntime 인터페이스.
 *
 * <p>백엔드를 소유하고 큐를 비우는 전용 워커의 생명주기를 정의합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code WorkerLoop}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.bridge.application.runtime;
