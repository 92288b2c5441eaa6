/**
 * Bridge Runner Adapter - 단일 워커 실행 어댑터.
 *
 * <p>이 패키지는 {@link com.ryuqq.bridge.application.bridge.Bridge}와
 * {@link com.ryuqq.bridge.application.runtime.WorkerRuntime}의 구현체를 제공합니다.</p>
 *
 * <h2>핵심 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.SingleWorkerBridge} - 제출/대기/타임아웃/미준비 처리</li>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.WorkerLoop} - 백엔드를 소유한 전용 워커 스레드</li>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.WorkerConfig} - 워커 설정</li>
 * </ul>
 *
 * <h2>스레드 모델</h2>
 * <pre>
 * caller threads ──submit──► DispatchQueue ──dequeue──► knowledge-worker ──► KnowledgeBase
 *       ▲                                                     │
 *       └──────────── completion copy (orTimeout) ◄───────────┘
 * </pre>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.runner;
