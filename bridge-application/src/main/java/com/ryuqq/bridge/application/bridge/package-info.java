/**
 * Bridge Application Layer - 직렬화 실행 API.
 *
 * <p>비동기 호출자의 요청을 받아 단일 워커 스레드로 전달하는 포트를 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.application.bridge.Bridge} - Operation 제출 및 결과 대기</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>값으로서의 실패:</strong> 오류와 타임아웃은 예외가 아닌 CallOutcome으로 전달</li>
 * </ul>
 *
 * @author Bridge Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.application.bridge;
