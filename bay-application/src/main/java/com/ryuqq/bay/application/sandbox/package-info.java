/**
 * Sandbox 생명주기 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bay.application.sandbox.SandboxOrchestrator} - 대화형 생명주기 연산</li>
 *   <li>{@link com.ryuqq.bay.application.sandbox.SandboxReclaimer} - GC 회수 연산</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 bay-adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
package com.ryuqq.bay.application.sandbox;
