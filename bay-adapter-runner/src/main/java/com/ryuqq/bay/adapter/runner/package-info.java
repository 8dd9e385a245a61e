/**
 * Runner Adapter Layer - Sandbox 수명주기 구현체.
 *
 * <p>이 패키지는 application 계층 인터페이스의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bay.adapter.runner.DefaultSandboxOrchestrator} - ensureRunning / stop / delete / extendTtl</li>
 *   <li>{@link com.ryuqq.bay.adapter.runner.StoreBackedIdempotencyLedger} - 멱등성 원장</li>
 *   <li>{@link com.ryuqq.bay.adapter.runner.DefaultCapabilityRouter} - capability 라우팅</li>
 *   <li>{@link com.ryuqq.bay.adapter.runner.DefaultWorkspaceService} - external Workspace 관리</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultSandboxOrchestrator, SessionStarter, SandboxLocks)
 *   ↓ implements
 * application (SandboxOrchestrator, IdempotencyLedger, GcTask)
 *   ↓ depends on
 * core (Sandbox, Session, Workspace, StatusResolver, spi)
 * </pre>
 *
 * @author Bay Team
 * @since 1.0.0
 */
package com.ryuqq.bay.adapter.runner;
