package com.ryuqq.bay.application.sandbox;

import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.statemachine.SandboxStatus;

/**
 * Sandbox 생명주기 조정자.
 *
 * <p>모든 연산은 소유자 범위로 동작합니다. 다른 소유자의 Sandbox는 존재하지 않는 것과
 * 같이 {@code not_found}로 응답합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SandboxView sandbox = orchestrator.create("owner-1", new CreateSandboxRequest("python-default", null, 3600L));
 * Session session = orchestrator.ensureRunning("owner-1", SandboxId.of(sandbox.id()));
 * // session.endpoint() 로 런타임 호출
 * orchestrator.keepalive("owner-1", SandboxId.of(sandbox.id()));
 * orchestrator.delete("owner-1", SandboxId.of(sandbox.id()));
 * </pre>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface SandboxOrchestrator {

    /**
     * Sandbox 생성 (컴퓨트는 시작하지 않음).
     *
     * <p>Workspace를 지정하지 않으면 Sandbox 소유의 managed Workspace를 함께 만듭니다.</p>
     *
     * @param owner 소유자
     * @param request 생성 요청
     * @return 생성된 Sandbox (상태 IDLE)
     * @throws com.ryuqq.bay.core.error.ValidationException 알 수 없는 Profile, 음수 TTL
     * @throws com.ryuqq.bay.core.error.NotFoundException 지정한 Workspace가 없거나 다른 소유자의 것인 경우
     * @throws com.ryuqq.bay.core.error.DriverException 볼륨 생성 실패
     */
    SandboxView create(String owner, CreateSandboxRequest request);

    /**
     * Sandbox 조회 (상태는 조회 시점에 계산).
     *
     * @throws com.ryuqq.bay.core.error.NotFoundException 없거나 삭제된 경우
     */
    SandboxView get(String owner, SandboxId sandboxId);

    /**
     * 소유자의 Sandbox 목록 (id 순, 커서 페이지네이션).
     *
     * @param owner 소유자
     * @param status 상태 필터 (null = 전체)
     * @param cursor 이전 페이지의 nextCursor (null = 처음부터)
     * @param limit 페이지 크기 (null = 기본값, 1..최대값)
     * @return 페이지
     * @throws com.ryuqq.bay.core.error.ValidationException limit이 범위를 벗어난 경우
     */
    SandboxPage list(String owner, SandboxStatus status, String cursor, Integer limit);

    /**
     * 실행 중인 Session 보장.
     *
     * <p>이미 준비된 Session이 있으면 그대로 반환하고, 없으면 정확히 한 번 시작합니다.
     * 동시에 들어온 요청들은 하나의 시작 시도로 합쳐지며 모두 같은 결과를 받습니다.</p>
     *
     * @return RUNNING Session (endpoint 포함)
     * @throws com.ryuqq.bay.core.error.SandboxExpiredException hard TTL이 지난 경우
     * @throws com.ryuqq.bay.core.error.NotFoundException 없거나 삭제된 경우
     * @throws com.ryuqq.bay.core.error.SessionNotReadyException 다른 시도가 아직 시작 중인 경우
     * @throws com.ryuqq.bay.core.error.DriverException 드라이버 실패
     * @throws com.ryuqq.bay.core.error.OperationTimeoutException readiness 대기 예산 초과
     */
    Session ensureRunning(String owner, SandboxId sandboxId);

    /**
     * idle 마감 연장. 살아있는 Session이 없으면 아무 것도 하지 않습니다 (컴퓨트 시작 안 함).
     *
     * @throws com.ryuqq.bay.core.error.NotFoundException 없거나 삭제된 경우
     */
    void keepalive(String owner, SandboxId sandboxId);

    /**
     * 컴퓨트 회수 (멱등). Sandbox와 Workspace는 유지됩니다.
     *
     * @throws com.ryuqq.bay.core.error.NotFoundException 없거나 삭제된 경우
     */
    void stop(String owner, SandboxId sandboxId);

    /**
     * Sandbox 삭제 (효과 기준 멱등).
     *
     * <p>stop을 수행한 뒤 soft delete 하고, managed Workspace는 볼륨과 함께 삭제합니다.</p>
     *
     * @throws com.ryuqq.bay.core.error.NotFoundException 존재한 적이 없거나 다른 소유자의 것인 경우
     */
    void delete(String owner, SandboxId sandboxId);

    /**
     * hard TTL 연장: {@code new = max(old, now) + extendBySeconds}.
     *
     * @return 연장된 Sandbox
     * @throws com.ryuqq.bay.core.error.ValidationException extendBySeconds가 양수가 아니거나 상한 초과
     * @throws com.ryuqq.bay.core.error.SandboxTtlInfiniteException TTL이 무한인 경우
     * @throws com.ryuqq.bay.core.error.SandboxExpiredException 이미 만료된 경우
     */
    SandboxView extendTtl(String owner, SandboxId sandboxId, long extendBySeconds);
}
