package com.ryuqq.bay.application.sandbox;

import com.ryuqq.bay.core.statemachine.SandboxStatus;

import java.time.Instant;
import java.util.List;

/**
 * 외부에 노출되는 Sandbox 표현.
 *
 * <p>status는 저장되지 않고 조회 시점에 계산됩니다. 멱등성 원장이 응답 스냅샷으로
 * 그대로 저장하고 재생하는 대상이기도 합니다.</p>
 *
 * @param id Sandbox ID
 * @param status 합성 상태
 * @param profile Profile ID
 * @param workspaceId Workspace ID
 * @param capabilities Profile이 선언한 capability 목록
 * @param createdAt 생성 시각
 * @param expiresAt hard TTL 마감 (null = 만료 없음)
 * @param idleExpiresAt 현재 Session의 idle 마감 (null = 실행 중 아님)
 * @author Bay Team
 * @since 1.0.0
 */
public record SandboxView(
    String id,
    SandboxStatus status,
    String profile,
    String workspaceId,
    List<String> capabilities,
    Instant createdAt,
    Instant expiresAt,
    Instant idleExpiresAt
) {

    public SandboxView {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }
}
