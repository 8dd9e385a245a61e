package com.ryuqq.bay.core.model;

import java.time.Instant;

/**
 * Sandbox 레코드 (외부에 노출되는 유일한 안정 핸들).
 *
 * <p>Sandbox는 Workspace, Profile, 그리고 최대 1개의 살아있는 Session을 묶습니다.
 * 레코드는 불변이며, 변경은 항상 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code expiresAt}은 단조 비감소이며, non-null → null 전이 불가</li>
 *   <li>{@code workspaceId}는 soft delete 이후에만 null이 될 수 있음</li>
 *   <li>soft delete 표시({@code deletedAt})는 한 번 설정되면 해제되지 않음</li>
 * </ul>
 *
 * @param id Sandbox ID
 * @param owner 소유자 식별자
 * @param profileId Profile ID
 * @param workspaceId 바인딩된 Workspace ID (soft delete 이후에만 null 허용)
 * @param expiresAt hard TTL 마감 시각 (null = 만료 없음)
 * @param deletedAt soft delete 시각 (null = 살아있음)
 * @param createdAt 생성 시각
 * @param lastActiveAt 마지막 활동 시각
 *
 * @author Bay Team
 * @since 1.0.0
 */
public record Sandbox(
    SandboxId id,
    String owner,
    String profileId,
    WorkspaceId workspaceId,
    Instant expiresAt,
    Instant deletedAt,
    Instant createdAt,
    Instant lastActiveAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 누락되었거나 workspace 불변식을 위반한 경우
     */
    public Sandbox {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        if (profileId == null || profileId.isBlank()) {
            throw new IllegalArgumentException("profileId cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (workspaceId == null && deletedAt == null) {
            throw new IllegalArgumentException("workspaceId can only be null after soft deletion (sandbox: " + id + ")");
        }
    }

    /**
     * 신규 Sandbox 생성.
     *
     * @param id Sandbox ID
     * @param owner 소유자
     * @param profileId Profile ID
     * @param workspaceId Workspace ID
     * @param expiresAt hard TTL (null = 만료 없음)
     * @param now 생성 시각
     * @return Sandbox
     */
    public static Sandbox create(SandboxId id, String owner, String profileId,
                                 WorkspaceId workspaceId, Instant expiresAt, Instant now) {
        return new Sandbox(id, owner, profileId, workspaceId, expiresAt, null, now, now);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * TTL이 무한인지 확인.
     *
     * @return expiresAt이 null이면 true
     */
    public boolean hasInfiniteTtl() {
        return expiresAt == null;
    }

    /**
     * 주어진 시각 기준으로 hard TTL이 지났는지 확인.
     *
     * @param now 기준 시각
     * @return expiresAt &lt; now 인 경우 true
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /**
     * expiresAt 변경.
     *
     * @param newExpiresAt 새 마감 시각
     * @return 변경된 Sandbox
     * @throws IllegalStateException non-null → null 전이이거나 마감 시각이 줄어드는 경우
     */
    public Sandbox withExpiresAt(Instant newExpiresAt) {
        if (expiresAt != null && newExpiresAt == null) {
            throw new IllegalStateException("expiresAt cannot transition from non-null to null (sandbox: " + id + ")");
        }
        if (expiresAt != null && newExpiresAt.isBefore(expiresAt)) {
            throw new IllegalStateException(
                String.format("expiresAt cannot decrease (sandbox: %s, current: %s, requested: %s)", id, expiresAt, newExpiresAt)
            );
        }
        return new Sandbox(id, owner, profileId, workspaceId, newExpiresAt, deletedAt, createdAt, lastActiveAt);
    }

    public Sandbox withLastActiveAt(Instant now) {
        return new Sandbox(id, owner, profileId, workspaceId, expiresAt, deletedAt, createdAt, now);
    }

    /**
     * Soft delete 표시.
     *
     * <p>이미 삭제된 경우 기존 삭제 시각을 유지합니다.</p>
     *
     * @param now 삭제 시각
     * @return 삭제 표시된 Sandbox
     */
    public Sandbox markDeleted(Instant now) {
        if (deletedAt != null) {
            return this;
        }
        return new Sandbox(id, owner, profileId, workspaceId, expiresAt, now, createdAt, lastActiveAt);
    }

    /**
     * Workspace 참조 해제 (외부 리소스 정리 순서를 위한 것).
     *
     * @return workspaceId가 null인 Sandbox
     * @throws IllegalStateException soft delete 전인 경우
     */
    public Sandbox detachWorkspace() {
        if (deletedAt == null) {
            throw new IllegalStateException("Cannot detach workspace from a live sandbox: " + id);
        }
        return new Sandbox(id, owner, profileId, null, expiresAt, deletedAt, createdAt, lastActiveAt);
    }
}
