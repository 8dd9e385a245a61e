package com.ryuqq.bay.core.model;

import java.time.Instant;

/**
 * Workspace 레코드 (컴퓨트와 독립적인 생명주기를 가진 영속 스토리지 단위).
 *
 * <p><strong>종류:</strong></p>
 * <ul>
 *   <li><strong>managed:</strong> 정확히 하나의 Sandbox가 1:1로 소유, Sandbox와 함께 cascade 삭제</li>
 *   <li><strong>external:</strong> 독립적으로 생성, 0개 이상의 Sandbox가 동시에 참조 가능</li>
 * </ul>
 *
 * @param id Workspace ID
 * @param owner 소유자
 * @param managed managed 여부
 * @param managedBySandboxId 소유 Sandbox ID (managed에서만 non-null)
 * @param volumeRef 드라이버 볼륨 참조
 * @param sizeLimitMb 크기 제한 (MB)
 * @param createdAt 생성 시각
 * @param lastAccessedAt 마지막 접근 시각
 *
 * @author Bay Team
 * @since 1.0.0
 */
public record Workspace(
    WorkspaceId id,
    String owner,
    boolean managed,
    SandboxId managedBySandboxId,
    String volumeRef,
    int sizeLimitMb,
    Instant createdAt,
    Instant lastAccessedAt
) {

    public Workspace {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        if (volumeRef == null || volumeRef.isBlank()) {
            throw new IllegalArgumentException("volumeRef cannot be null or blank");
        }
        if (!managed && managedBySandboxId != null) {
            throw new IllegalArgumentException("external workspace cannot have an owning sandbox");
        }
        if (sizeLimitMb <= 0) {
            throw new IllegalArgumentException("sizeLimitMb must be positive (current: " + sizeLimitMb + ")");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * Sandbox 소유의 managed Workspace 생성.
     */
    public static Workspace managed(WorkspaceId id, String owner, SandboxId sandboxId,
                                    String volumeRef, int sizeLimitMb, Instant now) {
        if (sandboxId == null) {
            throw new IllegalArgumentException("managed workspace requires an owning sandbox");
        }
        return new Workspace(id, owner, true, sandboxId, volumeRef, sizeLimitMb, now, now);
    }

    /**
     * 독립 external Workspace 생성.
     */
    public static Workspace external(WorkspaceId id, String owner, String volumeRef, int sizeLimitMb, Instant now) {
        return new Workspace(id, owner, false, null, volumeRef, sizeLimitMb, now, now);
    }

    public Workspace withLastAccessedAt(Instant now) {
        return new Workspace(id, owner, managed, managedBySandboxId, volumeRef, sizeLimitMb, createdAt, now);
    }
}
