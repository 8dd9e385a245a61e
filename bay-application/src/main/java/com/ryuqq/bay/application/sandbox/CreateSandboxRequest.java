package com.ryuqq.bay.application.sandbox;

/**
 * Sandbox 생성 요청.
 *
 * @param profileId Profile ID (필수)
 * @param workspaceId 기존 external Workspace ID (null = managed Workspace 생성)
 * @param ttlSeconds hard TTL (null 또는 0 = 만료 없음, 음수 불가)
 * @author Bay Team
 * @since 1.0.0
 */
public record CreateSandboxRequest(String profileId, String workspaceId, Long ttlSeconds) {

    public CreateSandboxRequest {
        if (profileId == null || profileId.isBlank()) {
            throw new IllegalArgumentException("profileId cannot be null or blank");
        }
    }

    public boolean hasInfiniteTtl() {
        return ttlSeconds == null || ttlSeconds == 0;
    }
}
