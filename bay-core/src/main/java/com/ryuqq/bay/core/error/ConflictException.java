package com.ryuqq.bay.core.error;

import java.util.Map;

/**
 * 상태 충돌 (멱등성 키 불일치, 참조 중인 Workspace 삭제 시도 등).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class ConflictException extends BayException {

    public ConflictException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFLICT, message, details);
    }

    /**
     * 같은 Idempotency-Key가 다른 요청에 재사용된 경우.
     *
     * @param key Idempotency-Key
     * @return ConflictException
     */
    public static ConflictException idempotencyKeyReused(String key) {
        return new ConflictException(
            "Idempotency key already used with different request parameters",
            details("key", key, "hint", "Use a different Idempotency-Key for different request parameters")
        );
    }

    /**
     * 살아있는 Sandbox가 참조 중인 Workspace 삭제 시도.
     *
     * @param workspaceId Workspace ID
     * @param referencingSandboxes 참조 중인 Sandbox 수
     * @return ConflictException
     */
    public static ConflictException workspaceInUse(String workspaceId, long referencingSandboxes) {
        return new ConflictException(
            "Workspace is still referenced by live sandboxes: " + workspaceId,
            details("workspace_id", workspaceId, "referencing_sandboxes", referencingSandboxes)
        );
    }

    /**
     * managed Workspace를 직접 삭제하려는 시도.
     *
     * @param workspaceId Workspace ID
     * @return ConflictException
     */
    public static ConflictException managedWorkspace(String workspaceId) {
        return new ConflictException(
            "Managed workspace can only be deleted together with its sandbox: " + workspaceId,
            details("workspace_id", workspaceId)
        );
    }
}
