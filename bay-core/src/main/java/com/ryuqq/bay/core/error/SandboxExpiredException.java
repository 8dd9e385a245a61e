package com.ryuqq.bay.core.error;

import java.time.Instant;

/**
 * Hard TTL이 지난 Sandbox에 대한 시작/연장 시도 (종료 상태, 부활 금지).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class SandboxExpiredException extends BayException {

    public SandboxExpiredException(String sandboxId, Instant expiresAt) {
        super(ErrorCode.SANDBOX_EXPIRED, "Sandbox has expired: " + sandboxId,
            details("sandbox_id", sandboxId, "expires_at", expiresAt == null ? null : expiresAt.toString()));
    }
}
