package com.ryuqq.bay.core.error;

/**
 * TTL이 무한(expiresAt = null)인 Sandbox의 TTL 연장 시도.
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class SandboxTtlInfiniteException extends BayException {

    public SandboxTtlInfiniteException(String sandboxId) {
        super(ErrorCode.SANDBOX_TTL_INFINITE, "Sandbox has no TTL to extend: " + sandboxId,
            details("sandbox_id", sandboxId));
    }
}
