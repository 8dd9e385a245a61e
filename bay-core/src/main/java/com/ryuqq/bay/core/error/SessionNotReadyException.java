package com.ryuqq.bay.core.error;

/**
 * 컴퓨트가 아직 시작 중 (호출자가 재시도할 수 있음, Orchestrator는 재시도하지 않음).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class SessionNotReadyException extends BayException {

    private final long retryAfterMs;

    public SessionNotReadyException(String message, String sandboxId, long retryAfterMs) {
        super(ErrorCode.SESSION_NOT_READY, message,
            details("sandbox_id", sandboxId, "retry_after_ms", retryAfterMs > 0 ? retryAfterMs : null));
        this.retryAfterMs = retryAfterMs;
    }

    /**
     * 권장 재시도 지연.
     *
     * @return 밀리초 (0이면 권장값 없음)
     */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
