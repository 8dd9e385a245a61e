package com.ryuqq.bay.core.error;

/**
 * 시간 예산 초과 (readiness 대기, 섹션 획득 대기, 드라이버 호출).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class OperationTimeoutException extends BayException {

    public OperationTimeoutException(String message, String sandboxId, long budgetMs) {
        super(ErrorCode.TIMEOUT, message, details("sandbox_id", sandboxId, "budget_ms", budgetMs));
    }
}
