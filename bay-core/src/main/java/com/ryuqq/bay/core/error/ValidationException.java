package com.ryuqq.bay.core.error;

/**
 * 잘못된 입력 (상태를 건드리기 전에 동기적으로 거부).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class ValidationException extends BayException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message, null);
    }

    public ValidationException(String message, String field, Object rejectedValue) {
        super(ErrorCode.VALIDATION_ERROR, message, details("field", field, "rejected_value", rejectedValue));
    }
}
