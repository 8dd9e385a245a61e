package com.ryuqq.bay.core.error;

/**
 * Compute Driver(컨테이너 엔진) 실패.
 *
 * <p>조용히 삼키지 않고 항상 호출자에게 노출합니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class DriverException extends BayException {

    public DriverException(String operation, String message, Throwable cause) {
        super(ErrorCode.DRIVER_ERROR, "Driver " + operation + " failed: " + message,
            details("operation", operation), cause);
    }
}
