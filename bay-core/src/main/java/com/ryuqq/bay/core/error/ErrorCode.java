package com.ryuqq.bay.core.error;

/**
 * API 경계에서 노출되는 안정적인 오류 코드.
 *
 * <p>코드 문자열은 클라이언트가 프로그램적으로 분기하는 데 사용되므로 변경하지 않습니다.
 * HTTP 상태는 API 계층이 응답을 만들 때 참고하는 권장값입니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public enum ErrorCode {

    NOT_FOUND("not_found", 404),
    CONFLICT("conflict", 409),
    SANDBOX_EXPIRED("sandbox_expired", 409),
    SANDBOX_TTL_INFINITE("sandbox_ttl_infinite", 409),
    SESSION_NOT_READY("session_not_ready", 503),
    TIMEOUT("timeout", 504),
    DRIVER_ERROR("driver_error", 502),
    VALIDATION_ERROR("validation_error", 400),
    CAPABILITY_NOT_SUPPORTED("capability_not_supported", 400);

    private final String code;
    private final int httpStatus;

    ErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * 호출자가 같은 요청을 나중에 다시 보내 성공할 수 있는 오류인지 확인.
     *
     * @return SESSION_NOT_READY, TIMEOUT, DRIVER_ERROR 인 경우 true
     */
    public boolean isRetriable() {
        return this == SESSION_NOT_READY || this == TIMEOUT || this == DRIVER_ERROR;
    }
}
