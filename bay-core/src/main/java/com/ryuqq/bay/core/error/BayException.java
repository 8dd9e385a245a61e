package com.ryuqq.bay.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 모든 Bay 도메인 오류의 기반 예외.
 *
 * <p>사용자에게 보이는 실패는 항상 안정적인 {@link ErrorCode}와 디버깅에 필요한 컨텍스트
 * (sandbox id, 관련 시각 등)를 {@link #getDetails()}로 함께 전달합니다.
 * 다른 테넌트의 내부 식별자는 details에 넣지 않습니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>validation: {@link ValidationException}</li>
 *   <li>state-conflict: {@link SandboxExpiredException}, {@link SandboxTtlInfiniteException}, {@link ConflictException}</li>
 *   <li>upstream-dependency: {@link DriverException}, {@link OperationTimeoutException}, {@link SessionNotReadyException}</li>
 *   <li>lookup: {@link NotFoundException}</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public abstract class BayException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BayException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
        this.details = details == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    protected BayException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 오류 컨텍스트 (불변).
     *
     * @return details 맵 (비어있을 수 있음)
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * details를 만드는 작은 헬퍼 (null 값은 제외).
     */
    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}
