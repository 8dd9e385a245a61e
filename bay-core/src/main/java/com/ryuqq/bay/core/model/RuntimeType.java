package com.ryuqq.bay.core.model;

/**
 * Sandbox 내부 런타임 계열.
 *
 * <p>Profile에 선언되어 있고, Session 생성 시 한 번 선택되어 Session 레코드에 저장됩니다.
 * 이후 호출은 이 값으로 {@code RuntimeAdapterFactory}에서 어댑터를 얻으며
 * 호출마다 문자열 비교로 재분기하지 않습니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public enum RuntimeType {

    /**
     * 기본 코드 실행 런타임 (filesystem, shell, python).
     */
    SHIP("ship");

    private final String code;

    RuntimeType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * 코드 문자열로 RuntimeType 조회.
     *
     * @param code 런타임 코드 (예: "ship")
     * @return RuntimeType
     * @throws IllegalArgumentException 알 수 없는 코드인 경우
     */
    public static RuntimeType fromCode(String code) {
        for (RuntimeType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown runtime type: " + code);
    }
}
