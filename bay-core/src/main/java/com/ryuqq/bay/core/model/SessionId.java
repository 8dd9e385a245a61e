package com.ryuqq.bay.core.model;

import java.util.UUID;

/**
 * Session(컴퓨트 인스턴스 1개)의 내부 식별자.
 *
 * <p>Session은 외부에서 주소 지정되지 않으므로 이 값은 API 응답에 노출되지 않습니다.
 * 대신 Compute Driver가 생성한 인스턴스의 라벨로 기록되어
 * 고아 인스턴스 판별(OrphanInstanceGc)의 기준이 됩니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class SessionId {

    private static final String PREFIX = "sess-";

    private final String value;

    private SessionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * SessionId 생성.
     *
     * @param value SessionId 값
     * @return SessionId 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static SessionId of(String value) {
        return new SessionId(value);
    }

    /**
     * 새로운 SessionId 발급.
     *
     * @return 신규 SessionId
     */
    public static SessionId generate() {
        return new SessionId(PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionId that = (SessionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
