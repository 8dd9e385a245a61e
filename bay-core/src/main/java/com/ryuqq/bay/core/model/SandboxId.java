package com.ryuqq.bay.core.model;

import java.util.UUID;

/**
 * Sandbox의 외부 고유 식별자.
 *
 * <p>Sandbox는 외부에 노출되는 유일한 안정 핸들이며, 이 식별자는
 * Sandbox의 생명주기 동안 변경되지 않습니다.</p>
 *
 * <p><strong>형식:</strong> {@code sandbox-} + 12자리 소문자 hex (예: sandbox-3f9a1c0b2d4e)</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class SandboxId implements Comparable<SandboxId> {

    private static final String PREFIX = "sandbox-";

    private final String value;

    private SandboxId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SandboxId cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("SandboxId length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("SandboxId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * SandboxId 생성.
     *
     * @param value SandboxId 값
     * @return SandboxId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SandboxId of(String value) {
        return new SandboxId(value);
    }

    /**
     * 새로운 SandboxId 발급 (UUID 기반).
     *
     * @return 신규 SandboxId
     */
    public static SandboxId generate() {
        return new SandboxId(PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12));
    }

    /**
     * SandboxId 값 조회.
     *
     * @return SandboxId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(SandboxId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SandboxId that = (SandboxId) o;
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
