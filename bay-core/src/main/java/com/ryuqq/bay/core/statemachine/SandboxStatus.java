package com.ryuqq.bay.core.statemachine;

/**
 * Sandbox의 합성(derived) 상태.
 *
 * <p>이 상태는 저장되지 않고, Sandbox 레코드와 현재 Session 레코드로부터
 * {@link StatusResolver}가 매번 계산합니다.</p>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 *            ┌──────────── stop / idle timeout ────────────┐
 *            ▼                                              │
 *          IDLE ──(ensure_running)──► STARTING ──(health)──► READY
 *            ▲                           │
 *            │ stop                      ▼ (start error / timeout)
 *            └──────────────────────── FAILED ──(ensure_running)──► STARTING
 *
 * IDLE | READY | STARTING | FAILED ──(hard TTL 경과)──► EXPIRED
 * 모든 상태 ──(delete)──► DELETED
 *
 * 금지된 전이:
 * - EXPIRED → IDLE / STARTING / READY / FAILED ❌ (부활 금지)
 * - DELETED → * ❌
 * </pre>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public enum SandboxStatus {

    /**
     * 살아있는 Session 없음.
     */
    IDLE("idle"),

    /**
     * Session이 존재하지만 아직 런타임 health 확인 전.
     */
    STARTING("starting"),

    /**
     * Session이 healthy 상태.
     */
    READY("ready"),

    /**
     * 가장 최근 시작 시도가 실패함 (재시도 가능).
     */
    FAILED("failed"),

    /**
     * Hard TTL 경과 (종료 상태, 더 이상 시작 불가).
     */
    EXPIRED("expired"),

    /**
     * Soft delete 됨 (종료 상태, 호출자에게 더 이상 보이지 않음).
     */
    DELETED("deleted");

    private final String code;

    SandboxStatus(String code) {
        this.code = code;
    }

    /**
     * API 경계에서 사용하는 안정적인 상태 코드.
     *
     * @return 소문자 상태 코드 (예: "ready")
     */
    public String code() {
        return code;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(EXPIRED, DELETED)에서는 어떤 살아있는 상태로도 돌아갈 수 없습니다.</p>
     *
     * @return EXPIRED 또는 DELETED인 경우 true
     */
    public boolean isTerminal() {
        return this == EXPIRED || this == DELETED;
    }
}
