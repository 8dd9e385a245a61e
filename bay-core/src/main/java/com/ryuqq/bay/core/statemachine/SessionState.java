package com.ryuqq.bay.core.statemachine;

/**
 * Session(컴퓨트 인스턴스)의 desired/observed 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → STARTING (드라이버 start 호출)</li>
 *   <li>STARTING → RUNNING (런타임 health 확인)</li>
 *   <li>PENDING | STARTING → FAILED (start 오류 또는 readiness 타임아웃)</li>
 * </ul>
 *
 * <p>중지된 Session은 상태 전이 대신 레코드 자체가 hard delete 됩니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public enum SessionState {

    /**
     * 레코드만 생성됨 (인스턴스 시작 전).
     */
    PENDING,

    /**
     * 인스턴스 시작 요청됨, readiness 대기 중.
     */
    STARTING,

    /**
     * 런타임 healthy.
     */
    RUNNING,

    /**
     * 시작 실패 (종료 상태).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == FAILED;
    }

    /**
     * 전이가 허용되는지 확인.
     *
     * @param next 다음 상태
     * @return 허용되면 true
     */
    public boolean canTransitionTo(SessionState next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == STARTING || next == FAILED;
            case STARTING -> next == RUNNING || next == FAILED;
            case RUNNING, FAILED -> false;
        };
    }
}
