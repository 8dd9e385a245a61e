package com.ryuqq.bay.core.statemachine;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.bay.core.statemachine.SandboxStatus.*;

/**
 * Sandbox 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 Sandbox의 합성 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 부활 금지 불변식을 보장합니다. I/O는 수행하지 않습니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → STARTING (ensure_running 요청)</li>
 *   <li>STARTING → READY (런타임 health 확인)</li>
 *   <li>STARTING → FAILED (start 오류 또는 readiness 타임아웃)</li>
 *   <li>READY → IDLE (idle timeout 회수 또는 명시적 stop)</li>
 *   <li>FAILED → STARTING (다음 요청 시 암묵적 재시도)</li>
 *   <li>FAILED → IDLE (명시적 stop)</li>
 *   <li>IDLE | READY | STARTING | FAILED → EXPIRED (hard TTL 경과)</li>
 *   <li>IDLE | READY | STARTING | FAILED | EXPIRED → DELETED (명시적 delete)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>EXPIRED, DELETED에서는 살아있는 상태로 절대 돌아가지 않음</li>
 *   <li>DELETED에서는 어떤 상태로도 전이 불가</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private static final Map<SandboxStatus, Set<SandboxStatus>> ALLOWED = Map.of(
        IDLE, EnumSet.of(STARTING, EXPIRED, DELETED),
        STARTING, EnumSet.of(READY, FAILED, EXPIRED, DELETED),
        READY, EnumSet.of(IDLE, EXPIRED, DELETED),
        FAILED, EnumSet.of(STARTING, IDLE, EXPIRED, DELETED),
        EXPIRED, EnumSet.of(DELETED),
        DELETED, EnumSet.noneOf(SandboxStatus.class)
    );

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 허용되는지 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(SandboxStatus from, SandboxStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED.get(from).contains(to);
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SandboxStatus from, SandboxStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from == DELETED) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!ALLOWED.get(from).contains(to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static SandboxStatus transition(SandboxStatus current, SandboxStatus next) {
        validate(current, next);
        return next;
    }
}
