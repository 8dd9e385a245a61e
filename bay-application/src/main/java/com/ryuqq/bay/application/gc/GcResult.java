package com.ryuqq.bay.application.gc;

import java.time.Duration;

/**
 * GC 작업 1회 실행 결과 (저장되지 않음).
 *
 * @param taskName 작업 이름
 * @param cleaned 정리된 항목 수
 * @param errors 실패한 항목 수
 * @param duration 소요 시간
 * @author Bay Team
 * @since 1.0.0
 */
public record GcResult(String taskName, int cleaned, int errors, Duration duration) {

    public GcResult {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("taskName cannot be null or blank");
        }
        if (cleaned < 0 || errors < 0) {
            throw new IllegalArgumentException("cleaned and errors cannot be negative");
        }
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
    }

    /**
     * 작업 자체가 실패한 경우의 결과 (항목 처리 전 예외).
     *
     * @param taskName 작업 이름
     * @param duration 소요 시간
     * @return errors=1 결과
     */
    public static GcResult failed(String taskName, Duration duration) {
        return new GcResult(taskName, 0, 1, duration);
    }

    public boolean hasErrors() {
        return errors > 0;
    }
}
