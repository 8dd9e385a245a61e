package com.ryuqq.bay.application.gc;

/**
 * 독립적으로 스케줄되는 GC 작업.
 *
 * <p>구현체는 항목 단위 실패를 잡아서 세고 로그로 남기며, 배치 나머지를 계속 처리합니다.
 * {@link #run()}이 예외를 던지더라도 스케줄러는 다른 작업과 이후 주기를 계속 실행합니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface GcTask {

    /**
     * 작업 이름 (로그와 결과에 사용).
     */
    String name();

    /**
     * 한 번의 정리 패스.
     *
     * @return 결과 (cleaned, errors, duration)
     */
    GcResult run();
}
