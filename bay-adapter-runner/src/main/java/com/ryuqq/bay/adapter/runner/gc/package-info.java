/**
 * Garbage Collector 작업과 스케줄러.
 *
 * <p>만료 Sandbox, idle Session, 고아 Workspace, 고아 인스턴스, 만료 멱등성 기록을
 * 각자의 주기로 정리합니다. 외부 리소스 삭제가 기록 삭제보다 항상 먼저입니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
package com.ryuqq.bay.adapter.runner.gc;
