package com.ryuqq.bay.application.sandbox;

import com.ryuqq.bay.core.model.SandboxId;

/**
 * GC가 사용하는 회수 연산 (소유자 범위 없음).
 *
 * <p>대화형 연산과 같은 Sandbox 단위 임계 구역 안에서 상태를 다시 확인한 뒤 회수하므로,
 * 동시에 진행 중인 ensureRunning과 경쟁하지 않습니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface SandboxReclaimer {

    /**
     * idle 마감이 지난 Session을 회수.
     *
     * @param sandboxId Sandbox ID
     * @return 실제로 회수했으면 true (임계 구역 안에서 다시 확인한 결과 여전히 idle인 경우)
     */
    boolean reclaimIdleSession(SandboxId sandboxId);

    /**
     * hard TTL이 지난 Sandbox를 delete와 같은 방식으로 정리.
     *
     * @param sandboxId Sandbox ID
     * @return 실제로 정리했으면 true
     */
    boolean reclaimExpiredSandbox(SandboxId sandboxId);
}
