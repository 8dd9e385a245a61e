package com.ryuqq.bay.application.capability;

import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.spi.RuntimeAdapter;

/**
 * capability 호출을 Sandbox의 런타임으로 라우팅.
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface CapabilityRouter {

    /**
     * 실행 중인 런타임 어댑터 확보.
     *
     * <p>Sandbox의 Session을 ensureRunning으로 보장한 뒤, Session에 저장된 런타임 계열로
     * 어댑터를 만들고 capability 지원 여부를 확인합니다.</p>
     *
     * @param owner 소유자
     * @param sandboxId Sandbox ID
     * @param capability 요청 capability (예: "shell")
     * @return 런타임 어댑터
     * @throws com.ryuqq.bay.core.error.CapabilityNotSupportedException 지원하지 않는 capability
     */
    RuntimeAdapter route(String owner, SandboxId sandboxId, String capability);
}
