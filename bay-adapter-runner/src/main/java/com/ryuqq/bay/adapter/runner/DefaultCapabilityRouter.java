package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.application.capability.CapabilityRouter;
import com.ryuqq.bay.application.sandbox.SandboxOrchestrator;
import com.ryuqq.bay.application.sandbox.SandboxView;
import com.ryuqq.bay.core.error.CapabilityNotSupportedException;
import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.spi.RuntimeAdapter;
import com.ryuqq.bay.core.spi.RuntimeAdapterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link CapabilityRouter} 기본 구현.
 *
 * <p>Profile이 capability를 선언하지 않으면 컴퓨트를 깨우기 전에 거부하고,
 * 런타임이 실제로 보고하는 capability도 한 번 더 확인합니다.
 * 어댑터는 Session에 기록된 런타임 계열과 엔드포인트로 매 호출 만들며, 라우터는 상태를 갖지 않습니다.
 * Session이 회수된 뒤 같은 host:port가 재사용되어도 이전 Session의 어댑터가 쓰이지 않습니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class DefaultCapabilityRouter implements CapabilityRouter {

    private static final Logger log = LoggerFactory.getLogger(DefaultCapabilityRouter.class);

    private final SandboxOrchestrator orchestrator;
    private final RuntimeAdapterFactory adapterFactory;

    public DefaultCapabilityRouter(SandboxOrchestrator orchestrator, RuntimeAdapterFactory adapterFactory) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (adapterFactory == null) {
            throw new IllegalArgumentException("adapterFactory cannot be null");
        }
        this.orchestrator = orchestrator;
        this.adapterFactory = adapterFactory;
    }

    @Override
    public RuntimeAdapter route(String owner, SandboxId sandboxId, String capability) {
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability cannot be null or blank");
        }

        SandboxView view = orchestrator.get(owner, sandboxId);
        if (!view.capabilities().contains(capability)) {
            throw new CapabilityNotSupportedException(capability, view.capabilities());
        }

        Session session = orchestrator.ensureRunning(owner, sandboxId);
        RuntimeAdapter adapter = adapterFactory.create(session.runtimeType(), session.endpoint());

        List<String> declared = adapter.capabilities();
        if (!declared.contains(capability)) {
            log.warn("Runtime of {} does not declare capability {} (declared: {})", sandboxId, capability, declared);
            throw new CapabilityNotSupportedException(capability, declared);
        }
        return adapter;
    }
}
