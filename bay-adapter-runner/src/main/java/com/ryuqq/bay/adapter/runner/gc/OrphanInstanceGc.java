package com.ryuqq.bay.adapter.runner.gc;

import com.ryuqq.bay.core.config.RetryPolicy;
import com.ryuqq.bay.core.spi.ComputeDriver;
import com.ryuqq.bay.core.spi.InstanceInfo;
import com.ryuqq.bay.core.spi.InstanceLabels;
import com.ryuqq.bay.core.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 살아있는 Session이 가리키지 않는 관리 대상 인스턴스 destroy.
 *
 * <p>{@code bay.managed} 라벨이 붙은 인스턴스만 대상으로 합니다.
 * 인스턴스 목록을 <em>먼저</em> 읽고 Session 목록을 나중에 읽습니다. Session 기록은 드라이버
 * start보다 먼저 저장되므로, 이 순서에서는 시작 중인 인스턴스가 고아로 오인되지 않습니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class OrphanInstanceGc extends AbstractGcTask<InstanceInfo> {

    private static final Logger log = LoggerFactory.getLogger(OrphanInstanceGc.class);

    public static final String NAME = "orphan_instance";

    private final ComputeDriver driver;
    private final SessionStore sessionStore;
    private final int batchSize;

    public OrphanInstanceGc(ComputeDriver driver, SessionStore sessionStore, int batchSize, RetryPolicy retryPolicy) {
        super(retryPolicy);
        if (driver == null) {
            throw new IllegalArgumentException("driver cannot be null");
        }
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore cannot be null");
        }
        this.driver = driver;
        this.sessionStore = sessionStore;
        this.batchSize = batchSize;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<InstanceInfo> scan() {
        // 1. 인스턴스 먼저
        List<InstanceInfo> instances = driver.listInstances(InstanceLabels.managedFilter());

        // 2. 살아있는 Session 나중
        Set<String> liveSessionIds = sessionStore.findLive().stream()
            .map(session -> session.id().getValue())
            .collect(Collectors.toSet());

        return instances.stream()
            .filter(instance -> !isReferenced(instance, liveSessionIds))
            .limit(batchSize)
            .toList();
    }

    @Override
    protected boolean reclaim(InstanceInfo instance) {
        driver.destroy(instance.instanceRef());
        log.info("Destroyed orphan instance {} (sandbox: {}, session: {})",
            instance.instanceRef(), instance.label(InstanceLabels.SANDBOX_ID), instance.label(InstanceLabels.SESSION_ID));
        return true;
    }

    @Override
    protected String describe(InstanceInfo instance) {
        return "instance " + instance.instanceRef();
    }

    private static boolean isReferenced(InstanceInfo instance, Set<String> liveSessionIds) {
        String sessionId = instance.label(InstanceLabels.SESSION_ID);
        return sessionId != null && liveSessionIds.contains(sessionId);
    }
}
