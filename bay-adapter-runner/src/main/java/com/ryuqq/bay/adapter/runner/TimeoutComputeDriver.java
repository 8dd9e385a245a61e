package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.core.config.ProfileConfig;
import com.ryuqq.bay.core.error.BayException;
import com.ryuqq.bay.core.error.DriverException;
import com.ryuqq.bay.core.error.OperationTimeoutException;
import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.spi.ComputeDriver;
import com.ryuqq.bay.core.spi.InstanceInfo;
import com.ryuqq.bay.core.spi.StartedInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 모든 드라이버 호출에 호출 단위 타임아웃을 거는 decorator.
 *
 * <p>드라이버는 신뢰할 수 없는 외부 의존성으로 취급합니다. 호출이 멈추면 호출자는
 * {@code timeout}을 받고, 그 밖의 실패는 {@code driver_error}로 변환됩니다.
 * 타임아웃 이후에 뒤늦게 생성된 인스턴스는 OrphanInstanceGc가 회수합니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class TimeoutComputeDriver implements ComputeDriver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutComputeDriver.class);

    private final ComputeDriver delegate;
    private final long callTimeoutMs;
    private final ExecutorService callExecutor;

    /**
     * 생성자.
     *
     * @param delegate 실제 드라이버
     * @param callTimeoutMs 호출 1회 상한 (밀리초, 양수)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TimeoutComputeDriver(ComputeDriver delegate, long callTimeoutMs) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (callTimeoutMs <= 0) {
            throw new IllegalArgumentException("callTimeoutMs must be positive (current: " + callTimeoutMs + ")");
        }
        this.delegate = delegate;
        this.callTimeoutMs = callTimeoutMs;
        AtomicInteger counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "bay-driver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String createVolume(String name, Map<String, String> labels) {
        return call("createVolume", () -> delegate.createVolume(name, labels));
    }

    @Override
    public void deleteVolume(String volumeRef) {
        call("deleteVolume", () -> {
            delegate.deleteVolume(volumeRef);
            return null;
        });
    }

    @Override
    public StartedInstance start(ProfileConfig profile, Workspace workspace, Map<String, String> labels) {
        return call("start", () -> delegate.start(profile, workspace, labels));
    }

    @Override
    public void stop(String instanceRef) {
        call("stop", () -> {
            delegate.stop(instanceRef);
            return null;
        });
    }

    @Override
    public void destroy(String instanceRef) {
        call("destroy", () -> {
            delegate.destroy(instanceRef);
            return null;
        });
    }

    @Override
    public List<InstanceInfo> listInstances(Map<String, String> labelFilter) {
        return call("listInstances", () -> delegate.listInstances(labelFilter));
    }

    private <T> T call(String operation, Callable<T> callable) {
        Future<T> future = callExecutor.submit(callable);
        try {
            return future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Driver {} timed out after {}ms", operation, callTimeoutMs);
            throw new OperationTimeoutException("Driver " + operation + " timed out", null, callTimeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BayException) {
                throw (BayException) cause;
            }
            throw new DriverException(operation, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DriverException(operation, "interrupted", e);
        }
    }

    /**
     * 호출 스레드 풀 종료.
     */
    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
