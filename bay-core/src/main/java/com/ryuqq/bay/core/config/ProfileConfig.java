package com.ryuqq.bay.core.config;

import com.ryuqq.bay.core.model.RuntimeType;

import java.util.List;
import java.util.Map;

/**
 * 런타임 Profile (Sandbox 생성 시 선택되는 이름 붙은 설정).
 *
 * <p>{@code runtimeType}은 어떤 RuntimeAdapter로 런타임과 통신할지 결정하고,
 * {@code runtimePort}는 런타임 컨테이너 안의 HTTP 포트입니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 * @param id Profile ID
 * @param image 컨테이너 이미지
 * @param runtimeType 런타임 계열
 * @param cpus CPU 할당량
 * @param memory 메모리 할당량 (예: "1g")
 * @param capabilities 런타임이 제공하는 capability 목록
 * @param idleTimeoutSeconds idle 타임아웃 (초, 양수)
 * @param runtimePort 런타임 HTTP 포트
 * @param env 컨테이너 환경 변수
 */
public record ProfileConfig(
    String id,
    String image,
    RuntimeType runtimeType,
    double cpus,
    String memory,
    List<String> capabilities,
    long idleTimeoutSeconds,
    int runtimePort,
    Map<String, String> env
) {

    public ProfileConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("image cannot be null or blank");
        }
        if (runtimeType == null) {
            throw new IllegalArgumentException("runtimeType cannot be null");
        }
        if (cpus <= 0) {
            throw new IllegalArgumentException("cpus must be positive (current: " + cpus + ")");
        }
        if (idleTimeoutSeconds <= 0) {
            throw new IllegalArgumentException(
                "idleTimeoutSeconds must be positive (current: " + idleTimeoutSeconds + ")"
            );
        }
        if (runtimePort <= 0 || runtimePort > 65535) {
            throw new IllegalArgumentException("runtimePort out of range (current: " + runtimePort + ")");
        }
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    /**
     * 기본 ship 런타임 Profile 생성 (filesystem, shell, python / idle 30분 / 포트 8123).
     *
     * @param id Profile ID
     * @param image 컨테이너 이미지
     * @param cpus CPU 할당량
     * @param memory 메모리 할당량
     * @return ProfileConfig
     */
    public static ProfileConfig ship(String id, String image, double cpus, String memory) {
        return new ProfileConfig(id, image, RuntimeType.SHIP, cpus, memory,
            List.of("filesystem", "shell", "python"), 1800, 8123, Map.of());
    }

    public boolean supports(String capability) {
        return capabilities.contains(capability);
    }

    public ProfileConfig withIdleTimeoutSeconds(long idleTimeoutSeconds) {
        return new ProfileConfig(id, image, runtimeType, cpus, memory, capabilities,
            idleTimeoutSeconds, runtimePort, env);
    }
}
