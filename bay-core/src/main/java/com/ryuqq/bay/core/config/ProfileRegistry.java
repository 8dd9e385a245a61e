package com.ryuqq.bay.core.config;

import com.ryuqq.bay.core.error.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Profile 카탈로그 (불변).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class ProfileRegistry {

    private final Map<String, ProfileConfig> profiles;

    private ProfileRegistry(Map<String, ProfileConfig> profiles) {
        this.profiles = profiles;
    }

    /**
     * Profile 목록으로 Registry 생성.
     *
     * @param profiles Profile 목록 (1개 이상, ID 중복 불가)
     * @return ProfileRegistry
     * @throws IllegalArgumentException 비어있거나 ID가 중복된 경우
     */
    public static ProfileRegistry of(Collection<ProfileConfig> profiles) {
        if (profiles == null || profiles.isEmpty()) {
            throw new IllegalArgumentException("at least one profile is required");
        }
        Map<String, ProfileConfig> byId = new LinkedHashMap<>();
        for (ProfileConfig profile : profiles) {
            if (byId.putIfAbsent(profile.id(), profile) != null) {
                throw new IllegalArgumentException("duplicate profile id: " + profile.id());
            }
        }
        return new ProfileRegistry(Map.copyOf(byId));
    }

    /**
     * 기본 Profile 구성 (python-default, python-data).
     *
     * @return ProfileRegistry
     */
    public static ProfileRegistry defaults() {
        return of(List.of(
            ProfileConfig.ship("python-default", "ship:latest", 1.0, "1g"),
            ProfileConfig.ship("python-data", "ship:data", 2.0, "4g")
        ));
    }

    public Optional<ProfileConfig> find(String profileId) {
        return Optional.ofNullable(profileId == null ? null : profiles.get(profileId));
    }

    /**
     * Profile 조회 (API 경계용).
     *
     * @param profileId Profile ID
     * @return ProfileConfig
     * @throws ValidationException 존재하지 않는 Profile인 경우
     */
    public ProfileConfig require(String profileId) {
        return find(profileId).orElseThrow(() ->
            new ValidationException("Invalid profile: " + profileId, "profile", profileId));
    }

    public List<ProfileConfig> all() {
        List<ProfileConfig> list = new ArrayList<>(profiles.values());
        list.sort((a, b) -> a.id().compareTo(b.id()));
        return list;
    }
}
