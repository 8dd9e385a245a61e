package com.ryuqq.bay.application.sandbox;

import com.ryuqq.bay.core.statemachine.SandboxStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 요청/응답 record 유닛 테스트.
 *
 * @author Bay Team
 * @since 1.0.0
 */
class CreateSandboxRequestTest {

    @Test
    void ttl_null_또는_0이면_무한() {
        assertThat(new CreateSandboxRequest("python-default", null, null).hasInfiniteTtl()).isTrue();
        assertThat(new CreateSandboxRequest("python-default", null, 0L).hasInfiniteTtl()).isTrue();
        assertThat(new CreateSandboxRequest("python-default", null, 60L).hasInfiniteTtl()).isFalse();
    }

    @Test
    void profile_누락_거부() {
        assertThatThrownBy(() -> new CreateSandboxRequest(null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("profileId");
    }

    @Test
    void SandboxView_capabilities_방어적_복사() {
        // given
        List<String> capabilities = new ArrayList<>(List.of("shell"));

        // when
        SandboxView view = new SandboxView("sandbox-1", SandboxStatus.IDLE, "python-default", "ws-1",
            capabilities, Instant.EPOCH, null, null);
        capabilities.add("python");

        // then
        assertThat(view.capabilities()).containsExactly("shell");
    }

    @Test
    void SandboxPage_다음_커서_여부() {
        assertThat(new SandboxPage(List.of(), null).hasMore()).isFalse();
        assertThat(new SandboxPage(null, "sandbox-9").hasMore()).isTrue();
    }
}
