package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.adapter.inmemory.store.InMemoryIdempotencyStore;
import com.ryuqq.bay.application.idempotency.IdempotencyRequest;
import com.ryuqq.bay.application.idempotency.StoredResponse;
import com.ryuqq.bay.application.sandbox.SandboxView;
import com.ryuqq.bay.core.config.IdempotencyConfig;
import com.ryuqq.bay.core.error.ConflictException;
import com.ryuqq.bay.core.error.ValidationException;
import com.ryuqq.bay.core.model.IdempotencyRecord;
import com.ryuqq.bay.core.statemachine.SandboxStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StoreBackedIdempotencyLedger 유닛 테스트.
 *
 * @author Bay Team
 * @since 1.0.0
 */
class StoreBackedIdempotencyLedgerTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private TestClock clock;
    private InMemoryIdempotencyStore store;
    private StoreBackedIdempotencyLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        store = new InMemoryIdempotencyStore();
        ledger = new StoreBackedIdempotencyLedger(store, new IdempotencyConfig(),
            StoreBackedIdempotencyLedger.defaultObjectMapper(), clock);
    }

    private static IdempotencyRequest createRequest(String key, Object body) {
        return new IdempotencyRequest("alice", key, "POST", "/v1/sandboxes", body);
    }

    private static SandboxView sampleView(String id) {
        return new SandboxView(id, SandboxStatus.IDLE, "python-default", "ws-000000000001",
            List.of("filesystem", "shell"), START, START.plusSeconds(600), null);
    }

    @Test
    void 기록이_없으면_empty() {
        assertThat(ledger.check(createRequest("k1", Map.of("profile", "python-default")))).isEmpty();
    }

    @Test
    void 저장_후_같은_요청은_저장된_응답을_재생() {
        // given
        IdempotencyRequest request = createRequest("k1", Map.of("profile", "python-default"));
        StoredResponse saved = ledger.save(request, Map.of("id", "sandbox-abc"), 201);

        // when
        Optional<StoredResponse> replay = ledger.check(request);

        // then
        assertThat(replay).contains(saved);
        assertThat(saved.statusCode()).isEqualTo(201);
        assertThat(saved.body()).contains("sandbox-abc");
    }

    @Test
    void body의_키_순서가_달라도_같은_지문() {
        // given
        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put("profile", "python-default");
        ordered.put("ttl", 600);
        Map<String, Object> reversed = new LinkedHashMap<>();
        reversed.put("ttl", 600);
        reversed.put("profile", "python-default");
        ledger.save(createRequest("k1", ordered), Map.of("id", "sandbox-abc"), 201);

        // when & then
        assertThat(ledger.check(createRequest("k1", reversed))).isPresent();
    }

    @Test
    void 같은_키_다른_요청은_conflict() {
        // given
        ledger.save(createRequest("k1", Map.of("ttl", 600)), Map.of("id", "sandbox-abc"), 201);

        // when & then
        assertThatThrownBy(() -> ledger.check(createRequest("k1", Map.of("ttl", 1200))))
            .isInstanceOf(ConflictException.class);
    }

    @Test
    void 같은_키라도_경로가_다르면_conflict() {
        // given
        ledger.save(createRequest("k1", null), Map.of("ok", true), 200);
        IdempotencyRequest otherPath = new IdempotencyRequest("alice", "k1", "POST", "/v1/sandboxes/x/stop", null);

        // when & then
        assertThatThrownBy(() -> ledger.check(otherPath)).isInstanceOf(ConflictException.class);
    }

    @Test
    void 소유자가_다르면_키_공간이_분리됨() {
        // given
        ledger.save(createRequest("k1", null), Map.of("ok", true), 200);
        IdempotencyRequest bob = new IdempotencyRequest("bob", "k1", "POST", "/v1/sandboxes", Map.of("x", 1));

        // when & then
        assertThat(ledger.check(bob)).isEmpty();
    }

    @Test
    void 만료된_기록은_없는_것으로_취급하고_삭제() {
        // given
        IdempotencyRequest request = createRequest("k1", null);
        ledger.save(request, Map.of("ok", true), 200);
        clock.advance(Duration.ofHours(1));

        // when
        Optional<StoredResponse> replay = ledger.check(request);

        // then
        assertThat(replay).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void 경쟁에서_진_save는_승자의_기록을_반환() {
        // given
        IdempotencyRequest request = createRequest("k1", null);
        StoredResponse winner = ledger.save(request, Map.of("id", "sandbox-winner"), 201);

        // when
        StoredResponse loser = ledger.save(request, Map.of("id", "sandbox-loser"), 201);

        // then
        assertThat(loser).isEqualTo(winner);
        assertThat(loser.body()).contains("sandbox-winner");
    }

    @Test
    void 만료된_기록_위에_save하면_새_기록으로_대체() {
        // given
        IdempotencyRequest request = createRequest("k1", null);
        ledger.save(request, Map.of("id", "old"), 201);
        clock.advance(Duration.ofHours(2));

        // when
        StoredResponse saved = ledger.save(request, Map.of("id", "new"), 201);

        // then
        assertThat(saved.body()).contains("new");
        IdempotencyRecord record = store.find("alice", "k1").orElseThrow();
        assertThat(record.expiresAt()).isEqualTo(START.plus(Duration.ofHours(3)));
    }

    @Test
    void execute는_재생_시_연산을_다시_실행하지_않음() {
        // given
        IdempotencyRequest request = createRequest("k1", Map.of("profile", "python-default"));
        AtomicInteger executions = new AtomicInteger();

        // when
        SandboxView first = ledger.execute(request, SandboxView.class, 201, () -> {
            executions.incrementAndGet();
            return sampleView("sandbox-000000000001");
        });
        SandboxView second = ledger.execute(request, SandboxView.class, 201, () -> {
            executions.incrementAndGet();
            return sampleView("sandbox-000000000002");
        });

        // then
        assertThat(executions.get()).isEqualTo(1);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void 키가_없으면_기록하지_않고_항상_실행() {
        // given
        IdempotencyRequest request = createRequest(null, null);
        AtomicInteger executions = new AtomicInteger();

        // when
        ledger.execute(request, SandboxView.class, 201, () -> {
            executions.incrementAndGet();
            return sampleView("sandbox-000000000001");
        });
        ledger.execute(request, SandboxView.class, 201, () -> {
            executions.incrementAndGet();
            return sampleView("sandbox-000000000001");
        });

        // then
        assertThat(executions.get()).isEqualTo(2);
        assertThat(store.size()).isZero();
    }

    @Test
    void 원장이_비활성이면_키가_있어도_기록하지_않음() {
        // given
        ledger = new StoreBackedIdempotencyLedger(store, new IdempotencyConfig().withEnabled(false),
            StoreBackedIdempotencyLedger.defaultObjectMapper(), clock);
        IdempotencyRequest request = createRequest("k1", null);

        // when
        ledger.save(request, Map.of("ok", true), 200);

        // then
        assertThat(ledger.check(request)).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void 잘못된_키_형식은_validation_error() {
        assertThatThrownBy(() -> ledger.check(createRequest("has space", null)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.check(createRequest("x".repeat(129), null)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.check(createRequest("", null)))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void purgeExpired는_만료된_기록만_삭제() {
        // given
        ledger.save(createRequest("old", null), Map.of("ok", true), 200);
        clock.advance(Duration.ofMinutes(30));
        ledger.save(createRequest("fresh", null), Map.of("ok", true), 200);
        clock.advance(Duration.ofMinutes(31));

        // when
        int purged = ledger.purgeExpired(100);

        // then
        assertThat(purged).isEqualTo(1);
        assertThat(store.find("alice", "fresh")).isPresent();
        assertThat(store.find("alice", "old")).isEmpty();
    }
}
