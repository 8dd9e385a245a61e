package com.ryuqq.bay.application.idempotency;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 요청 멱등성 원장.
 *
 * <p>클라이언트 재시도 시 <em>자기 자신의</em> 이전 결과를 재생하는 것을 보장합니다.
 * 키를 공유하지 않는 논리적으로 다른 두 요청을 직렬화하지는 않습니다.</p>
 *
 * <p><strong>사용 흐름:</strong></p>
 * <pre>
 * Optional&lt;StoredResponse&gt; replay = ledger.check(request);
 * if (replay.isPresent()) {
 *     return replay.get();           // 연산을 다시 실행하지 않음
 * }
 * SandboxView result = orchestrator.create(owner, body);
 * return ledger.save(request, result, 201);  // 반드시 정확히 한 번 호출
 * </pre>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface IdempotencyLedger {

    /**
     * 기록 조회.
     *
     * <ul>
     *   <li>키 없음 / 원장 비활성: empty (무조건 진행)</li>
     *   <li>기록 없음 또는 만료(삭제 후): empty (진행 후 save 필수)</li>
     *   <li>fingerprint 일치: 저장된 응답 (재생)</li>
     *   <li>fingerprint 불일치: {@link com.ryuqq.bay.core.error.ConflictException}</li>
     * </ul>
     *
     * @param request 요청
     * @return 재생할 응답 (없으면 empty)
     * @throws com.ryuqq.bay.core.error.ValidationException 키 형식이 잘못된 경우
     * @throws com.ryuqq.bay.core.error.ConflictException 같은 키가 다른 요청에 사용된 경우
     */
    Optional<StoredResponse> check(IdempotencyRequest request);

    /**
     * 연산 결과 기록 (원자적 insert).
     *
     * <p>동시에 같은 키로 저장한 다른 요청에 경쟁에서 지면, 승자의 기록을 다시 읽어
     * 그것을 권위 있는 결과로 반환합니다.</p>
     *
     * @param request 요청
     * @param response 응답 본문 (JSON으로 직렬화)
     * @param statusCode HTTP 상태 코드
     * @return 원장에 남은 권위 있는 응답
     */
    StoredResponse save(IdempotencyRequest request, Object response, int statusCode);

    /**
     * check → 실행 → save 를 한 번에 수행.
     *
     * @param request 요청
     * @param responseType 응답 타입 (재생 시 역직렬화)
     * @param statusCode 성공 시 HTTP 상태 코드
     * @param operation 실제 연산
     * @param <T> 응답 타입
     * @return 재생된 응답 또는 새로 실행한 결과 (경쟁에서 진 경우 승자의 결과)
     */
    <T> T execute(IdempotencyRequest request, Class<T> responseType, int statusCode, Supplier<T> operation);

    /**
     * 만료된 기록 일괄 삭제.
     *
     * @param limit 최대 삭제 건수
     * @return 삭제 건수
     */
    int purgeExpired(int limit);
}
