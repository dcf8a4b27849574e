package com.ryuqq.tickline.core.spi;

import com.ryuqq.tickline.core.model.IdempotencyKey;

import java.util.Optional;

/**
 * 멱등성 응답 레지스트리 SPI (Service Provider Interface).
 *
 * <p>transport 경계는 {@code (clientId, requestId)}로 최초 응답을 기록하고,
 * 같은 키로 재전송된 요청에는 기록된 응답을 다시 돌려줍니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>같은 키로 다시 기록하면 덮어쓰기</li>
 *   <li>TTL이 지난 기록은 조회 시 없는 것으로 취급</li>
 *   <li>{@link #purgeExpired(long)} 호출 시 만료 기록 제거</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * // InMemory 구현 (테스트용)
 * IdempotencyRegistry&lt;CommandResponse&gt; registry = new InMemoryIdempotencyRegistry&lt;&gt;();
 * registry.record(IdempotencyKey.of("client-a", "req-1"), response, now);
 * registry.get(IdempotencyKey.of("client-a", "req-1")); // Optional[response]
 * </pre>
 *
 * @param <R> 응답 타입
 * @author Tickline Team
 * @since 1.0.0
 */
public interface IdempotencyRegistry<R> {

    /**
     * 응답 기록 (이미 있으면 덮어쓰기).
     *
     * @param key 멱등성 키
     * @param response 응답
     * @param nowMs 기록 시각 (epoch millis)
     * @throws IllegalArgumentException key 또는 response가 null인 경우
     */
    void record(IdempotencyKey key, R response, long nowMs);

    /**
     * 기록된 응답 조회.
     *
     * <p>만료 여부는 호출자가 {@link #record}나 {@link #purgeExpired}로 전달한 가장 최근 시각 기준으로 판단합니다.
     * 구현체는 별도의 시계를 두지 않습니다.</p>
     *
     * @param key 멱등성 키
     * @return 응답 (없거나 만료된 경우 empty)
     * @throws IllegalArgumentException key가 null인 경우
     */
    Optional<R> get(IdempotencyKey key);

    /**
     * 주어진 시각 기준으로 만료된 기록 제거.
     *
     * @param nowMs 기준 시각 (epoch millis)
     */
    void purgeExpired(long nowMs);

    /**
     * 기록 보존 기간.
     *
     * @return TTL (밀리초)
     */
    long ttlMs();

    /**
     * 저장된 기록 수 (아직 제거되지 않은 만료 기록 포함).
     *
     * @return 기록 수
     */
    int size();
}
