package com.ryuqq.tickline.core.model;

/**
 * 멱등성 레지스트리에 저장된 응답 기록.
 *
 * <p>최초 응답 시 생성되고, 같은 키로 다시 기록하면 덮어씁니다.
 * {@code recordedAtMs + ttlMs <= now}가 되면 만료됩니다.</p>
 *
 * @param key 멱등성 키
 * @param response 기록된 응답
 * @param recordedAtMs 기록 시각 (epoch millis)
 * @param <R> 응답 타입
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record IdempotencyRecord<R>(
    IdempotencyKey key,
    R response,
    long recordedAtMs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key 또는 response가 null인 경우
     */
    public IdempotencyRecord {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }

    /**
     * 주어진 시각 기준 만료 여부.
     *
     * @param nowMs 현재 시각 (epoch millis)
     * @param ttlMs 보존 기간 (밀리초)
     * @return 만료되었으면 true
     */
    public boolean isExpired(long nowMs, long ttlMs) {
        return recordedAtMs + ttlMs <= nowMs;
    }
}
