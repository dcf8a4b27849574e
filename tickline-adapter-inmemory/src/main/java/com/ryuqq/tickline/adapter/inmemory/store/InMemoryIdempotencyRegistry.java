package com.ryuqq.tickline.adapter.inmemory.store;

import com.ryuqq.tickline.core.model.IdempotencyKey;
import com.ryuqq.tickline.core.model.IdempotencyRecord;
import com.ryuqq.tickline.core.spi.IdempotencyRegistry;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link IdempotencyRegistry} for testing and reference purposes.
 *
 * <p>Responses are kept per {@link IdempotencyKey} together with the time they
 * were recorded. A record expires once {@code recordedAtMs + ttlMs <= now}.
 * The registry has no clock of its own: {@code now} is always the caller's time,
 * passed to {@link #record} and {@link #purgeExpired}.</p>
 *
 * <p><strong>Expiry Semantics:</strong></p>
 * <ul>
 *   <li>{@link #get(IdempotencyKey)} checks expiry against the latest time the caller
 *       has supplied and evicts the expired record it finds</li>
 *   <li>{@link #purgeExpired(long)} removes every record expired at the given time</li>
 *   <li>Recording the same key again overwrites the response and restarts the TTL</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Backed by {@link ConcurrentHashMap}</li>
 *   <li>Expired-record eviction uses {@link ConcurrentHashMap#remove(Object, Object)}
 *       so a concurrent overwrite is never lost</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * IdempotencyRegistry&lt;CommandResponse&gt; registry =
 *     new InMemoryIdempotencyRegistry&lt;&gt;(Duration.ofMinutes(5).toMillis());
 *
 * registry.record(IdempotencyKey.of("client-a", "req-1"), response, System.currentTimeMillis());
 * registry.get(IdempotencyKey.of("client-a", "req-1")); // Optional[response]
 * </pre>
 *
 * @param <R> the response type
 * @author Tickline Team
 * @since 1.0.0
 */
public class InMemoryIdempotencyRegistry<R> implements IdempotencyRegistry<R> {

    /**
     * Default time-to-live: 5 minutes.
     */
    public static final long DEFAULT_TTL_MS = 5 * 60 * 1000L;

    private final ConcurrentHashMap<IdempotencyKey, IdempotencyRecord<R>> store;
    private final long ttlMs;
    private final AtomicLong latestNowMs;

    /**
     * Creates a registry with the default TTL.
     */
    public InMemoryIdempotencyRegistry() {
        this(DEFAULT_TTL_MS);
    }

    /**
     * Creates a registry with a custom TTL.
     *
     * @param ttlMs record time-to-live in milliseconds (must be positive)
     * @throws IllegalArgumentException if ttlMs is not positive
     */
    public InMemoryIdempotencyRegistry(long ttlMs) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException(
                "ttlMs must be positive (current: " + ttlMs + ")"
            );
        }
        this.store = new ConcurrentHashMap<>();
        this.ttlMs = ttlMs;
        this.latestNowMs = new AtomicLong(Long.MIN_VALUE);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if key or response is null
     */
    @Override
    public void record(IdempotencyKey key, R response, long nowMs) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
        advanceTo(nowMs);
        store.put(key, new IdempotencyRecord<>(key, response, nowMs));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Expiry is evaluated against the latest {@code nowMs} seen by
     *       {@link #record} or {@link #purgeExpired}</li>
     *   <li>An expired record found here is removed eagerly</li>
     * </ul>
     *
     * @throws IllegalArgumentException if key is null
     */
    @Override
    public Optional<R> get(IdempotencyKey key) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }

        IdempotencyRecord<R> record = store.get(key);
        if (record == null) {
            return Optional.empty();
        }
        if (record.isExpired(latestNowMs.get(), ttlMs)) {
            store.remove(key, record);
            return Optional.empty();
        }
        return Optional.of(record.response());
    }

    @Override
    public void purgeExpired(long nowMs) {
        advanceTo(nowMs);
        store.values().removeIf(record -> record.isExpired(nowMs, ttlMs));
    }

    @Override
    public long ttlMs() {
        return ttlMs;
    }

    @Override
    public int size() {
        return store.size();
    }

    private void advanceTo(long nowMs) {
        latestNowMs.accumulateAndGet(nowMs, Math::max);
    }

    /**
     * Clears all stored records.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        store.clear();
    }
}
