/**
 * In-memory store adapters.
 *
 * <p>Provides {@link com.ryuqq.tickline.adapter.inmemory.store.InMemoryIdempotencyRegistry},
 * a {@link java.util.concurrent.ConcurrentHashMap}-backed implementation of the
 * {@link com.ryuqq.tickline.core.spi.IdempotencyRegistry} SPI with TTL-based expiry.</p>
 *
 * <p><strong>Intended Use:</strong></p>
 * <ul>
 *   <li>Single-process deployments of the transport boundary</li>
 *   <li>Unit and contract tests</li>
 * </ul>
 *
 * <p>Records live only as long as the JVM. Durable registries implement the same
 * SPI and run {@code AbstractIdempotencyRegistryContractTest} from the testkit.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tickline.adapter.inmemory.store;
