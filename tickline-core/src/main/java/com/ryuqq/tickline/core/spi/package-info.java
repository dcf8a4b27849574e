/**
 * Service Provider Interfaces implemented by hosts and adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.tickline.core.spi.TelemetrySink} - structured operational events</li>
 *   <li>{@link com.ryuqq.tickline.core.spi.IdempotencyRegistry} - response cache keyed by client and request id</li>
 *   <li>{@link com.ryuqq.tickline.core.spi.EventPublisher} - domain events raised from handlers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Tickline Team
 */
package com.ryuqq.tickline.core.spi;
