/**
 * Command model package.
 *
 * <p>This package defines the immutable value types that flow through the pipeline.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tickline.core.model.Command} - Typed instruction with priority, payload and step metadata</li>
 *   <li>{@link com.ryuqq.tickline.core.model.CommandPriority} - Fixed drain lanes (SYSTEM, PLAYER, AUTOMATION)</li>
 *   <li>{@link com.ryuqq.tickline.core.model.RuntimeCommandTypes} - Built-in command type catalogue</li>
 *   <li>{@link com.ryuqq.tickline.core.model.IdempotencyKey} - (clientId, requestId) deduplication key</li>
 *   <li>{@link com.ryuqq.tickline.core.model.IdempotencyRecord} - Recorded response with its recording time</li>
 * </ul>
 *
 * <h2>Validation</h2>
 * <p>All records validate in their compact constructors and throw
 * {@link java.lang.IllegalArgumentException} for construction defects
 * (blank type, missing priority, blank identifiers).</p>
 *
 * @since 1.0.0
 * @author Tickline Team
 */
package com.ryuqq.tickline.core.model;
