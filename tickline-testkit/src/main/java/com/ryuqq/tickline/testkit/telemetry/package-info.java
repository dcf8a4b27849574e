/**
 * Telemetry test doubles.
 *
 * <p>{@link com.ryuqq.tickline.testkit.telemetry.RecordingTelemetrySink} records every
 * event reported by the queue, dispatcher, authorizer and step runner so tests can
 * assert on telemetry without mocking.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tickline.testkit.telemetry;
