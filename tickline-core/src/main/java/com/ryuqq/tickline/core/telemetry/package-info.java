/**
 * Telemetry event names recorded by the command pipeline.
 *
 * <p>Sinks are injected through constructors; the
 * {@link com.ryuqq.tickline.core.telemetry.noop.NoOpTelemetrySink} is the default when none is given.</p>
 *
 * @since 1.0.0
 * @author Tickline Team
 */
package com.ryuqq.tickline.core.telemetry;
