/**
 * Command execution results.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tickline.core.result.CommandResult} - Sealed interface (permits Success, Failure)</li>
 * </ul>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tickline.core.result.Success} - Command applied</li>
 *   <li>{@link com.ryuqq.tickline.core.result.Failure} - Recoverable failure carrying a
 *       {@link com.ryuqq.tickline.core.result.CommandError} with a stable code</li>
 * </ul>
 *
 * <p>Handler defects are converted to {@code COMMAND_EXECUTION_FAILED} failures by the dispatcher,
 * so a result is always returned and never thrown.</p>
 *
 * @since 1.0.0
 * @author Tickline Team
 */
package com.ryuqq.tickline.core.result;
