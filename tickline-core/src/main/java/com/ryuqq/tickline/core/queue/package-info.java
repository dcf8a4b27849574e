/**
 * Priority-laned, capacity-bounded command queue.
 *
 * <p>Admission authorizes the command, replaces its payload with an immutable snapshot and
 * applies the overflow policy before the command becomes visible to the driver.</p>
 *
 * @since 1.0.0
 * @author Tickline Team
 */
package com.ryuqq.tickline.core.queue;
