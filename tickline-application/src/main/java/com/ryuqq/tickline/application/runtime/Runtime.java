package com.ryuqq.tickline.application.runtime;

import com.ryuqq.tickline.core.result.CommandExecutionOutcome;

import java.util.List;

/**
 * Fixed-Step Simulation Runtime.
 *
 * <p>This interface defines the driver that advances the simulation in
 * fixed-size steps and drains the command queue once per step.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Accumulation of wall-clock time into whole simulation steps</li>
 *   <li>Draining of commands scheduled up to the current step</li>
 *   <li>Execution through the command dispatcher</li>
 *   <li>Collection of execution outcomes for the transport boundary</li>
 * </ul>
 *
 * <p><strong>Runtime Step Flow:</strong></p>
 * <pre>
 * tick(deltaMs)
 *   ↓
 * accumulator += deltaMs
 * steps = min(floor(accumulator / stepSizeMs), maxStepsPerFrame)
 * repeat steps times:
 *   1. nextExecutableStep = currentStep
 *   2. Dequeue commands with step &lt;= currentStep
 *   3. nextExecutableStep = currentStep + 1
 *   4. For each command:
 *      a. step == currentStep → dispatch, collect outcome
 *      b. otherwise → report CommandStepMismatch, skip
 *   5. Record queue counters and tick telemetry
 *   6. currentStep++
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>tick() is invoked from a single simulation thread (frame loop or scheduler)</li>
 *   <li>The queue and dispatcher are not safe for concurrent mutation</li>
 *   <li>Outcome collection tolerates handlers completing on other threads</li>
 * </ul>
 *
 * <p><strong>Integration with Other Components:</strong></p>
 * <ul>
 *   <li>CommandQueue: per-step drain</li>
 *   <li>CommandDispatcher: authorization and handler execution</li>
 *   <li>CommandTransportServer: stamps incoming commands with
 *       {@link #getNextExecutableStep()}, consumes {@link #drainCommandOutcomes()}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * long last = System.currentTimeMillis();
 * while (running) {
 *     long now = System.currentTimeMillis();
 *     runtime.tick(now - last);
 *     last = now;
 *     transportServer.drainOutcomeResponses(now, runtime.drainCommandOutcomes());
 * }
 * </pre>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Advances the simulation by the given amount of wall-clock time.
     *
     * <p>Non-positive deltas are ignored. Leftover time below one step stays
     * in the accumulator for the next call; time beyond
     * {@code maxStepsPerFrame} steps is kept as well and consumed by later
     * calls.</p>
     *
     * @param deltaMs elapsed milliseconds since the previous call
     */
    void tick(long deltaMs);

    /**
     * Returns the step that will run on the next executed step.
     *
     * @return current step (starts at 0)
     */
    long getCurrentStep();

    /**
     * Returns the earliest step a newly submitted command can still run at.
     *
     * <p>While a step is draining this equals the step after the one being
     * executed, so commands enqueued from handlers never join the running
     * batch.</p>
     *
     * @return next executable step
     */
    long getNextExecutableStep();

    /**
     * Returns and clears the outcomes collected since the previous call.
     *
     * @return outcomes in execution order (never null)
     */
    List<CommandExecutionOutcome> drainCommandOutcomes();
}
