package com.ryuqq.tickline.adapter.runner;

import com.ryuqq.tickline.application.runtime.Runtime;
import com.ryuqq.tickline.core.dispatcher.CommandDispatcher;
import com.ryuqq.tickline.core.model.Command;
import com.ryuqq.tickline.core.queue.CommandQueue;
import com.ryuqq.tickline.core.recorder.CommandRecorder;
import com.ryuqq.tickline.core.recorder.ReplayStepControl;
import com.ryuqq.tickline.core.result.CommandExecutionOutcome;
import com.ryuqq.tickline.core.spi.TelemetrySink;
import com.ryuqq.tickline.core.telemetry.TelemetryEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 고정 step Runtime 구현체.
 *
 * <p>경과 시간을 누적해 step 단위로 명령 큐를 소비하고, Dispatcher로 실행한 결과를
 * transport 경계가 가져갈 수 있도록 모아 둡니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>경과 시간 누적 및 프레임당 step 수 제한</li>
 *   <li>step별 명령 drain 및 step 불일치 명령 건너뛰기</li>
 *   <li>Dispatcher를 통한 명령 실행 및 결과 수집</li>
 *   <li>큐 카운터 및 tick telemetry 기록</li>
 *   <li>recorder가 설정된 경우 실행 직전 명령 기록</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * tick(deltaMs) 호출
 *   ↓
 * steps = min(floor(accumulator / stepSizeMs), maxStepsPerFrame)
 *   ↓
 * For each step:
 *   1. dequeueUpToStep(currentStep) → [Command1, Command2, ...]
 *   2. nextExecutableStep = currentStep + 1 (실행 중 적재된 명령은 다음 step)
 *   3. step 일치 → recorder.record(command) → dispatcher.executeWithResult(command) → outcome 수집
 *      step 불일치 → CommandStepMismatch 기록 후 건너뜀
 *   4. recordCounters(commandQueue) + recordTick()
 *   5. currentStep++
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>tick()은 단일 simulation 스레드에서 호출해야 함</li>
 *   <li>비동기 handler는 다른 스레드에서 완료될 수 있으므로 outcome은
 *       {@link ConcurrentLinkedQueue}에 모음</li>
 * </ul>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class StepRunner implements Runtime, ReplayStepControl {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final CommandQueue queue;
    private final CommandDispatcher dispatcher;
    private final TelemetrySink telemetry;
    private final StepRunnerConfig config;
    private final ConcurrentLinkedQueue<CommandExecutionOutcome> outcomes = new ConcurrentLinkedQueue<>();

    private CommandRecorder recorder;
    private long accumulatorMs;
    private long currentStep;
    private long nextExecutableStep;

    /**
     * 생성자.
     *
     * @param queue 명령 큐
     * @param dispatcher 명령 실행기
     * @param telemetry telemetry sink
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StepRunner(CommandQueue queue, CommandDispatcher dispatcher, TelemetrySink telemetry, StepRunnerConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.queue = queue;
        this.dispatcher = dispatcher;
        this.telemetry = telemetry;
        this.config = config;
    }

    @Override
    public void tick(long deltaMs) {
        if (deltaMs <= 0) {
            return;
        }

        accumulatorMs += deltaMs;
        long availableSteps = accumulatorMs / config.stepSizeMs();
        long steps = Math.min(availableSteps, config.maxStepsPerFrame());
        if (steps == 0) {
            return;
        }
        accumulatorMs -= steps * config.stepSizeMs();

        if (availableSteps > steps) {
            log.warn("Frame clamped to {} steps, {}ms backlog remaining", steps, accumulatorMs);
        }

        for (long i = 0; i < steps; i++) {
            runStep();
        }
    }

    @Override
    public long getCurrentStep() {
        return currentStep;
    }

    @Override
    public long getNextExecutableStep() {
        return nextExecutableStep;
    }

    @Override
    public void setCurrentStep(long step) {
        this.currentStep = step;
    }

    @Override
    public void setNextExecutableStep(long step) {
        this.nextExecutableStep = step;
    }

    /**
     * 실행하는 명령을 기록할 recorder 설정.
     *
     * @param recorder 명령 recorder (null이면 기록하지 않음)
     */
    public void setCommandRecorder(CommandRecorder recorder) {
        this.recorder = recorder;
    }

    @Override
    public List<CommandExecutionOutcome> drainCommandOutcomes() {
        List<CommandExecutionOutcome> drained = new ArrayList<>();
        CommandExecutionOutcome outcome;
        while ((outcome = outcomes.poll()) != null) {
            drained.add(outcome);
        }
        return drained;
    }

    /**
     * 누적기에 남은 시간.
     *
     * @return 아직 step으로 소비되지 않은 시간 (밀리초)
     */
    public long getAccumulatorBacklogMs() {
        return accumulatorMs;
    }

    private void runStep() {
        long step = currentStep;
        int sizeBefore = queue.size();

        nextExecutableStep = step;
        List<Command> commands = queue.dequeueUpToStep(step);
        nextExecutableStep = step + 1;

        long executed = 0;
        long skipped = 0;
        for (Command command : commands) {
            if (command.step() != step) {
                skipped++;
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("expectedStep", step);
                data.put("commandStep", command.step());
                data.put("type", command.type());
                telemetry.recordError(TelemetryEvents.COMMAND_STEP_MISMATCH, data);
                continue;
            }

            if (recorder != null) {
                recorder.record(command);
            }
            String requestId = command.requestId();
            dispatcher.executeWithResult(command)
                .thenAccept(result -> outcomes.add(new CommandExecutionOutcome(requestId, step, result)));
            executed++;
        }

        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("sizeBefore", (long) sizeBefore);
        counters.put("sizeAfter", (long) queue.size());
        counters.put("captured", (long) commands.size());
        counters.put("executed", executed);
        counters.put("skipped", skipped);
        telemetry.recordCounters(TelemetryEvents.COMMAND_QUEUE_COUNTERS, counters);

        log.debug("Step {} completed: captured={}, executed={}, skipped={}", step, commands.size(), executed, skipped);

        currentStep = step + 1;
        nextExecutableStep = currentStep;
        telemetry.recordTick();
    }
}
