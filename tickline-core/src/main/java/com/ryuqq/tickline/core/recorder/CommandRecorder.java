package com.ryuqq.tickline.core.recorder;

import com.ryuqq.tickline.core.authorization.AuthorizationContext;
import com.ryuqq.tickline.core.dispatcher.CommandDispatcher;
import com.ryuqq.tickline.core.model.Command;
import com.ryuqq.tickline.core.queue.CommandQueue;
import com.ryuqq.tickline.core.result.CommandErrorCodes;
import com.ryuqq.tickline.core.result.CommandResult;
import com.ryuqq.tickline.core.result.Failure;
import com.ryuqq.tickline.core.snapshot.ImmutableSnapshots;
import com.ryuqq.tickline.core.spi.TelemetrySink;
import com.ryuqq.tickline.core.telemetry.TelemetryEvents;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 실행된 명령을 기록하고 다시 실행하는 recorder.
 *
 * <p>드라이버가 실행 직전에 {@link #record(Command)}를 호출하면 payload가 snapshot된 사본이
 * 기록됩니다. {@link #export()}로 내보낸 {@link CommandLog}는 {@link #replay}로 같은 순서대로
 * 다시 실행할 수 있습니다.</p>
 *
 * <p><strong>replay 처리 흐름:</strong></p>
 * <pre>
 * 큐가 비어있지 않음 → ReplayQueueNotEmpty 기록 후 IllegalStateException
 *   ↓
 * For each 기록된 명령:
 *   1. handler 없음 → ReplayUnknownCommandType 기록 후 건너뜀
 *   2. dispatcher.executeWithResult(command, REPLAY context) 완료까지 대기
 *      handler 실패 → ReplayExecutionFailed 기록 후 계속
 *   3. 실행 중 큐에 적재된 명령 drain → 이후 기록에서 아직 대응되지 않은 같은 명령을 찾음
 *      없으면 ReplayMissingFollowupCommand 기록 후 IllegalStateException
 *   4. 1000개마다 CommandReplay 진행 기록
 *   ↓
 * 성공 → current/next step = finalStep + 1
 * 실패 → 이전 step 값 복원
 * </pre>
 *
 * <p>handler가 적재한 후속 명령은 큐에 남지 않습니다. 기록에 이미 포함되어 있으므로
 * 기록된 순서에서 한 번만 실행됩니다.</p>
 *
 * <p>단일 simulation 스레드에서 사용하도록 설계되었으며 thread-safe하지 않습니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class CommandRecorder {

    /** 진행 telemetry를 기록하는 명령 수 간격. */
    public static final int PROGRESS_BATCH_SIZE = 1000;

    private static final AuthorizationContext REPLAY_CONTEXT = AuthorizationContext.replay("replay");

    private final TelemetrySink telemetry;
    private final LongSupplier clock;
    private final List<Command> recorded = new ArrayList<>();

    private Object startState;
    private long lastRecordedStep = -1;

    /**
     * 생성자.
     *
     * @param startState 기록 시작 시점의 상태 (null 가능)
     * @param telemetry telemetry sink
     * @param clock 내보낸 시각을 제공하는 epoch millis 시계
     * @throws IllegalArgumentException telemetry 또는 clock이 null이거나 상태를 snapshot할 수 없는 경우
     */
    public CommandRecorder(Object startState, TelemetrySink telemetry, LongSupplier clock) {
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.telemetry = telemetry;
        this.clock = clock;
        this.startState = ImmutableSnapshots.snapshot(startState);
    }

    /**
     * 명령 기록.
     *
     * @param command 기록할 명령
     * @throws IllegalArgumentException command가 null이거나 payload를 snapshot할 수 없는 경우
     */
    public void record(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        recorded.add(command.withPayload(ImmutableSnapshots.snapshot(command.payload())));
        lastRecordedStep = Math.max(lastRecordedStep, command.step());
    }

    /**
     * 지금까지의 기록을 내보냄.
     *
     * @return 변경 불가능한 명령 기록
     */
    public CommandLog export() {
        return new CommandLog(
            CommandLog.CURRENT_VERSION,
            startState,
            recorded,
            clock.getAsLong(),
            lastRecordedStep
        );
    }

    /**
     * 기록을 비우고 새 시작 상태로 다시 시작.
     *
     * @param nextState 새 시작 상태 (null 가능)
     */
    public void clear(Object nextState) {
        recorded.clear();
        startState = ImmutableSnapshots.snapshot(nextState);
        lastRecordedStep = -1;
    }

    public int size() {
        return recorded.size();
    }

    /**
     * step 위치를 옮기지 않고 재실행.
     *
     * @param log 재실행할 기록
     * @param dispatcher 명령 실행기
     * @param queue handler가 후속 명령을 적재하는 큐
     * @throws IllegalStateException 큐가 비어있지 않거나 기록에 없는 후속 명령이 적재된 경우
     */
    public void replay(CommandLog log, CommandDispatcher dispatcher, CommandQueue queue) {
        replay(log, dispatcher, queue, null);
    }

    /**
     * 재실행 후 드라이버의 step 위치를 마지막 기록 다음 step으로 옮김.
     *
     * @param log 재실행할 기록
     * @param dispatcher 명령 실행기
     * @param queue handler가 후속 명령을 적재하는 큐
     * @param stepControl step 위치 접근점 (null이면 옮기지 않음)
     * @throws IllegalArgumentException log, dispatcher, queue가 null인 경우
     * @throws IllegalStateException 큐가 비어있지 않거나 기록에 없는 후속 명령이 적재된 경우
     */
    public void replay(CommandLog log, CommandDispatcher dispatcher, CommandQueue queue, ReplayStepControl stepControl) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }

        if (!queue.isEmpty()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("pending", queue.size());
            telemetry.recordError(TelemetryEvents.REPLAY_QUEUE_NOT_EMPTY, data);
            throw new IllegalStateException("Command queue must be empty before replay begins.");
        }

        long previousStep = stepControl != null ? stepControl.getCurrentStep() : -1;
        long previousNextStep = stepControl != null ? stepControl.getNextExecutableStep() : -1;

        try {
            replayCommands(log.commands(), dispatcher, queue);
        } catch (RuntimeException e) {
            if (stepControl != null) {
                stepControl.setCurrentStep(previousStep);
                stepControl.setNextExecutableStep(previousNextStep);
            }
            throw e;
        }

        long finalStep = finalStep(log);
        if (stepControl != null && finalStep >= 0) {
            stepControl.setCurrentStep(finalStep + 1);
            stepControl.setNextExecutableStep(finalStep + 1);
        }
    }

    private void replayCommands(List<Command> commands, CommandDispatcher dispatcher, CommandQueue queue) {
        boolean[] claimed = new boolean[commands.size()];
        int processed = 0;

        for (int i = 0; i < commands.size(); i++) {
            Command command = commands.get(i);

            if (!dispatcher.hasHandler(command.type())) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("type", command.type());
                data.put("step", command.step());
                telemetry.recordError(TelemetryEvents.REPLAY_UNKNOWN_COMMAND_TYPE, data);
            } else {
                CommandResult result = dispatcher.executeWithResult(command, REPLAY_CONTEXT).join();
                if (result instanceof Failure failure
                    && CommandErrorCodes.COMMAND_EXECUTION_FAILED.equals(failure.code())) {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("type", command.type());
                    data.put("step", command.step());
                    data.put("error", failure.error().message());
                    telemetry.recordError(TelemetryEvents.REPLAY_EXECUTION_FAILED, data);
                }
            }

            for (Command followup : queue.dequeueAll()) {
                int match = findUnclaimedMatch(commands, followup, i + 1, claimed);
                if (match < 0) {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("type", followup.type());
                    data.put("step", followup.step());
                    telemetry.recordError(TelemetryEvents.REPLAY_MISSING_FOLLOWUP_COMMAND, data);
                    queue.clear();
                    throw new IllegalStateException(
                        "Replay log is missing a command that was enqueued during handler execution."
                    );
                }
                claimed[match] = true;
            }

            processed++;
            if (processed % PROGRESS_BATCH_SIZE == 0 || processed == commands.size()) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("processed", processed);
                telemetry.recordProgress(TelemetryEvents.COMMAND_REPLAY, data);
            }
        }
    }

    private static int findUnclaimedMatch(List<Command> commands, Command candidate, int from, boolean[] claimed) {
        for (int i = from; i < commands.size(); i++) {
            if (!claimed[i] && sameCommand(commands.get(i), candidate)) {
                return i;
            }
        }
        return -1;
    }

    // requestId는 transport 경계의 값이라 비교하지 않음
    private static boolean sameCommand(Command left, Command right) {
        return left.type().equals(right.type())
            && left.priority() == right.priority()
            && left.step() == right.step()
            && left.timestamp() == right.timestamp()
            && Objects.equals(left.payload(), right.payload());
    }

    private static long finalStep(CommandLog log) {
        if (log.lastStep() >= 0) {
            return log.lastStep();
        }
        long max = -1;
        for (Command command : log.commands()) {
            max = Math.max(max, command.step());
        }
        return max;
    }
}
