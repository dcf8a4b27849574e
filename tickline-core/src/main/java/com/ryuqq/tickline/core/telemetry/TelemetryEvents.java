package com.ryuqq.tickline.core.telemetry;

/**
 * 코어가 기록하는 telemetry 이벤트 이름.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class TelemetryEvents {

    /** 정책에 전용 이벤트가 없을 때의 권한 위반 경고. */
    public static final String COMMAND_PRIORITY_VIOLATION = "CommandPriorityViolation";

    public static final String COMMAND_QUEUE_OVERFLOW = "CommandQueueOverflow";
    public static final String COMMAND_DROPPED = "CommandDropped";
    public static final String COMMAND_REJECTED = "CommandRejected";
    public static final String COMMAND_PAYLOAD_UNSUPPORTED = "CommandPayloadUnsupported";

    public static final String UNKNOWN_COMMAND_TYPE = "UnknownCommandType";
    public static final String COMMAND_EXECUTION_FAILED = "CommandExecutionFailed";

    public static final String COMMAND_STEP_MISMATCH = "CommandStepMismatch";

    public static final String REPLAY_QUEUE_NOT_EMPTY = "ReplayQueueNotEmpty";
    public static final String REPLAY_UNKNOWN_COMMAND_TYPE = "ReplayUnknownCommandType";
    public static final String REPLAY_EXECUTION_FAILED = "ReplayExecutionFailed";
    public static final String REPLAY_MISSING_FOLLOWUP_COMMAND = "ReplayMissingFollowupCommand";

    /** 재실행 진행 ({@code processed} 누적 명령 수). */
    public static final String COMMAND_REPLAY = "CommandReplay";

    /** 드라이버가 step마다 기록하는 카운터 그룹. */
    public static final String COMMAND_QUEUE_COUNTERS = "commandQueue";

    private TelemetryEvents() {
    }
}
