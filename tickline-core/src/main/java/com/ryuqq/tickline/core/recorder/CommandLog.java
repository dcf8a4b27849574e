package com.ryuqq.tickline.core.recorder;

import com.ryuqq.tickline.core.model.Command;

import java.util.List;

/**
 * 내보낸 명령 기록.
 *
 * <p>startState와 각 명령의 payload는 immutable snapshot이며, commands는 기록 순서를 유지하는
 * 변경 불가능한 목록입니다.</p>
 *
 * @param version 기록 형식 버전
 * @param startState 기록 시작 시점의 상태 snapshot (null 가능)
 * @param commands 기록된 명령
 * @param recordedAtMs 내보낸 시각 (epoch millis)
 * @param lastStep 기록된 명령 중 가장 큰 step (없으면 -1)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record CommandLog(
    String version,
    Object startState,
    List<Command> commands,
    long recordedAtMs,
    long lastStep
) {

    /** 현재 기록 형식 버전. */
    public static final String CURRENT_VERSION = "0.1.0";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException version이 비어있거나 commands가 null인 경우
     */
    public CommandLog {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version cannot be null or blank");
        }
        if (commands == null) {
            throw new IllegalArgumentException("commands cannot be null");
        }
        commands = List.copyOf(commands);
    }
}
