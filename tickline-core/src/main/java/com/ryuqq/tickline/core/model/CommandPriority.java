package com.ryuqq.tickline.core.model;

import java.util.List;

/**
 * Command 실행 우선순위 (priority lane).
 *
 * <p>세 개의 고정된 lane이 존재하며, 큐는 항상 아래 순서로 drain합니다:</p>
 * <ol>
 *   <li>{@link #SYSTEM}: 시스템 lifecycle 이벤트 (마이그레이션, 오프라인 보정 등)</li>
 *   <li>{@link #PLAYER}: 플레이어 입력</li>
 *   <li>{@link #AUTOMATION}: 자동화 서브시스템이 생성한 명령</li>
 * </ol>
 *
 * <p>각 lane은 직렬화 경계에서 사용하는 고정 숫자 값(0, 1, 2)을 가지며,
 * 그 외의 값은 {@link #fromValue(int)}에서 즉시 거부됩니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public enum CommandPriority {

    SYSTEM(0),
    PLAYER(1),
    AUTOMATION(2);

    /**
     * Drain 순서 (SYSTEM → PLAYER → AUTOMATION).
     */
    public static final List<CommandPriority> DRAIN_ORDER = List.of(SYSTEM, PLAYER, AUTOMATION);

    private final int value;

    CommandPriority(int value) {
        this.value = value;
    }

    /**
     * 직렬화 경계에서 사용하는 숫자 값.
     *
     * @return 0 (SYSTEM), 1 (PLAYER), 2 (AUTOMATION)
     */
    public int getValue() {
        return value;
    }

    /**
     * 이 lane이 다른 lane보다 낮은 우선순위(나중에 drain)인지 확인.
     *
     * @param other 비교 대상
     * @return 이 lane이 더 늦게 drain되면 true
     */
    public boolean isLowerThan(CommandPriority other) {
        return value > other.value;
    }

    /**
     * 숫자 값으로 CommandPriority 조회.
     *
     * @param value 숫자 값
     * @return CommandPriority
     * @throws IllegalArgumentException 정의되지 않은 값인 경우
     */
    public static CommandPriority fromValue(int value) {
        for (CommandPriority priority : values()) {
            if (priority.value == value) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Invalid command priority: " + value);
    }

    /**
     * 숫자 값이 유효한 priority인지 확인.
     *
     * @param value 숫자 값
     * @return 유효하면 true
     */
    public static boolean isValid(int value) {
        for (CommandPriority priority : values()) {
            if (priority.value == value) {
                return true;
            }
        }
        return false;
    }
}
