package com.ryuqq.tickline.core.model;

/**
 * 시뮬레이션에 제출되는 명령.
 *
 * <p>Producer(플레이어 입력, 자동화 시스템, 시스템 이벤트)가 생성하여 큐에 제출하며,
 * 드라이버가 step마다 drain하여 정확히 한 번 실행합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>type:</strong> 명령 유형 (예: PURCHASE_GENERATOR)</li>
 *   <li><strong>priority:</strong> 실행 lane (SYSTEM, PLAYER, AUTOMATION)</li>
 *   <li><strong>payload:</strong> 업무 데이터 (임의의 값 그래프, null 가능)</li>
 *   <li><strong>timestamp:</strong> 생성 시각 (epoch milliseconds)</li>
 *   <li><strong>step:</strong> 실행 대상 simulation step</li>
 *   <li><strong>requestId:</strong> transport 경계의 요청 식별자 (null 가능)</li>
 * </ul>
 *
 * <p>큐에 들어간 이후의 Command는 payload가 immutable snapshot으로 교체된 사본입니다.
 * 원본 payload를 나중에 변경해도 큐에 있는 명령에는 영향이 없습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Command command = Command.of(
 *     RuntimeCommandTypes.PURCHASE_GENERATOR,
 *     CommandPriority.PLAYER,
 *     Map.of("generatorId", "gen-1", "count", 1),
 *     System.currentTimeMillis(),
 *     42L
 * );
 * </pre>
 *
 * @param type 명령 유형
 * @param priority 실행 우선순위
 * @param payload 업무 데이터 (null 가능)
 * @param timestamp 생성 시각 (epoch millis)
 * @param step 실행 대상 step
 * @param requestId 요청 식별자 (null 가능)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record Command(
    String type,
    CommandPriority priority,
    Object payload,
    long timestamp,
    long step,
    String requestId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 비어있거나 priority가 null인 경우
     */
    public Command {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (priority == null) {
            throw new IllegalArgumentException("Invalid command priority: null");
        }
        // payload, requestId는 null 허용
    }

    /**
     * requestId 없이 Command 생성.
     *
     * @param type 명령 유형
     * @param priority 실행 우선순위
     * @param payload 업무 데이터
     * @param timestamp 생성 시각
     * @param step 실행 대상 step
     * @return Command 인스턴스
     * @throws IllegalArgumentException 필수 필드가 유효하지 않은 경우
     */
    public static Command of(String type, CommandPriority priority, Object payload, long timestamp, long step) {
        return new Command(type, priority, payload, timestamp, step, null);
    }

    /**
     * payload만 교체한 새 인스턴스 생성.
     *
     * @param newPayload 새 payload
     * @return 새 Command
     */
    public Command withPayload(Object newPayload) {
        return new Command(type, priority, newPayload, timestamp, step, requestId);
    }

    /**
     * step만 교체한 새 인스턴스 생성.
     *
     * @param newStep 새 step
     * @return 새 Command
     */
    public Command withStep(long newStep) {
        return new Command(type, priority, payload, timestamp, newStep, requestId);
    }
}
