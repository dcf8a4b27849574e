package com.ryuqq.tickline.core.result;

/**
 * 드라이버가 실행한 명령 하나의 결과 기록.
 *
 * <p>transport 경계는 requestId로 대기 중인 요청을 찾아 최종 응답으로 변환합니다.</p>
 *
 * @param requestId 요청 식별자 (null 가능)
 * @param serverStep 실행된 step
 * @param result 실행 결과
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record CommandExecutionOutcome(
    String requestId,
    long serverStep,
    CommandResult result
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException result가 null인 경우
     */
    public CommandExecutionOutcome {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }
}
