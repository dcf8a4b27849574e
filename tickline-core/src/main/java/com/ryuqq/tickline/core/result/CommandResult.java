package com.ryuqq.tickline.core.result;

/**
 * 명령 실행 결과.
 *
 * <p>CommandResult는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 명령이 정상적으로 처리됨</li>
 *   <li>{@link Failure}: 업무상 실패 또는 실행 오류 (안정적인 코드 포함)</li>
 * </ul>
 *
 * <p>Dispatcher는 handler 예외, 권한 위반, 미등록 유형을 모두 Failure로 변환하므로
 * 한 명령의 실패가 같은 batch의 나머지 명령 실행을 중단시키지 않습니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public sealed interface CommandResult permits Success, Failure {

    /**
     * 성공 결과.
     *
     * @return Success 인스턴스
     */
    static CommandResult success() {
        return Success.INSTANCE;
    }

    /**
     * 실패 결과 생성.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @return Failure 인스턴스
     */
    static CommandResult failure(String code, String message) {
        return new Failure(CommandError.of(code, message));
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }
}
