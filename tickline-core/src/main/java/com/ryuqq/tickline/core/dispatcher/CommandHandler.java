package com.ryuqq.tickline.core.dispatcher;

import com.ryuqq.tickline.core.result.CommandResult;

/**
 * 동기 명령 handler.
 *
 * <p>null 반환은 성공으로 취급합니다. 업무 실패는 {@link com.ryuqq.tickline.core.result.Failure}를
 * 반환하고, 던진 예외는 Dispatcher가 COMMAND_EXECUTION_FAILED로 변환합니다.</p>
 *
 * <p>payload는 snapshot 값이므로 handler가 기대하는 형태(보통 {@code Map<String, Object>})로
 * 직접 확인해서 사용합니다. 형태가 맞지 않아 발생한 예외도 실행 실패로 변환됩니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * 명령 처리.
     *
     * @param payload 읽기 전용 payload snapshot
     * @param context 실행 정보
     * @return 실행 결과 (null이면 성공)
     * @throws Exception 처리 중 오류
     */
    CommandResult handle(Object payload, ExecutionContext context) throws Exception;
}
