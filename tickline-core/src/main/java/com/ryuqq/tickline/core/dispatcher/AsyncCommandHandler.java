package com.ryuqq.tickline.core.dispatcher;

import com.ryuqq.tickline.core.result.CommandResult;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 명령 handler.
 *
 * <p>null stage 또는 null 완료 값은 성공입니다. 예외로 완료된 stage는
 * COMMAND_EXECUTION_FAILED로 변환됩니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncCommandHandler {

    CompletionStage<CommandResult> handle(Object payload, ExecutionContext context) throws Exception;
}
