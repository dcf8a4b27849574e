package com.ryuqq.tickline.core.result;

/**
 * Dispatcher가 생성하는 안정적인 오류 코드.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class CommandErrorCodes {

    public static final String COMMAND_UNAUTHORIZED = "COMMAND_UNAUTHORIZED";
    public static final String UNKNOWN_COMMAND_TYPE = "UNKNOWN_COMMAND_TYPE";
    public static final String COMMAND_EXECUTION_FAILED = "COMMAND_EXECUTION_FAILED";

    private CommandErrorCodes() {
    }
}
