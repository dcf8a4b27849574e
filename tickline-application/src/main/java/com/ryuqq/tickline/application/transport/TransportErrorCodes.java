package com.ryuqq.tickline.application.transport;

/**
 * transport 경계에서 REJECTED 응답에 사용하는 오류 코드.
 *
 * <p>명령 실행 단계의 코드는 {@link com.ryuqq.tickline.core.result.CommandErrorCodes}를 따릅니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class TransportErrorCodes {

    public static final String INVALID_IDENTIFIER = "INVALID_IDENTIFIER";
    public static final String IDENTIFIER_TOO_LONG = "IDENTIFIER_TOO_LONG";
    public static final String INVALID_IDENTIFIER_FORMAT = "INVALID_IDENTIFIER_FORMAT";
    public static final String REQUEST_ID_IN_USE = "REQUEST_ID_IN_USE";
    public static final String INVALID_SENT_AT = "INVALID_SENT_AT";
    public static final String INVALID_COMMAND = "INVALID_COMMAND";
    public static final String INVALID_COMMAND_TYPE = "INVALID_COMMAND_TYPE";
    public static final String INVALID_COMMAND_PRIORITY = "INVALID_COMMAND_PRIORITY";
    public static final String INVALID_COMMAND_TIMESTAMP = "INVALID_COMMAND_TIMESTAMP";
    public static final String INVALID_COMMAND_STEP = "INVALID_COMMAND_STEP";
    public static final String INVALID_COMMAND_PAYLOAD = "INVALID_COMMAND_PAYLOAD";
    public static final String INVALID_COMMAND_REQUEST_ID = "INVALID_COMMAND_REQUEST_ID";
    public static final String REQUEST_ID_MISMATCH = "REQUEST_ID_MISMATCH";
    public static final String COMMAND_NOT_ENQUEUED = "COMMAND_NOT_ENQUEUED";

    private TransportErrorCodes() {
    }
}
