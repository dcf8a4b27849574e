package com.ryuqq.tickline.application.transport;

/**
 * transport 응답 상태.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public enum CommandResponseStatus {

    /**
     * 접수됨 (또는 실행 성공).
     */
    ACCEPTED("accepted"),

    /**
     * 검증 실패 또는 실행 실패.
     */
    REJECTED("rejected"),

    /**
     * 이미 기록된 응답의 재전송.
     */
    DUPLICATE("duplicate");

    private final String wireValue;

    CommandResponseStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }
}
