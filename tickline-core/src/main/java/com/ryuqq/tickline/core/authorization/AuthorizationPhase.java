package com.ryuqq.tickline.core.authorization;

/**
 * 권한 검사가 수행된 단계.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public enum AuthorizationPhase {

    /** 실시간 제출 및 실행. */
    LIVE("live"),

    /** 기록된 명령 재생. */
    REPLAY("replay");

    private final String label;

    AuthorizationPhase(String label) {
        this.label = label;
    }

    /**
     * telemetry에 기록되는 이름.
     *
     * @return 소문자 단계 이름
     */
    public String getLabel() {
        return label;
    }
}
