package com.ryuqq.tickline.core.authorization;

/**
 * 권한 검사 호출 정보.
 *
 * <p>reason은 어느 검사 지점이 명령을 거부했는지 구분합니다 (예: queue, dispatcher).</p>
 *
 * @param phase 검사 단계
 * @param reason 검사 지점 (null 가능, null이면 telemetry에서 생략)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record AuthorizationContext(
    AuthorizationPhase phase,
    String reason
) {

    /** reason 없는 실시간 검사. */
    public static final AuthorizationContext LIVE = new AuthorizationContext(AuthorizationPhase.LIVE, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException phase가 null인 경우
     */
    public AuthorizationContext {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
    }

    public static AuthorizationContext live(String reason) {
        return new AuthorizationContext(AuthorizationPhase.LIVE, reason);
    }

    public static AuthorizationContext replay(String reason) {
        return new AuthorizationContext(AuthorizationPhase.REPLAY, reason);
    }
}
