package com.ryuqq.tickline.core.authorization;

import com.ryuqq.tickline.core.model.CommandPriority;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 명령 유형 하나의 권한 정책.
 *
 * @param type 명령 유형
 * @param allowedPriorities 허용 우선순위 (비어 있으면 안 됨, 읽기 전용 사본으로 보관)
 * @param rationale 정책 근거
 * @param unauthorizedEvent 위반 시 기록할 전용 이벤트 이름 (null이면 기본 이벤트)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record AuthorizationPolicy(
    String type,
    Set<CommandPriority> allowedPriorities,
    String rationale,
    String unauthorizedEvent
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 비어있는 경우
     */
    public AuthorizationPolicy {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (allowedPriorities == null || allowedPriorities.isEmpty()) {
            throw new IllegalArgumentException("allowedPriorities cannot be null or empty");
        }
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("rationale cannot be null or blank");
        }
        allowedPriorities = Collections.unmodifiableSet(EnumSet.copyOf(allowedPriorities));
        // unauthorizedEvent는 null 허용
    }

    /**
     * 전용 이벤트 없는 정책 생성.
     *
     * @param type 명령 유형
     * @param allowedPriorities 허용 우선순위
     * @param rationale 정책 근거
     * @return AuthorizationPolicy 인스턴스
     */
    public static AuthorizationPolicy of(String type, Set<CommandPriority> allowedPriorities, String rationale) {
        return new AuthorizationPolicy(type, allowedPriorities, rationale, null);
    }

    /**
     * 우선순위 허용 여부.
     *
     * @param priority 확인할 우선순위
     * @return 허용되면 true
     */
    public boolean allows(CommandPriority priority) {
        return allowedPriorities.contains(priority);
    }
}
