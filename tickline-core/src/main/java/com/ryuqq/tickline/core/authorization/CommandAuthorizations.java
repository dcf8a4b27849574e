package com.ryuqq.tickline.core.authorization;

import com.ryuqq.tickline.core.model.CommandPriority;
import com.ryuqq.tickline.core.model.RuntimeCommandTypes;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.ryuqq.tickline.core.model.CommandPriority.AUTOMATION;
import static com.ryuqq.tickline.core.model.CommandPriority.PLAYER;
import static com.ryuqq.tickline.core.model.CommandPriority.SYSTEM;

/**
 * 기본 명령 권한 테이블.
 *
 * <p>{@link RuntimeCommandTypes}의 모든 유형에 정확히 하나의 정책이 있습니다.
 * Queue(admission)와 Dispatcher(execution)가 같은 테이블을 독립적으로 조회하므로,
 * Queue를 거치지 않은 명령도 handler 실행 전에 거부됩니다.</p>
 *
 * <p><strong>주요 제약:</strong></p>
 * <ul>
 *   <li>APPLY_MIGRATION: SYSTEM 전용 (UnauthorizedSystemCommand)</li>
 *   <li>PRESTIGE_RESET: AUTOMATION 불가 (AutomationPrestigeBlocked)</li>
 *   <li>ADD_ENTITY_EXPERIENCE: PLAYER 불가</li>
 *   <li>PURCHASE_GENERATOR: 모든 우선순위 허용</li>
 * </ul>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class CommandAuthorizations {

    private static final Map<String, AuthorizationPolicy> POLICIES = buildDefaultPolicies();

    private CommandAuthorizations() {
    }

    /**
     * 기본 정책 테이블 (읽기 전용, 유형 선언 순서).
     *
     * @return 명령 유형별 정책
     */
    public static Map<String, AuthorizationPolicy> defaults() {
        return POLICIES;
    }

    /**
     * 명령 유형의 정책 조회.
     *
     * @param type 명령 유형
     * @return 정책 (정의되지 않은 유형이면 empty)
     */
    public static Optional<AuthorizationPolicy> find(String type) {
        return Optional.ofNullable(POLICIES.get(type));
    }

    private static Map<String, AuthorizationPolicy> buildDefaultPolicies() {
        Map<String, AuthorizationPolicy> policies = new LinkedHashMap<>();
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.PURCHASE_GENERATOR,
            EnumSet.of(SYSTEM, PLAYER, AUTOMATION),
            "Players purchase directly and automation may buy generators on their behalf."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.PURCHASE_UPGRADE,
            EnumSet.of(SYSTEM, PLAYER, AUTOMATION),
            "Upgrades are bought manually or by purchase automations."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.TOGGLE_GENERATOR,
            EnumSet.of(SYSTEM, PLAYER, AUTOMATION),
            "Generators can be paused by the player or by automation rules."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.TOGGLE_AUTOMATION,
            EnumSet.of(SYSTEM, PLAYER),
            "Automations must not enable or disable themselves."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.COLLECT_RESOURCE,
            EnumSet.of(SYSTEM, PLAYER, AUTOMATION),
            "Resources are collected manually or by collector automations."
        ));
        put(policies, new AuthorizationPolicy(
            RuntimeCommandTypes.PRESTIGE_RESET,
            EnumSet.of(SYSTEM, PLAYER),
            "Prestige discards progress and requires an explicit player decision.",
            "AutomationPrestigeBlocked"
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.OFFLINE_CATCHUP,
            EnumSet.of(SYSTEM),
            "Offline progress is granted only by the runtime when a session resumes."
        ));
        put(policies, new AuthorizationPolicy(
            RuntimeCommandTypes.APPLY_MIGRATION,
            EnumSet.of(SYSTEM),
            "State migrations run only during runtime lifecycle transitions.",
            "UnauthorizedSystemCommand"
        ));
        put(policies, new AuthorizationPolicy(
            RuntimeCommandTypes.RUN_TRANSFORM,
            EnumSet.of(SYSTEM, PLAYER),
            "Automated transforms are scheduled by the transform system at SYSTEM priority.",
            "UnauthorizedTransformCommand"
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.MAKE_MISSION_DECISION,
            EnumSet.of(SYSTEM, PLAYER),
            "Mission decisions are player choices or system defaults on timeout."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.ADD_ENTITY,
            EnumSet.of(SYSTEM),
            "Entity definitions are unlocked by progression systems only."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.REMOVE_ENTITY,
            EnumSet.of(SYSTEM),
            "Entity definitions are removed by progression systems only."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.CREATE_ENTITY_INSTANCE,
            EnumSet.of(SYSTEM, PLAYER, AUTOMATION),
            "Instances are recruited manually or by recruitment automations."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.DESTROY_ENTITY_INSTANCE,
            EnumSet.of(SYSTEM, PLAYER),
            "Dismissing an instance is irreversible and never automated."
        ));
        put(policies, new AuthorizationPolicy(
            RuntimeCommandTypes.ADD_ENTITY_EXPERIENCE,
            EnumSet.of(SYSTEM, AUTOMATION),
            "Experience is earned from simulation outcomes, not granted by player input.",
            "PlayerExperienceGrantBlocked"
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.ASSIGN_ENTITY_TO_MISSION,
            EnumSet.of(SYSTEM, PLAYER, AUTOMATION),
            "Missions are staffed manually or by dispatch automations."
        ));
        put(policies, AuthorizationPolicy.of(
            RuntimeCommandTypes.RETURN_ENTITY_FROM_MISSION,
            EnumSet.of(SYSTEM, PLAYER, AUTOMATION),
            "Instances return on completion, recall or automation rules."
        ));
        return Collections.unmodifiableMap(policies);
    }

    private static void put(Map<String, AuthorizationPolicy> policies, AuthorizationPolicy policy) {
        policies.put(policy.type(), policy);
    }
}
