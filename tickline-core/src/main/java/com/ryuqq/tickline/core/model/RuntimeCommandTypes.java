package com.ryuqq.tickline.core.model;

import java.util.List;

/**
 * 런타임이 기본으로 인식하는 명령 유형 목록.
 *
 * <p>각 유형은 {@link com.ryuqq.tickline.core.authorization.CommandAuthorizations}에
 * 정확히 하나의 권한 정책을 가집니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class RuntimeCommandTypes {

    public static final String PURCHASE_GENERATOR = "PURCHASE_GENERATOR";
    public static final String PURCHASE_UPGRADE = "PURCHASE_UPGRADE";
    public static final String TOGGLE_GENERATOR = "TOGGLE_GENERATOR";
    public static final String TOGGLE_AUTOMATION = "TOGGLE_AUTOMATION";
    public static final String COLLECT_RESOURCE = "COLLECT_RESOURCE";
    public static final String PRESTIGE_RESET = "PRESTIGE_RESET";
    public static final String OFFLINE_CATCHUP = "OFFLINE_CATCHUP";
    public static final String APPLY_MIGRATION = "APPLY_MIGRATION";
    public static final String RUN_TRANSFORM = "RUN_TRANSFORM";
    public static final String MAKE_MISSION_DECISION = "MAKE_MISSION_DECISION";
    public static final String ADD_ENTITY = "ADD_ENTITY";
    public static final String REMOVE_ENTITY = "REMOVE_ENTITY";
    public static final String CREATE_ENTITY_INSTANCE = "CREATE_ENTITY_INSTANCE";
    public static final String DESTROY_ENTITY_INSTANCE = "DESTROY_ENTITY_INSTANCE";
    public static final String ADD_ENTITY_EXPERIENCE = "ADD_ENTITY_EXPERIENCE";
    public static final String ASSIGN_ENTITY_TO_MISSION = "ASSIGN_ENTITY_TO_MISSION";
    public static final String RETURN_ENTITY_FROM_MISSION = "RETURN_ENTITY_FROM_MISSION";

    /**
     * 전체 유형 (선언 순서).
     */
    public static final List<String> ALL = List.of(
        PURCHASE_GENERATOR,
        PURCHASE_UPGRADE,
        TOGGLE_GENERATOR,
        TOGGLE_AUTOMATION,
        COLLECT_RESOURCE,
        PRESTIGE_RESET,
        OFFLINE_CATCHUP,
        APPLY_MIGRATION,
        RUN_TRANSFORM,
        MAKE_MISSION_DECISION,
        ADD_ENTITY,
        REMOVE_ENTITY,
        CREATE_ENTITY_INSTANCE,
        DESTROY_ENTITY_INSTANCE,
        ADD_ENTITY_EXPERIENCE,
        ASSIGN_ENTITY_TO_MISSION,
        RETURN_ENTITY_FROM_MISSION
    );

    private RuntimeCommandTypes() {
    }
}
