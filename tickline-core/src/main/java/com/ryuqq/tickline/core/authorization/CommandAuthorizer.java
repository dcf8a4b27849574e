package com.ryuqq.tickline.core.authorization;

import com.ryuqq.tickline.core.model.Command;
import com.ryuqq.tickline.core.model.CommandPriority;
import com.ryuqq.tickline.core.spi.TelemetrySink;
import com.ryuqq.tickline.core.telemetry.TelemetryEvents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 권한 테이블 기반 명령 권한 검사기.
 *
 * <p>정책이 없는 유형은 허용합니다. 거부 시 정책의 전용 이벤트
 * (없으면 {@value TelemetryEvents#COMMAND_PRIORITY_VIOLATION})로 경고를 기록합니다.</p>
 *
 * <p><strong>경고 데이터:</strong></p>
 * <ul>
 *   <li>type, attemptedPriority, allowedPriorities</li>
 *   <li>phase (live/replay), reason (주어진 경우만), step</li>
 * </ul>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class CommandAuthorizer {

    private final Map<String, AuthorizationPolicy> policies;
    private final TelemetrySink telemetry;

    /**
     * 기본 권한 테이블로 생성.
     *
     * @param telemetry 위반 경고를 기록할 sink
     */
    public CommandAuthorizer(TelemetrySink telemetry) {
        this(CommandAuthorizations.defaults(), telemetry);
    }

    /**
     * 사용자 정의 권한 테이블로 생성.
     *
     * @param policies 명령 유형별 정책
     * @param telemetry 위반 경고를 기록할 sink
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CommandAuthorizer(Map<String, AuthorizationPolicy> policies, TelemetrySink telemetry) {
        if (policies == null) {
            throw new IllegalArgumentException("policies cannot be null");
        }
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
        this.telemetry = telemetry;
    }

    /**
     * 명령 권한 검사.
     *
     * @param command 검사할 명령
     * @param context 검사 단계와 지점
     * @return 허용되면 true
     */
    public boolean authorize(Command command, AuthorizationContext context) {
        AuthorizationPolicy policy = policies.get(command.type());
        if (policy == null || policy.allows(command.priority())) {
            return true;
        }

        String event = policy.unauthorizedEvent() != null
            ? policy.unauthorizedEvent()
            : TelemetryEvents.COMMAND_PRIORITY_VIOLATION;
        telemetry.recordWarning(event, violationData(command, policy, context));
        return false;
    }

    /**
     * reason 없이 실시간 단계로 권한 검사.
     *
     * @param command 검사할 명령
     * @return 허용되면 true
     */
    public boolean authorize(Command command) {
        return authorize(command, AuthorizationContext.LIVE);
    }

    public Map<String, AuthorizationPolicy> policies() {
        return policies;
    }

    private static Map<String, Object> violationData(
        Command command,
        AuthorizationPolicy policy,
        AuthorizationContext context
    ) {
        List<String> allowed = new ArrayList<>();
        for (CommandPriority priority : policy.allowedPriorities()) {
            allowed.add(priority.name());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", command.type());
        data.put("attemptedPriority", command.priority().name());
        data.put("allowedPriorities", Collections.unmodifiableList(allowed));
        data.put("phase", context.phase().getLabel());
        if (context.reason() != null) {
            data.put("reason", context.reason());
        }
        data.put("step", command.step());
        return Collections.unmodifiableMap(data);
    }
}
