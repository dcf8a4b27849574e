package com.ryuqq.tickline.core.dispatcher;

import com.ryuqq.tickline.core.model.CommandPriority;
import com.ryuqq.tickline.core.spi.EventPublisher;

/**
 * handler에 전달되는 실행 정보.
 *
 * @param step 명령이 실행되는 step
 * @param timestamp 명령 생성 시각 (epoch millis)
 * @param priority 명령 우선순위
 * @param events 이벤트 발행 통로
 * @param requestId 요청 식별자 (null 가능)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record ExecutionContext(
    long step,
    long timestamp,
    CommandPriority priority,
    EventPublisher events,
    String requestId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException priority 또는 events가 null인 경우
     */
    public ExecutionContext {
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
    }
}
