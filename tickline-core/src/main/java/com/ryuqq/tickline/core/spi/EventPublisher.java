package com.ryuqq.tickline.core.spi;

/**
 * handler가 실행 중 도메인 이벤트를 발행하는 통로.
 *
 * <p>Dispatcher는 {@link com.ryuqq.tickline.core.dispatcher.ExecutionContext#events()}로
 * 이 인터페이스를 handler에 전달합니다. 이벤트 버스 자체는 호스트가 제공합니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * 이벤트 발행.
     *
     * @param eventType 이벤트 유형
     * @param payload 이벤트 데이터
     */
    void publish(String eventType, Object payload);
}
