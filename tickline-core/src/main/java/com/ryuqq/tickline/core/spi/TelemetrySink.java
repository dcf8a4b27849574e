package com.ryuqq.tickline.core.spi;

import java.util.Map;

/**
 * 운영 이벤트 기록 SPI.
 *
 * <p>Queue, Dispatcher, 권한 검사, 드라이버는 모두 이 인터페이스로만 이벤트를 보고하며
 * 구현체에 의존하지 않습니다. 구현체는 생성자로 주입하고, 주입하지 않으면
 * {@link com.ryuqq.tickline.core.telemetry.noop.NoOpTelemetrySink}가 사용됩니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <ul>
 *   <li>SLF4J 로깅 (adapter-runner)</li>
 *   <li>메트릭 수집기 (Micrometer 등)</li>
 *   <li>테스트용 기록기 (testkit)</li>
 * </ul>
 *
 * <p>이벤트 이름은 {@link com.ryuqq.tickline.core.telemetry.TelemetryEvents} 상수를 사용합니다.
 * data 맵은 호출 후 변경되지 않으므로 구현체가 그대로 보관해도 됩니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public interface TelemetrySink {

    /**
     * 오류 이벤트 기록 (handler 실패, 미등록 명령 유형 등).
     *
     * @param event 이벤트 이름
     * @param data 이벤트 데이터
     */
    void recordError(String event, Map<String, Object> data);

    /**
     * 경고 이벤트 기록 (권한 위반, 용량 초과, 명령 폐기 등).
     *
     * @param event 이벤트 이름
     * @param data 이벤트 데이터
     */
    void recordWarning(String event, Map<String, Object> data);

    /**
     * 진행 상황 기록.
     *
     * @param event 이벤트 이름
     * @param data 이벤트 데이터
     */
    void recordProgress(String event, Map<String, Object> data);

    /**
     * 카운터 묶음 기록.
     *
     * @param group 카운터 그룹 이름 (예: commandQueue)
     * @param counters 카운터 이름과 값
     */
    void recordCounters(String group, Map<String, Long> counters);

    /**
     * simulation step 하나가 끝났음을 기록.
     */
    void recordTick();
}
