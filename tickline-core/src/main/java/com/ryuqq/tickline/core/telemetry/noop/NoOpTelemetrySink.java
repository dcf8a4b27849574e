package com.ryuqq.tickline.core.telemetry.noop;

import com.ryuqq.tickline.core.spi.TelemetrySink;

import java.util.Map;

/**
 * TelemetrySink NoOp 구현.
 *
 * <p>모든 이벤트를 버립니다. sink를 주입하지 않은 Queue, Dispatcher, 드라이버의 기본값입니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>recordError/recordWarning/recordProgress: 아무 동작 안 함</li>
 *   <li>recordCounters/recordTick: 아무 동작 안 함</li>
 * </ul>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class NoOpTelemetrySink implements TelemetrySink {

    /** 공유 인스턴스 (상태 없음). */
    public static final NoOpTelemetrySink INSTANCE = new NoOpTelemetrySink();

    @Override
    public void recordError(String event, Map<String, Object> data) {
        // NoOp
    }

    @Override
    public void recordWarning(String event, Map<String, Object> data) {
        // NoOp
    }

    @Override
    public void recordProgress(String event, Map<String, Object> data) {
        // NoOp
    }

    @Override
    public void recordCounters(String group, Map<String, Long> counters) {
        // NoOp
    }

    @Override
    public void recordTick() {
        // NoOp
    }
}
