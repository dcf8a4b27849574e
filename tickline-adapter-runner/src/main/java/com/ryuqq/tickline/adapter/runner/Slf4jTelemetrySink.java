package com.ryuqq.tickline.adapter.runner;

import com.ryuqq.tickline.core.spi.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * SLF4J 기반 TelemetrySink.
 *
 * <p><strong>레벨 매핑:</strong></p>
 * <ul>
 *   <li>recordError → ERROR</li>
 *   <li>recordWarning → WARN</li>
 *   <li>recordProgress → INFO</li>
 *   <li>recordCounters, recordTick → DEBUG</li>
 * </ul>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class Slf4jTelemetrySink implements TelemetrySink {

    private final Logger log;

    /**
     * {@code Slf4jTelemetrySink} 클래스 이름의 Logger 사용.
     */
    public Slf4jTelemetrySink() {
        this(LoggerFactory.getLogger(Slf4jTelemetrySink.class));
    }

    /**
     * 생성자 (Logger 주입).
     *
     * @param log 출력 대상 Logger
     * @throws IllegalArgumentException log가 null인 경우
     */
    public Slf4jTelemetrySink(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void recordError(String event, Map<String, Object> data) {
        log.error("{} {}", event, data);
    }

    @Override
    public void recordWarning(String event, Map<String, Object> data) {
        log.warn("{} {}", event, data);
    }

    @Override
    public void recordProgress(String event, Map<String, Object> data) {
        log.info("{} {}", event, data);
    }

    @Override
    public void recordCounters(String group, Map<String, Long> counters) {
        if (log.isDebugEnabled()) {
            log.debug("{} {}", group, counters);
        }
    }

    @Override
    public void recordTick() {
        log.debug("tick");
    }
}
