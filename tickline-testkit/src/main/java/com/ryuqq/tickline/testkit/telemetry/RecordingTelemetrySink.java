package com.ryuqq.tickline.testkit.telemetry;

import com.ryuqq.tickline.core.spi.TelemetrySink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test {@link TelemetrySink} that keeps every recorded event in memory.
 *
 * <p>Events are stored in recording order and can be filtered by level or
 * name. Safe to use from handlers that complete on other threads.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RecordingTelemetrySink telemetry = new RecordingTelemetrySink();
 * CommandQueue queue = new CommandQueue(2, telemetry);
 * // ...
 * assertThat(telemetry.warnings(TelemetryEvents.COMMAND_QUEUE_OVERFLOW)).hasSize(1);
 * </pre>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public class RecordingTelemetrySink implements TelemetrySink {

    /**
     * Event severity as reported through the sink.
     */
    public enum Level {
        ERROR,
        WARNING,
        PROGRESS
    }

    /**
     * A single recorded error, warning or progress event.
     *
     * @param level event level
     * @param event event name
     * @param data event data
     */
    public record RecordedEvent(Level level, String event, Map<String, Object> data) {
    }

    /**
     * A single counters snapshot.
     *
     * @param group counter group name
     * @param counters counter values
     */
    public record RecordedCounters(String group, Map<String, Long> counters) {
    }

    private final List<RecordedEvent> events = new CopyOnWriteArrayList<>();
    private final List<RecordedCounters> counters = new CopyOnWriteArrayList<>();
    private final AtomicLong ticks = new AtomicLong();

    @Override
    public void recordError(String event, Map<String, Object> data) {
        events.add(new RecordedEvent(Level.ERROR, event, data));
    }

    @Override
    public void recordWarning(String event, Map<String, Object> data) {
        events.add(new RecordedEvent(Level.WARNING, event, data));
    }

    @Override
    public void recordProgress(String event, Map<String, Object> data) {
        events.add(new RecordedEvent(Level.PROGRESS, event, data));
    }

    @Override
    public void recordCounters(String group, Map<String, Long> values) {
        counters.add(new RecordedCounters(group, values));
    }

    @Override
    public void recordTick() {
        ticks.incrementAndGet();
    }

    /**
     * Returns all recorded events in order.
     */
    public List<RecordedEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public List<RecordedEvent> errors(String event) {
        return filter(Level.ERROR, event);
    }

    public List<RecordedEvent> warnings(String event) {
        return filter(Level.WARNING, event);
    }

    public List<RecordedEvent> progress(String event) {
        return filter(Level.PROGRESS, event);
    }

    /**
     * Returns every counters snapshot recorded for the group.
     *
     * @param group counter group name
     * @return snapshots in recording order
     */
    public List<RecordedCounters> counters(String group) {
        List<RecordedCounters> matched = new ArrayList<>();
        for (RecordedCounters recorded : counters) {
            if (recorded.group().equals(group)) {
                matched.add(recorded);
            }
        }
        return Collections.unmodifiableList(matched);
    }

    /**
     * Returns the most recent counters snapshot for the group.
     *
     * @param group counter group name
     * @return latest snapshot, or empty if none was recorded
     */
    public Optional<Map<String, Long>> lastCounters(String group) {
        List<RecordedCounters> matched = counters(group);
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(matched.get(matched.size() - 1).counters());
    }

    public long tickCount() {
        return ticks.get();
    }

    /**
     * Clears all recorded data.
     */
    public void clear() {
        events.clear();
        counters.clear();
        ticks.set(0);
    }

    private List<RecordedEvent> filter(Level level, String event) {
        List<RecordedEvent> matched = new ArrayList<>();
        for (RecordedEvent recorded : events) {
            if (recorded.level() == level && recorded.event().equals(event)) {
                matched.add(recorded);
            }
        }
        return Collections.unmodifiableList(matched);
    }
}
