package com.ryuqq.tickline.core.queue;

import com.ryuqq.tickline.core.authorization.AuthorizationContext;
import com.ryuqq.tickline.core.authorization.CommandAuthorizer;
import com.ryuqq.tickline.core.model.Command;
import com.ryuqq.tickline.core.model.CommandPriority;
import com.ryuqq.tickline.core.snapshot.ImmutableSnapshots;
import com.ryuqq.tickline.core.snapshot.UnsupportedPayloadException;
import com.ryuqq.tickline.core.spi.TelemetrySink;
import com.ryuqq.tickline.core.telemetry.TelemetryEvents;
import com.ryuqq.tickline.core.telemetry.noop.NoOpTelemetrySink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 우선순위별 lane을 가진 용량 제한 명령 큐.
 *
 * <p>Producer는 {@link #enqueue(Command)}로 명령을 제출하고, 드라이버는 step마다
 * {@link #dequeueUpToStep(long)}으로 실행할 명령을 꺼냅니다.</p>
 *
 * <p><strong>enqueue 처리 순서:</strong></p>
 * <ol>
 *   <li>권한 검사 (phase LIVE, reason "queue"): 거부 시 큐에 넣지 않음</li>
 *   <li>payload snapshot: 지원하지 않는 값이면 {@value TelemetryEvents#COMMAND_PAYLOAD_UNSUPPORTED} 경고 후 거부</li>
 *   <li>용량 초과 시 {@value TelemetryEvents#COMMAND_QUEUE_OVERFLOW} 경고 후,
 *       가장 낮은 비어있지 않은 lane이 들어오는 명령보다 낮은 우선순위이면 그 lane의 가장 오래된 명령을 폐기하고,
 *       아니면 들어오는 명령을 거부</li>
 *   <li>(snapshot 명령, 순번) 추가</li>
 * </ol>
 *
 * <p><strong>drain 순서:</strong> 우선순위 오름차순 (SYSTEM → PLAYER → AUTOMATION), 같은 lane 안에서는 삽입 순서.</p>
 *
 * <p>단일 simulation 스레드에서 사용하도록 설계되었으며 thread-safe하지 않습니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class CommandQueue {

    /** 기본 최대 보관 명령 수. */
    public static final int DEFAULT_MAX_SIZE = 10_000;

    private static final AuthorizationContext QUEUE_CONTEXT = AuthorizationContext.live("queue");

    private final Map<CommandPriority, ArrayDeque<QueueEntry>> lanes = new EnumMap<>(CommandPriority.class);
    private final int maxSize;
    private final CommandAuthorizer authorizer;
    private final TelemetrySink telemetry;

    private long nextSequence;
    private int size;

    /**
     * 기본 용량, NoOp telemetry로 생성.
     */
    public CommandQueue() {
        this(DEFAULT_MAX_SIZE, NoOpTelemetrySink.INSTANCE);
    }

    /**
     * 기본 권한 테이블로 생성.
     *
     * @param maxSize 최대 보관 명령 수 (양수)
     * @param telemetry telemetry sink
     */
    public CommandQueue(int maxSize, TelemetrySink telemetry) {
        this(maxSize, new CommandAuthorizer(requireTelemetry(telemetry)), telemetry);
    }

    /**
     * 생성자.
     *
     * @param maxSize 최대 보관 명령 수 (양수)
     * @param authorizer admission 권한 검사기
     * @param telemetry telemetry sink
     * @throws IllegalArgumentException maxSize가 양수가 아니거나 인자가 null인 경우
     */
    public CommandQueue(int maxSize, CommandAuthorizer authorizer, TelemetrySink telemetry) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer cannot be null");
        }
        this.maxSize = maxSize;
        this.authorizer = authorizer;
        this.telemetry = requireTelemetry(telemetry);
        for (CommandPriority priority : CommandPriority.DRAIN_ORDER) {
            lanes.put(priority, new ArrayDeque<>());
        }
    }

    private static TelemetrySink requireTelemetry(TelemetrySink telemetry) {
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        return telemetry;
    }

    /**
     * 명령 제출.
     *
     * <p>권한 위반, 지원하지 않는 payload, 용량 초과로 인한 거부는 예외가 아닌
     * telemetry 경고로 보고됩니다.</p>
     *
     * @param command 제출할 명령
     * @return 큐에 추가되었으면 true
     * @throws IllegalArgumentException command가 null인 경우
     */
    public boolean enqueue(Command command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (!authorizer.authorize(command, QUEUE_CONTEXT)) {
            return false;
        }

        Command snapshotCommand;
        try {
            snapshotCommand = command.withPayload(ImmutableSnapshots.snapshot(command.payload()));
        } catch (UnsupportedPayloadException e) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", command.type());
            data.put("priority", command.priority().name());
            data.put("reason", e.getMessage());
            telemetry.recordWarning(TelemetryEvents.COMMAND_PAYLOAD_UNSUPPORTED, data);
            return false;
        }

        if (size >= maxSize && !makeRoomFor(snapshotCommand)) {
            return false;
        }

        lanes.get(snapshotCommand.priority()).addLast(new QueueEntry(snapshotCommand, nextSequence++));
        size++;
        return true;
    }

    private boolean makeRoomFor(Command incoming) {
        Map<String, Object> overflow = new LinkedHashMap<>();
        overflow.put("size", size);
        overflow.put("maxSize", maxSize);
        overflow.put("priority", incoming.priority().name());
        telemetry.recordWarning(TelemetryEvents.COMMAND_QUEUE_OVERFLOW, overflow);

        CommandPriority lowest = lowestNonEmptyLane();
        if (lowest != null && lowest.isLowerThan(incoming.priority())) {
            QueueEntry evicted = lanes.get(lowest).pollFirst();
            size--;
            Command dropped = evicted.command();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", dropped.type());
            data.put("priority", dropped.priority().name());
            data.put("timestamp", dropped.timestamp());
            data.put("step", dropped.step());
            telemetry.recordWarning(TelemetryEvents.COMMAND_DROPPED, data);
            return true;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", incoming.type());
        data.put("priority", incoming.priority().name());
        data.put("timestamp", incoming.timestamp());
        data.put("size", size);
        data.put("maxSize", maxSize);
        telemetry.recordWarning(TelemetryEvents.COMMAND_REJECTED, data);
        return false;
    }

    private CommandPriority lowestNonEmptyLane() {
        List<CommandPriority> order = CommandPriority.DRAIN_ORDER;
        for (int i = order.size() - 1; i >= 0; i--) {
            if (!lanes.get(order.get(i)).isEmpty()) {
                return order.get(i);
            }
        }
        return null;
    }

    /**
     * 보관된 모든 명령을 drain 순서로 꺼냄.
     *
     * @return 명령 목록 (읽기 전용)
     */
    public List<Command> dequeueAll() {
        List<Command> drained = new ArrayList<>(size);
        for (CommandPriority priority : CommandPriority.DRAIN_ORDER) {
            ArrayDeque<QueueEntry> lane = lanes.get(priority);
            for (QueueEntry entry : lane) {
                drained.add(entry.command());
            }
            lane.clear();
        }
        size = 0;
        return Collections.unmodifiableList(drained);
    }

    /**
     * step이 주어진 값 이하인 명령만 drain 순서로 꺼냄.
     *
     * <p>나머지 명령은 lane 안의 순서를 유지한 채 남습니다.</p>
     *
     * @param step 기준 step (포함)
     * @return 명령 목록 (읽기 전용)
     */
    public List<Command> dequeueUpToStep(long step) {
        List<Command> drained = new ArrayList<>();
        for (CommandPriority priority : CommandPriority.DRAIN_ORDER) {
            Iterator<QueueEntry> iterator = lanes.get(priority).iterator();
            while (iterator.hasNext()) {
                QueueEntry entry = iterator.next();
                if (entry.command().step() <= step) {
                    drained.add(entry.command());
                    iterator.remove();
                }
            }
        }
        size -= drained.size();
        return Collections.unmodifiableList(drained);
    }

    /**
     * 모든 명령 제거 (telemetry 기록 없음).
     */
    public void clear() {
        for (ArrayDeque<QueueEntry> lane : lanes.values()) {
            lane.clear();
        }
        size = 0;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
