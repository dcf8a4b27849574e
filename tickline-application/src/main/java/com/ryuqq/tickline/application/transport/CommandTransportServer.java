package com.ryuqq.tickline.application.transport;

import com.ryuqq.tickline.application.runtime.Runtime;
import com.ryuqq.tickline.core.model.Command;
import com.ryuqq.tickline.core.model.CommandPriority;
import com.ryuqq.tickline.core.model.IdempotencyKey;
import com.ryuqq.tickline.core.queue.CommandQueue;
import com.ryuqq.tickline.core.result.CommandError;
import com.ryuqq.tickline.core.result.CommandExecutionOutcome;
import com.ryuqq.tickline.core.result.Failure;
import com.ryuqq.tickline.core.spi.IdempotencyRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * 원격 클라이언트 명령 수신 경계.
 *
 * <p>envelope를 검증하고, 멱등성 레지스트리를 직접 조회해 재전송을 걸러낸 뒤
 * 명령을 큐에 넣습니다. 서버 step은 {@link Runtime#getNextExecutableStep()}으로
 * 다시 배정하므로 클라이언트가 보낸 step은 유효성 검증과 fallback에만 쓰입니다.</p>
 *
 * <p><strong>처리 순서 ({@link #handleEnvelope(CommandEnvelope)}):</strong></p>
 * <ol>
 *   <li>만료 기록 정리</li>
 *   <li>requestId, clientId 검증</li>
 *   <li>(clientId, requestId) 기록이 있으면 → DUPLICATE</li>
 *   <li>requestId가 다른 클라이언트에서 대기 중이면 → REJECTED (REQUEST_ID_IN_USE)</li>
 *   <li>sentAt, 명령 필드, payload 검증 실패 → REJECTED</li>
 *   <li>큐 적재 성공 → ACCEPTED, 거부 → REJECTED (COMMAND_NOT_ENQUEUED)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CommandTransportServer server = new CommandTransportServer(
 *     queue, registry, runtime, System::currentTimeMillis, new CommandTransportConfig());
 *
 * CommandResponse response = server.handleEnvelope(envelope);
 * // ...
 * runtime.tick(delta);
 * List&lt;CommandResponse&gt; finals = server.drainOutcomeResponses(System.currentTimeMillis());
 * </pre>
 *
 * <p>스레드 안전하지 않습니다. 시뮬레이션 스레드에서 호출해야 합니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class CommandTransportServer {

    private final CommandQueue queue;
    private final IdempotencyRegistry<CommandResponse> registry;
    private final Runtime runtime;
    private final LongSupplier clock;
    private final CommandTransportConfig config;
    private final Map<String, PendingRequest> pendingRequests = new HashMap<>();

    /**
     * 생성자.
     *
     * @param queue 명령 큐
     * @param registry 멱등성 레지스트리
     * @param runtime step 배정 및 실행 결과 제공자
     * @param clock 현재 시각 (epoch millis)
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CommandTransportServer(
        CommandQueue queue,
        IdempotencyRegistry<CommandResponse> registry,
        Runtime runtime,
        LongSupplier clock,
        CommandTransportConfig config
    ) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = queue;
        this.registry = registry;
        this.runtime = runtime;
        this.clock = clock;
        this.config = config;
    }

    /**
     * envelope 처리.
     *
     * <p>이 메서드는 예외를 던지지 않습니다. 모든 검증 실패는 REJECTED 응답으로 반환됩니다.</p>
     *
     * @param envelope 클라이언트 envelope (null이면 INVALID_IDENTIFIER)
     * @return 응답
     */
    public CommandResponse handleEnvelope(CommandEnvelope envelope) {
        long now = clock.getAsLong();
        purgeExpired(now);

        String rawRequestId = envelope == null ? null : envelope.requestId();
        String responseRequestId = rawRequestId == null ? "" : rawRequestId;

        CommandError requestIdError = validateIdentifier(rawRequestId);
        if (requestIdError != null) {
            return CommandResponse.rejected(responseRequestId, resolveServerStep(-1), requestIdError);
        }
        String requestId = rawRequestId;

        CommandError clientIdError = validateIdentifier(envelope.clientId());
        if (clientIdError != null) {
            return CommandResponse.rejected(requestId, resolveServerStep(-1), clientIdError);
        }

        IdempotencyKey key = IdempotencyKey.of(envelope.clientId(), requestId);
        Optional<CommandResponse> cached = registry.get(key);
        if (cached.isPresent()) {
            return cached.get().toDuplicate();
        }

        PendingRequest pending = pendingRequests.get(requestId);
        if (pending != null && !pending.key().equals(key)) {
            CommandResponse response = CommandResponse.rejected(
                requestId,
                resolveServerStep(-1),
                CommandError.of(
                    TransportErrorCodes.REQUEST_ID_IN_USE,
                    "Envelope requestId is already in use by another client."
                )
            );
            registry.record(key, response, now);
            return response;
        }

        if (!Double.isFinite(envelope.sentAt())) {
            return recordRejected(key, now, CommandError.of(
                TransportErrorCodes.INVALID_SENT_AT,
                "Envelope sentAt must be a finite number."
            ));
        }

        SerializedCommand serialized = envelope.command();
        CommandError commandError = validateCommand(serialized);
        if (commandError != null) {
            return recordRejected(key, now, commandError);
        }

        Object payload;
        try {
            payload = PlainDataPayloads.copyOf(serialized.payload());
        } catch (IllegalArgumentException e) {
            return recordRejected(key, now, CommandError.of(
                TransportErrorCodes.INVALID_COMMAND_PAYLOAD,
                e.getMessage()
            ));
        }

        String commandRequestId = serialized.requestId();
        if (commandRequestId != null && validateIdentifier(commandRequestId) != null) {
            return recordRejected(key, now, CommandError.of(
                TransportErrorCodes.INVALID_COMMAND_REQUEST_ID,
                "Command requestId is invalid."
            ));
        }
        if (commandRequestId != null && !commandRequestId.equals(requestId)) {
            return recordRejected(key, now, CommandError.of(
                TransportErrorCodes.REQUEST_ID_MISMATCH,
                "Command requestId does not match envelope requestId.",
                Map.of("commandRequestId", commandRequestId, "envelopeRequestId", requestId)
            ));
        }

        long serverStep = resolveServerStep(serialized.step());
        Command command = new Command(
            serialized.type(),
            CommandPriority.fromValue(serialized.priority()),
            payload,
            (long) serialized.timestamp(),
            serverStep,
            requestId
        );

        if (!queue.enqueue(command)) {
            return recordRejected(key, now, CommandError.of(
                TransportErrorCodes.COMMAND_NOT_ENQUEUED,
                "Command was not accepted by the command queue."
            ));
        }

        CommandResponse response = CommandResponse.accepted(requestId, serverStep);
        registry.record(key, response, now);
        pendingRequests.put(requestId, new PendingRequest(key, now + registry.ttlMs()));
        return response;
    }

    /**
     * Runtime이 수집한 실행 결과를 최종 응답으로 변환.
     *
     * <p>대기 중인 requestId에 해당하는 결과만 변환하며, 변환된 응답은 레지스트리의
     * 기존 ACCEPTED 기록을 덮어씁니다. 이후 같은 요청의 재전송은 최종 응답을
     * DUPLICATE로 받습니다.</p>
     *
     * @param nowMs 현재 시각 (epoch millis)
     * @return 최종 응답 목록 (실행 순서)
     */
    public List<CommandResponse> drainOutcomeResponses(long nowMs) {
        purgeExpired(nowMs);

        List<CommandExecutionOutcome> outcomes = runtime.drainCommandOutcomes();
        List<CommandResponse> responses = new ArrayList<>();
        for (CommandExecutionOutcome outcome : outcomes) {
            String requestId = outcome.requestId();
            if (requestId == null || requestId.isEmpty()) {
                continue;
            }
            PendingRequest pending = pendingRequests.remove(requestId);
            if (pending == null) {
                continue;
            }

            CommandResponse response;
            if (outcome.result() instanceof Failure failure) {
                response = CommandResponse.rejected(requestId, outcome.serverStep(), toResponseError(failure.error()));
            } else {
                response = CommandResponse.accepted(requestId, outcome.serverStep());
            }
            registry.record(pending.key(), response, nowMs);
            responses.add(response);
        }
        return responses;
    }

    /**
     * 현재 시각 기준으로 {@link #drainOutcomeResponses(long)} 실행.
     *
     * @return 최종 응답 목록
     */
    public List<CommandResponse> drainOutcomeResponses() {
        return drainOutcomeResponses(clock.getAsLong());
    }

    /**
     * 만료된 레지스트리 기록과 대기 요청 정리.
     *
     * @param nowMs 기준 시각 (epoch millis)
     */
    public void purgeExpired(long nowMs) {
        registry.purgeExpired(nowMs);
        pendingRequests.values().removeIf(pending -> pending.expiresAtMs() <= nowMs);
    }

    /**
     * 대기 중인 요청 수.
     *
     * @return 최종 응답을 기다리는 requestId 수
     */
    public int pendingCount() {
        return pendingRequests.size();
    }

    private CommandResponse recordRejected(IdempotencyKey key, long now, CommandError error) {
        CommandResponse response = CommandResponse.rejected(key.requestId(), resolveServerStep(-1), error);
        registry.record(key, response, now);
        pendingRequests.put(key.requestId(), new PendingRequest(key, now + registry.ttlMs()));
        return response;
    }

    private CommandError validateIdentifier(String value) {
        if (value == null || value.isBlank()) {
            return CommandError.of(
                TransportErrorCodes.INVALID_IDENTIFIER,
                "Identifier must be a non-empty string."
            );
        }
        String stripped = value.strip();
        int maxLength = config.maxIdentifierLength();
        if (stripped.length() > maxLength) {
            return CommandError.of(
                TransportErrorCodes.IDENTIFIER_TOO_LONG,
                "Identifier exceeds the maximum length.",
                Map.of("maxLength", maxLength, "length", stripped.length())
            );
        }
        if (!stripped.equals(value)) {
            return CommandError.of(
                TransportErrorCodes.INVALID_IDENTIFIER_FORMAT,
                "Identifier must not include leading or trailing whitespace."
            );
        }
        return null;
    }

    private CommandError validateCommand(SerializedCommand command) {
        if (command == null) {
            return CommandError.of(TransportErrorCodes.INVALID_COMMAND, "Command payload must be an object.");
        }
        if (command.type() == null || command.type().isBlank()) {
            return CommandError.of(
                TransportErrorCodes.INVALID_COMMAND_TYPE,
                "Command type must be a non-empty string."
            );
        }
        Integer priority = command.priority();
        if (priority == null || !CommandPriority.isValid(priority)) {
            Object priorityDetail = priority == null ? "null" : priority;
            return CommandError.of(
                TransportErrorCodes.INVALID_COMMAND_PRIORITY,
                "Command priority is invalid.",
                Map.of("priority", priorityDetail)
            );
        }
        if (!Double.isFinite(command.timestamp())) {
            return CommandError.of(
                TransportErrorCodes.INVALID_COMMAND_TIMESTAMP,
                "Command timestamp must be a finite number."
            );
        }
        if (command.step() == null || command.step() < 0) {
            return CommandError.of(
                TransportErrorCodes.INVALID_COMMAND_STEP,
                "Command step must be a non-negative integer."
            );
        }
        return null;
    }

    private long resolveServerStep(long fallbackStep) {
        long step = runtime.getNextExecutableStep();
        if (step >= 0) {
            return step;
        }
        return Math.max(fallbackStep, 0);
    }

    private static CommandError toResponseError(CommandError error) {
        if (error.details() == null) {
            return error;
        }
        try {
            return CommandError.of(error.code(), error.message(), PlainDataPayloads.copyOfMap(error.details()));
        } catch (IllegalArgumentException e) {
            // 직렬화할 수 없는 details는 응답에서 제외
            return CommandError.of(error.code(), error.message());
        }
    }

    private record PendingRequest(IdempotencyKey key, long expiresAtMs) {
    }
}
