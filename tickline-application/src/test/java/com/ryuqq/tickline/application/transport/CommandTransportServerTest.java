package com.ryuqq.tickline.application.transport;

import com.ryuqq.tickline.adapter.inmemory.store.InMemoryIdempotencyRegistry;
import com.ryuqq.tickline.application.runtime.Runtime;
import com.ryuqq.tickline.core.model.Command;
import com.ryuqq.tickline.core.model.CommandPriority;
import com.ryuqq.tickline.core.model.RuntimeCommandTypes;
import com.ryuqq.tickline.core.queue.CommandQueue;
import com.ryuqq.tickline.core.result.CommandErrorCodes;
import com.ryuqq.tickline.core.result.CommandExecutionOutcome;
import com.ryuqq.tickline.core.result.CommandResult;
import com.ryuqq.tickline.core.result.Failure;
import com.ryuqq.tickline.testkit.telemetry.RecordingTelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

/**
 * CommandTransportServer 테스트.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CommandTransportServerTest {

    private static final long TTL_MS = 60_000L;

    @Mock
    private Runtime runtime;

    private AtomicLong clock;
    private RecordingTelemetrySink telemetry;
    private CommandQueue queue;
    private InMemoryIdempotencyRegistry<CommandResponse> registry;
    private CommandTransportServer server;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(1_000L);
        telemetry = new RecordingTelemetrySink();
        queue = new CommandQueue(CommandQueue.DEFAULT_MAX_SIZE, telemetry);
        registry = new InMemoryIdempotencyRegistry<>(TTL_MS);
        server = new CommandTransportServer(queue, registry, runtime, clock::get, new CommandTransportConfig());
        lenient().when(runtime.getNextExecutableStep()).thenReturn(7L);
    }

    // ============================================================
    // Accept
    // ============================================================

    @Test
    @DisplayName("유효한 envelope는 서버 step으로 큐에 적재되고 ACCEPTED")
    void handleEnvelope_valid_enqueuesWithServerStep() {
        // given
        CommandEnvelope envelope = envelope("client-a", "req-1", command(Map.of("generatorId", "oven")));

        // when
        CommandResponse response = server.handleEnvelope(envelope);

        // then
        assertThat(response.status()).isEqualTo(CommandResponseStatus.ACCEPTED);
        assertThat(response.requestId()).isEqualTo("req-1");
        assertThat(response.serverStep()).isEqualTo(7L);
        assertThat(response.error()).isNull();

        List<Command> queued = queue.dequeueAll();
        assertThat(queued).hasSize(1);
        Command queuedCommand = queued.get(0);
        assertThat(queuedCommand.type()).isEqualTo(RuntimeCommandTypes.PURCHASE_GENERATOR);
        assertThat(queuedCommand.priority()).isEqualTo(CommandPriority.PLAYER);
        assertThat(queuedCommand.step()).isEqualTo(7L);
        assertThat(queuedCommand.requestId()).isEqualTo("req-1");
        assertThat(queuedCommand.timestamp()).isEqualTo(500L);
        assertThat(server.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("runtime이 음수 step을 주면 클라이언트 step으로 대체")
    void handleEnvelope_negativeRuntimeStep_fallsBackToCommandStep() {
        // given
        when(runtime.getNextExecutableStep()).thenReturn(-1L);

        // when
        CommandResponse response = server.handleEnvelope(envelope("client-a", "req-1", command(null)));

        // then
        assertThat(response.serverStep()).isEqualTo(3L);
        assertThat(queue.dequeueAll().get(0).step()).isEqualTo(3L);
    }

    // ============================================================
    // Duplicates and request id ownership
    // ============================================================

    @Test
    @DisplayName("같은 클라이언트의 재전송은 큐에 다시 넣지 않고 DUPLICATE")
    void handleEnvelope_resend_returnsDuplicateWithoutEnqueue() {
        // given
        server.handleEnvelope(envelope("client-a", "req-1", command(null)));

        // when
        CommandResponse duplicate = server.handleEnvelope(envelope("client-a", "req-1", command(null)));

        // then
        assertThat(duplicate.status()).isEqualTo(CommandResponseStatus.DUPLICATE);
        assertThat(duplicate.serverStep()).isEqualTo(7L);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("서버 시계가 실제 시각과 달라도 재전송은 한 번만 접수")
    void handleEnvelope_simulatedServerClock_resendIsDuplicate() {
        // given
        CommandTransportServer simulated = new CommandTransportServer(
            queue, new InMemoryIdempotencyRegistry<>(), runtime, () -> 1_000L, new CommandTransportConfig());
        CommandEnvelope envelope = envelope("client-a", "req-1", command(null));

        // when
        CommandResponse first = simulated.handleEnvelope(envelope);
        CommandResponse second = simulated.handleEnvelope(envelope);

        // then
        assertThat(first.status()).isEqualTo(CommandResponseStatus.ACCEPTED);
        assertThat(second.isDuplicate()).isTrue();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("다른 클라이언트가 대기 중인 requestId를 쓰면 REQUEST_ID_IN_USE")
    void handleEnvelope_requestIdPendingForOtherClient_rejected() {
        // given
        server.handleEnvelope(envelope("client-a", "req-1", command(null)));

        // when
        CommandResponse response = server.handleEnvelope(envelope("client-b", "req-1", command(null)));

        // then
        assertThat(response.status()).isEqualTo(CommandResponseStatus.REJECTED);
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.REQUEST_ID_IN_USE);
        assertThat(queue.size()).isEqualTo(1);

        // and the rejection itself is remembered for client-b
        CommandResponse again = server.handleEnvelope(envelope("client-b", "req-1", command(null)));
        assertThat(again.status()).isEqualTo(CommandResponseStatus.DUPLICATE);
        assertThat(again.error().code()).isEqualTo(TransportErrorCodes.REQUEST_ID_IN_USE);
    }

    @Test
    @DisplayName("TTL이 지나면 기록과 대기 요청이 정리되어 다시 접수 가능")
    void handleEnvelope_afterTtl_acceptedAgain() {
        // given
        server.handleEnvelope(envelope("client-a", "req-1", command(null)));

        // when
        clock.addAndGet(TTL_MS);
        CommandResponse response = server.handleEnvelope(envelope("client-b", "req-1", command(null)));

        // then
        assertThat(response.status()).isEqualTo(CommandResponseStatus.ACCEPTED);
        assertThat(queue.size()).isEqualTo(2);
    }

    // ============================================================
    // Identifier validation
    // ============================================================

    @Test
    @DisplayName("null envelope는 빈 requestId로 INVALID_IDENTIFIER")
    void handleEnvelope_null_invalidIdentifier() {
        // when
        CommandResponse response = server.handleEnvelope(null);

        // then
        assertThat(response.requestId()).isEmpty();
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.INVALID_IDENTIFIER);
    }

    @Test
    @DisplayName("공백 clientId는 INVALID_IDENTIFIER, 기록하지 않음")
    void handleEnvelope_blankClientId_notRecorded() {
        // when
        CommandResponse response = server.handleEnvelope(envelope("  ", "req-1", command(null)));

        // then
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.INVALID_IDENTIFIER);
        assertThat(response.requestId()).isEqualTo("req-1");
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("앞뒤 공백이 있는 식별자는 INVALID_IDENTIFIER_FORMAT")
    void handleEnvelope_surroundingWhitespace_invalidFormat() {
        // when
        CommandResponse response = server.handleEnvelope(envelope("client-a", " req-1", command(null)));

        // then
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.INVALID_IDENTIFIER_FORMAT);
        assertThat(response.requestId()).isEqualTo(" req-1");
    }

    @Test
    @DisplayName("최대 길이를 넘는 식별자는 IDENTIFIER_TOO_LONG")
    void handleEnvelope_tooLongIdentifier_rejected() {
        // given
        CommandTransportServer shortServer = new CommandTransportServer(
            queue, registry, runtime, clock::get, new CommandTransportConfig().withMaxIdentifierLength(4));

        // when
        CommandResponse response = shortServer.handleEnvelope(envelope("client-a", "req-1", command(null)));

        // then
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.IDENTIFIER_TOO_LONG);
        assertThat(response.error().details()).containsEntry("maxLength", 4).containsEntry("length", 5);
    }

    // ============================================================
    // Envelope and command validation
    // ============================================================

    @Test
    @DisplayName("sentAt이 유한수가 아니면 INVALID_SENT_AT")
    void handleEnvelope_nonFiniteSentAt_rejected() {
        // when
        CommandResponse response = server.handleEnvelope(
            new CommandEnvelope("req-1", "client-a", Double.NaN, command(null)));

        // then
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.INVALID_SENT_AT);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("명령 필드 검증 실패는 각 코드로 REJECTED")
    void handleEnvelope_invalidCommandFields_rejectedWithCodes() {
        assertThat(code(envelope("c", "r1", null))).isEqualTo(TransportErrorCodes.INVALID_COMMAND);
        assertThat(code(envelope("c", "r2", new SerializedCommand(" ", 1, 0, 0L, null, null))))
            .isEqualTo(TransportErrorCodes.INVALID_COMMAND_TYPE);
        assertThat(code(envelope("c", "r3", new SerializedCommand("T", 9, 0, 0L, null, null))))
            .isEqualTo(TransportErrorCodes.INVALID_COMMAND_PRIORITY);
        assertThat(code(envelope("c", "r4", new SerializedCommand("T", 1, Double.POSITIVE_INFINITY, 0L, null, null))))
            .isEqualTo(TransportErrorCodes.INVALID_COMMAND_TIMESTAMP);
        assertThat(code(envelope("c", "r5", new SerializedCommand("T", 1, 0, -1L, null, null))))
            .isEqualTo(TransportErrorCodes.INVALID_COMMAND_STEP);
        assertThat(code(envelope("c", "r6", new SerializedCommand("T", 1, 0, null, null, null))))
            .isEqualTo(TransportErrorCodes.INVALID_COMMAND_STEP);
        assertThat(code(envelope("c", "r7", new SerializedCommand("T", 1, 0, 0L, null, " bad"))))
            .isEqualTo(TransportErrorCodes.INVALID_COMMAND_REQUEST_ID);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("priority 오류 details에 시도한 값이 담김")
    void handleEnvelope_invalidPriority_detailsCarryValue() {
        // when
        CommandResponse response = server.handleEnvelope(
            envelope("client-a", "req-1", new SerializedCommand("T", 5, 0, 0L, null, null)));

        // then
        assertThat(response.error().details()).containsEntry("priority", 5);
    }

    @Test
    @DisplayName("plain data가 아닌 payload는 INVALID_COMMAND_PAYLOAD")
    void handleEnvelope_nonPlainPayload_rejected() {
        // given
        Map<String, Object> circular = new HashMap<>();
        circular.put("self", circular);

        // when
        CommandResponse response = server.handleEnvelope(envelope("client-a", "req-1", command(circular)));

        // then
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.INVALID_COMMAND_PAYLOAD);
        assertThat(response.error().message()).contains("circular reference");
    }

    @Test
    @DisplayName("명령 requestId가 envelope와 다르면 REQUEST_ID_MISMATCH")
    void handleEnvelope_requestIdMismatch_rejected() {
        // when
        CommandResponse response = server.handleEnvelope(
            envelope("client-a", "req-1", new SerializedCommand("T", 1, 0, 0L, null, "req-2")));

        // then
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.REQUEST_ID_MISMATCH);
        assertThat(response.error().details())
            .containsEntry("commandRequestId", "req-2")
            .containsEntry("envelopeRequestId", "req-1");
    }

    @Test
    @DisplayName("큐가 명령을 거부하면 COMMAND_NOT_ENQUEUED")
    void handleEnvelope_queueRefuses_rejected() {
        // given
        SerializedCommand automationPrestige = SerializedCommand.of(
            RuntimeCommandTypes.PRESTIGE_RESET, CommandPriority.AUTOMATION.getValue(), 0, 0L, null);

        // when
        CommandResponse response = server.handleEnvelope(envelope("client-a", "req-1", automationPrestige));

        // then
        assertThat(response.status()).isEqualTo(CommandResponseStatus.REJECTED);
        assertThat(response.error().code()).isEqualTo(TransportErrorCodes.COMMAND_NOT_ENQUEUED);
        assertThat(queue.isEmpty()).isTrue();
        assertThat(telemetry.warnings("AutomationPrestigeBlocked")).hasSize(1);
    }

    // ============================================================
    // Outcome draining
    // ============================================================

    @Test
    @DisplayName("실행 결과가 최종 응답으로 변환되고 레지스트리 기록을 덮어씀")
    void drainOutcomeResponses_rewritesStoredResponses() {
        // given
        server.handleEnvelope(envelope("client-a", "req-ok", command(null)));
        server.handleEnvelope(envelope("client-a", "req-fail", command(null)));
        List<CommandExecutionOutcome> outcomes = new ArrayList<>();
        outcomes.add(new CommandExecutionOutcome("req-ok", 7L, CommandResult.success()));
        outcomes.add(new CommandExecutionOutcome("req-fail", 7L,
            CommandResult.failure(CommandErrorCodes.COMMAND_EXECUTION_FAILED, "boom")));
        outcomes.add(new CommandExecutionOutcome(null, 7L, CommandResult.success()));
        outcomes.add(new CommandExecutionOutcome("unknown", 7L, CommandResult.success()));
        when(runtime.drainCommandOutcomes()).thenReturn(outcomes);

        // when
        List<CommandResponse> responses = server.drainOutcomeResponses(clock.get());

        // then
        assertThat(responses).hasSize(2);
        assertThat(responses.get(0).status()).isEqualTo(CommandResponseStatus.ACCEPTED);
        assertThat(responses.get(1).status()).isEqualTo(CommandResponseStatus.REJECTED);
        assertThat(responses.get(1).error().code()).isEqualTo(CommandErrorCodes.COMMAND_EXECUTION_FAILED);
        assertThat(server.pendingCount()).isZero();

        CommandResponse resent = server.handleEnvelope(envelope("client-a", "req-fail", command(null)));
        assertThat(resent.status()).isEqualTo(CommandResponseStatus.DUPLICATE);
        assertThat(resent.error().message()).isEqualTo("boom");
    }

    @Test
    @DisplayName("실행이 끝난 requestId는 다른 클라이언트가 다시 사용할 수 있음")
    void drainOutcomeResponses_releasesRequestId() {
        // given
        server.handleEnvelope(envelope("client-a", "req-1", command(null)));
        when(runtime.drainCommandOutcomes())
            .thenReturn(List.of(new CommandExecutionOutcome("req-1", 7L, CommandResult.success())));
        server.drainOutcomeResponses(clock.get());

        // when
        CommandResponse response = server.handleEnvelope(envelope("client-b", "req-1", command(null)));

        // then
        assertThat(response.status()).isEqualTo(CommandResponseStatus.ACCEPTED);
    }

    @Test
    @DisplayName("직렬화할 수 없는 실패 details는 응답에서 제외")
    void drainOutcomeResponses_nonPlainDetails_dropped() {
        // given
        server.handleEnvelope(envelope("client-a", "req-1", command(null)));
        Map<String, Object> details = Map.of("error", new IllegalStateException("x"));
        when(runtime.drainCommandOutcomes()).thenReturn(List.of(new CommandExecutionOutcome(
            "req-1", 7L, Failure.of(CommandErrorCodes.COMMAND_EXECUTION_FAILED, "x", details))));

        // when
        List<CommandResponse> responses = server.drainOutcomeResponses(clock.get());

        // then
        assertThat(responses.get(0).error().details()).isNull();
        assertThat(responses.get(0).error().message()).isEqualTo("x");
    }

    // ============================================================
    // Helpers
    // ============================================================

    private String code(CommandEnvelope envelope) {
        return server.handleEnvelope(envelope).error().code();
    }

    private static CommandEnvelope envelope(String clientId, String requestId, SerializedCommand command) {
        return new CommandEnvelope(requestId, clientId, 1_000d, command);
    }

    private static SerializedCommand command(Object payload) {
        return SerializedCommand.of(
            RuntimeCommandTypes.PURCHASE_GENERATOR,
            CommandPriority.PLAYER.getValue(),
            500d,
            3L,
            payload
        );
    }
}
