package com.ryuqq.tickline.adapter.runner;

import com.ryuqq.tickline.adapter.inmemory.store.InMemoryIdempotencyRegistry;
import com.ryuqq.tickline.application.transport.CommandEnvelope;
import com.ryuqq.tickline.application.transport.CommandResponse;
import com.ryuqq.tickline.application.transport.CommandResponseStatus;
import com.ryuqq.tickline.application.transport.CommandTransportConfig;
import com.ryuqq.tickline.application.transport.CommandTransportServer;
import com.ryuqq.tickline.application.transport.SerializedCommand;
import com.ryuqq.tickline.core.dispatcher.CommandDispatcher;
import com.ryuqq.tickline.core.dispatcher.ExecutionContext;
import com.ryuqq.tickline.core.model.CommandPriority;
import com.ryuqq.tickline.core.model.RuntimeCommandTypes;
import com.ryuqq.tickline.core.queue.CommandQueue;
import com.ryuqq.tickline.core.result.CommandResult;
import com.ryuqq.tickline.testkit.telemetry.RecordingTelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Transport → Queue → StepRunner → 최종 응답 통합 테스트.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
class StepRunnerTransportIntegrationTest {

    private AtomicLong clock;
    private CommandQueue queue;
    private StepRunner runner;
    private CommandTransportServer server;
    private List<Object> purchased;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(10_000L);
        RecordingTelemetrySink telemetry = new RecordingTelemetrySink();
        queue = new CommandQueue(CommandQueue.DEFAULT_MAX_SIZE, telemetry);
        CommandDispatcher dispatcher = new CommandDispatcher(telemetry);
        purchased = new ArrayList<>();

        dispatcher.register(RuntimeCommandTypes.PURCHASE_GENERATOR, (Object payload, ExecutionContext context) -> {
            Object generatorId = ((Map<?, ?>) payload).get("generatorId");
            if ("locked".equals(generatorId)) {
                return CommandResult.failure("GENERATOR_LOCKED", "Generator is locked");
            }
            purchased.add(generatorId);
            return CommandResult.success();
        });

        runner = new StepRunner(queue, dispatcher, telemetry, new StepRunnerConfig());
        server = new CommandTransportServer(
            queue,
            new InMemoryIdempotencyRegistry<>(60_000L),
            runner,
            clock::get,
            new CommandTransportConfig()
        );
    }

    private static CommandEnvelope purchase(String requestId, String generatorId, long clientStep) {
        return new CommandEnvelope(requestId, "client-a", 9_999d, SerializedCommand.of(
            RuntimeCommandTypes.PURCHASE_GENERATOR,
            CommandPriority.PLAYER.getValue(),
            9_999d,
            clientStep,
            Map.of("generatorId", generatorId)
        ));
    }

    @Test
    void 접수된_명령은_다음_step에_실행되고_최종_응답으로_변환됨() {
        // given
        runner.tick(300);

        // when
        CommandResponse accepted = server.handleEnvelope(purchase("req-1", "oven", 0));
        CommandResponse failing = server.handleEnvelope(purchase("req-2", "locked", 0));

        // then
        assertThat(accepted.status()).isEqualTo(CommandResponseStatus.ACCEPTED);
        assertThat(accepted.serverStep()).isEqualTo(3);
        assertThat(failing.serverStep()).isEqualTo(3);

        // when
        runner.tick(100);
        List<CommandResponse> finals = server.drainOutcomeResponses();

        // then
        assertThat(purchased).containsExactly("oven");
        assertThat(finals).extracting(CommandResponse::status)
            .containsExactly(CommandResponseStatus.ACCEPTED, CommandResponseStatus.REJECTED);
        assertThat(finals.get(1).error().code()).isEqualTo("GENERATOR_LOCKED");
        assertThat(finals).allMatch(response -> response.serverStep() == 3);
    }

    @Test
    void 재전송은_한_번만_실행되고_최종_응답을_DUPLICATE로_받음() {
        // given
        server.handleEnvelope(purchase("req-1", "locked", 0));
        runner.tick(100);
        server.drainOutcomeResponses();

        // when
        CommandResponse resent = server.handleEnvelope(purchase("req-1", "locked", 0));
        runner.tick(100);

        // then
        assertThat(resent.status()).isEqualTo(CommandResponseStatus.DUPLICATE);
        assertThat(resent.error().code()).isEqualTo("GENERATOR_LOCKED");
        assertThat(queue.isEmpty()).isTrue();
        assertThat(server.drainOutcomeResponses()).isEmpty();
    }
}
