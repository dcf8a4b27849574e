package com.ryuqq.tickline.core.dispatcher;

import com.ryuqq.tickline.core.authorization.AuthorizationContext;
import com.ryuqq.tickline.core.authorization.CommandAuthorizer;
import com.ryuqq.tickline.core.model.Command;
import com.ryuqq.tickline.core.result.CommandErrorCodes;
import com.ryuqq.tickline.core.result.CommandResult;
import com.ryuqq.tickline.core.result.Failure;
import com.ryuqq.tickline.core.spi.EventPublisher;
import com.ryuqq.tickline.core.spi.TelemetrySink;
import com.ryuqq.tickline.core.telemetry.TelemetryEvents;
import com.ryuqq.tickline.core.telemetry.noop.NoOpTelemetrySink;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.BiConsumer;

/**
 * 명령 유형별 handler 실행기.
 *
 * <p>Dispatcher는 실행 직전에 권한을 다시 검사하므로 Queue를 거치지 않은 명령도
 * handler에 도달하기 전에 거부됩니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>권한 검사 (phase LIVE, reason "dispatcher"): 실패 시 COMMAND_UNAUTHORIZED</li>
 *   <li>handler 조회: 없으면 {@value TelemetryEvents#UNKNOWN_COMMAND_TYPE} 오류 기록 후 UNKNOWN_COMMAND_TYPE</li>
 *   <li>handler 실행 (payload, ExecutionContext)</li>
 *   <li>결과 정규화: null → Success, Failure → 그대로, 예외 → COMMAND_EXECUTION_FAILED
 *       ({@value TelemetryEvents#COMMAND_EXECUTION_FAILED} 오류 1회 기록)</li>
 * </ol>
 *
 * <p>어떤 경우에도 예외를 밖으로 던지지 않고 {@link CommandResult}로 완료되는 future를 반환합니다.
 * 동기 handler의 결과는 이미 완료된 future입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CommandDispatcher dispatcher = new CommandDispatcher(telemetry);
 * dispatcher.register(RuntimeCommandTypes.PURCHASE_GENERATOR,
 *     (payload, context) -&gt; {
 *         Map&lt;?, ?&gt; fields = (Map&lt;?, ?&gt;) payload;
 *         generators.purchase((String) fields.get("generatorId"));
 *         return null;
 *     });
 * CommandResult result = dispatcher.executeWithResult(command).join();
 * </pre>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class CommandDispatcher {

    private static final AuthorizationContext DISPATCHER_CONTEXT = AuthorizationContext.live("dispatcher");

    private static final EventPublisher MISSING_PUBLISHER = (eventType, payload) -> {
        throw new IllegalStateException("No event publisher configured for event: " + eventType);
    };

    private final Map<String, Registration> handlers = new LinkedHashMap<>();
    private final CommandAuthorizer authorizer;
    private final TelemetrySink telemetry;

    private EventPublisher eventPublisher = MISSING_PUBLISHER;

    /**
     * NoOp telemetry로 생성.
     */
    public CommandDispatcher() {
        this(NoOpTelemetrySink.INSTANCE);
    }

    public CommandDispatcher(TelemetrySink telemetry) {
        this(new CommandAuthorizer(telemetry), telemetry);
    }

    /**
     * 생성자.
     *
     * @param authorizer execution 권한 검사기
     * @param telemetry telemetry sink
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CommandDispatcher(CommandAuthorizer authorizer, TelemetrySink telemetry) {
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer cannot be null");
        }
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        this.authorizer = authorizer;
        this.telemetry = telemetry;
    }

    /**
     * 동기 handler 등록 (같은 유형은 교체).
     *
     * @param type 명령 유형
     * @param handler handler
     * @throws IllegalArgumentException type이 비어있거나 handler가 null인 경우
     */
    public void register(String type, CommandHandler handler) {
        requireRegistration(type, handler);
        handlers.put(type, new Registration(handler, (payload, context) ->
            CompletableFuture.completedFuture(handler.handle(payload, context))));
    }

    /**
     * 비동기 handler 등록 (같은 유형은 교체).
     *
     * @param type 명령 유형
     * @param handler handler
     * @throws IllegalArgumentException type이 비어있거나 handler가 null인 경우
     */
    public void registerAsync(String type, AsyncCommandHandler handler) {
        requireRegistration(type, handler);
        handlers.put(type, new Registration(handler, handler));
    }

    private static void requireRegistration(String type, Object handler) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
    }

    /**
     * handler에 전달할 이벤트 발행 통로 설정.
     *
     * @param eventPublisher 이벤트 발행기
     * @throws IllegalArgumentException eventPublisher가 null인 경우
     */
    public void setEventPublisher(EventPublisher eventPublisher) {
        if (eventPublisher == null) {
            throw new IllegalArgumentException("eventPublisher cannot be null");
        }
        this.eventPublisher = eventPublisher;
    }

    public boolean hasHandler(String type) {
        return handlers.containsKey(type);
    }

    /**
     * 등록된 handler 순회 (등록 순서).
     *
     * @param consumer (명령 유형, 등록된 handler 객체)
     */
    public void forEachHandler(BiConsumer<String, Object> consumer) {
        handlers.forEach((type, registration) -> consumer.accept(type, registration.handler()));
    }

    /**
     * 명령 실행 후 결과 반환.
     *
     * @param command 실행할 명령
     * @return 항상 정상 완료되는 결과 future
     * @throws IllegalArgumentException command가 null인 경우
     */
    public CompletableFuture<CommandResult> executeWithResult(Command command) {
        return executeWithResult(command, DISPATCHER_CONTEXT);
    }

    /**
     * 주어진 권한 context로 명령 실행 후 결과 반환.
     *
     * <p>기록된 명령을 다시 실행할 때 phase REPLAY context로 호출합니다.</p>
     *
     * @param command 실행할 명령
     * @param authorizationContext 권한 검사 context
     * @return 항상 정상 완료되는 결과 future
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CompletableFuture<CommandResult> executeWithResult(
        Command command,
        AuthorizationContext authorizationContext
    ) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (authorizationContext == null) {
            throw new IllegalArgumentException("authorizationContext cannot be null");
        }

        if (!authorizer.authorize(command, authorizationContext)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("type", command.type());
            details.put("priority", command.priority().name());
            return CompletableFuture.completedFuture(Failure.of(
                CommandErrorCodes.COMMAND_UNAUTHORIZED,
                "Command " + command.type() + " is not authorized for priority " + command.priority(),
                details
            ));
        }

        Registration registration = handlers.get(command.type());
        if (registration == null) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", command.type());
            telemetry.recordError(TelemetryEvents.UNKNOWN_COMMAND_TYPE, data);
            return CompletableFuture.completedFuture(Failure.of(
                CommandErrorCodes.UNKNOWN_COMMAND_TYPE,
                "Unknown command type: " + command.type(),
                data
            ));
        }

        ExecutionContext context = new ExecutionContext(
            command.step(),
            command.timestamp(),
            command.priority(),
            eventPublisher,
            command.requestId()
        );

        CompletionStage<CommandResult> stage;
        try {
            stage = registration.invoker().handle(command.payload(), context);
        } catch (Exception e) {
            return CompletableFuture.completedFuture(executionFailed(command, e));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(CommandResult.success());
        }
        return stage
            .handle((result, error) -> error != null
                ? executionFailed(command, unwrap(error))
                : normalize(result))
            .toCompletableFuture();
    }

    /**
     * 명령 실행 (결과를 기다리지 않음).
     *
     * <p>늦게 실패한 비동기 handler도 telemetry에 기록됩니다.</p>
     *
     * @param command 실행할 명령
     */
    public void execute(Command command) {
        executeWithResult(command);
    }

    private CommandResult executionFailed(Command command, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", command.type());
        data.put("error", message);
        telemetry.recordError(TelemetryEvents.COMMAND_EXECUTION_FAILED, data);

        return Failure.of(CommandErrorCodes.COMMAND_EXECUTION_FAILED, message, data);
    }

    private static CommandResult normalize(CommandResult result) {
        return result != null ? result : CommandResult.success();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record Registration(Object handler, AsyncCommandHandler invoker) {
    }
}
