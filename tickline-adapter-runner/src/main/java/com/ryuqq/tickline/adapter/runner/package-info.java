/**
 * Runner Adapter Layer - Runtime 구현체.
 *
 * <p>이 패키지는 Runtime 인터페이스의 구체적인 구현체와 로깅 telemetry를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tickline.adapter.runner.StepRunner} - 고정 step 단위로 큐를 소비하는 러너</li>
 *   <li>{@link com.ryuqq.tickline.adapter.runner.StepRunnerConfig} - step 길이, 프레임당 최대 step 수 설정</li>
 *   <li>{@link com.ryuqq.tickline.adapter.runner.Slf4jTelemetrySink} - telemetry 이벤트를 SLF4J 로그로 출력</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (StepRunner)
 *   ↓ implements
 * application (Runtime interface)
 *   ↓ depends on
 * core (CommandQueue, CommandDispatcher, TelemetrySink)
 * </pre>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
package com.ryuqq.tickline.adapter.runner;
