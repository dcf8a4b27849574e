/**
 * Runtime 인터페이스 및 관련 컴포넌트.
 *
 * <p>이 패키지는 고정 step 단위로 명령 큐를 소비하는 Runtime 인터페이스를 제공합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tickline.application.runtime.Runtime} - step 누적 및 명령 실행 인터페이스</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code StepRunner}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.tickline.application.runtime;
