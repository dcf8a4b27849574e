package com.ryuqq.tickline.adapter.runner;

/**
 * StepRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>stepSizeMs: simulation step 하나의 길이 (기본 100ms)</li>
 *   <li>maxStepsPerFrame: tick() 한 번에 실행할 최대 step 수 (기본 50)</li>
 * </ul>
 *
 * <p>maxStepsPerFrame은 긴 정지 후 한 프레임에 밀린 step을 모두 실행하느라
 * 다음 프레임이 더 늦어지는 상황을 막습니다. 남은 시간은 누적기에 남아
 * 다음 tick()에서 이어서 소비됩니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 * @param stepSizeMs step 길이 (밀리초, 양수여야 함)
 * @param maxStepsPerFrame 프레임당 최대 step 수 (1 이상이어야 함)
 */
public record StepRunnerConfig(
    long stepSizeMs,
    int maxStepsPerFrame
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: stepSizeMs=100ms, maxStepsPerFrame=50</p>
     */
    public StepRunnerConfig() {
        this(100, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StepRunnerConfig {
        if (stepSizeMs <= 0) {
            throw new IllegalArgumentException(
                "stepSizeMs must be positive (current: " + stepSizeMs + ")"
            );
        }
        if (maxStepsPerFrame <= 0) {
            throw new IllegalArgumentException(
                "maxStepsPerFrame must be positive (current: " + maxStepsPerFrame + ")"
            );
        }
    }

    /**
     * stepSizeMs만 변경한 새 인스턴스 생성.
     */
    public StepRunnerConfig withStepSizeMs(long stepSizeMs) {
        return new StepRunnerConfig(stepSizeMs, maxStepsPerFrame);
    }

    /**
     * maxStepsPerFrame만 변경한 새 인스턴스 생성.
     */
    public StepRunnerConfig withMaxStepsPerFrame(int maxStepsPerFrame) {
        return new StepRunnerConfig(stepSizeMs, maxStepsPerFrame);
    }
}
