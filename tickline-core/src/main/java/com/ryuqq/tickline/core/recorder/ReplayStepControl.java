package com.ryuqq.tickline.core.recorder;

/**
 * 재실행이 끝난 뒤 드라이버의 step 위치를 옮기기 위한 접근점.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public interface ReplayStepControl {

    long getCurrentStep();

    long getNextExecutableStep();

    void setCurrentStep(long step);

    void setNextExecutableStep(long step);
}
