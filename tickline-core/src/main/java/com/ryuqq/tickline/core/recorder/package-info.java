/**
 * 명령 기록과 결정적 재실행.
 *
 * <p>{@link com.ryuqq.tickline.core.recorder.CommandRecorder}는 드라이버가 실행한 명령을 snapshot으로 보관하고,
 * 내보낸 {@link com.ryuqq.tickline.core.recorder.CommandLog}를 phase REPLAY 권한 검사로 다시 실행합니다.</p>
 *
 * @since 1.0.0
 * @author Tickline Team
 */
package com.ryuqq.tickline.core.recorder;
