package com.ryuqq.tickline.core.result;

import java.util.Map;

/**
 * 실패 결과.
 *
 * <p>handler가 반환한 업무 실패와 Dispatcher가 변환한 실행 실패를 모두 표현합니다.</p>
 *
 * @param error 오류 정보
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record Failure(CommandError error) implements CommandResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Failure {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    /**
     * Failure 생성 (details 포함).
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @param details 부가 정보
     * @return Failure 인스턴스
     */
    public static Failure of(String code, String message, Map<String, Object> details) {
        return new Failure(CommandError.of(code, message, details));
    }

    public String code() {
        return error.code();
    }
}
