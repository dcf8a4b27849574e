package com.ryuqq.tickline.core.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 실패 결과의 오류 정보.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CommandError error = CommandError.of(
 *     CommandErrorCodes.COMMAND_UNAUTHORIZED,
 *     "Command PRESTIGE_RESET is not authorized for priority AUTOMATION",
 *     Map.of("type", "PRESTIGE_RESET", "priority", "AUTOMATION")
 * );
 * </pre>
 *
 * @param code 안정적인 오류 코드 (예: COMMAND_EXECUTION_FAILED)
 * @param message 오류 메시지 (빈 문자열 허용)
 * @param details 부가 정보 (null 가능, 삽입 순서 유지된 읽기 전용 사본)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record CommandError(
    String code,
    String message,
    Map<String, Object> details
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 비어있거나 message가 null인 경우
     */
    public CommandError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (details != null) {
            details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }
    }

    public static CommandError of(String code, String message) {
        return new CommandError(code, message, null);
    }

    public static CommandError of(String code, String message, Map<String, Object> details) {
        return new CommandError(code, message, details);
    }
}
