package com.ryuqq.tickline.application.transport;

import com.ryuqq.tickline.core.result.CommandError;

/**
 * transport 응답.
 *
 * @param requestId 요청 식별자 (식별자 검증 실패 시 빈 문자열일 수 있음)
 * @param status 응답 상태
 * @param serverStep 서버가 배정한 step
 * @param error 오류 정보 (ACCEPTED이면 null)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record CommandResponse(
    String requestId,
    CommandResponseStatus status,
    long serverStep,
    CommandError error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException requestId 또는 status가 null인 경우
     */
    public CommandResponse {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static CommandResponse accepted(String requestId, long serverStep) {
        return new CommandResponse(requestId, CommandResponseStatus.ACCEPTED, serverStep, null);
    }

    /**
     * REJECTED 응답 생성.
     *
     * @param requestId 요청 식별자
     * @param serverStep 서버 step
     * @param error 오류 정보
     * @return REJECTED 응답
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static CommandResponse rejected(String requestId, long serverStep, CommandError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new CommandResponse(requestId, CommandResponseStatus.REJECTED, serverStep, error);
    }

    /**
     * 기록된 응답을 DUPLICATE 응답으로 변환.
     *
     * <p>requestId, serverStep, error는 그대로 유지합니다.</p>
     *
     * @return DUPLICATE 응답
     */
    public CommandResponse toDuplicate() {
        return new CommandResponse(requestId, CommandResponseStatus.DUPLICATE, serverStep, error);
    }

    public boolean isAccepted() {
        return status == CommandResponseStatus.ACCEPTED;
    }

    public boolean isRejected() {
        return status == CommandResponseStatus.REJECTED;
    }

    public boolean isDuplicate() {
        return status == CommandResponseStatus.DUPLICATE;
    }
}
