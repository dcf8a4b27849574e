package com.ryuqq.tickline.application.transport;

/**
 * 클라이언트 요청 봉투.
 *
 * <p>{@link SerializedCommand}와 마찬가지로 생성 시점에는 검증하지 않습니다.</p>
 *
 * @param requestId 요청 식별자
 * @param clientId 클라이언트 식별자
 * @param sentAt 클라이언트 전송 시각
 * @param command 직렬화된 명령
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record CommandEnvelope(
    String requestId,
    String clientId,
    double sentAt,
    SerializedCommand command
) {
}
