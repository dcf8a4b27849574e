package com.ryuqq.tickline.core.model;

/**
 * 멱등성 복합 키.
 *
 * <p>IdempotencyKey는 (clientId, requestId) 조합으로 구성되며,
 * transport 경계에서 재전송된 요청을 식별하는 데 사용됩니다.</p>
 *
 * <p><strong>비즈니스 의미:</strong></p>
 * <ul>
 *   <li><strong>clientId:</strong> 요청을 보낸 클라이언트 (세션, 워커 등)</li>
 *   <li><strong>requestId:</strong> 클라이언트 내에서 요청 구분</li>
 * </ul>
 *
 * <p>서로 다른 클라이언트가 같은 requestId를 사용하더라도 다른 키로 취급됩니다.
 * 식별자에 구분자 문자(예: ':')가 포함되어도 충돌하지 않습니다.</p>
 *
 * @param clientId 클라이언트 식별자
 * @param requestId 요청 식별자
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record IdempotencyKey(
    String clientId,
    String requestId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public IdempotencyKey {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId cannot be null or blank");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be null or blank");
        }
    }

    /**
     * IdempotencyKey 생성.
     *
     * @param clientId 클라이언트 식별자
     * @param requestId 요청 식별자
     * @return IdempotencyKey
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public static IdempotencyKey of(String clientId, String requestId) {
        return new IdempotencyKey(clientId, requestId);
    }
}
