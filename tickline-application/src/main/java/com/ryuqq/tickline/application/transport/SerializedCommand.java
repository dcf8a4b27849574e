package com.ryuqq.tickline.application.transport;

/**
 * 클라이언트가 전송한 직렬화된 명령.
 *
 * <p>수신 직후의 원시 데이터이므로 생성 시점에는 검증하지 않습니다.
 * 모든 필드는 {@link CommandTransportServer#handleEnvelope(CommandEnvelope)}에서
 * 검증되고, 실패 시 REJECTED 응답으로 변환됩니다.</p>
 *
 * @param type 명령 유형
 * @param priority 우선순위 숫자 값 (null 가능, 0/1/2만 유효)
 * @param timestamp 클라이언트 생성 시각 (유한수여야 함)
 * @param step 클라이언트가 본 step (0 이상)
 * @param payload 업무 데이터 (plain data만 허용)
 * @param requestId 명령 수준 요청 식별자 (null이면 envelope의 것을 사용)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record SerializedCommand(
    String type,
    Integer priority,
    double timestamp,
    Long step,
    Object payload,
    String requestId
) {

    /**
     * requestId 없이 생성.
     *
     * @param type 명령 유형
     * @param priority 우선순위 숫자 값
     * @param timestamp 생성 시각
     * @param step step
     * @param payload 업무 데이터
     * @return SerializedCommand 인스턴스
     */
    public static SerializedCommand of(String type, Integer priority, double timestamp, Long step, Object payload) {
        return new SerializedCommand(type, priority, timestamp, step, payload, null);
    }
}
