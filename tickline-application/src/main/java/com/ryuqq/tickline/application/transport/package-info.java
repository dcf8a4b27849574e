/**
 * 원격 명령 수신 경계 (transport boundary).
 *
 * <p>wire 직렬화는 다루지 않습니다. 이미 역직렬화된 {@link com.ryuqq.tickline.application.transport.CommandEnvelope}를
 * 받아 검증, 중복 제거, 큐 적재를 수행하고 {@link com.ryuqq.tickline.application.transport.CommandResponse}로 응답합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.tickline.application.transport.CommandTransportServer} - envelope 처리 및 최종 응답 변환</li>
 *   <li>{@link com.ryuqq.tickline.application.transport.PlainDataPayloads} - 원격 payload 검증</li>
 *   <li>{@link com.ryuqq.tickline.application.transport.TransportErrorCodes} - REJECTED 오류 코드</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.tickline.application.transport;
