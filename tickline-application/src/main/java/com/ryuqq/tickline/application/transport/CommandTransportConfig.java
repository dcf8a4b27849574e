package com.ryuqq.tickline.application.transport;

/**
 * CommandTransportServer 설정.
 *
 * @param maxIdentifierLength requestId/clientId 최대 길이 (기본값: 128)
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public record CommandTransportConfig(
    int maxIdentifierLength
) {

    public static final int DEFAULT_MAX_IDENTIFIER_LENGTH = 128;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CommandTransportConfig {
        if (maxIdentifierLength <= 0) {
            throw new IllegalArgumentException(
                "maxIdentifierLength must be positive (current: " + maxIdentifierLength + ")"
            );
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public CommandTransportConfig() {
        this(DEFAULT_MAX_IDENTIFIER_LENGTH);
    }

    /**
     * maxIdentifierLength만 변경한 새 인스턴스 생성.
     */
    public CommandTransportConfig withMaxIdentifierLength(int newMaxIdentifierLength) {
        return new CommandTransportConfig(newMaxIdentifierLength);
    }
}
