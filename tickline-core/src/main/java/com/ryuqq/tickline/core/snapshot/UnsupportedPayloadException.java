package com.ryuqq.tickline.core.snapshot;

/**
 * snapshot으로 변환할 수 없는 payload 값.
 *
 * <p>상태를 가진 임의 객체(bean, {@code Matcher}, atomic 타입 등)나
 * 구성 요소 타입과 호환되지 않는 record는 읽기 전용 사본을 만들 수 없으므로 거부됩니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public class UnsupportedPayloadException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public UnsupportedPayloadException(String message) {
        super(message);
    }

    public UnsupportedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 지원하지 않는 타입의 값에 대한 예외 생성.
     *
     * @param value 거부된 값
     * @return UnsupportedPayloadException
     */
    public static UnsupportedPayloadException unsupportedType(Object value) {
        return new UnsupportedPayloadException(
            "Unsupported payload value type: " + value.getClass().getName()
        );
    }
}
