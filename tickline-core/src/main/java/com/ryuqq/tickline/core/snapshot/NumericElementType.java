package com.ryuqq.tickline.core.snapshot;

/**
 * 숫자 buffer의 요소 타입.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public enum NumericElementType {

    INT16(short.class, Short.BYTES, true),
    INT32(int.class, Integer.BYTES, true),
    INT64(long.class, Long.BYTES, true),
    FLOAT32(float.class, Float.BYTES, false),
    FLOAT64(double.class, Double.BYTES, false);

    private final Class<?> componentType;
    private final int bytesPerElement;
    private final boolean integral;

    NumericElementType(Class<?> componentType, int bytesPerElement, boolean integral) {
        this.componentType = componentType;
        this.bytesPerElement = bytesPerElement;
        this.integral = integral;
    }

    public Class<?> getComponentType() {
        return componentType;
    }

    public int getBytesPerElement() {
        return bytesPerElement;
    }

    public boolean isIntegral() {
        return integral;
    }

    boolean sameValue(Number element, Number candidate) {
        if (integral) {
            return element.longValue() == candidate.longValue()
                && candidate.doubleValue() == candidate.longValue();
        }
        return element.doubleValue() == candidate.doubleValue();
    }
}
