package com.ryuqq.tickline.core.snapshot;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;
import java.util.Calendar;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Payload 값 종류 (closed variant).
 *
 * <p>{@link ImmutableSnapshots}는 이 enum에 대한 switch 식으로 분기하므로,
 * 새 종류를 추가하면 처리 코드 없이는 컴파일되지 않습니다.</p>
 *
 * <table border="1">
 *   <caption>분류 규칙</caption>
 *   <tr><th>Kind</th><th>입력 타입</th></tr>
 *   <tr><td>IMMUTABLE</td><td>null, String, boxed primitive, BigInteger, BigDecimal, enum, UUID, java.time 값, 기존 snapshot</td></tr>
 *   <tr><td>RECORD</td><td>java.lang.Record</td></tr>
 *   <tr><td>LIST</td><td>List 및 Set이 아닌 Collection, Object[], boolean[], char[]</td></tr>
 *   <tr><td>MAP</td><td>Map</td></tr>
 *   <tr><td>SET</td><td>Set</td></tr>
 *   <tr><td>BUFFER</td><td>byte[], heap ByteBuffer</td></tr>
 *   <tr><td>SHARED_BUFFER</td><td>direct ByteBuffer</td></tr>
 *   <tr><td>NUMERIC_BUFFER</td><td>short[]/int[]/long[]/float[]/double[] 및 대응 NIO buffer</td></tr>
 *   <tr><td>CALENDAR</td><td>Date, Calendar</td></tr>
 *   <tr><td>PATTERN</td><td>java.util.regex.Pattern</td></tr>
 *   <tr><td>UNSUPPORTED</td><td>그 외</td></tr>
 * </table>
 *
 * <p>enum 상수는 식별자 값으로 취급되어 참조 그대로 전달됩니다.
 * 상수에 변경 가능한 상태를 두는 enum은 payload로 사용하지 않습니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public enum SnapshotKind {

    IMMUTABLE,
    RECORD,
    LIST,
    MAP,
    SET,
    BUFFER,
    SHARED_BUFFER,
    NUMERIC_BUFFER,
    CALENDAR,
    PATTERN,
    UNSUPPORTED;

    private static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
        String.class,
        Boolean.class,
        Character.class,
        Byte.class,
        Short.class,
        Integer.class,
        Long.class,
        Float.class,
        Double.class,
        BigInteger.class,
        BigDecimal.class,
        UUID.class
    );

    /**
     * 값의 종류 판별.
     *
     * @param value 판별할 값 (null 허용)
     * @return SnapshotKind
     */
    public static SnapshotKind of(Object value) {
        if (value == null || value instanceof ImmutableSnapshot) {
            return IMMUTABLE;
        }
        Class<?> type = value.getClass();
        if (IMMUTABLE_TYPES.contains(type) || value instanceof Enum<?> || isJavaTimeValue(type)) {
            return IMMUTABLE;
        }
        if (value instanceof Record) {
            return RECORD;
        }
        if (value instanceof Map<?, ?>) {
            return MAP;
        }
        if (value instanceof Set<?>) {
            return SET;
        }
        if (value instanceof Collection<?>) {
            return LIST;
        }
        if (value instanceof byte[]) {
            return BUFFER;
        }
        if (value instanceof ByteBuffer buffer) {
            return buffer.isDirect() ? SHARED_BUFFER : BUFFER;
        }
        if (isNumericBuffer(value)) {
            return NUMERIC_BUFFER;
        }
        if (value instanceof Object[] || value instanceof boolean[] || value instanceof char[]) {
            return LIST;
        }
        if (value instanceof Date || value instanceof Calendar) {
            return CALENDAR;
        }
        if (value instanceof Pattern) {
            return PATTERN;
        }
        return UNSUPPORTED;
    }

    private static boolean isJavaTimeValue(Class<?> type) {
        // java.time 패키지의 값 타입은 모두 불변
        return type.getPackageName().startsWith("java.time");
    }

    private static boolean isNumericBuffer(Object value) {
        return value instanceof short[]
            || value instanceof int[]
            || value instanceof long[]
            || value instanceof float[]
            || value instanceof double[]
            || value instanceof ShortBuffer
            || value instanceof IntBuffer
            || value instanceof LongBuffer
            || value instanceof FloatBuffer
            || value instanceof DoubleBuffer;
    }
}
