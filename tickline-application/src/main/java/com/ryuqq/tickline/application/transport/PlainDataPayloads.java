package com.ryuqq.tickline.application.transport;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 원격 payload의 plain data 검증 및 복사.
 *
 * <p>허용 타입: null, String, Boolean, 유한한 Number, List, String 키를 가진 Map.
 * 그 밖의 타입이나 순환 참조가 있으면 {@link IllegalArgumentException}을 던집니다.
 * 같은 객체를 여러 번 참조하는 것은 순환이 아니므로 허용합니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class PlainDataPayloads {

    private PlainDataPayloads() {
    }

    /**
     * plain data 검증 후 수정 불가능한 복사본 반환.
     *
     * @param value 원본 값
     * @return 복사본 (List/Map은 unmodifiable)
     * @throws IllegalArgumentException plain data가 아닌 경우
     */
    public static Object copyOf(Object value) {
        return copy(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * String 키 Map의 plain data 검증 후 수정 불가능한 복사본 반환.
     *
     * @param value 원본 Map
     * @return 복사본 (unmodifiable)
     * @throws IllegalArgumentException plain data가 아닌 경우
     */
    public static Map<String, Object> copyOfMap(Map<?, ?> value) {
        return copyMap(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * plain data 여부 확인.
     *
     * @param value 검사할 값
     * @return plain data이면 true
     */
    public static boolean isPlainData(Object value) {
        try {
            copyOf(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Object copy(Object value, Set<Object> ancestors) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return checkNumber(number);
        }
        if (value instanceof List<?> list) {
            enter(list, ancestors);
            List<Object> copied = new ArrayList<>(list.size());
            for (Object element : list) {
                copied.add(copy(element, ancestors));
            }
            ancestors.remove(list);
            return Collections.unmodifiableList(copied);
        }
        if (value instanceof Map<?, ?> map) {
            return copyMap(map, ancestors);
        }
        throw new IllegalArgumentException(
            "Command payload contains unsupported type: " + value.getClass().getName());
    }

    private static Map<String, Object> copyMap(Map<?, ?> map, Set<Object> ancestors) {
        enter(map, ancestors);
        Map<String, Object> copied = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException(
                    "Command payload contains non-string key: " + entry.getKey());
            }
            copied.put(key, copy(entry.getValue(), ancestors));
        }
        ancestors.remove(map);
        return Collections.unmodifiableMap(copied);
    }

    private static Number checkNumber(Number number) {
        if (number instanceof Integer || number instanceof Long
            || number instanceof Short || number instanceof Byte
            || number instanceof BigInteger || number instanceof BigDecimal) {
            return number;
        }
        if (number instanceof Double || number instanceof Float) {
            if (!Double.isFinite(number.doubleValue())) {
                throw new IllegalArgumentException("Command payload contains non-finite number");
            }
            return number;
        }
        throw new IllegalArgumentException(
            "Command payload contains unsupported type: " + number.getClass().getName());
    }

    private static void enter(Object container, Set<Object> ancestors) {
        if (!ancestors.add(container)) {
            throw new IllegalArgumentException("Command payload contains a circular reference");
        }
    }
}
