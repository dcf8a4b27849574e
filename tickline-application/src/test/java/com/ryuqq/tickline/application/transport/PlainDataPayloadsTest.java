package com.ryuqq.tickline.application.transport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PlainDataPayloads 테스트.
 *
 * @author Tickline Team
 * @since 1.0.0
 */
class PlainDataPayloadsTest {

    @Test
    @DisplayName("중첩 List/Map은 수정 불가능한 사본으로 복사")
    @SuppressWarnings("unchecked")
    void copyOf_nestedContainers_unmodifiableCopy() {
        // given
        List<Object> tags = new ArrayList<>(List.of("a", 1, 2.5, true));
        tags.add(null);
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("tags", tags);
        source.put("amount", new BigDecimal("1.50"));

        // when
        Map<String, Object> copy = (Map<String, Object>) PlainDataPayloads.copyOf(source);
        tags.add("later");

        // then
        assertThat(copy).containsOnlyKeys("tags", "amount");
        assertThat((List<Object>) copy.get("tags")).containsExactly("a", 1, 2.5, true, null);
        assertThatThrownBy(() -> copy.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("같은 객체를 여러 번 참조하는 것은 순환이 아님")
    void copyOf_sharedReference_allowed() {
        // given
        List<Object> shared = List.of(1, 2);
        Map<String, Object> source = Map.of("left", shared, "right", shared);

        // when & then
        assertThat(PlainDataPayloads.isPlainData(source)).isTrue();
    }

    @Test
    @DisplayName("순환 참조는 거부")
    void copyOf_circular_rejected() {
        // given
        List<Object> loop = new ArrayList<>();
        loop.add(loop);

        // when & then
        assertThatThrownBy(() -> PlainDataPayloads.copyOf(loop))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Command payload contains a circular reference");
    }

    @Test
    @DisplayName("유한하지 않은 수, 문자열이 아닌 키, 그 밖의 타입은 거부")
    void copyOf_unsupportedValues_rejected() {
        Map<Object, Object> intKey = new HashMap<>();
        intKey.put(1, "x");

        assertThatThrownBy(() -> PlainDataPayloads.copyOf(Double.NaN))
            .hasMessage("Command payload contains non-finite number");
        assertThatThrownBy(() -> PlainDataPayloads.copyOf(Float.POSITIVE_INFINITY))
            .hasMessage("Command payload contains non-finite number");
        assertThatThrownBy(() -> PlainDataPayloads.copyOf(intKey))
            .hasMessageContaining("non-string key");
        assertThatThrownBy(() -> PlainDataPayloads.copyOf(Instant.EPOCH))
            .hasMessageContaining("unsupported type: java.time.Instant");
        assertThat(PlainDataPayloads.isPlainData(new int[] {1})).isFalse();
    }

    @Test
    @DisplayName("null과 스칼라는 그대로 반환")
    void copyOf_scalars_returnedAsIs() {
        assertThat(PlainDataPayloads.copyOf(null)).isNull();
        assertThat(PlainDataPayloads.copyOf("text")).isEqualTo("text");
        assertThat(PlainDataPayloads.copyOf(42L)).isEqualTo(42L);
        assertThat(PlainDataPayloads.copyOf(false)).isEqualTo(false);
    }

    @Test
    @DisplayName("copyOfMap은 String 키 Map을 타입 그대로 복사")
    void copyOfMap_stringKeys_typedCopy() {
        // given
        Map<String, Object> source = new HashMap<>();
        source.put("code", "LOCKED");

        // when
        Map<String, Object> copy = PlainDataPayloads.copyOfMap(source);
        source.put("later", 1);

        // then
        assertThat(copy).containsExactly(Map.entry("code", "LOCKED"));
        assertThatThrownBy(() -> PlainDataPayloads.copyOfMap(Map.of("bad", new Object())))
            .hasMessageContaining("unsupported type");
    }
}
