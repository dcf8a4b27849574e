package com.ryuqq.tickline.core.snapshot;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Date;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ImmutableSnapshots 테스트.
 *
 * <p>모든 변경 경로가 {@link SnapshotMutationException}으로 막히는지,
 * 원본과 snapshot이 서로 독립적인지 검증합니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
class ImmutableSnapshotsTest {

    enum Tier { BRONZE, GOLD }

    public record Upgrade(String id, List<String> tags) {
    }

    public record Plain(String id, int level, Tier tier) {
    }

    public record Blob(byte[] data) {
    }

    public record Holder(List<Object> children) {
    }

    record Hidden(List<String> tags) {
    }

    @SuppressWarnings("unchecked")
    private static <T> T snapshot(Object value) {
        return (T) ImmutableSnapshots.snapshot(value);
    }

    private static Map<String, Object> nestedPayload() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("count", 1);
        inner.put("tags", new ArrayList<>(List.of("a", "b")));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("generatorId", "gen-1");
        payload.put("inner", inner);
        payload.put("ids", new LinkedHashSet<>(List.of(1, 2, 3)));
        return payload;
    }

    // ============================================================
    // 값 종류별 변환
    // ============================================================

    @Test
    void snapshot_불변_값은_그대로_반환() {
        UUID id = UUID.randomUUID();
        Instant now = Instant.now();

        assertThat((Object) snapshot(null)).isNull();
        assertThat((Object) snapshot("text")).isSameAs("text");
        assertThat((Object) snapshot(id)).isSameAs(id);
        assertThat((Object) snapshot(now)).isSameAs(now);
        assertThat((Object) snapshot(Tier.GOLD)).isSameAs(Tier.GOLD);
    }

    @Test
    void snapshot_Pattern은_그대로_반환() {
        Pattern pattern = Pattern.compile("gen-\\d+");

        assertThat((Object) snapshot(pattern)).isSameAs(pattern);
    }

    @Test
    void snapshot_이미_snapshot인_값은_그대로_반환() {
        Map<String, Object> first = snapshot(nestedPayload());

        assertThat((Object) snapshot(first)).isSameAs(first);
    }

    @Test
    void snapshot_타입은_이_패키지의_구현으로_닫혀_있음() {
        assertThat(ImmutableSnapshot.class.isSealed()).isTrue();
        assertThat(ImmutableSnapshot.class.getPermittedSubclasses()).containsExactlyInAnyOrder(
            ImmutableListSnapshot.class,
            ImmutableMapSnapshot.class,
            ImmutableSetSnapshot.class,
            ImmutableBinarySnapshot.class,
            ImmutableNumericBufferSnapshot.class,
            ImmutableDateSnapshot.class
        );
    }

    @Test
    void snapshot_중첩된_snapshot도_원본과_독립() {
        // given
        List<String> items = new ArrayList<>(List.of("before"));
        Map<String, Object> payload = new HashMap<>();
        payload.put("x", items);
        Map<String, Object> first = snapshot(payload);

        // when
        Map<String, Object> second = snapshot(Map.of("x", first.get("x")));
        items.add("after-snapshot");

        // then
        assertThat(second.get("x")).isSameAs(first.get("x"));
        assertThat((List<Object>) second.get("x")).containsExactly("before");
    }

    @Test
    void snapshot_enum_상수는_참조_그대로_전달() {
        assertThat((Object) snapshot(Tier.GOLD)).isSameAs(Tier.GOLD);
    }

    @Test
    void snapshot_지원하지_않는_값은_UnsupportedPayloadException() {
        assertThatThrownBy(() -> ImmutableSnapshots.snapshot(new AtomicInteger(1)))
            .isInstanceOf(UnsupportedPayloadException.class)
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ImmutableSnapshots.snapshot(Pattern.compile("a").matcher("a")))
            .isInstanceOf(UnsupportedPayloadException.class);
        assertThatThrownBy(() -> ImmutableSnapshots.snapshot(Map.of("nested", new Object())))
            .isInstanceOf(UnsupportedPayloadException.class);
    }

    @Test
    void snapshot_배열은_List로_변환() {
        List<Object> objects = snapshot(new Object[] {"a", 1});
        List<Object> flags = snapshot(new boolean[] {true, false});
        List<Object> chars = snapshot(new char[] {'x'});

        assertThat(objects).isInstanceOf(ImmutableListSnapshot.class).containsExactly("a", 1);
        assertThat(flags).containsExactly(true, false);
        assertThat(chars).containsExactly('x');
    }

    @Test
    void snapshot_kind별_타입() {
        assertThat(SnapshotKind.of(new byte[0])).isEqualTo(SnapshotKind.BUFFER);
        assertThat(SnapshotKind.of(ByteBuffer.allocateDirect(1))).isEqualTo(SnapshotKind.SHARED_BUFFER);
        assertThat(SnapshotKind.of(new int[0])).isEqualTo(SnapshotKind.NUMERIC_BUFFER);
        assertThat(SnapshotKind.of(new Date())).isEqualTo(SnapshotKind.CALENDAR);
        assertThat(SnapshotKind.of(new Plain("p", 1, Tier.GOLD))).isEqualTo(SnapshotKind.RECORD);
        assertThat(SnapshotKind.of(new Object())).isEqualTo(SnapshotKind.UNSUPPORTED);
    }

    // ============================================================
    // Map / List / Set 변경 경로
    // ============================================================

    @Test
    void mapSnapshot_읽기는_원본과_동일() {
        // given
        Map<String, Object> payload = nestedPayload();

        // when
        Map<String, Object> copy = snapshot(payload);

        // then
        assertThat(copy).isEqualTo(payload);
        assertThat(copy.keySet()).containsExactly("generatorId", "inner", "ids");
        assertThat(copy.get("inner")).isInstanceOf(ImmutableMapSnapshot.class);
        assertThat(copy.get("ids")).isInstanceOf(ImmutableSetSnapshot.class);
    }

    @Test
    void mapSnapshot_모든_변경_연산은_예외() {
        Map<String, Object> copy = snapshot(nestedPayload());

        assertThatThrownBy(() -> copy.put("x", 1)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.remove("generatorId")).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.putAll(Map.of("x", 1))).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.compute("x", (k, v) -> 1)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.computeIfAbsent("x", k -> 1)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.merge("x", 1, (a, b) -> a)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.replaceAll((k, v) -> v)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(copy::clear).isInstanceOf(SnapshotMutationException.class);
    }

    @Test
    void mapSnapshot_뷰와_entry를_통한_변경도_예외() {
        Map<String, Object> copy = snapshot(nestedPayload());

        assertThatThrownBy(() -> copy.keySet().remove("inner")).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.values().clear()).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.entrySet().removeIf(e -> true)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.entrySet().iterator().next().setValue("x"))
            .isInstanceOf(SnapshotMutationException.class);

        Iterator<String> keys = copy.keySet().iterator();
        keys.next();
        assertThatThrownBy(keys::remove).isInstanceOf(SnapshotMutationException.class);
    }

    @Test
    void mapSnapshot_빈_컨테이너도_변경은_예외() {
        Map<String, Object> empty = snapshot(new HashMap<>());

        assertThatThrownBy(empty::clear).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> empty.remove("missing")).isInstanceOf(SnapshotMutationException.class);
    }

    @Test
    void 중첩_컨테이너를_꺼내도_변경은_예외() {
        Map<String, Object> copy = snapshot(nestedPayload());

        @SuppressWarnings("unchecked")
        Map<String, Object> inner = (Map<String, Object>) copy.get("inner");
        @SuppressWarnings("unchecked")
        List<String> tags = (List<String>) inner.get("tags");
        @SuppressWarnings("unchecked")
        Set<Integer> ids = (Set<Integer>) copy.get("ids");

        assertThatThrownBy(() -> inner.put("count", 2)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> tags.add("c")).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> ids.add(4)).isInstanceOf(SnapshotMutationException.class);
    }

    @Test
    void 순회_콜백은_wrapper_자신을_전달하고_그_안에서도_변경은_예외() {
        // given
        ImmutableMapSnapshot<String, Object> copy = snapshot(nestedPayload());
        List<Object> containers = new ArrayList<>();

        // when
        copy.forEachEntry((value, key, map) -> containers.add(map));

        // then
        assertThat(containers).hasSize(3).allSatisfy(container -> assertThat(container).isSameAs(copy));
        assertThatThrownBy(() -> copy.forEachEntry((value, key, map) -> map.put("x", 1)))
            .isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.forEach((key, value) -> copy.remove(key)))
            .isInstanceOf(SnapshotMutationException.class);
        assertThat(copy.unwrap()).isSameAs(copy);
    }

    @Test
    void listSnapshot_모든_변경_연산은_예외() {
        ImmutableListSnapshot<String> list = snapshot(new ArrayList<>(List.of("b", "a", "c")));

        assertThatThrownBy(() -> list.add("d")).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> list.set(0, "z")).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> list.remove(0)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> list.removeIf(s -> true)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> list.replaceAll(s -> s)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> list.sort(null)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> list.subList(0, 2).clear()).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> list.listIterator().set("z")).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> list.iterator().remove()).isInstanceOf(SnapshotMutationException.class);

        assertThat(list).containsExactly("b", "a", "c");
        assertThat(list.unwrap()).isSameAs(list);
    }

    @Test
    void listSnapshot_forEachIndexed는_wrapper를_전달() {
        ImmutableListSnapshot<String> list = snapshot(List.of("a", "b"));
        List<Integer> indexes = new ArrayList<>();

        list.forEachIndexed((value, index, owner) -> {
            assertThat(owner).isSameAs(list);
            indexes.add(index);
        });

        assertThat(indexes).containsExactly(0, 1);
    }

    @Test
    void setSnapshot_변경은_예외_순서는_유지() {
        ImmutableSetSnapshot<Integer> set = snapshot(new LinkedHashSet<>(List.of(3, 1, 2)));

        assertThat(set).containsExactly(3, 1, 2);
        assertThatThrownBy(() -> set.add(4)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> set.retainAll(List.of(1))).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(set::clear).isInstanceOf(SnapshotMutationException.class);
        set.forEachElement((value, owner) -> assertThat(owner).isSameAs(set));
    }

    // ============================================================
    // 원본과의 독립성
    // ============================================================

    @Test
    void 원본을_변경해도_snapshot은_영향_없음() {
        // given
        Map<String, Object> payload = nestedPayload();
        Map<String, Object> copy = snapshot(payload);

        // when
        payload.put("generatorId", "gen-2");
        @SuppressWarnings("unchecked")
        Map<String, Object> inner = (Map<String, Object>) payload.get("inner");
        @SuppressWarnings("unchecked")
        List<String> tags = (List<String>) inner.get("tags");
        tags.add("c");

        // then
        assertThat(copy.get("generatorId")).isEqualTo("gen-1");
        @SuppressWarnings("unchecked")
        Map<String, Object> innerCopy = (Map<String, Object>) copy.get("inner");
        assertThat(innerCopy).containsEntry("tags", List.of("a", "b"));
    }

    @Test
    void 공유_참조는_같은_snapshot으로_변환() {
        List<String> shared = new ArrayList<>(List.of("x"));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("first", shared);
        payload.put("second", shared);

        Map<String, Object> copy = snapshot(payload);

        assertThat(copy.get("first")).isSameAs(copy.get("second"));
    }

    @Test
    void List를_통한_순환_참조_지원() {
        List<Object> cyclic = new ArrayList<>();
        cyclic.add("head");
        cyclic.add(cyclic);

        List<Object> copy = snapshot(cyclic);

        assertThat(copy.get(0)).isEqualTo("head");
        assertThat(copy.get(1)).isSameAs(copy);
    }

    @Test
    void Map을_통한_순환_참조_지원() {
        Map<String, Object> cyclic = new LinkedHashMap<>();
        cyclic.put("self", cyclic);

        Map<String, Object> copy = snapshot(cyclic);

        assertThat(copy.get("self")).isSameAs(copy);
    }

    @Test
    void mapSnapshot_keySet_contains는_원본_키_조회와_일치() {
        // given
        Map<Object, Object> source = new LinkedHashMap<>();
        for (int i = 0; i < 1_000; i++) {
            source.put("key-" + i, i);
        }
        source.put(null, "null-key");

        // when
        Map<Object, Object> copy = snapshot(source);

        // then
        assertThat(copy.keySet().contains("key-999")).isTrue();
        assertThat(copy.keySet().contains(null)).isTrue();
        assertThat(copy.keySet().contains("missing")).isFalse();
        assertThat(copy.keySet().contains(999)).isFalse();
        assertThat(copy.entrySet().contains(Map.entry("key-1", 1))).isTrue();
    }

    // ============================================================
    // Record
    // ============================================================

    @Test
    void record_변경_가능한_구성요소는_snapshot으로_재구성() {
        // given
        List<String> tags = new ArrayList<>(List.of("speed"));
        Upgrade upgrade = new Upgrade("u-1", tags);

        // when
        Upgrade copy = snapshot(upgrade);
        tags.add("power");

        // then
        assertThat(copy).isNotSameAs(upgrade);
        assertThat(copy.id()).isEqualTo("u-1");
        assertThat(copy.tags()).isInstanceOf(ImmutableListSnapshot.class).containsExactly("speed");
        assertThatThrownBy(() -> copy.tags().add("x")).isInstanceOf(SnapshotMutationException.class);
    }

    @Test
    void record_불변_구성요소만_있으면_원본_반환() {
        Plain plain = new Plain("p-1", 3, Tier.BRONZE);

        assertThat((Object) snapshot(plain)).isSameAs(plain);
    }

    @Test
    void record_snapshot을_담을_수_없는_구성요소는_거부() {
        assertThatThrownBy(() -> ImmutableSnapshots.snapshot(new Blob(new byte[] {1})))
            .isInstanceOf(UnsupportedPayloadException.class)
            .hasMessageContaining("data");
    }

    @Test
    void record_public이_아닌_타입은_거부() {
        assertThatThrownBy(() -> ImmutableSnapshots.snapshot(new Hidden(new ArrayList<>(List.of("a")))))
            .isInstanceOf(UnsupportedPayloadException.class)
            .hasMessageContaining("must be public");
    }

    @Test
    void record를_통한_순환_참조는_거부() {
        List<Object> children = new ArrayList<>();
        Holder holder = new Holder(children);
        children.add(holder);

        assertThatThrownBy(() -> ImmutableSnapshots.snapshot(holder))
            .isInstanceOf(UnsupportedPayloadException.class)
            .hasMessageContaining("Circular reference");
    }

    // ============================================================
    // Calendar
    // ============================================================

    @Test
    void Date_snapshot은_읽기는_동일하고_setter는_예외() {
        // given
        Date original = new Date(1_000L);

        // when
        Date copy = snapshot(original);
        original.setTime(5_000L);

        // then
        assertThat(copy).isInstanceOf(ImmutableDateSnapshot.class);
        assertThat(copy.getTime()).isEqualTo(1_000L);
        assertThat(copy.toInstant()).isEqualTo(Instant.ofEpochMilli(1_000L));
        assertThatThrownBy(() -> copy.setTime(0L)).isInstanceOf(SnapshotMutationException.class);
    }

    @Test
    @SuppressWarnings("deprecation")
    void Date_snapshot_legacy_setter도_예외() {
        Date copy = snapshot(new Date(0L));

        assertThatThrownBy(() -> copy.setYear(99)).isInstanceOf(SnapshotMutationException.class);
        assertThatThrownBy(() -> copy.setHours(1)).isInstanceOf(SnapshotMutationException.class);
    }

    @Test
    void Date_clone은_변경_가능한_독립_사본() {
        Date copy = snapshot(new Date(1_000L));

        Date cloned = (Date) copy.clone();
        cloned.setTime(9_000L);

        assertThat(cloned).isNotInstanceOf(ImmutableDateSnapshot.class);
        assertThat(copy.getTime()).isEqualTo(1_000L);
    }

    @Test
    void Calendar는_ZonedDateTime으로_변환() {
        Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
        calendar.setTimeInMillis(0L);

        ZonedDateTime copy = snapshot(calendar);
        calendar.setTimeInMillis(10_000L);

        assertThat(copy.toInstant()).isEqualTo(Instant.EPOCH);
    }
}
