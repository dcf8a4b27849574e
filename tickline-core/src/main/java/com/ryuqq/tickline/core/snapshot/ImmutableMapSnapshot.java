package com.ryuqq.tickline.core.snapshot;

import java.util.AbstractMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 깊은 읽기 전용 Map snapshot.
 *
 * <p>키와 값 모두 snapshot이며 원본의 삽입 순서를 유지합니다.</p>
 *
 * <p><strong>변경 연산:</strong></p>
 * <ul>
 *   <li>put, remove, clear, compute*, merge, replace*: 항상 {@link SnapshotMutationException}</li>
 *   <li>keySet/values/entrySet 뷰의 삭제 연산: 항상 {@link SnapshotMutationException}</li>
 *   <li>entry의 setValue: 항상 {@link SnapshotMutationException}</li>
 * </ul>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Tickline Team
 * @since 1.0.0
 */
public final class ImmutableMapSnapshot<K, V> extends AbstractMap<K, V> implements ImmutableSnapshot {

    private static final String TARGET = "map";

    private final LinkedHashMap<K, V> entries;
    private final Set<K> keyView;
    private final Collection<V> valueView;
    private final Set<Map.Entry<K, V>> entryView;

    ImmutableMapSnapshot(LinkedHashMap<K, V> entries) {
        this.entries = entries;
        this.keyView = ReadOnlyViews.set(entries.keySet(), TARGET);
        this.valueView = ReadOnlyViews.collection(entries.values(), TARGET);
        this.entryView = ReadOnlyViews.set(
            entries.entrySet(),
            e -> ReadOnlyViews.entry(e.getKey(), e.getValue(), TARGET),
            TARGET
        );
    }

    /**
     * 엔트리 방문자.
     *
     * @param <K> 키 타입
     * @param <V> 값 타입
     */
    @FunctionalInterface
    public interface EntryVisitor<K, V> {
        void visit(V value, K key, ImmutableMapSnapshot<K, V> map);
    }

    /**
     * 모든 엔트리를 삽입 순서대로 방문.
     *
     * <p>세 번째 인자는 내부 저장소가 아닌 이 snapshot 자신입니다.</p>
     *
     * @param visitor 방문자
     */
    public void forEachEntry(EntryVisitor<K, V> visitor) {
        for (Map.Entry<K, V> entry : entries.entrySet()) {
            visitor.visit(entry.getValue(), entry.getKey(), this);
        }
    }

    @Override
    public V get(Object key) {
        return entries.get(key);
    }

    @Override
    public V getOrDefault(Object key, V defaultValue) {
        return entries.getOrDefault(key, defaultValue);
    }

    @Override
    public boolean containsKey(Object key) {
        return entries.containsKey(key);
    }

    @Override
    public boolean containsValue(Object value) {
        return entries.containsValue(value);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Set<K> keySet() {
        return keyView;
    }

    @Override
    public Collection<V> values() {
        return valueView;
    }

    @Override
    public Set<Map.Entry<K, V>> entrySet() {
        return entryView;
    }

    @Override
    public SnapshotKind kind() {
        return SnapshotKind.MAP;
    }

    @Override
    public ImmutableMapSnapshot<K, V> unwrap() {
        return this;
    }

    @Override
    public V put(K key, V value) {
        throw new SnapshotMutationException(TARGET, "put");
    }

    @Override
    public void putAll(Map<? extends K, ? extends V> m) {
        throw new SnapshotMutationException(TARGET, "putAll");
    }

    @Override
    public V putIfAbsent(K key, V value) {
        throw new SnapshotMutationException(TARGET, "putIfAbsent");
    }

    @Override
    public V remove(Object key) {
        throw new SnapshotMutationException(TARGET, "remove");
    }

    @Override
    public boolean remove(Object key, Object value) {
        throw new SnapshotMutationException(TARGET, "remove");
    }

    @Override
    public V replace(K key, V value) {
        throw new SnapshotMutationException(TARGET, "replace");
    }

    @Override
    public boolean replace(K key, V oldValue, V newValue) {
        throw new SnapshotMutationException(TARGET, "replace");
    }

    @Override
    public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
        throw new SnapshotMutationException(TARGET, "replaceAll");
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        throw new SnapshotMutationException(TARGET, "computeIfAbsent");
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        throw new SnapshotMutationException(TARGET, "computeIfPresent");
    }

    @Override
    public V compute(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        throw new SnapshotMutationException(TARGET, "compute");
    }

    @Override
    public V merge(K key, V value, BiFunction<? super V, ? super V, ? extends V> remappingFunction) {
        throw new SnapshotMutationException(TARGET, "merge");
    }

    @Override
    public void clear() {
        throw new SnapshotMutationException(TARGET, "clear");
    }
}
