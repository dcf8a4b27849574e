package com.ryuqq.tickline.core.snapshot;

import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.function.Predicate;

/**
 * 깊은 읽기 전용 Set snapshot.
 *
 * <p>요소는 snapshot이며 원본의 순회 순서를 유지합니다.
 * add, remove, clear 등 변경 연산은 항상 {@link SnapshotMutationException}을 던집니다.</p>
 *
 * @param <E> 요소 타입
 * @author Tickline Team
 * @since 1.0.0
 */
public final class ImmutableSetSnapshot<E> extends AbstractSet<E> implements ImmutableSnapshot {

    private static final String TARGET = "set";

    private final LinkedHashSet<E> elements;

    ImmutableSetSnapshot(LinkedHashSet<E> elements) {
        this.elements = elements;
    }

    @FunctionalInterface
    public interface ElementVisitor<E> {
        void visit(E value, ImmutableSetSnapshot<E> set);
    }

    /**
     * 모든 요소 방문. 두 번째 인자는 이 snapshot 자신입니다.
     *
     * @param visitor 방문자
     */
    public void forEachElement(ElementVisitor<E> visitor) {
        for (E element : elements) {
            visitor.visit(element, this);
        }
    }

    @Override
    public boolean contains(Object o) {
        return elements.contains(o);
    }

    @Override
    public Iterator<E> iterator() {
        return ReadOnlyViews.iterator(elements.iterator(), TARGET);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public SnapshotKind kind() {
        return SnapshotKind.SET;
    }

    @Override
    public ImmutableSetSnapshot<E> unwrap() {
        return this;
    }

    @Override
    public boolean add(E e) {
        throw new SnapshotMutationException(TARGET, "add");
    }

    @Override
    public boolean addAll(Collection<? extends E> c) {
        throw new SnapshotMutationException(TARGET, "addAll");
    }

    @Override
    public boolean remove(Object o) {
        throw new SnapshotMutationException(TARGET, "remove");
    }

    @Override
    public boolean removeAll(Collection<?> c) {
        throw new SnapshotMutationException(TARGET, "removeAll");
    }

    @Override
    public boolean retainAll(Collection<?> c) {
        throw new SnapshotMutationException(TARGET, "retainAll");
    }

    @Override
    public boolean removeIf(Predicate<? super E> filter) {
        throw new SnapshotMutationException(TARGET, "removeIf");
    }

    @Override
    public void clear() {
        throw new SnapshotMutationException(TARGET, "clear");
    }
}
