package com.ryuqq.tickline.core.snapshot;

import java.util.AbstractList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.RandomAccess;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * 깊은 읽기 전용 List snapshot.
 *
 * <p>요소는 이미 snapshot이 된 값입니다. 원소 추가/삭제/교체/정렬 등
 * 모든 변경 연산은 조건 확인 없이 {@link SnapshotMutationException}을 던집니다.
 * iterator, listIterator, subList도 같은 규칙을 따릅니다.</p>
 *
 * @param <E> 요소 타입
 * @author Tickline Team
 * @since 1.0.0
 */
public final class ImmutableListSnapshot<E> extends AbstractList<E>
    implements RandomAccess, ImmutableSnapshot {

    private static final String TARGET = "list";

    private final List<E> elements;

    ImmutableListSnapshot(List<E> elements) {
        this.elements = elements;
    }

    /**
     * 인덱스를 함께 받는 방문자.
     *
     * @param <E> 요소 타입
     */
    @FunctionalInterface
    public interface ElementVisitor<E> {
        void visit(E value, int index, ImmutableListSnapshot<E> list);
    }

    /**
     * 모든 요소 방문.
     *
     * <p>세 번째 인자로 내부 저장소가 아닌 이 snapshot 자신이 전달됩니다.</p>
     *
     * @param visitor 방문자
     */
    public void forEachIndexed(ElementVisitor<E> visitor) {
        for (int i = 0; i < elements.size(); i++) {
            visitor.visit(elements.get(i), i, this);
        }
    }

    @Override
    public E get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public Iterator<E> iterator() {
        return ReadOnlyViews.iterator(elements.iterator(), TARGET);
    }

    @Override
    public ListIterator<E> listIterator() {
        return listIterator(0);
    }

    @Override
    public ListIterator<E> listIterator(int index) {
        return new ReadOnlyViews.ReadOnlyListIterator<>(elements.listIterator(index), TARGET);
    }

    @Override
    public List<E> subList(int fromIndex, int toIndex) {
        return new ImmutableListSnapshot<>(elements.subList(fromIndex, toIndex));
    }

    @Override
    public SnapshotKind kind() {
        return SnapshotKind.LIST;
    }

    @Override
    public ImmutableListSnapshot<E> unwrap() {
        return this;
    }

    @Override
    public boolean add(E e) {
        throw new SnapshotMutationException(TARGET, "add");
    }

    @Override
    public void add(int index, E element) {
        throw new SnapshotMutationException(TARGET, "add");
    }

    @Override
    public boolean addAll(Collection<? extends E> c) {
        throw new SnapshotMutationException(TARGET, "addAll");
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        throw new SnapshotMutationException(TARGET, "addAll");
    }

    @Override
    public E set(int index, E element) {
        throw new SnapshotMutationException(TARGET, "set");
    }

    @Override
    public E remove(int index) {
        throw new SnapshotMutationException(TARGET, "remove");
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
    public void replaceAll(UnaryOperator<E> operator) {
        throw new SnapshotMutationException(TARGET, "replaceAll");
    }

    @Override
    public void sort(Comparator<? super E> c) {
        throw new SnapshotMutationException(TARGET, "sort");
    }

    @Override
    public void clear() {
        throw new SnapshotMutationException(TARGET, "clear");
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        throw new SnapshotMutationException(TARGET, "removeRange");
    }
}
