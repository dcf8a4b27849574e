package com.ryuqq.tickline.core.snapshot;

import java.util.AbstractCollection;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.ListIterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * snapshot 컨테이너가 노출하는 읽기 전용 뷰 모음.
 *
 * <p>뷰는 snapshot 내부 저장소를 감싸기만 하며, 모든 변경 연산은
 * 상태를 확인하기 전에 {@link SnapshotMutationException}을 던집니다.</p>
 */
final class ReadOnlyViews {

    private ReadOnlyViews() {
    }

    static <S, E> Iterator<E> iterator(Iterator<S> delegate, Function<S, E> mapper, String target) {
        return new ReadOnlyIterator<>(delegate, mapper, target);
    }

    static <E> Iterator<E> iterator(Iterator<E> delegate, String target) {
        return new ReadOnlyIterator<>(delegate, Function.identity(), target);
    }

    static <S, E> java.util.Set<E> set(Collection<S> backing, Function<S, E> mapper, String target) {
        return new ReadOnlySet<>(backing, mapper, null, target);
    }

    /**
     * 변환 없이 감싸는 set 뷰. contains는 backing set의 조회를 그대로 사용합니다.
     */
    static <E> java.util.Set<E> set(java.util.Set<E> backing, String target) {
        return new ReadOnlySet<>(backing, Function.identity(), backing::contains, target);
    }

    static <E> Collection<E> collection(Collection<E> backing, String target) {
        return new ReadOnlyCollection<>(backing, target);
    }

    static <K, V> Map.Entry<K, V> entry(K key, V value, String target) {
        return new ReadOnlyEntry<>(key, value, target);
    }

    static final class ReadOnlyIterator<S, E> implements Iterator<E> {

        private final Iterator<S> delegate;
        private final Function<S, E> mapper;
        private final String target;

        ReadOnlyIterator(Iterator<S> delegate, Function<S, E> mapper, String target) {
            this.delegate = delegate;
            this.mapper = mapper;
            this.target = target;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public E next() {
            return mapper.apply(delegate.next());
        }

        @Override
        public void remove() {
            throw new SnapshotMutationException(target, "iterator.remove");
        }
    }

    static final class ReadOnlyListIterator<E> implements ListIterator<E> {

        private final ListIterator<E> delegate;
        private final String target;

        ReadOnlyListIterator(ListIterator<E> delegate, String target) {
            this.delegate = delegate;
            this.target = target;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public E next() {
            return delegate.next();
        }

        @Override
        public boolean hasPrevious() {
            return delegate.hasPrevious();
        }

        @Override
        public E previous() {
            return delegate.previous();
        }

        @Override
        public int nextIndex() {
            return delegate.nextIndex();
        }

        @Override
        public int previousIndex() {
            return delegate.previousIndex();
        }

        @Override
        public void remove() {
            throw new SnapshotMutationException(target, "iterator.remove");
        }

        @Override
        public void set(E e) {
            throw new SnapshotMutationException(target, "iterator.set");
        }

        @Override
        public void add(E e) {
            throw new SnapshotMutationException(target, "iterator.add");
        }
    }

    static final class ReadOnlySet<S, E> extends AbstractSet<E> {

        private final Collection<S> backing;
        private final Function<S, E> mapper;
        private final Predicate<Object> membership;
        private final String target;

        ReadOnlySet(Collection<S> backing, Function<S, E> mapper, Predicate<Object> membership, String target) {
            this.backing = backing;
            this.mapper = mapper;
            this.membership = membership;
            this.target = target;
        }

        @Override
        public Iterator<E> iterator() {
            return new ReadOnlyIterator<>(backing.iterator(), mapper, target);
        }

        @Override
        public boolean contains(Object o) {
            return membership != null ? membership.test(o) : super.contains(o);
        }

        @Override
        public int size() {
            return backing.size();
        }

        @Override
        public boolean add(E e) {
            throw new SnapshotMutationException(target, "add");
        }

        @Override
        public boolean addAll(Collection<? extends E> c) {
            throw new SnapshotMutationException(target, "addAll");
        }

        @Override
        public boolean remove(Object o) {
            throw new SnapshotMutationException(target, "remove");
        }

        @Override
        public boolean removeAll(Collection<?> c) {
            throw new SnapshotMutationException(target, "removeAll");
        }

        @Override
        public boolean retainAll(Collection<?> c) {
            throw new SnapshotMutationException(target, "retainAll");
        }

        @Override
        public boolean removeIf(Predicate<? super E> filter) {
            throw new SnapshotMutationException(target, "removeIf");
        }

        @Override
        public void clear() {
            throw new SnapshotMutationException(target, "clear");
        }
    }

    static final class ReadOnlyCollection<E> extends AbstractCollection<E> {

        private final Collection<E> backing;
        private final String target;

        ReadOnlyCollection(Collection<E> backing, String target) {
            this.backing = backing;
            this.target = target;
        }

        @Override
        public Iterator<E> iterator() {
            return new ReadOnlyIterator<>(backing.iterator(), Function.identity(), target);
        }

        @Override
        public int size() {
            return backing.size();
        }

        @Override
        public boolean contains(Object o) {
            return backing.contains(o);
        }

        @Override
        public boolean add(E e) {
            throw new SnapshotMutationException(target, "add");
        }

        @Override
        public boolean addAll(Collection<? extends E> c) {
            throw new SnapshotMutationException(target, "addAll");
        }

        @Override
        public boolean remove(Object o) {
            throw new SnapshotMutationException(target, "remove");
        }

        @Override
        public boolean removeAll(Collection<?> c) {
            throw new SnapshotMutationException(target, "removeAll");
        }

        @Override
        public boolean retainAll(Collection<?> c) {
            throw new SnapshotMutationException(target, "retainAll");
        }

        @Override
        public boolean removeIf(Predicate<? super E> filter) {
            throw new SnapshotMutationException(target, "removeIf");
        }

        @Override
        public void clear() {
            throw new SnapshotMutationException(target, "clear");
        }
    }

    static final class ReadOnlyEntry<K, V> implements Map.Entry<K, V> {

        private final K key;
        private final V value;
        private final String target;

        ReadOnlyEntry(K key, V value, String target) {
            this.key = key;
            this.value = value;
            this.target = target;
        }

        @Override
        public K getKey() {
            return key;
        }

        @Override
        public V getValue() {
            return value;
        }

        @Override
        public V setValue(V value) {
            throw new SnapshotMutationException(target, "entry.setValue");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Map.Entry<?, ?> other)) {
                return false;
            }
            return Objects.equals(key, other.getKey()) && Objects.equals(value, other.getValue());
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(key) ^ Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return key + "=" + value;
        }
    }
}
