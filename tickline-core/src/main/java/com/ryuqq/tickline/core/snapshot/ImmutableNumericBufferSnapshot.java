package com.ryuqq.tickline.core.snapshot;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * 숫자 배열(typed array)의 읽기 전용 facade.
 *
 * <p>원본 요소는 생성 시점에 비공개 primitive 배열로 복사됩니다.
 * 쓰기 메서드는 존재하지 않으며, 새 배열을 만드는 {@link #map}, {@link #filter},
 * {@link #slice}, {@link #toArray()}는 항상 호출자 소유의 새 primitive 배열을 반환합니다.</p>
 *
 * <p><strong>콜백 규칙:</strong></p>
 * <ul>
 *   <li>모든 방문 콜백은 세 번째 인자로 이 facade 자신을 받습니다.</li>
 *   <li>{@link #subarray}는 같은 비공개 배열을 공유하는 또 다른 facade입니다.</li>
 * </ul>
 *
 * <p>{@link #buffer()}는 전체 요소를 {@link #order()} 바이트 순서로 인코딩한
 * 바이너리 snapshot을 반환하며, 같은 facade에서는 항상 같은 인스턴스입니다.</p>
 *
 * @param <A> primitive 배열 타입 (short[], int[], long[], float[], double[])
 * @author Tickline Team
 * @since 1.0.0
 */
public final class ImmutableNumericBufferSnapshot<A> implements ImmutableSnapshot, Iterable<Number> {

    private static final String TARGET = "numeric buffer";

    private final NumericElementType elementType;
    private final NumericElements<A> elements;
    private final int offset;
    private final int length;
    private final ByteOrder order;
    private final boolean shared;
    private final BufferCache cache;

    private ImmutableNumericBufferSnapshot(
        NumericElements<A> elements,
        int offset,
        int length,
        ByteOrder order,
        boolean shared,
        BufferCache cache
    ) {
        this.elementType = elements.type();
        this.elements = elements;
        this.offset = offset;
        this.length = length;
        this.order = order;
        this.shared = shared;
        this.cache = cache;
    }

    @FunctionalInterface
    public interface ElementVisitor<A> {
        void visit(Number value, int index, ImmutableNumericBufferSnapshot<A> array);
    }

    @FunctionalInterface
    public interface ElementMapper<A> {
        Number apply(Number value, int index, ImmutableNumericBufferSnapshot<A> array);
    }

    @FunctionalInterface
    public interface ElementPredicate<A> {
        boolean test(Number value, int index, ImmutableNumericBufferSnapshot<A> array);
    }

    @FunctionalInterface
    public interface ElementReducer<R, A> {
        R apply(R accumulator, Number value, int index, ImmutableNumericBufferSnapshot<A> array);
    }

    public static ImmutableNumericBufferSnapshot<short[]> of(short[] values) {
        return fromArray(new NumericElements.Int16(requireSource(values).clone()));
    }

    public static ImmutableNumericBufferSnapshot<int[]> of(int[] values) {
        return fromArray(new NumericElements.Int32(requireSource(values).clone()));
    }

    public static ImmutableNumericBufferSnapshot<long[]> of(long[] values) {
        return fromArray(new NumericElements.Int64(requireSource(values).clone()));
    }

    public static ImmutableNumericBufferSnapshot<float[]> of(float[] values) {
        return fromArray(new NumericElements.Float32(requireSource(values).clone()));
    }

    public static ImmutableNumericBufferSnapshot<double[]> of(double[] values) {
        return fromArray(new NumericElements.Float64(requireSource(values).clone()));
    }

    /**
     * primitive 숫자 배열 또는 NIO 숫자 buffer로부터 snapshot 생성.
     *
     * <p>NIO buffer는 position부터 limit까지의 요소를 복사하고 원본 position은 건드리지 않습니다.
     * 바이트 순서와 direct 여부는 원본 buffer를 따릅니다.</p>
     *
     * @param source 숫자 배열 또는 buffer
     * @return snapshot
     * @throws UnsupportedPayloadException 숫자 배열/buffer가 아닌 경우
     */
    public static ImmutableNumericBufferSnapshot<?> copyOf(Object source) {
        requireSource(source);
        if (source instanceof short[] values) {
            return of(values);
        }
        if (source instanceof int[] values) {
            return of(values);
        }
        if (source instanceof long[] values) {
            return of(values);
        }
        if (source instanceof float[] values) {
            return of(values);
        }
        if (source instanceof double[] values) {
            return of(values);
        }
        if (source instanceof ShortBuffer buffer) {
            short[] copy = new short[buffer.remaining()];
            buffer.duplicate().get(copy);
            return fromBuffer(new NumericElements.Int16(copy), buffer.order(), buffer.isDirect());
        }
        if (source instanceof IntBuffer buffer) {
            int[] copy = new int[buffer.remaining()];
            buffer.duplicate().get(copy);
            return fromBuffer(new NumericElements.Int32(copy), buffer.order(), buffer.isDirect());
        }
        if (source instanceof LongBuffer buffer) {
            long[] copy = new long[buffer.remaining()];
            buffer.duplicate().get(copy);
            return fromBuffer(new NumericElements.Int64(copy), buffer.order(), buffer.isDirect());
        }
        if (source instanceof FloatBuffer buffer) {
            float[] copy = new float[buffer.remaining()];
            buffer.duplicate().get(copy);
            return fromBuffer(new NumericElements.Float32(copy), buffer.order(), buffer.isDirect());
        }
        if (source instanceof DoubleBuffer buffer) {
            double[] copy = new double[buffer.remaining()];
            buffer.duplicate().get(copy);
            return fromBuffer(new NumericElements.Float64(copy), buffer.order(), buffer.isDirect());
        }
        throw UnsupportedPayloadException.unsupportedType(source);
    }

    private static <T> T requireSource(T source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return source;
    }

    private static <A> ImmutableNumericBufferSnapshot<A> fromArray(NumericElements<A> owned) {
        return fromBuffer(owned, ByteOrder.BIG_ENDIAN, false);
    }

    private static <A> ImmutableNumericBufferSnapshot<A> fromBuffer(
        NumericElements<A> owned,
        ByteOrder order,
        boolean shared
    ) {
        return new ImmutableNumericBufferSnapshot<>(
            owned, 0, owned.size(), order, shared, new BufferCache()
        );
    }

    public NumericElementType elementType() {
        return elementType;
    }

    public int length() {
        return length;
    }

    public ByteOrder order() {
        return order;
    }

    /**
     * 요소 조회.
     *
     * @param index 0 이상 length 미만
     * @return boxed 값 (Short, Integer, Long, Float, Double)
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public Number get(int index) {
        SliceBounds.checkIndex(index, length);
        return element(index);
    }

    public long getAsLong(int index) {
        return get(index).longValue();
    }

    public double getAsDouble(int index) {
        return get(index).doubleValue();
    }

    public int indexOf(Number value) {
        if (value == null) {
            return -1;
        }
        for (int i = 0; i < length; i++) {
            if (elementType.sameValue(element(i), value)) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(Number value) {
        return indexOf(value) >= 0;
    }

    public void forEachElement(ElementVisitor<A> visitor) {
        for (int i = 0; i < length; i++) {
            visitor.visit(element(i), i, this);
        }
    }

    public boolean some(ElementPredicate<A> predicate) {
        for (int i = 0; i < length; i++) {
            if (predicate.test(element(i), i, this)) {
                return true;
            }
        }
        return false;
    }

    public boolean every(ElementPredicate<A> predicate) {
        for (int i = 0; i < length; i++) {
            if (!predicate.test(element(i), i, this)) {
                return false;
            }
        }
        return true;
    }

    public <R> R reduce(R identity, ElementReducer<R, A> reducer) {
        R accumulator = identity;
        for (int i = 0; i < length; i++) {
            accumulator = reducer.apply(accumulator, element(i), i, this);
        }
        return accumulator;
    }

    /**
     * 각 요소를 변환한 새 primitive 배열. 결과 값은 요소 타입으로 좁혀집니다.
     *
     * @param mapper 변환 함수
     * @return 호출자 소유의 새 배열
     */
    public A map(ElementMapper<A> mapper) {
        Number[] mapped = new Number[length];
        for (int i = 0; i < length; i++) {
            mapped[i] = Objects.requireNonNull(mapper.apply(element(i), i, this), "mapped value");
        }
        return elements.narrow(mapped, length);
    }

    public A filter(ElementPredicate<A> predicate) {
        Number[] matched = new Number[length];
        int count = 0;
        for (int i = 0; i < length; i++) {
            Number value = element(i);
            if (predicate.test(value, i, this)) {
                matched[count++] = value;
            }
        }
        return elements.narrow(matched, count);
    }

    /**
     * [begin, end) 범위의 새 primitive 배열. 음수 인덱스는 끝에서부터 계산합니다.
     */
    public A slice(int begin, int end) {
        int from = SliceBounds.resolve(begin, length);
        int to = Math.max(SliceBounds.resolve(end, length), from);
        return elements.copyRange(offset + from, offset + to);
    }

    public A slice(int begin) {
        return slice(begin, length);
    }

    /**
     * [begin, end) 범위를 가리키는 또 다른 facade. 비공개 배열을 공유하며 복사하지 않습니다.
     */
    public ImmutableNumericBufferSnapshot<A> subarray(int begin, int end) {
        int from = SliceBounds.resolve(begin, length);
        int to = Math.max(SliceBounds.resolve(end, length), from);
        return new ImmutableNumericBufferSnapshot<>(
            elements, offset + from, to - from, order, shared, cache
        );
    }

    public A toArray() {
        return slice(0, length);
    }

    /**
     * 요소 전체를 인코딩한 바이너리 snapshot.
     *
     * <p>subarray는 부모와 같은 buffer를 공유하며, 이 facade의 범위는
     * {@link #byteOffset()}과 {@link #byteLength()}로 나타냅니다.
     * direct buffer에서 만들어진 경우 {@link ImmutableSharedBufferSnapshot}입니다.</p>
     *
     * @return 캐시된 바이너리 snapshot
     */
    public ImmutableBinarySnapshot buffer() {
        return cache.get(this);
    }

    public int byteOffset() {
        return offset * elementType.getBytesPerElement();
    }

    public int byteLength() {
        return length * elementType.getBytesPerElement();
    }

    @Override
    public Iterator<Number> iterator() {
        return new Iterator<>() {
            private int cursor;

            @Override
            public boolean hasNext() {
                return cursor < length;
            }

            @Override
            public Number next() {
                if (cursor >= length) {
                    throw new NoSuchElementException();
                }
                return element(cursor++);
            }

            @Override
            public void remove() {
                throw new SnapshotMutationException(TARGET, "iterator.remove");
            }
        };
    }

    @Override
    public SnapshotKind kind() {
        return SnapshotKind.NUMERIC_BUFFER;
    }

    @Override
    public ImmutableNumericBufferSnapshot<A> unwrap() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImmutableNumericBufferSnapshot<?> other)) {
            return false;
        }
        if (elementType != other.elementType || length != other.length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (!element(i).equals(other.element(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = elementType.hashCode();
        for (int i = 0; i < length; i++) {
            result = 31 * result + element(i).hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        return "ImmutableNumericBufferSnapshot[" + elementType + ", length=" + length + "]";
    }

    private Number element(int index) {
        return elements.get(offset + index);
    }

    private ImmutableBinarySnapshot encodeAll() {
        int total = elements.size();
        ByteBuffer target = ByteBuffer.allocate(total * elementType.getBytesPerElement()).order(order);
        for (int i = 0; i < total; i++) {
            elements.write(target, i);
        }
        byte[] encoded = target.array();
        return shared
            ? ImmutableSharedBufferSnapshot.adopt(encoded)
            : ImmutableByteBufferSnapshot.adopt(encoded);
    }

    private static final class BufferCache {

        private volatile ImmutableBinarySnapshot encoded;

        ImmutableBinarySnapshot get(ImmutableNumericBufferSnapshot<?> owner) {
            ImmutableBinarySnapshot current = encoded;
            if (current == null) {
                synchronized (this) {
                    current = encoded;
                    if (current == null) {
                        current = owner.encodeAll();
                        encoded = current;
                    }
                }
            }
            return current;
        }
    }
}
