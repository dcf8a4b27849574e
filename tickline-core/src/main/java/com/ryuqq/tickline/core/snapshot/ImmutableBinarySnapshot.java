package com.ryuqq.tickline.core.snapshot;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 바이너리 buffer의 읽기 전용 facade.
 *
 * <p>원본 바이트는 생성 시점에 비공개 배열로 복사되며 외부로 노출되지 않습니다.
 * 쓰기 메서드는 존재하지 않으므로 변경 시도는 컴파일 단계에서 거부됩니다.</p>
 *
 * <p><strong>명시적 복사 경로:</strong></p>
 * <ul>
 *   <li>{@link #toByteArray()}: 새 byte[] 사본</li>
 *   <li>{@link #toByteBuffer()}: 새 heap ByteBuffer 사본</li>
 *   <li>{@link #asReadOnlyByteBuffer()}: 복사 없는 read-only 뷰</li>
 * </ul>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public abstract sealed class ImmutableBinarySnapshot implements ImmutableSnapshot
    permits ImmutableByteBufferSnapshot, ImmutableSharedBufferSnapshot {

    private final byte[] bytes;

    ImmutableBinarySnapshot(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * 원본 buffer 종류를 나타내는 태그.
     *
     * @return 타입 태그
     */
    public abstract String typeTag();

    abstract ImmutableBinarySnapshot newInstance(byte[] slice);

    public int byteLength() {
        return bytes.length;
    }

    public byte getByte(int index) {
        SliceBounds.checkIndex(index, bytes.length);
        return bytes[index];
    }

    public int getUnsignedByte(int index) {
        return Byte.toUnsignedInt(getByte(index));
    }

    /**
     * begin부터 끝까지의 사본.
     *
     * @param begin 시작 인덱스 (음수면 끝에서부터)
     * @return 같은 종류의 새 snapshot
     */
    public ImmutableBinarySnapshot slice(int begin) {
        return slice(begin, bytes.length);
    }

    /**
     * [begin, end) 범위의 사본.
     *
     * <p>음수 인덱스는 끝에서부터 계산하고 범위를 벗어난 값은 잘라냅니다.
     * end가 begin 이하이면 빈 snapshot을 반환합니다.</p>
     *
     * @param begin 시작 인덱스
     * @param end 끝 인덱스 (미포함)
     * @return 같은 종류의 새 snapshot
     */
    public ImmutableBinarySnapshot slice(int begin, int end) {
        return sliceResolved(begin, end);
    }

    /**
     * 실수 인덱스 slice. NaN은 0으로 취급합니다.
     */
    public ImmutableBinarySnapshot slice(double begin) {
        return sliceResolved(SliceBounds.truncate(begin), bytes.length);
    }

    public ImmutableBinarySnapshot slice(double begin, double end) {
        return sliceResolved(SliceBounds.truncate(begin), SliceBounds.truncate(end));
    }

    private ImmutableBinarySnapshot sliceResolved(long begin, long end) {
        int from = SliceBounds.resolve(begin, bytes.length);
        int to = SliceBounds.resolve(end, bytes.length);
        if (to <= from) {
            return newInstance(new byte[0]);
        }
        return newInstance(Arrays.copyOfRange(bytes, from, to));
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    public ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(bytes.clone());
    }

    public ByteBuffer asReadOnlyByteBuffer() {
        return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    }

    @Override
    public ImmutableBinarySnapshot unwrap() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(bytes, ((ImmutableBinarySnapshot) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[byteLength=" + bytes.length + "]";
    }

    static byte[] remainingBytes(ByteBuffer source) {
        ByteBuffer view = source.duplicate();
        byte[] copy = new byte[view.remaining()];
        view.get(copy);
        return copy;
    }
}
