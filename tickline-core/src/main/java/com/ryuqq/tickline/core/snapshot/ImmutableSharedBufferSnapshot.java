package com.ryuqq.tickline.core.snapshot;

import java.nio.ByteBuffer;

/**
 * direct(공유 가능) ByteBuffer의 snapshot.
 *
 * <p>다른 스레드나 native 코드가 원본을 계속 수정할 수 있으므로 바이트는
 * 생성 시점에 heap으로 복사됩니다. {@link #toSharedBuffer()}는 새 direct buffer 사본을 돌려줍니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class ImmutableSharedBufferSnapshot extends ImmutableBinarySnapshot {

    public static final String TYPE_TAG = "SharedByteBuffer";

    private ImmutableSharedBufferSnapshot(byte[] bytes) {
        super(bytes);
    }

    public static ImmutableSharedBufferSnapshot copyOf(ByteBuffer source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new ImmutableSharedBufferSnapshot(remainingBytes(source));
    }

    static ImmutableSharedBufferSnapshot adopt(byte[] owned) {
        return new ImmutableSharedBufferSnapshot(owned);
    }

    /**
     * 새 direct ByteBuffer 사본.
     *
     * @return position 0, limit = byteLength인 direct buffer
     */
    public ByteBuffer toSharedBuffer() {
        byte[] copy = toByteArray();
        ByteBuffer shared = ByteBuffer.allocateDirect(copy.length);
        shared.put(copy);
        shared.flip();
        return shared;
    }

    @Override
    public String typeTag() {
        return TYPE_TAG;
    }

    @Override
    public SnapshotKind kind() {
        return SnapshotKind.SHARED_BUFFER;
    }

    @Override
    public ImmutableSharedBufferSnapshot slice(int begin) {
        return (ImmutableSharedBufferSnapshot) super.slice(begin);
    }

    @Override
    public ImmutableSharedBufferSnapshot slice(int begin, int end) {
        return (ImmutableSharedBufferSnapshot) super.slice(begin, end);
    }

    @Override
    public ImmutableSharedBufferSnapshot slice(double begin) {
        return (ImmutableSharedBufferSnapshot) super.slice(begin);
    }

    @Override
    public ImmutableSharedBufferSnapshot slice(double begin, double end) {
        return (ImmutableSharedBufferSnapshot) super.slice(begin, end);
    }

    @Override
    ImmutableBinarySnapshot newInstance(byte[] slice) {
        return new ImmutableSharedBufferSnapshot(slice);
    }
}
