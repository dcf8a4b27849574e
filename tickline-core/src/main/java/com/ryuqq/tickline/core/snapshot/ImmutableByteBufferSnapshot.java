package com.ryuqq.tickline.core.snapshot;

import java.nio.ByteBuffer;

/**
 * byte[] 또는 heap ByteBuffer의 snapshot.
 *
 * <p>ByteBuffer는 position부터 limit까지의 바이트를 복사하며 원본의 position은 변경하지 않습니다.</p>
 *
 * @author Tickline Team
 * @since 1.0.0
 */
public final class ImmutableByteBufferSnapshot extends ImmutableBinarySnapshot {

    public static final String TYPE_TAG = "ByteBuffer";

    private ImmutableByteBufferSnapshot(byte[] bytes) {
        super(bytes);
    }

    public static ImmutableByteBufferSnapshot copyOf(byte[] source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new ImmutableByteBufferSnapshot(source.clone());
    }

    public static ImmutableByteBufferSnapshot copyOf(ByteBuffer source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new ImmutableByteBufferSnapshot(remainingBytes(source));
    }

    static ImmutableByteBufferSnapshot adopt(byte[] owned) {
        return new ImmutableByteBufferSnapshot(owned);
    }

    @Override
    public String typeTag() {
        return TYPE_TAG;
    }

    @Override
    public SnapshotKind kind() {
        return SnapshotKind.BUFFER;
    }

    @Override
    public ImmutableByteBufferSnapshot slice(int begin) {
        return (ImmutableByteBufferSnapshot) super.slice(begin);
    }

    @Override
    public ImmutableByteBufferSnapshot slice(int begin, int end) {
        return (ImmutableByteBufferSnapshot) super.slice(begin, end);
    }

    @Override
    public ImmutableByteBufferSnapshot slice(double begin) {
        return (ImmutableByteBufferSnapshot) super.slice(begin);
    }

    @Override
    public ImmutableByteBufferSnapshot slice(double begin, double end) {
        return (ImmutableByteBufferSnapshot) super.slice(begin, end);
    }

    @Override
    ImmutableBinarySnapshot newInstance(byte[] slice) {
        return new ImmutableByteBufferSnapshot(slice);
    }
}
