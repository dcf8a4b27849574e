package com.ryuqq.tickline.core.snapshot;

/**
 * slice/subarray 인덱스 해석.
 *
 * <p>음수 인덱스는 끝에서부터 계산하고, 범위를 벗어난 값은 [0, length]로 잘라냅니다.
 * 실수 인덱스는 0 방향으로 절삭하며 NaN은 0으로 취급합니다.</p>
 */
final class SliceBounds {

    private SliceBounds() {
    }

    static int resolve(long index, int length) {
        if (index < 0) {
            return (int) Math.max(length + index, 0L);
        }
        return (int) Math.min(index, length);
    }

    static long truncate(double index) {
        if (Double.isNaN(index)) {
            return 0L;
        }
        if (index >= Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        if (index <= Long.MIN_VALUE) {
            return Long.MIN_VALUE;
        }
        return (long) index;
    }

    static void checkIndex(int index, int length) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length);
        }
    }
}
