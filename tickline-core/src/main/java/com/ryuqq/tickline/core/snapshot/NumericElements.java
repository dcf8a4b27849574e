package com.ryuqq.tickline.core.snapshot;

import java.nio.ByteBuffer;

/**
 * 숫자 buffer snapshot이 소유하는 primitive 배열.
 *
 * <p>요소 타입마다 하나의 구현이 있으며, 배열은 생성 이후 외부로 노출되지 않습니다.
 * 새 배열을 만드는 연산은 항상 호출자 소유의 사본을 반환합니다.</p>
 *
 * @param <A> primitive 배열 타입
 * @author Tickline Team
 * @since 1.0.0
 */
abstract sealed class NumericElements<A> {

    abstract NumericElementType type();

    abstract int size();

    abstract Number get(int index);

    abstract void write(ByteBuffer target, int index);

    /**
     * [from, to) 범위를 복사한 새 배열.
     */
    abstract A copyRange(int from, int to);

    /**
     * 앞에서부터 count개의 값을 요소 타입으로 좁혀 담은 새 배열.
     */
    abstract A narrow(Number[] values, int count);

    static final class Int16 extends NumericElements<short[]> {

        private final short[] values;

        Int16(short[] owned) {
            this.values = owned;
        }

        @Override
        NumericElementType type() {
            return NumericElementType.INT16;
        }

        @Override
        int size() {
            return values.length;
        }

        @Override
        Number get(int index) {
            return values[index];
        }

        @Override
        void write(ByteBuffer target, int index) {
            target.putShort(values[index]);
        }

        @Override
        short[] copyRange(int from, int to) {
            short[] copy = new short[to - from];
            System.arraycopy(values, from, copy, 0, copy.length);
            return copy;
        }

        @Override
        short[] narrow(Number[] source, int count) {
            short[] result = new short[count];
            for (int i = 0; i < count; i++) {
                result[i] = source[i].shortValue();
            }
            return result;
        }
    }

    static final class Int32 extends NumericElements<int[]> {

        private final int[] values;

        Int32(int[] owned) {
            this.values = owned;
        }

        @Override
        NumericElementType type() {
            return NumericElementType.INT32;
        }

        @Override
        int size() {
            return values.length;
        }

        @Override
        Number get(int index) {
            return values[index];
        }

        @Override
        void write(ByteBuffer target, int index) {
            target.putInt(values[index]);
        }

        @Override
        int[] copyRange(int from, int to) {
            int[] copy = new int[to - from];
            System.arraycopy(values, from, copy, 0, copy.length);
            return copy;
        }

        @Override
        int[] narrow(Number[] source, int count) {
            int[] result = new int[count];
            for (int i = 0; i < count; i++) {
                result[i] = source[i].intValue();
            }
            return result;
        }
    }

    static final class Int64 extends NumericElements<long[]> {

        private final long[] values;

        Int64(long[] owned) {
            this.values = owned;
        }

        @Override
        NumericElementType type() {
            return NumericElementType.INT64;
        }

        @Override
        int size() {
            return values.length;
        }

        @Override
        Number get(int index) {
            return values[index];
        }

        @Override
        void write(ByteBuffer target, int index) {
            target.putLong(values[index]);
        }

        @Override
        long[] copyRange(int from, int to) {
            long[] copy = new long[to - from];
            System.arraycopy(values, from, copy, 0, copy.length);
            return copy;
        }

        @Override
        long[] narrow(Number[] source, int count) {
            long[] result = new long[count];
            for (int i = 0; i < count; i++) {
                result[i] = source[i].longValue();
            }
            return result;
        }
    }

    static final class Float32 extends NumericElements<float[]> {

        private final float[] values;

        Float32(float[] owned) {
            this.values = owned;
        }

        @Override
        NumericElementType type() {
            return NumericElementType.FLOAT32;
        }

        @Override
        int size() {
            return values.length;
        }

        @Override
        Number get(int index) {
            return values[index];
        }

        @Override
        void write(ByteBuffer target, int index) {
            target.putFloat(values[index]);
        }

        @Override
        float[] copyRange(int from, int to) {
            float[] copy = new float[to - from];
            System.arraycopy(values, from, copy, 0, copy.length);
            return copy;
        }

        @Override
        float[] narrow(Number[] source, int count) {
            float[] result = new float[count];
            for (int i = 0; i < count; i++) {
                result[i] = source[i].floatValue();
            }
            return result;
        }
    }

    static final class Float64 extends NumericElements<double[]> {

        private final double[] values;

        Float64(double[] owned) {
            this.values = owned;
        }

        @Override
        NumericElementType type() {
            return NumericElementType.FLOAT64;
        }

        @Override
        int size() {
            return values.length;
        }

        @Override
        Number get(int index) {
            return values[index];
        }

        @Override
        void write(ByteBuffer target, int index) {
            target.putDouble(values[index]);
        }

        @Override
        double[] copyRange(int from, int to) {
            double[] copy = new double[to - from];
            System.arraycopy(values, from, copy, 0, copy.length);
            return copy;
        }

        @Override
        double[] narrow(Number[] source, int count) {
            double[] result = new double[count];
            for (int i = 0; i < count; i++) {
                result[i] = source[i].doubleValue();
            }
            return result;
        }
    }
}
