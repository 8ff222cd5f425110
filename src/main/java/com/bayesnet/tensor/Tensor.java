package com.bayesnet.tensor;

import java.util.Arrays;

/**
 * Immutable dense tensor of doubles in row-major layout.
 *
 * A tensor of rank 0 is a scalar holding exactly one element. Probability
 * tables, joint distributions and marginals are all represented as tensors:
 * axis i of a node's table ranges over the states of the i-th variable in
 * its declared axis order.
 *
 * Layout:
 * - shape[i] is the extent of axis i.
 * - strides[i] is the distance in the flat data array between two elements
 * that differ by one along axis i. The last axis has stride 1.
 *
 * The flat array is never exposed to callers; toArray() returns a copy.
 */
public final class Tensor {
    private static final int[] SCALAR_SHAPE = new int[0];

    private final int[] shape;
    private final int[] strides;
    private final double[] data;

    private Tensor(int[] shape, double[] data) {
        this.shape = shape;
        this.strides = stridesOf(shape);
        this.data = data;
    }

    /** Creates a tensor of the given shape; data is copied. */
    public static Tensor of(int[] shape, double[] data) {
        int[] s = shape.clone();
        int size = 1;
        for (int d : s) {
            if (d <= 0)
                throw new IllegalArgumentException("Tensor dimensions must be positive: " + Arrays.toString(s));
            size = Math.multiplyExact(size, d);
        }
        if (size != data.length)
            throw new IllegalArgumentException(
                    "Shape " + Arrays.toString(s) + " needs " + size + " elements, got " + data.length);
        return new Tensor(s, data.clone());
    }

    /** Rank-1 tensor. */
    public static Tensor of(double... values) {
        return of(new int[] { values.length }, values);
    }

    /** Rank-2 tensor from a rectangular matrix. */
    public static Tensor of(double[][] values) {
        int rows = values.length;
        int cols = rows == 0 ? 0 : values[0].length;
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (values[r].length != cols)
                throw new IllegalArgumentException("Ragged matrix at row " + r);
            System.arraycopy(values[r], 0, flat, r * cols, cols);
        }
        return of(new int[] { rows, cols }, flat);
    }

    /** Rank-3 tensor from a rectangular cube. */
    public static Tensor of(double[][][] values) {
        int d0 = values.length;
        int d1 = d0 == 0 ? 0 : values[0].length;
        int d2 = d1 == 0 ? 0 : values[0][0].length;
        double[] flat = new double[d0 * d1 * d2];
        int pos = 0;
        for (int i = 0; i < d0; i++) {
            if (values[i].length != d1)
                throw new IllegalArgumentException("Ragged tensor at index " + i);
            for (int j = 0; j < d1; j++) {
                if (values[i][j].length != d2)
                    throw new IllegalArgumentException("Ragged tensor at index " + i + "," + j);
                System.arraycopy(values[i][j], 0, flat, pos, d2);
                pos += d2;
            }
        }
        return of(new int[] { d0, d1, d2 }, flat);
    }

    public static Tensor scalar(double value) {
        return new Tensor(SCALAR_SHAPE, new double[] { value });
    }

    // Takes ownership of data; callers in this package must not keep a reference.
    static Tensor wrap(int[] shape, double[] data) {
        return new Tensor(shape, data);
    }

    public int rank() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    /** Extent of the given axis. */
    public int dim(int axis) {
        return shape[axis];
    }

    /** Total number of elements. */
    public int size() {
        return data.length;
    }

    public double get(int... index) {
        return data[offset(index)];
    }

    public double sum() {
        double s = 0.0;
        for (double v : data)
            s += v;
        return s;
    }

    public Tensor divide(double divisor) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++)
            out[i] = data[i] / divisor;
        return new Tensor(shape, out);
    }

    /**
     * Scales the tensor so that its elements sum to one.
     *
     * @throws IllegalStateException if the total is zero, negative or not a
     *                               number. There is no meaningful
     *                               distribution to return in that case.
     */
    public Tensor normalize() {
        double total = sum();
        if (!(total > 0.0) || Double.isInfinite(total))
            throw new IllegalStateException("Cannot normalize tensor with total mass " + total);
        return divide(total);
    }

    /**
     * Fixes one axis to a single index and drops it from the result.
     *
     * @param axis  The axis to fix.
     * @param index The position along that axis to keep.
     * @return A tensor of rank {@code rank() - 1}.
     */
    public Tensor slice(int axis, int index) {
        if (axis < 0 || axis >= shape.length)
            throw new IndexOutOfBoundsException("Axis " + axis + " out of range for rank " + shape.length);
        if (index < 0 || index >= shape[axis])
            throw new IndexOutOfBoundsException("Index " + index + " out of range for axis " + axis
                    + " of extent " + shape[axis]);

        int[] newShape = new int[shape.length - 1];
        for (int i = 0, j = 0; i < shape.length; i++)
            if (i != axis)
                newShape[j++] = shape[i];

        // Every block of 'inner' contiguous elements is one slab along the trailing axes.
        int inner = strides[axis];
        int outer = data.length / (inner * shape[axis]);
        double[] out = new double[outer * inner];
        for (int o = 0; o < outer; o++)
            System.arraycopy(data, (o * shape[axis] + index) * inner, out, o * inner, inner);
        return new Tensor(newShape, out);
    }

    /** Copy of the flat row-major data. */
    public double[] toArray() {
        return data.clone();
    }

    public boolean approxEquals(Tensor other, double tolerance) {
        if (!Arrays.equals(shape, other.shape))
            return false;
        for (int i = 0; i < data.length; i++)
            if (Math.abs(data[i] - other.data[i]) > tolerance)
                return false;
        return true;
    }

    double[] data() {
        return data;
    }

    int stride(int axis) {
        return strides[axis];
    }

    private int offset(int[] index) {
        if (index.length != shape.length)
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        int off = 0;
        for (int i = 0; i < index.length; i++) {
            if (index[i] < 0 || index[i] >= shape[i])
                throw new IndexOutOfBoundsException("Index " + index[i] + " out of range for axis " + i);
            off += index[i] * strides[i];
        }
        return off;
    }

    private static int[] stridesOf(int[] shape) {
        int[] s = new int[shape.length];
        int acc = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            s[i] = acc;
            acc *= shape[i];
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Tensor t))
            return false;
        return Arrays.equals(shape, t.shape) && Arrays.equals(data, t.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Tensor" + Arrays.toString(shape) + Arrays.toString(data);
    }
}
