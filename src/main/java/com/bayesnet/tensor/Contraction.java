package com.bayesnet.tensor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Einstein summation over integer axis labels.
 *
 * Every operand carries one label per axis. The output element for a given
 * assignment of the output labels is the sum, over every assignment of the
 * remaining labels, of the product of the matching elements of all
 * operands. Labels are plain ints, so the number of distinct variables in a
 * contraction is not tied to any alphabet.
 *
 * Strategy:
 * Operands are folded left to right. After each pairwise product a label is
 * summed out as soon as neither the output nor any operand still to come
 * refers to it. This keeps intermediate tensors no larger than the variables
 * that are still live, instead of materializing the product of every
 * operand's state space at once. A final pass permutes the accumulated
 * tensor into the requested output order.
 *
 * Each individual step walks its index space with an odometer and
 * incremental offsets, so no per-element index arrays are allocated.
 */
public final class Contraction {
    private Contraction() {
        // Utility class
    }

    /** A tensor together with the label of each of its axes. */
    public record Operand(Tensor tensor, int[] labels) {
        public Operand {
            if (tensor == null)
                throw new IllegalArgumentException("Operand tensor must not be null");
            labels = labels.clone();
            if (labels.length != tensor.rank())
                throw new IllegalArgumentException("Operand of rank " + tensor.rank() + " given "
                        + labels.length + " labels " + Arrays.toString(labels));
            Set<Integer> seen = new HashSet<>();
            for (int l : labels)
                if (!seen.add(l))
                    throw new IllegalArgumentException("Repeated label " + l + " within one operand");
        }

        public static Operand of(Tensor tensor, int... labels) {
            return new Operand(tensor, labels);
        }

        @Override
        public int[] labels() {
            return labels.clone();
        }
    }

    public static Tensor contract(List<Operand> operands, int... outputLabels) {
        if (operands.isEmpty())
            throw new IllegalArgumentException("Contraction needs at least one operand");
        Map<Integer, Integer> extents = extents(operands);
        Set<Integer> outSet = new LinkedHashSet<>();
        for (int l : outputLabels) {
            if (!outSet.add(l))
                throw new IllegalArgumentException("Repeated output label " + l);
            if (!extents.containsKey(l))
                throw new IllegalArgumentException("Output label " + l + " does not occur in any operand");
        }

        // 1. Fold operands pairwise, dropping labels nobody downstream needs.
        Operand acc = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            Operand next = operands.get(i);
            Set<Integer> live = new LinkedHashSet<>(outSet);
            for (int j = i + 1; j < operands.size(); j++)
                for (int l : operands.get(j).labels)
                    live.add(l);

            List<Integer> kept = new ArrayList<>();
            for (int l : acc.labels)
                if (live.contains(l))
                    kept.add(l);
            for (int l : next.labels)
                if (live.contains(l) && !kept.contains(l))
                    kept.add(l);

            int[] keptLabels = kept.stream().mapToInt(Integer::intValue).toArray();
            acc = new Operand(step(List.of(acc, next), keptLabels, extents), keptLabels);
        }

        // 2. Sum out leftovers and permute into output order.
        if (Arrays.equals(acc.labels, outputLabels))
            return acc.tensor;
        return step(List.of(acc), outputLabels, extents);
    }

    private static Map<Integer, Integer> extents(List<Operand> operands) {
        Map<Integer, Integer> extents = new HashMap<>();
        for (Operand op : operands) {
            for (int axis = 0; axis < op.labels.length; axis++) {
                int label = op.labels[axis];
                int extent = op.tensor.dim(axis);
                Integer prev = extents.putIfAbsent(label, extent);
                if (prev != null && prev != extent)
                    throw new IllegalArgumentException("Label " + label + " has extent " + prev
                            + " in one operand and " + extent + " in another");
            }
        }
        return extents;
    }

    /**
     * Direct product-and-sum of the given operands into {@code out} labels.
     * Iterates the full index space of the union of all labels.
     */
    private static Tensor step(List<Operand> ops, int[] out, Map<Integer, Integer> extents) {
        // Union of labels: output labels first, then summed labels in order of appearance.
        List<Integer> union = new ArrayList<>();
        for (int l : out)
            union.add(l);
        for (Operand op : ops)
            for (int l : op.labels)
                if (!union.contains(l))
                    union.add(l);

        int n = union.size();
        int k = ops.size();
        int[] ext = new int[n];
        for (int p = 0; p < n; p++)
            ext[p] = extents.get(union.get(p));

        int[] outShape = Arrays.copyOf(ext, out.length);
        int[] outStride = new int[n];
        int acc = 1;
        for (int p = out.length - 1; p >= 0; p--) {
            outStride[p] = acc;
            acc *= ext[p];
        }
        double[] result = new double[acc];

        double[][] data = new double[k][];
        int[][] stride = new int[k][n];
        for (int i = 0; i < k; i++) {
            Operand op = ops.get(i);
            data[i] = op.tensor.data();
            for (int axis = 0; axis < op.labels.length; axis++)
                stride[i][union.indexOf(op.labels[axis])] = op.tensor.stride(axis);
        }

        long total = 1;
        for (int e : ext)
            total *= e;

        int[] counter = new int[n];
        int[] offset = new int[k];
        int outOffset = 0;
        for (long it = 0; it < total; it++) {
            double prod = 1.0;
            for (int i = 0; i < k; i++)
                prod *= data[i][offset[i]];
            result[outOffset] += prod;

            // Advance the odometer; last position moves fastest.
            for (int p = n - 1; p >= 0; p--) {
                if (++counter[p] < ext[p]) {
                    for (int i = 0; i < k; i++)
                        offset[i] += stride[i][p];
                    outOffset += outStride[p];
                    break;
                }
                counter[p] = 0;
                int back = ext[p] - 1;
                for (int i = 0; i < k; i++)
                    offset[i] -= stride[i][p] * back;
                outOffset -= outStride[p] * back;
            }
        }
        return Tensor.wrap(outShape, result);
    }
}
