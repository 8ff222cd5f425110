package com.bayesnet.graph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable topological ordering of a directed graph's vertices.
 *
 * Produced by {@link DirectedGraph#topologicalOrder()} and used to check that
 * a network is acyclic and to walk it parents-before-children.
 *
 * Data layout (CSR, Compressed Sparse Row):
 * - order: vertex names sorted topologically. Iterating 0..N visits every
 * parent before any of its children.
 * - childrenList: one flat int array holding the topological indices of the
 * children of every vertex.
 * - childrenOffset: childrenOffset[i] is where vertex i's children start in
 * childrenList; they end at childrenOffset[i+1] exclusive.
 *
 * Ties are broken by insertion order, so the result is deterministic for a
 * given sequence of addNode/addEdge calls.
 */
@Log4j2
public final class TopologicalOrder {
    private final String[] order;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(String[] order, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex) {
        this.order = order;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return order.length;
    }

    /** Name of the vertex at the given topological index. */
    public String node(int ti) {
        return order[ti];
    }

    /** Vertex names in topological order. */
    public List<String> names() {
        return List.of(order);
    }

    /** Resolves a vertex name to its topological index. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    public boolean isRoot(int ti) {
        return parentCount[ti] == 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(String name) {
            if (nameToIdx.containsKey(name))
                throw new IllegalArgumentException("Duplicate node name: " + name);
            int idx = nodes.size();
            nodes.add(name);
            nameToIdx.put(name, idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        // Self-edges are accepted here and reported as cycles by build().
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return idx;
        }

        /**
         * Runs Kahn's algorithm.
         *
         * @throws IllegalStateException if the edges form a cycle.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Initialize queue with nodes having in-degree 0
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n) {
                List<String> stuck = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        stuck.add(nodes.get(i));
                log.debug("Topological sort stopped after {} of {} nodes, blocked: {}", topoIdx, n, stuck);
                throw new IllegalStateException("Cycle detected! Processed " + topoIdx + " of " + n
                        + ", unresolved: " + stuck);
            }

            // 4. Construct compact arrays
            String[] ordered = new String[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(ordered[ti], ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            int[] parentCounts = new int[n];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            return new TopologicalOrder(ordered, offsets, flatChildren, parentCounts, newNameToIndex);
        }
    }
}
