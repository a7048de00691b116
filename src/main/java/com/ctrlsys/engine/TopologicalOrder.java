package com.ctrlsys.engine;

import com.ctrlsys.api.Block;
import com.ctrlsys.api.ControlSystemException;

import java.util.*;

/**
 * Topology -- CSR-encoded scheduling DAG.
 *
 * This class represents the immutable execution structure of a control system
 * after it has been built. It only ever contains zero-delay edges: an edge
 * producer -> consumer exists when the consumer reads a signal written by the
 * producer and the consumer declares no delay.
 *
 * Data layout (Compressed Sparse Row):
 * - topoOrder: the blocks sorted topologically. Iterating 0..N visits every
 * producer before its zero-delay consumers.
 * - childrenList: a single flattened int array containing the topological
 * indices of all children of all blocks.
 * - childrenOffset: childrenOffset[i] points to the start of block i's children
 * in childrenList; the children are stored from childrenList[childrenOffset[i]]
 * inclusive to childrenList[childrenOffset[i+1]] exclusive.
 *
 * Iterating children reads contiguous ints and never allocates.
 */
public final class TopologicalOrder {
    private final Block[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(Block[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
    }

    public int blockCount() {
        return topoOrder.length;
    }

    /** Returns the block at the given topological index. */
    public Block block(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a block name to its topological index. O(1) hash lookup. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown block: " + name);
        return idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int childrenStart(int ti) {
        return childrenOffset[ti];
    }

    public int childrenEnd(int ti) {
        return childrenOffset[ti + 1];
    }

    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** Block names in execution order. */
    public List<String> names() {
        List<String> names = new ArrayList<>(topoOrder.length);
        for (Block b : topoOrder)
            names.add(b.name());
        return Collections.unmodifiableList(names);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<Block> blocks = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addBlock(Block block) {
            if (nameToIdx.containsKey(block.name()))
                throw ControlSystemException.duplicateBlockName(block.name());
            int idx = blocks.size();
            blocks.add(block);
            nameToIdx.put(block.name(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /**
         * Adds a scheduling edge. Self-edges are accepted here and reported as a
         * cycle by build().
         */
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown block: " + name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         * Blocks without mutual dependencies keep their registration order.
         *
         * @throws ControlSystemException CYCLE_DETECTED naming a block that lies on a cycle.
         */
        public TopologicalOrder build() {
            int n = blocks.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Initialize queue with blocks having in-degree 0
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue (Kahn's algorithm)
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
            if (topoIdx != n)
                throw ControlSystemException.cycleDetected(blocks.get(findBlockOnCycle(inDegree)).name());

            // 4. Construct compact arrays
            Block[] ordered = new Block[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = blocks.get(reverseMap[ti]);
                newNameToIndex.put(ordered[ti].name(), ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
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

        /*
         * After Kahn's pass every unprocessed block still has an unprocessed
         * parent. Walking parents from any of them must revisit a block, and that
         * block lies on a cycle (blocks merely downstream of a cycle do not).
         */
        private int findBlockOnCycle(int[] remainingInDegree) {
            int n = blocks.size();
            int[] parent = new int[n];
            Arrays.fill(parent, -1);
            for (var entry : forwardEdges.entrySet()) {
                int from = entry.getKey();
                if (remainingInDegree[from] == 0)
                    continue;
                for (int child : entry.getValue())
                    if (remainingInDegree[child] > 0 && parent[child] < 0)
                        parent[child] = from;
            }

            int start = 0;
            while (remainingInDegree[start] == 0)
                start++;

            boolean[] seen = new boolean[n];
            int curr = start;
            while (!seen[curr]) {
                seen[curr] = true;
                curr = parent[curr];
            }
            return curr;
        }
    }
}
