package com.credit.modelengine.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CSR-encoded static DAG of metric definitions.
 *
 * Data layout:
 * - topoOrder: metrics sorted topologically. Iterating 0..N visits every
 * dependency before its dependents.
 * - childrenList: flattened topological indices of all dependents.
 * - childrenOffset: childrenOffset[i] points to the start of metric i's
 * dependents in childrenList, childrenOffset[i+1] to the end.
 *
 * Only metric-to-metric dependencies are edges. A dependency on a base value
 * key is resolved from the value map at evaluation time.
 */
public final class MetricTopology {
    private final MetricDefinition[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> keyToIndex;

    private MetricTopology(MetricDefinition[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> keyToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.keyToIndex = keyToIndex;
    }

    public int metricCount() {
        return topoOrder.length;
    }

    public MetricDefinition metric(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a metric key to its topological index. */
    public int topoIndex(String key) {
        Integer idx = keyToIndex.get(key);
        if (idx == null)
            throw new IllegalArgumentException("Unknown metric: " + key);
        return idx;
    }

    public boolean contains(String key) {
        return keyToIndex.containsKey(key);
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

    /** Metrics in evaluation order. */
    public List<MetricDefinition> ordered() {
        List<MetricDefinition> list = new ArrayList<>(topoOrder.length);
        Collections.addAll(list, topoOrder);
        return list;
    }

    public static MetricTopology of(List<MetricDefinition> metrics) {
        Builder b = builder();
        for (MetricDefinition m : metrics)
            b.addMetric(m);
        for (MetricDefinition m : metrics)
            for (String dep : references(m))
                if (b.isMetric(dep))
                    b.addEdge(dep, m.key());
        return b.build();
    }

    /** Declared dependencies plus the non-literal formula operands, in that order. */
    static List<String> references(MetricDefinition m) {
        List<String> refs = new ArrayList<>(m.dependsOn());
        for (String operand : List.of(m.formula().left(), m.formula().right()))
            if (Formula.literal(operand) == null && !refs.contains(operand))
                refs.add(operand);
        return refs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for the topology. Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<MetricDefinition> metrics = new ArrayList<>();
        private final Map<String, Integer> keyToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();

        public Builder addMetric(MetricDefinition metric) {
            if (keyToIdx.containsKey(metric.key()))
                throw new IllegalArgumentException("Duplicate metric key: " + metric.key());
            int idx = metrics.size();
            metrics.add(metric);
            keyToIdx.put(metric.key(), idx);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /** Adds an edge from a dependency to its dependent. A self-edge is a cycle of one. */
        public Builder addEdge(String from, String to) {
            int fromIdx = requireIndex(from);
            int toIdx = requireIndex(to);
            if (!forwardEdges.get(fromIdx).contains(toIdx))
                forwardEdges.get(fromIdx).add(toIdx);
            return this;
        }

        boolean isMetric(String key) {
            return keyToIdx.containsKey(key);
        }

        private int requireIndex(String key) {
            Integer idx = keyToIdx.get(key);
            if (idx == null)
                throw new IllegalArgumentException("Unknown metric: " + key);
            return idx;
        }

        /**
         * Compiles the graph using Kahn's algorithm. Ready metrics are taken in
         * definition order, so the result is deterministic for a given input.
         *
         * @throws MetricCycleException naming a metric on the cycle.
         */
        public MetricTopology build() {
            int n = metrics.size();
            int[] inDegree = new int[n];

            for (List<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

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
                List<String> unresolved = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        unresolved.add(metrics.get(i).key());
                throw new MetricCycleException(metrics.get(cycleMember(inDegree)).key(), unresolved);
            }

            MetricDefinition[] ordered = new MetricDefinition[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newKeyToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = metrics.get(reverseMap[ti]);
                newKeyToIndex.put(ordered[ti].key(), ti);
            }

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
            return new MetricTopology(ordered, offsets, flatChildren, parentCounts, newKeyToIndex);
        }

        /**
         * Finds a metric on a cycle among those Kahn's algorithm left unordered.
         * Every unordered metric has an unordered parent, so walking parents
         * from any of them must revisit a metric; the walk from there is the
         * cycle. Returns its earliest member in definition order.
         */
        private int cycleMember(int[] inDegree) {
            int n = metrics.size();
            int[] parent = new int[n];
            Arrays.fill(parent, -1);
            int start = -1;
            for (int i = 0; i < n; i++) {
                if (inDegree[i] == 0)
                    continue;
                if (start < 0)
                    start = i;
                for (int child : forwardEdges.get(i))
                    if (parent[child] < 0)
                        parent[child] = i;
            }

            boolean[] seen = new boolean[n];
            int curr = start;
            while (!seen[curr]) {
                seen[curr] = true;
                curr = parent[curr];
            }
            int first = curr;
            for (int m = parent[curr]; m != curr; m = parent[m])
                first = Math.min(first, m);
            return first;
        }
    }
}
