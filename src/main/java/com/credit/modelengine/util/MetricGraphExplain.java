package com.credit.modelengine.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.credit.modelengine.engine.MetricDefinition;
import com.credit.modelengine.engine.MetricTopology;

/**
 * Diagnostic dumps of a metric graph together with the values of one
 * evaluation.
 *
 * <p>
 * Intended for debugging sessions and audit attachments. Allocates strings
 * freely.
 */
public final class MetricGraphExplain {
    private final MetricTopology topology;
    private final Map<String, Double> values;
    private final Map<String, List<String>> dependencyGraph;

    public MetricGraphExplain(List<MetricDefinition> metrics, Map<String, Double> values) {
        this(metrics, values, Collections.emptyMap());
    }

    /**
     * @param dependencyGraph realized dependencies from an audited evaluation;
     *                        when given, base inputs are drawn as well.
     */
    public MetricGraphExplain(List<MetricDefinition> metrics, Map<String, Double> values,
            Map<String, List<String>> dependencyGraph) {
        this.topology = MetricTopology.of(metrics);
        this.values = values;
        this.dependencyGraph = dependencyGraph;
    }

    /** Details of a single metric. */
    public String explainMetric(String key) {
        int idx = topology.topoIndex(key);
        MetricDefinition metric = topology.metric(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Metric: ").append(key).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Metric inputs: ").append(topology.parentCount(idx)).append('\n')
                .append("  Formula: ").append(metric.formula()).append('\n')
                .append("  Value: ").append(format(values.get(key))).append('\n');
        if (metric.description() != null)
            sb.append("  Description: ").append(metric.description()).append('\n');
        List<String> reads = dependencyGraph.get(key);
        if (reads != null) {
            sb.append("  Reads: ");
            for (int i = 0; i < reads.size(); i++) {
                String dep = reads.get(i);
                sb.append(dep).append('=').append(format(values.get(dep)));
                if (i < reads.size() - 1)
                    sb.append(", ");
            }
            sb.append('\n');
        }
        int cc = topology.childCount(idx);
        sb.append("  Dependents (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(topology.metric(topology.child(idx, i)).key());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /** The metric topology in evaluation order, one line per metric. */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Metric graph (").append(topology.metricCount()).append(" metrics):\n");
        for (int i = 0; i < topology.metricCount(); i++) {
            MetricDefinition metric = topology.metric(i);
            sb.append("  [").append(i).append("] ").append(metric.key())
                    .append(" = ").append(metric.formula())
                    .append(" : ").append(format(values.get(metric.key())));
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.metric(topology.child(i, j)).key());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Mermaid diagram of the graph, suitable for embedding in Markdown. Base
     * inputs are drawn only when a dependency graph was supplied.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        Set<String> inputs = new LinkedHashSet<>();
        for (List<String> reads : dependencyGraph.values())
            for (String dep : reads)
                if (!topology.contains(dep))
                    inputs.add(dep);

        for (String input : inputs) {
            sb.append("  ").append(sanitize(input)).append("([\"").append(input).append("<br/>")
                    .append(format(values.get(input))).append("\"]);\n");
        }
        for (int i = 0; i < topology.metricCount(); i++) {
            String key = topology.metric(i).key();
            sb.append("  ").append(sanitize(key)).append("[\"").append(key).append("<br/>")
                    .append(format(values.get(key))).append("\"];\n");
        }

        for (Map.Entry<String, List<String>> e : dependencyGraph.entrySet()) {
            for (String dep : e.getValue()) {
                if (inputs.contains(dep))
                    sb.append("  ").append(sanitize(dep)).append(" --> ").append(sanitize(e.getKey())).append(";\n");
            }
        }
        for (int i = 0; i < topology.metricCount(); i++) {
            String parent = sanitize(topology.metric(i).key());
            int cc = topology.childCount(i);
            for (int j = 0; j < cc; j++) {
                sb.append("  ").append(parent).append(" --> ")
                        .append(sanitize(topology.metric(topology.child(i, j)).key())).append(";\n");
            }
        }
        return sb.toString();
    }

    private static String format(Double v) {
        return v == null ? "null" : String.format(Locale.US, "%.4f", v);
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
