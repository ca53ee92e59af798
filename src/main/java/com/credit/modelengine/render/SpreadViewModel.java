package com.credit.modelengine.render;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renderer-neutral view of a model: ordered columns, sections of rows, and
 * summary counts. Presentation code consumes this without knowing which path
 * computed it; {@code source} records that for audit only.
 */
public record SpreadViewModel(
        String source,
        String dealId,
        String generatedAt,
        List<Column> columns,
        List<Section> sections,
        Meta meta) {

    public SpreadViewModel {
        columns = List.copyOf(columns);
        sections = List.copyOf(sections);
    }

    /** One period column. {@code key} is the period end date. */
    public record Column(String key, String label) {
    }

    public record Section(String key, String title, List<Row> rows) {
        public Section {
            rows = List.copyOf(rows);
        }
    }

    /**
     * One row. Both maps are keyed by column key, in column order; a missing
     * value is held as {@code null} and displayed as an em dash.
     */
    public record Row(String key, String label, RowFormat format, Map<String, Double> values,
            Map<String, String> displayValues) {
        public Row {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
            displayValues = Collections.unmodifiableMap(new LinkedHashMap<>(displayValues));
        }
    }

    public record Meta(int rowCount, int sectionCount, int periodCount, int nonNullCellCount) {
    }

    public Section section(String key) {
        return sections.stream().filter(s -> s.key().equals(key)).findFirst().orElse(null);
    }
}
