package com.credit.modelengine.parity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A statement rendered by the legacy spreading path, as read for comparison.
 *
 * <p>
 * Rows carry either a per-column value map or a single scalar. Columns carry an
 * optional {@code kind}; {@code ttm}, {@code ytd} and {@code prior_ytd} mark
 * aggregate columns.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LegacySpread {
    private String spreadType;
    private List<Column> columns = new ArrayList<>();
    private List<Row> rows = new ArrayList<>();

    public LegacySpread(String spreadType) {
        this.spreadType = spreadType;
    }

    public LegacySpread column(String key, String label, String kind, String endDate) {
        Column c = new Column();
        c.setKey(key);
        c.setLabel(label);
        c.setKind(kind);
        c.setEndDate(endDate);
        columns.add(c);
        return this;
    }

    public LegacySpread row(String key, Map<String, Double> values) {
        Row r = new Row();
        r.setKey(key);
        r.setValues(values);
        rows.add(r);
        return this;
    }

    public LegacySpread scalarRow(String key, Double value) {
        Row r = new Row();
        r.setKey(key);
        r.setValue(value);
        rows.add(r);
        return this;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Column {
        private String key, label, kind, endDate;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Row {
        private String key, label, section, notes;
        private Map<String, Double> values;
        private Double value;
    }
}
