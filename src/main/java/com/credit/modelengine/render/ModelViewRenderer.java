package com.credit.modelengine.render;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.credit.modelengine.builder.BaseValueExtractor;
import com.credit.modelengine.engine.MetricGraphEvaluator;
import com.credit.modelengine.io.MetricRegistry;
import com.credit.modelengine.model.FinancialModel;
import com.credit.modelengine.model.FinancialPeriod;
import com.credit.modelengine.parity.ModelParityAdapter;

import lombok.extern.log4j.Log4j2;

/**
 * Converts a {@link FinancialModel} into a {@link SpreadViewModel}.
 *
 * <p>
 * Each period is flattened into base values and run through the metric graph,
 * so ratio rows show exactly what the registry computes. Rows whose key is
 * neither a base value nor a registry metric are omitted.
 */
@Log4j2
public final class ModelViewRenderer {

    public static final String SOURCE = "model";

    private final MetricGraphEvaluator evaluator = new MetricGraphEvaluator();
    private final Clock clock;

    public ModelViewRenderer() {
        this(Clock.systemUTC());
    }

    public ModelViewRenderer(Clock clock) {
        this.clock = clock;
    }

    public SpreadViewModel render(FinancialModel model, MetricRegistry registry) {
        List<SpreadViewModel.Column> columns = new ArrayList<>(model.periods().size());
        Map<String, Map<String, Double>> valuesByPeriod = new LinkedHashMap<>();
        for (FinancialPeriod period : model.periods()) {
            String end = period.getPeriodEnd();
            columns.add(new SpreadViewModel.Column(end, ModelParityAdapter.label(end)));
            valuesByPeriod.put(end, evaluator.evaluate(registry.metrics(), BaseValueExtractor.extract(period)));
        }

        Map<ViewSectionKind, List<SpreadViewModel.Row>> rowsBySection = new EnumMap<>(ViewSectionKind.class);
        int nonNull = 0;
        for (StandardRow row : StandardRow.values()) {
            if (row.section() == ViewSectionKind.RATIOS && registry.metric(row.key()).isEmpty())
                continue;
            Map<String, Double> values = new LinkedHashMap<>();
            Map<String, String> display = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, Double>> e : valuesByPeriod.entrySet()) {
                Double v = e.getValue().get(row.key());
                values.put(e.getKey(), v);
                display.put(e.getKey(), row.format().format(v));
                if (v != null)
                    nonNull++;
            }
            rowsBySection.computeIfAbsent(row.section(), k -> new ArrayList<>())
                    .add(new SpreadViewModel.Row(row.key(), row.label(), row.format(), values, display));
        }

        List<SpreadViewModel.Section> sections = new ArrayList<>();
        int rowCount = 0;
        for (Map.Entry<ViewSectionKind, List<SpreadViewModel.Row>> e : rowsBySection.entrySet()) {
            sections.add(new SpreadViewModel.Section(e.getKey().name(), e.getKey().title(), e.getValue()));
            rowCount += e.getValue().size();
        }

        SpreadViewModel.Meta meta = new SpreadViewModel.Meta(rowCount, sections.size(), columns.size(), nonNull);
        log.debug("Rendered deal {}: {} rows, {} periods, {} non-null cells", model.dealId(), rowCount,
                columns.size(), nonNull);
        return new SpreadViewModel(SOURCE, model.dealId(), Instant.now(clock).toString(), columns, sections, meta);
    }
}
