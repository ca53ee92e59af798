package com.credit.modelengine.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a metric registry file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricRegistryDefinition {
    private RegistryInfo registry;

    /** Meta-information and the metric list. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class RegistryInfo {
        private String name, version;
        private List<MetricDef> metrics;
    }

    /** Definition of a single metric. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class MetricDef {
        private String key, description;
        private List<String> dependsOn;
        private FormulaDef formula;
    }

    /** Two-operand formula node. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FormulaDef {
        private String op, left, right;
    }
}
