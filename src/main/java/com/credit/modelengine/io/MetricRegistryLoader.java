package com.credit.modelengine.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.credit.modelengine.engine.Formula;
import com.credit.modelengine.engine.MetricDefinition;
import com.credit.modelengine.engine.MetricTopology;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Loads {@link MetricRegistry} instances from JSON.
 *
 * <p>
 * Validation happens here, at load time: unknown operators, blank operands,
 * duplicate keys and dependency cycles are rejected before any evaluation.
 */
@Log4j2
public final class MetricRegistryLoader {

    /** Classpath location of the seed registry. */
    public static final String SEED_RESOURCE = "metrics/registry-v1.json";

    private final ObjectMapper mapper;

    public MetricRegistryLoader() {
        this(new ObjectMapper());
    }

    public MetricRegistryLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Loads the registry bundled with the engine. */
    public MetricRegistry loadSeed() {
        return loadResource(SEED_RESOURCE);
    }

    public MetricRegistry loadResource(String resource) {
        try (InputStream in = MetricRegistryLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Metric registry resource not found: " + resource);
            return compile(mapper.readValue(in, MetricRegistryDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metric registry " + resource, e);
        }
    }

    public MetricRegistry loadFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return compile(mapper.readValue(in, MetricRegistryDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metric registry " + path, e);
        }
    }

    public MetricRegistry parse(String json) {
        try {
            return compile(mapper.readValue(json, MetricRegistryDefinition.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed metric registry JSON", e);
        }
    }

    /**
     * Compiles the definition into validated metric definitions.
     *
     * @throws IllegalArgumentException on malformed definitions.
     * @throws com.credit.modelengine.engine.MetricCycleException on a cycle.
     */
    public MetricRegistry compile(MetricRegistryDefinition def) {
        MetricRegistryDefinition.RegistryInfo info = def.getRegistry();
        if (info == null || info.getMetrics() == null)
            throw new IllegalArgumentException("Metric registry has no metrics");

        List<MetricDefinition> metrics = new ArrayList<>(info.getMetrics().size());
        Set<String> keys = new HashSet<>();
        for (MetricRegistryDefinition.MetricDef md : info.getMetrics()) {
            if (md.getFormula() == null)
                throw new IllegalArgumentException("Metric " + md.getKey() + " has no formula");
            if (!keys.add(md.getKey()))
                throw new IllegalArgumentException("Duplicate metric key: " + md.getKey());
            MetricRegistryDefinition.FormulaDef fd = md.getFormula();
            Formula formula;
            try {
                formula = Formula.of(fd.getOp(), fd.getLeft(), fd.getRight());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid formula for metric " + md.getKey() + ": " + e.getMessage(), e);
            }
            metrics.add(new MetricDefinition(md.getKey(), md.getDependsOn(), formula, md.getDescription()));
        }

        // Fail at load time rather than on the first evaluation.
        MetricTopology.of(metrics);

        String version = info.getVersion() == null ? "unversioned" : info.getVersion();
        log.info("Loaded metric registry {} {} ({} metrics)", info.getName(), version, metrics.size());
        return new MetricRegistry(info.getName(), version, metrics);
    }
}
