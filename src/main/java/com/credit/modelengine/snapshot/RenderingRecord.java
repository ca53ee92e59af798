package com.credit.modelengine.snapshot;

import java.util.List;
import java.util.Map;

import com.credit.modelengine.render.SpreadViewModel;

/**
 * The current rendering of one statement for a deal and bank. Overwritten on
 * every authoritative computation; the version stamps let a later replay detect
 * drift.
 */
public record RenderingRecord(
        String dealId,
        String bankId,
        String statementType,
        int schemaVersion,
        String registryVersion,
        String policyVersion,
        String outputsHash,
        String snapshotHash,
        Map<String, List<String>> dependencyGraph,
        SpreadViewModel view,
        String updatedAt) {

    public static final int SCHEMA_VERSION = 2;
    public static final String STANDARD_STATEMENT = "STANDARD";
}
