package com.credit.modelengine.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.credit.modelengine.model.Fact;

/**
 * Loads the full fact set of a deal from the fact-extraction store. The result
 * is treated as a point-in-time snapshot.
 */
@FunctionalInterface
public interface FactSource {
    CompletableFuture<List<Fact>> loadFacts(String dealId);
}
