package com.credit.modelengine.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.credit.modelengine.parity.LegacySpread;

/** Loads the legacy renderings of a deal, used only for shadow comparison. */
@FunctionalInterface
public interface LegacySpreadSource {
    CompletableFuture<List<LegacySpread>> loadSpreads(String dealId, String bankId);
}
