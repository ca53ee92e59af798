package com.credit.modelengine;

import com.credit.modelengine.mode.ModeDecision;
import com.credit.modelengine.parity.ParityReport;

/**
 * Response of {@link EngineAuthority#serve}. {@code parity} is only set in
 * shadow mode, and is null if the legacy rendering could not be loaded.
 */
public record ServedResult(ModeDecision decision, AuthoritativeResult result, ParityReport parity) {
}
