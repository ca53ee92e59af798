package com.credit.modelengine.mode;

import java.util.Locale;

/** Which computation path is authoritative. */
public enum EngineMode {
    /** Legacy rendering is authoritative; the model is computed read-only. */
    LEGACY,
    /** Model is authoritative and compared against the legacy rendering. */
    SHADOW,
    /** Model is authoritative with no comparison. */
    PRIMARY;

    /** Case-insensitive parse; {@code null} for blank input. */
    public static EngineMode parse(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown engine mode: " + raw, e);
        }
    }
}
