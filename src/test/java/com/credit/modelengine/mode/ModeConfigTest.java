package com.credit.modelengine.mode;

import org.junit.Test;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class ModeConfigTest {

    @Test
    public void testFromProperties() {
        ModeConfig config = ModeConfig.fromProperties(Map.of(
                ModeConfig.OVERRIDE_KEY, " legacy ",
                ModeConfig.MODE_KEY, "Shadow",
                ModeConfig.DEAL_ALLOWLIST_KEY, "D1, D2,,",
                ModeConfig.BANK_ALLOWLIST_KEY, "B1",
                ModeConfig.ALLOWLIST_MODE_KEY, "primary"));

        assertEquals(EngineMode.LEGACY, config.globalOverride());
        assertEquals(EngineMode.SHADOW, config.explicitMode());
        assertEquals(Set.of("D1", "D2"), config.dealAllowlist());
        assertEquals(Set.of("B1"), config.bankAllowlist());
        assertEquals(EngineMode.PRIMARY, config.allowlistMode());
    }

    @Test
    public void testEmptyPropertiesMatchDefault() {
        assertEquals(ModeConfig.DEFAULT, ModeConfig.fromProperties(Map.of()));
        assertEquals(EngineMode.SHADOW, ModeConfig.DEFAULT.allowlistMode());
    }

    @Test
    public void testBlankModeIsUnset() {
        assertNull(EngineMode.parse("  "));
        assertNull(EngineMode.parse(null));
        assertNull(ModeConfig.fromProperties(Map.of(ModeConfig.MODE_KEY, "")).explicitMode());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownModeRejected() {
        ModeConfig.fromProperties(Map.of(ModeConfig.OVERRIDE_KEY, "v2"));
    }

    @Test
    public void testAllowlistsAreCopied() {
        Set<String> deals = new HashSet<>(Set.of("D1"));
        ModeConfig config = new ModeConfig(null, null, deals, null, null);
        deals.add("D2");
        assertEquals(Set.of("D1"), config.dealAllowlist());
        assertTrue(config.bankAllowlist().isEmpty());
    }
}
