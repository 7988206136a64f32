package com.raditha.inductive.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MinerConfigTest {

    @Test
    void testDefaults() {
        MinerConfig config = MinerConfig.defaults();

        assertEquals(MinerVariant.IM, config.variant());
        assertTrue(config.strictSequenceCut());
        assertTrue(config.minimumSelfDistance());
        assertFalse(config.disableFallThroughs());
        assertEquals(1, config.parallelism());
        assertFalse(config.isParallel());
    }

    @Test
    void testPresets() {
        assertFalse(MinerConfig.relaxed().strictSequenceCut());
        assertEquals(MinerVariant.IMD, MinerConfig.directlyFollows().variant());
        assertFalse(MinerConfig.directlyFollows().minimumSelfDistance());

        assertEquals(MinerConfig.relaxed(), MinerConfig.forPreset("relaxed"));
        assertEquals(MinerConfig.directlyFollows(), MinerConfig.forPreset("imd"));
        assertEquals(MinerConfig.directlyFollows(), MinerConfig.forPreset("directly_follows"));
        assertEquals(MinerConfig.defaults(), MinerConfig.forPreset("anything else"));
    }

    @Test
    void testWithers() {
        MinerConfig config = MinerConfig.defaults().withVariant(MinerVariant.IMD).withParallelism(4);

        assertEquals(MinerVariant.IMD, config.variant());
        assertEquals(4, config.parallelism());
        assertTrue(config.isParallel());
        assertTrue(config.strictSequenceCut());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> MinerConfig.defaults().withParallelism(0));
        assertThrows(IllegalArgumentException.class, () -> new MinerConfig(null, true, true, false, 1));
    }

    @Test
    void testVariantParsing() {
        assertEquals(MinerVariant.IM, MinerVariant.parse("im"));
        assertEquals(MinerVariant.IMD, MinerVariant.parse(" IMD "));
        assertEquals(MinerVariant.IMD, MinerVariant.parse("im_d"));
        assertThrows(IllegalArgumentException.class, () -> MinerVariant.parse("alpha"));
        assertThrows(IllegalArgumentException.class, () -> MinerVariant.parse(null));
    }
}
