package com.raditha.inductive.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MinerSettingsTest {

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws Exception {
        return Path.of(MinerSettingsTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    void testNoYamlGivesDefaults() {
        assertEquals(MinerConfig.defaults(), MinerSettings.loadConfig(Map.of(), null, null, false, false, 0));
        assertEquals(MinerConfig.defaults(), MinerSettings.loadConfig(null, null, null, false, false, 0));
    }

    @Test
    void testClasspathDefaults() throws IOException {
        Map<String, Object> yaml = MinerSettings.readYaml(null);

        assertTrue(yaml.containsKey(MinerSettings.CONFIG_KEY));
        assertEquals(MinerConfig.defaults(), MinerSettings.loadConfig(yaml, null, null, false, false, 0));
    }

    @Test
    void testPresetFromYaml() throws Exception {
        Map<String, Object> yaml = MinerSettings.readYaml(resource("relaxed.yml"));

        assertEquals(MinerConfig.relaxed(), MinerSettings.loadConfig(yaml, null, null, false, false, 0));
    }

    @Test
    void testIndividualKeys() throws Exception {
        Map<String, Object> yaml = MinerSettings.readYaml(resource("custom.yml"));

        MinerConfig config = MinerSettings.loadConfig(yaml, null, null, false, false, 0);

        assertEquals(MinerVariant.IMD, config.variant());
        assertFalse(config.strictSequenceCut());
        assertTrue(config.minimumSelfDistance());
        assertFalse(config.disableFallThroughs());
        assertEquals(3, config.parallelism());
    }

    @Test
    void testCliOverridesYaml() throws Exception {
        Map<String, Object> yaml = MinerSettings.readYaml(resource("custom.yml"));

        MinerConfig config = MinerSettings.loadConfig(yaml, null, "im", false, true, 2);

        assertEquals(MinerVariant.IM, config.variant());
        assertFalse(config.strictSequenceCut());
        assertTrue(config.disableFallThroughs());
        assertEquals(2, config.parallelism());
    }

    @Test
    void testCliPresetWinsOverYamlKeys() throws Exception {
        Map<String, Object> yaml = MinerSettings.readYaml(resource("custom.yml"));

        assertEquals(MinerConfig.defaults(), MinerSettings.loadConfig(yaml, "default", null, false, false, 0));
        assertEquals(MinerConfig.relaxed(), MinerSettings.loadConfig(Map.of(), null, null, true, false, 0));
    }

    @Test
    void testUnknownVariant() throws IOException {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "inductive_miner:\n  variant: heuristic\n");
        Map<String, Object> yaml = MinerSettings.readYaml(file);

        assertThrows(IllegalArgumentException.class,
                () -> MinerSettings.loadConfig(yaml, null, null, false, false, 0));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> MinerSettings.readYaml(tempDir.resolve("missing.yml")));
    }

    @Test
    void testEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        assertTrue(MinerSettings.readYaml(file).isEmpty());
    }
}
