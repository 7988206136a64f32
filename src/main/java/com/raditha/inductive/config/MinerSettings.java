package com.raditha.inductive.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads miner configuration from YAML with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > defaults.
 * Settings live under the {@code inductive_miner} key:
 * <pre>
 * inductive_miner:
 *   preset: relaxed           # optional, wins over the individual keys
 *   variant: im               # im | imd
 *   strict_sequence_cut: true
 *   minimum_self_distance: true
 *   disable_fall_throughs: false
 *   parallelism: 1
 * </pre>
 */
public class MinerSettings {

    private static final Logger logger = LoggerFactory.getLogger(MinerSettings.class);

    static final String CONFIG_KEY = "inductive_miner";
    static final String DEFAULT_RESOURCE = "miner.yml";

    private MinerSettings() {
    }

    /**
     * Read a YAML document. Without a file, the {@code miner.yml} on the classpath is used if present.
     *
     * @param configFile YAML file, or {@code null}
     * @return the top-level YAML mapping, empty if there is none
     * @throws IOException if the file cannot be read
     */
    public static Map<String, Object> readYaml(Path configFile) throws IOException {
        if (configFile != null) {
            try (InputStream in = Files.newInputStream(configFile)) {
                logger.debug("Loading miner settings from {}", configFile);
                return asMap(new Yaml().load(in));
            }
        }
        try (InputStream in = MinerSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return Map.of();
            }
            return asMap(new Yaml().load(in));
        }
    }

    /**
     * Build the configuration, applying CLI overrides where provided.
     *
     * @param yaml                   top-level YAML mapping, may be empty
     * @param presetCLI              CLI preset name (null = use YAML/default)
     * @param variantCLI             CLI variant (null = use YAML/default)
     * @param relaxedSequenceCLI     CLI flag selecting the relaxed sequence cut (false = use YAML/default)
     * @param disableFallThroughsCLI CLI flag keeping only the flower model (false = use YAML/default)
     * @param parallelismCLI         CLI worker count (0 = use YAML/default)
     * @return complete miner configuration
     */
    public static MinerConfig loadConfig(Map<String, Object> yaml, String presetCLI, String variantCLI,
                                         boolean relaxedSequenceCLI, boolean disableFallThroughsCLI,
                                         int parallelismCLI) {
        Map<String, Object> config = asMap(yaml == null ? null : yaml.get(CONFIG_KEY));

        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        MinerConfig base = preset != null ? MinerConfig.forPreset(preset) : fromYaml(config);

        MinerVariant variant = variantCLI != null ? MinerVariant.parse(variantCLI) : base.variant();
        boolean strict = !relaxedSequenceCLI && base.strictSequenceCut();
        boolean flowerOnly = disableFallThroughsCLI || base.disableFallThroughs();
        int parallelism = parallelismCLI != 0 ? parallelismCLI : base.parallelism();

        MinerConfig result = new MinerConfig(variant, strict, base.minimumSelfDistance(), flowerOnly, parallelism);
        logger.debug("Miner configuration: {}", result);
        return result;
    }

    private static MinerConfig fromYaml(Map<String, Object> config) {
        MinerConfig defaults = MinerConfig.defaults();
        String variant = getString(config, "variant", null);
        return new MinerConfig(
                variant != null ? MinerVariant.parse(variant) : defaults.variant(),
                getBoolean(config, "strict_sequence_cut", defaults.strictSequenceCut()),
                getBoolean(config, "minimum_self_distance", defaults.minimumSelfDistance()),
                getBoolean(config, "disable_fall_throughs", defaults.disableFallThroughs()),
                getInt(config, "parallelism", defaults.parallelism()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
