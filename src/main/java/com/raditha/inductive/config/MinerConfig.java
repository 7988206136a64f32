package com.raditha.inductive.config;

/**
 * Configuration of a mining run.
 *
 * @param variant             abstraction the miner works on
 * @param strictSequenceCut   if true, start and end activities are kept in the outer groups of a sequence cut
 * @param minimumSelfDistance if true, activities separating repetitions of another activity are never concurrent to it
 * @param disableFallThroughs if true, only the flower model is used when no cut applies
 * @param parallelism         number of worker threads; 1 mines sequentially
 */
public record MinerConfig(
        MinerVariant variant,
        boolean strictSequenceCut,
        boolean minimumSelfDistance,
        boolean disableFallThroughs,
        int parallelism) {

    public MinerConfig {
        if (variant == null) {
            throw new IllegalArgumentException("variant cannot be null");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
    }

    /**
     * Variant log miner with the strict sequence cut, sequential.
     */
    public static MinerConfig defaults() {
        return new MinerConfig(
                MinerVariant.IM,
                true, // strictSequenceCut
                true, // minimumSelfDistance
                false, // disableFallThroughs
                1);
    }

    /**
     * Variant log miner with the relaxed sequence cut; skipped groups become optional.
     */
    public static MinerConfig relaxed() {
        return new MinerConfig(MinerVariant.IM, false, true, false, 1);
    }

    /**
     * Directly-follows miner. Self-distance needs traces, so it is off.
     */
    public static MinerConfig directlyFollows() {
        return new MinerConfig(MinerVariant.IMD, true, false, false, 1);
    }

    public static MinerConfig forPreset(String preset) {
        return switch (preset) {
            case "relaxed" -> relaxed();
            case "directly_follows", "imd" -> directlyFollows();
            default -> defaults();
        };
    }

    public MinerConfig withVariant(MinerVariant newVariant) {
        return new MinerConfig(newVariant, strictSequenceCut, minimumSelfDistance, disableFallThroughs, parallelism);
    }

    public MinerConfig withParallelism(int newParallelism) {
        return new MinerConfig(variant, strictSequenceCut, minimumSelfDistance, disableFallThroughs, newParallelism);
    }

    public boolean isParallel() {
        return parallelism > 1;
    }
}
