package com.raditha.inductive.config;

/**
 * Which abstraction the miner works on.
 */
public enum MinerVariant {
    /** Variant log based Inductive Miner */
    IM,

    /** Directly-follows based Inductive Miner */
    IMD;

    /**
     * Case-insensitive lookup, accepting {@code im}, {@code imd} and {@code im_d}.
     */
    public static MinerVariant parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("variant cannot be null");
        }
        String normalized = value.trim().replace("_", "").toUpperCase();
        for (MinerVariant variant : values()) {
            if (variant.name().equals(normalized)) {
                return variant;
            }
        }
        throw new IllegalArgumentException("Unknown miner variant: " + value + " (expected IM or IMD)");
    }
}
