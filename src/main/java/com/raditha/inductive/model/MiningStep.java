package com.raditha.inductive.model;

/**
 * Every decision the miner can take for a sub-problem.
 * Used to label cut results and to count how a model was obtained.
 */
public enum MiningStep {
    EMPTY_LOG(Kind.BASE_CASE, "empty log"),
    SINGLE_ACTIVITY(Kind.BASE_CASE, "single activity"),

    EXCLUSIVE_CHOICE_CUT(Kind.CUT, "exclusive choice"),
    SEQUENCE_CUT(Kind.CUT, "sequence"),
    CONCURRENCY_CUT(Kind.CUT, "concurrency"),
    LOOP_CUT(Kind.CUT, "loop"),

    EMPTY_TRACES(Kind.FALL_THROUGH, "empty traces"),
    ACTIVITY_ONCE_PER_TRACE(Kind.FALL_THROUGH, "activity once per trace"),
    ACTIVITY_CONCURRENT(Kind.FALL_THROUGH, "activity concurrent"),
    STRICT_TAU_LOOP(Kind.FALL_THROUGH, "strict tau loop"),
    TAU_LOOP(Kind.FALL_THROUGH, "tau loop"),
    FLOWER_MODEL(Kind.FALL_THROUGH, "flower model");

    /**
     * Family a step belongs to.
     */
    public enum Kind {
        BASE_CASE,
        CUT,
        FALL_THROUGH
    }

    private final Kind kind;
    private final String displayName;

    MiningStep(Kind kind, String displayName) {
        this.kind = kind;
        this.displayName = displayName;
    }

    public Kind kind() {
        return kind;
    }

    public String displayName() {
        return displayName;
    }
}
