package com.raditha.inductive.model;

/**
 * Control-flow operators of a process tree.
 */
public enum Operator {
    /** Children execute one after the other, in list order */
    SEQUENCE("->"),

    /** Exactly one child executes */
    EXCLUSIVE_CHOICE("X"),

    /** Children interleave freely */
    CONCURRENT("+"),

    /** First child executes, then optionally a redo child followed by the first child again */
    LOOP("*");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Symbol used by the canonical text form of a tree.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Whether the order of the children carries meaning.
     * Children of the other operators are put in canonical order after mining.
     */
    public boolean isOrderSignificant() {
        return this == SEQUENCE || this == LOOP;
    }
}
