package com.galois.p4sym.callable;

/**
 * How a parameter passes values across a call boundary.
 */
public enum Direction {
    /** Copied in; changes made by the callee are not visible to the caller. */
    IN,
    /** Unconstrained on entry and copied back to the caller. */
    OUT,
    /** Copied in and copied back. */
    INOUT;

    /** Whether the callee's final value is copied back to the argument. */
    public boolean copiesOut() {
        return this != IN;
    }

    /**
     * Parse a direction keyword; an empty or missing keyword means {@link #IN}.
     */
    public static Direction parse(String keyword) {
        if (keyword == null || keyword.isEmpty() || keyword.equals("in")) return IN;
        if (keyword.equals("out")) return OUT;
        if (keyword.equals("inout")) return INOUT;
        throw new IllegalArgumentException("Unknown parameter direction: " + keyword);
    }
}
