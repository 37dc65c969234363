package com.galois.p4sym.engine;

/**
 * A node that always produces a value.
 */
public interface Expression extends Operand {
    /**
     * Evaluate this expression; may mutate <code>state</code> when it calls
     * a callable.
     */
    Value evaluate(ProgramState state);
}
