package com.galois.p4sym.engine;

import com.galois.p4sym.Term;

/**
 * A node that mutates or forks a program state.
 */
public interface Statement extends Operand {
    /**
     * Execute this statement against <code>state</code>.
     *
     * @return the formula of the rest of the evaluation if this statement
     *   consumed the remaining continuation itself, or <code>null</code> if
     *   evaluation should go on with the next queued statement.
     */
    Term execute(ProgramState state);
}
