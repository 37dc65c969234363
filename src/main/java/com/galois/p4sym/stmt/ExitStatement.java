package com.galois.p4sym.stmt;

import com.galois.p4sym.Term;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;

/**
 * Drops the rest of the continuation.  Open calls are still closed by their
 * {@link com.galois.p4sym.engine.CallFrame}s, so the result is the formula
 * of the outermost state.
 */
public final class ExitStatement implements Statement {
    public static final ExitStatement INSTANCE = new ExitStatement();

    private ExitStatement() {}

    public Term execute(ProgramState state) {
        state.unwindChain();
        return null;
    }

    public String toString() {
        return "exit";
    }
}
