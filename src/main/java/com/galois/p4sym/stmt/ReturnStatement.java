package com.galois.p4sym.stmt;

import com.galois.p4sym.Term;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;

/**
 * Ends evaluation of the current path.  Without a value the result is the
 * state's formula; with one, the resolved value itself.
 */
public final class ReturnStatement implements Statement {
    private final Operand value;

    public ReturnStatement() {
        this(null);
    }

    public ReturnStatement(Operand value) {
        this.value = value;
    }

    public Term execute(ProgramState state) {
        if (value == null) {
            return state.getFormula();
        }
        return state.resolveTerm(value);
    }

    public String toString() {
        return value == null ? "return" : "return " + value;
    }
}
