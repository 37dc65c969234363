package com.galois.p4sym.stmt;

import com.galois.p4sym.Term;
import com.galois.p4sym.engine.Invocable;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.expr.MethodCallExpression;

/**
 * A call in statement position.  If the callee runs the rest of the
 * continuation itself its result is the result of this statement;
 * otherwise the returned value is discarded.
 */
public final class MethodCallStatement implements Statement {
    private final MethodCallExpression call;

    public MethodCallStatement(MethodCallExpression call) {
        this.call = call;
    }

    public Term execute(ProgramState state) {
        Invocable callee = call.resolveCallee(state);
        Value result = call.invoke(state, callee);
        if (callee.consumesContinuation()) {
            return result.toTerm(state.builder());
        }
        return null;
    }

    public String toString() {
        return call.toString();
    }
}
