package com.galois.p4sym.expr;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

/** <code>high ++ low</code>. */
public final class ConcatExpression implements Expression {
    private final Operand high;
    private final Operand low;

    public ConcatExpression(Operand high, Operand low) {
        this.high = high;
        this.low = low;
    }

    public Value evaluate(ProgramState state) {
        TermBuilder b = state.builder();
        return Value.of(BitOps.concat(b, state.resolveTerm(high), state.resolveTerm(low)));
    }

    public String toString() {
        return "(" + high + " ++ " + low + ")";
    }
}
