package com.galois.p4sym.expr;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

/** <code>cond ? then : else</code>. */
public final class MuxExpression implements Expression {
    private final Operand cond;
    private final Operand thenValue;
    private final Operand elseValue;

    public MuxExpression(Operand cond, Operand thenValue, Operand elseValue) {
        this.cond = cond;
        this.thenValue = thenValue;
        this.elseValue = elseValue;
    }

    public Value evaluate(ProgramState state) {
        TermBuilder b = state.builder();
        Term c = BitOps.castToBool(b, state.resolveTerm(cond));
        Term[] xy = BitOps.align(b, state.resolveTerm(thenValue), state.resolveTerm(elseValue));
        return Value.of(b.ite(c, xy[0], xy[1]));
    }

    public String toString() {
        return "(" + cond + " ? " + thenValue + " : " + elseValue + ")";
    }
}
