package com.galois.p4sym.expr;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.types.P4Type;

/**
 * Cast to a Boolean or bitvector type.  There is no sign extension.
 */
public final class CastExpression implements Expression {
    private final P4Type target;
    private final Operand operand;

    public CastExpression(P4Type target, Operand operand) {
        this.target = target;
        this.operand = operand;
    }

    public Value evaluate(ProgramState state) {
        return Value.of(BitOps.cast(state.builder(), state.resolveTerm(operand), target.sort()));
    }

    public String toString() {
        return "(" + target + ") " + operand;
    }
}
