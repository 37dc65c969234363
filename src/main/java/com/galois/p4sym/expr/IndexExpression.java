package com.galois.p4sym.expr;

import java.math.BigInteger;

import com.galois.p4sym.BitvectorValue;
import com.galois.p4sym.Term;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.engine.IntValue;
import com.galois.p4sym.engine.LValue;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

/**
 * <code>base[index]</code> on a stack of headers, which is a complex value
 * whose members are named <code>0</code>, <code>1</code>, and so on.  The
 * index must resolve to a literal.
 */
public final class IndexExpression implements LValue {
    private final LValue base;
    private final Operand index;

    public IndexExpression(LValue base, Operand index) {
        this.base = base;
        this.index = index;
    }

    public String referenceName(ProgramState state) {
        Value v = state.resolve(index);
        BigInteger i;
        if (v.kind() == Value.Kind.INTEGER) {
            i = ((IntValue) v).getValue();
        } else {
            Term t = v.toTerm(state.builder());
            if (!(t instanceof BitvectorValue)) {
                throw new UnsupportedValueException(t.sort().toString(), "as a symbolic index into " + base);
            }
            i = ((BitvectorValue) t).getValue();
        }
        return base.referenceName(state) + "." + i;
    }

    public Value evaluate(ProgramState state) {
        return state.resolve(referenceName(state));
    }

    public String toString() {
        return base + "[" + index + "]";
    }
}
