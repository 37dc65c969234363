package com.galois.p4sym.expr;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

/**
 * Bits <code>[high:low]</code> of a value.  Integer literals are sliced as
 * 64-bit values.
 */
public final class SliceExpression implements Expression {
    private final Operand base;
    private final long high;
    private final long low;

    public SliceExpression(Operand base, long high, long low) {
        if (low < 0 || high < low) {
            throw new IllegalArgumentException("Invalid slice [" + high + ":" + low + "]");
        }
        this.base = base;
        this.high = high;
        this.low = low;
    }

    public Operand getBase() {
        return base;
    }

    public long getHigh() {
        return high;
    }

    public long getLow() {
        return low;
    }

    public Value evaluate(ProgramState state) {
        TermBuilder b = state.builder();
        return Value.of(b.bvExtract(high, low, BitOps.asBitvector(b, state.resolveTerm(base))));
    }

    public String toString() {
        return base + "[" + high + ":" + low + "]";
    }
}
