package com.galois.p4sym.expr;

import com.galois.p4sym.Term;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.engine.ComplexValue;
import com.galois.p4sym.engine.LValue;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

/**
 * <code>base.member</code>.  When the base denotes storage the member is
 * resolved through the composed dotted reference, so the same node also
 * serves as an assignment target.
 */
public final class MemberExpression implements LValue {
    private final Operand base;
    private final String member;

    public MemberExpression(Operand base, String member) {
        this.base = base;
        this.member = member;
    }

    public Operand getBase() {
        return base;
    }

    public String getMember() {
        return member;
    }

    public String referenceName(ProgramState state) {
        if (!(base instanceof LValue)) {
            throw new UnsupportedValueException(base.getClass().getSimpleName(), "as an assignment target");
        }
        return ((LValue) base).referenceName(state) + "." + member;
    }

    public Value evaluate(ProgramState state) {
        if (base instanceof LValue) {
            return state.resolve(referenceName(state));
        }
        Value v = state.resolve(base);
        if (v instanceof ComplexValue) {
            return ((ComplexValue) v).member(member).copy();
        }
        Term t = v.toTerm(state.builder());
        return Value.of(state.builder().structGet(member, t));
    }

    public String toString() {
        return base + "." + member;
    }
}
