package com.galois.p4sym.stmt;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.LValue;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.expr.SliceExpression;

/**
 * <code>target = value</code>.  The right-hand side is resolved before it
 * is stored.  The target may be a slice, in which case only the selected
 * bits change.
 */
public final class AssignmentStatement implements Statement {
    private final Operand target;
    private final Operand value;

    public AssignmentStatement(Operand target, Operand value) {
        this.target = target;
        this.value = value;
    }

    public Term execute(ProgramState state) {
        assign(state, target, state.resolve(value));
        return null;
    }

    /**
     * Store an already resolved value into an assignment target.  Nested
     * slices such as <code>x[7:4][1:0]</code> are flattened into a single
     * slice of the innermost base.
     *
     * @throws MalformedProgramException if the target does not denote storage.
     */
    public static void assign(ProgramState state, Operand target, Value value) {
        if (!(target instanceof SliceExpression)) {
            if (!(target instanceof LValue)) {
                throw new MalformedProgramException("Cannot assign to " + target);
            }
            state.setOrAddVar(((LValue) target).referenceName(state), value);
            return;
        }
        SliceExpression slice = (SliceExpression) target;
        long high = slice.getHigh();
        long low = slice.getLow();
        Operand base = slice.getBase();
        while (base instanceof SliceExpression) {
            SliceExpression inner = (SliceExpression) base;
            if (inner.getLow() + high > inner.getHigh()) {
                throw new MalformedProgramException("Slice " + target + " exceeds " + inner);
            }
            high += inner.getLow();
            low += inner.getLow();
            base = inner.getBase();
        }
        if (!(base instanceof LValue)) {
            throw new MalformedProgramException("Cannot assign to " + target);
        }
        String ref = ((LValue) base).referenceName(state);
        TermBuilder b = state.builder();
        Term container = state.resolve(ref).toTerm(b);
        state.setOrAddVar(ref, Value.of(BitOps.sliceAssign(b, container, value.toTerm(b), high, low)));
    }

    public String toString() {
        return target + " = " + value;
    }
}
