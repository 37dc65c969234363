package com.galois.p4sym.expr;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.Invocable;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

/**
 * A call.  The callee is either a dotted name looked up in the state when
 * the call is evaluated, or an invocable bound at construction.
 */
public final class MethodCallExpression implements Expression {
    private final String calleeName;
    private final Invocable callee;
    private final ImmutableList<Operand> args;
    private final ImmutableMap<String, Operand> namedArgs;

    public MethodCallExpression(String calleeName, List<? extends Operand> args,
                                Map<String, ? extends Operand> namedArgs) {
        this.calleeName = calleeName;
        this.callee = null;
        this.args = ImmutableList.copyOf(args);
        this.namedArgs = ImmutableMap.copyOf(namedArgs);
    }

    public MethodCallExpression(String calleeName, Operand... args) {
        this(calleeName, Arrays.asList(args), new LinkedHashMap<String, Operand>());
    }

    public MethodCallExpression(Invocable callee, List<? extends Operand> args,
                                Map<String, ? extends Operand> namedArgs) {
        this.calleeName = callee.toString();
        this.callee = callee;
        this.args = ImmutableList.copyOf(args);
        this.namedArgs = ImmutableMap.copyOf(namedArgs);
    }

    public MethodCallExpression(Invocable callee, Operand... args) {
        this(callee, Arrays.asList(args), new LinkedHashMap<String, Operand>());
    }

    public Invocable resolveCallee(ProgramState state) {
        if (callee != null) {
            return callee;
        }
        Operand o = state.lookup(calleeName);
        if (!(o instanceof Invocable)) {
            throw new UnsupportedValueException(o.getClass().getSimpleName(), "as the callee of " + calleeName);
        }
        return (Invocable) o;
    }

    public Value evaluate(ProgramState state) {
        return invoke(state, resolveCallee(state));
    }

    /** Invoke an already resolved callee with this call's arguments. */
    public Value invoke(ProgramState state, Invocable target) {
        return target.invoke(state, args, namedArgs);
    }

    public String toString() {
        return calleeName + args + (namedArgs.isEmpty() ? "" : namedArgs.toString());
    }
}
