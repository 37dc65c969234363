package com.galois.p4sym.expr;

import com.galois.p4sym.engine.LValue;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

/** A reference to a variable or global by name. */
public final class PathExpression implements LValue {
    private final String name;

    public PathExpression(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public String referenceName(ProgramState state) {
        return name;
    }

    public Value evaluate(ProgramState state) {
        return state.resolve(name);
    }

    public String toString() {
        return name;
    }
}
