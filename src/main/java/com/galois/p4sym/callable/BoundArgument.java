package com.galois.p4sym.callable;

import com.galois.p4sym.engine.Operand;

/** An argument paired with the parameter it binds to. */
public final class BoundArgument {
    private final Parameter parameter;
    private final Operand argument;

    public BoundArgument(Parameter parameter, Operand argument) {
        this.parameter = parameter;
        this.argument = argument;
    }

    public Parameter getParameter() {
        return parameter;
    }

    public Operand getArgument() {
        return argument;
    }

    public String toString() {
        return parameter.getName() + "=" + argument;
    }
}
