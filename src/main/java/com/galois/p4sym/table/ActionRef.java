package com.galois.p4sym.table;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.p4sym.engine.Operand;

/**
 * An action named in a table together with the arguments bound in the
 * table declaration.  Remaining parameters are supplied by the control
 * plane and become fresh values.
 */
public final class ActionRef {
    private final String name;
    private final ImmutableList<Operand> args;

    public ActionRef(String name, List<? extends Operand> args) {
        this.name = name;
        this.args = ImmutableList.copyOf(args);
    }

    public ActionRef(String name, Operand... args) {
        this(name, Arrays.asList(args));
    }

    public String getName() {
        return name;
    }

    public ImmutableList<Operand> getArgs() {
        return args;
    }

    public String toString() {
        return name + args;
    }
}
