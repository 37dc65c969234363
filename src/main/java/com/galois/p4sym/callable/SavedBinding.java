package com.galois.p4sym.callable;

import com.galois.p4sym.engine.Operand;

/**
 * The caller's binding of a parameter name before a call, together with the
 * caller-side argument that receives the value of an out or inout
 * parameter.  A <code>null</code> previous binding means the name was
 * unbound and is deleted again on return.
 */
final class SavedBinding {
    final Parameter parameter;
    final Operand target;
    final Operand previous;

    SavedBinding(Parameter parameter, Operand target, Operand previous) {
        this.parameter = parameter;
        this.target = target;
        this.previous = previous;
    }

    String name() {
        return parameter.getName();
    }
}
