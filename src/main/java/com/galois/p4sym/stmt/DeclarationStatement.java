package com.galois.p4sym.stmt;

import com.galois.p4sym.MissingNodeException;
import com.galois.p4sym.Term;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;
import com.galois.p4sym.types.P4Type;

/**
 * Introduces a local.  The initializer is stored as is and resolved when
 * the local is read; without one the local is an unconstrained instance of
 * its type.
 */
public final class DeclarationStatement implements Statement {
    private final String name;
    private final P4Type type;
    private final Operand init;

    public DeclarationStatement(String name, P4Type type, Operand init) {
        this.name = name;
        this.type = type;
        this.init = init;
    }

    public DeclarationStatement(String name, Operand init) {
        this(name, null, init);
    }

    public DeclarationStatement(String name, P4Type type) {
        this(name, type, null);
    }

    public Term execute(ProgramState state) {
        if (init != null) {
            state.declareVar(name, init);
        } else if (type != null) {
            state.declareVar(name, state.getRegistry().instantiate(name, type));
        } else {
            throw new MissingNodeException("Declaration of " + name + " has neither a type nor a value.");
        }
        return null;
    }

    public String toString() {
        return (type == null ? "" : type + " ") + name + (init == null ? "" : " = " + init);
    }
}
