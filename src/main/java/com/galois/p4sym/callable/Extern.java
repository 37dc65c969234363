package com.galois.p4sym.callable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;

import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.engine.ComplexValue;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramRegistry;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.TermValue;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.stmt.AssignmentStatement;
import com.galois.p4sym.stmt.BlockStatement;
import com.galois.p4sym.types.P4Type;
import com.galois.p4sym.types.PrimitiveType;

/**
 * A black-box function or object.  Its effects are modelled by fresh
 * values: every out or inout argument receives the constant
 * <code>{extern}_{parameter}</code> and the return value is the constant
 * named by {@link #returnName}, so that two calls with the same inputs
 * return the same unknown.
 */
public class Extern extends Callable {
    private final P4Type returnType;
    private final Map<String, Extern> methods = new LinkedHashMap<String, Extern>();

    public Extern(String name, P4Type returnType) {
        super(name, new BlockStatement());
        this.returnType = returnType;
    }

    public Extern(String name) {
        this(name, null);
    }

    public P4Type getReturnType() {
        return returnType;
    }

    /** Add a method reachable as <code>{extern}.{method}</code>. */
    public Extern addMethod(String methodName, Extern method) {
        methods.put(methodName, method);
        return this;
    }

    public Operand member(String member) {
        Extern m = methods.get(member);
        return m != null ? m : super.member(member);
    }

    /**
     * Name of the value returned for the given inputs: the extern's name
     * followed by the canonical rendering of each input value.
     */
    public static String returnName(String extern, List<Value> inputs, TermBuilder b) {
        List<String> parts = new ArrayList<String>();
        parts.add(extern);
        for (Value v : inputs) {
            parts.add(v.toTerm(b).toString());
        }
        return Joiner.on('_').join(parts);
    }

    protected Value call(ProgramState state, List<BoundArgument> bound) {
        ProgramRegistry registry = state.getRegistry();
        List<Value> inputs = new ArrayList<Value>();
        for (BoundArgument b : bound) {
            if (b.getParameter().getDirection() != Direction.OUT) {
                inputs.add(state.resolve(b.getArgument()));
            }
        }
        for (BoundArgument b : bound) {
            Parameter p = b.getParameter();
            if (p.getDirection().copiesOut()) {
                P4Type type = p.getType() != null ? p.getType() : typeOf(state.resolve(b.getArgument()));
                Value fresh = registry.instantiate(getName() + "_" + p.getName(), type);
                AssignmentStatement.assign(state, b.getArgument(), fresh);
            }
        }
        if (returnType != null) {
            return registry.instantiate(returnName(getName(), inputs, state.builder()), returnType);
        }
        return Value.of(state.getFormula());
    }

    private static P4Type typeOf(Value v) {
        switch (v.kind()) {
        case TERM:
            return PrimitiveType.of(((TermValue) v).getTerm().sort());
        case COMPLEX:
            return ((ComplexValue) v).type();
        default:
            throw new UnsupportedValueException(v.kind().toString(), "as a generic extern argument");
        }
    }

    public boolean consumesContinuation() {
        return false;
    }
}
