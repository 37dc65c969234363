package com.galois.p4sym.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.engine.ComplexValue;
import com.galois.p4sym.engine.ListValue;
import com.galois.p4sym.engine.MapValue;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.types.StructType;

/**
 * Builds a struct or header value from a list (positional) or a map (by
 * field name).  Fields that are not initialized stay unconstrained.
 */
public final class StructInitializer implements Expression {
    private final StructType type;
    private final Operand init;

    public StructInitializer(StructType type, Operand init) {
        this.type = type;
        this.init = init;
    }

    public Value evaluate(ProgramState state) {
        TermBuilder b = state.builder();
        Value v = state.resolve(init);
        ComplexValue result = (ComplexValue) type.instantiate(type.name(), b);
        switch (v.kind()) {
        case LIST: {
            // The list was resolved above, so every element is a value.
            List<Value> elements = new ArrayList<Value>();
            for (Operand e : ((ListValue) v).getElements()) {
                elements.add((Value) e);
            }
            result.setMembers(b, elements);
            return result;
        }
        case MAP:
            for (Map.Entry<String, Operand> e : ((MapValue) v).getEntries().entrySet()) {
                result.setMember(b, e.getKey(), (Value) e.getValue());
            }
            return result;
        case COMPLEX:
            return v;
        case TERM:
            result.propagate(b, v.toTerm(b));
            return result;
        default:
            throw new UnsupportedValueException(v.kind().toString(), "to initialize " + type);
        }
    }

    public String toString() {
        return type + "(" + init + ")";
    }
}
