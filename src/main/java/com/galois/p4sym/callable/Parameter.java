package com.galois.p4sym.callable;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.IntegerValue;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.types.P4Type;

/**
 * A declared parameter.  The type may be <code>null</code> for generic
 * extern parameters.
 */
public final class Parameter {
    private final Direction direction;
    private final String name;
    private final P4Type type;

    public Parameter(Direction direction, String name, P4Type type) {
        this.direction = direction;
        this.name = name;
        this.type = type;
    }

    public Direction getDirection() {
        return direction;
    }

    public String getName() {
        return name;
    }

    public P4Type getType() {
        return type;
    }

    /**
     * Cast an argument to the parameter's type when that type is a
     * Boolean or bitvector.
     */
    Value coerce(TermBuilder b, Value v) {
        if (type == null || (v.kind() != Value.Kind.TERM && v.kind() != Value.Kind.INTEGER)) {
            return v;
        }
        Sort sort = type.sort();
        Term t = v.toTerm(b);
        boolean castable = t.sort().isBitvector() || t.sort().isBool() || t instanceof IntegerValue;
        if ((sort.isBitvector() || sort.isBool()) && castable) {
            return Value.of(BitOps.cast(b, t, sort));
        }
        return v;
    }

    public String toString() {
        return direction.toString().toLowerCase() + " " + (type == null ? "" : type + " ") + name;
    }
}
