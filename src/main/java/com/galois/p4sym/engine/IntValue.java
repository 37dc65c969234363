package com.galois.p4sym.engine;

import java.math.BigInteger;

import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;

/**
 * An integer literal without a width.  It becomes a bitvector once it meets
 * a bitvector operand, a cast or a typed slot.
 */
public final class IntValue extends Value {
    private final BigInteger v;

    public IntValue(BigInteger v) {
        if (v == null) throw new NullPointerException("v");
        this.v = v;
    }

    public Kind kind() {
        return Kind.INTEGER;
    }

    public BigInteger getValue() {
        return v;
    }

    public Term toTerm(TermBuilder b) {
        return b.intLiteral(v);
    }

    public String toString() {
        return v.toString();
    }

    public boolean equals(Object o) {
        return o instanceof IntValue && v.equals(((IntValue) o).v);
    }

    public int hashCode() {
        return v.hashCode();
    }
}
