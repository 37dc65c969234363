package com.galois.p4sym.engine;

import java.math.BigInteger;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.BitvectorValue;
import com.galois.p4sym.BoolValue;
import com.galois.p4sym.IntegerValue;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnsupportedValueException;

/**
 * A resolved symbolic value.  Every consumer switches over {@link #kind()};
 * no other runtime type inspection is needed to tell the variants apart.
 */
public abstract class Value implements Operand {
    /** The closed set of value variants. */
    public enum Kind {
        /** A formula term (Boolean, bitvector or struct sorted). */
        TERM,
        /** A machine integer literal not yet given a width. */
        INTEGER,
        /** A struct or header value with individually mutable members. */
        COMPLEX,
        /** An ordered container used while initializing structs. */
        LIST,
        /** A name-to-value container used while initializing structs. */
        MAP
    }

    protected Value() {}

    public abstract Kind kind();

    /**
     * Returns the formula term for this value.
     *
     * @throws UnsupportedValueException if the value has no term form.
     */
    public abstract Term toTerm(TermBuilder b);

    /**
     * Returns a value that can be mutated independently of this one.
     * Immutable variants return themselves.
     */
    public Value copy() {
        return this;
    }

    /** Returns a value wrapping the given term; integer literals become {@link Kind#INTEGER}. */
    public static Value of(Term t) {
        if (t instanceof IntegerValue) {
            return new IntValue(((IntegerValue) t).getValue());
        }
        return new TermValue(t);
    }

    public static Value of(boolean b) {
        return new TermValue(BoolValue.of(b));
    }

    public static Value integer(long i) {
        return new IntValue(BigInteger.valueOf(i));
    }

    public static Value bits(long width, long v) {
        return new TermValue(new BitvectorValue(width, v));
    }

    /**
     * Shape <code>next</code> so it can replace <code>previous</code> in a
     * variable or member.  Bitvector and Boolean slots keep their sort; a
     * complex slot receiving a struct term spreads it over a copy of its
     * members.  Anything else replaces the slot as is.
     */
    public static Value conform(TermBuilder b, Value previous, Value next) {
        if (previous == null) {
            return next;
        }
        switch (previous.kind()) {
        case TERM: {
            Sort sort = previous.toTerm(b).sort();
            if ((sort.isBitvector() || sort.isBool())
                && (next.kind() == Kind.TERM || next.kind() == Kind.INTEGER)) {
                Term t = next.toTerm(b);
                if (t.sort().isBitvector() || t.sort().isBool() || t instanceof IntegerValue) {
                    return Value.of(BitOps.cast(b, t, sort));
                }
            }
            return next;
        }
        case COMPLEX:
            if (next.kind() == Kind.TERM && next.toTerm(b).sort().isStruct()) {
                ComplexValue target = (ComplexValue) previous.copy();
                target.propagate(b, next.toTerm(b));
                return target;
            }
            return next;
        default:
            return next;
        }
    }

}
