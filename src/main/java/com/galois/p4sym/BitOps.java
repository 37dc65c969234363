package com.galois.p4sym;

/**
 * Bit-precise operations shared by expressions, assignments and parameter
 * passing: casting, slice assignment, width alignment and concatenation.
 *
 * <p>
 * Integer literals (terms of sort {@link Sort#INTEGER} that are
 * {@link IntegerValue}s) are accepted wherever a bitvector is expected and
 * are materialized at the width the context requires.
 */
public final class BitOps {
    private BitOps() {}

    /** Width assumed for an integer literal that is sliced or spliced. */
    public static final long DEFAULT_INTEGER_WIDTH = 64;

    /**
     * Cast a term to a bitvector of the given width.  Booleans become the
     * 1-bit values 1 and 0 first; narrower bitvectors are zero-extended and
     * wider ones keep their low <code>width</code> bits.
     */
    public static Term cast(TermBuilder b, Term val, long width) {
        if (val.sort().isBool()) {
            val = b.boolToBV(val, 1);
        }
        if (val instanceof IntegerValue) {
            return b.bvLiteral(width, ((IntegerValue) val).getValue());
        }
        Sort sort = val.sort();
        if (!sort.isBitvector()) {
            throw new UnsupportedOperationException("Cannot cast " + val + " of sort " + sort
                                                    + " to a bitvector.");
        }
        if (sort.width() < width) {
            return b.bvZext(val, width);
        } else if (sort.width() > width) {
            return b.bvExtract(width - 1, 0, val);
        }
        return val;
    }

    /**
     * Cast a term to a Boolean by comparing it with the 1-bit value 1.
     */
    public static Term castToBool(TermBuilder b, Term val) {
        if (val.sort().isBool()) {
            return val;
        }
        return b.eq(cast(b, val, 1), b.bvLiteral(1, 1));
    }

    /**
     * Cast a term to the given sort.  Only Boolean and bitvector targets
     * change the term; any other target requires the sorts to agree.
     */
    public static Term cast(TermBuilder b, Term val, Sort target) {
        if (target.isBool()) {
            return castToBool(b, val);
        } else if (target.isBitvector()) {
            return cast(b, val, target.width());
        } else if (!val.sort().equals(target)) {
            throw new UnsupportedOperationException("Cannot cast " + val + " to " + target);
        }
        return val;
    }

    /** Returns the term as a bitvector, giving integer literals the default width. */
    public static Term asBitvector(TermBuilder b, Term val) {
        if (val instanceof IntegerValue) {
            return cast(b, val, DEFAULT_INTEGER_WIDTH);
        }
        if (!val.sort().isBitvector()) {
            throw new UnsupportedOperationException("Expected a bitvector, got " + val.sort());
        }
        return val;
    }

    /**
     * Overwrite bits <code>[high:low]</code> of <code>container</code> with
     * <code>rhs</code>, which is cast to exactly <code>high - low + 1</code>
     * bits.  A slice spanning the whole container replaces it.
     */
    public static Term sliceAssign(TermBuilder b, Term container, Term rhs, long high, long low) {
        container = asBitvector(b, container);
        long max = container.sort().width() - 1;
        if (!(0 <= low && low <= high && high <= max)) {
            throw new UnsupportedOperationException("Slice [" + high + ":" + low
                                                    + "] out of bounds for " + container.sort());
        }
        if (high == max && low == 0) {
            return cast(b, rhs, container.sort().width());
        }
        Term middle = cast(b, rhs, high - low + 1);
        Term result = middle;
        if (low > 0) {
            result = b.bvConcat(result, b.bvExtract(low - 1, 0, container));
        }
        if (high < max) {
            result = b.bvConcat(b.bvExtract(max, high + 1, container), result);
        }
        return result;
    }

    /**
     * Align two operands of a binary operation.  The narrower of two
     * bitvectors is zero-extended; an integer literal takes the width of a
     * bitvector partner.  Other combinations are returned unchanged.
     */
    public static Term[] align(TermBuilder b, Term x, Term y) {
        Sort xs = x.sort();
        Sort ys = y.sort();
        if (xs.isBitvector() && ys.isBitvector()) {
            if (xs.width() < ys.width()) {
                x = cast(b, x, ys.width());
            } else if (xs.width() > ys.width()) {
                y = cast(b, y, xs.width());
            }
        } else if (xs.isBitvector() && y instanceof IntegerValue) {
            y = cast(b, y, xs.width());
        } else if (ys.isBitvector() && x instanceof IntegerValue) {
            x = cast(b, x, ys.width());
        }
        return new Term[] { x, y };
    }

    /**
     * Concatenate two bitvectors; <code>high</code> supplies the most
     * significant bits.
     */
    public static Term concat(TermBuilder b, Term high, Term low) {
        if (high.sort().isBool()) high = cast(b, high, 1);
        if (low.sort().isBool()) low = cast(b, low, 1);
        return b.bvConcat(asBitvector(b, high), asBitvector(b, low));
    }
}
