package com.galois.p4sym;
import java.math.BigInteger;

import com.galois.p4sym.proto.Protos;

/**
 * Provides methods for applying primitive operations to values with
 * sort <code>T</code>.
 *
 * It requires subclasses to implement <code>applyPrimitive</code>,
 * and then they can automatically inherit a large set of operations.
 */
public abstract class ValueCreator<T extends Sorted> {
    /**
     * Apply the primitive operation to the given arguments.
     * @param res Sort of result
     */
    protected
    abstract
    T applyPrimitive(Sort res, Protos.PrimitiveOp op, Object... args);

    public abstract T bvLiteral( long width, BigInteger val );
    public abstract T intLiteral( BigInteger val );
    public abstract T boolLiteral( boolean val );

    /**
     * Returns the free variable with the given name and sort.
     */
    public abstract T freshConstant( String name, Sort sort );

    public T intLiteral( long val )
    {
        return intLiteral( BigInteger.valueOf(val) );
    }

    public T bvLiteral( long width, long val )
    {
        return bvLiteral( width, BigInteger.valueOf(val) );
    }

    private static void checkBool(String nm, Sorted x) {
        if (!x.sort().equals(Sort.BOOL))
            throw new UnsupportedOperationException(nm + " expects Boolean arguments, got " + x.sort());
    }

    /** Complement Boolean value. */
    public T not(T x) {
        checkBool("not", x);
        return applyPrimitive(Sort.BOOL, Protos.PrimitiveOp.BoolNot, x);
    }

    /** And two Boolean values. */
    public T and(T x, T y) {
        checkBool("and", x);
        checkBool("and", y);
        return applyPrimitive(Sort.BOOL, Protos.PrimitiveOp.BoolAnd, x, y);
    }

    /**
     * Conjunction of any number of Boolean values; the empty conjunction
     * is <code>true</code>.
     */
    public T and(T[] xs) {
        if (xs.length == 0) return boolLiteral(true);
        T acc = xs[0];
        for (int i = 1; i < xs.length; ++i) {
            acc = and(acc, xs[i]);
        }
        return acc;
    }

    /** Inclusive-or of two Boolean values. */
    public T or(T x, T y) {
        checkBool("or", x);
        checkBool("or", y);
        return applyPrimitive(Sort.BOOL, Protos.PrimitiveOp.BoolOr, x, y);
    }

    /** Exclusive-or of two Boolean values. */
    public T xor(T x, T y) {
        checkBool("xor", x);
        checkBool("xor", y);
        return applyPrimitive(Sort.BOOL, Protos.PrimitiveOp.BoolXor, x, y);
    }

    /**
     * if-then-else applied to values with the same sort.
     */
    public T ite(T c, T x, T y) {
        if (!c.sort().equals(Sort.BOOL))
            throw new UnsupportedOperationException("ite expects Boolean condition.");
        Sort sort = x.sort();
        if (!sort.equals(y.sort()))
            throw new UnsupportedOperationException("ite expects cases to have same sort: "
                                                    + sort + " " + y.sort());
        return applyPrimitive(sort, Protos.PrimitiveOp.Ite, c, x, y);
    }

    /**
     * Check if values are equal.
     * @param x first value
     * @param y second value
     * @return boolean value
     */
    public T eq(T x, T y) {
        Sort x_sort = x.sort();
        Sort y_sort = y.sort();
        if (!x_sort.equals(y_sort)) {
            throw new UnsupportedOperationException("Values to eq must have same sort: "
                                                    + x_sort + " " + y_sort);
        }
        return applyPrimitive(Sort.BOOL, Protos.PrimitiveOp.Eq, x, y);
    }

    // ************** Integer ops ***************

    private T intbinop( Protos.PrimitiveOp op, Sort res, T x, T y )
    {
        if( !(x.sort().isInteger() && y.sort().isInteger()) ) {
            throw new UnsupportedOperationException("integer operation given unsupported sorts " +
                                                    x.sort() + " " + y.sort() );
        }
        return applyPrimitive( res, op, x, y );
    }

    public T intAdd( T x, T y ) {
        return intbinop( Protos.PrimitiveOp.IntegerAdd, Sort.INTEGER, x, y );
    }

    // ************** Bitvector ops ***************


    /**
     * Apply a binary operation on bitvectors.  The two expressions
     * must both be of the same bitvector sort, and the result is of the same sort.
     */
    private T bvbinop( Protos.PrimitiveOp op, T x, T y )
    {
        Sort x_sort = x.sort();
        Sort y_sort = y.sort();

        if( !(x_sort.isBitvector() && x_sort.equals(y_sort) ) ) {
            throw new UnsupportedOperationException("binary bitvector operation given unsupported sorts " +
                                                    x_sort.toString() + " " + y_sort.toString() );
        }

        return applyPrimitive( x_sort, op, x, y );
    }

    /**
     *  Apply a binary comparison operator to bitvectors.  The two expressions
     *  must both be of the same bitvector sort.
     */
    private T bvcmpop( Protos.PrimitiveOp op, T x, T y )
    {
        Sort x_sort = x.sort();
        Sort y_sort = y.sort();

        if( !(x_sort.isBitvector() && x_sort.equals(y_sort) ) ) {
            throw new UnsupportedOperationException("binary bitvector comparison operation given unsupported sorts " +
                                                    x_sort.toString() + " " + y_sort.toString() );
        }

        return applyPrimitive( Sort.BOOL, op, x, y );
    }

    private T bvunop( Protos.PrimitiveOp op, T x )
    {
        Sort x_sort = x.sort();
        if( !(x_sort.isBitvector()) ) {
            throw new UnsupportedOperationException(op.name() + " given unsupported sort " +
                                                    x_sort.toString() );
        }
        return applyPrimitive( x_sort, op, x );
    }

    /**
     * Bitvector addition.
     * @param x
     * @param y
     */
    public T bvAdd( T x, T y ) {
        return bvbinop( Protos.PrimitiveOp.BVAdd, x, y );
    }

    /**
     * Bitvector subtraction.
     * @param x
     * @param y
     */
    public T bvSub( T x, T y ) {
        return bvbinop( Protos.PrimitiveOp.BVSub, x, y );
    }

    /**
     * Bitvector multiplication.
     * @param x
     * @param y
     */
    public T bvMul( T x, T y ) {
        return bvbinop( Protos.PrimitiveOp.BVMul, x, y );
    }

    /**
     * Bitvector unsigned division
     * @param x
     * @param y
     */
    public T bvUdiv( T x, T y ) {
        return bvbinop( Protos.PrimitiveOp.BVUdiv, x, y );
    }

    /**
     * Bitvector unsigned remainder
     * @param x
     * @param y
     */
    public T bvUrem( T x, T y ) {
        return bvbinop( Protos.PrimitiveOp.BVUrem, x, y );
    }

    /**
     * Two's complement negation.
     */
    public T bvNeg( T x ) {
        return bvunop( Protos.PrimitiveOp.BVNeg, x );
    }

    /**
     * Unsigned less-than-or-equal test.
     * @param x
     * @param y
     * @return true iff x &lt;= y when x and y are interpreted as unsigned values
     */
    public T bvUle( T x, T y ) {
        return bvcmpop( Protos.PrimitiveOp.BVUle, x, y );
    }

    /**
     * Unsigned less-than test.
     * @param x
     * @param y
     * @return true iff x &lt; y when x and y are interpreted as unsigned values
     */
    public T bvUlt( T x, T y ) {
        return bvcmpop( Protos.PrimitiveOp.BVUlt, x, y );
    }

    public T bvUge( T x, T y ) {
        return bvUle( y, x );
    }

    public T bvUgt( T x, T y ) {
        return bvUlt( y, x );
    }

    /**
     * Shift left.
     * @param x
     * @param y
     * @return The value x shifted left by y bits.  Zeros are shifted into the least significant bits.
     */
    public T bvShl( T x, T y ) {
        return bvbinop( Protos.PrimitiveOp.BVShl, x, y );
    }

    /**
     * Logical shift right.
     * @param x
     * @param y
     * @return The value x shifted right by y bits.  Zeros are shifted into the most significant bits.
     */
    public T bvLshr( T x, T y ) {
        return bvbinop( Protos.PrimitiveOp.BVLshr, x, y );
    }

    /**
     * Bitwise logical negation.
     * @param x
     * @return bitvector value with every bit flipped from x
     */
    public T bvNot( T x ) {
        return bvunop( Protos.PrimitiveOp.BVNot, x );
    }

    /**
     * Bitwise logical conjunction.
     * @param x
     * @param y
     */
    public T bvAnd( T x, T y ) {
        return bvbinop(Protos.PrimitiveOp.BVAnd, x, y );
    }

    /**
     * Bitwise logical disjunction.
     * @param x
     * @param y
     */
    public T bvOr( T x, T y ) {
        return bvbinop(Protos.PrimitiveOp.BVOr, x, y );
    }

    /**
     * Bitwise logical exclusive or.
     * @param x
     * @param y
     */
    public T bvXor( T x, T y ) {
        return bvbinop(Protos.PrimitiveOp.BVXor, x, y );
    }

    /**
     * Zero-extend a bitvector to the given width.  The target width must be
     * no less than the width of x.
     * @param x the value to extend
     * @param w the target width
     * @return x zero-extended to w bits
     */
    public T bvZext( T x, long w ) {
        Sort x_sort = x.sort();
        if( !(x_sort.isBitvector()) ) {
            throw new UnsupportedOperationException("bvZext given unsupported sort " +
                                                    x_sort.toString() );
        }

        if( !(x_sort.width() <= w) ) {
            throw new UnsupportedOperationException("invalid zero extension of sort " +
                                                    x_sort.toString() + " to length " + w );
        }

        return applyPrimitive( Sort.bitvector(w), Protos.PrimitiveOp.BVZext, x );
    }

    /**
     * Select a subsequence from a bitvector.  Take <code>n</code> bits starting at index <code>idx</code>
     * (counting from the least-significant bit as 0) from the bitvector <code>x</code>.  <code>x</code> must
     * be a bitvector with width at least <code>idx + n </code>.
     * @param idx the index to begin selecting bits (least significant bit is 0)
     * @param n the number of bits to take
     * @param x the bitvector from which to select
     * @return the n-bit subsequence of x starting at idx
     */
    public T bvSelect( long idx, long n, T x ) {
        Sort x_sort = x.sort();

        if( !(x_sort.isBitvector()) ) {
            throw new UnsupportedOperationException("bvSelect given unsupported sort " +
                                                    x_sort.toString() );
        }

        if( !(0 <= idx && 0 < n && idx + n <= x_sort.width() ) ) {
            throw new UnsupportedOperationException("bvSelect subsequence out of bounds " +
                                                    idx + " " + n + " " + x_sort.toString() );
        }

        return applyPrimitive( Sort.bitvector( n ),
                               Protos.PrimitiveOp.BVSelect,
                               intLiteral(idx),
                               intLiteral(n),
                               x );
    }

    /**
     * Extract the bits <code>[high:low]</code> (both inclusive) of a bitvector.
     */
    public T bvExtract( long high, long low, T x ) {
        return bvSelect( low, high - low + 1, x );
    }

    /**
     * Concatenate two bitvectors
     * @param x high-order bitvector of width m
     * @param y low-order bitvector of width n
     * @return concatenated bitvector of width (m+n)
     */
    public T bvConcat( T x, T y ) {
        Sort x_sort = x.sort();
        Sort y_sort = y.sort();
        if( !(x_sort.isBitvector() && y_sort.isBitvector()) ) {
            throw new UnsupportedOperationException("bvConcat given unsupported sorts " +
                                                    x_sort.toString() + " " + y_sort.toString() );
        }

        Sort ret_sort = Sort.bitvector( x_sort.width() + y_sort.width() );

        return applyPrimitive( ret_sort, Protos.PrimitiveOp.BVConcat, x, y );
    }

    /**
     * Concatenate a sequence of bitvectors together in bigendian format.  That is,
     * index 0 contains the high order bits and index (N-1) contains the low-order bits.
     * If xs contains 1 element, it is returned unchanged.
     * @param xs An array of bitvectors to concatenate
     * @return concatenated bitvector
     */
    public T bvConcat( T[] xs ) {
        if( xs.length == 0 ) {
            throw new UnsupportedOperationException("bvConcat needs at least one bitvector");
        }

        int i = xs.length - 1;
        T acc = xs[i];
        while( i > 0 ) {
            i--;
            acc = bvConcat( xs[i], acc );
        }

        return acc;
    }

    public T boolToBV( T x, long width ) {
        Sort x_sort = x.sort();
        if( !x_sort.equals( Sort.BOOL ) ) {
            throw new UnsupportedOperationException("boolToBV given unsupported sort " +
                                                    x_sort.toString() );
        }

        if( !(width > 0) ) {
            throw new UnsupportedOperationException("boolToBV given non-positive width " + width);
        }

        return applyPrimitive( Sort.bitvector(width), Protos.PrimitiveOp.BoolToBV, x );
    }

    // ******************* Struct Ops *****************************************
    public T structLiteral( Sort sort, T... vals ) {
        if( !(sort.isStruct()) ) {
            throw new UnsupportedOperationException("Expected struct sort in structLiteral, but got " + sort);
        }
        if( sort.fieldCount() != vals.length ) {
            throw new UnsupportedOperationException("structLiteral for " + sort + " expects "
                                                    + sort.fieldCount() + " fields, got " + vals.length);
        }
        for( int i=0; i<vals.length; i++ ) {
            if( !sort.field(i).equals( vals[i].sort() ) ) {
                throw new UnsupportedOperationException("Sort mismatch in structLiteral field "
                                                        + sort.fieldName(i) + ": expected "
                                                        + sort.field(i) + ", got " + vals[i].sort());
            }
        }

        return applyPrimitive( sort, Protos.PrimitiveOp.StructLiteral, (Object[]) vals );
    }

    public T structGet( int idx, T struct ) {
        Sort s_sort = struct.sort();
        if( !(s_sort.isStruct() ) ) {
            throw new UnsupportedOperationException("Expected struct value in structGet, but got " + s_sort.toString());
        }

        Sort retSort = s_sort.field( idx );

        return applyPrimitive( retSort, Protos.PrimitiveOp.StructGet, intLiteral(idx), struct );
    }

    public T structGet( String field, T struct ) {
        int idx = struct.sort().isStruct() ? struct.sort().fieldIndex(field) : -1;
        if( idx < 0 ) {
            throw new UnsupportedOperationException("No field " + field + " in " + struct.sort());
        }
        return structGet( idx, struct );
    }
}
