package com.galois.p4sym;

import java.math.BigInteger;
import com.google.protobuf.ByteString;

import com.galois.p4sym.proto.Protos;

/** This represents a bitvector literal. */
public final class BitvectorValue implements Term {
    private final long width;
    private final BigInteger v;

    /**
     * Create a literal; the value is reduced modulo <code>2^width</code>.
     */
    public BitvectorValue(long width, BigInteger v) {
        if (v == null) throw new NullPointerException("v");
        this.width = width;
        this.v = v.and(mask(width));
    }

    public BitvectorValue(long width, long v) {
        this(width, BigInteger.valueOf(v));
    }

    /** All-ones value of the given width. */
    public static BigInteger mask(long width) {
        return BigInteger.ONE.shiftLeft((int) width).subtract(BigInteger.ONE);
    }

    public Sort sort() {
        return Sort.bitvector(width);
    }

    public long width() {
        return width;
    }

    public BigInteger getValue() {
        return v;
    }

    public Protos.Term getTermRep() {
        return
            Protos.Term.newBuilder()
            .setCode(Protos.TermCode.BitvectorTerm)
            .setSort(sort().getSortRep())
            .setData(ByteString.copyFrom(v.toByteArray()))
            .build();
    }

    public String toString() {
        return "0x" + v.toString(16) + ":[" + String.valueOf(width) + "]";
    }

    public boolean equals(Object o) {
        if (!(o instanceof BitvectorValue)) return false;
        BitvectorValue r = (BitvectorValue) o;
        return (width == r.width) && v.equals(r.v);
    }

    public int hashCode() {
        return ((int) width) ^ v.hashCode();
    }

}
