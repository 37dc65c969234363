package com.galois.p4sym;
import java.math.BigInteger;
import com.google.protobuf.ByteString;
import com.galois.p4sym.proto.Protos;

/**
 * A specific integer term.
 */
public final class IntegerValue implements Term {
    private final BigInteger v;

    public IntegerValue(long i) {
        this.v = BigInteger.valueOf(i);
    }

    public IntegerValue(BigInteger i) {
        if (i == null) throw new NullPointerException("i");
        this.v = i;
    }

    public Sort sort() {
        return Sort.INTEGER;
    }

    public BigInteger getValue() {
        return v;
    }

    public Protos.Term getTermRep() {
        return
            Protos.Term.newBuilder()
            .setCode(Protos.TermCode.IntegerTerm)
            .setSort(Sort.INTEGER.getSortRep())
            .setData(ByteString.copyFrom(v.toByteArray()))
            .build();
    }

    public boolean equals(Object o) {
        if (!(o instanceof IntegerValue)) return false;
        return v.equals(((IntegerValue) o).v);
    }

    /**
     * Returns hash code of integer.
     */
    public int hashCode() {
        return v.hashCode();
    }

    /**
     * Returns decimal representation of string.
     */
    public String toString() {
        return v.toString();
    }
}
