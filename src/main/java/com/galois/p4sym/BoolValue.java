package com.galois.p4sym;
import com.galois.p4sym.proto.Protos;

/** A Boolean literal as a term. */
public final class BoolValue implements Term {
    final boolean bool;

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);


    /** Create a new value. */
    private BoolValue(boolean bool) {
        this.bool = bool;
    }

    public static BoolValue of(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * Return the sort associated with this value.
     * @return the sort of the Boolean value.
     */
    public Sort sort() {
        return Sort.BOOL;
    }

    /**
     * Return the protocol buffer representation of this value.
     *
     * @return the protocol buffer representation.
     */
    public Protos.Term getTermRep() {
        return
            Protos.Term.newBuilder()
            .setCode(bool ? Protos.TermCode.TrueTerm : Protos.TermCode.FalseTerm)
            .setSort(Sort.BOOL.getSortRep())
            .build();
    }

    /**
     * Return Boolean value.
     *
     * @return the value
     */
    public boolean getValue() {
        return bool;
    }

    /**
     * Return string "true" or "false" based on value.
     *
     * @return string representation.
     */
    public String toString() {
        return bool ? "true" : "false";
    }

    public boolean equals(Object o) {
        if (!(o instanceof BoolValue)) return false;
        return bool == ((BoolValue) o).bool;
    }

    public int hashCode() {
        return bool ? 1231 : 1237;
    }
}
