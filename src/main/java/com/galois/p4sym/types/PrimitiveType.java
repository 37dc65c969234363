package com.galois.p4sym.types;

import com.galois.p4sym.Sort;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Value;

/**
 * Booleans, fixed-width bitvectors and unbounded integers.
 */
public final class PrimitiveType implements P4Type {
    public static final PrimitiveType BOOL = new PrimitiveType("bool", Sort.BOOL);
    public static final PrimitiveType INTEGER = new PrimitiveType("int", Sort.INTEGER);

    private final String name;
    private final Sort sort;

    private PrimitiveType(String name, Sort sort) {
        this.name = name;
        this.sort = sort;
    }

    /** Type <code>bit&lt;width&gt;</code>. */
    public static PrimitiveType bits(long width) {
        return new PrimitiveType("bit<" + width + ">", Sort.bitvector(width));
    }

    /**
     * Returns the primitive type for a Boolean, integer or bitvector sort.
     */
    public static PrimitiveType of(Sort sort) {
        if (sort.isBool()) return BOOL;
        if (sort.isInteger()) return INTEGER;
        if (sort.isBitvector()) return bits(sort.width());
        throw new IllegalArgumentException("Not a primitive sort: " + sort);
    }

    public String name() {
        return name;
    }

    public Sort sort() {
        return sort;
    }

    public Value instantiate(String instanceName, TermBuilder b) {
        return Value.of(b.freshConstant(instanceName, sort));
    }

    public String toString() {
        return name;
    }

    public boolean equals(Object o) {
        return o instanceof PrimitiveType && sort.equals(((PrimitiveType) o).sort);
    }

    public int hashCode() {
        return sort.hashCode();
    }
}
