package com.galois.p4sym;
import com.galois.p4sym.proto.Protos;

/**
 * A free variable of a formula.  Two constants are the same variable
 * exactly when their names and sorts agree, so naming a constant
 * deterministically is how repeated evaluations refer to the same unknown.
 */
public final class FreshConstant implements Term {
    private final String name;
    private final Sort sort;

    public FreshConstant(String name, Sort sort) {
        if (name == null) throw new NullPointerException("name");
        if (sort == null) throw new NullPointerException("sort");
        this.name = name;
        this.sort = sort;
    }

    public String getName() {
        return name;
    }

    public Sort sort() {
        return sort;
    }

    public Protos.Term getTermRep() {
        return
            Protos.Term.newBuilder()
            .setCode(Protos.TermCode.ConstantTerm)
            .setSort(sort.getSortRep())
            .setName(name)
            .build();
    }

    public String toString() {
        return name;
    }

    public boolean equals(Object o) {
        if (!(o instanceof FreshConstant)) return false;
        FreshConstant r = (FreshConstant) o;
        return name.equals(r.name) && sort.equals(r.sort);
    }

    public int hashCode() {
        return name.hashCode() * 31 + sort.hashCode();
    }
}
