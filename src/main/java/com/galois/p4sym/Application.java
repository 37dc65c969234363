package com.galois.p4sym;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import com.galois.p4sym.proto.Protos;

/**
 * A primitive operation applied to argument terms.
 */
public final class Application implements Term {
    private final Protos.PrimitiveOp op;
    private final Sort sort;
    private final ImmutableList<Term> args;

    Application(Protos.PrimitiveOp op, Sort sort, Term... args) {
        if (op == null) throw new NullPointerException("op");
        if (sort == null) throw new NullPointerException("sort");
        this.op = op;
        this.sort = sort;
        this.args = ImmutableList.copyOf(args);
    }

    public Protos.PrimitiveOp getOp() {
        return op;
    }

    public Sort sort() {
        return sort;
    }

    public List<Term> getArgs() {
        return args;
    }

    public Term getArg(int i) {
        return args.get(i);
    }

    public Protos.Term getTermRep() {
        Protos.Term.Builder b
            = Protos.Term.newBuilder()
            .setCode(Protos.TermCode.ApplicationTerm)
            .setSort(sort.getSortRep())
            .setOp(op);
        for (Term arg : args) {
            b.addArg(arg.getTermRep());
        }
        return b.build();
    }

    public String toString() {
        return "(" + op.name() + " " + Joiner.on(' ').join(args) + ")";
    }

    public boolean equals(Object o) {
        if (!(o instanceof Application)) return false;
        Application r = (Application) o;
        return op == r.op && sort.equals(r.sort) && args.equals(r.args);
    }

    public int hashCode() {
        return (op.hashCode() * 31 + sort.hashCode()) * 31 + args.hashCode();
    }
}
