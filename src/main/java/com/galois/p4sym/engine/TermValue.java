package com.galois.p4sym.engine;

import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;

/** A value that is already a formula term. */
public final class TermValue extends Value {
    private final Term term;

    public TermValue(Term term) {
        if (term == null) throw new NullPointerException("term");
        this.term = term;
    }

    public Kind kind() {
        return Kind.TERM;
    }

    public Term getTerm() {
        return term;
    }

    public Term toTerm(TermBuilder b) {
        return term;
    }

    public String toString() {
        return term.toString();
    }

    public boolean equals(Object o) {
        return o instanceof TermValue && term.equals(((TermValue) o).term);
    }

    public int hashCode() {
        return term.hashCode();
    }
}
