package com.galois.p4sym.engine;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnsupportedValueException;

/**
 * An ordered container of operands.  Resolving a list resolves its
 * elements one by one.
 */
public final class ListValue extends Value {
    private final ImmutableList<Operand> elements;

    public ListValue(List<? extends Operand> elements) {
        this.elements = ImmutableList.copyOf(elements);
    }

    public Kind kind() {
        return Kind.LIST;
    }

    public ImmutableList<Operand> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public Term toTerm(TermBuilder b) {
        throw new UnsupportedValueException(kind().toString(), "as a formula term");
    }

    public String toString() {
        return "[" + Joiner.on(", ").join(elements) + "]";
    }
}
