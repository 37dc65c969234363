package com.galois.p4sym.engine;

import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnsupportedValueException;

/**
 * A name-to-operand container, in insertion order.
 */
public final class MapValue extends Value {
    private final ImmutableMap<String, Operand> entries;

    public MapValue(Map<String, ? extends Operand> entries) {
        this.entries = ImmutableMap.copyOf(entries);
    }

    public Kind kind() {
        return Kind.MAP;
    }

    public ImmutableMap<String, Operand> getEntries() {
        return entries;
    }

    public Term toTerm(TermBuilder b) {
        throw new UnsupportedValueException(kind().toString(), "as a formula term");
    }

    public String toString() {
        return "{" + Joiner.on(", ").withKeyValueSeparator(": ").join(entries) + "}";
    }
}
