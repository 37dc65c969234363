package com.galois.p4sym.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnresolvedReferenceException;
import com.galois.p4sym.types.P4Type;

/**
 * An aggregate with named, individually mutable members.  Reading a complex
 * value into a new holder always goes through {@link #copy()}, so two
 * holders never share member storage.
 */
public abstract class ComplexValue extends Value {
    private final String name;
    private final LinkedHashMap<String, Value> members;

    protected ComplexValue(String name, Map<String, Value> members) {
        this.name = name;
        this.members = new LinkedHashMap<String, Value>(members);
    }

    public final Kind kind() {
        return Kind.COMPLEX;
    }

    /** Returns the type this value was instantiated from. */
    public abstract P4Type type();

    /** Returns a value of the same class holding the given members. */
    protected abstract ComplexValue withMembers(String name, Map<String, Value> members);

    /** Name under which the value was instantiated. */
    public String getName() {
        return name;
    }

    public Set<String> memberNames() {
        return members.keySet();
    }

    public boolean hasMember(String member) {
        return members.containsKey(member);
    }

    /**
     * Returns the live member value (not a copy).
     */
    public Value member(String member) {
        Value v = members.get(member);
        if (v == null) {
            throw new UnresolvedReferenceException(name + "." + member);
        }
        return v;
    }

    /**
     * Replace a member, keeping the member's width if it is a bitvector.
     */
    public void setMember(TermBuilder b, String member, Value v) {
        Value previous = member(member);
        members.put(member, Value.conform(b, previous, v));
    }

    /** Assign members in declaration order. */
    public void setMembers(TermBuilder b, List<Value> values) {
        if (values.size() > members.size()) {
            throw new IllegalArgumentException("Too many initializers for " + name + ": " + values.size());
        }
        List<String> names = new ArrayList<String>(members.keySet());
        for (int i = 0; i != values.size(); ++i) {
            setMember(b, names.get(i), values.get(i));
        }
    }

    /**
     * Overwrite every member with the matching field of a struct term.
     */
    public void propagate(TermBuilder b, Term structTerm) {
        Sort sort = structTerm.sort();
        for (String m : new ArrayList<String>(members.keySet())) {
            if (sort.fieldIndex(m) >= 0) {
                setMember(b, m, Value.of(b.structGet(m, structTerm)));
            }
        }
    }

    /** Terms of the members, in the order of the fields of the type's sort. */
    protected List<Term> memberTerms(TermBuilder b) {
        Sort sort = type().sort();
        List<Term> terms = new ArrayList<Term>();
        int i = 0;
        for (Value v : members.values()) {
            terms.add(fit(b, v.toTerm(b), sort.field(i++)));
        }
        return terms;
    }

    protected static Term fit(TermBuilder b, Term t, Sort sort) {
        if (sort.isBitvector() || sort.isBool()) {
            return BitOps.cast(b, t, sort);
        }
        return t;
    }

    public Term toTerm(TermBuilder b) {
        List<Term> terms = memberTerms(b);
        return b.structLiteral(type().sort(), terms.toArray(new Term[terms.size()]));
    }

    public Value copy() {
        LinkedHashMap<String, Value> copied = new LinkedHashMap<String, Value>();
        for (Map.Entry<String, Value> e : members.entrySet()) {
            copied.put(e.getKey(), e.getValue().copy());
        }
        return withMembers(name, copied);
    }

    public String toString() {
        return name + members;
    }
}
