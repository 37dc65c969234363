package com.galois.p4sym.types;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.p4sym.Sort;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnresolvedReferenceException;
import com.galois.p4sym.engine.Value;

/**
 * An enumeration.  Members are 32-bit literals numbered from 0 in
 * declaration order.
 */
public final class EnumType implements P4Type {
    public static final long WIDTH = 32;

    private final String name;
    private final ImmutableList<String> members;

    public EnumType(String name, List<String> members) {
        this.name = name;
        this.members = ImmutableList.copyOf(members);
    }

    public String name() {
        return name;
    }

    public ImmutableList<String> getMembers() {
        return members;
    }

    public Sort sort() {
        return Sort.bitvector(WIDTH);
    }

    /** Returns the literal of a member. */
    public Value member(String member, TermBuilder b) {
        int idx = members.indexOf(member);
        if (idx < 0) {
            throw new UnresolvedReferenceException(name + "." + member);
        }
        return Value.of(b.bvLiteral(WIDTH, idx));
    }

    public Value instantiate(String instanceName, TermBuilder b) {
        return Value.of(b.freshConstant(instanceName, sort()));
    }

    public String toString() {
        return name;
    }
}
