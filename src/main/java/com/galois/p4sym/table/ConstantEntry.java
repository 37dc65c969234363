package com.galois.p4sym.table;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.p4sym.engine.Operand;

/**
 * An entry of a table's constant entry list: one literal (or
 * {@link Wildcard#DONT_CARE}) per key, and the action it selects.
 */
public final class ConstantEntry {
    private final ImmutableList<Operand> keys;
    private final ActionRef action;

    public ConstantEntry(List<? extends Operand> keys, ActionRef action) {
        this.keys = ImmutableList.copyOf(keys);
        this.action = action;
    }

    public ImmutableList<Operand> getKeys() {
        return keys;
    }

    public ActionRef getAction() {
        return action;
    }

    public static boolean isWildcard(Operand key) {
        return key == Wildcard.DONT_CARE;
    }

    public String toString() {
        return keys + " -> " + action;
    }
}
