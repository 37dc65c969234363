package com.galois.p4sym.engine;

/**
 * Declared objects that expose named members through dotted references,
 * such as <code>table.apply</code> or <code>extern.method</code>.
 */
public interface MemberResolver extends Operand {
    /**
     * Returns the member called <code>name</code>, or <code>null</code> if
     * there is none.
     */
    Operand member(String name);
}
