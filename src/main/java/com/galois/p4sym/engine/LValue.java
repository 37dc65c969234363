package com.galois.p4sym.engine;

/**
 * An expression that denotes storage and can therefore be assigned to.
 */
public interface LValue extends Expression {
    /**
     * Returns the dotted reference (for instance <code>hdr.eth.dst</code>)
     * that the program state interprets against nested complex values.
     */
    String referenceName(ProgramState state);
}
