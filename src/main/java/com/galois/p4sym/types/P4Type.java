package com.galois.p4sym.types;

import com.galois.p4sym.Sort;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.Value;

/**
 * A declared type of the packet-processing language.
 */
public interface P4Type extends Operand {
    String name();

    /** Sort of the formula terms that represent values of this type. */
    Sort sort();

    /**
     * Create an unconstrained value of this type.  Primitive values become
     * a fresh constant called <code>instanceName</code>; members of
     * aggregates are named <code>instanceName.member</code>.
     */
    Value instantiate(String instanceName, TermBuilder b);
}
