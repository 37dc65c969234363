package com.galois.p4sym.types;

import com.galois.p4sym.Sort;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Value;

/**
 * A header: a struct whose sort carries a trailing validity bit.
 */
public final class HeaderType extends StructType {
    /** Name of the validity field and suffix of its fresh constant. */
    public static final String VALID_FIELD = "$valid";

    public HeaderType(String name) {
        super(name);
    }

    protected String[] extraFieldNames() {
        return new String[] { VALID_FIELD };
    }

    protected Sort[] extraFieldSorts() {
        return new Sort[] { Sort.BOOL };
    }

    public Value instantiate(String instanceName, TermBuilder b) {
        return new HeaderValue(this, instanceName, instantiateFields(instanceName, b),
                               b.freshConstant(instanceName + "." + VALID_FIELD, Sort.BOOL));
    }
}
