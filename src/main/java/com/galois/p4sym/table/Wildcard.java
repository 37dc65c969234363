package com.galois.p4sym.table;

import com.galois.p4sym.engine.Operand;

/** Key pattern of a constant entry that matches any key value. */
public enum Wildcard implements Operand {
    DONT_CARE
}
