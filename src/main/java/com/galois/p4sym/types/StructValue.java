package com.galois.p4sym.types;

import java.util.Map;

import com.galois.p4sym.engine.ComplexValue;
import com.galois.p4sym.engine.Value;

public final class StructValue extends ComplexValue {
    private final StructType type;

    public StructValue(StructType type, String name, Map<String, Value> members) {
        super(name, members);
        this.type = type;
    }

    public StructType type() {
        return type;
    }

    protected ComplexValue withMembers(String name, Map<String, Value> members) {
        return new StructValue(type, name, members);
    }
}
