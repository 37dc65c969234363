package com.galois.p4sym.types;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import com.galois.p4sym.Sort;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Value;

/**
 * A struct type with ordered fields.
 */
public class StructType implements P4Type {
    private final String name;
    private final LinkedHashMap<String, P4Type> fields = new LinkedHashMap<String, P4Type>();
    private Sort sort;

    public StructType(String name) {
        this.name = name;
    }

    /**
     * Append a field.  Fields cannot be added once the sort was requested.
     */
    public StructType addField(String field, P4Type type) {
        if (sort != null) {
            throw new IllegalStateException("Struct " + name + " is already in use.");
        }
        if (fields.containsKey(field)) {
            throw new IllegalArgumentException("Duplicate field " + field + " in " + name);
        }
        fields.put(field, type);
        return this;
    }

    public String name() {
        return name;
    }

    public ImmutableMap<String, P4Type> getFields() {
        return ImmutableMap.copyOf(fields);
    }

    public P4Type fieldType(String field) {
        return fields.get(field);
    }

    public synchronized Sort sort() {
        if (sort == null) {
            int n = fields.size() + extraFieldNames().length;
            String[] names = new String[n];
            Sort[] sorts = new Sort[n];
            int i = 0;
            for (Map.Entry<String, P4Type> e : fields.entrySet()) {
                names[i] = e.getKey();
                sorts[i] = e.getValue().sort();
                ++i;
            }
            for (int j = 0; j != extraFieldNames().length; ++j, ++i) {
                names[i] = extraFieldNames()[j];
                sorts[i] = extraFieldSorts()[j];
            }
            sort = Sort.struct(name, names, sorts);
        }
        return sort;
    }

    /** Hidden fields appended to the sort after the declared ones. */
    protected String[] extraFieldNames() {
        return new String[0];
    }

    protected Sort[] extraFieldSorts() {
        return new Sort[0];
    }

    protected LinkedHashMap<String, Value> instantiateFields(String instanceName, TermBuilder b) {
        LinkedHashMap<String, Value> members = new LinkedHashMap<String, Value>();
        for (Map.Entry<String, P4Type> e : fields.entrySet()) {
            members.put(e.getKey(), e.getValue().instantiate(instanceName + "." + e.getKey(), b));
        }
        return members;
    }

    public Value instantiate(String instanceName, TermBuilder b) {
        return new StructValue(this, instanceName, instantiateFields(instanceName, b));
    }

    public String toString() {
        return name;
    }
}
