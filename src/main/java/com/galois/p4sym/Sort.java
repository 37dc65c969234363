package com.galois.p4sym;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.galois.p4sym.proto.Protos;

/**
 * Sorts of formula terms.
 */
public final class Sort {
    final Protos.SortId id;
    final long width;
    final String name;
    final String[] fieldNames;
    final Sort[] fields;

    /** A private method for creating a sort with the given args. */
    private Sort(Protos.SortId id, long width, String name, String[] fieldNames, Sort[] fields) {
        this.id = id;
        this.width = width;
        this.name = name;
        this.fieldNames = fieldNames;
        this.fields = fields;
    }

    private Sort(Protos.SortId id) {
        this(id, 0, "", new String[0], new Sort[0]);
    }

    /**
     * Sort for Boolean values (true or false)
     */
    public static final Sort BOOL = new Sort(Protos.SortId.BoolSort);

    /**
     * Sort for unbounded integers.
     */
    public static final Sort INTEGER = new Sort(Protos.SortId.IntegerSort);

    // Cache used for bitvector sorts.
    private static Map<Long,Sort> bitvectorSorts = new HashMap<Long,Sort>();

    /**
     * Returns the sort of a bitvector with <code>width</code> bits.
     *
     * @param width The number of bits in bitvector.
     * @return The given sort.
     */
    public static Sort bitvector(long width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Bitvector width must be positive: " + width);
        }
        synchronized (bitvectorSorts) {
            Sort r = bitvectorSorts.get(width);
            if (r == null) {
                r = new Sort(Protos.SortId.BitvectorSort, width, "", new String[0], new Sort[0]);
                bitvectorSorts.put(width, r);
            }
            return r;
        }
    }

    private static Map<List<Object>, Sort> structSorts = new HashMap<List<Object>, Sort>();

    /**
     * Sort for a struct with a single constructor and the given fields.
     *
     * @param name The name of the struct.
     * @param fieldNames The names of the fields, in declaration order.
     * @param fields The sorts of the fields.
     * @return The resulting sort.
     */
    public static Sort struct(String name, String[] fieldNames, Sort[] fields) {
        if (fieldNames.length != fields.length) {
            throw new IllegalArgumentException("Struct " + name + " has mismatched field lists.");
        }
        synchronized (structSorts) {
            List<Object> key = Arrays.<Object>asList(name,
                                                     Arrays.asList(fieldNames),
                                                     Arrays.asList(fields));
            Sort r = structSorts.get(key);
            if (r == null) {
                r = new Sort(Protos.SortId.StructSort, 0, name,
                             fieldNames.clone(), fields.clone());
                structSorts.put(key, r);
            }
            return r;
        }
    }

    /**
     * Check if this is a bitvector sort.
     * @return Whether this is a bitvector sort.
     */
    public boolean isBitvector() {
        return id == Protos.SortId.BitvectorSort;
    }

    public boolean isBool() {
        return id == Protos.SortId.BoolSort;
    }

    public boolean isInteger() {
        return id == Protos.SortId.IntegerSort;
    }

    /**
     * Check if this sort is a struct sort
     * @return true if this is a struct sort
     */
    public boolean isStruct() {
        return id == Protos.SortId.StructSort;
    }

    /**
     * Return width of this sort if it is a bitvector, and <code>0</code> otherwise.
     * @return The width
     */
    public long width() {
        return width;
    }

    /**
     * Return the name of a struct sort.
     */
    public String name() {
        return name;
    }

    public int fieldCount() {
        return fields.length;
    }

    public String fieldName(int i) {
        checkField(i);
        return fieldNames[i];
    }

    /**
     * Return the sort of a struct field.
     *
     * @param i Index of field.
     * @return the sort
     */
    public Sort field(int i) {
        checkField(i);
        return fields[i];
    }

    /**
     * Return the index of the named field, or <code>-1</code> if there is none.
     */
    public int fieldIndex(String fieldName) {
        for (int i = 0; i != fieldNames.length; ++i) {
            if (fieldNames[i].equals(fieldName)) return i;
        }
        return -1;
    }

    private void checkField(int i) {
        if (!isStruct()) {
            throw new UnsupportedOperationException("Expected struct sort, got " + this);
        }
        if (!(0 <= i && i < fields.length)) {
            throw new IllegalArgumentException("Invalid field index " + i + " for " + this);
        }
    }

    /**
     * Return protocol buffer representation for sort.
     * @return the representation
     */
    public Protos.Sort getSortRep() {
        Protos.Sort.Builder b
            = Protos.Sort.newBuilder()
            .setId(id)
            .setWidth(width)
            .setName(name);
        for (int i = 0; i != fields.length; ++i) {
            b.addFieldName(fieldNames[i]);
            b.addField(fields[i].getSortRep());
        }
        return b.build();
    }

    public String toString() {
        switch (id) {
        case BoolSort:
            return "Bool";
        case IntegerSort:
            return "Int";
        case BitvectorSort:
            return "(_ BitVec " + width + ")";
        default:
            return name;
        }
    }

    /**
     * Returns true if <code>this</code> and <code>o</code> are the same sort.
     * @param o the other sort.
     * @return whether the sorts are the same.
     */
    public boolean equals(Object o) {
        if (!(o instanceof Sort)) return false;
        Sort other = (Sort) o;
        return this.id.equals(other.id)
            && this.width == other.width
            && this.name.equals(other.name)
            && Arrays.equals(this.fieldNames, other.fieldNames)
            && Arrays.equals(this.fields, other.fields);
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { id, width, name, Arrays.hashCode(fields) });
    }
}
