package com.galois.p4sym.types;

import java.util.List;
import java.util.Map;

import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.ComplexValue;
import com.galois.p4sym.engine.Value;

/**
 * A header instance.  Its validity is a Boolean term kept next to the
 * members and exposed through {@link HeaderMethod}s.
 */
public final class HeaderValue extends ComplexValue {
    private final HeaderType type;
    private Term valid;

    public HeaderValue(HeaderType type, String name, Map<String, Value> members, Term valid) {
        super(name, members);
        if (!valid.sort().isBool()) {
            throw new IllegalArgumentException("Header validity must be Boolean: " + valid);
        }
        this.type = type;
        this.valid = valid;
    }

    public HeaderType type() {
        return type;
    }

    public Term isValid() {
        return valid;
    }

    public void setValid(Term valid) {
        this.valid = valid;
    }

    protected ComplexValue withMembers(String name, Map<String, Value> members) {
        return new HeaderValue(type, name, members, valid);
    }

    protected List<Term> memberTerms(TermBuilder b) {
        List<Term> terms = super.memberTerms(b);
        terms.add(valid);
        return terms;
    }

    public void propagate(TermBuilder b, Term structTerm) {
        super.propagate(b, structTerm);
        Sort sort = structTerm.sort();
        if (sort.fieldIndex(HeaderType.VALID_FIELD) >= 0) {
            valid = b.structGet(HeaderType.VALID_FIELD, structTerm);
        }
    }
}
