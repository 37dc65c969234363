package com.galois.p4sym;
import com.galois.p4sym.proto.Protos;

/**
 * Interface that all formula terms must implement.
 *
 * Terms are immutable and compare structurally, so the same term may be
 * shared freely between forked program states.
 */
public interface Term extends Sorted {
    /**
     * Return the Protocol Buffer representation of a term.
     * @return the representation
     */
    Protos.Term getTermRep();
}
