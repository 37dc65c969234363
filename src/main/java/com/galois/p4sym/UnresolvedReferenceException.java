package com.galois.p4sym;

/**
 * Thrown when a name has no binding in the current program state.
 */
public class UnresolvedReferenceException extends EvaluationException {
    private final String reference;

    public UnresolvedReferenceException(String reference) {
        super("Value " + reference + " could not be found!");
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
