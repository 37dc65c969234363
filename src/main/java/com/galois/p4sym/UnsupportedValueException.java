package com.galois.p4sym;

/**
 * Thrown when a value reaches a position that cannot handle its kind.
 */
public class UnsupportedValueException extends EvaluationException {
    private final String valueKind;

    public UnsupportedValueException(String valueKind, String context) {
        super("Value of kind " + valueKind + " cannot be used " + context + "!");
        this.valueKind = valueKind;
    }

    public String getValueKind() {
        return valueKind;
    }
}
