package com.galois.p4sym;

/**
 * Thrown when a program graph was constructed incorrectly, either at
 * construction time or the first time the faulty node is used.
 */
public class MalformedProgramException extends EvaluationException {
    public MalformedProgramException(String message) {
        super(message);
    }
}
