package com.galois.p4sym;

/**
 * EvaluationException is thrown when the engine fails to build the formula
 * of a program.  Every subclass signals a defect in the program graph or in
 * its translation; none of them is recovered from inside the engine.
 */
public class EvaluationException extends RuntimeException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
