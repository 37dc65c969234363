package com.galois.p4sym;

/**
 * Thrown when a node is evaluated before a required sub-node was set.
 */
public class MissingNodeException extends MalformedProgramException {
    public MissingNodeException(String message) {
        super(message);
    }
}
