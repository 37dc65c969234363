package com.galois.p4sym.engine;

import java.util.List;
import java.util.Map;

/**
 * Something a method call expression can call.
 */
public interface Invocable extends Operand {
    /**
     * Invoke with positional and named arguments.
     */
    Value invoke(ProgramState state, List<Operand> args, Map<String, Operand> namedArgs);

    /**
     * Whether an invocation runs the caller's remaining continuation and
     * returns the formula of everything that follows the call.
     */
    boolean consumesContinuation();
}
