package com.galois.p4sym.engine;

/**
 * Anything that may be bound to a name in a program state or passed as an
 * argument: resolved values, unevaluated expression nodes, and declared
 * objects such as callables, tables and types.
 */
public interface Operand {
}
