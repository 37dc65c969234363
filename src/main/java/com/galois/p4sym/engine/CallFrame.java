package com.galois.p4sym.engine;

/**
 * A statement that closes a call.  An <code>exit</code> abandons the
 * continuation but still runs these, so that out parameters are copied back
 * and evaluation ends in the outermost caller's state.
 */
public interface CallFrame extends Statement {
}
