package com.galois.p4sym.stmt;

import com.galois.p4sym.Term;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;

public final class NoopStatement implements Statement {
    public static final NoopStatement INSTANCE = new NoopStatement();

    private NoopStatement() {}

    public Term execute(ProgramState state) {
        return null;
    }

    public String toString() {
        return ";";
    }
}
