package com.galois.p4sym.stmt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.p4sym.Term;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;

/**
 * A sequence of statements, queued in order in front of the continuation.
 */
public final class BlockStatement implements Statement {
    private final List<Statement> stmts = new ArrayList<Statement>();

    public BlockStatement() {}

    public BlockStatement(Statement... stmts) {
        this.stmts.addAll(Arrays.asList(stmts));
    }

    /** Append a statement while the program is being built. */
    public BlockStatement add(Statement s) {
        stmts.add(s);
        return this;
    }

    public ImmutableList<Statement> getStatements() {
        return ImmutableList.copyOf(stmts);
    }

    public Term execute(ProgramState state) {
        state.pushAll(stmts);
        return null;
    }

    public String toString() {
        return "{" + stmts.size() + " statements}";
    }
}
