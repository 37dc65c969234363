package com.galois.p4sym.stmt;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.MissingNodeException;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Engine;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;

/**
 * A two-way branch.  Both sides run to the end of the continuation; the
 * "then" side on a deep copy of the state, the "else" side (or the plain
 * fallthrough) on the state itself.  The result is
 * <code>ite(cond, then, else)</code>.
 */
public final class IfStatement implements Statement {
    private Operand cond;
    private Statement thenStmt;
    private Statement elseStmt;

    public IfStatement() {}

    public IfStatement(Operand cond, Statement thenStmt, Statement elseStmt) {
        this.cond = cond;
        this.thenStmt = thenStmt;
        this.elseStmt = elseStmt;
    }

    public IfStatement setCondition(Operand cond) {
        this.cond = cond;
        return this;
    }

    public IfStatement setThen(Statement s) {
        this.thenStmt = s;
        return this;
    }

    public IfStatement setElse(Statement s) {
        this.elseStmt = s;
        return this;
    }

    public Term execute(ProgramState state) {
        if (cond == null) {
            throw new MissingNodeException("Conditional has no condition.");
        }
        if (thenStmt == null) {
            throw new MissingNodeException("Conditional on " + cond + " has no then branch.");
        }
        TermBuilder b = state.builder();
        Term c = BitOps.castToBool(b, state.resolveTerm(cond));

        ProgramState thenState = state.deepCopy();
        thenState.push(thenStmt);
        Term thenTerm = Engine.step(thenState);

        if (elseStmt != null) {
            state.push(elseStmt);
        }
        Term elseTerm = Engine.step(state);
        return b.ite(c, thenTerm, elseTerm);
    }

    public String toString() {
        return "if (" + cond + ")";
    }
}
