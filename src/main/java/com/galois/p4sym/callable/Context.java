package com.galois.p4sym.callable;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import com.galois.p4sym.Term;
import com.galois.p4sym.engine.CallFrame;
import com.galois.p4sym.engine.Engine;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.stmt.AssignmentStatement;

/**
 * Queued after a callable's body to undo its parameter bindings.
 *
 * <p>
 * The final values of out and inout parameters are copied to their
 * caller-side arguments (only the selected bits for slice arguments).  When
 * the callee ran in the caller's own state, every parameter name gets its
 * pre-call binding back.  When it ran in a child state (controls and
 * parsers), the remaining continuation moves back to a copy of the parent
 * state and evaluation goes on there.  Either way the call is closed, so
 * the nesting depth only counts calls still open on the current path.
 */
public final class Context implements CallFrame {
    private final String callee;
    private final ImmutableList<SavedBinding> saved;
    private final ProgramState parent;

    Context(String callee, List<SavedBinding> saved, ProgramState parent) {
        this.callee = callee;
        this.saved = ImmutableList.copyOf(saved);
        this.parent = parent;
    }

    public Term execute(ProgramState state) {
        List<Value> results = new ArrayList<Value>();
        for (SavedBinding s : saved) {
            results.add(s.parameter.getDirection().copiesOut() ? state.resolve(s.name()) : null);
        }

        // The parent may be reached from several forked paths, so each path
        // restores into its own copy.
        ProgramState target = parent == null ? state : parent.deepCopy();
        if (parent == null) {
            for (SavedBinding s : saved) {
                if (s.previous == null) {
                    state.delVar(s.name());
                } else {
                    Operand previous = s.previous instanceof Value ? ((Value) s.previous).copy() : s.previous;
                    state.declareVar(s.name(), previous);
                }
            }
            state.exitCall();
        }
        for (int i = 0; i != saved.size(); ++i) {
            if (results.get(i) != null) {
                AssignmentStatement.assign(target, saved.get(i).target, results.get(i));
            }
        }
        state.getRegistry().log("return from " + callee);

        if (parent == null) {
            return null;
        }
        target.setChain(state.getChain());
        state.clearChain();
        return Engine.step(target);
    }

    public String toString() {
        return "context of " + callee;
    }
}
