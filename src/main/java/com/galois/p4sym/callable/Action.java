package com.galois.p4sym.callable;

import java.util.List;

import com.galois.p4sym.engine.Engine;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.stmt.BlockStatement;

/**
 * An action runs in its caller's state: the body is queued in front of the
 * caller's continuation, followed by the {@link Context} that restores the
 * parameter names and closes the call.
 */
public class Action extends Callable {
    public Action(String name, BlockStatement body) {
        super(name, body);
    }

    /** An action without parameters that does nothing. */
    public static Action noAction() {
        return new Action("NoAction", new BlockStatement());
    }

    protected Value call(ProgramState state, List<BoundArgument> bound) {
        state.enterCall(getName());
        List<SavedBinding> saved = saveBindings(state, bound);
        bindArguments(state, state, bound);
        state.push(new Context(getName(), saved, null));
        state.push(getBody());
        return Value.of(Engine.step(state));
    }

    public boolean consumesContinuation() {
        return true;
    }
}
