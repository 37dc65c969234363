package com.galois.p4sym.callable;

import java.util.List;

import com.galois.p4sym.Term;
import com.galois.p4sym.engine.Engine;
import com.galois.p4sym.engine.ProgramRegistry;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.stmt.BlockStatement;

/**
 * A control block.  It runs in a child state whose formula is the struct of
 * its parameters; the caller's continuation is carried through the child
 * and handed back by the {@link Context} at the end of the body.
 */
public class Control extends Callable {
    public Control(String name, BlockStatement body) {
        super(name, body);
    }

    /**
     * Evaluate this block as a pipeline: every parameter is unconstrained
     * and named <code>{control}_{parameter}</code>.
     */
    public Term evaluate(ProgramRegistry registry) {
        registry.log("evaluate " + getName());
        ProgramState state = registry.newState(getName(), parameterTypes());
        state.push(getBody());
        return Engine.step(state);
    }

    protected Value call(ProgramState state, List<BoundArgument> bound) {
        ProgramState child = state.getRegistry().newState(getName(), parameterTypes());
        child.enterCall(getName(), state.getCallDepth());
        bindArguments(state, child, bound);
        List<SavedBinding> saved = saveBindings(child, bound);
        child.setChain(state.getChain());
        state.clearChain();
        child.push(new Context(getName(), saved, state));
        child.push(getBody());
        return Value.of(Engine.step(child));
    }

    public boolean consumesContinuation() {
        return true;
    }
}
