package com.galois.p4sym.engine;

import com.galois.p4sym.Term;

/**
 * Drains the continuation of a program state into a single formula.
 *
 * <p>
 * Sequencing is expressed by pushing statements onto the front of the
 * state's continuation rather than by host recursion: a block pushes its
 * statements, an action pushes its body followed by the context that
 * restores the caller's bindings.  A statement that returns a formula has
 * taken over the rest of the continuation (a conditional evaluates both
 * branches to the end, for instance), and that formula is the result.
 */
public final class Engine {
    private Engine() {}

    public static Term step(ProgramState state) {
        ProgramRegistry registry = state.getRegistry();
        while (true) {
            Statement next = state.popNext();
            if (next == null) {
                return state.getFormula();
            }
            if (registry.getOptions().getTraceSteps()) {
                registry.log(state.getName() + ": " + next);
            }
            Term result = next.execute(state);
            if (result != null) {
                return result;
            }
        }
    }
}
