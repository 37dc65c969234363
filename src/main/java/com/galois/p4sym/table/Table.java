package com.galois.p4sym.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.IntegerValue;
import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.callable.Action;
import com.galois.p4sym.callable.Callable;
import com.galois.p4sym.callable.Parameter;
import com.galois.p4sym.engine.Invocable;
import com.galois.p4sym.engine.MemberResolver;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramRegistry;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;
import com.galois.p4sym.engine.Value;

/**
 * A match-action table.
 *
 * <p>
 * Applying a table yields
 * <code>ite(match, dispatch, default)</code> where <code>match</code> is
 * the conjunction of <code>key_i == {table}_key_i</code> (<code>false</code>
 * for a table without keys), <code>default</code> is the default action run
 * on the state itself, and <code>dispatch</code> is built innermost first:
 * the default action, then each constant entry in reverse declaration order
 * guarded by its key literals, then each declared action in reverse
 * declaration order guarded by <code>{table}_action == id</code>.  Every
 * alternative runs on its own copy of the state and consumes the rest of
 * the continuation.
 *
 * <p>
 * Declared actions have ids <code>1..N</code> in declaration order; the
 * default action has id 0.  A table without a declared default uses a
 * synthesized <code>NoAction</code>.
 */
public final class Table implements Statement, Invocable, MemberResolver {
    private final String name;
    private final List<Operand> keys = new ArrayList<Operand>();
    private final LinkedHashMap<String, ActionRef> actions = new LinkedHashMap<String, ActionRef>();
    private final List<ConstantEntry> entries = new ArrayList<ConstantEntry>();
    private final Action noAction = Action.noAction();
    private ActionRef defaultAction;

    public Table(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Table addKey(Operand key) {
        if (!entries.isEmpty()) {
            throw new MalformedProgramException("Keys of table " + name + " must be declared before its entries.");
        }
        keys.add(key);
        return this;
    }

    public Table addAction(ActionRef action) {
        if (actions.containsKey(action.getName())) {
            throw new IllegalArgumentException("Duplicate action " + action.getName() + " in table " + name);
        }
        actions.put(action.getName(), action);
        return this;
    }

    public Table setDefaultAction(ActionRef action) {
        this.defaultAction = action;
        return this;
    }

    /**
     * Add a constant entry.
     *
     * @throws MalformedProgramException if the entry does not have one
     *   pattern per key.
     */
    public Table addConstantEntry(List<? extends Operand> patterns, ActionRef action) {
        if (patterns.size() != keys.size()) {
            throw new MalformedProgramException("Entry " + patterns + " of table " + name + " has "
                                                + patterns.size() + " keys, expected " + keys.size() + ".");
        }
        entries.add(new ConstantEntry(patterns, action));
        return this;
    }

    public ImmutableList<Operand> getKeys() {
        return ImmutableList.copyOf(keys);
    }

    public ImmutableList<String> getActionNames() {
        return ImmutableList.copyOf(actions.keySet());
    }

    public ImmutableList<ConstantEntry> getConstantEntries() {
        return ImmutableList.copyOf(entries);
    }

    /** Name of the default action; <code>NoAction</code> if none was declared. */
    public String getDefaultActionName() {
        return defaultAction == null ? noAction.getName() : defaultAction.getName();
    }

    /**
     * Returns the id of a declared action, or 0 for the default action.
     *
     * @throws MalformedProgramException if the table does not know the action.
     */
    public int actionId(String action) {
        int i = 1;
        for (String a : actions.keySet()) {
            if (a.equals(action)) return i;
            ++i;
        }
        if (action.equals(getDefaultActionName())) return 0;
        throw new MalformedProgramException("Table " + name + " has no action " + action + ".");
    }

    /** The integer variable that selects among the declared actions. */
    public Term actionSelector(TermBuilder b) {
        return b.freshConstant(name + "_action", Sort.INTEGER);
    }

    /** The variable that the <code>i</code>th key is matched against. */
    public Term keyConstant(TermBuilder b, int i, Sort sort) {
        return b.freshConstant(name + "_key_" + i, sort);
    }

    public Operand member(String member) {
        return "apply".equals(member) ? this : null;
    }

    public Value invoke(ProgramState state, List<Operand> args, Map<String, Operand> namedArgs) {
        return Value.of(execute(state));
    }

    public boolean consumesContinuation() {
        return true;
    }

    public Term execute(ProgramState state) {
        ProgramRegistry registry = state.getRegistry();
        registry.log("apply table " + name);
        TermBuilder b = state.builder();

        List<Term> keyTerms = new ArrayList<Term>();
        for (Operand k : keys) {
            Term t = state.resolveTerm(k);
            keyTerms.add(t instanceof IntegerValue ? BitOps.asBitvector(b, t) : t);
        }
        Term match = b.boolLiteral(false);
        if (!keyTerms.isEmpty()) {
            List<Term> conjuncts = new ArrayList<Term>();
            for (int i = 0; i != keyTerms.size(); ++i) {
                Term k = keyTerms.get(i);
                conjuncts.add(b.eq(k, keyConstant(b, i, k.sort())));
            }
            match = b.and(conjuncts.toArray(new Term[conjuncts.size()]));
        }

        Term dispatch = run(state.deepCopy(), defaultAction);
        for (ConstantEntry e : Lists.reverse(entries)) {
            Term guard = entryGuard(state, keyTerms, e);
            dispatch = b.ite(guard, run(state.deepCopy(), e.getAction()), dispatch);
        }
        List<ActionRef> declared = new ArrayList<ActionRef>(actions.values());
        Collections.reverse(declared);
        Term selector = actionSelector(b);
        for (ActionRef a : declared) {
            Term guard = b.eq(selector, b.intLiteral(actionId(a.getName())));
            dispatch = b.ite(guard, run(state.deepCopy(), a), dispatch);
        }

        Term miss = run(state, defaultAction);
        return b.ite(match, dispatch, miss);
    }

    private Term entryGuard(ProgramState state, List<Term> keyTerms, ConstantEntry e) {
        TermBuilder b = state.builder();
        List<Term> conjuncts = new ArrayList<Term>();
        for (int i = 0; i != keyTerms.size(); ++i) {
            Operand pattern = e.getKeys().get(i);
            if (ConstantEntry.isWildcard(pattern)) continue;
            Term[] xy = BitOps.align(b, keyTerms.get(i), state.resolveTerm(pattern));
            conjuncts.add(b.eq(xy[0], xy[1]));
        }
        return b.and(conjuncts.toArray(new Term[conjuncts.size()]));
    }

    /**
     * Invoke an action, filling parameters without an argument with fresh
     * values named <code>{table}_{action}_{parameter}</code>.
     */
    private Term run(ProgramState state, ActionRef ref) {
        Callable action = ref == null ? noAction : resolveAction(state, ref.getName());
        List<Operand> args = new ArrayList<Operand>();
        if (ref != null) args.addAll(ref.getArgs());
        List<Parameter> params = action.getParameters();
        for (int i = args.size(); i < params.size(); ++i) {
            Parameter p = params.get(i);
            args.add(state.getRegistry().instantiate(name + "_" + action.getName() + "_" + p.getName(),
                                                     p.getType()));
        }
        Value result = action.invoke(state, args, Collections.<String, Operand>emptyMap());
        return result.toTerm(state.builder());
    }

    private Callable resolveAction(ProgramState state, String action) {
        if (action.equals(noAction.getName()) && !state.getRegistry().contains(action)
            && state.getVar(action) == null) {
            return noAction;
        }
        Operand o = state.lookup(action);
        if (!(o instanceof Callable) || !((Callable) o).consumesContinuation()) {
            throw new MalformedProgramException(action + " in table " + name + " is not an action.");
        }
        return (Callable) o;
    }

    public String toString() {
        return name;
    }
}
