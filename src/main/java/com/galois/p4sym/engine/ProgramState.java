package com.galois.p4sym.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.MissingNodeException;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnresolvedReferenceException;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.types.EnumType;
import com.galois.p4sym.types.HeaderMethod;
import com.galois.p4sym.types.HeaderValue;
import com.galois.p4sym.types.P4Type;

/**
 * The symbolic environment of one evaluation path: variable bindings plus
 * the continuation of statements that still have to run.
 *
 * <p>
 * A state is owned by exactly one evaluation path.  Branches work on a
 * {@link #deepCopy()}, which shares no mutable storage with the original.
 * Names that are not bound in the state are looked up in the
 * {@link ProgramRegistry}.
 */
public final class ProgramState {
    private final String name;
    private final ImmutableMap<String, P4Type> members;
    private final ProgramRegistry registry;
    private final HashMap<String, Operand> vars;
    private LinkedList<Statement> chain;
    private Sort formulaSort;
    private int callDepth;

    /**
     * Create an empty state whose formula is the struct of the given
     * members.  Use {@link ProgramRegistry#newState} to get the members
     * bound as well.
     */
    public ProgramState(String name, Map<String, P4Type> members, ProgramRegistry registry) {
        this.name = name;
        this.members = ImmutableMap.copyOf(members);
        this.registry = registry;
        this.vars = new HashMap<String, Operand>();
        this.chain = new LinkedList<Statement>();
    }

    private ProgramState(ProgramState other) {
        this.name = other.name;
        this.members = other.members;
        this.registry = other.registry;
        this.formulaSort = other.formulaSort;
        this.callDepth = other.callDepth;
        this.vars = new HashMap<String, Operand>();
        for (Map.Entry<String, Operand> e : other.vars.entrySet()) {
            Operand o = e.getValue();
            vars.put(e.getKey(), o instanceof Value ? ((Value) o).copy() : o);
        }
        this.chain = new LinkedList<Statement>(other.chain);
    }

    public String getName() {
        return name;
    }

    public ImmutableMap<String, P4Type> getMembers() {
        return members;
    }

    public ProgramRegistry getRegistry() {
        return registry;
    }

    public TermBuilder builder() {
        return registry.builder();
    }

    /** Returns an independent copy of this state, continuation included. */
    public ProgramState deepCopy() {
        return new ProgramState(this);
    }

    // ******************* Continuation ***************************************

    /** Run <code>s</code> next. */
    public void push(Statement s) {
        chain.addFirst(s);
    }

    /** Run the given statements next, in order. */
    public void pushAll(List<? extends Statement> stmts) {
        for (Statement s : Lists.reverse(stmts)) {
            chain.addFirst(s);
        }
    }

    /** Remove and return the next statement, or <code>null</code> if none is left. */
    public Statement popNext() {
        return chain.pollFirst();
    }

    public boolean isChainEmpty() {
        return chain.isEmpty();
    }

    public void clearChain() {
        chain.clear();
    }

    /** Drop every queued statement except the {@link CallFrame}s. */
    public void unwindChain() {
        Iterator<Statement> it = chain.iterator();
        while (it.hasNext()) {
            if (!(it.next() instanceof CallFrame)) {
                it.remove();
            }
        }
    }

    /** Returns a snapshot of the continuation. */
    public List<Statement> getChain() {
        return new ArrayList<Statement>(chain);
    }

    public void setChain(List<Statement> stmts) {
        chain = new LinkedList<Statement>(stmts);
    }

    // ******************* Calls *********************************************

    /** Number of calls open on this path. */
    public int getCallDepth() {
        return callDepth;
    }

    /**
     * Record entry into <code>callee</code> from a caller with
     * <code>callerDepth</code> open calls.
     *
     * @throws MalformedProgramException if this exceeds the configured
     *   maximum nesting depth.
     */
    public void enterCall(String callee, int callerDepth) {
        int max = registry.getOptions().getMaxCallDepth();
        if (callerDepth >= max) {
            throw new MalformedProgramException("Call to " + callee + " exceeds the maximum nesting depth of "
                                                + max + ".");
        }
        callDepth = callerDepth + 1;
    }

    public void enterCall(String callee) {
        enterCall(callee, callDepth);
    }

    public void exitCall() {
        --callDepth;
    }

    // ******************* Variables ******************************************

    /** Returns the binding of exactly <code>var</code> in this state, or <code>null</code>. */
    public Operand getVar(String var) {
        return vars.get(var);
    }

    public boolean hasVar(String var) {
        return vars.containsKey(var);
    }

    public void delVar(String var) {
        vars.remove(var);
    }

    /** Bind <code>var</code> to <code>value</code> without any conversion. */
    public void declareVar(String var, Operand value) {
        vars.put(var, value);
    }

    /**
     * Overwrite or insert a binding.  A dotted name writes into the member of
     * a complex value.  Values written over a bitvector or Boolean binding
     * are cast to its sort.
     */
    public void setOrAddVar(String var, Operand value) {
        if (!(value instanceof Value)) {
            vars.put(var, value);
            return;
        }
        Value v = (Value) value;
        int dot = var.lastIndexOf('.');
        if (dot < 0 || vars.containsKey(var)) {
            Operand previous = vars.get(var);
            vars.put(var, previous instanceof Value ? Value.conform(builder(), (Value) previous, v) : v);
            return;
        }
        Operand parent = lookup(var.substring(0, dot));
        if (!(parent instanceof ComplexValue)) {
            throw new UnsupportedValueException(kindOf(parent), "as the target of " + var);
        }
        ((ComplexValue) parent).setMember(builder(), var.substring(dot + 1), v);
    }

    /**
     * Returns the live binding of a possibly dotted name.  Each segment
     * after the first selects a member of a complex value, a field of a
     * struct term, a header method, an enum member, or a member of a
     * declared object.
     *
     * @throws UnresolvedReferenceException if any segment is unbound.
     */
    public Operand lookup(String ref) {
        Operand direct = vars.get(ref);
        if (direct == null) direct = registry.get(ref);
        if (direct != null) {
            return direct;
        }
        String[] parts = ref.split("\\.");
        Operand current = vars.get(parts[0]);
        if (current == null) current = registry.get(parts[0]);
        if (current == null) {
            throw new UnresolvedReferenceException(ref);
        }
        for (int i = 1; i != parts.length; ++i) {
            current = select(current, parts[i], ref);
        }
        return current;
    }

    private Operand select(Operand current, String member, String ref) {
        if (current instanceof Expression) {
            current = resolve(current);
        }
        if (current instanceof HeaderValue) {
            HeaderMethod m = HeaderMethod.forName((HeaderValue) current, member);
            if (m != null) return m;
        }
        if (current instanceof ComplexValue) {
            ComplexValue c = (ComplexValue) current;
            if (c.hasMember(member)) return c.member(member);
        } else if (current instanceof TermValue) {
            Term t = ((TermValue) current).getTerm();
            if (t.sort().isStruct() && t.sort().fieldIndex(member) >= 0) {
                return Value.of(builder().structGet(member, t));
            }
        } else if (current instanceof EnumType) {
            return ((EnumType) current).member(member, builder());
        } else if (current instanceof MemberResolver) {
            Operand m = ((MemberResolver) current).member(member);
            if (m != null) return m;
        }
        throw new UnresolvedReferenceException(ref);
    }

    /** Resolve the binding of a name. */
    public Value resolve(String ref) {
        return resolve(lookup(ref));
    }

    /**
     * Reduce an operand to a value: expressions are evaluated, containers
     * are resolved element by element and complex values are copied.
     *
     * @throws UnsupportedValueException if the operand is a declared object
     *   rather than something with a value.
     */
    public Value resolve(Operand o) {
        if (o == null) {
            throw new MissingNodeException("Cannot resolve a missing operand.");
        }
        if (o instanceof Expression) {
            return resolve(((Expression) o).evaluate(this));
        }
        if (!(o instanceof Value)) {
            throw new UnsupportedValueException(kindOf(o), "as a value");
        }
        Value v = (Value) o;
        switch (v.kind()) {
        case TERM:
        case INTEGER:
            return v;
        case COMPLEX:
            return v.copy();
        case LIST: {
            List<Value> elements = new ArrayList<Value>();
            for (Operand e : ((ListValue) v).getElements()) {
                elements.add(resolve(e));
            }
            return new ListValue(elements);
        }
        case MAP: {
            Map<String, Value> entries = new LinkedHashMap<String, Value>();
            for (Map.Entry<String, Operand> e : ((MapValue) v).getEntries().entrySet()) {
                entries.put(e.getKey(), resolve(e.getValue()));
            }
            return new MapValue(entries);
        }
        default:
            throw new UnsupportedValueException(v.kind().toString(), "as a value");
        }
    }

    public Term resolveTerm(Operand o) {
        return resolve(o).toTerm(builder());
    }

    static String kindOf(Operand o) {
        if (o instanceof Value) return ((Value) o).kind().toString();
        return o.getClass().getSimpleName();
    }

    // ******************* Formula ********************************************

    /** Sort of {@link #getFormula()}: a struct with one field per member. */
    public synchronized Sort formulaSort() {
        if (formulaSort == null) {
            String[] names = members.keySet().toArray(new String[members.size()]);
            Sort[] sorts = new Sort[names.length];
            for (int i = 0; i != names.length; ++i) {
                sorts[i] = members.get(names[i]).sort();
            }
            formulaSort = Sort.struct(name, names, sorts);
        }
        return formulaSort;
    }

    /**
     * Returns the current value of the members as one struct term.
     */
    public Term getFormula() {
        Sort sort = formulaSort();
        TermBuilder b = builder();
        Term[] fields = new Term[sort.fieldCount()];
        for (int i = 0; i != fields.length; ++i) {
            Term t = resolveTerm(lookup(sort.fieldName(i)));
            Sort fieldSort = sort.field(i);
            fields[i] = (fieldSort.isBitvector() || fieldSort.isBool()) ? BitOps.cast(b, t, fieldSort) : t;
        }
        return b.structLiteral(sort, fields);
    }

    public String toString() {
        return name + vars;
    }
}
