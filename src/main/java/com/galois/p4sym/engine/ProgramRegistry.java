package com.galois.p4sym.engine;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

import com.galois.p4sym.EvaluatorOptions;
import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.types.P4Type;

/**
 * The global declarations of a program (callables, tables, types and
 * constants) together with the evaluation settings shared by every program
 * state built from it.
 *
 * <p>
 * The registry is populated once while a program is translated and is only
 * read during evaluation.
 */
public final class ProgramRegistry {
    private final Map<String, Operand> declarations = new LinkedHashMap<String, Operand>();
    private final EvaluatorOptions options;
    private final TermBuilder builder;

    private PrintStream statusStream;

    public ProgramRegistry() {
        this(new EvaluatorOptions());
    }

    public ProgramRegistry(EvaluatorOptions options) {
        this.options = options;
        this.builder = new TermBuilder(options.getFoldConstants());
    }

    /**
     * Declare a global.
     *
     * @throws IllegalArgumentException if the name is already declared.
     */
    public ProgramRegistry declare(String name, Operand value) {
        if (declarations.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate declaration of " + name);
        }
        declarations.put(name, value);
        return this;
    }

    public ProgramRegistry declare(P4Type type) {
        return declare(type.name(), type);
    }

    /** Returns the global called <code>name</code>, or <code>null</code>. */
    public Operand get(String name) {
        return declarations.get(name);
    }

    public boolean contains(String name) {
        return declarations.containsKey(name);
    }

    public EvaluatorOptions getOptions() {
        return options;
    }

    public TermBuilder builder() {
        return builder;
    }

    /**
     * Create a state named <code>name</code> whose output is the given
     * members, each bound to a fresh instance named
     * <code>{name}_{member}</code>.
     */
    public ProgramState newState(String name, Map<String, P4Type> members) {
        ProgramState state = new ProgramState(name, members, this);
        for (Map.Entry<String, P4Type> e : members.entrySet()) {
            state.setOrAddVar(e.getKey(), instantiate(name + "_" + e.getKey(), e.getValue()));
        }
        return state;
    }

    /** Create an unconstrained value of <code>type</code>. */
    public Value instantiate(String name, P4Type type) {
        if (type == null) {
            throw new MalformedProgramException("Cannot instantiate " + name + " without a type.");
        }
        return type.instantiate(name, builder);
    }

    /**
     * Set a stream for receiving status messages from the evaluator.
     * Passing <code>null</code> disables them.
     */
    public void setStatusStream(PrintStream s) {
        this.statusStream = s;
    }

    public PrintStream getStatusStream() {
        return statusStream;
    }

    public void log(String msg) {
        PrintStream s = statusStream;
        if (s != null) {
            s.println(msg);
            s.flush();
        }
    }
}
