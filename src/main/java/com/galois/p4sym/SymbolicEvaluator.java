package com.galois.p4sym;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;

import com.galois.p4sym.callable.Control;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramRegistry;
import com.galois.p4sym.proto.Protos;

/**
 * Entry point: evaluates named pipelines of a translated program into
 * closed-form formulas.
 *
 * <p>
 * The formula of a pipeline is a struct term whose fields are the final
 * values of the pipeline's parameters.  Its free variables follow a fixed
 * naming scheme that consumers rely on:
 * <ul>
 *   <li><code>{pipeline}_{parameter}</code> (and dotted members) for inputs,</li>
 *   <li><code>{table}_key_{i}</code> for the value a table key is matched against,</li>
 *   <li><code>{table}_action</code> for the action a table selected,</li>
 *   <li><code>{table}_{action}_{parameter}</code> for control-plane action data,</li>
 *   <li><code>{extern}_{parameter}</code> for values written by externs.</li>
 * </ul>
 */
public final class SymbolicEvaluator {
    private final ProgramRegistry registry;

    public SymbolicEvaluator(ProgramRegistry registry) {
        this.registry = registry;
    }

    public ProgramRegistry getRegistry() {
        return registry;
    }

    /**
     * Set a stream for receiving status messages; <code>null</code>
     * disables them.
     */
    public void setStatusStream(PrintStream s) {
        registry.setStatusStream(s);
    }

    /**
     * Returns the formula of the control or parser called <code>name</code>.
     *
     * @throws UnresolvedReferenceException if no such pipeline is declared.
     * @throws MalformedProgramException if <code>name</code> is not a control.
     */
    public Term evaluatePipeline(String name) {
        Operand o = registry.get(name);
        if (o == null) {
            throw new UnresolvedReferenceException(name);
        }
        if (!(o instanceof Control)) {
            throw new MalformedProgramException(name + " is not a control or parser.");
        }
        return ((Control) o).evaluate(registry);
    }

    /** Evaluate a pipeline and package it for transmission. */
    public Protos.Formula exportPipeline(String name) {
        return FormulaExporter.toFormula(name, evaluatePipeline(name));
    }

    /** Evaluate a pipeline and write it length-delimited to <code>out</code>. */
    public void writePipeline(String name, OutputStream out) throws IOException {
        FormulaExporter.write(exportPipeline(name), out);
    }
}
