package com.galois.p4sym;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.galois.p4sym.proto.Protos;

/**
 * Converts formulas to and from their protocol buffer representation.
 * Messages on a stream are length-delimited so that several formulas can
 * follow each other.
 */
public final class FormulaExporter {
    private FormulaExporter() {}

    public static Protos.Formula toFormula(String pipeline, Term term) {
        Protos.Formula.Builder b
            = Protos.Formula.newBuilder()
            .setPipeline(pipeline)
            .setTerm(term.getTermRep());
        for (FreshConstant c : FormulaInspector.freeVariables(term)) {
            b.addFreeVariable(c.getTermRep());
        }
        return b.build();
    }

    public static void write(Protos.Formula formula, OutputStream out) throws IOException {
        formula.writeDelimitedTo(out);
        out.flush();
    }

    /**
     * Read the next formula from <code>in</code>.
     *
     * @return the formula, or <code>null</code> at end of stream.
     */
    public static Protos.Formula read(InputStream in) throws IOException {
        return Protos.Formula.parseDelimitedFrom(in);
    }
}
