package com.galois.p4sym;

import java.io.IOException;
import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.Set;

import com.galois.p4sym.proto.Protos;

/**
 * Renders formulas as SMT-LIB 2 scripts.
 *
 * <p>
 * A script declares a datatype with a single constructor
 * <code>mk-{Name}</code> for every struct sort (selectors are called
 * <code>{Name}.{field}</code>), a constant for every free variable, and a
 * constant named by the caller that is asserted equal to the formula.
 */
public final class SmtLib2Writer {
    private final Appendable out;

    public SmtLib2Writer(Appendable out) {
        this.out = out;
    }

    /** Write a complete script binding <code>outputName</code> to <code>formula</code>. */
    public void writeScript(String outputName, Term formula) throws IOException {
        Set<Term> subterms = FormulaInspector.subterms(formula);
        Set<Sort> structs = new LinkedHashSet<Sort>();
        for (Term t : subterms) {
            collectStructs(t.sort(), structs);
        }
        for (Sort s : structs) {
            writeDatatype(s);
        }
        for (FreshConstant c : FormulaInspector.freeVariables(formula)) {
            out.append("(declare-const ").append(symbol(c.getName())).append(' ')
                .append(sort(c.sort())).append(")\n");
        }
        out.append("(declare-const ").append(symbol(outputName)).append(' ')
            .append(sort(formula.sort())).append(")\n");
        out.append("(assert (= ").append(symbol(outputName)).append(' ');
        writeTerm(formula);
        out.append("))\n");
    }

    /** Structs used by <code>s</code>, nested ones first. */
    private static void collectStructs(Sort s, Set<Sort> acc) {
        if (!s.isStruct() || acc.contains(s)) return;
        for (int i = 0; i != s.fieldCount(); ++i) {
            collectStructs(s.field(i), acc);
        }
        acc.add(s);
    }

    private void writeDatatype(Sort s) throws IOException {
        out.append("(declare-datatypes ((").append(symbol(s.name())).append(" 0)) (((")
            .append(symbol("mk-" + s.name()));
        for (int i = 0; i != s.fieldCount(); ++i) {
            out.append(" (").append(selector(s, i)).append(' ').append(sort(s.field(i))).append(')');
        }
        out.append("))))\n");
    }

    private static String selector(Sort s, int i) {
        return symbol(s.name() + "." + s.fieldName(i));
    }

    /** Quote a symbol; characters SMT-LIB forbids inside quotes are replaced. */
    public static String symbol(String name) {
        return "|" + name.replace('|', '_').replace('\\', '_') + "|";
    }

    public static String sort(Sort s) {
        if (s.isBool()) return "Bool";
        if (s.isInteger()) return "Int";
        if (s.isBitvector()) return "(_ BitVec " + s.width() + ")";
        return symbol(s.name());
    }

    public void writeTerm(Term t) throws IOException {
        if (t instanceof BoolValue) {
            out.append(((BoolValue) t).getValue() ? "true" : "false");
        } else if (t instanceof BitvectorValue) {
            BitvectorValue bv = (BitvectorValue) t;
            out.append("(_ bv").append(bv.getValue().toString()).append(' ')
                .append(Long.toString(bv.width())).append(')');
        } else if (t instanceof IntegerValue) {
            BigInteger v = ((IntegerValue) t).getValue();
            out.append(v.signum() < 0 ? "(- " + v.negate() + ")" : v.toString());
        } else if (t instanceof FreshConstant) {
            out.append(symbol(((FreshConstant) t).getName()));
        } else if (t instanceof Application) {
            writeApplication((Application) t);
        } else {
            throw new UnsupportedOperationException("Cannot render " + t);
        }
    }

    private static long intArg(Application a, int i) {
        return ((IntegerValue) a.getArg(i)).getValue().longValue();
    }

    private void writeApplication(Application a) throws IOException {
        Protos.PrimitiveOp op = a.getOp();
        switch (op) {
        case BVSelect: {
            long low = intArg(a, 0);
            long high = low + intArg(a, 1) - 1;
            out.append("((_ extract ").append(Long.toString(high)).append(' ')
                .append(Long.toString(low)).append(") ");
            writeTerm(a.getArg(2));
            out.append(')');
            return;
        }
        case BVZext:
            out.append("((_ zero_extend ")
                .append(Long.toString(a.sort().width() - a.getArg(0).sort().width())).append(") ");
            writeTerm(a.getArg(0));
            out.append(')');
            return;
        case BoolToBV: {
            long w = a.sort().width();
            out.append("(ite ");
            writeTerm(a.getArg(0));
            out.append(" (_ bv1 ").append(Long.toString(w)).append(") (_ bv0 ")
                .append(Long.toString(w)).append("))");
            return;
        }
        case StructGet: {
            Sort s = a.getArg(1).sort();
            out.append('(').append(selector(s, (int) intArg(a, 0))).append(' ');
            writeTerm(a.getArg(1));
            out.append(')');
            return;
        }
        case StructLiteral:
            if (a.getArgs().isEmpty()) {
                out.append(symbol("mk-" + a.sort().name()));
                return;
            }
            writeCall(symbol("mk-" + a.sort().name()), a);
            return;
        default:
            writeCall(operator(op), a);
        }
    }

    private void writeCall(String fn, Application a) throws IOException {
        out.append('(').append(fn);
        for (Term arg : a.getArgs()) {
            out.append(' ');
            writeTerm(arg);
        }
        out.append(')');
    }

    private static String operator(Protos.PrimitiveOp op) {
        switch (op) {
        case BoolNot: return "not";
        case BoolAnd: return "and";
        case BoolOr: return "or";
        case BoolXor: return "xor";
        case Ite: return "ite";
        case Eq: return "=";
        case IntegerAdd: return "+";
        case BVAdd: return "bvadd";
        case BVSub: return "bvsub";
        case BVMul: return "bvmul";
        case BVUdiv: return "bvudiv";
        case BVUrem: return "bvurem";
        case BVNeg: return "bvneg";
        case BVNot: return "bvnot";
        case BVAnd: return "bvand";
        case BVOr: return "bvor";
        case BVXor: return "bvxor";
        case BVShl: return "bvshl";
        case BVLshr: return "bvlshr";
        case BVUlt: return "bvult";
        case BVUle: return "bvule";
        case BVConcat: return "concat";
        default:
            throw new UnsupportedOperationException("No SMT-LIB operator for " + op);
        }
    }
}
