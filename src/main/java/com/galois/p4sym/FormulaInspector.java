package com.galois.p4sym;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.galois.p4sym.proto.Protos;

/**
 * Queries over the structure of a formula.  Shared sub-terms are visited
 * once.
 */
public final class FormulaInspector {
    private FormulaInspector() {}

    /** Returns the free variables of <code>t</code> in depth-first order. */
    public static Set<FreshConstant> freeVariables(Term t) {
        Set<FreshConstant> result = new LinkedHashSet<FreshConstant>();
        for (Term s : subterms(t)) {
            if (s instanceof FreshConstant) {
                result.add((FreshConstant) s);
            }
        }
        return result;
    }

    /**
     * Returns the condition of every <code>ite</code> in <code>t</code>,
     * outermost first, without duplicates.
     */
    public static Set<Term> branchConditions(Term t) {
        Set<Term> result = new LinkedHashSet<Term>();
        for (Term s : subterms(t)) {
            if (s instanceof Application && ((Application) s).getOp() == Protos.PrimitiveOp.Ite) {
                result.add(((Application) s).getArg(0));
            }
        }
        return result;
    }

    /** All distinct sub-terms of <code>t</code> (including itself) in pre-order. */
    public static Set<Term> subterms(Term t) {
        Set<Term> seen = new LinkedHashSet<Term>();
        Deque<Term> work = new ArrayDeque<Term>();
        work.push(t);
        while (!work.isEmpty()) {
            Term next = work.pop();
            if (!seen.add(next)) continue;
            if (next instanceof Application) {
                List<Term> args = ((Application) next).getArgs();
                for (int i = args.size() - 1; i >= 0; --i) {
                    if (!seen.contains(args.get(i))) {
                        work.push(args.get(i));
                    }
                }
            }
        }
        return seen;
    }
}
