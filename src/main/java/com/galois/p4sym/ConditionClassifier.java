package com.galois.p4sym;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Sorts the branch conditions of a pipeline formula by the variables they
 * mention, as needed to pick test inputs:
 * <ul>
 *   <li><em>controllable</em> conditions mention only pipeline inputs, so a
 *     packet can be chosen to satisfy or violate them;</li>
 *   <li><em>undefined</em> conditions mention only variables that are
 *     neither inputs nor table variables, such as extern results;</li>
 *   <li>every other condition is <em>fixed</em>.</li>
 * </ul>
 * Each undefined variable also yields a constraint fixing it to zero.
 */
public final class ConditionClassifier {
    private final String inputPrefix;
    private final ImmutableSet<String> tables;

    private final List<Term> controllable = new ArrayList<Term>();
    private final List<Term> fixed = new ArrayList<Term>();
    private final List<Term> undefined = new ArrayList<Term>();
    private final Set<FreshConstant> undefinedVariables = new LinkedHashSet<FreshConstant>();

    /**
     * @param pipeline name of the evaluated pipeline; its inputs are the
     *   variables named <code>{pipeline}_...</code>.
     * @param tables names of the tables the pipeline may apply; their
     *   variables are <code>{table}_action</code> and
     *   <code>{table}_key_{i}</code>.
     */
    public ConditionClassifier(String pipeline, Collection<String> tables) {
        this.inputPrefix = pipeline + "_";
        this.tables = ImmutableSet.copyOf(tables);
    }

    public boolean isTableKey(FreshConstant c) {
        String name = c.getName();
        for (String t : tables) {
            String prefix = t + "_key_";
            if (name.startsWith(prefix) && name.length() > prefix.length()
                && CharMatcher.inRange('0', '9').matchesAllOf(name.substring(prefix.length()))) {
                return true;
            }
        }
        return false;
    }

    public boolean isActionSelector(FreshConstant c) {
        String name = c.getName();
        return name.endsWith("_action")
            && tables.contains(name.substring(0, name.length() - "_action".length()));
    }

    public boolean isInput(FreshConstant c) {
        return c.getName().startsWith(inputPrefix);
    }

    /** Classify every branch condition of <code>formula</code>. */
    public ConditionClassifier classify(Term formula) {
        for (Term cond : FormulaInspector.branchConditions(formula)) {
            add(cond);
        }
        return this;
    }

    /** Classify one condition. */
    public void add(Term cond) {
        boolean hasInput = false;
        boolean hasTable = false;
        boolean hasUndefined = false;
        for (FreshConstant c : FormulaInspector.freeVariables(cond)) {
            if (isTableKey(c) || isActionSelector(c)) {
                hasTable = true;
            } else if (isInput(c)) {
                hasInput = true;
            } else {
                undefinedVariables.add(c);
                hasUndefined = true;
            }
        }
        if (hasInput && !hasTable && !hasUndefined) {
            controllable.add(cond);
        } else if (hasUndefined && !hasTable && !hasInput) {
            undefined.add(cond);
        } else {
            fixed.add(cond);
        }
    }

    public ImmutableList<Term> getControllable() {
        return ImmutableList.copyOf(controllable);
    }

    public ImmutableList<Term> getFixed() {
        return ImmutableList.copyOf(fixed);
    }

    public ImmutableList<Term> getUndefined() {
        return ImmutableList.copyOf(undefined);
    }

    public ImmutableList<FreshConstant> getUndefinedVariables() {
        return ImmutableList.copyOf(undefinedVariables);
    }

    /**
     * Returns <code>v == 0</code> (<code>v == false</code> for Booleans) for
     * every undefined variable seen so far; struct-sorted variables are
     * skipped.
     */
    public ImmutableList<Term> undefinedConstraints(TermBuilder b) {
        ImmutableList.Builder<Term> result = ImmutableList.builder();
        for (FreshConstant c : undefinedVariables) {
            Sort s = c.sort();
            if (s.isBool()) {
                result.add(b.eq(c, b.boolLiteral(false)));
            } else if (s.isBitvector()) {
                result.add(b.eq(c, b.bvLiteral(s.width(), 0)));
            } else if (s.isInteger()) {
                result.add(b.eq(c, b.intLiteral(0)));
            }
        }
        return result.build();
    }
}
