package com.galois.p4sym.stmt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.engine.Engine;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Statement;
import com.galois.p4sym.table.Table;

/**
 * <code>switch (table.apply().action_run)</code>: applies the table and
 * then branches on which action it selected.
 */
public final class SwitchStatement implements Statement {
    private final String tableName;
    private final LinkedHashMap<String, Statement> cases = new LinkedHashMap<String, Statement>();
    private Statement defaultCase = new BlockStatement();

    public SwitchStatement(String tableName) {
        this.tableName = tableName;
    }

    /** Add the case for an action; cases are checked in the order added. */
    public SwitchStatement addCase(String action, Statement body) {
        if (cases.containsKey(action)) {
            throw new IllegalArgumentException("Duplicate case " + action + " in switch on " + tableName);
        }
        cases.put(action, body);
        return this;
    }

    public SwitchStatement setDefault(Statement body) {
        this.defaultCase = body;
        return this;
    }

    public Term execute(ProgramState state) {
        Operand o = state.lookup(tableName);
        if (!(o instanceof Table)) {
            throw new MalformedProgramException("Switch on " + tableName + ", which is not a table.");
        }
        Table table = (Table) o;
        for (String action : cases.keySet()) {
            table.actionId(action);
        }
        state.push(new SwitchHit(table, new LinkedHashMap<String, Statement>(cases), defaultCase));
        state.push(table);
        return null;
    }

    public String toString() {
        return "switch (" + tableName + ".apply().action_run)";
    }

    /**
     * Runs after the table's action: one branch per case, guarded by the
     * table's action selector, nested so that the first case is checked
     * outermost and the default block is innermost.
     */
    static final class SwitchHit implements Statement {
        private final Table table;
        private final Map<String, Statement> cases;
        private final Statement defaultCase;

        SwitchHit(Table table, Map<String, Statement> cases, Statement defaultCase) {
            this.table = table;
            this.cases = cases;
            this.defaultCase = defaultCase;
        }

        public Term execute(ProgramState state) {
            TermBuilder b = state.builder();
            Term selector = table.actionSelector(b);
            Map<String, Term> results = new LinkedHashMap<String, Term>();
            for (Map.Entry<String, Statement> c : cases.entrySet()) {
                ProgramState copy = state.deepCopy();
                copy.push(c.getValue());
                results.put(c.getKey(), Engine.step(copy));
            }
            state.push(defaultCase);
            Term expr = Engine.step(state);
            List<String> names = new ArrayList<String>(results.keySet());
            for (int i = names.size() - 1; i >= 0; --i) {
                String action = names.get(i);
                Term guard = b.eq(selector, b.intLiteral(table.actionId(action)));
                expr = b.ite(guard, results.get(action), expr);
            }
            return expr;
        }

        public String toString() {
            return "switch hit on " + table.getName();
        }
    }
}
