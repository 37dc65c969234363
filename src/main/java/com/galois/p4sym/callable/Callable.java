package com.galois.p4sym.callable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.engine.Invocable;
import com.galois.p4sym.engine.MemberResolver;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.stmt.AssignmentStatement;
import com.galois.p4sym.stmt.BlockStatement;
import com.galois.p4sym.types.P4Type;

/**
 * Base class of actions, functions, controls, parsers and externs: an
 * ordered list of parameters and a body.
 */
public abstract class Callable implements Invocable, MemberResolver {
    private final String name;
    private final LinkedHashMap<String, Parameter> params = new LinkedHashMap<String, Parameter>();
    private final BlockStatement body;
    private int callCounter;

    protected Callable(String name, BlockStatement body) {
        this.name = name;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public BlockStatement getBody() {
        return body;
    }

    /** Number of times this callable was invoked. */
    public int getCallCounter() {
        return callCounter;
    }

    public Callable addParameter(Direction direction, String paramName, P4Type type) {
        if (params.containsKey(paramName)) {
            throw new IllegalArgumentException("Duplicate parameter " + paramName + " of " + name);
        }
        params.put(paramName, new Parameter(direction, paramName, type));
        return this;
    }

    public ImmutableList<Parameter> getParameters() {
        return ImmutableList.copyOf(params.values());
    }

    /** Parameter names and types, in declaration order. */
    protected Map<String, P4Type> parameterTypes() {
        Map<String, P4Type> types = new LinkedHashMap<String, P4Type>();
        for (Parameter p : params.values()) {
            types.put(p.getName(), p.getType());
        }
        return types;
    }

    public Operand member(String member) {
        return "apply".equals(member) ? this : null;
    }

    public final Value invoke(ProgramState state, List<Operand> args, Map<String, Operand> namedArgs) {
        ++callCounter;
        state.getRegistry().log("call " + name + " #" + callCounter);
        return call(state, mergeParameters(args, namedArgs));
    }

    /**
     * Run this callable with already bound arguments.  Implementations that
     * run a body count the call on the state the body runs in.
     */
    protected abstract Value call(ProgramState state, List<BoundArgument> bound);

    /**
     * Pair positional arguments with parameters in declaration order, then
     * named arguments by name.  Parameters without an argument stay unbound.
     *
     * @throws MalformedProgramException for surplus, unknown or repeated arguments.
     */
    public List<BoundArgument> mergeParameters(List<Operand> args, Map<String, Operand> namedArgs) {
        if (args.size() > params.size()) {
            throw new MalformedProgramException(name + " takes " + params.size()
                                                + " arguments but was given " + args.size() + ".");
        }
        List<Parameter> declared = new ArrayList<Parameter>(params.values());
        List<BoundArgument> bound = new ArrayList<BoundArgument>();
        for (int i = 0; i != args.size(); ++i) {
            bound.add(new BoundArgument(declared.get(i), args.get(i)));
        }
        for (Map.Entry<String, Operand> e : namedArgs.entrySet()) {
            Parameter p = params.get(e.getKey());
            if (p == null) {
                throw new MalformedProgramException(name + " has no parameter " + e.getKey() + ".");
            }
            if (declared.indexOf(p) < args.size()) {
                throw new MalformedProgramException("Parameter " + e.getKey() + " of " + name + " is bound twice.");
            }
            bound.add(new BoundArgument(p, e.getValue()));
        }
        return bound;
    }

    /** Record the bindings of <code>state</code> that the parameters will shadow. */
    protected static List<SavedBinding> saveBindings(ProgramState state, List<BoundArgument> bound) {
        List<SavedBinding> saved = new ArrayList<SavedBinding>();
        for (BoundArgument b : bound) {
            saved.add(new SavedBinding(b.getParameter(), b.getArgument(),
                                       state.getVar(b.getParameter().getName())));
        }
        return saved;
    }

    /**
     * Bind the parameters in <code>callee</code>.  In and inout arguments
     * are resolved in <code>caller</code> before anything is bound.  Out
     * parameters get a fresh value named after the parameter, which is also
     * written to the caller-side argument.
     */
    protected static void bindArguments(ProgramState caller, ProgramState callee, List<BoundArgument> bound) {
        List<Value> values = new ArrayList<Value>();
        for (BoundArgument b : bound) {
            Parameter p = b.getParameter();
            values.add(p.getDirection() == Direction.OUT ? null : caller.resolve(b.getArgument()));
        }
        for (int i = 0; i != bound.size(); ++i) {
            Parameter p = bound.get(i).getParameter();
            if (p.getDirection() == Direction.OUT) {
                Value fresh = caller.getRegistry().instantiate(p.getName(), p.getType());
                AssignmentStatement.assign(caller, bound.get(i).getArgument(), fresh.copy());
                values.set(i, fresh);
            }
        }
        for (int i = 0; i != bound.size(); ++i) {
            Parameter p = bound.get(i).getParameter();
            callee.declareVar(p.getName(), p.coerce(callee.builder(), values.get(i)));
        }
    }

    public String toString() {
        return name;
    }
}
