package com.galois.p4sym.callable;

import java.util.List;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.Sort;
import com.galois.p4sym.Term;
import com.galois.p4sym.engine.Engine;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;
import com.galois.p4sym.stmt.BlockStatement;
import com.galois.p4sym.types.P4Type;

/**
 * A function.  With a return type the body runs on an isolated copy of the
 * caller's state and only the returned value leaves the call; without one
 * it behaves like an {@link Action}.
 */
public class Function extends Action {
    private final P4Type returnType;

    public Function(String name, P4Type returnType, BlockStatement body) {
        super(name, body);
        this.returnType = returnType;
    }

    public P4Type getReturnType() {
        return returnType;
    }

    protected Value call(ProgramState state, List<BoundArgument> bound) {
        if (returnType == null) {
            return super.call(state, bound);
        }
        ProgramState scratch = state.deepCopy();
        scratch.clearChain();
        scratch.enterCall(getName());
        bindArguments(scratch, scratch, bound);
        scratch.push(getBody());
        Term result = Engine.step(scratch);
        Sort sort = returnType.sort();
        if (result.sort().equals(scratch.formulaSort()) && !sort.equals(result.sort())) {
            throw new MalformedProgramException("Function " + getName() + " ended without returning a value.");
        }
        if (sort.isBitvector() || sort.isBool()) {
            result = BitOps.cast(scratch.builder(), result, sort);
        }
        return Value.of(result);
    }

    public boolean consumesContinuation() {
        return returnType == null;
    }
}
