package com.galois.p4sym.types;

import java.util.List;
import java.util.Map;

import com.galois.p4sym.BoolValue;
import com.galois.p4sym.MalformedProgramException;
import com.galois.p4sym.engine.Invocable;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

/**
 * One of the built-in methods of a header instance, bound to the live
 * header it was looked up on.
 */
public final class HeaderMethod implements Invocable {
    public enum Kind {
        IS_VALID("isValid"),
        SET_VALID("setValid"),
        SET_INVALID("setInvalid");

        private final String methodName;

        Kind(String methodName) {
            this.methodName = methodName;
        }

        public String methodName() {
            return methodName;
        }
    }

    private final HeaderValue header;
    private final Kind kind;

    public HeaderMethod(HeaderValue header, Kind kind) {
        this.header = header;
        this.kind = kind;
    }

    /**
     * Returns the method called <code>name</code> on <code>header</code>, or
     * <code>null</code> if headers have no such method.
     */
    public static HeaderMethod forName(HeaderValue header, String name) {
        for (Kind k : Kind.values()) {
            if (k.methodName().equals(name)) {
                return new HeaderMethod(header, k);
            }
        }
        return null;
    }

    public Kind getKind() {
        return kind;
    }

    public Value invoke(ProgramState state, List<Operand> args, Map<String, Operand> namedArgs) {
        if (!args.isEmpty() || !namedArgs.isEmpty()) {
            throw new MalformedProgramException(kind.methodName() + " takes no arguments.");
        }
        switch (kind) {
        case IS_VALID:
            return Value.of(header.isValid());
        case SET_VALID:
            header.setValid(BoolValue.TRUE);
            return Value.of(true);
        case SET_INVALID:
        default:
            header.setValid(BoolValue.FALSE);
            return Value.of(false);
        }
    }

    public boolean consumesContinuation() {
        return false;
    }

    public String toString() {
        return header.getName() + "." + kind.methodName();
    }
}
