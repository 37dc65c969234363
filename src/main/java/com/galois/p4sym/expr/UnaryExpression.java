package com.galois.p4sym.expr;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.IntValue;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.Value;

public final class UnaryExpression implements Expression {
    public enum Operator {
        /** Logical not. */
        LNOT("!"),
        /** Bitwise complement. */
        BNOT("~"),
        /** Two's complement negation. */
        NEG("-");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Operator op;
    private final Operand operand;

    public UnaryExpression(Operator op, Operand operand) {
        this.op = op;
        this.operand = operand;
    }

    public Value evaluate(ProgramState state) {
        TermBuilder b = state.builder();
        Value v = state.resolve(operand);
        if (v.kind() == Value.Kind.INTEGER && op == Operator.NEG) {
            return new IntValue(((IntValue) v).getValue().negate());
        }
        Term t = v.toTerm(b);
        switch (op) {
        case LNOT:
            return Value.of(b.not(BitOps.castToBool(b, t)));
        case BNOT:
            if (v.kind() == Value.Kind.INTEGER) {
                throw new UnsupportedValueException(v.kind().toString(), "with operator ~");
            }
            return Value.of(b.bvNot(t));
        case NEG:
        default:
            return Value.of(b.bvNeg(BitOps.asBitvector(b, t)));
        }
    }

    public String toString() {
        return op.symbol() + operand;
    }
}
