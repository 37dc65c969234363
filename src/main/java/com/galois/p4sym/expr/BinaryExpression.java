package com.galois.p4sym.expr;

import java.math.BigInteger;

import com.galois.p4sym.BitOps;
import com.galois.p4sym.BitvectorValue;
import com.galois.p4sym.BoolValue;
import com.galois.p4sym.Term;
import com.galois.p4sym.TermBuilder;
import com.galois.p4sym.UnsupportedValueException;
import com.galois.p4sym.engine.Expression;
import com.galois.p4sym.engine.IntValue;
import com.galois.p4sym.engine.Operand;
import com.galois.p4sym.engine.ProgramState;
import com.galois.p4sym.engine.TermValue;
import com.galois.p4sym.engine.Value;

/**
 * A binary operation.  The left operand is evaluated first.  Logical and
 * and or skip the right operand when the left one is the literal
 * <code>false</code> or <code>true</code> respectively.
 */
public final class BinaryExpression implements Expression {
    private final BinaryOperator op;
    private final Operand left;
    private final Operand right;

    public BinaryExpression(BinaryOperator op, Operand left, Operand right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public Value evaluate(ProgramState state) {
        TermBuilder b = state.builder();
        Value l = state.resolve(left);
        if (op == BinaryOperator.LAND && isLiteral(l, false)) {
            return Value.of(false);
        }
        if (op == BinaryOperator.LOR && isLiteral(l, true)) {
            return Value.of(true);
        }
        Value r = state.resolve(right);
        if (l.kind() == Value.Kind.INTEGER && r.kind() == Value.Kind.INTEGER) {
            Value v = evaluateIntegers(((IntValue) l).getValue(), ((IntValue) r).getValue());
            if (v != null) return v;
        }
        Term[] xy = BitOps.align(b, l.toTerm(b), r.toTerm(b));
        return Value.of(apply(b, xy[0], xy[1]));
    }

    private static boolean isLiteral(Value v, boolean b) {
        return v instanceof TermValue && BoolValue.of(b).equals(((TermValue) v).getTerm());
    }

    /**
     * Integer literal arithmetic.  Returns <code>null</code> for operators
     * that need a width.
     */
    private Value evaluateIntegers(BigInteger x, BigInteger y) {
        switch (op) {
        case ADD: return new IntValue(x.add(y));
        case SUB: return new IntValue(x.subtract(y));
        case MUL: return new IntValue(x.multiply(y));
        case DIV:
            if (y.signum() == 0) return null;
            return new IntValue(x.divide(y));
        case MOD:
            if (y.signum() == 0) return null;
            return new IntValue(x.mod(y.abs()));
        case SHL: return new IntValue(x.shiftLeft(y.intValue()));
        case SHR: return new IntValue(x.shiftRight(y.intValue()));
        case BAND:
        case MASK: return new IntValue(x.and(y));
        case BOR: return new IntValue(x.or(y));
        case BXOR: return new IntValue(x.xor(y));
        case EQ: return Value.of(x.equals(y));
        case NE: return Value.of(!x.equals(y));
        case LT: return Value.of(x.compareTo(y) < 0);
        case LE: return Value.of(x.compareTo(y) <= 0);
        case GT: return Value.of(x.compareTo(y) > 0);
        case GE: return Value.of(x.compareTo(y) >= 0);
        default: return null;
        }
    }

    private Term apply(TermBuilder b, Term x, Term y) {
        switch (op) {
        case EQ: return equality(b, x, y);
        case NE: return b.not(equality(b, x, y));
        case LAND: return b.and(BitOps.castToBool(b, x), BitOps.castToBool(b, y));
        case LOR: return b.or(BitOps.castToBool(b, x), BitOps.castToBool(b, y));
        default: break;
        }
        x = BitOps.asBitvector(b, x);
        y = BitOps.asBitvector(b, y);
        Term[] xy = BitOps.align(b, x, y);
        x = xy[0];
        y = xy[1];
        switch (op) {
        case ADD: return b.bvAdd(x, y);
        case SUB: return b.bvSub(x, y);
        case MUL: return b.bvMul(x, y);
        case DIV: return b.bvUdiv(x, y);
        case MOD: return b.bvUrem(x, y);
        case ADD_SAT: {
            Term sum = b.bvAdd(x, y);
            Term max = b.bvLiteral(x.sort().width(), BitvectorValue.mask(x.sort().width()));
            return b.ite(b.bvUlt(sum, x), max, sum);
        }
        case SUB_SAT:
            return b.ite(b.bvUlt(x, y), b.bvLiteral(x.sort().width(), 0), b.bvSub(x, y));
        case SHL: return b.bvShl(x, y);
        case SHR: return b.bvLshr(x, y);
        case BAND:
        case MASK: return b.bvAnd(x, y);
        case BOR: return b.bvOr(x, y);
        case BXOR: return b.bvXor(x, y);
        case LT: return b.bvUlt(x, y);
        case LE: return b.bvUle(x, y);
        case GT: return b.bvUgt(x, y);
        case GE: return b.bvUge(x, y);
        default:
            throw new UnsupportedValueException(x.sort().toString(), "with operator " + op.symbol());
        }
    }

    private static Term equality(TermBuilder b, Term x, Term y) {
        if (x.sort().isBool() && y.sort().isBitvector()) {
            x = BitOps.cast(b, x, y.sort());
        } else if (y.sort().isBool() && x.sort().isBitvector()) {
            y = BitOps.cast(b, y, x.sort());
        }
        return b.eq(x, y);
    }

    public String toString() {
        return "(" + left + " " + op.symbol() + " " + right + ")";
    }
}
