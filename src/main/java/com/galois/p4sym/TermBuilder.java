package com.galois.p4sym;
import java.math.BigInteger;

import com.galois.p4sym.proto.Protos;

/**
 * Builds formula terms.
 *
 * <p>
 * When constant folding is enabled, operations whose arguments are
 * literals are computed immediately, and a small set of identities
 * (absorbing Boolean literals, <code>ite</code> on a literal condition,
 * equality of identical terms, field selection from a struct literal)
 * are applied while building.  Folding never changes the meaning of a
 * term, only its shape.
 */
public final class TermBuilder extends ValueCreator<Term> {
    private final boolean foldConstants;

    public TermBuilder() {
        this(true);
    }

    public TermBuilder(boolean foldConstants) {
        this.foldConstants = foldConstants;
    }

    public boolean foldsConstants() {
        return foldConstants;
    }

    public Term bvLiteral( long width, BigInteger val ) {
        return new BitvectorValue(width, val);
    }

    public Term intLiteral( BigInteger val ) {
        return new IntegerValue(val);
    }

    public Term boolLiteral( boolean val ) {
        return BoolValue.of(val);
    }

    public Term freshConstant( String name, Sort sort ) {
        return new FreshConstant(name, sort);
    }

    protected Term applyPrimitive(Sort res, Protos.PrimitiveOp op, Object... args) {
        Term[] terms = new Term[args.length];
        for (int i = 0; i != args.length; ++i) {
            if (!(args[i] instanceof Term)) {
                throw new IllegalArgumentException("Argument " + i + " of " + op + " is not a term: " + args[i]);
            }
            terms[i] = (Term) args[i];
        }
        if (foldConstants) {
            Term folded = fold(res, op, terms);
            if (folded != null) return folded;
        }
        return new Application(op, res, terms);
    }

    private static boolean isTrue(Term t) {
        return BoolValue.TRUE.equals(t);
    }

    private static boolean isFalse(Term t) {
        return BoolValue.FALSE.equals(t);
    }

    private static boolean isLiteral(Term t) {
        return t instanceof BoolValue
            || t instanceof BitvectorValue
            || t instanceof IntegerValue;
    }

    private static BigInteger bv(Term t) {
        return ((BitvectorValue) t).getValue();
    }

    private static BigInteger integer(Term t) {
        return ((IntegerValue) t).getValue();
    }

    /**
     * Returns the simplified term, or <code>null</code> if no rule applies.
     */
    private Term fold(Sort res, Protos.PrimitiveOp op, Term[] a) {
        switch (op) {
        case BoolNot:
            if (a[0] instanceof BoolValue) return BoolValue.of(!((BoolValue) a[0]).getValue());
            if (a[0] instanceof Application
                && ((Application) a[0]).getOp() == Protos.PrimitiveOp.BoolNot) {
                return ((Application) a[0]).getArg(0);
            }
            return null;
        case BoolAnd:
            if (isFalse(a[0]) || isFalse(a[1])) return BoolValue.FALSE;
            if (isTrue(a[0])) return a[1];
            if (isTrue(a[1]) || a[0].equals(a[1])) return a[0];
            return null;
        case BoolOr:
            if (isTrue(a[0]) || isTrue(a[1])) return BoolValue.TRUE;
            if (isFalse(a[0])) return a[1];
            if (isFalse(a[1]) || a[0].equals(a[1])) return a[0];
            return null;
        case BoolXor:
            if (isFalse(a[0])) return a[1];
            if (isFalse(a[1])) return a[0];
            if (a[0] instanceof BoolValue && a[1] instanceof BoolValue) {
                return BoolValue.of(((BoolValue) a[0]).getValue() != ((BoolValue) a[1]).getValue());
            }
            return null;
        case Ite:
            if (isTrue(a[0])) return a[1];
            if (isFalse(a[0])) return a[2];
            if (a[1].equals(a[2])) return a[1];
            if (isTrue(a[1]) && isFalse(a[2])) return a[0];
            return null;
        case Eq:
            if (a[0].equals(a[1])) return BoolValue.TRUE;
            if (isLiteral(a[0]) && isLiteral(a[1])) return BoolValue.FALSE;
            return null;
        default:
            break;
        }

        if (a.length == 2 && a[0] instanceof IntegerValue && a[1] instanceof IntegerValue) {
            BigInteger x = integer(a[0]);
            BigInteger y = integer(a[1]);
            switch (op) {
            case IntegerAdd: return new IntegerValue(x.add(y));
            default: break;
            }
        }

        if (a.length == 2 && a[0] instanceof BitvectorValue && a[1] instanceof BitvectorValue) {
            long w = ((BitvectorValue) a[0]).width();
            BigInteger x = bv(a[0]);
            BigInteger y = bv(a[1]);
            switch (op) {
            case BVAdd: return new BitvectorValue(w, x.add(y));
            case BVSub: return new BitvectorValue(w, x.subtract(y));
            case BVMul: return new BitvectorValue(w, x.multiply(y));
            case BVUdiv:
                // Division by zero yields all ones, as in SMT-LIB.
                return new BitvectorValue(w, y.signum() == 0 ? BitvectorValue.mask(w) : x.divide(y));
            case BVUrem:
                return new BitvectorValue(w, y.signum() == 0 ? x : x.mod(y));
            case BVAnd: return new BitvectorValue(w, x.and(y));
            case BVOr: return new BitvectorValue(w, x.or(y));
            case BVXor: return new BitvectorValue(w, x.xor(y));
            case BVShl:
                if (y.compareTo(BigInteger.valueOf(w)) >= 0) return new BitvectorValue(w, 0);
                return new BitvectorValue(w, x.shiftLeft(y.intValue()));
            case BVLshr:
                if (y.compareTo(BigInteger.valueOf(w)) >= 0) return new BitvectorValue(w, 0);
                return new BitvectorValue(w, x.shiftRight(y.intValue()));
            case BVUlt: return BoolValue.of(x.compareTo(y) < 0);
            case BVUle: return BoolValue.of(x.compareTo(y) <= 0);
            case BVConcat:
                long yw = ((BitvectorValue) a[1]).width();
                return new BitvectorValue(w + yw, x.shiftLeft((int) yw).or(y));
            default: break;
            }
        }

        switch (op) {
        case BVNot:
            if (a[0] instanceof BitvectorValue) {
                long w = res.width();
                return new BitvectorValue(w, bv(a[0]).xor(BitvectorValue.mask(w)));
            }
            return null;
        case BVNeg:
            if (a[0] instanceof BitvectorValue) {
                return new BitvectorValue(res.width(), bv(a[0]).negate());
            }
            return null;
        case BVSelect: {
            long idx = integer(a[0]).longValue();
            long n = integer(a[1]).longValue();
            if (idx == 0 && n == a[2].sort().width()) return a[2];
            if (a[2] instanceof BitvectorValue) {
                return new BitvectorValue(n, bv(a[2]).shiftRight((int) idx));
            }
            if (a[2] instanceof Application
                && ((Application) a[2]).getOp() == Protos.PrimitiveOp.BVConcat) {
                // Bits taken from only one side of a concatenation.
                Term high = ((Application) a[2]).getArg(0);
                Term low = ((Application) a[2]).getArg(1);
                long lw = low.sort().width();
                if (idx + n <= lw) return bvSelect(idx, n, low);
                if (idx >= lw) return bvSelect(idx - lw, n, high);
            }
            return null;
        }
        case BVZext:
            if (res.equals(a[0].sort())) return a[0];
            if (a[0] instanceof BitvectorValue) return new BitvectorValue(res.width(), bv(a[0]));
            return null;
        case BoolToBV:
            if (a[0] instanceof BoolValue) {
                return new BitvectorValue(res.width(), ((BoolValue) a[0]).getValue() ? 1 : 0);
            }
            return null;
        case StructGet:
            if (a[1] instanceof Application
                && ((Application) a[1]).getOp() == Protos.PrimitiveOp.StructLiteral) {
                return ((Application) a[1]).getArg(integer(a[0]).intValue());
            }
            return null;
        default:
            return null;
        }
    }
}
