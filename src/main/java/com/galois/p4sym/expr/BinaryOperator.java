package com.galois.p4sym.expr;

/**
 * Operators of {@link BinaryExpression}.  Arithmetic is unsigned and
 * modular; the saturating variants clamp instead of wrapping.
 */
public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    ADD_SAT("|+|"),
    SUB_SAT("|-|"),
    SHL("<<"),
    SHR(">>"),
    BAND("&"),
    BOR("|"),
    BXOR("^"),
    MASK("&&&"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    LAND("&&"),
    LOR("||");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
