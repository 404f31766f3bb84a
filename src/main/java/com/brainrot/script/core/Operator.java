package com.brainrot.script.core;

public enum Operator {
    // binary
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    MOD("%"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),
    AND("&&"),
    OR("||"),

    // unary
    NEG("-"),
    PRE_INC("++x"),
    PRE_DEC("--x"),
    POST_INC("x++"),
    POST_DEC("x--");

    public final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public boolean isUnary() {
        return ordinal() >= NEG.ordinal();
    }

    public boolean isComparison() {
        return this == LT || this == GT || this == LE || this == GE || this == EQ || this == NE;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isArithmetic() {
        return this == PLUS || this == MINUS || this == TIMES || this == DIVIDE || this == MOD;
    }

    public boolean isIncrement() {
        return this == PRE_INC || this == PRE_DEC || this == POST_INC || this == POST_DEC;
    }

    public static Operator binary(String symbol) {
        for (Operator op : values()) {
            if (!op.isUnary() && op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }

    public static Operator unary(String symbol) {
        for (Operator op : values()) {
            if (op.isUnary() && op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown unary operator: " + symbol);
    }
}
