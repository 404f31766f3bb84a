package com.brainrot.script.core;

import java.util.Locale;

/** Declared types of variables, parameters and function results. */
public enum VarType {
    SHORT(2),
    INT(4),
    FLOAT(4),
    DOUBLE(8),
    BOOL(1),
    CHAR(1),
    STRING(8),
    VOID(0);

    private final int width;

    VarType(int width) {
        this.width = width;
    }

    /** Natural byte width, as reported by sizeof. STRING reports its reference width. */
    public int width() { return width; }

    public boolean isNumeric() {
        return this == SHORT || this == INT || this == FLOAT || this == DOUBLE || this == CHAR;
    }

    public boolean isIntegral() {
        return this == SHORT || this == INT || this == CHAR || this == BOOL;
    }

    public boolean isFloating() {
        return this == FLOAT || this == DOUBLE;
    }

    /** The value a freshly declared variable of this type holds. */
    public Value zero() {
        switch (this) {
            case SHORT: return Value.int16((short) 0);
            case INT: return Value.int32(0);
            case FLOAT: return Value.float32(0f);
            case DOUBLE: return Value.float64(0d);
            case BOOL: return Value.bool(false);
            case CHAR: return Value.character(0);
            case STRING: return Value.string("");
            default: throw new IllegalStateException("No zero value for " + this);
        }
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VarType fromKeyword(String keyword) {
        if (keyword == null) throw new IllegalArgumentException("Missing type keyword");
        try {
            return VarType.valueOf(keyword.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown type keyword: " + keyword, e);
        }
    }
}
