package com.brainrot.script.analysis;

/** One diagnostic found by {@link SemanticAnalyzer}. */
public final class SemanticError {

    public enum Kind {
        UNDEFINED_VARIABLE,
        UNDEFINED_FUNCTION,
        TYPE_MISMATCH,
        CONST_ASSIGNMENT,
        ARRAY_BOUNDS,
        REDEFINITION,
        SCOPE_ERROR,
        INVALID_OPERATION,
        ARITY_MISMATCH
    }

    private final Kind kind;
    private final String message;
    private final int line;

    public SemanticError(Kind kind, String message, int line) {
        this.kind = kind;
        this.message = message;
        this.line = line;
    }

    public Kind kind() { return kind; }
    public String message() { return message; }
    public int line() { return line; }

    @Override
    public String toString() {
        return (line > 0 ? "line " + line + ": " : "") + kind + ": " + message;
    }
}
