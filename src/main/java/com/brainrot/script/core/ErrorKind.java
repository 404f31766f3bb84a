package com.brainrot.script.core;

/**
 * Runtime error taxonomy. Only division and modulo by zero are recoverable:
 * they are reported and evaluation continues with 0. Every other kind ends the run.
 */
public enum ErrorKind {
    UNDEFINED_VARIABLE("UndefinedVariable", true),
    UNDEFINED_FUNCTION("UndefinedFunction", true),
    UNDEFINED_ARRAY("UndefinedArray", true),
    TYPE_MISMATCH("TypeMismatch", true),
    CONST_VIOLATION("ConstViolation", true),
    ARRAY_BOUNDS_VIOLATION("ArrayBoundsViolation", true),
    ARITY_MISMATCH("ArityMismatch", true),
    DIVISION_BY_ZERO("DivisionByZero", false),
    MODULO_BY_ZERO("ModuloByZero", false),
    UNSUPPORTED_OPERATION("UnsupportedOperation", true),
    ALLOCATION_FAILURE("AllocationFailure", true);

    private final String displayName;
    private final boolean fatal;

    ErrorKind(String displayName, boolean fatal) {
        this.displayName = displayName;
        this.fatal = fatal;
    }

    public String displayName() { return displayName; }

    public boolean isFatal() { return fatal; }
}
