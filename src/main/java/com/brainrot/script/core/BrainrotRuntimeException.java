package com.brainrot.script.core;

/** Fatal interpreter error. Terminates the running program once it reaches the engine. */
public class BrainrotRuntimeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final int line;

    public BrainrotRuntimeException(ErrorKind kind, String message) {
        this(kind, message, 0);
    }

    public BrainrotRuntimeException(ErrorKind kind, String message, int line) {
        super(message);
        this.kind = kind;
        this.line = line;
    }

    public BrainrotRuntimeException(ErrorKind kind, String message, int line, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.line = line;
    }

    public ErrorKind kind() { return kind; }

    /** Source line, or 0 when the failing node carried none. */
    public int line() { return line; }

    /** Copy carrying the given line, used when the failure was raised below the statement level. */
    public BrainrotRuntimeException atLine(int line) {
        if (this.line > 0 || line <= 0) return this;
        BrainrotRuntimeException copy = new BrainrotRuntimeException(kind, getMessage(), line, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    @Override
    public String toString() {
        return kind.displayName() + ": " + getMessage() + (line > 0 ? " (line " + line + ")" : "");
    }
}
