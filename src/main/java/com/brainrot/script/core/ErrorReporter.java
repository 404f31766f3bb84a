package com.brainrot.script.core;

import java.io.PrintStream;

/** Error reporter hook used by the interpreter to surface errors to the host. */
public interface ErrorReporter {
    void report(ErrorKind kind, String message, int line);

    /** Writes "Error (line N): Kind: message" lines to the given stream. */
    static ErrorReporter printingTo(PrintStream err) {
        return (kind, message, line) -> {
            String where = line > 0 ? "Error (line " + line + "): " : "Error: ";
            err.println(where + kind.displayName() + ": " + message);
        };
    }
}
