package com.brainrot.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.brainrot.script.analysis.SemanticError;
import com.brainrot.script.core.BrainrotRuntimeException;
import com.brainrot.script.core.Value;

/** Outcome of one program run: exit status, top-level return value, globals snapshot. */
public class RunResult {
    private final int exitCode;
    private final Value returnValue;
    private final BrainrotRuntimeException error;
    private final Map<String, Value> globals;
    private final List<SemanticError> diagnostics;

    RunResult(int exitCode, Value returnValue, BrainrotRuntimeException error,
              Map<String, Value> globals, List<SemanticError> diagnostics) {
        this.exitCode = exitCode;
        this.returnValue = returnValue;
        this.error = error;
        this.globals = Collections.unmodifiableMap(globals);
        this.diagnostics = (diagnostics == null) ? List.of() : diagnostics;
    }

    public int exitCode() { return exitCode; }

    /** Value of a top-level return statement, or null. */
    public Value returnValue() { return returnValue; }

    /** The fatal error that ended the run, or null. */
    public BrainrotRuntimeException error() { return error; }

    public boolean succeeded() { return error == null; }

    /** Global variables as they were when the program ended. Arrays are shared with the run. */
    public Map<String, Value> globals() { return globals; }

    public Value global(String name) { return globals.get(name); }

    /** Findings of the semantic analyzer, empty when it did not run. */
    public List<SemanticError> diagnostics() { return diagnostics; }
}
