package com.brainrot.script;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.brainrot.debug.Debug;
import com.brainrot.script.analysis.SemanticAnalyzer;
import com.brainrot.script.analysis.SemanticError;
import com.brainrot.script.core.BrainrotRuntimeException;
import com.brainrot.script.core.Environment;
import com.brainrot.script.core.ErrorReporter;
import com.brainrot.script.core.FunctionTable;
import com.brainrot.script.core.Interpreter;
import com.brainrot.script.core.Statement.Stmt;
import com.brainrot.script.core.Value;
import com.brainrot.script.core.Variable;
import com.brainrot.script.json.AstJsonReader;
import com.brainrot.script.stdrot.Sleeper;
import com.brainrot.script.stdrot.StdRot;

/**
 * Brainrot engine: runs programs handed over as ASTs (built with
 * {@link com.brainrot.script.core.Ast} or read from JSON).
 *
 * - Types: short, int, float, double, bool, char, string, arrays of up to 8 dimensions
 * - Control flow: if / for / while / do-while / switch / break / return
 * - Functions: by-value parameters, no access to the caller's variables
 * - Builtins: yapping, yappin, baka, ragequit, chill, slorp
 *
 * Each run gets a fresh interpreter, scope chain and function table.
 *
 * ERROR HANDLING CONTRACT:
 *   - Division or modulo by zero on integers is reported and evaluation continues with 0.
 *   - Every other runtime error is reported once and ends the run with exit status 1;
 *     no exception escapes to the host.
 */
public class BrainrotScript {

    private static final String TAG = "brainrot.engine";

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private BufferedReader in;
    private Sleeper sleeper = Sleeper.SYSTEM;
    private ErrorReporter errorReporter;
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private boolean semanticAnalysis;

    private final AstJsonReader jsonReader = new AstJsonReader();

    public void setOut(PrintStream out) { this.out = (out == null) ? System.out : out; }

    public void setErr(PrintStream err) { this.err = (err == null) ? System.err : err; }

    public void setIn(Reader reader) {
        this.in = (reader == null) ? null
                : (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);
    }

    public void setIn(InputStream stream) {
        setIn(stream == null ? null : new InputStreamReader(stream, StandardCharsets.UTF_8));
    }

    public void setSleeper(Sleeper sleeper) { this.sleeper = (sleeper == null) ? Sleeper.SYSTEM : sleeper; }

    /** Replaces the default reporter, which prints "Error (line N): Kind: message" to stderr. */
    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be positive, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** When enabled, the semantic analyzer runs before each program and its findings are printed as warnings. */
    public void setSemanticAnalysis(boolean enabled) { this.semanticAnalysis = enabled; }

    // ===================== RUN =====================

    public RunResult runJson(String programJson) {
        return run(jsonReader.readProgram(programJson));
    }

    public RunResult run(Stmt program) {
        ErrorReporter reporter = (errorReporter != null) ? errorReporter : ErrorReporter.printingTo(err);

        List<SemanticError> diagnostics = List.of();
        if (semanticAnalysis) {
            diagnostics = analyze(program);
            for (SemanticError d : diagnostics) {
                Debug.get().w(TAG, d.toString());
                err.println("Warning: " + d);
            }
        }

        StdRot stdrot = new StdRot(sleeper);
        Environment env = new Environment();
        Interpreter interpreter = new Interpreter(env, new FunctionTable(), stdrot.builtins(), reporter,
                out, err, stdin(), maxCallDepth);

        Debug.get().d(TAG, "run start (maxCallDepth=" + maxCallDepth + ")");
        try {
            Interpreter.Completion done = interpreter.run(program);
            Debug.get().d(TAG, "run finished with status " + done.exitCode);
            return new RunResult(done.exitCode, done.returnValue, null, snapshot(env), diagnostics);
        } catch (BrainrotRuntimeException e) {
            reporter.report(e.kind(), e.getMessage(), e.line());
            Debug.get().e(TAG, "run failed: " + e, e);
            return new RunResult(1, null, e, snapshot(env), diagnostics);
        } finally {
            out.flush();
            err.flush();
        }
    }

    public List<SemanticError> analyze(Stmt program) {
        return new SemanticAnalyzer(new StdRot(sleeper).builtins().keySet()).analyze(program);
    }

    private BufferedReader stdin() {
        if (in == null) in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return in;
    }

    private static Map<String, Value> snapshot(Environment env) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Variable> e : env.global().variables().entrySet()) {
            out.put(e.getKey(), e.getValue().get());
        }
        return out;
    }
}
