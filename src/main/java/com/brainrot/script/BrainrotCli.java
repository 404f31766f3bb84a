package com.brainrot.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.brainrot.debug.Debug;
import com.brainrot.debug.DebugLevel;
import com.brainrot.script.core.Statement;
import com.brainrot.script.json.AstJsonReader;
import com.brainrot.script.json.ValueJson;

/**
 * Runs a program stored as a JSON AST document.
 *
 * Exit status: the program's own status, 1 for a fatal runtime error, 2 for bad usage and
 * 3 when the program file cannot be read or decoded.
 */
public final class BrainrotCli {

    private static final String USAGE =
            "Usage: BrainrotCli <program.json> [--analyze] [--trace] [--dump-globals] [--max-depth N]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        String file = null;
        boolean analyze = false;
        boolean trace = false;
        boolean dumpGlobals = false;
        Integer maxDepth = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--analyze": analyze = true; break;
                case "--trace": trace = true; break;
                case "--dump-globals": dumpGlobals = true; break;
                case "--max-depth":
                    if (i + 1 >= args.length) return usage();
                    try {
                        maxDepth = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("--max-depth expects a number, got " + args[i]);
                        return usage();
                    }
                    if (maxDepth < 1) return usage();
                    break;
                default:
                    if (a.startsWith("--") || file != null) return usage();
                    file = a;
            }
        }
        if (file == null) return usage();

        final Path programPath = Path.of(file);
        final Statement.StatementList program;
        try {
            program = new AstJsonReader().readProgram(Files.readString(programPath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            System.err.println("Failed to read program file: " + programPath);
            e.printStackTrace(System.err);
            return 3;
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid program file " + programPath + ": " + e.getMessage());
            return 3;
        }

        if (trace) Debug.get().setSink(Debug.streamSink(System.err, DebugLevel.TRACE));

        final BrainrotScript engine = new BrainrotScript();
        engine.setSemanticAnalysis(analyze);
        if (maxDepth != null) engine.setMaxCallDepth(maxDepth);

        RunResult result = engine.run(program);
        if (dumpGlobals) {
            System.out.println(ValueJson.toPrettyString(new ObjectMapper(), result.globals()));
        }
        return result.exitCode();
    }

    private static int usage() {
        System.err.println(USAGE);
        return 2;
    }

    private BrainrotCli() {}
}
