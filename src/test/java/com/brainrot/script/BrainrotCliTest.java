package com.brainrot.script;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.brainrot.debug.Debug;

public class BrainrotCliTest {

    @TempDir
    Path dir;

    private final PrintStream realOut = System.out;
    private final PrintStream realErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void captureStreams() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(realOut);
        System.setErr(realErr);
        Debug.get().setSink(null);
    }

    private Path write(String name, String json) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void runsProgramAndReturnsItsStatus() throws IOException {
        Path file = write("quit.json", String.join("\n",
                "[",
                "  { \"kind\": \"print\", \"value\": { \"kind\": \"string\", \"value\": \"bye\" } },",
                "  { \"kind\": \"expression\", \"expression\": { \"kind\": \"call\", \"name\": \"ragequit\",",
                "    \"args\": [ { \"kind\": \"int\", \"value\": 5 } ] } }",
                "]"
        ));

        assertEquals(5, BrainrotCli.run(new String[] {file.toString()}));
        assertEquals("bye", out.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void fatalRuntimeErrorExitsWithOne() throws IOException {
        Path file = write("bad.json",
                "[ { \"kind\": \"print\", \"value\": { \"kind\": \"identifier\", \"name\": \"nope\" }, \"line\": 2 } ]");

        assertEquals(1, BrainrotCli.run(new String[] {file.toString()}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Error (line 2): UndefinedVariable"));
    }

    @Test
    void dumpGlobalsPrintsJson() throws IOException {
        Path file = write("globals.json",
                "[ { \"kind\": \"declaration\", \"type\": \"double\", \"name\": \"ratio\", \"init\": { \"kind\": \"double\", \"value\": 0.5 } } ]");

        assertEquals(0, BrainrotCli.run(new String[] {file.toString(), "--dump-globals", "--max-depth", "8"}));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("\"ratio\" : 0.5"));
    }

    @Test
    void analyzeFlagPrintsWarnings() throws IOException {
        Path file = write("warn.json", String.join("\n",
                "[ { \"kind\": \"print\", \"line\": 1, \"value\": { \"kind\": \"binary\", \"op\": \"%\",",
                "    \"left\": { \"kind\": \"int\", \"value\": 1 }, \"right\": { \"kind\": \"int\", \"value\": 0 } } } ]"
        ));

        assertEquals(0, BrainrotCli.run(new String[] {"--analyze", file.toString()}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Warning: line 1: INVALID_OPERATION"));
    }

    @Test
    void badUsageExitsWithTwo() {
        assertEquals(2, BrainrotCli.run(new String[] {}));
        assertEquals(2, BrainrotCli.run(new String[] {"a.json", "b.json"}));
        assertEquals(2, BrainrotCli.run(new String[] {"a.json", "--max-depth"}));
        assertEquals(2, BrainrotCli.run(new String[] {"a.json", "--max-depth", "lots"}));
        assertEquals(2, BrainrotCli.run(new String[] {"a.json", "--max-depth", "0"}));
        assertEquals(2, BrainrotCli.run(new String[] {"a.json", "--verbose"}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: BrainrotCli"));
    }

    @Test
    void unreadableOrInvalidFileExitsWithThree() throws IOException {
        assertEquals(3, BrainrotCli.run(new String[] {dir.resolve("missing.json").toString()}));

        Path junk = write("junk.json", "{ this is not json");
        assertEquals(3, BrainrotCli.run(new String[] {junk.toString()}));

        Path unknown = write("unknown.json", "[ { \"kind\": \"goto\" } ]");
        assertEquals(3, BrainrotCli.run(new String[] {unknown.toString()}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("unknown statement kind 'goto'"));
    }
}
