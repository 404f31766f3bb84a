import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.brainrot.script.BrainrotScript;
import com.brainrot.script.RunResult;
import com.brainrot.script.core.ArrayStorage;
import com.brainrot.script.core.Expr;
import com.brainrot.script.core.Operator;
import com.brainrot.script.core.Statement;
import com.brainrot.script.core.Value;
import com.brainrot.script.core.VarType;
import com.brainrot.script.json.AstJsonReader;
import com.brainrot.script.json.ValueJson;

public class BrainrotJsonProgramTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private BrainrotScript engine;
    private final AstJsonReader reader = new AstJsonReader();

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        engine = new BrainrotScript();
        engine.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        engine.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String errors() {
        return err.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private RunResult runResource(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/programs/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return engine.run(reader.readProgram(in));
        }
    }

    @Test
    void arithmeticProgram() throws IOException {
        RunResult r = runResource("arithmetic.json");

        assertTrue(r.succeeded());
        assertEquals("2\n0\n4\n", output());
        assertEquals("Error (line 6): DivisionByZero: Division by zero\n", errors());
    }

    @Test
    void matrixProgram() throws IOException {
        RunResult r = runResource("matrix.json");

        assertTrue(r.succeeded(), () -> String.valueOf(r.error()));
        assertEquals("9\n0\nno cap, size 24\n", output());
    }

    @Test
    void functionsProgram() throws IOException {
        RunResult r = runResource("functions.json");

        assertTrue(r.succeeded(), () -> String.valueOf(r.error()));
        assertEquals("42\n3 2 1 liftoff\n", output());
    }

    @Test
    void controlProgramReturnsStatus() throws IOException {
        RunResult r = runResource("control.json");

        assertTrue(r.succeeded(), () -> String.valueOf(r.error()));
        assertEquals("18\n", output());
        assertEquals("once\n", errors());
        assertEquals(3, r.exitCode());
        assertEquals(18, r.global("total").asInt());
    }

    @Test
    void readerBuildsTypedNodes() {
        Statement.StatementList program = reader.readProgram(String.join("\n",
                "[",
                "  { \"kind\": \"declaration\", \"type\": \"int\", \"name\": \"n\", \"modifiers\": [\"unsigned\", \"volatile\"],",
                "    \"init\": { \"kind\": \"binary\", \"op\": \"%\", \"unsigned\": true, \"line\": 4,",
                "      \"left\": { \"kind\": \"char\", \"value\": \"z\" }, \"right\": { \"kind\": \"char\", \"value\": 10 } } }",
                "]"
        ));

        assertEquals(1, program.statements.size());
        Statement.Declaration decl = (Statement.Declaration) program.statements.get(0);
        assertEquals(VarType.INT, decl.type);
        assertTrue(decl.modifiers.isUnsigned);
        assertTrue(decl.modifiers.isVolatile);
        assertFalse(decl.modifiers.isConst);

        Expr.Binary init = (Expr.Binary) decl.initializer;
        assertEquals(Operator.MOD, init.operator);
        assertTrue(init.unsigned);
        assertEquals(4, init.line());
        assertEquals(Value.character('z'), ((Expr.Literal) init.left).value);
        assertEquals(Value.character(10), ((Expr.Literal) init.right).value);
    }

    @Test
    void malformedDocumentsNameTheOffendingPath() {
        IllegalArgumentException missingKind = assertThrows(IllegalArgumentException.class,
                () -> reader.readProgram("{ \"program\": [ { \"name\": \"x\" } ] }"));
        assertTrue(missingKind.getMessage().startsWith("$.program[0].kind"), missingKind.getMessage());

        IllegalArgumentException badOp = assertThrows(IllegalArgumentException.class,
                () -> reader.readProgram("[ { \"kind\": \"print\", \"value\": { \"kind\": \"binary\", \"op\": \"^\","
                        + " \"left\": { \"kind\": \"int\", \"value\": 1 }, \"right\": { \"kind\": \"int\", \"value\": 2 } } } ]"));
        assertTrue(badOp.getMessage().startsWith("$[0].value.op"), badOp.getMessage());

        IllegalArgumentException badModifier = assertThrows(IllegalArgumentException.class,
                () -> reader.readProgram("[ { \"kind\": \"declaration\", \"type\": \"int\", \"name\": \"x\", \"modifiers\": [\"static\"] } ]"));
        assertTrue(badModifier.getMessage().startsWith("$[0].modifiers"), badModifier.getMessage());

        assertThrows(IllegalArgumentException.class, () -> reader.readProgram("{ \"statements\": [] }"));
        assertThrows(IllegalArgumentException.class, () -> reader.readProgram("not json"));
        assertThrows(IllegalArgumentException.class, () -> engine.runJson("[ { \"kind\": \"teleport\" } ]"));
    }

    @Test
    void globalsRenderAsJson() {
        ArrayStorage grid = new ArrayStorage(VarType.INT, 2, 2);
        grid.set(new int[] {1, 0}, Value.int32(7));
        ArrayStorage word = new ArrayStorage(VarType.CHAR, 3);
        word.storeCString("ok");

        Map<String, Value> globals = new LinkedHashMap<>();
        globals.put("n", Value.int32(3));
        globals.put("flag", Value.bool(true));
        globals.put("letter", Value.character('q'));
        globals.put("grid", Value.array(grid));
        globals.put("word", Value.array(word));

        JsonNode json = ValueJson.toJson(globals);
        assertEquals(3, json.get("n").intValue());
        assertTrue(json.get("flag").booleanValue());
        assertEquals("q", json.get("letter").textValue());
        assertEquals(7, json.get("grid").get(1).get(0).intValue());
        assertEquals(0, json.get("grid").get(0).get(1).intValue());
        assertEquals("o", json.get("word").get(0).textValue());

        String pretty = ValueJson.toPrettyString(new ObjectMapper(), globals);
        assertTrue(pretty.contains("\"n\" : 3"), pretty);
    }
}
