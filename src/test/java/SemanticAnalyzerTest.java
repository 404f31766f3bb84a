import static com.brainrot.script.core.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.brainrot.script.BrainrotScript;
import com.brainrot.script.RunResult;
import com.brainrot.script.analysis.SemanticAnalyzer;
import com.brainrot.script.analysis.SemanticError;
import com.brainrot.script.core.Expr;
import com.brainrot.script.core.Modifiers;
import com.brainrot.script.core.Operator;
import com.brainrot.script.core.Statement.Stmt;
import com.brainrot.script.core.VarType;

public class SemanticAnalyzerTest {

    private static final Set<String> BUILTINS = Set.of("yapping", "yappin", "baka", "ragequit", "chill", "slorp");

    private static List<SemanticError.Kind> kinds(Stmt... program) {
        return new SemanticAnalyzer(BUILTINS).analyze(program(program)).stream()
                .map(SemanticError::kind)
                .collect(Collectors.toList());
    }

    @Test
    void cleanProgramHasNoFindings() {
        assertEquals(List.of(), kinds(
                declare(VarType.INT, "a", intLit(5)),
                declareArray(VarType.INT, "m", intLit(2), intLit(3)),
                assign(index("m", intLit(1), intLit(2)), ident("a")),
                function(VarType.INT, "twice", List.of(param(VarType.INT, "x")),
                        ret(binary(Operator.TIMES, ident("x"), intLit(2)))),
                forLoop(declare(VarType.INT, "i", intLit(0)), binary(Operator.LT, ident("i"), intLit(3)),
                        exprStmt(unary(Operator.POST_INC, ident("i"))),
                        ifThen(binary(Operator.EQ, ident("i"), intLit(2)), brk())),
                callStmt("yapping", stringLit("%d"), call("twice", ident("a")))
        ));
    }

    @Test
    void undefinedNames() {
        assertEquals(List.of(SemanticError.Kind.UNDEFINED_VARIABLE), kinds(print(ident("ghost"))));
        assertEquals(List.of(SemanticError.Kind.UNDEFINED_FUNCTION), kinds(callStmt("ghost")));
    }

    @Test
    void functionBodiesDoNotSeeGlobals() {
        assertEquals(List.of(SemanticError.Kind.UNDEFINED_VARIABLE), kinds(
                declare(VarType.INT, "g", intLit(1)),
                function(VarType.INT, "f", List.of(), ret(ident("g")))
        ));
    }

    @Test
    void constWrites() {
        assertEquals(List.of(SemanticError.Kind.CONST_ASSIGNMENT, SemanticError.Kind.CONST_ASSIGNMENT), kinds(
                declare(Modifiers.constant(), VarType.INT, "k", intLit(1)),
                assign("k", intLit(2)),
                exprStmt(unary(Operator.PRE_DEC, ident("k")))
        ));
    }

    @Test
    void literalIndicesAreBoundsChecked() {
        assertEquals(List.of(SemanticError.Kind.ARRAY_BOUNDS, SemanticError.Kind.ARRAY_BOUNDS), kinds(
                declareArray(VarType.INT, "v", intLit(3)),
                print(index("v", intLit(3))),
                print(index("v", intLit(0), intLit(0))),
                print(index("v", intLit(2)))
        ));
    }

    @Test
    void breakOutsideLoopOrSwitch() {
        assertEquals(List.of(SemanticError.Kind.SCOPE_ERROR, SemanticError.Kind.SCOPE_ERROR), kinds(
                brk(),
                whileLoop(intLit(1),
                        ifThen(intLit(1), brk())),
                switchOf(intLit(1), caseOf(intLit(1), brk())),
                function(VarType.VOID, "f", List.of(), brk())
        ));
    }

    @Test
    void redefinitions() {
        assertEquals(List.of(SemanticError.Kind.REDEFINITION), kinds(
                declare(VarType.INT, "x"),
                declare(VarType.DOUBLE, "x")
        ));
        assertEquals(List.of(SemanticError.Kind.REDEFINITION), kinds(
                function(VarType.VOID, "f", List.of()),
                function(VarType.VOID, "f", List.of())
        ));
        assertEquals(List.of(SemanticError.Kind.REDEFINITION), kinds(
                function(VarType.VOID, "chill", List.of())
        ));
        assertEquals(List.of(SemanticError.Kind.REDEFINITION), kinds(
                switchOf(intLit(1), defaultCase(), defaultCase())
        ));
    }

    @Test
    void arityAndArgumentTypes() {
        assertEquals(List.of(SemanticError.Kind.ARITY_MISMATCH, SemanticError.Kind.TYPE_MISMATCH), kinds(
                function(VarType.INT, "f", List.of(param(VarType.INT, "a")), ret(ident("a"))),
                print(call("f")),
                print(call("f", stringLit("no")))
        ));
    }

    @Test
    void typeMismatches() {
        assertEquals(List.of(SemanticError.Kind.TYPE_MISMATCH, SemanticError.Kind.TYPE_MISMATCH,
                SemanticError.Kind.TYPE_MISMATCH, SemanticError.Kind.TYPE_MISMATCH), kinds(
                declare(VarType.INT, "i", stringLit("x")),
                declare(VarType.STRING, "s", doubleLit(1.0)),
                ifThen(ident("s"), print(intLit(1))),
                print(binary(Operator.PLUS, boolLit(true), intLit(1)))
        ));
        assertEquals(List.of(SemanticError.Kind.TYPE_MISMATCH), kinds(
                function(VarType.VOID, "v", List.of(), ret(intLit(1)))
        ));
    }

    @Test
    void constantZeroDivisorIsFlaggedOnlyForIntegers() {
        assertEquals(List.of(SemanticError.Kind.INVALID_OPERATION, SemanticError.Kind.INVALID_OPERATION), kinds(
                print(binary(Operator.DIVIDE, intLit(1), intLit(0))),
                print(binary(Operator.MOD, shortLit(1), shortLit(0))),
                print(binary(Operator.DIVIDE, doubleLit(1), intLit(0)))
        ));
    }

    @Test
    void analysisLeavesTheTreeUntouched() {
        Expr.Identifier id = ident("ghost");
        new SemanticAnalyzer(BUILTINS).analyze(program(print(id)));
        assertFalse(id.alreadyChecked());
    }

    @Test
    void engineReportsFindingsAsWarningsAndStillRuns() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        BrainrotScript engine = new BrainrotScript();
        engine.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        engine.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
        engine.setSemanticAnalysis(true);

        RunResult r = engine.run(program(
                print(binary(Operator.DIVIDE, intLit(7), intLit(0))),
                print(stringLit("kept going"))
        ));

        assertTrue(r.succeeded());
        assertEquals(1, r.diagnostics().size());
        assertEquals(SemanticError.Kind.INVALID_OPERATION, r.diagnostics().get(0).kind());
        assertEquals("0\nkept going\n", out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
        String warnings = err.toString(StandardCharsets.UTF_8);
        assertTrue(warnings.startsWith("Warning: INVALID_OPERATION"), warnings);
        assertTrue(warnings.contains("DivisionByZero"), warnings);

        assertEquals(1, engine.analyze(program(callStmt("ghost"))).size());
    }
}
