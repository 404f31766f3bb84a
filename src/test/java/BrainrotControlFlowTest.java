import static com.brainrot.script.core.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.brainrot.script.BrainrotScript;
import com.brainrot.script.RunResult;
import com.brainrot.script.core.ErrorKind;
import com.brainrot.script.core.Operator;
import com.brainrot.script.core.Statement.Stmt;
import com.brainrot.script.core.VarType;

public class BrainrotControlFlowTest {

    private ByteArrayOutputStream out;
    private BrainrotScript engine;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        engine = new BrainrotScript();
        engine.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        engine.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static Stmt increment(String name) {
        return assign(name, binary(Operator.PLUS, ident(name), intLit(1)));
    }

    @Test
    void ifElseTakesOneBranch() {
        RunResult r = engine.run(program(
                declare(VarType.INT, "x", intLit(3)),
                ifThenElse(binary(Operator.GT, ident("x"), intLit(5)),
                        print(stringLit("big")),
                        print(stringLit("small"))),
                ifThen(doubleLit(0.0), print(stringLit("never")))
        ));

        assertTrue(r.succeeded());
        assertEquals("small\n", output());
    }

    @Test
    void breakLeavesOnlyTheInnermostLoop() {
        RunResult r = engine.run(program(
                forLoop(declare(VarType.INT, "i", intLit(0)), binary(Operator.LT, ident("i"), intLit(3)), increment("i"),
                        forLoop(declare(VarType.INT, "j", intLit(0)), binary(Operator.LT, ident("j"), intLit(5)), increment("j"),
                                ifThen(binary(Operator.EQ, ident("j"), intLit(1)), brk()),
                                print(ident("j"))
                        ),
                        print(ident("i"))
                )
        ));

        assertTrue(r.succeeded(), () -> String.valueOf(r.error()));
        assertEquals("0\n0\n0\n1\n0\n2\n", output());
    }

    @Test
    void forWithoutConditionRunsUntilBreak() {
        RunResult r = engine.run(program(
                declare(VarType.INT, "n", intLit(0)),
                forLoop(null, null, increment("n"),
                        ifThen(binary(Operator.GE, ident("n"), intLit(4)), brk())
                ),
                print(ident("n"))
        ));

        assertTrue(r.succeeded(), () -> String.valueOf(r.error()));
        assertEquals("4\n", output());
    }

    @Test
    void whileLoopSums() {
        RunResult r = engine.run(program(
                declare(VarType.INT, "i", intLit(1)),
                declare(VarType.INT, "sum", intLit(0)),
                whileLoop(binary(Operator.LE, ident("i"), intLit(10)),
                        assign("sum", binary(Operator.PLUS, ident("sum"), ident("i"))),
                        exprStmt(unary(Operator.PRE_INC, ident("i")))
                ),
                print(ident("sum"))
        ));

        assertTrue(r.succeeded());
        assertEquals("55\n", output());
    }

    @Test
    void doWhileRunsBodyAtLeastOnce() {
        RunResult r = engine.run(program(
                declare(VarType.INT, "n", intLit(10)),
                doWhile(binary(Operator.LT, ident("n"), intLit(5)),
                        print(ident("n"))
                )
        ));

        assertTrue(r.succeeded());
        assertEquals("10\n", output());
    }

    @Test
    void switchFallsThroughUntilBreak() {
        RunResult r = engine.run(program(
                switchOf(intLit(2),
                        caseOf(intLit(1), print(intLit(1))),
                        caseOf(intLit(2), print(intLit(2))),
                        caseOf(intLit(3), print(intLit(3)), brk()),
                        defaultCase(print(intLit(99)))
                ),
                print(stringLit("after"))
        ));

        assertTrue(r.succeeded(), () -> String.valueOf(r.error()));
        assertEquals("2\n3\nafter\n", output());
    }

    @Test
    void defaultMatchesWhereItStandsWhenNoEarlierCaseMatched() {
        RunResult r = engine.run(program(
                switchOf(intLit(7),
                        caseOf(intLit(1), print(intLit(1))),
                        defaultCase(print(intLit(0))),
                        caseOf(intLit(2), print(intLit(2)), brk()),
                        caseOf(intLit(3), print(intLit(3)))
                )
        ));

        assertTrue(r.succeeded());
        assertEquals("0\n2\n", output());
    }

    @Test
    void switchOnStrings() {
        RunResult r = engine.run(program(
                declare(VarType.STRING, "mood", stringLit("sigma")),
                switchOf(ident("mood"),
                        caseOf(stringLit("beta"), print(intLit(1)), brk()),
                        caseOf(stringLit("sigma"), print(intLit(2)), brk()),
                        defaultCase(print(intLit(3)))
                )
        ));

        assertTrue(r.succeeded());
        assertEquals("2\n", output());
    }

    @Test
    void breakInsideSwitchInsideLoopLeavesOnlyTheSwitch() {
        RunResult r = engine.run(program(
                forLoop(declare(VarType.INT, "i", intLit(0)), binary(Operator.LT, ident("i"), intLit(2)), increment("i"),
                        switchOf(ident("i"),
                                caseOf(intLit(0), print(stringLit("zero")), brk()),
                                defaultCase(print(stringLit("other")))
                        ),
                        print(ident("i"))
                )
        ));

        assertTrue(r.succeeded());
        assertEquals("zero\n0\nother\n1\n", output());
    }

    @Test
    void breakOutsideLoopOrSwitchIsFatal() {
        RunResult r = engine.run(program(print(intLit(1)), brk(), print(intLit(2))));

        assertEquals(ErrorKind.UNSUPPORTED_OPERATION, r.error().kind());
        assertEquals("1\n", output());
    }

    @Test
    void breakDoesNotCrossAFunctionBoundary() {
        RunResult r = engine.run(program(
                function(VarType.VOID, "escape", List.of(), brk()),
                whileLoop(intLit(1), callStmt("escape"))
        ));

        assertEquals(ErrorKind.UNSUPPORTED_OPERATION, r.error().kind());
    }

    @Test
    void topLevelReturnEndsProgramWithStatus() {
        RunResult r = engine.run(program(
                print(intLit(1)),
                whileLoop(intLit(1), ret(intLit(3))),
                print(intLit(2))
        ));

        assertTrue(r.succeeded());
        assertEquals(3, r.exitCode());
        assertEquals(3, r.returnValue().asInt());
        assertEquals("1\n", output());
    }

    @Test
    void ragequitEndsProgramFromAnyDepth() {
        RunResult r = engine.run(program(
                function(VarType.VOID, "bail", List.of(param(VarType.INT, "code")),
                        whileLoop(intLit(1), callStmt("ragequit", ident("code")))),
                callStmt("bail", intLit(4)),
                print(stringLit("unreachable"))
        ));

        assertTrue(r.succeeded());
        assertEquals(4, r.exitCode());
        assertEquals("", output());
    }

    @Test
    void stringConditionIsATypeMismatch() {
        RunResult r = engine.run(program(ifThen(stringLit("yes"), print(intLit(1)))));
        assertEquals(ErrorKind.TYPE_MISMATCH, r.error().kind());
    }
}
