package com.brainrot.script.core;

import java.util.Arrays;
import java.util.List;

import com.brainrot.script.core.Expr.ExprInterface;
import com.brainrot.script.core.Statement.Case;
import com.brainrot.script.core.Statement.Param;
import com.brainrot.script.core.Statement.Stmt;

/**
 * Node factories for hosts and parsers that build programs directly.
 * Nodes built here carry line 0.
 */
public final class Ast {

    private Ast() {}

    // -------------------------
    // Literals
    // -------------------------
    public static Expr.Literal intLit(int v) { return new Expr.Literal(Value.int32(v), 0); }
    public static Expr.Literal shortLit(int v) { return new Expr.Literal(Value.int16((short) v), 0); }
    public static Expr.Literal floatLit(float v) { return new Expr.Literal(Value.float32(v), 0); }
    public static Expr.Literal doubleLit(double v) { return new Expr.Literal(Value.float64(v), 0); }
    public static Expr.Literal charLit(char v) { return new Expr.Literal(Value.character(v), 0); }
    public static Expr.Literal boolLit(boolean v) { return new Expr.Literal(Value.bool(v), 0); }
    public static Expr.Literal stringLit(String v) { return new Expr.Literal(Value.string(v), 0); }

    // -------------------------
    // Expressions
    // -------------------------
    public static Expr.Identifier ident(String name) { return new Expr.Identifier(name, 0); }

    public static Expr.Binary binary(Operator op, ExprInterface left, ExprInterface right) {
        return new Expr.Binary(op, left, right, false, 0);
    }

    public static Expr.Binary unsignedBinary(Operator op, ExprInterface left, ExprInterface right) {
        return new Expr.Binary(op, left, right, true, 0);
    }

    public static Expr.Unary unary(Operator op, ExprInterface operand) {
        return new Expr.Unary(op, operand, 0);
    }

    public static Expr.ArrayAccess index(String name, ExprInterface... indices) {
        return new Expr.ArrayAccess(name, Arrays.asList(indices), 0);
    }

    public static Expr.Call call(String name, ExprInterface... args) {
        return new Expr.Call(name, Arrays.asList(args), 0);
    }

    public static Expr.Sizeof sizeof(ExprInterface operand) {
        return new Expr.Sizeof(operand, 0);
    }

    // -------------------------
    // Declarations and assignment
    // -------------------------
    public static Statement.Declaration declare(VarType type, String name) {
        return new Statement.Declaration(type, Modifiers.NONE, name, null, null, null, 0);
    }

    public static Statement.Declaration declare(VarType type, String name, ExprInterface init) {
        return new Statement.Declaration(type, Modifiers.NONE, name, null, init, null, 0);
    }

    public static Statement.Declaration declare(Modifiers mods, VarType type, String name, ExprInterface init) {
        return new Statement.Declaration(type, mods, name, null, init, null, 0);
    }

    public static Statement.Declaration declareArray(VarType type, String name, ExprInterface... dims) {
        return new Statement.Declaration(type, Modifiers.NONE, name, Arrays.asList(dims), null, null, 0);
    }

    public static Statement.Declaration declareArray(VarType type, String name, List<ExprInterface> dims,
                                                     List<ExprInterface> elements) {
        return new Statement.Declaration(type, Modifiers.NONE, name, dims, null, elements, 0);
    }

    public static Statement.Assignment assign(String name, ExprInterface value) {
        return new Statement.Assignment(ident(name), value, 0);
    }

    public static Statement.Assignment assign(ExprInterface target, ExprInterface value) {
        return new Statement.Assignment(target, value, 0);
    }

    // -------------------------
    // Control flow
    // -------------------------
    public static Statement.If ifThen(ExprInterface cond, Stmt then) {
        return new Statement.If(cond, then, null, 0);
    }

    public static Statement.If ifThenElse(ExprInterface cond, Stmt then, Stmt otherwise) {
        return new Statement.If(cond, then, otherwise, 0);
    }

    public static Statement.For forLoop(Stmt init, ExprInterface cond, Stmt incr, Stmt... body) {
        return new Statement.For(init, cond, incr, block(body), 0);
    }

    public static Statement.While whileLoop(ExprInterface cond, Stmt... body) {
        return new Statement.While(cond, block(body), 0);
    }

    public static Statement.DoWhile doWhile(ExprInterface cond, Stmt... body) {
        return new Statement.DoWhile(block(body), cond, 0);
    }

    public static Statement.Switch switchOf(ExprInterface value, Case... cases) {
        return new Statement.Switch(value, Arrays.asList(cases), 0);
    }

    public static Case caseOf(ExprInterface value, Stmt... body) {
        return new Case(value, Arrays.asList(body));
    }

    public static Case defaultCase(Stmt... body) {
        return new Case(null, Arrays.asList(body));
    }

    public static Statement.Break brk() { return new Statement.Break(0); }

    public static Statement.Return ret() { return new Statement.Return(null, 0); }

    public static Statement.Return ret(ExprInterface value) { return new Statement.Return(value, 0); }

    // -------------------------
    // Functions
    // -------------------------
    public static Param param(VarType type, String name) {
        return new Param(name, type, Modifiers.NONE);
    }

    public static Statement.FunctionDef function(VarType returnType, String name, List<Param> params, Stmt... body) {
        return new Statement.FunctionDef(name, returnType, params, block(body), 0);
    }

    // -------------------------
    // Misc
    // -------------------------
    public static Statement.StatementList block(Stmt... statements) {
        return new Statement.StatementList(Arrays.asList(statements), 0);
    }

    public static Statement.StatementList program(Stmt... statements) {
        return block(statements);
    }

    public static Statement.Print print(ExprInterface value) { return new Statement.Print(value, 0); }

    public static Statement.ErrorPrint errorPrint(ExprInterface value) { return new Statement.ErrorPrint(value, 0); }

    public static Statement.ExprStmt exprStmt(ExprInterface expr) { return new Statement.ExprStmt(expr, 0); }

    /** Shorthand for a builtin or user call used as a statement. */
    public static Statement.ExprStmt callStmt(String name, ExprInterface... args) {
        return exprStmt(call(name, args));
    }
}
