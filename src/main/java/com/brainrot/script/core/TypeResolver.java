package com.brainrot.script.core;

import com.brainrot.script.core.Expr.ArrayAccess;
import com.brainrot.script.core.Expr.Binary;
import com.brainrot.script.core.Expr.Call;
import com.brainrot.script.core.Expr.ExprInterface;
import com.brainrot.script.core.Expr.ExprVisitor;
import com.brainrot.script.core.Expr.Identifier;
import com.brainrot.script.core.Expr.Literal;
import com.brainrot.script.core.Expr.Sizeof;
import com.brainrot.script.core.Expr.Unary;

/**
 * Static type of an expression without evaluating it. Returns null when a name cannot be
 * resolved or the operands have no common type.
 */
public final class TypeResolver implements ExprVisitor<VarType> {

    /** Name resolution used by the resolver. Both methods return null for unknown names. */
    public interface Symbols {
        VarType variableType(String name);
        VarType functionType(String name);
    }

    private final Symbols symbols;

    public TypeResolver(Symbols symbols) {
        this.symbols = symbols;
    }

    public VarType resolve(ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public VarType visitLiteralExpr(Literal expr) {
        return expr.value.varType();
    }

    @Override
    public VarType visitIdentifierExpr(Identifier expr) {
        return symbols.variableType(expr.name);
    }

    @Override
    public VarType visitBinaryExpr(Binary expr) {
        if (expr.operator.isLogical()) return VarType.BOOL;
        VarType l = resolve(expr.left);
        VarType r = resolve(expr.right);
        if (expr.operator.isComparison() && l == VarType.STRING && r == VarType.STRING) return VarType.INT;
        if (expr.operator.isArithmetic() && (l == VarType.BOOL || r == VarType.BOOL)) return null;
        return TypeRules.promote(l, r);
    }

    @Override
    public VarType visitUnaryExpr(Unary expr) {
        VarType t = resolve(expr.operand);
        if (t == null) return null;
        if (expr.operator == Operator.NEG) {
            if (t == VarType.BOOL) return VarType.BOOL;
            if (t == VarType.CHAR) return VarType.INT;
        }
        return t.isNumeric() ? t : null;
    }

    @Override
    public VarType visitArrayAccessExpr(ArrayAccess expr) {
        return symbols.variableType(expr.name);
    }

    @Override
    public VarType visitCallExpr(Call expr) {
        return symbols.functionType(expr.name);
    }

    @Override
    public VarType visitSizeofExpr(Sizeof expr) {
        return VarType.INT;
    }
}
