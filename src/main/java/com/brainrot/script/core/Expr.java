package com.brainrot.script.core;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Source line, 0 when unknown. */
        int line();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitIdentifierExpr(Identifier expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitArrayAccessExpr(ArrayAccess expr);
        R visitCallExpr(Call expr);
        R visitSizeofExpr(Sizeof expr);
    }

    /** Int, short, float, double, char, bool and string literals, carrying their typed value. */
    public static final class Literal implements ExprInterface {
        public final Value value;
        final int line;

        public Literal(Value value, int line) {
            this.value = value;
            this.line = line;
        }

        @Override public int line() { return line; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Identifier implements ExprInterface {
        public final String name;
        final int line;

        // Validation memo, local to this node: set on first evaluation.
        boolean alreadyChecked;
        boolean validSymbol;

        public Identifier(String name, int line) {
            this.name = name;
            this.line = line;
        }

        @Override public int line() { return line; }

        public boolean alreadyChecked() { return alreadyChecked; }
        public boolean validSymbol() { return validSymbol; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final Operator operator;
        public final ExprInterface left;
        public final ExprInterface right;
        /** Forces unsigned semantics for % on int operands. */
        public final boolean unsigned;
        final int line;

        public Binary(Operator operator, ExprInterface left, ExprInterface right, boolean unsigned, int line) {
            if (operator.isUnary()) throw new IllegalArgumentException(operator + " is not a binary operator");
            this.operator = operator;
            this.left = left;
            this.right = right;
            this.unsigned = unsigned;
            this.line = line;
        }

        @Override public int line() { return line; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Operator operator;
        public final ExprInterface operand;
        final int line;

        public Unary(Operator operator, ExprInterface operand, int line) {
            if (!operator.isUnary()) throw new IllegalArgumentException(operator + " is not a unary operator");
            this.operator = operator;
            this.operand = operand;
            this.line = line;
        }

        @Override public int line() { return line; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class ArrayAccess implements ExprInterface {
        public final String name;
        public final List<ExprInterface> indices;
        final int line;

        public ArrayAccess(String name, List<ExprInterface> indices, int line) {
            this.name = name;
            this.indices = List.copyOf(indices);
            this.line = line;
        }

        @Override public int line() { return line; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayAccessExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final String name;
        public final List<ExprInterface> arguments;
        final int line;

        public Call(String name, List<ExprInterface> arguments, int line) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
            this.line = line;
        }

        @Override public int line() { return line; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    public static final class Sizeof implements ExprInterface {
        public final ExprInterface operand;
        final int line;

        public Sizeof(ExprInterface operand, int line) {
            this.operand = operand;
            this.line = line;
        }

        @Override public int line() { return line; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSizeofExpr(this);
        }
    }
}
