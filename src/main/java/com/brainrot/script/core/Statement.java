package com.brainrot.script.core;

import java.util.List;

import com.brainrot.script.core.Expr.ExprInterface;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);

        /** Source line, 0 when unknown. */
        int line();
    }

    public interface StmtVisitor {
        void visitDeclarationStmt(Declaration stmt);
        void visitAssignmentStmt(Assignment stmt);
        void visitIfStmt(If stmt);
        void visitForStmt(For stmt);
        void visitWhileStmt(While stmt);
        void visitDoWhileStmt(DoWhile stmt);
        void visitSwitchStmt(Switch stmt);
        void visitBreakStmt(Break stmt);
        void visitReturnStmt(Return stmt);
        void visitFunctionDefStmt(FunctionDef stmt);
        void visitStatementListStmt(StatementList stmt);
        void visitPrintStmt(Print stmt);
        void visitErrorPrintStmt(ErrorPrint stmt);
        void visitExprStmt(ExprStmt stmt);
    }

    /**
     * Variable declaration. Arrays carry one dimension expression per axis and may carry an
     * element list, filled in row-major order; char arrays may instead take a string initializer.
     */
    public static final class Declaration implements Stmt {
        public final VarType type;
        public final Modifiers modifiers;
        public final String name;
        public final List<ExprInterface> dimensions;
        public final ExprInterface initializer;
        public final List<ExprInterface> elements;
        final int line;

        public Declaration(VarType type, Modifiers modifiers, String name, List<ExprInterface> dimensions,
                           ExprInterface initializer, List<ExprInterface> elements, int line) {
            this.type = type;
            this.modifiers = (modifiers == null) ? Modifiers.NONE : modifiers;
            this.name = name;
            this.dimensions = (dimensions == null) ? List.of() : List.copyOf(dimensions);
            this.initializer = initializer;
            this.elements = (elements == null) ? null : List.copyOf(elements);
            this.line = line;
        }

        public boolean isArray() { return !dimensions.isEmpty(); }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitDeclarationStmt(this); }
    }

    /** Target is an {@link Expr.Identifier} or an {@link Expr.ArrayAccess}. */
    public static final class Assignment implements Stmt {
        public final ExprInterface target;
        public final ExprInterface value;
        final int line;

        public Assignment(ExprInterface target, ExprInterface value, int line) {
            if (!(target instanceof Expr.Identifier) && !(target instanceof Expr.ArrayAccess)) {
                throw new IllegalArgumentException("Assignment target must be a variable or array element");
            }
            this.target = target;
            this.value = value;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitAssignmentStmt(this); }
    }

    public static final class If implements Stmt {
        public final ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;
        final int line;

        public If(ExprInterface condition, Stmt thenBranch, Stmt elseBranch, int line) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    /** Any of init, condition and increment may be null. */
    public static final class For implements Stmt {
        public final Stmt init;
        public final ExprInterface condition;
        public final Stmt increment;
        public final Stmt body;
        final int line;

        public For(Stmt init, ExprInterface condition, Stmt increment, Stmt body, int line) {
            this.init = init;
            this.condition = condition;
            this.increment = increment;
            this.body = body;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    public static final class While implements Stmt {
        public final ExprInterface condition;
        public final Stmt body;
        final int line;

        public While(ExprInterface condition, Stmt body, int line) {
            this.condition = condition;
            this.body = body;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    public static final class DoWhile implements Stmt {
        public final Stmt body;
        public final ExprInterface condition;
        final int line;

        public DoWhile(Stmt body, ExprInterface condition, int line) {
            this.body = body;
            this.condition = condition;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitDoWhileStmt(this); }
    }

    public static final class Switch implements Stmt {
        public final ExprInterface expression;
        public final List<Case> cases;
        final int line;

        public Switch(ExprInterface expression, List<Case> cases, int line) {
            this.expression = expression;
            this.cases = List.copyOf(cases);
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitSwitchStmt(this); }
    }

    /** A switch arm. A null value marks the default arm. */
    public static final class Case {
        public final ExprInterface value;
        public final List<Stmt> body;

        public Case(ExprInterface value, List<Stmt> body) {
            this.value = value;
            this.body = List.copyOf(body);
        }

        public boolean isDefault() { return value == null; }
    }

    public static final class Break implements Stmt {
        final int line;

        public Break(int line) { this.line = line; }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
    }

    public static final class Return implements Stmt {
        public final ExprInterface value;
        final int line;

        public Return(ExprInterface value, int line) {
            this.value = value;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class Param {
        public final String name;
        public final VarType type;
        public final Modifiers modifiers;

        public Param(String name, VarType type, Modifiers modifiers) {
            if (type == VarType.VOID) throw new IllegalArgumentException("Parameter '" + name + "' cannot be void");
            this.name = name;
            this.type = type;
            this.modifiers = (modifiers == null) ? Modifiers.NONE : modifiers;
        }
    }

    public static final class FunctionDef implements Stmt {
        public final String name;
        public final VarType returnType;
        public final List<Param> params;
        public final Stmt body;
        final int line;

        public FunctionDef(String name, VarType returnType, List<Param> params, Stmt body, int line) {
            this.name = name;
            this.returnType = returnType;
            this.params = List.copyOf(params);
            this.body = body;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitFunctionDefStmt(this); }
    }

    /** Sequence of statements. Does not open a scope of its own. */
    public static final class StatementList implements Stmt {
        public final List<Stmt> statements;
        final int line;

        public StatementList(List<Stmt> statements, int line) {
            this.statements = List.copyOf(statements);
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitStatementListStmt(this); }
    }

    public static final class Print implements Stmt {
        public final ExprInterface value;
        final int line;

        public Print(ExprInterface value, int line) {
            this.value = value;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
    }

    public static final class ErrorPrint implements Stmt {
        public final ExprInterface value;
        final int line;

        public ErrorPrint(ExprInterface value, int line) {
            this.value = value;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitErrorPrintStmt(this); }
    }

    /** An expression evaluated for its side effects, e.g. {@code s++;} or a call. */
    public static final class ExprStmt implements Stmt {
        public final ExprInterface expression;
        final int line;

        public ExprStmt(ExprInterface expression, int line) {
            this.expression = expression;
            this.line = line;
        }

        @Override public int line() { return line; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }
}
