package com.brainrot.script.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.brainrot.script.core.Expr.ArrayAccess;
import com.brainrot.script.core.Expr.Binary;
import com.brainrot.script.core.Expr.Call;
import com.brainrot.script.core.Expr.ExprInterface;
import com.brainrot.script.core.Expr.ExprVisitor;
import com.brainrot.script.core.Expr.Identifier;
import com.brainrot.script.core.Expr.Literal;
import com.brainrot.script.core.Expr.Sizeof;
import com.brainrot.script.core.Expr.Unary;
import com.brainrot.script.core.Modifiers;
import com.brainrot.script.core.Operator;
import com.brainrot.script.core.Statement.Assignment;
import com.brainrot.script.core.Statement.Break;
import com.brainrot.script.core.Statement.Case;
import com.brainrot.script.core.Statement.Declaration;
import com.brainrot.script.core.Statement.DoWhile;
import com.brainrot.script.core.Statement.ErrorPrint;
import com.brainrot.script.core.Statement.ExprStmt;
import com.brainrot.script.core.Statement.For;
import com.brainrot.script.core.Statement.FunctionDef;
import com.brainrot.script.core.Statement.If;
import com.brainrot.script.core.Statement.Param;
import com.brainrot.script.core.Statement.Print;
import com.brainrot.script.core.Statement.Return;
import com.brainrot.script.core.Statement.StatementList;
import com.brainrot.script.core.Statement.Stmt;
import com.brainrot.script.core.Statement.StmtVisitor;
import com.brainrot.script.core.Statement.Switch;
import com.brainrot.script.core.Statement.While;
import com.brainrot.script.core.TypeRules;
import com.brainrot.script.core.Value;
import com.brainrot.script.core.VarType;

/**
 * Best-effort static checks over a program.
 *
 * Works on its own symbol tables mirroring the runtime scoping rules and never touches the AST
 * or interpreter state, so running it is optional. Every problem is collected; none stops the
 * analysis.
 */
public final class SemanticAnalyzer implements ExprVisitor<VarType>, StmtVisitor {

    private static final class Symbol {
        final VarType type;
        final Modifiers modifiers;
        /** Constant dimensions of an array, -1 for a dimension that is not a literal; null for scalars. */
        final int[] dimensions;

        Symbol(VarType type, Modifiers modifiers, int[] dimensions) {
            this.type = type;
            this.modifiers = modifiers;
            this.dimensions = dimensions;
        }

        boolean isArray() { return dimensions != null; }
    }

    private static final class Frame {
        final Map<String, Symbol> symbols = new LinkedHashMap<>();
        final boolean boundary;

        Frame(boolean boundary) { this.boundary = boundary; }
    }

    private final Set<String> builtins;
    private final Map<String, FunctionDef> functions = new HashMap<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final List<SemanticError> errors = new ArrayList<>();

    private int breakable;
    private VarType returnType;

    public SemanticAnalyzer(Set<String> builtins) {
        this.builtins = (builtins == null) ? Collections.emptySet() : builtins;
    }

    /** Analyzes a whole program. The analyzer can be reused; each call starts from scratch. */
    public List<SemanticError> analyze(Stmt program) {
        errors.clear();
        functions.clear();
        frames.clear();
        frames.push(new Frame(false));
        breakable = 0;
        returnType = null;

        if (program instanceof StatementList) {
            for (Stmt s : ((StatementList) program).statements) {
                if (s instanceof FunctionDef) functions.putIfAbsent(((FunctionDef) s).name, (FunctionDef) s);
            }
        }
        if (program != null) program.accept(this);
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    private void error(SemanticError.Kind kind, String message, int line) {
        errors.add(new SemanticError(kind, message, line));
    }

    // -------------------------
    // Symbols
    // -------------------------

    private Symbol lookup(String name) {
        for (Frame f : frames) {
            Symbol s = f.symbols.get(name);
            if (s != null) return s;
            if (f.boundary) return null;
        }
        return null;
    }

    private void declare(String name, Symbol symbol, int line) {
        Frame top = frames.peek();
        if (top.symbols.containsKey(name)) {
            error(SemanticError.Kind.REDEFINITION, "Variable '" + name + "' already declared in this scope", line);
            return;
        }
        top.symbols.put(name, symbol);
    }

    private void push(boolean boundary) { frames.push(new Frame(boundary)); }

    private void pop() { frames.pop(); }

    private VarType typeOf(ExprInterface e) {
        return (e == null) ? null : e.accept(this);
    }

    private static boolean assignable(VarType to, VarType from) {
        if (from == null || to == null) return true;
        if (from == VarType.VOID || to == VarType.VOID) return false;
        return (to == VarType.STRING) == (from == VarType.STRING);
    }

    private static Integer intLiteral(ExprInterface e) {
        if (e instanceof Literal) {
            Value v = ((Literal) e).value;
            if (v.type == Value.Type.INT || v.type == Value.Type.SHORT || v.type == Value.Type.CHAR) {
                return (int) TypeRules.toLong(v);
            }
        }
        return null;
    }

    private void checkCondition(ExprInterface cond, int line) {
        VarType t = typeOf(cond);
        if (t == VarType.STRING || t == VarType.VOID) {
            error(SemanticError.Kind.TYPE_MISMATCH, t.keyword() + " is not a valid condition", line);
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public VarType visitLiteralExpr(Literal expr) {
        return expr.value.varType();
    }

    @Override
    public VarType visitIdentifierExpr(Identifier expr) {
        Symbol s = lookup(expr.name);
        if (s == null) {
            error(SemanticError.Kind.UNDEFINED_VARIABLE, "Undefined variable '" + expr.name + "'", expr.line());
            return null;
        }
        return s.type;
    }

    @Override
    public VarType visitBinaryExpr(Binary expr) {
        VarType l = typeOf(expr.left);
        VarType r = typeOf(expr.right);
        Operator op = expr.operator;
        if (l == null || r == null) return null;

        if (op.isLogical()) {
            if (l == VarType.STRING || r == VarType.STRING || l == VarType.VOID || r == VarType.VOID) {
                error(SemanticError.Kind.TYPE_MISMATCH, "Operator " + op.symbol + " needs scalar operands", expr.line());
            }
            return VarType.BOOL;
        }
        if (op.isComparison() && l == VarType.STRING && r == VarType.STRING) {
            if (op != Operator.EQ && op != Operator.NE) {
                error(SemanticError.Kind.TYPE_MISMATCH, "Operator " + op.symbol + " is not defined for strings", expr.line());
            }
            return VarType.INT;
        }
        if (op.isArithmetic() && (l == VarType.BOOL || r == VarType.BOOL)) {
            error(SemanticError.Kind.TYPE_MISMATCH, "Operator " + op.symbol + " cannot be applied to bool", expr.line());
            return null;
        }
        VarType promoted = TypeRules.promote(l, r);
        if (promoted == null) {
            error(SemanticError.Kind.TYPE_MISMATCH,
                    "Operator " + op.symbol + " cannot be applied to " + l.keyword() + " and " + r.keyword(), expr.line());
            return null;
        }
        if ((op == Operator.DIVIDE || op == Operator.MOD) && !promoted.isFloating()) {
            Integer divisor = intLiteral(expr.right);
            if (divisor != null && divisor == 0) {
                error(SemanticError.Kind.INVALID_OPERATION,
                        (op == Operator.DIVIDE ? "Division" : "Modulo") + " by constant zero", expr.line());
            }
        }
        return promoted;
    }

    @Override
    public VarType visitUnaryExpr(Unary expr) {
        if (expr.operator == Operator.NEG) {
            VarType t = typeOf(expr.operand);
            if (t == null) return null;
            if (t == VarType.BOOL) return VarType.BOOL;
            if (!t.isNumeric()) {
                error(SemanticError.Kind.TYPE_MISMATCH, "Cannot negate " + t.keyword(), expr.line());
                return null;
            }
            return t == VarType.CHAR ? VarType.INT : t;
        }

        if (!(expr.operand instanceof Identifier)) {
            error(SemanticError.Kind.INVALID_OPERATION,
                    "Operator " + expr.operator.symbol + " applies to variables only", expr.line());
            typeOf(expr.operand);
            return null;
        }
        String name = ((Identifier) expr.operand).name;
        Symbol s = lookup(name);
        if (s == null) {
            error(SemanticError.Kind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'", expr.line());
            return null;
        }
        if (s.modifiers.isConst) {
            error(SemanticError.Kind.CONST_ASSIGNMENT, "Cannot modify const variable '" + name + "'", expr.line());
        }
        if (s.isArray() || !s.type.isNumeric()) {
            error(SemanticError.Kind.TYPE_MISMATCH,
                    "Operator " + expr.operator.symbol + " cannot be applied to '" + name + "'", expr.line());
            return null;
        }
        return s.type;
    }

    @Override
    public VarType visitArrayAccessExpr(ArrayAccess expr) {
        for (ExprInterface idx : expr.indices) {
            VarType t = typeOf(idx);
            if (t == VarType.STRING || t == VarType.VOID) {
                error(SemanticError.Kind.TYPE_MISMATCH, "Array index must be numeric", expr.line());
            }
        }
        Symbol s = lookup(expr.name);
        if (s == null) {
            error(SemanticError.Kind.UNDEFINED_VARIABLE, "Undefined array '" + expr.name + "'", expr.line());
            return null;
        }
        if (!s.isArray()) {
            error(SemanticError.Kind.TYPE_MISMATCH, "'" + expr.name + "' is not an array", expr.line());
            return s.type;
        }
        if (expr.indices.size() != s.dimensions.length) {
            error(SemanticError.Kind.ARRAY_BOUNDS, "Array '" + expr.name + "' has " + s.dimensions.length
                    + " dimension(s), accessed with " + expr.indices.size(), expr.line());
            return s.type;
        }
        for (int axis = 0; axis < s.dimensions.length; axis++) {
            Integer idx = intLiteral(expr.indices.get(axis));
            int dim = s.dimensions[axis];
            if (idx != null && (idx < 0 || (dim >= 0 && idx >= dim))) {
                error(SemanticError.Kind.ARRAY_BOUNDS,
                        "Index " + idx + " out of bounds for '" + expr.name + "' on axis " + axis, expr.line());
            }
        }
        return s.type;
    }

    @Override
    public VarType visitCallExpr(Call expr) {
        List<VarType> argTypes = new ArrayList<>();
        for (ExprInterface a : expr.arguments) {
            argTypes.add(typeOf(a));
        }
        if (builtins.contains(expr.name)) return VarType.VOID;

        FunctionDef fn = functions.get(expr.name);
        if (fn == null) {
            error(SemanticError.Kind.UNDEFINED_FUNCTION, "Undefined function '" + expr.name + "'", expr.line());
            return null;
        }
        if (fn.params.size() != argTypes.size()) {
            error(SemanticError.Kind.ARITY_MISMATCH, expr.name + "() expects " + fn.params.size()
                    + " arguments, got " + argTypes.size(), expr.line());
        } else {
            for (int i = 0; i < argTypes.size(); i++) {
                Param p = fn.params.get(i);
                if (!assignable(p.type, argTypes.get(i))) {
                    error(SemanticError.Kind.TYPE_MISMATCH, "Argument '" + p.name + "' of " + expr.name
                            + "() expects " + p.type.keyword() + ", got " + argTypes.get(i).keyword(), expr.line());
                }
            }
        }
        return fn.returnType;
    }

    @Override
    public VarType visitSizeofExpr(Sizeof expr) {
        typeOf(expr.operand);
        return VarType.INT;
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitDeclarationStmt(Declaration stmt) {
        if (stmt.type == VarType.VOID) {
            error(SemanticError.Kind.TYPE_MISMATCH, "Variable '" + stmt.name + "' cannot be void", stmt.line());
        }
        if (stmt.isArray()) {
            int[] dims = new int[stmt.dimensions.size()];
            for (int i = 0; i < dims.length; i++) {
                typeOf(stmt.dimensions.get(i));
                Integer d = intLiteral(stmt.dimensions.get(i));
                if (d != null && d <= 0) {
                    error(SemanticError.Kind.ARRAY_BOUNDS, "Invalid dimension " + d + " for '" + stmt.name + "'", stmt.line());
                }
                dims[i] = (d == null) ? -1 : d;
            }
            declare(stmt.name, new Symbol(stmt.type, stmt.modifiers, dims), stmt.line());

            if (stmt.elements != null) {
                long total = 1;
                for (int d : dims) total = (d < 0 || total < 0) ? -1 : total * d;
                if (total >= 0 && stmt.elements.size() > total) {
                    error(SemanticError.Kind.ARRAY_BOUNDS, "Too many initializers for '" + stmt.name + "'", stmt.line());
                }
                for (ExprInterface e : stmt.elements) {
                    if (!assignable(stmt.type, typeOf(e))) {
                        error(SemanticError.Kind.TYPE_MISMATCH, "Initializer does not match element type of '"
                                + stmt.name + "'", stmt.line());
                    }
                }
            } else if (stmt.initializer != null) {
                VarType t = typeOf(stmt.initializer);
                if (!(stmt.type == VarType.CHAR && t == VarType.STRING) && t != null) {
                    error(SemanticError.Kind.TYPE_MISMATCH,
                            "Array '" + stmt.name + "' can only be initialized from an element list", stmt.line());
                }
            }
            return;
        }

        declare(stmt.name, new Symbol(stmt.type, stmt.modifiers, null), stmt.line());
        if (stmt.initializer != null) {
            VarType t = typeOf(stmt.initializer);
            if (!assignable(stmt.type, t)) {
                error(SemanticError.Kind.TYPE_MISMATCH, "Cannot initialize " + stmt.type.keyword() + " '"
                        + stmt.name + "' from " + t.keyword(), stmt.line());
            }
        }
    }

    @Override
    public void visitAssignmentStmt(Assignment stmt) {
        VarType targetType;
        String name;
        if (stmt.target instanceof Identifier) {
            name = ((Identifier) stmt.target).name;
            Symbol s = lookup(name);
            if (s == null) {
                error(SemanticError.Kind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'", stmt.line());
                typeOf(stmt.value);
                return;
            }
            if (s.isArray()) {
                error(SemanticError.Kind.TYPE_MISMATCH, "Cannot assign to array '" + name + "' as a whole", stmt.line());
            }
            targetType = s.type;
            if (s.modifiers.isConst) {
                error(SemanticError.Kind.CONST_ASSIGNMENT, "Cannot assign to const variable '" + name + "'", stmt.line());
            }
        } else {
            ArrayAccess target = (ArrayAccess) stmt.target;
            name = target.name;
            targetType = typeOf(target);
            Symbol s = lookup(name);
            if (s != null && s.modifiers.isConst) {
                error(SemanticError.Kind.CONST_ASSIGNMENT, "Cannot assign to const array '" + name + "'", stmt.line());
            }
        }
        VarType valueType = typeOf(stmt.value);
        if (!assignable(targetType, valueType)) {
            error(SemanticError.Kind.TYPE_MISMATCH, "Cannot assign " + valueType.keyword() + " to '" + name + "'", stmt.line());
        }
    }

    @Override
    public void visitIfStmt(If stmt) {
        checkCondition(stmt.condition, stmt.line());
        push(false);
        if (stmt.thenBranch != null) stmt.thenBranch.accept(this);
        if (stmt.elseBranch != null) stmt.elseBranch.accept(this);
        pop();
    }

    @Override
    public void visitForStmt(For stmt) {
        push(false);
        if (stmt.init != null) stmt.init.accept(this);
        if (stmt.condition != null) checkCondition(stmt.condition, stmt.line());
        push(false);
        breakable++;
        if (stmt.body != null) stmt.body.accept(this);
        if (stmt.increment != null) stmt.increment.accept(this);
        breakable--;
        pop();
        pop();
    }

    @Override
    public void visitWhileStmt(While stmt) {
        push(false);
        checkCondition(stmt.condition, stmt.line());
        loopBody(stmt.body);
        pop();
    }

    @Override
    public void visitDoWhileStmt(DoWhile stmt) {
        push(false);
        loopBody(stmt.body);
        checkCondition(stmt.condition, stmt.line());
        pop();
    }

    private void loopBody(Stmt body) {
        push(false);
        breakable++;
        if (body != null) body.accept(this);
        breakable--;
        pop();
    }

    @Override
    public void visitSwitchStmt(Switch stmt) {
        VarType selector = typeOf(stmt.expression);
        push(false);
        breakable++;
        boolean seenDefault = false;
        for (Case c : stmt.cases) {
            if (c.isDefault()) {
                if (seenDefault) error(SemanticError.Kind.REDEFINITION, "Duplicate default case", stmt.line());
                seenDefault = true;
            } else {
                VarType label = typeOf(c.value);
                if (!assignable(selector, label)) {
                    error(SemanticError.Kind.TYPE_MISMATCH, "Case label type does not match switch value", stmt.line());
                }
            }
            for (Stmt s : c.body) s.accept(this);
        }
        breakable--;
        pop();
    }

    @Override
    public void visitBreakStmt(Break stmt) {
        if (breakable == 0) {
            error(SemanticError.Kind.SCOPE_ERROR, "break outside of a loop or switch", stmt.line());
        }
    }

    @Override
    public void visitReturnStmt(Return stmt) {
        VarType expected = (returnType == null) ? VarType.INT : returnType;
        if (stmt.value == null) return;
        VarType t = typeOf(stmt.value);
        if (expected == VarType.VOID) {
            error(SemanticError.Kind.TYPE_MISMATCH, "void function cannot return a value", stmt.line());
        } else if (!assignable(expected, t)) {
            error(SemanticError.Kind.TYPE_MISMATCH, "Cannot return " + t.keyword() + " from a "
                    + expected.keyword() + " function", stmt.line());
        }
    }

    @Override
    public void visitFunctionDefStmt(FunctionDef stmt) {
        if (builtins.contains(stmt.name)) {
            error(SemanticError.Kind.REDEFINITION, "'" + stmt.name + "' is a builtin", stmt.line());
        }
        FunctionDef existing = functions.putIfAbsent(stmt.name, stmt);
        if (existing != null && existing != stmt) {
            error(SemanticError.Kind.REDEFINITION, "Function '" + stmt.name + "' already defined", stmt.line());
        }

        int savedBreakable = breakable;
        VarType savedReturn = returnType;
        breakable = 0;
        returnType = stmt.returnType;
        push(true);
        for (Param p : stmt.params) {
            declare(p.name, new Symbol(p.type, p.modifiers, null), stmt.line());
        }
        if (stmt.body != null) stmt.body.accept(this);
        pop();
        breakable = savedBreakable;
        returnType = savedReturn;
    }

    @Override
    public void visitStatementListStmt(StatementList stmt) {
        for (Stmt s : stmt.statements) s.accept(this);
    }

    @Override
    public void visitPrintStmt(Print stmt) {
        if (typeOf(stmt.value) == VarType.VOID) {
            error(SemanticError.Kind.TYPE_MISMATCH, "print needs a value", stmt.line());
        }
    }

    @Override
    public void visitErrorPrintStmt(ErrorPrint stmt) {
        if (typeOf(stmt.value) == VarType.VOID) {
            error(SemanticError.Kind.TYPE_MISMATCH, "print needs a value", stmt.line());
        }
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        typeOf(stmt.expression);
    }
}
