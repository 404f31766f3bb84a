package com.brainrot.script.core;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.brainrot.debug.Debug;
import com.brainrot.script.core.Expr.ArrayAccess;
import com.brainrot.script.core.Expr.Binary;
import com.brainrot.script.core.Expr.Call;
import com.brainrot.script.core.Expr.ExprInterface;
import com.brainrot.script.core.Expr.ExprVisitor;
import com.brainrot.script.core.Expr.Identifier;
import com.brainrot.script.core.Expr.Literal;
import com.brainrot.script.core.Expr.Sizeof;
import com.brainrot.script.core.Expr.Unary;
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
import com.brainrot.script.core.Statement.Print;
import com.brainrot.script.core.Statement.Return;
import com.brainrot.script.core.Statement.StatementList;
import com.brainrot.script.core.Statement.Stmt;
import com.brainrot.script.core.Statement.StmtVisitor;
import com.brainrot.script.core.Statement.Switch;
import com.brainrot.script.core.Statement.While;

/**
 * Tree-walking evaluator and executor.
 *
 * Expressions evaluate to a {@link Value} at their natural (promoted) type and callers convert
 * to the type they need. A null result means the expression produced no value (void call).
 *
 * break and return are unchecked signals. Every loop, switch and call pushes an
 * {@link ExitTarget} on entry and pops it on exit, and every construct that opens a scope
 * unwinds back to its saved scope in a finally block, so a signal tears down all the scopes
 * it crosses.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {

    private static final String TAG = "brainrot.interp";

    private final Environment env;
    private final FunctionTable functions;
    private final Map<String, Builtin> builtins;
    private final ErrorReporter reporter;
    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader in;
    private final int maxCallDepth;

    private final ReturnChannel returnChannel = new ReturnChannel();
    private final Deque<ExitTarget> exitTargets = new ArrayDeque<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final TypeResolver types;

    private int currentLine;

    public Interpreter(Environment env, FunctionTable functions, Map<String, Builtin> builtins,
                       ErrorReporter reporter, PrintStream out, PrintStream err, BufferedReader in,
                       int maxCallDepth) {
        this.env = env;
        this.functions = functions;
        this.builtins = (builtins == null) ? Collections.emptyMap() : builtins;
        this.reporter = reporter;
        this.out = out;
        this.err = err;
        this.in = in;
        this.maxCallDepth = maxCallDepth;
        this.types = new TypeResolver(new TypeResolver.Symbols() {
            @Override
            public VarType variableType(String name) {
                Variable v = Interpreter.this.env.lookup(name);
                return (v == null) ? null : v.type;
            }

            @Override
            public VarType functionType(String name) {
                if (Interpreter.this.builtins.containsKey(name)) return VarType.VOID;
                UserFunction fn = Interpreter.this.functions.lookup(name);
                return (fn == null) ? null : fn.returnType;
            }
        });
    }

    // ===================== ACCESSORS (used by builtins) =====================

    public Environment environment() { return env; }
    public PrintStream out() { return out; }
    public PrintStream err() { return err; }
    public BufferedReader in() { return in; }
    public int callDepth() { return callStack.size(); }

    // ===================== SIGNALS =====================

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ReturnSignal() { super(null, null, false, false); }
    }

    public static final class BreakSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;

        BreakSignal() { super(null, null, false, false); }
    }

    /** Raised by ragequit: ends the program with the given status. */
    public static final class ExitSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        private final int code;

        public ExitSignal(int code) {
            super(null, null, false, false);
            this.code = code;
        }

        public int code() { return code; }
    }

    /** How a program run ended when no fatal error occurred. */
    public static final class Completion {
        public final int exitCode;
        /** Value of a top-level return, or null. */
        public final Value returnValue;
        public final boolean ragequit;

        Completion(int exitCode, Value returnValue, boolean ragequit) {
            this.exitCode = exitCode;
            this.returnValue = returnValue;
            this.ragequit = ragequit;
        }
    }

    // ===================== PROGRAM =====================

    /**
     * Registers the top-level function definitions, then executes the program in the global scope.
     * Fatal errors propagate as {@link BrainrotRuntimeException} carrying the failing line.
     */
    public Completion run(Stmt program) {
        hoistFunctions(program);
        returnChannel.reset(VarType.INT);
        try {
            execute(program);
            return new Completion(0, null, false);
        } catch (ReturnSignal rs) {
            Value v = returnChannel.hasValue() ? returnChannel.value() : null;
            int code = (v == null) ? 0 : TypeRules.require(v, VarType.INT, "program exit status").asInt();
            Debug.get().d(TAG, "program returned " + code);
            return new Completion(code, v, false);
        } catch (ExitSignal es) {
            Debug.get().d(TAG, "ragequit(" + es.code() + ")");
            return new Completion(es.code(), null, true);
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(currentLine);
        } catch (StackOverflowError so) {
            throw new BrainrotRuntimeException(ErrorKind.ALLOCATION_FAILURE, "Stack exhausted", currentLine, so);
        }
    }

    private void hoistFunctions(Stmt program) {
        if (program instanceof FunctionDef) {
            registerFunction((FunctionDef) program);
        } else if (program instanceof StatementList) {
            for (Stmt s : ((StatementList) program).statements) {
                if (s instanceof FunctionDef) registerFunction((FunctionDef) s);
            }
        }
    }

    private void registerFunction(FunctionDef def) {
        if (builtins.containsKey(def.name)) {
            throw new BrainrotRuntimeException(ErrorKind.UNSUPPORTED_OPERATION,
                    "'" + def.name + "' is a builtin and cannot be redefined", def.line);
        }
        UserFunction fn = functions.register(def);
        if (fn.definition != def) {
            Debug.get().w(TAG, "function " + def.name + " already defined; keeping the first definition");
        }
    }

    public void execute(Stmt stmt) {
        if (stmt != null) stmt.accept(this);
    }

    private void mark(Stmt stmt) {
        if (stmt.line() > 0) currentLine = stmt.line();
    }

    private int lineOf(ExprInterface expr) {
        return expr.line() > 0 ? expr.line() : currentLine;
    }

    // ===================== ERRORS =====================

    /** Reports a recoverable error; execution continues. */
    public void reportRecoverable(ErrorKind kind, String message, int line) {
        int at = line > 0 ? line : currentLine;
        Debug.get().w(TAG, kind.displayName() + ": " + message + " (line " + at + ")");
        if (reporter != null) reporter.report(kind, message, at);
    }

    private BrainrotRuntimeException fail(ErrorKind kind, String message, int line) {
        return new BrainrotRuntimeException(kind, message, line > 0 ? line : currentLine);
    }

    // ===================== EVALUATION ENTRY POINTS =====================

    /** Evaluates an expression that must produce a value. */
    public Value evaluate(ExprInterface expr) {
        Value v = expr.accept(this);
        if (v == null) {
            throw fail(ErrorKind.TYPE_MISMATCH, "Expression does not produce a value", lineOf(expr));
        }
        return v;
    }

    /** Evaluates and converts to the requested type. */
    public Value evaluateAs(ExprInterface expr, VarType target, String context) {
        Value v = evaluate(expr);
        try {
            return TypeRules.require(v, target, context);
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(lineOf(expr));
        }
    }

    public boolean evaluateCondition(ExprInterface expr) {
        Value v = evaluate(expr);
        try {
            return TypeRules.isTruthy(v);
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(lineOf(expr));
        }
    }

    /**
     * Resolves an identifier through the scope chain, recording the node-local validity memo.
     * The lookup failure is logged only the first time a node is checked.
     */
    public Variable resolve(Identifier id) {
        Variable v = env.lookup(id.name);
        if (!id.alreadyChecked) {
            id.alreadyChecked = true;
            id.validSymbol = (v != null);
            if (v == null) Debug.get().w(TAG, "undefined identifier '" + id.name + "' (line " + id.line + ")");
        }
        if (v == null) {
            throw fail(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + id.name + "'", id.line);
        }
        return v;
    }

    private Variable resolveArray(String name, int line) {
        Variable v = env.lookup(name);
        if (v == null || !v.isArray()) {
            throw fail(ErrorKind.UNDEFINED_ARRAY, "Undefined array '" + name + "'", line);
        }
        return v;
    }

    private int[] evaluateIndices(List<ExprInterface> indices) {
        int[] out = new int[indices.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = evaluateAs(indices.get(i), VarType.INT, "array index").asInt();
        }
        return out;
    }

    // ===================== EXPRESSIONS =====================

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitIdentifierExpr(Identifier expr) {
        return resolve(expr).get();
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Operator op = expr.operator;
        if (op.isLogical()) {
            boolean left = evaluateCondition(expr.left);
            if (op == Operator.AND && !left) return Value.bool(false);
            if (op == Operator.OR && left) return Value.bool(true);
            return Value.bool(evaluateCondition(expr.right));
        }

        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        if (op.isComparison()) return compare(op, left, right, expr.line);
        return arithmetic(expr, left, right);
    }

    private Value compare(Operator op, Value left, Value right, int line) {
        if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            if (op != Operator.EQ && op != Operator.NE) {
                throw fail(ErrorKind.TYPE_MISMATCH, "Operator " + op.symbol + " is not defined for strings", line);
            }
            boolean same = left.asString().equals(right.asString());
            return Value.int32((op == Operator.EQ) == same ? 1 : 0);
        }
        VarType type = operandType(op, left, right, line);

        boolean result;
        if (type.isFloating()) {
            double a = TypeRules.toDouble(left);
            double b = TypeRules.toDouble(right);
            switch (op) {
                case LT: result = a < b; break;
                case GT: result = a > b; break;
                case LE: result = a <= b; break;
                case GE: result = a >= b; break;
                case EQ: result = a == b; break;
                default: result = a != b; break;
            }
        } else {
            long a = TypeRules.toLong(left);
            long b = TypeRules.toLong(right);
            switch (op) {
                case LT: result = a < b; break;
                case GT: result = a > b; break;
                case LE: result = a <= b; break;
                case GE: result = a >= b; break;
                case EQ: result = a == b; break;
                default: result = a != b; break;
            }
        }
        return TypeRules.coerce(Value.int32(result ? 1 : 0), type);
    }

    private VarType operandType(Operator op, Value left, Value right, int line) {
        if (left.type == Value.Type.ARRAY || right.type == Value.Type.ARRAY
                || left.type == Value.Type.STRING || right.type == Value.Type.STRING) {
            throw fail(ErrorKind.TYPE_MISMATCH, "Operator " + op.symbol + " cannot be applied to "
                    + describe(left) + " and " + describe(right), line);
        }
        if (op.isArithmetic() && (left.type == Value.Type.BOOL || right.type == Value.Type.BOOL)) {
            throw fail(ErrorKind.TYPE_MISMATCH, "Operator " + op.symbol + " cannot be applied to bool", line);
        }
        return TypeRules.promote(left.varType(), right.varType());
    }

    private static String describe(Value v) {
        return v.type == Value.Type.ARRAY ? "array" : v.varType().keyword();
    }

    private Value arithmetic(Binary expr, Value left, Value right) {
        Operator op = expr.operator;
        VarType type = operandType(op, left, right, expr.line);

        switch (type) {
            case SHORT:
            case INT: {
                int a = (int) TypeRules.toLong(left);
                int b = (int) TypeRules.toLong(right);
                int r;
                switch (op) {
                    case PLUS: r = a + b; break;
                    case MINUS: r = a - b; break;
                    case TIMES: r = a * b; break;
                    case DIVIDE:
                        if (b == 0) {
                            reportRecoverable(ErrorKind.DIVISION_BY_ZERO, "Division by zero", expr.line);
                            return type.zero();
                        }
                        r = a / b;
                        break;
                    case MOD:
                        if (b == 0) {
                            reportRecoverable(ErrorKind.MODULO_BY_ZERO, "Modulo by zero", expr.line);
                            return type.zero();
                        }
                        r = (expr.unsigned && type == VarType.INT) ? Integer.remainderUnsigned(a, b) : a % b;
                        break;
                    default:
                        throw fail(ErrorKind.UNSUPPORTED_OPERATION, "Unknown operator " + op, expr.line);
                }
                return (type == VarType.SHORT) ? Value.int16((short) r) : Value.int32(r);
            }
            case FLOAT: {
                float a = (float) TypeRules.toDouble(left);
                float b = (float) TypeRules.toDouble(right);
                switch (op) {
                    case PLUS: return Value.float32(a + b);
                    case MINUS: return Value.float32(a - b);
                    case TIMES: return Value.float32(a * b);
                    case DIVIDE: return Value.float32(a / b);
                    case MOD: return Value.float32(a % b);
                    default: throw fail(ErrorKind.UNSUPPORTED_OPERATION, "Unknown operator " + op, expr.line);
                }
            }
            default: {
                double a = TypeRules.toDouble(left);
                double b = TypeRules.toDouble(right);
                switch (op) {
                    case PLUS: return Value.float64(a + b);
                    case MINUS: return Value.float64(a - b);
                    case TIMES: return Value.float64(a * b);
                    case DIVIDE: return Value.float64(a / b);
                    case MOD: return Value.float64(a % b);
                    default: throw fail(ErrorKind.UNSUPPORTED_OPERATION, "Unknown operator " + op, expr.line);
                }
            }
        }
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        if (expr.operator == Operator.NEG) {
            Value v = evaluate(expr.operand);
            switch (v.type) {
                case BOOL: return Value.bool(!v.asBool());
                case SHORT: return Value.int16((short) -v.asShort());
                case INT: return Value.int32(-v.asInt());
                case CHAR: return Value.int32(-v.asChar());
                case FLOAT: return Value.float32(-v.asFloat());
                case DOUBLE: return Value.float64(-v.asDouble());
                default:
                    throw fail(ErrorKind.TYPE_MISMATCH, "Cannot negate " + describe(v), expr.line);
            }
        }

        if (!(expr.operand instanceof Identifier)) {
            throw fail(ErrorKind.UNSUPPORTED_OPERATION,
                    "Operator " + expr.operator.symbol + " applies to variables only", expr.line);
        }
        Variable var = resolve((Identifier) expr.operand);
        if (var.isArray() || !var.type.isNumeric()) {
            throw fail(ErrorKind.TYPE_MISMATCH,
                    "Operator " + expr.operator.symbol + " cannot be applied to " + (var.isArray() ? "array" : var.type.keyword()),
                    expr.line);
        }
        var.checkWritable();

        Value old = var.get();
        int delta = (expr.operator == Operator.PRE_INC || expr.operator == Operator.POST_INC) ? 1 : -1;
        Value updated;
        if (var.type.isFloating()) {
            updated = TypeRules.coerce(Value.float64(TypeRules.toDouble(old) + delta), var.type);
        } else {
            updated = TypeRules.coerce(Value.int32((int) (TypeRules.toLong(old) + delta)), var.type);
        }
        var.assign(updated);
        return (expr.operator == Operator.PRE_INC || expr.operator == Operator.PRE_DEC) ? updated : old;
    }

    @Override
    public Value visitArrayAccessExpr(ArrayAccess expr) {
        Variable var = resolveArray(expr.name, expr.line);
        int[] indices = evaluateIndices(expr.indices);
        try {
            return var.storage().get(indices);
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(lineOf(expr));
        }
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Builtin builtin = builtins.get(expr.name);
        if (builtin != null) {
            return builtin.call(this, expr.arguments, lineOf(expr));
        }
        return callFunction(expr.name, expr.arguments, lineOf(expr));
    }

    /**
     * Call protocol: arguments are evaluated in the caller's scope and converted to the parameter
     * types before the function-boundary scope is opened. Returns null for void functions.
     */
    public Value callFunction(String name, List<ExprInterface> argExprs, int line) {
        UserFunction fn = functions.lookup(name);
        if (fn == null) {
            throw fail(ErrorKind.UNDEFINED_FUNCTION, "Undefined function '" + name + "'", line);
        }
        if (argExprs.size() != fn.params.size()) {
            throw fail(ErrorKind.ARITY_MISMATCH,
                    name + "() expects " + fn.params.size() + " arguments, got " + argExprs.size(), line);
        }
        if (callStack.size() >= maxCallDepth) {
            throw fail(ErrorKind.ALLOCATION_FAILURE, "Max call depth exceeded (" + maxCallDepth + ")", line);
        }

        List<Value> args = new ArrayList<>(argExprs.size());
        for (int i = 0; i < argExprs.size(); i++) {
            Statement.Param p = fn.params.get(i);
            args.add(evaluateAs(argExprs.get(i), p.type, "argument '" + p.name + "' of " + name + "()"));
        }

        Scope caller = env.current();
        callStack.push(new CallFrame(name, fn.returnType, args, line));
        exitTargets.push(ExitTarget.FUNCTION);
        Debug.get().t(TAG, "call " + callStack.peek() + " depth=" + callStack.size());
        try {
            env.enterFunctionScope(fn, args);
            returnChannel.reset(fn.returnType);
            boolean returned = false;
            try {
                execute(fn.body);
            } catch (ReturnSignal rs) {
                returned = true;
            }
            if (fn.returnType == VarType.VOID) return null;
            if (returned && returnChannel.hasValue()) return returnChannel.value();
            return fn.returnType.zero();
        } catch (StackOverflowError so) {
            throw fail(ErrorKind.ALLOCATION_FAILURE,
                    "Stack exhausted in " + name + "() at call depth " + callStack.size(), line);
        } finally {
            env.unwindTo(caller);
            exitTargets.pop();
            callStack.pop();
        }
    }

    @Override
    public Value visitSizeofExpr(Sizeof expr) {
        ExprInterface operand = expr.operand;
        if (operand instanceof Identifier) {
            Variable var = resolve((Identifier) operand);
            if (var.isArray()) {
                return Value.int32(var.type.width() * var.storage().totalLength());
            }
            if (var.type == VarType.STRING) {
                return Value.int32(var.get().asString().length() + 1);
            }
            return Value.int32(var.type.width());
        }
        if (operand instanceof Literal && ((Literal) operand).value.type == Value.Type.STRING) {
            return Value.int32(((Literal) operand).value.asString().length() + 1);
        }
        VarType t = types.resolve(operand);
        if (t == null || t == VarType.VOID) {
            throw fail(ErrorKind.TYPE_MISMATCH, "sizeof operand has no type", expr.line);
        }
        return Value.int32(t.width());
    }

    // ===================== STATEMENTS =====================

    @Override
    public void visitDeclarationStmt(Declaration stmt) {
        mark(stmt);
        if (stmt.isArray()) {
            declareArray(stmt);
            return;
        }
        Variable var;
        try {
            var = Variable.scalar(stmt.name, stmt.type, stmt.modifiers);
            env.declare(var);
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(currentLine);
        }
        if (stmt.elements != null) {
            throw fail(ErrorKind.TYPE_MISMATCH, "Scalar '" + stmt.name + "' cannot take an element list", stmt.line);
        }
        if (stmt.initializer != null) {
            var.initialize(evaluateAs(stmt.initializer, stmt.type, "initializer of '" + stmt.name + "'"));
        }
    }

    private void declareArray(Declaration stmt) {
        int[] dims = new int[stmt.dimensions.size()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = evaluateAs(stmt.dimensions.get(i), VarType.INT, "array dimension").asInt();
        }
        ArrayStorage storage;
        try {
            storage = new ArrayStorage(stmt.type, dims);
            env.declare(Variable.array(stmt.name, stmt.modifiers, storage));
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(currentLine);
        }

        if (stmt.elements != null) {
            if (stmt.elements.size() > storage.totalLength()) {
                throw fail(ErrorKind.ARRAY_BOUNDS_VIOLATION, "Too many initializers for '" + stmt.name
                        + "': " + stmt.elements.size() + " > " + storage.totalLength(), stmt.line);
            }
            for (int i = 0; i < stmt.elements.size(); i++) {
                storage.setAt(i, evaluateAs(stmt.elements.get(i), stmt.type, "element " + i + " of '" + stmt.name + "'"));
            }
        } else if (stmt.initializer != null) {
            Value init = evaluate(stmt.initializer);
            if (init.type != Value.Type.STRING || stmt.type != VarType.CHAR) {
                throw fail(ErrorKind.TYPE_MISMATCH,
                        "Array '" + stmt.name + "' can only be initialized from an element list", stmt.line);
            }
            try {
                storage.storeCString(init.asString());
            } catch (BrainrotRuntimeException e) {
                throw e.atLine(currentLine);
            }
        }
    }

    @Override
    public void visitAssignmentStmt(Assignment stmt) {
        mark(stmt);
        if (stmt.target instanceof Identifier) {
            Identifier id = (Identifier) stmt.target;
            Variable var = resolve(id);
            if (var.isArray()) {
                throw fail(ErrorKind.TYPE_MISMATCH, "Cannot assign to array '" + id.name + "' as a whole", stmt.line);
            }
            Value v = evaluateAs(stmt.value, var.type, "assignment to '" + id.name + "'");
            try {
                var.assign(v);
            } catch (BrainrotRuntimeException e) {
                throw e.atLine(currentLine);
            }
            return;
        }

        ArrayAccess target = (ArrayAccess) stmt.target;
        Variable var = resolveArray(target.name, target.line);
        int[] indices = evaluateIndices(target.indices);
        Value v = evaluateAs(stmt.value, var.type, "assignment to '" + target.name + "'");
        try {
            var.assignElement(indices, v);
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(currentLine);
        }
    }

    @Override
    public void visitIfStmt(If stmt) {
        mark(stmt);
        Scope saved = env.current();
        env.enterScope();
        try {
            if (evaluateCondition(stmt.condition)) {
                execute(stmt.thenBranch);
            } else {
                execute(stmt.elseBranch);
            }
        } finally {
            env.unwindTo(saved);
        }
    }

    @Override
    public void visitForStmt(For stmt) {
        mark(stmt);
        Scope outer = env.current();
        env.enterScope();
        exitTargets.push(ExitTarget.LOOP);
        try {
            execute(stmt.init);
            while (true) {
                Scope iteration = env.current();
                env.enterScope();
                try {
                    if (stmt.condition != null && !evaluateCondition(stmt.condition)) break;
                    execute(stmt.body);
                    execute(stmt.increment);
                } finally {
                    env.unwindTo(iteration);
                }
            }
        } catch (BreakSignal b) {
            Debug.get().t(TAG, "break out of for at line " + currentLine);
        } finally {
            exitTargets.pop();
            env.unwindTo(outer);
        }
    }

    @Override
    public void visitWhileStmt(While stmt) {
        mark(stmt);
        Scope outer = env.current();
        env.enterScope();
        exitTargets.push(ExitTarget.LOOP);
        try {
            while (evaluateCondition(stmt.condition)) {
                Scope iteration = env.current();
                env.enterScope();
                try {
                    execute(stmt.body);
                } finally {
                    env.unwindTo(iteration);
                }
            }
        } catch (BreakSignal b) {
            Debug.get().t(TAG, "break out of while at line " + currentLine);
        } finally {
            exitTargets.pop();
            env.unwindTo(outer);
        }
    }

    @Override
    public void visitDoWhileStmt(DoWhile stmt) {
        mark(stmt);
        Scope outer = env.current();
        env.enterScope();
        exitTargets.push(ExitTarget.LOOP);
        try {
            do {
                Scope iteration = env.current();
                env.enterScope();
                try {
                    execute(stmt.body);
                } finally {
                    env.unwindTo(iteration);
                }
            } while (evaluateCondition(stmt.condition));
        } catch (BreakSignal b) {
            Debug.get().t(TAG, "break out of do-while at line " + currentLine);
        } finally {
            exitTargets.pop();
            env.unwindTo(outer);
        }
    }

    @Override
    public void visitSwitchStmt(Switch stmt) {
        mark(stmt);
        Value selector = evaluate(stmt.expression);
        Scope outer = env.current();
        env.enterScope();
        exitTargets.push(ExitTarget.SWITCH);
        try {
            boolean matched = false;
            for (Case c : stmt.cases) {
                if (!matched) {
                    matched = c.isDefault() || caseMatches(selector, evaluate(c.value), stmt.line);
                }
                if (matched) {
                    for (Stmt s : c.body) execute(s);
                }
            }
        } catch (BreakSignal b) {
            Debug.get().t(TAG, "break out of switch at line " + currentLine);
        } finally {
            exitTargets.pop();
            env.unwindTo(outer);
        }
    }

    private boolean caseMatches(Value selector, Value label, int line) {
        if (selector.type == Value.Type.STRING || label.type == Value.Type.STRING) {
            if (selector.type != label.type) {
                throw fail(ErrorKind.TYPE_MISMATCH, "Case label type does not match switch value", line);
            }
            return selector.asString().equals(label.asString());
        }
        return TypeRules.isTruthy(compare(Operator.EQ, selector, label, line));
    }

    @Override
    public void visitBreakStmt(Break stmt) {
        mark(stmt);
        ExitTarget target = exitTargets.peek();
        if (target != ExitTarget.LOOP && target != ExitTarget.SWITCH) {
            throw fail(ErrorKind.UNSUPPORTED_OPERATION, "break outside of a loop or switch", stmt.line);
        }
        throw new BreakSignal();
    }

    @Override
    public void visitReturnStmt(Return stmt) {
        mark(stmt);
        VarType type = callStack.isEmpty() ? VarType.INT : callStack.peek().returnType;
        if (stmt.value == null) {
            returnChannel.reset(type);
        } else {
            if (type == VarType.VOID) {
                throw fail(ErrorKind.TYPE_MISMATCH, "void function " + callStack.peek().functionName
                        + "() cannot return a value", stmt.line);
            }
            returnChannel.set(type, evaluateAs(stmt.value, type, "return value"));
        }
        throw new ReturnSignal();
    }

    @Override
    public void visitFunctionDefStmt(FunctionDef stmt) {
        mark(stmt);
        registerFunction(stmt);
    }

    @Override
    public void visitStatementListStmt(StatementList stmt) {
        for (Stmt s : stmt.statements) execute(s);
    }

    @Override
    public void visitPrintStmt(Print stmt) {
        mark(stmt);
        out.println(display(evaluate(stmt.value), stmt.line));
        out.flush();
    }

    @Override
    public void visitErrorPrintStmt(ErrorPrint stmt) {
        mark(stmt);
        err.println(display(evaluate(stmt.value), stmt.line));
        err.flush();
    }

    /** Text written by print: integral values in decimal, floating values with %f. */
    private String display(Value v, int line) {
        switch (v.type) {
            case STRING: return v.asString();
            case FLOAT:
            case DOUBLE: return String.format(Locale.ROOT, "%f", TypeRules.toDouble(v));
            case ARRAY:
                if (v.asArray().elementType() == VarType.CHAR) return v.asArray().asCString();
                throw fail(ErrorKind.TYPE_MISMATCH, "Cannot print a " + v.asArray().elementType().keyword() + " array", line);
            default: return Long.toString(TypeRules.toLong(v));
        }
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        mark(stmt);
        stmt.expression.accept(this);
    }
}
