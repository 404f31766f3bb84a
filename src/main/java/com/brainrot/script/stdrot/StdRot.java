package com.brainrot.script.stdrot;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.brainrot.debug.Debug;
import com.brainrot.script.core.ArrayStorage;
import com.brainrot.script.core.BrainrotRuntimeException;
import com.brainrot.script.core.Builtin;
import com.brainrot.script.core.ErrorKind;
import com.brainrot.script.core.Expr;
import com.brainrot.script.core.Expr.ExprInterface;
import com.brainrot.script.core.Interpreter;
import com.brainrot.script.core.Value;
import com.brainrot.script.core.VarType;
import com.brainrot.script.core.Variable;

/**
 * The closed set of builtin functions.
 *
 * <pre>
 *   yapping(fmt, ...)   formatted print to stdout, newline appended
 *   yappin(fmt, ...)    formatted print to stdout
 *   baka(fmt, ...)      formatted print to stderr; no arguments prints a newline
 *   ragequit(code)      end the program with the given status
 *   chill(seconds)      pause
 *   slorp(var)          read one line from stdin into a variable, parsed by its type
 * </pre>
 *
 * None of them produce a value.
 */
public final class StdRot {

    private static final String TAG = "brainrot.stdrot";

    private final Sleeper sleeper;
    private final Map<String, Builtin> builtins;

    public StdRot(Sleeper sleeper) {
        this.sleeper = (sleeper == null) ? Sleeper.SYSTEM : sleeper;

        Map<String, Builtin> m = new LinkedHashMap<>();
        m.put("yapping", (itp, args, line) -> {
            itp.out().println(formatCall(itp, "yapping", args, line));
            itp.out().flush();
            return null;
        });
        m.put("yappin", (itp, args, line) -> {
            itp.out().print(formatCall(itp, "yappin", args, line));
            itp.out().flush();
            return null;
        });
        m.put("baka", (itp, args, line) -> {
            if (args.isEmpty()) {
                itp.err().println();
            } else {
                itp.err().print(formatCall(itp, "baka", args, line));
            }
            itp.err().flush();
            return null;
        });
        m.put("ragequit", (itp, args, line) -> {
            requireArgCount("ragequit", args, 1, line);
            int code = itp.evaluateAs(args.get(0), VarType.INT, "ragequit() status").asInt();
            throw new Interpreter.ExitSignal(code);
        });
        m.put("chill", this::chill);
        m.put("slorp", StdRot::slorp);
        this.builtins = Collections.unmodifiableMap(m);
    }

    public Map<String, Builtin> builtins() {
        return builtins;
    }

    private static void requireArgCount(String fn, List<ExprInterface> args, int count, int line) {
        if (args.size() != count) {
            throw new BrainrotRuntimeException(ErrorKind.ARITY_MISMATCH,
                    fn + "() expects " + count + " argument(s), got " + args.size(), line);
        }
    }

    // -------------------------
    // Formatted output
    // -------------------------

    private static String formatCall(Interpreter itp, String fn, List<ExprInterface> args, int line) {
        if (args.isEmpty()) {
            throw new BrainrotRuntimeException(ErrorKind.ARITY_MISMATCH, fn + "() expects a format string", line);
        }
        ExprInterface first = args.get(0);
        if (!(first instanceof Expr.Literal) || ((Expr.Literal) first).value.type != Value.Type.STRING) {
            throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH,
                    fn + "() format must be a string literal", line);
        }
        String fmt = ((Expr.Literal) first).value.asString();

        List<FormatArg> values = new ArrayList<>(args.size() - 1);
        for (int i = 1; i < args.size(); i++) {
            ExprInterface e = args.get(i);
            Value v = itp.evaluate(e);
            values.add(new FormatArg(v, isUnsignedVariable(itp, e)));
        }
        try {
            return PrintfFormatter.format(fmt, values);
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(line);
        }
    }

    private static boolean isUnsignedVariable(Interpreter itp, ExprInterface e) {
        String name = null;
        if (e instanceof Expr.Identifier) name = ((Expr.Identifier) e).name;
        if (e instanceof Expr.ArrayAccess) name = ((Expr.ArrayAccess) e).name;
        if (name == null) return false;
        Variable v = itp.environment().lookup(name);
        return v != null && v.isUnsigned();
    }

    // -------------------------
    // chill
    // -------------------------

    private Value chill(Interpreter itp, List<ExprInterface> args, int line) {
        requireArgCount("chill", args, 1, line);
        int seconds = itp.evaluateAs(args.get(0), VarType.INT, "chill() duration").asInt();
        if (seconds < 0) {
            throw new BrainrotRuntimeException(ErrorKind.UNSUPPORTED_OPERATION,
                    "chill() duration must not be negative, got " + seconds, line);
        }
        try {
            sleeper.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Debug.get().w(TAG, "chill(" + seconds + ") interrupted");
        }
        return null;
    }

    // -------------------------
    // slorp
    // -------------------------

    private static Value slorp(Interpreter itp, List<ExprInterface> args, int line) {
        requireArgCount("slorp", args, 1, line);
        ExprInterface target = args.get(0);
        if (!(target instanceof Expr.Identifier)) {
            throw new BrainrotRuntimeException(ErrorKind.UNSUPPORTED_OPERATION,
                    "slorp() reads into a variable", line);
        }
        Variable var = itp.resolve((Expr.Identifier) target);

        String input;
        try {
            input = itp.in().readLine();
        } catch (IOException e) {
            throw new BrainrotRuntimeException(ErrorKind.UNSUPPORTED_OPERATION,
                    "slorp() failed to read input: " + e.getMessage(), line, e);
        }
        if (input == null) {
            Debug.get().w(TAG, "slorp(" + var.name() + ") hit end of input; variable unchanged");
            return null;
        }

        try {
            if (var.isArray()) {
                ArrayStorage storage = var.storage();
                if (storage.elementType() != VarType.CHAR) {
                    throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH,
                            "slorp() cannot read into a " + storage.elementType().keyword() + " array");
                }
                if (var.isConst()) {
                    throw new BrainrotRuntimeException(ErrorKind.CONST_VIOLATION,
                            "Cannot assign to const variable '" + var.name() + "'");
                }
                int room = storage.totalLength() - 1;
                storage.storeCString(input.length() > room ? input.substring(0, room) : input);
            } else {
                var.assign(parse(input, var.type()));
            }
        } catch (BrainrotRuntimeException e) {
            throw e.atLine(line);
        }
        return null;
    }

    static Value parse(String input, VarType type) {
        String s = input.trim();
        try {
            switch (type) {
                case SHORT: return Value.int16(Short.parseShort(s));
                case INT: return Value.int32(Integer.parseInt(s));
                case FLOAT: return Value.float32(Float.parseFloat(s));
                case DOUBLE: return Value.float64(Double.parseDouble(s));
                case CHAR: return Value.character(input.isEmpty() ? 0 : input.charAt(0));
                case STRING: return Value.string(input);
                case BOOL: {
                    String b = s.toLowerCase(Locale.ROOT);
                    if (b.equals("w") || b.equals("true") || b.equals("1")) return Value.bool(true);
                    if (b.equals("l") || b.equals("false") || b.equals("0")) return Value.bool(false);
                    break;
                }
                default:
                    break;
            }
        } catch (NumberFormatException e) {
            throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH,
                    "slorp() could not read " + type.keyword() + " from '" + input + "'", 0, e);
        }
        throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH,
                "slorp() could not read " + type.keyword() + " from '" + input + "'");
    }
}
