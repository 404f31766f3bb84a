package com.brainrot.script.core;

/**
 * Promotion lattice and C-style conversions between scalar values.
 *
 * Ranking, narrowest first: SHORT &lt; INT &lt; FLOAT &lt; DOUBLE. BOOL and CHAR rank as INT.
 */
public final class TypeRules {

    private TypeRules() {}

    static int rank(VarType t) {
        switch (t) {
            case SHORT: return 0;
            case INT:
            case BOOL:
            case CHAR: return 1;
            case FLOAT: return 2;
            case DOUBLE: return 3;
            default: return -1;
        }
    }

    /**
     * Common type of a binary arithmetic or relational operation, or null when either side
     * has no place in the lattice (STRING, VOID, unknown).
     */
    public static VarType promote(VarType a, VarType b) {
        if (a == null || b == null) return null;
        int ra = rank(a);
        int rb = rank(b);
        if (ra < 0 || rb < 0) return null;
        switch (Math.max(ra, rb)) {
            case 0: return VarType.SHORT;
            case 1: return VarType.INT;
            case 2: return VarType.FLOAT;
            default: return VarType.DOUBLE;
        }
    }

    /** Integral view of a SHORT, INT, CHAR or BOOL value; floating values truncate toward zero. */
    public static long toLong(Value v) {
        switch (v.type) {
            case SHORT: return v.asShort();
            case INT: return v.asInt();
            case CHAR: return v.asChar();
            case BOOL: return v.asBool() ? 1 : 0;
            case FLOAT: return (long) v.asFloat();
            case DOUBLE: return (long) v.asDouble();
            default: throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH, "Expected a numeric value, got " + v.type);
        }
    }

    public static double toDouble(Value v) {
        switch (v.type) {
            case FLOAT: return v.asFloat();
            case DOUBLE: return v.asDouble();
            default: return toLong(v);
        }
    }

    /** Condition test: numbers are true when non-zero. Strings and arrays are not conditions. */
    public static boolean isTruthy(Value v) {
        switch (v.type) {
            case BOOL: return v.asBool();
            case FLOAT:
            case DOUBLE: return toDouble(v) != 0.0;
            case SHORT:
            case INT:
            case CHAR: return toLong(v) != 0;
            default: throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH, v.type + " is not a valid condition");
        }
    }

    /**
     * Converts a value to the target type with C cast semantics: narrowing truncates toward zero
     * and wraps to the target width. Returns null when no conversion exists.
     */
    public static Value coerce(Value v, VarType target) {
        if (v == null || target == null) return null;
        if (v.type == Value.Type.ARRAY) return null;
        if (v.type == Value.Type.STRING || target == VarType.STRING) {
            return (v.type == Value.Type.STRING && target == VarType.STRING) ? v : null;
        }
        if (v.varType() == target) return v;

        switch (target) {
            case SHORT:
                return Value.int16((short) integral(v));
            case INT:
                return Value.int32((int) integral(v));
            case CHAR:
                return Value.character((int) integral(v));
            case BOOL:
                return Value.bool(isTruthy(v));
            case FLOAT:
                return Value.float32((float) toDouble(v));
            case DOUBLE:
                return Value.float64(toDouble(v));
            default:
                return null;
        }
    }

    private static long integral(Value v) {
        if (v.type == Value.Type.FLOAT || v.type == Value.Type.DOUBLE) {
            double d = toDouble(v);
            if (Double.isNaN(d)) return 0;
            return (long) d;
        }
        return toLong(v);
    }

    /** Like {@link #coerce} but fails with TYPE_MISMATCH instead of returning null. */
    public static Value require(Value v, VarType target, String context) {
        Value out = coerce(v, target);
        if (out == null) {
            String from = (v == null) ? "void" : (v.type == Value.Type.ARRAY ? "array" : v.varType().keyword());
            throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH,
                    "Cannot convert " + from + " to " + target.keyword() + " in " + context);
        }
        return out;
    }
}
