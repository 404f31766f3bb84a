package com.brainrot.script.core;

import java.util.Objects;

public class Value {
    public enum Type { SHORT, INT, FLOAT, DOUBLE, BOOL, CHAR, STRING, ARRAY }

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value int16(short s) { return new Value(Type.SHORT, s); }
    public static Value int32(int i) { return new Value(Type.INT, i); }
    public static Value float32(float f) { return new Value(Type.FLOAT, f); }
    public static Value float64(double d) { return new Value(Type.DOUBLE, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    /** Chars are unsigned 8-bit codes. */
    public static Value character(int code) { return new Value(Type.CHAR, code & 0xFF); }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value array(ArrayStorage a) { return new Value(Type.ARRAY, Objects.requireNonNull(a)); }

    /** Declared-type view of this value; arrays report their element type. */
    public VarType varType() {
        switch (type) {
            case SHORT: return VarType.SHORT;
            case INT: return VarType.INT;
            case FLOAT: return VarType.FLOAT;
            case DOUBLE: return VarType.DOUBLE;
            case BOOL: return VarType.BOOL;
            case CHAR: return VarType.CHAR;
            case STRING: return VarType.STRING;
            default: return asArray().elementType();
        }
    }

    public boolean isNumeric() {
        return type == Type.SHORT || type == Type.INT || type == Type.FLOAT
                || type == Type.DOUBLE || type == Type.CHAR;
    }

    public short asShort() {
        if (type != Type.SHORT) throw new RuntimeException("Expected short, got " + type);
        return (short) value;
    }

    public int asInt() {
        if (type != Type.INT) throw new RuntimeException("Expected int, got " + type);
        return (int) value;
    }

    public float asFloat() {
        if (type != Type.FLOAT) throw new RuntimeException("Expected float, got " + type);
        return (float) value;
    }

    public double asDouble() {
        if (type != Type.DOUBLE) throw new RuntimeException("Expected double, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new RuntimeException("Expected bool, got " + type);
        return (boolean) value;
    }

    public int asChar() {
        if (type != Type.CHAR) throw new RuntimeException("Expected char, got " + type);
        return (int) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new RuntimeException("Expected string, got " + type);
        return (String) value;
    }

    public ArrayStorage asArray() {
        if (type != Type.ARRAY) throw new RuntimeException("Expected array, got " + type);
        return (ArrayStorage) value;
    }

    @Override
    public String toString() {
        switch (type) {
            case CHAR:
                return "'" + (char) asChar() + "'";
            case STRING:
                return '"' + asString() + '"';
            case ARRAY:
                return asArray().toString();
            default:
                return String.valueOf(value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }
}
