package com.brainrot.script.core;

import java.util.Arrays;

/**
 * Contiguous, zero-initialized element buffer addressed in row-major order.
 * The last index varies fastest.
 */
public final class ArrayStorage {

    public static final int MAX_DIMENSIONS = 8;

    private final VarType elementType;
    private final int[] dimensions;
    private final int totalLength;
    private final Value[] data;

    public ArrayStorage(VarType elementType, int... dimensions) {
        if (elementType == null || elementType == VarType.VOID) {
            throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH, "Arrays of " + elementType + " are not allowed");
        }
        if (dimensions == null || dimensions.length == 0 || dimensions.length > MAX_DIMENSIONS) {
            int n = (dimensions == null) ? 0 : dimensions.length;
            throw new BrainrotRuntimeException(ErrorKind.ALLOCATION_FAILURE,
                    "Arrays take 1 to " + MAX_DIMENSIONS + " dimensions, got " + n);
        }
        int total = 1;
        for (int d : dimensions) {
            if (d <= 0) {
                throw new BrainrotRuntimeException(ErrorKind.ALLOCATION_FAILURE, "Invalid array dimension " + d);
            }
            try {
                total = Math.multiplyExact(total, d);
            } catch (ArithmeticException e) {
                throw new BrainrotRuntimeException(ErrorKind.ALLOCATION_FAILURE,
                        "Array of " + Arrays.toString(dimensions) + " is too large");
            }
        }
        this.elementType = elementType;
        this.dimensions = dimensions.clone();
        this.totalLength = total;
        this.data = new Value[total];
        Arrays.fill(data, elementType.zero());
    }

    public VarType elementType() { return elementType; }

    public int rank() { return dimensions.length; }

    public int[] dimensions() { return dimensions.clone(); }

    public int totalLength() { return totalLength; }

    /**
     * Row-major linear offset of the given indices. Every axis is bounds-checked and the index
     * count must equal the declared rank.
     */
    public int offset(int... indices) {
        if (indices.length != dimensions.length) {
            throw new BrainrotRuntimeException(ErrorKind.ARRAY_BOUNDS_VIOLATION,
                    "Array has " + dimensions.length + " dimension(s), accessed with " + indices.length + " index(es)");
        }
        int offset = 0;
        for (int axis = 0; axis < dimensions.length; axis++) {
            int i = indices[axis];
            if (i < 0 || i >= dimensions[axis]) {
                throw new BrainrotRuntimeException(ErrorKind.ARRAY_BOUNDS_VIOLATION,
                        "Index " + i + " out of bounds [0, " + dimensions[axis] + ") on axis " + axis);
            }
            offset = offset * dimensions[axis] + i;
        }
        return offset;
    }

    public Value get(int... indices) {
        return data[offset(indices)];
    }

    /** Stores an element; the caller has already converted it to the element type. */
    public void set(int[] indices, Value v) {
        int at = offset(indices);
        data[at] = v;
    }

    public Value getAt(int linear) {
        checkLinear(linear);
        return data[linear];
    }

    public void setAt(int linear, Value v) {
        checkLinear(linear);
        data[linear] = v;
    }

    private void checkLinear(int linear) {
        if (linear < 0 || linear >= totalLength) {
            throw new BrainrotRuntimeException(ErrorKind.ARRAY_BOUNDS_VIOLATION,
                    "Element " + linear + " out of bounds [0, " + totalLength + ")");
        }
    }

    /** Char array contents up to the first NUL. */
    public String asCString() {
        if (elementType != VarType.CHAR) {
            throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH, "Expected a char array, got " + elementType.keyword() + " array");
        }
        StringBuilder sb = new StringBuilder();
        for (Value v : data) {
            int c = v.asChar();
            if (c == 0) break;
            sb.append((char) c);
        }
        return sb.toString();
    }

    /** Copies a string into a char array followed by a NUL terminator. */
    public void storeCString(String s) {
        if (elementType != VarType.CHAR) {
            throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH, "Cannot store a string in a " + elementType.keyword() + " array");
        }
        if (s.length() + 1 > totalLength) {
            throw new BrainrotRuntimeException(ErrorKind.ARRAY_BOUNDS_VIOLATION,
                    "String of length " + s.length() + " does not fit in char[" + totalLength + "]");
        }
        for (int i = 0; i < totalLength; i++) {
            data[i] = Value.character(i < s.length() ? s.charAt(i) : 0);
        }
    }

    @Override
    public String toString() {
        return elementType.keyword() + Arrays.toString(dimensions);
    }
}
