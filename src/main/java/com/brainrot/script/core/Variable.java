package com.brainrot.script.core;

/** A named storage slot owned by the scope that declared it. */
public final class Variable {
    final String name;
    final VarType type;
    final Modifiers modifiers;
    private Value scalar;
    private final ArrayStorage array;

    private Variable(String name, VarType type, Modifiers modifiers, Value scalar, ArrayStorage array) {
        this.name = name;
        this.type = type;
        this.modifiers = (modifiers == null) ? Modifiers.NONE : modifiers;
        this.scalar = scalar;
        this.array = array;
    }

    public static Variable scalar(String name, VarType type, Modifiers modifiers) {
        if (type == VarType.VOID) {
            throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH, "Variable '" + name + "' cannot be void");
        }
        return new Variable(name, type, modifiers, type.zero(), null);
    }

    public static Variable array(String name, Modifiers modifiers, ArrayStorage storage) {
        return new Variable(name, storage.elementType(), modifiers, null, storage);
    }

    public String name() { return name; }
    public VarType type() { return type; }
    public Modifiers modifiers() { return modifiers; }
    public boolean isArray() { return array != null; }
    public boolean isConst() { return modifiers.isConst; }
    public boolean isUnsigned() { return modifiers.isUnsigned; }

    public ArrayStorage storage() {
        if (array == null) {
            throw new BrainrotRuntimeException(ErrorKind.UNDEFINED_ARRAY, "'" + name + "' is not an array");
        }
        return array;
    }

    /** Current value; arrays are exposed as a handle to their storage. */
    public Value get() {
        return (array != null) ? Value.array(array) : scalar;
    }

    /** Sets the value produced by the declaration itself. Const does not apply here. */
    void initialize(Value v) {
        if (array != null) throw new IllegalStateException("initialize on array " + name);
        this.scalar = v;
    }

    public void assign(Value v) {
        checkWritable();
        if (array != null) {
            throw new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH, "Cannot assign to array '" + name + "' as a whole");
        }
        this.scalar = v;
    }

    public void assignElement(int[] indices, Value v) {
        checkWritable();
        storage().set(indices, v);
    }

    void checkWritable() {
        if (modifiers.isConst) {
            throw new BrainrotRuntimeException(ErrorKind.CONST_VIOLATION, "Cannot assign to const variable '" + name + "'");
        }
    }

    @Override
    public String toString() {
        String mods = modifiers.toString();
        return (mods.isEmpty() ? "" : mods + " ") + type.keyword() + " " + name + " = " + get();
    }
}
