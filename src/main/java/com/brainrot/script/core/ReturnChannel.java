package com.brainrot.script.core;

/** Slot written by a return statement and read by the call site right after the body finishes. */
public final class ReturnChannel {
    private boolean hasValue;
    private VarType type = VarType.VOID;
    private Value value;

    public void reset(VarType type) {
        this.type = type;
        this.hasValue = false;
        this.value = null;
    }

    public void set(VarType type, Value value) {
        this.type = type;
        this.value = value;
        this.hasValue = true;
    }

    public boolean hasValue() { return hasValue; }
    public VarType type() { return type; }
    public Value value() { return value; }
}
