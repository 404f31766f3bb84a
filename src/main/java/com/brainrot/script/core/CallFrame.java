package com.brainrot.script.core;

import java.util.List;

public class CallFrame {
    final String functionName;
    final VarType returnType;
    final List<Value> arguments;
    final int line;

    CallFrame(String functionName, VarType returnType, List<Value> arguments, int line) {
        this.functionName = functionName;
        this.returnType = returnType;
        this.arguments = arguments;
        this.line = line;
    }

    @Override
    public String toString() {
        return functionName + arguments + (line > 0 ? " @" + line : "");
    }
}
