package com.brainrot.script.core;

import java.util.List;

/** A registered function definition. The body runs in a fresh function-boundary scope per call. */
public class UserFunction {
    final Statement.FunctionDef definition;
    final String name;
    final VarType returnType;
    final List<Statement.Param> params;
    final Statement.Stmt body;

    UserFunction(Statement.FunctionDef def) {
        this.definition = def;
        this.name = def.name;
        this.returnType = def.returnType;
        this.params = def.params;
        this.body = def.body;
    }

    public String name() { return name; }
    public VarType returnType() { return returnType; }
    public List<Statement.Param> params() { return params; }
    public Statement.FunctionDef definition() { return definition; }
}
