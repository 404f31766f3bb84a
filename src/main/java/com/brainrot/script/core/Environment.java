package com.brainrot.script.core;

import java.util.List;

/**
 * Chain of scopes rooted at the global scope, owned by one interpreter.
 *
 * Lookup walks toward the root but stops after the nearest function-boundary scope, so a
 * function activation sees only its own parameters and locals.
 */
public class Environment {

    private final Scope global;
    private Scope current;
    private int depth;

    public Environment() {
        this.global = new Scope(null, false);
        this.current = global;
        this.depth = 1;
    }

    public Scope global() { return global; }

    public Scope current() { return current; }

    /** Number of live scopes, global included. */
    public int depth() { return depth; }

    // -------------------------
    // Block-scoping (LIFO)
    // -------------------------
    public Scope enterScope() {
        return push(false);
    }

    public void exitScope() {
        if (current == global) {
            throw new BrainrotRuntimeException(ErrorKind.UNSUPPORTED_OPERATION, "Cannot exit the global scope");
        }
        current = current.parent;
        depth--;
    }

    /** Pops scopes until {@code target} is current again. */
    public void unwindTo(Scope target) {
        while (current != target) {
            if (current == global) {
                throw new IllegalStateException("Scope to unwind to is not on the chain (bug)");
            }
            exitScope();
        }
    }

    private Scope push(boolean boundary) {
        current = new Scope(current, boundary);
        depth++;
        return current;
    }

    // -------------------------
    // Symbols
    // -------------------------
    public void declare(Variable v) {
        if (current.variables.containsKey(v.name)) {
            throw new BrainrotRuntimeException(ErrorKind.UNSUPPORTED_OPERATION,
                    "Variable '" + v.name + "' already declared in this scope");
        }
        current.variables.put(v.name, v);
    }

    /** Nearest visible variable, or null. */
    public Variable lookup(String name) {
        for (Scope s = current; s != null; s = s.parent) {
            Variable v = s.variables.get(name);
            if (v != null) return v;
            if (s.functionBoundary) return null;
        }
        return null;
    }

    public Variable require(String name) {
        Variable v = lookup(name);
        if (v == null) {
            throw new BrainrotRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'");
        }
        return v;
    }

    /**
     * Opens a function-boundary scope on top of the caller's scope and binds each parameter to
     * its already evaluated and converted argument.
     */
    public Scope enterFunctionScope(UserFunction fn, List<Value> args) {
        if (args.size() != fn.params().size()) {
            throw new BrainrotRuntimeException(ErrorKind.ARITY_MISMATCH,
                    fn.name() + "() expects " + fn.params().size() + " arguments, got " + args.size());
        }
        Scope frame = push(true);
        for (int i = 0; i < args.size(); i++) {
            Statement.Param p = fn.params().get(i);
            Variable v = Variable.scalar(p.name, p.type, p.modifiers);
            v.initialize(args.get(i));
            declare(v);
        }
        return frame;
    }
}
