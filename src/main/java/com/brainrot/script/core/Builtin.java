package com.brainrot.script.core;

import java.util.List;

import com.brainrot.script.core.Expr.ExprInterface;

/**
 * Host-provided function dispatched by name before the user function table.
 * Receives the unevaluated argument nodes; returns null when the call yields no value.
 */
public interface Builtin {
    Value call(Interpreter interpreter, List<ExprInterface> args, int line);
}
