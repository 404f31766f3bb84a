package com.brainrot.script.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One lexical block. Function-boundary scopes stop name lookup from reaching their parent. */
public final class Scope {
    final Map<String, Variable> variables = new LinkedHashMap<>();
    final Scope parent;
    final boolean functionBoundary;

    Scope(Scope parent, boolean functionBoundary) {
        this.parent = parent;
        this.functionBoundary = functionBoundary;
    }

    public Scope parent() { return parent; }

    public boolean isFunctionBoundary() { return functionBoundary; }

    public Variable local(String name) { return variables.get(name); }

    public Map<String, Variable> variables() { return Collections.unmodifiableMap(variables); }
}
