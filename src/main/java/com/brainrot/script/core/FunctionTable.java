package com.brainrot.script.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Global name to function map of one interpreter. */
public class FunctionTable {
    private final Map<String, UserFunction> functions = new LinkedHashMap<>();

    /**
     * Registers a definition. A name that is already registered keeps its first definition and
     * that entry is returned unchanged.
     */
    public UserFunction register(Statement.FunctionDef def) {
        UserFunction existing = functions.get(def.name);
        if (existing != null) return existing;
        UserFunction fn = new UserFunction(def);
        functions.put(def.name, fn);
        return fn;
    }

    public UserFunction lookup(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Map<String, UserFunction> all() {
        return Collections.unmodifiableMap(functions);
    }
}
