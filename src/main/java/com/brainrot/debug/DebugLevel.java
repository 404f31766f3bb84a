package com.brainrot.debug;

/** Severity of a debug record, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }
}
