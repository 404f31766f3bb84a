package com.brainrot.script.core;

/** Constructs a non-local exit can unwind to. */
enum ExitTarget {
    LOOP,
    SWITCH,
    FUNCTION
}
