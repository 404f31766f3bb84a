package com.brainrot.script.stdrot;

import com.brainrot.script.core.Value;

/** One evaluated argument of a formatted print, with the signedness of its source variable. */
public final class FormatArg {
    final Value value;
    final boolean unsigned;

    public FormatArg(Value value, boolean unsigned) {
        this.value = value;
        this.unsigned = unsigned;
    }

    public static FormatArg of(Value value) {
        return new FormatArg(value, false);
    }
}
