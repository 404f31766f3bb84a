package com.brainrot.debug;

/** Pluggable debug output target (stderr, test capture, file, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
