package com.brainrot.script.stdrot;

/** Pause used by chill(). Tests install one that records instead of sleeping. */
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;

    Sleeper SYSTEM = Thread::sleep;
}
