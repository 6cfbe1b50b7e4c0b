package com.tlsearch.runtime;

/**
 * Blocking pause used between provider calls and retries.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
