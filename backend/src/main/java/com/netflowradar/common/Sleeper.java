package com.netflowradar.common;

/**
 * Blocking pause between retries. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
