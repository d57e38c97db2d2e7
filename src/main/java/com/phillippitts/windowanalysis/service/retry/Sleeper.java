package com.phillippitts.windowanalysis.service.retry;

/**
 * Blocking pause between retries. Replaced in tests to avoid real waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
