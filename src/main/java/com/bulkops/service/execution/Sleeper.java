package com.bulkops.service.execution;

/**
 * Blocking pause used between retries; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
