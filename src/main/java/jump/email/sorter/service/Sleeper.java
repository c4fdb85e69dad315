package jump.email.sorter.service;

/**
 * Pause hook so waits can be skipped in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
