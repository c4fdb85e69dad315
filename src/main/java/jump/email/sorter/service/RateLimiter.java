package jump.email.sorter.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Sliding-window limiter for remote classification calls: at most {@code maxCalls} are recorded
 * in any window of {@code window} length. A caller over the limit waits until the oldest
 * recorded call leaves the window.
 */
@Slf4j
public class RateLimiter {
    private final int maxCalls;
    private final long windowMillis;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private final Deque<Long> calls = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public RateLimiter(int maxCalls, Duration window) {
        this(maxCalls, window, System::currentTimeMillis, Sleeper.THREAD);
    }

    public RateLimiter(int maxCalls, Duration window, LongSupplier clock, Sleeper sleeper) {
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be at least 1");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxCalls = maxCalls;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
        log.info("Rate limiter initialized: {} calls per {}s", maxCalls, window.getSeconds());
    }

    /**
     * Wait for a free slot and record the call.
     * @return false if the thread was interrupted while waiting; nothing is recorded then
     */
    public boolean acquire() {
        lock.lock();
        try {
            long now = clock.getAsLong();
            purge(now);
            while (calls.size() >= maxCalls) {
                long wait = calls.peekFirst() + windowMillis - now;
                if (wait > 0) {
                    log.warn("Rate limit reached ({} calls), waiting {} ms", calls.size(), wait);
                    try {
                        sleeper.sleep(wait);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.warn("Interrupted while waiting for the rate limiter");
                        return false;
                    }
                }
                now = clock.getAsLong();
                purge(now);
            }
            calls.addLast(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of calls recorded in the window ending now.
     */
    public int recordedCalls() {
        lock.lock();
        try {
            purge(clock.getAsLong());
            return calls.size();
        } finally {
            lock.unlock();
        }
    }

    private void purge(long now) {
        while (!calls.isEmpty() && calls.peekFirst() <= now - windowMillis) {
            calls.pollFirst();
        }
    }
}
