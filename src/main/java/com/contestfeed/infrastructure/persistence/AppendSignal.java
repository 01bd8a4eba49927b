package com.contestfeed.infrastructure.persistence;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Committed head of the event log plus a condition that feed readers wait on
 * until the writer publishes a newer token.
 */
public final class AppendSignal {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();
    private volatile long head;

    public long head() {
        return head;
    }

    /** Sets the head without waking anybody, used when loading the log. */
    public void reset(long token) {
        lock.lock();
        try {
            head = token;
        } finally {
            lock.unlock();
        }
    }

    public void publish(long token) {
        lock.lock();
        try {
            head = token;
            appended.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the head moved past {@code afterToken} within the timeout
     */
    public boolean await(long afterToken, Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            if (head > afterToken) {
                return true;
            }
            long nanos = timeout.toNanos();
            while (nanos > 0) {
                nanos = appended.awaitNanos(nanos);
                if (head > afterToken) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }
}
