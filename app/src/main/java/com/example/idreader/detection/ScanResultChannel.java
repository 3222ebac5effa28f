package com.example.idreader.detection;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hand-off between the OCR worker and the consumer. Holds at most one pending result;
 * a newer result replaces one that has not been taken yet.
 */
public class ScanResultChannel {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private ScanResult pending;

    public void offer(ScanResult result) {
        lock.lock();
        try {
            pending = result;
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the pending result without waiting.
     */
    public Optional<ScanResult> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(take());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to the timeout for a result and take it.
     */
    public Optional<ScanResult> await(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (pending == null) {
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = available.awaitNanos(nanos);
            }
            return Optional.of(take());
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            pending = null;
        } finally {
            lock.unlock();
        }
    }

    private ScanResult take() {
        ScanResult result = pending;
        pending = null;
        return result;
    }
}
