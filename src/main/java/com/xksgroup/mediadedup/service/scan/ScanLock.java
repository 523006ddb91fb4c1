package com.xksgroup.mediadedup.service.scan;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Process-wide advisory lock guaranteeing at most one scan at a time.
 *
 * <p>Re-entrant: the owning thread may acquire it again, each acquisition increments a hold count and the
 * lock is released when the count drops back to zero. Other threads get {@link Optional#empty()} instead
 * of blocking.
 */
@Slf4j
@Component
public class ScanLock {

    private Thread owner;
    private int holdCount;

    public synchronized Optional<Handle> tryAcquire() {
        Thread current = Thread.currentThread();
        if (owner != null && owner != current) {
            return Optional.empty();
        }
        owner = current;
        holdCount++;
        log.debug("Scan lock acquired by {} (holds: {})", current.getName(), holdCount);
        return Optional.of(new Handle());
    }

    public synchronized boolean isHeld() {
        return owner != null;
    }

    public synchronized int getHoldCount() {
        return holdCount;
    }

    private synchronized void release() {
        if (owner != Thread.currentThread()) {
            throw new IllegalStateException("Scan lock released by a thread that does not own it");
        }
        holdCount--;
        if (holdCount == 0) {
            owner = null;
            log.debug("Scan lock released");
        }
    }

    /**
     * One acquisition of the lock. Closing it more than once has no further effect.
     */
    public final class Handle implements AutoCloseable {
        private boolean closed;

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                release();
            }
        }
    }
}
