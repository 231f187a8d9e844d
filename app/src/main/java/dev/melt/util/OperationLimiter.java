package dev.melt.util;

import java.util.concurrent.Semaphore;

/**
 * Counting permit shared by every engine component that starts network or VCS work.
 */
public final class OperationLimiter {
    private final Semaphore permits;
    private final int capacity;

    public OperationLimiter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a permit is available.
     *
     * @return a handle that releases the permit when closed
     */
    public Permit acquire() throws InterruptedException {
        permits.acquire();
        return new Permit(permits);
    }

    public int capacity() {
        return capacity;
    }

    public int available() {
        return permits.availablePermits();
    }

    /** Releases its permit exactly once. */
    public static final class Permit implements AutoCloseable {
        private final Semaphore owner;
        private boolean released;

        private Permit(Semaphore owner) {
            this.owner = owner;
        }

        @Override
        public synchronized void close() {
            if (!released) {
                released = true;
                owner.release();
            }
        }
    }
}
