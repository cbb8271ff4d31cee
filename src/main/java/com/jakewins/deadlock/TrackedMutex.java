package com.jakewins.deadlock;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * Wraps a lock and tells a {@link ResourceGraph} what happens to it: that we're waiting for it, that we got it,
 * that we let it go. Use it with try-with-resources so the lock, and its record in the graph, is released on
 * every way out of the block:
 * <pre>
 * try(TrackedMutex mutex = new TrackedMutex(resource.getLock(), graph)) {
 *     mutex.lock();
 *     // use the resource
 * }
 * </pre>
 * A TrackedMutex is used by one thread at a time, like a local variable; many of them may wrap the same lock.
 * Failures of the wrapped lock are passed on as-is, after the wait record has been taken back out of the graph.
 */
public class TrackedMutex implements AutoCloseable {
    private final Lock lock;
    private final ResourceGraph graph;

    /** The thread that holds the lock through this wrapper, or null if we don't hold it */
    private Thread owner;

    public TrackedMutex(Lock lock, ResourceGraph graph) {
        this.lock = lock;
        this.graph = graph;
    }

    public void lock() {
        Thread current = Thread.currentThread();
        beforeAcquire(current);
        try {
            lock.lock();
        } catch (Throwable e) {
            graph.stopWaiting(current, lock);
            throw e;
        }
        acquired(current);
    }

    public void lockInterruptibly() throws InterruptedException {
        Thread current = Thread.currentThread();
        beforeAcquire(current);
        try {
            lock.lockInterruptibly();
        } catch (Throwable e) {
            // Most likely interrupted while blocked; either way we're not waiting any more
            graph.stopWaiting(current, lock);
            throw e;
        }
        acquired(current);
    }

    /** Acquire the lock if it is free right now; never claims a hold in the graph if it isn't. */
    public boolean tryLock() {
        Thread current = Thread.currentThread();
        beforeAcquire(current);
        boolean gotLock;
        try {
            gotLock = lock.tryLock();
        } catch (Throwable e) {
            graph.stopWaiting(current, lock);
            throw e;
        }
        return afterAttempt(current, gotLock);
    }

    public boolean tryLock(long time, TimeUnit unit) throws InterruptedException {
        Thread current = Thread.currentThread();
        beforeAcquire(current);
        boolean gotLock;
        try {
            gotLock = lock.tryLock(time, unit);
        } catch (Throwable e) {
            graph.stopWaiting(current, lock);
            throw e;
        }
        return afterAttempt(current, gotLock);
    }

    /**
     * Release the lock if this wrapper holds it; otherwise do nothing. If the wrapped lock refuses to be released,
     * the hold stays recorded and the failure is passed on.
     */
    public void unlock() {
        if(owner == null) {
            return;
        }
        graph.releaseLock(owner, lock);
        try {
            lock.unlock();
        } catch (Throwable e) {
            // Still held, so it still belongs in the graph
            graph.acquireLock(owner, lock);
            throw e;
        }
        owner = null;
    }

    public boolean isLocked() {
        return owner != null;
    }

    @Override
    public void close() {
        unlock();
    }

    @Override
    public String toString() {
        return "TrackedMutex(" + lock + (owner == null ? "" : ", held by " + owner.getName()) + ")";
    }

    private void beforeAcquire(Thread current) {
        assert owner == null : String.format("%s is already held; re-locking through the same wrapper would leak a hold.", this);
        graph.waitForLock(current, lock);
    }

    private boolean afterAttempt(Thread current, boolean gotLock) {
        if(gotLock) {
            acquired(current);
            return true;
        }
        graph.stopWaiting(current, lock);
        return false;
    }

    private void acquired(Thread current) {
        owner = current;
        graph.stopWaiting(current, lock);
        graph.acquireLock(current, lock);
    }
}
