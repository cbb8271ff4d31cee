package com.jakewins.deadlock;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An exclusive lock with a fixed level. A thread may only lock a hierarchical mutex whose level is strictly lower
 * than that of the last one it locked, so every thread takes them highest level first. If every thread follows
 * the same order, no two threads can each hold what the other wants; out-of-order attempts are refused up front
 * with a {@link HierarchyViolationException} rather than left to deadlock.
 * <p>
 * Locking a mutex twice from the same thread is an ordering violation too, as its level is not lower than itself.
 * <p>
 * Unlocking restores the thread to the level it was at before it took this mutex, so locks must be released in
 * the reverse order they were taken (innermost first); anything else is refused. Once a thread has released all
 * its hierarchical mutexes it may start over at any level.
 * <p>
 * Nothing is shared between threads apart from the underlying lock; the ordering check only looks at the calling
 * thread's own state.
 */
public class HierarchicalMutex implements Lock {
    /** Level of a thread holding no hierarchical mutex; higher than any mutex can have */
    static final long NO_LOCK_HELD = Long.MAX_VALUE;

    /** Level of the hierarchical mutex most recently locked by the current thread */
    private static final ThreadLocal<Long> currentLevel = ThreadLocal.withInitial(() -> NO_LOCK_HELD);

    private final ReentrantLock mutex = new ReentrantLock();
    private final long hierarchyLevel;

    /**
     * The level the owning thread was at before it locked this mutex; only touched by the thread holding
     * {@link #mutex}.
     */
    private long previousLevel = NO_LOCK_HELD;

    public HierarchicalMutex(long hierarchyLevel) {
        if(hierarchyLevel < 0 || hierarchyLevel >= NO_LOCK_HELD) {
            throw new IllegalArgumentException(String.format(
                    "Hierarchy level must be between 0 and %d (exclusive), got %d.", NO_LOCK_HELD, hierarchyLevel));
        }
        this.hierarchyLevel = hierarchyLevel;
    }

    public long getHierarchyLevel() {
        return hierarchyLevel;
    }

    @Override
    public void lock() {
        checkForHierarchyViolation();
        mutex.lock();
        enter();
    }

    @Override
    public void lockInterruptibly() throws InterruptedException {
        checkForHierarchyViolation();
        mutex.lockInterruptibly();
        enter();
    }

    /** @return false if the lock is held elsewhere, or if taking it now would break the hierarchy */
    @Override
    public boolean tryLock() {
        if(!canEnter()) {
            return false;
        }
        if(mutex.tryLock()) {
            enter();
            return true;
        }
        return false;
    }

    @Override
    public boolean tryLock(long time, TimeUnit unit) throws InterruptedException {
        if(!canEnter()) {
            return false;
        }
        if(mutex.tryLock(time, unit)) {
            enter();
            return true;
        }
        return false;
    }

    @Override
    public void unlock() {
        if(!mutex.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException(String.format(
                    "%s is not held by %s.", this, Thread.currentThread().getName()));
        }

        long level = currentLevel.get();
        if(level != hierarchyLevel) {
            throw new HierarchyViolationException(String.format(
                    "Mutex hierarchy violated: cannot unlock %s while a lower level mutex (level %d) is still held.",
                    this, level), hierarchyLevel, level);
        }

        currentLevel.set(previousLevel);
        previousLevel = NO_LOCK_HELD;
        mutex.unlock();
    }

    /** Conditions would let the lock go and come back behind the hierarchy's back. */
    @Override
    public Condition newCondition() {
        throw new UnsupportedOperationException("Hierarchical mutexes do not support conditions.");
    }

    @Override
    public String toString() {
        return "HierarchicalMutex(" + hierarchyLevel + ")";
    }

    /** Level of the hierarchical mutex the current thread locked last, or {@link #NO_LOCK_HELD}. */
    static long currentThreadLevel() {
        return currentLevel.get();
    }

    private boolean canEnter() {
        return currentLevel.get() > hierarchyLevel;
    }

    private void checkForHierarchyViolation() {
        long level = currentLevel.get();
        if(level <= hierarchyLevel) {
            throw new HierarchyViolationException(String.format(
                    "Mutex hierarchy violated: cannot lock %s after a mutex of level %d.", this, level),
                    hierarchyLevel, level);
        }
    }

    /** NOTE: Must hold mutex */
    private void enter() {
        previousLevel = currentLevel.get();
        currentLevel.set(hierarchyLevel);
    }
}
