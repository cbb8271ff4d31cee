package com.jakewins.deadlock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records, per thread, which locks it holds and which locks it is waiting for, and answers whether that adds up
 * to a deadlock. Edges in the wait-for graph go from a waiting thread to every thread holding the lock it waits
 * for; a cycle in that graph is a deadlock.
 * <p>
 * The graph only knows what its callers tell it, through the four hooks below or through {@link TrackedMutex}
 * which calls them for you. Waits must be paired with {@link #stopWaiting}, acquires with {@link #releaseLock}.
 * <p>
 * Every method takes the same graph lock for its whole duration, detection included. Detection is meant for
 * occasional polling, not to be called on every lock operation.
 * <p>
 * Create one per set of cooperating threads and pass it around; several graphs may live side by side.
 */
public class ResourceGraph {
    private final ReentrantLock graphLock = new ReentrantLock();

    /** Thread -> locks it holds. Threads with no locks have no entry. */
    private final Map<Thread, Set<Lock>> threadHolds = new LinkedHashMap<>();

    /** Thread -> locks it is blocked on. Threads not waiting have no entry. */
    private final Map<Thread, Set<Lock>> threadWaits = new LinkedHashMap<>();

    public void acquireLock(Lock lock) {
        acquireLock(Thread.currentThread(), lock);
    }

    /** Record that {@code thread} now holds {@code lock}. Recording the same pair twice is harmless. */
    public void acquireLock(Thread thread, Lock lock) {
        graphLock.lock();
        try {
            add(threadHolds, thread, lock);
        } finally {
            graphLock.unlock();
        }
    }

    public void releaseLock(Lock lock) {
        releaseLock(Thread.currentThread(), lock);
    }

    /** Record that {@code thread} no longer holds {@code lock}; does nothing if it was never recorded. */
    public void releaseLock(Thread thread, Lock lock) {
        graphLock.lock();
        try {
            remove(threadHolds, thread, lock);
        } finally {
            graphLock.unlock();
        }
    }

    public void waitForLock(Lock lock) {
        waitForLock(Thread.currentThread(), lock);
    }

    /** Record that {@code thread} is about to block on {@code lock}. */
    public void waitForLock(Thread thread, Lock lock) {
        graphLock.lock();
        try {
            add(threadWaits, thread, lock);
        } finally {
            graphLock.unlock();
        }
    }

    public void stopWaiting(Lock lock) {
        stopWaiting(Thread.currentThread(), lock);
    }

    /** Record that {@code thread} stopped waiting for {@code lock}, either because it got it or gave up. */
    public void stopWaiting(Thread thread, Lock lock) {
        graphLock.lock();
        try {
            remove(threadWaits, thread, lock);
        } finally {
            graphLock.unlock();
        }
    }

    /** @return true if the recorded holds and waits contain a cycle */
    public boolean hasDeadlock() {
        return detectDeadlock() != DeadlockDescription.NONE;
    }

    /**
     * Look for a cycle among the recorded holds and waits.
     * @return the first cycle found, or {@link DeadlockDescription#NONE}
     */
    public DeadlockDescription detectDeadlock() {
        graphLock.lock();
        try {
            List<DeadlockDescription.Link> cycle = findCycle();
            if(cycle == null) {
                return DeadlockDescription.NONE;
            }
            return new DeadlockDescription(cycle);
        } finally {
            graphLock.unlock();
        }
    }

    /** Snapshot of the locks recorded as held by {@code thread}. */
    public Set<Lock> locksHeldBy(Thread thread) {
        graphLock.lock();
        try {
            return snapshot(threadHolds.get(thread));
        } finally {
            graphLock.unlock();
        }
    }

    /** Snapshot of the locks {@code thread} is recorded as waiting for. */
    public Set<Lock> locksAwaitedBy(Thread thread) {
        graphLock.lock();
        try {
            return snapshot(threadWaits.get(thread));
        } finally {
            graphLock.unlock();
        }
    }

    /** Snapshot of every thread that currently holds or waits for at least one lock. */
    public Set<Thread> trackedThreads() {
        graphLock.lock();
        try {
            Set<Thread> threads = new HashSet<>(threadHolds.keySet());
            threads.addAll(threadWaits.keySet());
            return Collections.unmodifiableSet(threads);
        } finally {
            graphLock.unlock();
        }
    }

    @Override
    public String toString() {
        graphLock.lock();
        try {
            return "ResourceGraph{holds=" + threadHolds + ", waits=" + threadWaits + "}";
        } finally {
            graphLock.unlock();
        }
    }

    /**
     * Depth-first search from every lock holder, with an explicit stack so long wait chains can't overflow the
     * call stack. A thread is "visited" once we've started exploring it and "on path" while it's on the stack;
     * reaching an on-path thread again means we went around a cycle.
     *
     * NOTE: Must hold graphLock
     * @return the links making up the cycle, or null if there is none
     */
    private List<DeadlockDescription.Link> findCycle() {
        Set<Thread> visited = new HashSet<>();
        Set<Thread> onPath = new HashSet<>();
        Deque<Frame> path = new ArrayDeque<>();

        for(Thread root : threadHolds.keySet()) {
            if(!visited.add(root)) {
                continue;
            }
            onPath.add(root);
            path.push(new Frame(root, edgesFrom(root)));

            while(!path.isEmpty()) {
                Frame top = path.peek();
                if(!top.edges.hasNext()) {
                    // Explored everything reachable from here without coming back around
                    onPath.remove(top.thread);
                    path.pop();
                    continue;
                }

                DeadlockDescription.Link edge = top.edges.next();
                top.via = edge;

                if(onPath.contains(edge.holder())) {
                    return describeCycle(path, edge.holder());
                }

                if(visited.add(edge.holder())) {
                    onPath.add(edge.holder());
                    path.push(new Frame(edge.holder(), edgesFrom(edge.holder())));
                }
            }
        }

        return null;
    }

    /**
     * Every wait-for edge out of {@code waiter}: one per (lock it waits for, thread holding that lock).
     * NOTE: Must hold graphLock
     */
    private Iterator<DeadlockDescription.Link> edgesFrom(Thread waiter) {
        Set<Lock> waitingFor = threadWaits.get(waiter);
        if(waitingFor == null) {
            return Collections.emptyIterator();
        }

        List<DeadlockDescription.Link> edges = new ArrayList<>();
        for(Lock lock : waitingFor) {
            for(Map.Entry<Thread, Set<Lock>> holds : threadHolds.entrySet()) {
                if(holds.getValue().contains(lock)) {
                    edges.add(new DeadlockDescription.Link(waiter, lock, holds.getKey()));
                }
            }
        }
        return edges.iterator();
    }

    /**
     * The cycle is the part of the current path from {@code start} to the top, following the edge each frame
     * took; the top frame's edge is the one that closed the loop back to {@code start}.
     */
    private static List<DeadlockDescription.Link> describeCycle(Deque<Frame> path, Thread start) {
        List<DeadlockDescription.Link> cycle = new ArrayList<>();
        boolean inCycle = false;
        for(Iterator<Frame> frames = path.descendingIterator(); frames.hasNext(); ) {
            Frame frame = frames.next();
            if(frame.thread == start) {
                inCycle = true;
            }
            if(inCycle) {
                cycle.add(frame.via);
            }
        }
        return cycle;
    }

    private static void add(Map<Thread, Set<Lock>> locksByThread, Thread thread, Lock lock) {
        Set<Lock> locks = locksByThread.get(thread);
        if(locks == null) {
            locks = Collections.newSetFromMap(new IdentityHashMap<>());
            locksByThread.put(thread, locks);
        }
        locks.add(lock);
    }

    private static void remove(Map<Thread, Set<Lock>> locksByThread, Thread thread, Lock lock) {
        Set<Lock> locks = locksByThread.get(thread);
        if(locks == null) {
            return;
        }
        locks.remove(lock);

        // Never keep empty records around; detection should only see threads that actually hold or wait
        if(locks.isEmpty()) {
            locksByThread.remove(thread);
        }
    }

    private static Set<Lock> snapshot(Set<Lock> locks) {
        if(locks == null) {
            return Collections.emptySet();
        }
        Set<Lock> copy = Collections.newSetFromMap(new IdentityHashMap<>());
        copy.addAll(locks);
        return Collections.unmodifiableSet(copy);
    }

    /** A thread on the current search path, the edges left to try from it, and the edge it last followed. */
    private static class Frame {
        final Thread thread;
        final Iterator<DeadlockDescription.Link> edges;
        DeadlockDescription.Link via;

        Frame(Thread thread, Iterator<DeadlockDescription.Link> edges) {
            this.thread = thread;
            this.edges = edges;
        }
    }
}
