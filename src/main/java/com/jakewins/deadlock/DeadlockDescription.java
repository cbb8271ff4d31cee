package com.jakewins.deadlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * A cycle found in a {@link ResourceGraph}, as the chain of wait-for links that make it up. The holder of each
 * link is the waiter of the next one, and the holder of the last link is the waiter of the first.
 * <p>
 * This is a snapshot; the threads involved may well have moved on by the time anyone looks at it.
 */
public class DeadlockDescription {
    /** Returned by {@link ResourceGraph#detectDeadlock()} when there is no cycle. */
    public static final DeadlockDescription NONE = new DeadlockDescription() {
        @Override
        public String toString() {
            return "No Deadlock";
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public boolean equals(Object obj) {
            return obj == this;
        }
    };

    /** One edge of the wait-for graph: {@code waiter} is blocked on {@code lock}, which {@code holder} has. */
    public static final class Link {
        private final Thread waiter;
        private final Lock lock;
        private final Thread holder;

        Link(Thread waiter, Lock lock, Thread holder) {
            this.waiter = waiter;
            this.lock = lock;
            this.holder = holder;
        }

        public Thread waiter() {
            return waiter;
        }

        public Lock lock() {
            return lock;
        }

        public Thread holder() {
            return holder;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;

            Link that = (Link) o;

            return waiter == that.waiter && lock == that.lock && holder == that.holder;
        }

        @Override
        public int hashCode() {
            int result = System.identityHashCode(waiter);
            result = 31 * result + System.identityHashCode(lock);
            result = 31 * result + System.identityHashCode(holder);
            return result;
        }

        @Override
        public String toString() {
            return String.format("(%s)-[:WAITS_FOR]->(%s)-[:HELD_BY]->(%s)", waiter.getName(), lock, holder.getName());
        }
    }

    private final List<Link> chain;

    private DeadlockDescription() {
        this.chain = Collections.emptyList();
    }

    /**
     * @param chain the cycle, starting anywhere on it; each link's holder must be the next link's waiter
     */
    DeadlockDescription(List<Link> chain) {
        assert assertIsValidDeadlockChain(chain);
        this.chain = Collections.unmodifiableList(new ArrayList<>(chain));
    }

    public List<Link> links() {
        return chain;
    }

    /** The threads on the cycle, in wait order; the first thread waits for the second and so on. */
    public List<Thread> threads() {
        List<Thread> threads = new ArrayList<>(chain.size());
        for(Link link : chain) {
            threads.add(link.waiter);
        }
        return threads;
    }

    /** The locks on the cycle; the n-th lock is the one the n-th thread of {@link #threads()} waits for. */
    public List<Lock> locks() {
        List<Lock> locks = new ArrayList<>(chain.size());
        for(Link link : chain) {
            locks.add(link.lock);
        }
        return locks;
    }

    /**
     * Two descriptions are equal if they describe the same cycle, wherever each of them starts on it. A cycle
     * visits each thread once, so its links are distinct and comparing them as sets is enough.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        DeadlockDescription that = (DeadlockDescription) o;

        return chain.size() == that.chain.size() && new HashSet<>(chain).equals(new HashSet<>(that.chain));
    }

    @Override
    public int hashCode() {
        int result = 0;
        for(Link link : chain) {
            result += link.hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Deadlock[");
        for(Link link : chain) {
            sb.append(String.format("(%s)-[:WAITS_FOR]->(%s)-[:HELD_BY]->", link.waiter.getName(), link.lock));
        }
        sb.append(String.format("(%s)", chain.get(chain.size() - 1).holder.getName()));
        return sb.append("]").toString();
    }

    private static boolean assertIsValidDeadlockChain(List<Link> chain) {
        assert chain.size() > 0 : "Invalid deadlock chain: chain must be greater than zero";

        for(int linkIndex=0;linkIndex<chain.size();linkIndex++) {
            Link link = chain.get(linkIndex);
            Link next = chain.get((linkIndex + 1) % chain.size());

            // Whoever holds what we wait for must be the one waiting in the next link, all the way around
            assert link.holder == next.waiter : String.format("Invalid deadlock chain: %s\n" +
                    "%s is held by %s, but the next link is waited on by %s.", chain, link.lock, link.holder, next.waiter);
        }

        return true;
    }
}
