package com.jakewins.deadlock.demo;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.jakewins.deadlock.DeadlockDescription;
import com.jakewins.deadlock.DeadlockMonitor;
import com.jakewins.deadlock.HierarchicalMutex;
import com.jakewins.deadlock.HierarchyViolationException;
import com.jakewins.deadlock.Resource;
import com.jakewins.deadlock.ResourceGraph;
import com.jakewins.deadlock.TrackedMutex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks through the toolkit: two threads deadlock on two resources and the monitor spots it, then the same two
 * threads avoid it by taking both resources at once, then hierarchical mutexes refuse the lock order that would
 * have caused it.
 * <p>
 * The toolkit never breaks a deadlock by itself; here the demo plays the application and interrupts one of the
 * threads it was told about.
 */
public class DeadlockDemo {

    private static final Logger log = LoggerFactory.getLogger(DeadlockDemo.class);

    private static final long HOLD_TIME_MS = 100;
    private static final long GIVE_UP_AFTER_MS = 10_000;

    public static void main(String[] args) throws InterruptedException {
        log.info("Simulating a deadlock between two threads");
        DeadlockDescription deadlock = simulateDeadlock(new ResourceGraph(), 100, TimeUnit.MILLISECONDS);
        log.info("Detected: {}", deadlock);

        log.info("Demonstrating deadlock avoidance by taking all locks or none");
        int rounds = demonstrateLockAll(new ResourceGraph(), 100);
        log.info("Completed {} rounds without deadlock", rounds);

        log.info("Demonstrating deadlock prevention with hierarchical mutexes");
        demonstratePrevention();
    }

    /**
     * Two threads take resources 1 and 2 in opposite order, each holding the first while reaching for the
     * second. Once the monitor reports the cycle, the last thread in it is interrupted so both can finish.
     *
     * @return the deadlock the monitor reported, or {@link DeadlockDescription#NONE} if it never saw one
     */
    public static DeadlockDescription simulateDeadlock(ResourceGraph graph, long pollInterval, TimeUnit unit)
            throws InterruptedException {
        Resource first = new Resource(1);
        Resource second = new Resource(2);
        CountDownLatch bothHoldOne = new CountDownLatch(2);
        CountDownLatch detected = new CountDownLatch(1);
        AtomicReference<DeadlockDescription> reported = new AtomicReference<>(DeadlockDescription.NONE);

        Thread t1 = new Thread(() -> lockBoth(graph, first, second, bothHoldOne), "T1");
        Thread t2 = new Thread(() -> lockBoth(graph, second, first, bothHoldOne), "T2");
        t1.setDaemon(true);
        t2.setDaemon(true);

        try(DeadlockMonitor monitor = new DeadlockMonitor(graph, pollInterval, unit, deadlock -> {
            reported.compareAndSet(DeadlockDescription.NONE, deadlock);
            detected.countDown();
        })) {
            t1.start();
            t2.start();
            monitor.start();

            if(!detected.await(GIVE_UP_AFTER_MS, TimeUnit.MILLISECONDS)) {
                log.warn("No deadlock reported within {}ms", GIVE_UP_AFTER_MS);
                t1.interrupt();
                t2.interrupt();
            } else {
                List<Thread> threads = reported.get().threads();
                Thread victim = threads.get(threads.size() - 1);
                log.info("Interrupting {} to break the deadlock", victim.getName());
                victim.interrupt();
            }

            t1.join();
            t2.join();
        }

        return reported.get();
    }

    /**
     * Two threads take resources 1 and 2 in opposite order, {@code rounds} times each, but through
     * {@link #lockAll(List)}: a thread that can't get everything lets go of what it has and tries again. Nobody
     * ever holds one resource while blocked on the other, so the graph never sees a cycle.
     *
     * @return how many rounds the two threads completed between them
     */
    public static int demonstrateLockAll(ResourceGraph graph, int rounds) throws InterruptedException {
        Resource first = new Resource(1);
        Resource second = new Resource(2);
        AtomicInteger completed = new AtomicInteger();

        Thread t1 = new Thread(() -> useBoth(graph, first, second, rounds, completed), "T1");
        Thread t2 = new Thread(() -> useBoth(graph, second, first, rounds, completed), "T2");
        t1.start();
        t2.start();
        t1.join();
        t2.join();

        if(graph.hasDeadlock()) {
            log.error("Deadlock recorded after taking all locks at once: {}", graph.detectDeadlock());
        }
        return completed.get();
    }

    /**
     * Lock every mutex, or none of them. Tries each in turn without blocking; if one is taken, releases the
     * ones already locked, in reverse order, and starts over.
     */
    public static void lockAll(List<TrackedMutex> mutexes) {
        for(;;) {
            int locked = 0;
            while(locked < mutexes.size() && mutexes.get(locked).tryLock()) {
                locked++;
            }
            if(locked == mutexes.size()) {
                return;
            }
            for(int i = locked - 1; i >= 0; i--) {
                mutexes.get(i).unlock();
            }
            Thread.yield();
        }
    }

    /** Locks 2000 then 1000, which is fine, then 1000 then 2000, which is refused. */
    public static void demonstratePrevention() {
        HierarchicalMutex high = new HierarchicalMutex(2000);
        HierarchicalMutex low = new HierarchicalMutex(1000);

        high.lock();
        try {
            log.info("Acquired high-level lock");
            low.lock();
            try {
                log.info("Acquired low-level lock");
            } finally {
                low.unlock();
            }
        } finally {
            high.unlock();
        }

        low.lock();
        try {
            high.lock();
            high.unlock();
            log.error("High-level lock was granted after a low-level one");
        } catch (HierarchyViolationException e) {
            log.info("Expected error: {}", e.getMessage());
        } finally {
            low.unlock();
        }
    }

    private static void useBoth(ResourceGraph graph, Resource a, Resource b, int rounds, AtomicInteger completed) {
        for(int round = 0; round < rounds; round++) {
            try(TrackedMutex aMutex = new TrackedMutex(a.getLock(), graph);
                TrackedMutex bMutex = new TrackedMutex(b.getLock(), graph)) {
                lockAll(Arrays.asList(aMutex, bMutex));
                completed.incrementAndGet();
            }
        }
        log.info("{} done using resources {} and {}", Thread.currentThread().getName(), a.getId(), b.getId());
    }

    private static void lockBoth(ResourceGraph graph, Resource outer, Resource inner, CountDownLatch bothHoldOne) {
        String name = Thread.currentThread().getName();
        try(TrackedMutex outerMutex = new TrackedMutex(outer.getLock(), graph);
            TrackedMutex innerMutex = new TrackedMutex(inner.getLock(), graph)) {
            outerMutex.lockInterruptibly();
            log.info("{} acquired resource {}", name, outer.getId());

            bothHoldOne.countDown();
            bothHoldOne.await();
            Thread.sleep(HOLD_TIME_MS);

            innerMutex.lockInterruptibly();
            log.info("{} acquired resource {}", name, inner.getId());
            log.info("{} using resources {} and {}", name, outer.getId(), inner.getId());
        } catch (InterruptedException e) {
            log.info("{} interrupted, giving up its locks", name);
            Thread.currentThread().interrupt();
        }
    }
}
