package com.jakewins.deadlock;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static com.jakewins.deadlock.TrackedMutex_Test.run;

/**
 * Many threads taking random sets of locks, always in ascending id order, while a detector polls as fast as it
 * can. Ascending order can't deadlock, so anything the detector reports is a false positive.
 */
public class ResourceGraph_StressTest {
    private static final int THREADS = 8;
    private static final int RESOURCES = 16;
    private static final long DURATION_MS = 2_000;

    @Test(timeout = 60_000)
    public void testOrderedLockingNeverReportsDeadlock() throws InterruptedException {
        ResourceGraph graph = new ResourceGraph();
        List<Resource> resources = new ArrayList<>();
        for(int i = 0; i < RESOURCES; i++) {
            resources.add(new Resource(i));
        }

        AtomicBoolean stop = new AtomicBoolean();
        AtomicLong rounds = new AtomicLong();
        AtomicReference<DeadlockDescription> falsePositive = new AtomicReference<>(DeadlockDescription.NONE);

        List<Thread> workers = new ArrayList<>();
        for(int t = 0; t < THREADS; t++) {
            long seed = t;
            workers.add(run("worker-" + t, () -> {
                Random random = new Random(seed);
                while(!stop.get()) {
                    lockRandomSubsetInOrder(graph, resources, random);
                    rounds.incrementAndGet();
                }
            }));
        }

        Thread detector = run("detector", () -> {
            while(!stop.get()) {
                DeadlockDescription deadlock = graph.detectDeadlock();
                if(deadlock != DeadlockDescription.NONE) {
                    falsePositive.compareAndSet(DeadlockDescription.NONE, deadlock);
                }
            }
        });

        TimeUnit.MILLISECONDS.sleep(DURATION_MS);
        stop.set(true);
        for(Thread worker : workers) {
            worker.join();
        }
        detector.join();

        assert falsePositive.get() == DeadlockDescription.NONE : String.format("False positive: %s", falsePositive.get());
        assert rounds.get() > 0 : "Workers never got anything done";
        assert graph.trackedThreads().isEmpty() : String.format("Expected empty graph, found %s", graph);
    }

    private static void lockRandomSubsetInOrder(ResourceGraph graph, List<Resource> resources, Random random) {
        List<TrackedMutex> held = new ArrayList<>();
        try {
            for(Resource resource : resources) {
                if(random.nextInt(4) != 0) {
                    continue;
                }
                TrackedMutex mutex = new TrackedMutex(resource.getLock(), graph);
                held.add(mutex);
                if(random.nextBoolean()) {
                    mutex.lock();
                } else if(!mutex.tryLock()) {
                    // Skipping a lock keeps the order ascending
                    held.remove(held.size() - 1);
                }
            }
            Thread.yield();
        } finally {
            for(int i = held.size() - 1; i >= 0; i--) {
                held.get(i).close();
            }
        }
    }
}
