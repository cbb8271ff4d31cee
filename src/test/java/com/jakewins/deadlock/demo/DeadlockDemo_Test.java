package com.jakewins.deadlock.demo;

import com.jakewins.deadlock.DeadlockDescription;
import com.jakewins.deadlock.HierarchicalMutex;
import com.jakewins.deadlock.Resource;
import com.jakewins.deadlock.ResourceGraph;
import com.jakewins.deadlock.TrackedMutex;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class DeadlockDemo_Test {
    @Test(timeout = 30_000)
    public void testDeadlockIsDetectedAndBroken() throws InterruptedException {
        ResourceGraph graph = new ResourceGraph();

        DeadlockDescription deadlock = DeadlockDemo.simulateDeadlock(graph, 20, TimeUnit.MILLISECONDS);

        List<String> names = new ArrayList<>();
        for(Thread thread : deadlock.threads()) {
            names.add(thread.getName());
        }
        assert names.size() == 2 && names.contains("T1") && names.contains("T2") : String.format("Found %s", deadlock);
        assert !graph.hasDeadlock();
        assert graph.trackedThreads().isEmpty() : String.format("Expected empty graph, found %s", graph);
    }

    @Test(timeout = 30_000)
    public void testTakingAllLocksAtOnceNeverDeadlocks() throws InterruptedException {
        ResourceGraph graph = new ResourceGraph();

        int completed = DeadlockDemo.demonstrateLockAll(graph, 500);

        assert completed == 1000 : String.format("Expected every round to finish, %d did", completed);
        assert graph.trackedThreads().isEmpty() : String.format("Expected empty graph, found %s", graph);
    }

    @Test(timeout = 10_000)
    public void testLockAllBacksOffWhenOneIsTaken() throws InterruptedException {
        ResourceGraph graph = new ResourceGraph();
        Resource first = new Resource(1);
        Resource second = new Resource(2);
        CountDownLatch secondHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> {
            try(TrackedMutex mutex = new TrackedMutex(second.getLock(), graph)) {
                mutex.lock();
                secondHeld.countDown();
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "holder");
        holder.start();
        secondHeld.await();

        TrackedMutex firstMutex = new TrackedMutex(first.getLock(), graph);
        TrackedMutex secondMutex = new TrackedMutex(second.getLock(), graph);
        Thread taker = new Thread(() -> DeadlockDemo.lockAll(Arrays.asList(firstMutex, secondMutex)), "taker");
        taker.start();

        // While the second is taken, the taker keeps letting go of the first
        while(!first.getLock().tryLock()) {
            Thread.yield();
        }
        first.getLock().unlock();
        assert taker.isAlive() : "Taker finished while resource 2 was taken";
        assert !graph.hasDeadlock();

        release.countDown();
        holder.join();
        taker.join();

        assert graph.locksHeldBy(taker).size() == 2 : String.format("Expected taker to hold both, found %s", graph);
    }

    @Test
    public void testPreventionLeavesThreadFree() {
        DeadlockDemo.demonstratePrevention();

        // Any level is fine again once the demo has released everything
        HierarchicalMutex highest = new HierarchicalMutex(Long.MAX_VALUE - 1);
        assert highest.tryLock();
        highest.unlock();
    }
}
