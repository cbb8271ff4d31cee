package com.jakewins.deadlock;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * What instrumenting a lock costs, and how long a detection pass holds the graph. Run via {@link #main}; these
 * are not part of the regular test run.
 */
@State(Scope.Thread)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
public class ResourceGraph_PerfTest {

    @State(Scope.Benchmark)
    public static class SharedState {
        private ResourceGraph graph;
        private ResourceGraph populatedGraph;

        @Param({"10", "100", "1000"})
        public int populatedThreads;

        @Setup
        public void setup() {
            this.graph = new ResourceGraph();

            // A long open wait chain: every thread waits on the next one's lock, nobody closes the loop
            this.populatedGraph = new ResourceGraph();
            List<Thread> threads = new ArrayList<>();
            List<Lock> locks = new ArrayList<>();
            for(int i = 0; i < populatedThreads; i++) {
                threads.add(new Thread(() -> {}, "T" + i));
                locks.add(new ReentrantLock());
                populatedGraph.acquireLock(threads.get(i), locks.get(i));
            }
            for(int i = 0; i < populatedThreads - 1; i++) {
                populatedGraph.waitForLock(threads.get(i), locks.get(i + 1));
            }
        }
    }

    private Lock lock;
    private TrackedMutex trackedMutex;
    private HierarchicalMutex hierarchicalMutex;
    private SharedState shared;

    @Setup
    public void setup(SharedState shared) {
        this.shared = shared;
        this.lock = new ReentrantLock();
        this.trackedMutex = new TrackedMutex(lock, shared.graph);
        this.hierarchicalMutex = new HierarchicalMutex(1000);
    }

    @Benchmark
    public void rawLockUnlock() {
        lock.lock();
        lock.unlock();
    }

    @Benchmark
    public void trackedLockUnlock() {
        trackedMutex.lock();
        trackedMutex.unlock();
    }

    @Benchmark
    public void hierarchicalLockUnlock() {
        hierarchicalMutex.lock();
        hierarchicalMutex.unlock();
    }

    @Benchmark
    public boolean detectOnOpenChain() {
        return shared.populatedGraph.hasDeadlock();
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(ResourceGraph_PerfTest.class.getSimpleName())
                .warmupIterations(1)
                .measurementIterations(5)
                .threads(Runtime.getRuntime().availableProcessors())
                .forks(1)
                .syncIterations(true)
                .build();

        new Runner(opt).run();
    }
}
