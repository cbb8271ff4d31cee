package com.jakewins.deadlock;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/** Something threads compete for; one exclusive lock with an id, so it reads well in deadlock descriptions. */
public class Resource {
    private final int id;
    private final Lock lock;

    public Resource(int id) {
        this.id = id;
        this.lock = new ReentrantLock() {
            @Override
            public String toString() {
                return Resource.this.toString();
            }
        };
    }

    public Lock getLock() {
        return lock;
    }

    public int getId() {
        return id;
    }

    @Override
    public String toString() {
        return "Resource(" + id + ")";
    }
}
