package com.kickoff.tipping.service;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/** Single-flight gate shared by the full sync and the catch-up pass; both write the same fixture rows. */
@Component
public class SyncRunGuard {

    private final ReentrantLock lock = new ReentrantLock();
    private volatile String currentRun;

    /** Runs {@code work} unless another run holds the gate, in which case nothing runs and the result is empty. */
    public <T> Optional<T> tryRun(String name, Supplier<T> work) {
        if (!lock.tryLock()) return Optional.empty();
        try {
            currentRun = name;
            return Optional.ofNullable(work.get());
        } finally {
            currentRun = null;
            lock.unlock();
        }
    }

    public boolean isBusy() {
        return lock.isLocked();
    }

    public String getCurrentRun() {
        return currentRun;
    }
}
