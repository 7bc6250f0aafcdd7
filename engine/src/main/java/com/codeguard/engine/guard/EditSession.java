package com.codeguard.engine.guard;

import com.codeguard.engine.protect.ProtectedSymbolRegistry;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One conversation's editing state: its guard and the lock that serialises
 * its tool calls. Sessions never share a registry.
 */
public class EditSession {

    private final String        id;
    private final EditGuard     guard;
    private final ReentrantLock lock = new ReentrantLock();

    // recency order and System.nanoTime() of the last lookup
    private volatile long lastTick;
    private volatile long lastUsedNanos;

    public EditSession(String id, ProtectedSymbolRegistry registry) {
        this.id    = id;
        this.guard = new EditGuard(registry);
    }

    public String id()         { return id; }
    public EditGuard guard()   { return guard; }
    public ProtectedSymbolRegistry registry() { return guard.registry(); }

    void touch(long tick) {
        lastTick      = tick;
        lastUsedNanos = System.nanoTime();
    }

    long lastTick()      { return lastTick; }
    long lastUsedNanos() { return lastUsedNanos; }

    /** A call is running or waiting on this session. */
    boolean isBusy() {
        return lock.isLocked() || lock.hasQueuedThreads();
    }

    /** Run {@code work} while holding this session's lock. */
    public <T> T locked(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
