package org.eagowl.fleetoptimizer.ledger;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.model.OptimizationRun;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory log of completed optimization runs, keeping only the {@code capacity} most recent.
 * Appends and reads go through one lock; reads return copies.
 */
@Component
public class OptimizationLedger {

    private final int capacity;
    private final Deque<OptimizationRun> runs;
    private final Lock lock = new ReentrantLock();
    private long totalRecorded;

    @Autowired
    public OptimizationLedger(OptimizerConfiguration optimizerConfig) {
        this(optimizerConfig.getLedgerCapacity());
    }

    public OptimizationLedger(int capacity) {
        if (capacity < 1)
            throw new IllegalArgumentException(
                String.format("Ledger capacity must be positive but was %d", capacity));

        this.capacity = capacity;
        this.runs = new ArrayDeque<>(capacity);
    }

    public void record(OptimizationRun run) {
        lock.lock();
        try {
            if (runs.size() == capacity) {
                runs.removeFirst();
            }
            runs.addLast(run);
            totalRecorded++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The last {@code limit} runs still retained, oldest first.
     */
    public List<OptimizationRun> recent(int limit) {
        if (limit < 0)
            throw new IllegalArgumentException(
                String.format("Limit must not be negative but was %d", limit));

        lock.lock();
        try {
            var snapshot = new ArrayList<>(runs);
            return new ArrayList<>(snapshot.subList(Math.max(0, snapshot.size() - limit), snapshot.size()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of runs recorded since startup, including evicted ones.
     */
    public long count() {
        lock.lock();
        try {
            return totalRecorded;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
