package org.eagowl.fleetoptimizer.ledger;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.model.OptimizationRun;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationLedgerTest {

    private static OptimizationRun run(String id) {
        return new OptimizationRun(id, Instant.now(), 4, 1, 3, 0.75);
    }

    private static List<String> ids(List<OptimizationRun> runs) {
        return runs.stream().map(OptimizationRun::getId).toList();
    }

    @Test
    void emptyLedgerHasNothingToShow() {
        var ledger = new OptimizationLedger(10);

        assertEquals(0, ledger.count());
        assertTrue(ledger.recent(10).isEmpty());
    }

    @Test
    void recentReturnsLastEntriesOldestFirst() {
        var ledger = new OptimizationLedger(10);
        ledger.record(run("a"));
        ledger.record(run("b"));
        ledger.record(run("c"));

        assertEquals(List.of("b", "c"), ids(ledger.recent(2)));
        assertEquals(List.of("a", "b", "c"), ids(ledger.recent(50)));
        assertTrue(ledger.recent(0).isEmpty());
        assertEquals(3, ledger.count());
    }

    @Test
    void oldestRunsAreEvictedOnceFull() {
        var ledger = new OptimizationLedger(3);
        for (String id : List.of("a", "b", "c", "d", "e")) {
            ledger.record(run(id));
        }

        assertEquals(List.of("c", "d", "e"), ids(ledger.recent(10)));
        assertEquals(5, ledger.count());
    }

    @Test
    void returnedListIsASnapshot() {
        var ledger = new OptimizationLedger(5);
        ledger.record(run("a"));

        var snapshot = ledger.recent(5);
        ledger.record(run("b"));
        snapshot.clear();

        assertEquals(List.of("a", "b"), ids(ledger.recent(5)));
    }

    @Test
    void negativeLimitIsRejected() {
        var ledger = new OptimizationLedger(5);

        assertThrows(IllegalArgumentException.class, () -> ledger.recent(-1));
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new OptimizationLedger(0));
    }

    @Test
    void capacityIsReadFromConfiguration() {
        var config = new OptimizerConfiguration();
        config.setLedgerCapacity(7);

        assertEquals(7, new OptimizationLedger(config).capacity());
    }

    @Test
    void concurrentRecordsAreNotLost() throws Exception {
        var ledger = new OptimizationLedger(100);
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();

        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        ledger.record(run(thread + "-" + i));
                        ledger.recent(5);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, ledger.count());
        assertEquals(100, ledger.recent(1000).size());
    }
}
