package com.ivirs.backend.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ReputationStoreTest {

    @Test
    void unknownVehicleStartsAtDefault() {
        ReputationStore store = new ReputationStore();

        assertEquals(0.5, store.peek("ghost"));
        assertEquals(0, store.size());
        assertEquals(0.5, store.get("ghost"));
        assertEquals(1, store.size());
    }

    @Test
    void scoresAreClampedToUnitRange() {
        ReputationStore store = new ReputationStore();

        store.penalize("liar");
        double afterTwo = store.penalize("liar");
        assertEquals(0.0, afterTwo);
        assertEquals(0.0, store.penalize("liar"));

        for (int i = 0; i < 10; i++) {
            store.reward("saint");
        }
        assertEquals(1.0, store.peek("saint"));
    }

    @Test
    void rewardAndPenaltyUseFixedSteps() {
        ReputationStore store = new ReputationStore();

        assertEquals(0.6, store.reward("a"), 1e-9);
        assertEquals(0.3, store.penalize("a"), 1e-9);
    }

    @Test
    void snapshotIsSortedById() {
        ReputationStore store = new ReputationStore();
        store.reward("veh_2");
        store.reward("veh_1");

        assertEquals(List.of("veh_1", "veh_2"), new ArrayList<>(store.snapshot().keySet()));
    }

    @Test
    void concurrentUpdatesOnOneKeyAreNotLost() throws Exception {
        ReputationStore store = new ReputationStore();
        int threads = 8;
        int updatesPerThread = 1000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < updatesPerThread; i++) {
                        store.adjust("shared", 0.00001);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0.5 + threads * updatesPerThread * 0.00001, store.peek("shared"), 1e-9);
    }
}
