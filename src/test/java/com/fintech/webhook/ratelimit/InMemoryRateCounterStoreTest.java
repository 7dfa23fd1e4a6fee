package com.fintech.webhook.ratelimit;

import com.fintech.webhook.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRateCounterStoreTest {

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_000));

    @Test
    void increment_isPerCallerAndWindow() {
        InMemoryRateCounterStore store = new InMemoryRateCounterStore(clock, 1000);

        assertEquals(1, store.increment("a", 960, 1020, 120));
        assertEquals(2, store.increment("a", 960, 1020, 120));
        assertEquals(1, store.increment("b", 960, 1020, 120));
        assertEquals(1, store.increment("a", 1020, 1080, 120));
        assertFalse(store.isShared());
    }

    @Test
    void sweepExpired_dropsClosedWindows() {
        InMemoryRateCounterStore store = new InMemoryRateCounterStore(clock, 1000);
        store.increment("a", 960, 1020, 120);
        store.increment("b", 1020, 1080, 120);

        clock.advance(Duration.ofSeconds(30));

        assertEquals(1, store.sweepExpired());
        assertEquals(1, store.size());
    }

    @Test
    void increment_sweepsInlineAboveThreshold() {
        InMemoryRateCounterStore store = new InMemoryRateCounterStore(clock, 2);
        store.increment("a", 900, 960, 120);
        store.increment("b", 900, 960, 120);
        store.increment("c", 900, 960, 120);

        store.increment("d", 960, 1020, 120);

        assertEquals(1, store.size());
    }

    @Test
    void increment_isAtomicUnderContention() throws Exception {
        InMemoryRateCounterStore store = new InMemoryRateCounterStore(clock, 1000);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Long>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                results.add(executor.submit(() -> store.increment("a", 960, 1020, 120)));
            }
            long max = 0;
            for (Future<Long> result : results) {
                max = Math.max(max, result.get());
            }
            assertEquals(200, max);
        } finally {
            executor.shutdownNow();
        }
    }
}
