package io.trading.analytics.history;

import io.trading.analytics.model.AggregatedWindow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HistoryStoreTest {

    @Test
    void testCapacityAndFifoEviction() {
        HistoryStore store = new HistoryStore(3);
        for (int i = 0; i < 5; i++) {
            store.append(window("BTCUSDT", i, 10 + i));
        }

        assertEquals(3, store.size("BTCUSDT"));
        assertArrayEquals(new double[]{12, 13, 14}, store.recentPrices("BTCUSDT", 10));
        assertArrayEquals(new double[]{13, 14}, store.recentPrices("BTCUSDT", 2));

        HistorySnapshot snapshot = store.snapshot("BTCUSDT").orElseThrow();
        assertArrayEquals(new long[]{2, 3, 4}, snapshot.timestamps());
        assertEquals(2, snapshot.returns().length);
    }

    @Test
    void testReturns() {
        HistoryStore store = new HistoryStore();
        store.append(window("ETHUSDT", 1, 100));

        assertEquals(0, store.snapshot("ETHUSDT").orElseThrow().returns().length);

        store.append(window("ETHUSDT", 2, 110));
        double[] returns = store.snapshot("ETHUSDT").orElseThrow().returns();
        assertEquals(1, returns.length);
        assertEquals(0.1, returns[0], 1e-12);
    }

    @Test
    void testZeroPriorPriceSkipsReturn() {
        HistoryStore store = new HistoryStore();
        store.append(window("X", 1, 0.0));
        store.append(window("X", 2, 10.0));

        HistorySnapshot snapshot = store.snapshot("X").orElseThrow();
        assertEquals(2, snapshot.size());
        assertEquals(0, snapshot.returns().length);
    }

    @Test
    void testUnknownInstrument() {
        HistoryStore store = new HistoryStore();

        assertEquals(0, store.recentPrices("NOPE", 10).length);
        assertTrue(store.snapshot("NOPE").isEmpty());
        assertEquals(0, store.size("NOPE"));
    }

    @Test
    void testBatchSharesGeneration() {
        HistoryStore store = new HistoryStore();
        long first = store.appendAll(List.of(window("A", 1, 1), window("B", 1, 2)));
        long second = store.appendAll(List.of(window("A", 2, 3)));

        assertEquals(first, store.snapshot("B").orElseThrow().generation());
        assertEquals(second, store.snapshot("A").orElseThrow().generation());
        assertEquals(second, store.currentGeneration());
        assertTrue(second > first);
    }

    @Test
    void testInstrumentsInFirstSeenOrder() {
        HistoryStore store = new HistoryStore();
        store.append(window("ETHUSDT", 1, 1));
        store.append(window("BTCUSDT", 1, 1));
        store.append(window("ETHUSDT", 2, 1));

        assertEquals(List.of("ETHUSDT", "BTCUSDT"), store.instruments());
        List<HistorySnapshot> all = store.snapshotAll();
        assertEquals(2, all.size());
        assertEquals("ETHUSDT", all.get(0).instrumentId());
        assertEquals(2, all.get(0).size());
    }

    @Test
    void testSnapshotIsDetachedCopy() {
        HistoryStore store = new HistoryStore();
        store.append(window("X", 1, 100));
        HistorySnapshot before = store.snapshot("X").orElseThrow();

        store.append(window("X", 2, 200));

        assertEquals(1, before.size());
        assertEquals(100.0, before.lastPrice());
    }

    @Test
    void testSnapshotAllReadsOneGenerationDuringAppends() throws Exception {
        HistoryStore store = new HistoryStore(64);
        store.appendAll(List.of(window("A", 0, 1), window("B", 0, 1), window("C", 0, 1)));

        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger reads = new AtomicInteger();
        AtomicInteger torn = new AtomicInteger();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread reader = new Thread(() -> {
            try {
                while (!done.get()) {
                    List<HistorySnapshot> all = store.snapshotAll();
                    reads.incrementAndGet();
                    long generation = all.get(0).generation();
                    long lastTimestamp = all.get(0).timestamps()[all.get(0).size() - 1];
                    for (HistorySnapshot snapshot : all) {
                        long[] timestamps = snapshot.timestamps();
                        if (snapshot.generation() != generation
                            || timestamps[timestamps.length - 1] != lastTimestamp) {
                            torn.incrementAndGet();
                        }
                    }
                }
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "history-reader");
        reader.start();

        try {
            for (int i = 1; i <= 20_000; i++) {
                store.appendAll(List.of(window("A", i, i), window("B", i, i), window("C", i, i)));
            }
        } finally {
            done.set(true);
            reader.join(TimeUnit.SECONDS.toMillis(10));
        }

        assertNull(failure.get());
        assertTrue(reads.get() > 0);
        assertEquals(0, torn.get());
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryStore(1));
    }

    static AggregatedWindow window(String instrumentId, long timestamp, double price) {
        return new AggregatedWindow(timestamp, instrumentId, price, 0.0, price, price, 1.0, 1, price);
    }
}
