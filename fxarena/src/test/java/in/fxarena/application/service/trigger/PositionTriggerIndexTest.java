package in.fxarena.application.service.trigger;

import in.fxarena.domain.position.Side;
import in.fxarena.domain.position.TrackedPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PositionTriggerIndexTest {

    private PositionTriggerIndex index;

    @BeforeEach
    void setUp() {
        index = new PositionTriggerIndex();
    }

    @Test
    void rebuild_skipsPositionsWithoutExitLevels() {
        index.rebuild(List.of(
            position("p1", "EUR/USD", "1.08"),
            position("p2", "EUR/USD", "1.07"),
            position("p3", "GBP/USD", "1.25"),
            position("p4", "USD/JPY", null)));

        assertEquals(3, index.size());
        assertEquals(2, index.symbolCount());
        assertEquals(2, index.forSymbol("EUR/USD").size());
        assertTrue(index.forSymbol("USD/JPY").isEmpty());
        assertEquals(new PositionTriggerIndex.IndexStats(3, 2, 2, 0), index.getStats());
    }

    @Test
    void rebuild_replacesPreviousContents() {
        index.rebuild(List.of(position("p1", "EUR/USD", "1.08")));
        index.rebuild(List.of(position("p9", "GBP/USD", "1.25")));

        assertFalse(index.contains("p1"));
        assertTrue(index.contains("p9"));
        assertEquals(java.util.Set.of("GBP/USD"), index.symbols());
    }

    @Test
    void upsert_movesPositionBetweenSymbolsAndDropsLevelless() {
        index.upsert(position("p1", "EUR/USD", "1.08"));
        index.upsert(position("p1", "GBP/USD", "1.25"));

        assertTrue(index.forSymbol("EUR/USD").isEmpty());
        assertEquals(1, index.forSymbol("GBP/USD").size());
        assertEquals(1, index.symbolCount());

        index.upsert(position("p1", "GBP/USD", null));
        assertFalse(index.contains("p1"));
        assertEquals(0, index.symbolCount());
    }

    @Test
    void remove_returnsPositionOnlyOnce() {
        index.upsert(position("p1", "EUR/USD", "1.08"));

        assertTrue(index.remove("p1").isPresent());
        assertTrue(index.remove("p1").isEmpty());
        assertTrue(index.get("p1").isEmpty());
        assertTrue(index.symbols().isEmpty());
    }

    @Test
    void concurrentClaimers_exactlyOneMarksClosing() throws Exception {
        index.upsert(position("p1", "EUR/USD", "1.08"));
        int racers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> claims = new ArrayList<>();
        try {
            for (int i = 0; i < racers; i++) {
                claims.add(pool.submit(() -> {
                    go.await();
                    return index.markClosing("p1");
                }));
            }
            go.countDown();
            int winners = 0;
            for (Future<Boolean> claim : claims) {
                if (claim.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void closingMark_survivesRebuildAndUpsertUntilReleased() {
        index.upsert(position("p1", "EUR/USD", "1.08"));
        assertTrue(index.markClosing("p1"));
        index.remove("p1");

        index.rebuild(List.of(position("p1", "EUR/USD", "1.08"), position("p2", "EUR/USD", "1.07")));
        index.upsert(position("p1", "EUR/USD", "1.05"));

        assertFalse(index.contains("p1"));
        assertTrue(index.contains("p2"));
        assertEquals(new PositionTriggerIndex.IndexStats(1, 1, 1, 1), index.getStats());

        index.release("p1");
        index.upsert(position("p1", "EUR/USD", "1.05"));

        assertFalse(index.isClosing("p1"));
        assertEquals(new BigDecimal("1.05"), index.get("p1").orElseThrow().stopLoss());
    }

    @Test
    void markAllClosing_dropsEntriesAndBlocksReindexing() {
        index.upsert(position("p1", "EUR/USD", "1.08"));

        index.markAllClosing(List.of("p1", "p7"));
        index.rebuild(List.of(position("p7", "GBP/USD", "1.25")));

        assertEquals(0, index.size());
        assertFalse(index.markClosing("p7"));
        assertEquals(java.util.Set.of("p1", "p7"), index.closingIds());
    }

    @Test
    void forSymbol_returnsSnapshot() {
        index.upsert(position("p1", "EUR/USD", "1.08"));
        List<TrackedPosition> snapshot = index.forSymbol("EUR/USD");

        index.remove("p1");

        assertEquals(1, snapshot.size());
    }

    private static TrackedPosition position(String id, String symbol, String stopLoss) {
        return new TrackedPosition(id, symbol, Side.LONG, new BigDecimal("1.10"), BigDecimal.ONE,
            stopLoss != null ? new BigDecimal(stopLoss) : null, null, "u1", "c1");
    }
}
