package in.fxarena.application.service.reconciliation;

import in.fxarena.application.port.output.ClosureSink;
import in.fxarena.application.port.output.PositionStore;
import in.fxarena.application.port.output.RiskSettingsStore;
import in.fxarena.application.service.price.QuoteNormalizer;
import in.fxarena.application.service.price.TieredPriceCache;
import in.fxarena.application.service.trigger.PositionTriggerIndex;
import in.fxarena.application.service.trigger.SlTpTriggerService;
import in.fxarena.domain.position.AccountBook;
import in.fxarena.domain.position.BookPosition;
import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.position.Side;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;
import in.fxarena.domain.risk.MarginStatus;
import in.fxarena.domain.risk.RiskThresholds;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.domain.trade.TradeAction;
import in.fxarena.infrastructure.queue.InMemoryTradeExecutionQueue;
import in.fxarena.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationSweepTest {

    @Mock
    private PositionStore positionStore;
    @Mock
    private RiskSettingsStore riskSettings;
    @Mock
    private ClosureSink closureSink;

    private MutableClock clock;
    private PositionTriggerIndex index;
    private TieredPriceCache cache;
    private InMemoryTradeExecutionQueue queue;
    private SlTpTriggerService triggers;
    private ReconciliationSweep sweep;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-10T12:00:00Z");
        index = new PositionTriggerIndex();
        cache = new TieredPriceCache(TieredPriceCache.Settings.defaults(), clock, null, null, Runnable::run, null);
        queue = new InMemoryTradeExecutionQueue();
        triggers = new SlTpTriggerService(index, queue, clock, null);
        sweep = new ReconciliationSweep(positionStore, riskSettings, index, triggers, cache, queue,
            closureSink, null, clock, Duration.ofSeconds(30));
    }

    @Test
    void reloadedIndex_isRecheckedAgainstCachedPrices() {
        TrackedPosition p1 = new TrackedPosition("p1", "EUR/USD", Side.LONG, bd("1.10"), bd("1"),
            bd("1.08"), null, "u1", "c1");
        TrackedPosition p2 = new TrackedPosition("p2", "GBP/USD", Side.SHORT, bd("1.27"), bd("1"),
            bd("1.30"), null, "u2", "c1");
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of(p1, p2));
        when(positionStore.listOpenBooks()).thenReturn(List.of());
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());
        cache.put(quote("EUR/USD", "1.07990", "1.08005"));
        cache.put(quote("GBP/USD", "1.27000", "1.27020"));

        SweepReport report = sweep.sweep();

        assertEquals(1, report.triggersFired());
        assertEquals(1, report.indexedPositions());
        assertTrue(index.contains("p2"));
        QueuedTrade close = queue.pendingSnapshot().get(0);
        assertEquals("p1", close.positionId());
        assertEquals("stop_loss", close.payload().get(QueuedTrade.PAYLOAD_REASON));
        assertFalse(report.hasErrors());
        assertSame(report, sweep.lastReport().orElseThrow());
    }

    @Test
    void positionClosedByTick_isNotClosedAgainBySweepBeforeSettlement() {
        TrackedPosition p1 = new TrackedPosition("p1", "EUR/USD", Side.LONG, bd("1.10"), bd("1"),
            bd("1.08"), null, "u1", "c1");
        index.upsert(p1);
        PriceQuote hit = quote("EUR/USD", "1.07990", "1.08005");
        cache.put(hit);
        assertEquals(1, triggers.check(hit));

        // The store still lists p1 until the worker settles the close
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of(p1));
        when(positionStore.listOpenBooks()).thenReturn(List.of());
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());

        SweepReport report = sweep.sweep();

        assertEquals(0, report.triggersFired());
        assertEquals(0, report.indexedPositions());
        assertFalse(index.contains("p1"));
        assertTrue(index.isClosing("p1"));
        assertEquals(1, queue.pendingSnapshot().size());
    }

    @Test
    void releasedPosition_isIndexedAgainOnNextSweep() {
        TrackedPosition p1 = new TrackedPosition("p1", "EUR/USD", Side.LONG, bd("1.10"), bd("1"),
            bd("1.00"), null, "u1", "c1");
        assertTrue(index.markClosing("p1"));
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of(p1));
        when(positionStore.listOpenBooks()).thenReturn(List.of());
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());

        sweep.sweep();
        assertFalse(index.contains("p1"));

        index.release("p1");
        SweepReport report = sweep.sweep();

        assertTrue(index.contains("p1"));
        assertEquals(1, report.indexedPositions());
    }

    @Test
    void failedReload_keepsPreviousIndex() {
        index.upsert(new TrackedPosition("p9", "EUR/USD", Side.LONG, bd("1.10"), bd("1"),
            bd("1.00"), null, "u1", "c1"));
        when(positionStore.listOpenPositionsWithSlTp()).thenThrow(new IllegalStateException("db down"));
        when(positionStore.listOpenBooks()).thenReturn(List.of());
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());

        SweepReport report = sweep.sweep();

        assertTrue(index.contains("p9"));
        assertEquals(List.of("index reload: db down"), report.errors());
    }

    @Test
    void staleQuotes_neverFireTriggers() {
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of(new TrackedPosition("p1", "EUR/USD",
            Side.LONG, bd("1.10"), bd("1"), bd("1.08"), null, "u1", "c1")));
        when(positionStore.listOpenBooks()).thenReturn(List.of());
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());
        cache.put(quote("EUR/USD", "1.07990", "1.08005"));
        clock.advance(Duration.ofMinutes(6));

        SweepReport report = sweep.sweep();

        assertEquals(0, report.triggersFired());
        assertTrue(queue.pendingSnapshot().isEmpty());
    }

    @Test
    void bookInLiquidation_enqueuesMarginCallCloses() {
        // equity 1000 - 690 = 310, used 1100, level 28.18
        AccountBook book = new AccountBook("u1", "c1", bd("1000"), null, liquidationBook());
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of());
        when(positionStore.listOpenBooks()).thenReturn(List.of(book));
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());
        putLiquidationPrices();

        SweepReport report = sweep.sweep();

        assertEquals(1, report.booksChecked());
        assertEquals(1, report.marginAlerts());
        assertEquals(1, report.liquidations());
        QueuedTrade close = queue.pendingSnapshot().get(0);
        assertEquals(TradeAction.CLOSE, close.action());
        assertEquals("p-eur", close.positionId());
        assertEquals(CloseReason.MARGIN_CALL.code(), close.payload().get(QueuedTrade.PAYLOAD_REASON));
        assertEquals("1.09500", close.payload().get(QueuedTrade.PAYLOAD_EXIT_PRICE));
        verify(closureSink).marginAlert(eq(book), argThat(s -> s.status() == MarginStatus.LIQUIDATION));
    }

    @Test
    void consecutiveLiquidationSweeps_queueEachCloseOnce() {
        AccountBook book = new AccountBook("u1", "c1", bd("1000"), null, liquidationBook());
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of());
        when(positionStore.listOpenBooks()).thenReturn(List.of(book));
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());
        putLiquidationPrices();

        SweepReport first = sweep.sweep();
        // p-eur still in the stored book; counted as closed at 1.09500:
        // capital 500, used 600, equity 500 - 190 = 310, level 51.67
        SweepReport second = sweep.sweep();

        assertEquals(1, first.liquidations());
        assertEquals(0, second.liquidations());
        assertEquals(1, second.marginAlerts());
        assertEquals(1, queue.pendingSnapshot().size());
        assertEquals("p-eur", queue.pendingSnapshot().get(0).positionId());
        assertTrue(index.isClosing("p-eur"));
        verify(closureSink).marginAlert(any(), argThat(s -> s.status() == MarginStatus.DANGER));
    }

    @Test
    void stalePrices_areLeftOutOfTheMarginCheck() {
        // Marked at fresh prices this book would be liquidated; without them equity is 1000 / 1100
        AccountBook book = new AccountBook("u1", "c1", bd("1000"), null, liquidationBook());
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of());
        when(positionStore.listOpenBooks()).thenReturn(List.of(book));
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());
        putLiquidationPrices();
        clock.advance(Duration.ofMinutes(6));

        SweepReport report = sweep.sweep();

        assertEquals(1, report.marginAlerts());
        assertEquals(0, report.liquidations());
        assertTrue(queue.pendingSnapshot().isEmpty());
        verify(closureSink).marginAlert(eq(book), argThat(s -> s.status() == MarginStatus.DANGER));
    }

    @Test
    void healthyBook_raisesNothing() {
        AccountBook book = new AccountBook("u1", "c1", bd("10000"), null, liquidationBook());
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of());
        when(positionStore.listOpenBooks()).thenReturn(List.of(book));
        when(riskSettings.getRiskThresholds()).thenReturn(RiskThresholds.defaults());
        putLiquidationPrices();

        SweepReport report = sweep.sweep();

        assertEquals(0, report.marginAlerts());
        verifyNoInteractions(closureSink);
    }

    @Test
    void unreadableRiskSettings_skipMarginSweep() {
        when(positionStore.listOpenPositionsWithSlTp()).thenReturn(List.of());
        when(positionStore.listOpenBooks()).thenReturn(List.of());
        when(riskSettings.getRiskThresholds()).thenThrow(new IllegalStateException("settings missing"));

        SweepReport report = sweep.sweep();

        assertEquals(0, report.booksChecked());
        assertEquals(List.of("margin sweep: settings missing"), report.errors());
        verify(closureSink, never()).marginAlert(any(), any());
    }

    private List<BookPosition> liquidationBook() {
        return List.of(
            bookPosition("p-eur", "EUR/USD", Side.LONG, "1.10000", "1", "500"),
            bookPosition("p-gbp", "GBP/USD", Side.LONG, "1.30000", "1", "500"),
            bookPosition("p-chf", "USD/CHF", Side.SHORT, "0.90000", "0.1", "100"));
    }

    private void putLiquidationPrices() {
        cache.put(quote("EUR/USD", "1.09500", "1.09510"));
        cache.put(quote("GBP/USD", "1.29800", "1.29815"));
        cache.put(quote("USD/CHF", "0.89890", "0.89900"));
    }

    private static BookPosition bookPosition(String id, String symbol, Side side, String entry, String qty,
                                             String margin) {
        TrackedPosition p = new TrackedPosition(id, symbol, side, bd(entry), bd(qty), null, null, "u1", "c1");
        return new BookPosition(p, bd(margin));
    }

    private PriceQuote quote(String symbol, String bid, String ask) {
        return QuoteNormalizer.normalize(symbol, bd(bid), bd(ask), clock.instant(), PriceSource.STREAM)
            .orElseThrow();
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
