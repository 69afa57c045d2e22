package in.fxarena.application.service.execution;

import in.fxarena.application.port.output.ClosureSink;
import in.fxarena.application.port.output.PositionStore;
import in.fxarena.application.service.trigger.PositionTriggerIndex;
import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.position.Side;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.domain.trade.StoreResult;
import in.fxarena.domain.trade.TradeAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradeSettlerTest {

    private static final Instant TS = Instant.parse("2024-06-10T12:00:00Z");

    @Mock
    private PositionStore positionStore;
    @Mock
    private ClosureSink closureSink;

    private PositionTriggerIndex index;
    private TradeSettler settler;

    @BeforeEach
    void setUp() {
        index = new PositionTriggerIndex();
        settler = new TradeSettler(positionStore, index, closureSink, Runnable::run, null);
    }

    @Test
    void appliedClose_dropsIndexEntryAndNotifies() {
        TrackedPosition p = position("p1", new BigDecimal("1.08"), null);
        index.upsert(p);
        when(positionStore.closePosition("p1", new BigDecimal("1.07990"), CloseReason.STOP_LOSS))
            .thenReturn(StoreResult.closed(new BigDecimal("-510.00")));

        TradeSettler.Outcome outcome = settler.settle(
            QueuedTrade.close(p, new BigDecimal("1.07990"), CloseReason.STOP_LOSS, TS));

        assertEquals(TradeSettler.Outcome.COMPLETED, outcome);
        assertFalse(index.contains("p1"));
        verify(closureSink).recordClosure("p1", new BigDecimal("-510.00"), CloseReason.STOP_LOSS);
    }

    @Test
    void alreadyClosed_isTreatedAsDone() {
        TrackedPosition p = position("p1", new BigDecimal("1.08"), null);
        when(positionStore.closePosition(eq("p1"), any(), any())).thenReturn(StoreResult.alreadyClosed());

        TradeSettler.Outcome outcome = settler.settle(
            QueuedTrade.close(p, new BigDecimal("1.07990"), CloseReason.STOP_LOSS, TS));

        assertEquals(TradeSettler.Outcome.COMPLETED, outcome);
        verifyNoInteractions(closureSink);
    }

    @Test
    void storeRejection_completesWithoutRetry() {
        TrackedPosition p = position("p1", new BigDecimal("1.08"), null);
        index.markClosing("p1");
        when(positionStore.closePosition(eq("p1"), any(), any())).thenReturn(StoreResult.rejected("not found"));

        assertEquals(TradeSettler.Outcome.COMPLETED, settler.settle(
            QueuedTrade.close(p, new BigDecimal("1.07990"), CloseReason.MARGIN_CALL, TS)));
        assertFalse(index.isClosing("p1"));
    }

    @Test
    void storeFailure_asksForRetry() {
        TrackedPosition p = position("p1", new BigDecimal("1.08"), null);
        index.markClosing("p1");
        when(positionStore.closePosition(eq("p1"), any(), any())).thenThrow(new RuntimeException("db down"));

        assertEquals(TradeSettler.Outcome.RETRY, settler.settle(
            QueuedTrade.close(p, new BigDecimal("1.07990"), CloseReason.STOP_LOSS, TS)));
        assertTrue(index.isClosing("p1"));
    }

    @Test
    void settledClose_releasesClosingMark() {
        TrackedPosition p = position("p1", new BigDecimal("1.08"), null);
        index.markClosing("p1");
        when(positionStore.closePosition(eq("p1"), any(), any()))
            .thenReturn(StoreResult.closed(new BigDecimal("-510.00")));

        settler.settle(QueuedTrade.close(p, new BigDecimal("1.07990"), CloseReason.STOP_LOSS, TS));

        assertFalse(index.isClosing("p1"));
    }

    @Test
    void abandonedClose_releasesClosingMarkSoThePositionCanBeReindexed() {
        TrackedPosition p = position("p1", new BigDecimal("1.08"), null);
        index.markClosing("p1");

        settler.abandon(QueuedTrade.close(p, new BigDecimal("1.07990"), CloseReason.STOP_LOSS, TS));
        index.upsert(p);

        assertFalse(index.isClosing("p1"));
        assertTrue(index.contains("p1"));
        verifyNoInteractions(positionStore);
    }

    @Test
    void malformedClose_isDiscarded() {
        QueuedTrade broken = QueuedTrade.of("u1", "p1", TradeAction.CLOSE,
            Map.of(QueuedTrade.PAYLOAD_REASON, "stop_loss"), TS);

        index.markClosing("p1");

        assertEquals(TradeSettler.Outcome.COMPLETED, settler.settle(broken));
        verify(positionStore, never()).closePosition(any(), any(), any());
        assertFalse(index.isClosing("p1"));
    }

    @Test
    void sinkFailure_doesNotFailTheClose() {
        TrackedPosition p = position("p1", new BigDecimal("1.08"), null);
        when(positionStore.closePosition(eq("p1"), any(), any()))
            .thenReturn(StoreResult.closed(new BigDecimal("12.00")));
        doThrow(new IllegalStateException("sink down")).when(closureSink).recordClosure(any(), any(), any());

        assertEquals(TradeSettler.Outcome.COMPLETED, settler.settle(
            QueuedTrade.close(p, new BigDecimal("1.09"), CloseReason.TAKE_PROFIT, TS)));
    }

    @Test
    void appliedOpen_indexesPositionWithExitLevels() {
        TrackedPosition opened = position("p2", new BigDecimal("1.08"), new BigDecimal("1.12"));
        QueuedTrade open = QueuedTrade.of("u1", "p2", TradeAction.OPEN, Map.of(
            QueuedTrade.PAYLOAD_SYMBOL, "EUR/USD", QueuedTrade.PAYLOAD_SIDE, "long"), TS);
        when(positionStore.openPosition(open)).thenReturn(StoreResult.applied(opened));

        assertEquals(TradeSettler.Outcome.COMPLETED, settler.settle(open));
        assertEquals(opened, index.get("p2").orElseThrow());
    }

    @Test
    void modifyClearingBothLevels_dropsIndexEntry() {
        index.upsert(position("p3", new BigDecimal("1.08"), null));
        QueuedTrade clear = QueuedTrade.of("u1", "p3", TradeAction.MODIFY, Map.of(), TS);
        when(positionStore.modifyPosition("p3", null, null))
            .thenReturn(StoreResult.applied(position("p3", null, null)));

        settler.settle(clear);

        assertFalse(index.contains("p3"));
    }

    @Test
    void modifyOfClosedPosition_dropsIndexEntry() {
        index.upsert(position("p4", new BigDecimal("1.08"), null));
        QueuedTrade modify = QueuedTrade.of("u1", "p4", TradeAction.MODIFY,
            Map.of(QueuedTrade.PAYLOAD_STOP_LOSS, "1.07"), TS);
        when(positionStore.modifyPosition("p4", new BigDecimal("1.07"), null)).thenReturn(StoreResult.alreadyClosed());

        assertEquals(TradeSettler.Outcome.COMPLETED, settler.settle(modify));
        assertFalse(index.contains("p4"));
    }

    private static TrackedPosition position(String id, BigDecimal stopLoss, BigDecimal takeProfit) {
        return new TrackedPosition(id, "EUR/USD", Side.LONG, new BigDecimal("1.10"), BigDecimal.ONE,
            stopLoss, takeProfit, "u1", "c1");
    }
}
