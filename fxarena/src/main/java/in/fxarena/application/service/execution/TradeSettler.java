package in.fxarena.application.service.execution;

import in.fxarena.application.port.output.ClosureSink;
import in.fxarena.application.port.output.PositionStore;
import in.fxarena.application.service.trigger.PositionTriggerIndex;
import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.domain.trade.StoreResult;
import in.fxarena.domain.trade.TradeAction;
import in.fxarena.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Applies one queued trade to the position store.
 *
 * CLOSE  → closePosition; ALREADY_CLOSED counts as done
 * OPEN   → openPosition; the new position is indexed if it has exit levels
 * MODIFY → modifyPosition; the index entry is replaced or dropped
 *
 * Store rejections and malformed payloads complete the trade (retrying
 * cannot help). Any other failure asks for a retry.
 *
 * A CLOSE that leaves the queue, settled or abandoned, releases the
 * position's closing mark in the trigger index.
 */
public final class TradeSettler {
    private static final Logger log = LoggerFactory.getLogger(TradeSettler.class);

    public enum Outcome {
        COMPLETED,
        RETRY
    }

    private final PositionStore positionStore;
    private final PositionTriggerIndex index;
    private final ClosureSink closureSink;
    private final Executor notifier;
    private final EngineMetrics metrics;

    public TradeSettler(PositionStore positionStore, PositionTriggerIndex index, ClosureSink closureSink,
                        Executor notifier, EngineMetrics metrics) {
        this.positionStore = positionStore;
        this.index = index;
        this.closureSink = closureSink;
        this.notifier = notifier;
        this.metrics = metrics != null ? metrics : EngineMetrics.noop();
    }

    public Outcome settle(QueuedTrade trade) {
        long started = System.nanoTime();
        String outcome = "failed";
        try {
            StoreResult result = switch (trade.action()) {
                case CLOSE -> settleClose(trade);
                case OPEN -> settleOpen(trade);
                case MODIFY -> settleModify(trade);
            };
            outcome = result.outcome().name().toLowerCase(Locale.ROOT);
            if (result.outcome() == StoreResult.Outcome.REJECTED) {
                log.warn("[SETTLE] Store rejected {} {} for position {}: {}",
                    trade.action(), trade.id(), trade.positionId(), result.message());
            }
            releaseClosing(trade);
            return Outcome.COMPLETED;
        } catch (IllegalArgumentException e) {
            outcome = "malformed";
            log.error("[SETTLE] Malformed trade {} discarded: {} ({})", trade.id(), e.getMessage(), trade);
            releaseClosing(trade);
            return Outcome.COMPLETED;
        } catch (RuntimeException e) {
            log.warn("[SETTLE] {} {} for position {} failed (retries={}): {}",
                trade.action(), trade.id(), trade.positionId(), trade.retries(), e.getMessage());
            return Outcome.RETRY;
        } finally {
            metrics.recordSettlement(trade.action().name(), outcome, Duration.ofNanos(System.nanoTime() - started));
        }
    }

    /**
     * The queue gave up on a trade after its last retry.
     */
    public void abandon(QueuedTrade trade) {
        log.error("[SETTLE] Giving up on {} {} for position {}", trade.action(), trade.id(), trade.positionId());
        releaseClosing(trade);
    }

    private void releaseClosing(QueuedTrade trade) {
        if (trade.action() == TradeAction.CLOSE) {
            index.release(trade.positionId());
        }
    }

    private StoreResult settleClose(QueuedTrade trade) {
        BigDecimal exitPrice = trade.payloadDecimal(QueuedTrade.PAYLOAD_EXIT_PRICE)
            .orElseThrow(() -> new IllegalArgumentException("CLOSE without exitPrice"));
        CloseReason reason = CloseReason.fromCode(trade.payloadValue(QueuedTrade.PAYLOAD_REASON)
            .orElseThrow(() -> new IllegalArgumentException("CLOSE without reason")));

        StoreResult result = positionStore.closePosition(trade.positionId(), exitPrice, reason);
        switch (result.outcome()) {
            case APPLIED -> {
                index.remove(trade.positionId());
                log.info("[SETTLE] Closed {} ({}) @ {} pnl={}", trade.positionId(), reason.code(), exitPrice,
                    result.realizedPnl());
                notifyClosure(trade.positionId(), result.realizedPnl(), reason);
            }
            case ALREADY_CLOSED -> {
                index.remove(trade.positionId());
                log.info("[SETTLE] Position {} already closed, nothing to do", trade.positionId());
            }
            case REJECTED -> { }
        }
        return result;
    }

    private StoreResult settleOpen(QueuedTrade trade) {
        StoreResult result = positionStore.openPosition(trade);
        if (result.isApplied() && result.position() != null) {
            TrackedPosition opened = result.position();
            index.upsert(opened);
            log.info("[SETTLE] Opened {} {} {} x{} @ {}", opened.positionId(), opened.side(), opened.symbol(),
                opened.quantity(), opened.entryPrice());
        }
        return result;
    }

    private StoreResult settleModify(QueuedTrade trade) {
        BigDecimal stopLoss = trade.payloadDecimal(QueuedTrade.PAYLOAD_STOP_LOSS).orElse(null);
        BigDecimal takeProfit = trade.payloadDecimal(QueuedTrade.PAYLOAD_TAKE_PROFIT).orElse(null);

        StoreResult result = positionStore.modifyPosition(trade.positionId(), stopLoss, takeProfit);
        if (result.isApplied()) {
            if (result.position() != null) {
                index.upsert(result.position());
            } else {
                index.get(trade.positionId())
                    .ifPresent(p -> index.upsert(p.withExitLevels(stopLoss, takeProfit)));
            }
            log.info("[SETTLE] Modified {} SL={} TP={}", trade.positionId(), stopLoss, takeProfit);
        } else if (result.outcome() == StoreResult.Outcome.ALREADY_CLOSED) {
            index.remove(trade.positionId());
        }
        return result;
    }

    private void notifyClosure(String positionId, BigDecimal pnl, CloseReason reason) {
        try {
            notifier.execute(() -> {
                try {
                    closureSink.recordClosure(positionId, pnl, reason);
                } catch (RuntimeException e) {
                    log.warn("[SETTLE] Closure sink failed for {}: {}", positionId, e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("[SETTLE] Closure notification for {} not scheduled: {}", positionId, e.getMessage());
        }
    }
}
