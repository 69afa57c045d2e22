package in.fxarena.application.service.trigger;

import in.fxarena.application.port.output.TradeExecutionQueue;
import in.fxarena.application.service.price.PriceTickListener;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Event-driven stop-loss / take-profit trigger.
 *
 * Runs on the tick path: index lookup, pure evaluation, index removal and an
 * in-memory enqueue. No store I/O happens here; the settlement worker does
 * the actual close.
 */
public final class SlTpTriggerService implements PriceTickListener {
    private static final Logger log = LoggerFactory.getLogger(SlTpTriggerService.class);

    private final PositionTriggerIndex index;
    private final TradeExecutionQueue queue;
    private final Clock clock;
    private final EngineMetrics metrics;

    public SlTpTriggerService(PositionTriggerIndex index, TradeExecutionQueue queue, Clock clock,
                              EngineMetrics metrics) {
        this.index = index;
        this.queue = queue;
        this.clock = clock;
        this.metrics = metrics != null ? metrics : EngineMetrics.noop();
    }

    @Override
    public void onQuote(PriceQuote quote) {
        check(quote);
    }

    /**
     * Evaluate every indexed position on the quote's symbol.
     *
     * @return number of closes enqueued
     */
    public int check(PriceQuote quote) {
        int fired = 0;
        for (TrackedPosition position : index.forSymbol(quote.symbol())) {
            Optional<TriggerEvaluator.Trigger> trigger = TriggerEvaluator.evaluate(position, quote);
            if (trigger.isEmpty()) {
                continue;
            }
            // Only the caller that marks the position may enqueue
            if (!index.markClosing(position.positionId())) {
                continue;
            }
            TrackedPosition claimed = index.remove(position.positionId()).orElse(position);
            TriggerEvaluator.Trigger t = trigger.get();
            QueuedTrade close = QueuedTrade.close(claimed, t.exitPrice(), t.reason(), clock.instant());
            try {
                queue.enqueue(close);
            } catch (RuntimeException e) {
                // Put it back so the next tick or sweep can try again
                index.release(position.positionId());
                index.upsert(claimed);
                log.error("[SLTP] Failed to enqueue {} close for {}: {}",
                    t.reason(), position.positionId(), e.getMessage(), e);
                continue;
            }
            fired++;
            metrics.recordTrigger(t.reason().code());
            log.info("[SLTP] {} hit: position={} {} {} @ {} (SL={}, TP={})",
                t.reason(), position.positionId(), position.side(), position.symbol(), t.exitPrice(),
                position.stopLoss(), position.takeProfit());
        }
        return fired;
    }
}
