package in.fxarena.infrastructure.queue;

import in.fxarena.application.port.output.TradeExecutionQueue;
import in.fxarena.domain.trade.QueueStats;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.domain.trade.TradeAction;
import in.fxarena.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-local trade queue for single-instance deployments and tests.
 *
 * All transitions happen under one monitor, so a trade is never visible in
 * pending and processing at the same time.
 */
public final class InMemoryTradeExecutionQueue implements TradeExecutionQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTradeExecutionQueue.class);

    private final Deque<QueuedTrade> pending = new ArrayDeque<>();
    private final Map<String, QueuedTrade> processing = new LinkedHashMap<>();
    private final EngineMetrics metrics;

    public InMemoryTradeExecutionQueue() {
        this(EngineMetrics.noop());
    }

    public InMemoryTradeExecutionQueue(EngineMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void enqueue(QueuedTrade trade) {
        synchronized (this) {
            pending.addLast(trade.withRetries(0));
        }
        metrics.recordQueueEvent("enqueued");
        log.debug("[QUEUE] Enqueued {} {} for position {}", trade.action(), trade.id(), trade.positionId());
    }

    @Override
    public Optional<QueuedTrade> dequeue() {
        synchronized (this) {
            QueuedTrade next = pending.pollFirst();
            if (next == null) {
                return Optional.empty();
            }
            processing.put(next.id(), next);
            return Optional.of(next);
        }
    }

    @Override
    public void complete(QueuedTrade trade) {
        boolean removed;
        synchronized (this) {
            removed = processing.remove(trade.id()) != null;
        }
        if (removed) {
            metrics.recordQueueEvent("completed");
        } else {
            log.warn("[QUEUE] complete() for trade {} that is not processing", trade.id());
        }
    }

    @Override
    public boolean requeue(QueuedTrade trade) {
        synchronized (this) {
            processing.remove(trade.id());
            if (trade.retries() < MAX_RETRIES) {
                pending.addLast(trade.withRetries(trade.retries() + 1));
                metrics.recordQueueEvent("requeued");
                log.warn("[QUEUE] Requeued {} (retry {}/{})", trade.id(), trade.retries() + 1, MAX_RETRIES);
                return true;
            }
        }
        metrics.recordQueueEvent("dropped");
        log.error("[QUEUE] Dropping trade after {} retries: {}", trade.retries(), trade);
        return false;
    }

    @Override
    public synchronized QueueStats stats() {
        return new QueueStats(pending.size(), processing.size());
    }

    @Override
    public synchronized Set<String> positionsWithQueuedClose() {
        Set<String> ids = new HashSet<>();
        for (QueuedTrade trade : pending) {
            if (trade.action() == TradeAction.CLOSE) {
                ids.add(trade.positionId());
            }
        }
        for (QueuedTrade trade : processing.values()) {
            if (trade.action() == TradeAction.CLOSE) {
                ids.add(trade.positionId());
            }
        }
        return ids;
    }

    /**
     * Pending trades in FIFO order (for monitoring and tests).
     */
    public synchronized List<QueuedTrade> pendingSnapshot() {
        return List.copyOf(pending);
    }
}
