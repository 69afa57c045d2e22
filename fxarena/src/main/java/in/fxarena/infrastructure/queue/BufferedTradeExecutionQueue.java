package in.fxarena.infrastructure.queue;

import in.fxarena.application.port.output.TradeExecutionQueue;
import in.fxarena.domain.trade.QueueStats;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.domain.trade.TradeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * BufferedTradeExecutionQueue - keeps enqueue off the store.
 *
 * FEATURES:
 * - enqueue() only appends to an in-memory deque, so tick-path callers never
 *   wait on a connection or an INSERT
 * - A single flusher thread moves buffered trades to the delegate in FIFO
 *   order every flush interval
 * - A failed flush puts the trade back at the head and stops the pass; the
 *   next pass retries from the same trade
 * - stop() runs a final flush
 *
 * Everything else (dequeue, complete, requeue, lease release) goes straight
 * to the delegate. Buffered trades count as pending.
 */
public final class BufferedTradeExecutionQueue implements TradeExecutionQueue {
    private static final Logger log = LoggerFactory.getLogger(BufferedTradeExecutionQueue.class);

    private final TradeExecutionQueue delegate;
    private final BlockingDeque<QueuedTrade> buffer = new LinkedBlockingDeque<>();
    private final Object flushLock = new Object();
    private final long flushIntervalMs;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "trade-queue-flusher");
        t.setDaemon(true);
        return t;
    });

    public BufferedTradeExecutionQueue(TradeExecutionQueue delegate, long flushIntervalMs) {
        if (flushIntervalMs <= 0) {
            throw new IllegalArgumentException("flushIntervalMs must be positive");
        }
        this.delegate = delegate;
        this.flushIntervalMs = flushIntervalMs;
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::flushScheduled, flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
        log.info("[QUEUE] Buffered enqueue started with {}ms flush interval", flushIntervalMs);
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        flush();
        if (!buffer.isEmpty()) {
            log.error("[QUEUE] {} buffered trades could not be flushed on shutdown: {}", buffer.size(), buffer);
        }
    }

    @Override
    public void enqueue(QueuedTrade trade) {
        buffer.addLast(trade);
        log.debug("[QUEUE] Buffered {} {} for position {}", trade.action(), trade.id(), trade.positionId());
    }

    /**
     * Move buffered trades to the delegate, oldest first.
     *
     * @return number of trades handed over
     */
    public int flush() {
        synchronized (flushLock) {
            int flushed = 0;
            QueuedTrade next;
            while ((next = buffer.pollFirst()) != null) {
                try {
                    delegate.enqueue(next);
                } catch (RuntimeException e) {
                    buffer.addFirst(next);
                    log.warn("[QUEUE] Flush stopped at trade {} ({} still buffered): {}",
                        next.id(), buffer.size(), e.getMessage());
                    break;
                }
                flushed++;
            }
            return flushed;
        }
    }

    private void flushScheduled() {
        try {
            flush();
        } catch (Exception e) {
            log.error("[QUEUE] Buffered flush failed", e);
        }
    }

    public int buffered() {
        return buffer.size();
    }

    @Override
    public Optional<QueuedTrade> dequeue() {
        return delegate.dequeue();
    }

    @Override
    public void complete(QueuedTrade trade) {
        delegate.complete(trade);
    }

    @Override
    public boolean requeue(QueuedTrade trade) {
        return delegate.requeue(trade);
    }

    @Override
    public QueueStats stats() {
        QueueStats stored = delegate.stats();
        return new QueueStats(stored.pending() + buffer.size(), stored.processing());
    }

    @Override
    public Set<String> positionsWithQueuedClose() {
        Set<String> ids = new HashSet<>(delegate.positionsWithQueuedClose());
        for (QueuedTrade trade : buffer) {
            if (trade.action() == TradeAction.CLOSE) {
                ids.add(trade.positionId());
            }
        }
        return ids;
    }

    @Override
    public int releaseAbandoned(Duration claimedLongerThan) {
        return delegate.releaseAbandoned(claimedLongerThan);
    }
}
