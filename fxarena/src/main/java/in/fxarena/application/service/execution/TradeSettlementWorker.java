package in.fxarena.application.service.execution;

import in.fxarena.application.port.output.TradeExecutionQueue;
import in.fxarena.domain.trade.QueueStats;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TradeSettlementWorker - drains the trade queue and settles each trade.
 *
 * Each worker thread polls on a fixed delay and drains until the queue is
 * empty. Completed trades leave the processing set; failed ones go back
 * through {@link TradeExecutionQueue#requeue}, which enforces the retry cap.
 * Claims older than the lease are handed back to pending on a timer, so a
 * trade held by a dead worker is picked up again.
 */
public final class TradeSettlementWorker {
    private static final Logger log = LoggerFactory.getLogger(TradeSettlementWorker.class);

    private static final int INITIAL_DELAY_MS = 1000;
    private static final Duration DEFAULT_CLAIM_LEASE = Duration.ofMinutes(5);

    private final TradeExecutionQueue queue;
    private final TradeSettler settler;
    private final EngineMetrics metrics;
    private final int workers;
    private final long pollIntervalMs;
    private final Duration claimLease;
    private final ScheduledExecutorService scheduler;

    public TradeSettlementWorker(TradeExecutionQueue queue, TradeSettler settler, EngineMetrics metrics,
                                 int workers, long pollIntervalMs) {
        this(queue, settler, metrics, workers, pollIntervalMs, DEFAULT_CLAIM_LEASE);
    }

    public TradeSettlementWorker(TradeExecutionQueue queue, TradeSettler settler, EngineMetrics metrics,
                                 int workers, long pollIntervalMs, Duration claimLease) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        if (claimLease == null || claimLease.isNegative() || claimLease.isZero()) {
            throw new IllegalArgumentException("claimLease must be positive");
        }
        this.queue = queue;
        this.settler = settler;
        this.metrics = metrics != null ? metrics : EngineMetrics.noop();
        this.workers = workers;
        this.pollIntervalMs = pollIntervalMs;
        this.claimLease = claimLease;

        AtomicInteger threadCount = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(workers, r -> {
            Thread t = new Thread(r, "trade-settlement-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        log.info("Starting TradeSettlementWorker ({} workers, polling every {}ms, claim lease {}s)",
            workers, pollIntervalMs, claimLease.toSeconds());
        for (int i = 0; i < workers; i++) {
            scheduler.scheduleWithFixedDelay(this::drain, INITIAL_DELAY_MS, pollIntervalMs, TimeUnit.MILLISECONDS);
        }
        long leaseMs = claimLease.toMillis();
        scheduler.scheduleWithFixedDelay(this::releaseAbandoned, leaseMs, leaseMs, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        log.info("Stopping TradeSettlementWorker...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Settle queued trades until the queue is empty. A failed settlement ends
     * the pass so a struggling store is retried on the next poll rather than
     * in a tight loop.
     *
     * @return number of trades taken off the queue
     */
    public int drain() {
        int handled = 0;
        try {
            while (!scheduler.isShutdown()) {
                Optional<QueuedTrade> next = queue.dequeue();
                if (next.isEmpty()) {
                    break;
                }
                handled++;
                if (!processOne(next.get())) {
                    break;
                }
            }
            if (handled > 0) {
                QueueStats stats = queue.stats();
                metrics.updateQueueDepth(stats.pending(), stats.processing());
            }
        } catch (Exception e) {
            log.error("Error in trade settlement loop: {}", e.getMessage(), e);
        }
        return handled;
    }

    /**
     * Hand claims older than the lease back to pending.
     *
     * @return number of trades released
     */
    public int releaseAbandoned() {
        try {
            int released = queue.releaseAbandoned(claimLease);
            if (released > 0) {
                log.warn("Released {} trades claimed longer than {}s", released, claimLease.toSeconds());
            }
            return released;
        } catch (Exception e) {
            log.error("Error releasing abandoned trades: {}", e.getMessage(), e);
            return 0;
        }
    }

    private boolean processOne(QueuedTrade trade) {
        TradeSettler.Outcome outcome = settler.settle(trade);
        if (outcome == TradeSettler.Outcome.COMPLETED) {
            queue.complete(trade);
            return true;
        }
        if (!queue.requeue(trade)) {
            settler.abandon(trade);
        }
        return false;
    }
}
