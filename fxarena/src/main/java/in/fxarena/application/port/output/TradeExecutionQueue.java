package in.fxarena.application.port.output;

import in.fxarena.domain.trade.QueueStats;
import in.fxarena.domain.trade.QueuedTrade;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * FIFO work queue with an explicit processing set.
 *
 * A trade is in exactly one of pending or processing at any instant.
 * Implementations must make {@link #dequeue()} safe for concurrent workers:
 * each pending trade is handed to exactly one caller.
 */
public interface TradeExecutionQueue {

    int MAX_RETRIES = 3;

    /** Append at the tail of pending. */
    void enqueue(QueuedTrade trade);

    /** Move the oldest pending trade into processing. */
    Optional<QueuedTrade> dequeue();

    /** Remove a finished trade from processing. */
    void complete(QueuedTrade trade);

    /**
     * Remove a failed trade from processing and re-append it with
     * retries + 1 while retries &lt; {@link #MAX_RETRIES}; otherwise drop it
     * and log the trade at ERROR.
     *
     * @return true if the trade was re-enqueued
     */
    boolean requeue(QueuedTrade trade);

    QueueStats stats();

    /**
     * Position ids with a CLOSE waiting in pending or processing.
     */
    Set<String> positionsWithQueuedClose();

    /**
     * Return trades claimed longer ago than the lease to pending, for
     * queues whose claims can outlive a dead worker.
     *
     * @return number of trades released
     */
    default int releaseAbandoned(Duration claimedLongerThan) {
        return 0;
    }
}
