package in.fxarena.infrastructure.metrics;

import java.time.Duration;

/**
 * Engine metrics for monitoring and alerting.
 *
 * Every method has a no-op default so components can be built without a
 * registry in tests. Key metrics:
 * - Quotes accepted/rejected per source
 * - Cache tier hit distribution
 * - Upstream fetch latency and cooldown skips
 * - Feed state and reconnects
 * - Trigger fires, queue flow and settlement latency
 * - Reconciliation sweep duration and outcomes
 */
public interface EngineMetrics {

    /**
     * Record an accepted quote.
     *
     * @param source STREAM, FETCHED or CACHED
     */
    default void recordQuoteAccepted(String source) {}

    /**
     * Record a quote rejected at the boundary.
     *
     * @param reason short reason code (CROSSED, MISSING_SIDE, NON_POSITIVE, PARSE)
     */
    default void recordQuoteRejected(String reason) {}

    /**
     * Record which tier answered a lookup.
     *
     * @param tier stream, local, shared, fetch, fallback or miss
     */
    default void recordCacheLookup(String tier) {}

    default void recordFetch(boolean success, Duration latency) {}

    default void recordFetchSkipped() {}

    /**
     * @param state connection state name
     */
    default void updateFeedState(String state) {}

    default void recordReconnectAttempt() {}

    /**
     * @param reason close reason code
     */
    default void recordTrigger(String reason) {}

    /**
     * @param event enqueued, completed, requeued or dropped
     */
    default void recordQueueEvent(String event) {}

    default void updateQueueDepth(long pending, long processing) {}

    /**
     * @param action  OPEN, CLOSE or MODIFY
     * @param outcome applied, already_closed, rejected or failed
     */
    default void recordSettlement(String action, String outcome, Duration latency) {}

    default void recordSweep(Duration duration, int triggersFired, int liquidations, int errors) {}

    /**
     * Metrics sink that records nothing.
     */
    static EngineMetrics noop() {
        return new EngineMetrics() {};
    }
}
