package in.fxarena.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - fxarena_quotes_total{source} - Accepted quotes
 * - fxarena_quotes_rejected_total{reason} - Quotes dropped at the boundary
 * - fxarena_cache_lookups_total{tier} - Which tier answered
 * - fxarena_fetch_latency_seconds{status} - Upstream fetch latency
 * - fxarena_feed_state{state} - 1 for the current feed state
 * - fxarena_triggers_total{reason} - SL/TP/margin closes enqueued
 * - fxarena_queue_depth{queue} - pending / processing
 * - fxarena_settlement_latency_seconds{action, outcome}
 * - fxarena_sweep_duration_seconds
 *
 * Usage:
 * <pre>
 * PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
 * server.addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private static final List<String> FEED_STATES =
        List.of("disconnected", "connecting", "authenticating", "subscribed", "disabled");

    private final CollectorRegistry registry;

    // Price metrics
    private final Counter quoteCounter;
    private final Counter quoteRejectedCounter;
    private final Counter cacheLookupCounter;
    private final Histogram fetchLatency;
    private final Counter fetchSkippedCounter;

    // Feed metrics
    private final Gauge feedState;
    private final Counter reconnectCounter;

    // Execution metrics
    private final Counter triggerCounter;
    private final Counter queueEventCounter;
    private final Gauge queueDepth;
    private final Histogram settlementLatency;

    // Sweep metrics
    private final Histogram sweepDuration;
    private final Counter sweepOutcomeCounter;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.quoteCounter = Counter.build()
            .name("fxarena_quotes_total")
            .help("Total number of accepted quotes")
            .labelNames("source")
            .register(registry);

        this.quoteRejectedCounter = Counter.build()
            .name("fxarena_quotes_rejected_total")
            .help("Total number of quotes rejected as invalid")
            .labelNames("reason")
            .register(registry);

        this.cacheLookupCounter = Counter.build()
            .name("fxarena_cache_lookups_total")
            .help("Price lookups by answering tier")
            .labelNames("tier")
            .register(registry);

        this.fetchLatency = Histogram.build()
            .name("fxarena_fetch_latency_seconds")
            .help("Upstream quote fetch latency in seconds")
            .labelNames("status")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.fetchSkippedCounter = Counter.build()
            .name("fxarena_fetch_skipped_total")
            .help("Upstream fetches skipped because of the cooldown")
            .register(registry);

        this.feedState = Gauge.build()
            .name("fxarena_feed_state")
            .help("Streaming feed state (1 for the current state)")
            .labelNames("state")
            .register(registry);

        this.reconnectCounter = Counter.build()
            .name("fxarena_feed_reconnects_total")
            .help("Total number of feed reconnect attempts")
            .register(registry);

        this.triggerCounter = Counter.build()
            .name("fxarena_triggers_total")
            .help("Position closes enqueued by reason")
            .labelNames("reason")
            .register(registry);

        this.queueEventCounter = Counter.build()
            .name("fxarena_queue_events_total")
            .help("Trade queue events")
            .labelNames("event")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("fxarena_queue_depth")
            .help("Trade queue depth")
            .labelNames("queue")
            .register(registry);

        this.settlementLatency = Histogram.build()
            .name("fxarena_settlement_latency_seconds")
            .help("Trade settlement latency in seconds")
            .labelNames("action", "outcome")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.sweepDuration = Histogram.build()
            .name("fxarena_sweep_duration_seconds")
            .help("Reconciliation sweep duration in seconds")
            .buckets(0.1, 0.5, 1.0, 5.0, 10.0, 30.0, 60.0)
            .register(registry);

        this.sweepOutcomeCounter = Counter.build()
            .name("fxarena_sweep_outcomes_total")
            .help("Reconciliation sweep outcomes")
            .labelNames("outcome")
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized");
    }

    @Override
    public void recordQuoteAccepted(String source) {
        quoteCounter.labels(label(source)).inc();
    }

    @Override
    public void recordQuoteRejected(String reason) {
        quoteRejectedCounter.labels(label(reason)).inc();
    }

    @Override
    public void recordCacheLookup(String tier) {
        cacheLookupCounter.labels(label(tier)).inc();
    }

    @Override
    public void recordFetch(boolean success, Duration latency) {
        fetchLatency.labels(success ? "success" : "failure").observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordFetchSkipped() {
        fetchSkippedCounter.inc();
    }

    @Override
    public void updateFeedState(String state) {
        String current = label(state);
        for (String s : FEED_STATES) {
            feedState.labels(s).set(s.equals(current) ? 1 : 0);
        }
    }

    @Override
    public void recordReconnectAttempt() {
        reconnectCounter.inc();
    }

    @Override
    public void recordTrigger(String reason) {
        triggerCounter.labels(label(reason)).inc();
    }

    @Override
    public void recordQueueEvent(String event) {
        queueEventCounter.labels(label(event)).inc();
    }

    @Override
    public void updateQueueDepth(long pending, long processing) {
        queueDepth.labels("pending").set(pending);
        queueDepth.labels("processing").set(processing);
    }

    @Override
    public void recordSettlement(String action, String outcome, Duration latency) {
        settlementLatency.labels(label(action), label(outcome)).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordSweep(Duration duration, int triggersFired, int liquidations, int errors) {
        sweepDuration.observe(duration.toMillis() / 1000.0);
        sweepOutcomeCounter.labels("trigger").inc(triggersFired);
        sweepOutcomeCounter.labels("liquidation").inc(liquidations);
        sweepOutcomeCounter.labels("error").inc(errors);
    }

    /**
     * Get Prometheus CollectorRegistry for /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static String label(String value) {
        return value == null ? "unknown" : value.toLowerCase(Locale.ROOT);
    }
}
