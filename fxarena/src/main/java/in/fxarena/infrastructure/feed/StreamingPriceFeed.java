package in.fxarena.infrastructure.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxarena.application.service.price.QuoteNormalizer;
import in.fxarena.application.service.price.SpreadEstimator;
import in.fxarena.application.service.price.TieredPriceCache;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;
import in.fxarena.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * StreamingPriceFeed - the single process-wide market-data subscription.
 *
 * FLOW:
 * connect → AUTHENTICATING (send auth) → auth_success → send subscribe for
 * every configured symbol → SUBSCRIBED. Messages are handed to the
 * dispatcher as raw text; the dispatcher must run tasks one at a time so
 * per-symbol order is preserved.
 *
 * RECONNECT:
 * Every unrequested close or error schedules a reconnect using the
 * {@link ReconnectionPolicy}. When the policy is exhausted the feed moves to
 * DISABLED and stays there; prices then come from the fetch and fallback
 * tiers of the cache. A successful authentication resets the attempt count.
 *
 * QUOTES:
 * - quote events: validated, observed by the spread estimator, then cached
 * - aggregate events: bid/ask synthesized as close ∓ half the estimated
 *   spread, cached only if not older than what the cache holds
 */
public final class StreamingPriceFeed {
    private static final Logger log = LoggerFactory.getLogger(StreamingPriceFeed.class);

    private final Settings settings;
    private final FeedConnector connector;
    private final TieredPriceCache cache;
    private final SpreadEstimator spreads;
    private final FeedMessageParser parser;
    private final ObjectMapper mapper;
    private final Executor dispatcher;
    private final ScheduledExecutorService scheduler;
    private final ReconnectionPolicy policy;
    private final EngineMetrics metrics;
    private final Clock clock;

    private volatile StreamConnectionState state = StreamConnectionState.DISCONNECTED;
    private volatile Connection current;
    private volatile boolean stopped = true;
    private volatile long lastMessageAt = 0L;
    private final AtomicLong quotesReceived = new AtomicLong();

    public StreamingPriceFeed(Settings settings, FeedConnector connector, TieredPriceCache cache,
                              SpreadEstimator spreads, FeedMessageParser parser, ObjectMapper mapper,
                              Executor dispatcher, ScheduledExecutorService scheduler,
                              ReconnectionPolicy policy, EngineMetrics metrics, Clock clock) {
        this.settings = settings;
        this.connector = connector;
        this.cache = cache;
        this.spreads = spreads;
        this.parser = parser;
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.policy = policy;
        this.metrics = metrics != null ? metrics : EngineMetrics.noop();
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    public void start() {
        stopped = false;
        log.info("[STREAM] Starting feed for {} symbols", settings.symbols().size());
        connect();
    }

    /**
     * Close the connection. No reconnect is scheduled afterwards.
     */
    public void stop() {
        stopped = true;
        Connection connection = current;
        current = null;
        if (connection != null) {
            connection.closeQuietly();
        }
        if (state != StreamConnectionState.DISABLED) {
            transition(StreamConnectionState.DISCONNECTED);
        }
        log.info("[STREAM] Stopped");
    }

    private void connect() {
        if (stopped || state == StreamConnectionState.DISABLED) {
            return;
        }
        Connection connection = new Connection();
        current = connection;
        transition(StreamConnectionState.CONNECTING);
        try {
            connector.connect(settings.url(), connection).whenComplete((session, error) -> {
                if (error != null) {
                    connection.lost("connect failed: " + rootMessage(error));
                }
            });
        } catch (RuntimeException e) {
            connection.lost("connect failed: " + e.getMessage());
        }
    }

    private void onConnectionLost(Connection connection, String reason) {
        if (current == connection) {
            current = null;
        }
        if (stopped) {
            return;
        }
        // Every one of maxAttempts reconnects gets its turn before streaming is given up.
        if (policy.isExhausted()) {
            transition(StreamConnectionState.DISABLED);
            log.error("[STREAM] Streaming disabled after {} failed reconnects ({}). Serving fetched and fallback prices only",
                policy.getAttemptCount(), reason);
            return;
        }
        Duration delay = policy.getNextDelay();
        policy.recordFailure();
        metrics.recordReconnectAttempt();

        transition(StreamConnectionState.DISCONNECTED);
        log.warn("[STREAM] Connection lost ({}), reconnect {}/{} in {}ms",
            reason, policy.getAttemptCount(), policy.getMaxAttempts(), delay.toMillis());
        try {
            scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[STREAM] Reconnect not scheduled, scheduler is shut down");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Message handling (dispatcher thread)
    // ═══════════════════════════════════════════════════════════════

    void handleMessage(Connection connection, String text) {
        for (FeedEvent event : parser.parse(text)) {
            try {
                switch (event.kind()) {
                    case STATUS -> handleStatus(connection, event);
                    case QUOTE -> handleQuote(event);
                    case AGGREGATE -> handleAggregate(event);
                }
            } catch (RuntimeException e) {
                log.error("[STREAM] Failed to apply {} event for {}: {}",
                    event.kind(), event.symbol(), e.getMessage(), e);
            }
        }
    }

    private void handleStatus(Connection connection, FeedEvent event) {
        switch (event.status()) {
            case "auth_success" -> {
                policy.recordSuccess();
                connection.send(subscribeMessage());
                transition(StreamConnectionState.SUBSCRIBED);
                log.info("[STREAM] Authenticated, subscribed to {} symbols", settings.symbols().size());
            }
            case "auth_failed" -> {
                log.error("[STREAM] Authentication failed: {}", event.message());
                connection.closeQuietly();
                connection.lost("authentication failed");
            }
            case "connected" -> log.info("[STREAM] Feed says connected: {}", event.message());
            default -> log.debug("[STREAM] Status {}: {}", event.status(), event.message());
        }
    }

    private void handleQuote(FeedEvent event) {
        Optional<QuoteNormalizer.Rejection> rejection = QuoteNormalizer.check(event.bid(), event.ask());
        if (rejection.isPresent()) {
            log.debug("[STREAM] Rejected quote for {}: {} (bid={}, ask={})",
                event.symbol(), rejection.get(), event.bid(), event.ask());
            metrics.recordQuoteRejected(rejection.get().name());
            return;
        }
        spreads.observe(event.symbol(), event.bid(), event.ask());
        QuoteNormalizer.normalize(event.symbol(), event.bid(), event.ask(), event.timestamp(), PriceSource.STREAM)
            .ifPresent(q -> {
                if (cache.put(q)) {
                    quotesReceived.incrementAndGet();
                }
            });
    }

    private void handleAggregate(FeedEvent event) {
        BigDecimal close = event.close();
        if (close == null || close.signum() <= 0) {
            log.debug("[STREAM] Aggregate for {} without a usable close: {}", event.symbol(), close);
            metrics.recordQuoteRejected(close == null ? "MISSING_SIDE" : "NON_POSITIVE");
            return;
        }
        BigDecimal half = spreads.halfSpread(event.symbol());
        Optional<PriceQuote> quote = QuoteNormalizer.normalize(event.symbol(),
            close.subtract(half), close.add(half), event.timestamp(), PriceSource.STREAM);
        if (quote.isEmpty()) {
            metrics.recordQuoteRejected("NON_POSITIVE");
            return;
        }
        if (cache.putIfNotOlder(quote.get())) {
            quotesReceived.incrementAndGet();
        }
    }

    private String authMessage() {
        return mapper.createObjectNode()
            .put("action", "auth")
            .put("params", settings.apiKey())
            .toString();
    }

    String subscribeMessage() {
        String params = settings.symbols().stream()
            .map(s -> "C." + s + ",CAS." + s)
            .collect(Collectors.joining(","));
        return mapper.createObjectNode()
            .put("action", "subscribe")
            .put("params", params)
            .toString();
    }

    // ═══════════════════════════════════════════════════════════════
    // Monitoring
    // ═══════════════════════════════════════════════════════════════

    public StreamConnectionState state() {
        return state;
    }

    /**
     * @return true when subscribed and a message arrived within the silence window
     */
    public boolean isHealthy() {
        if (state != StreamConnectionState.SUBSCRIBED) {
            return false;
        }
        long last = lastMessageAt;
        if (last > 0) {
            long silence = clock.millis() - last;
            if (silence > settings.silenceWindow().toMillis()) {
                log.warn("[STREAM] Stale feed: no messages for {}ms", silence);
                return false;
            }
        }
        return true;
    }

    public FeedStatus status() {
        long last = lastMessageAt;
        return new FeedStatus(state, policy.getAttemptCount(),
            last > 0 ? Instant.ofEpochMilli(last) : null, quotesReceived.get(), isHealthy());
    }

    private void transition(StreamConnectionState next) {
        StreamConnectionState previous = state;
        state = next;
        if (previous != next) {
            log.debug("[STREAM] {} → {}", previous, next);
            metrics.updateFeedState(next.wireValue());
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof FeedConnectionException) && t.getCause() != null) {
            if (t instanceof FeedConnectionException) {
                return t.getMessage() + ": " + t.getCause().getMessage();
            }
            t = t.getCause();
        }
        return t.getMessage();
    }

    /**
     * One socket's worth of state. Loss is reported once per connection,
     * whichever of close, error or failed connect arrives first.
     */
    final class Connection implements FeedSessionListener {
        private final AtomicBoolean lost = new AtomicBoolean(false);
        private volatile FeedSession session;

        @Override
        public void onOpen(FeedSession session) {
            this.session = session;
            lastMessageAt = clock.millis();
            transition(StreamConnectionState.AUTHENTICATING);
            log.info("[STREAM] Connected, authenticating");
            session.send(authMessage());
        }

        @Override
        public void onText(String text) {
            lastMessageAt = clock.millis();
            try {
                dispatcher.execute(() -> handleMessage(this, text));
            } catch (RejectedExecutionException e) {
                log.warn("[STREAM] Dispatcher rejected message, dropping it");
            }
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            lost("closed " + statusCode + " " + reason);
        }

        @Override
        public void onError(Throwable error) {
            lost("error: " + error.getMessage());
        }

        void send(String text) {
            FeedSession s = session;
            if (s != null) {
                s.send(text);
            }
        }

        void closeQuietly() {
            FeedSession s = session;
            session = null;
            if (s != null) {
                try {
                    s.close();
                } catch (RuntimeException e) {
                    log.debug("[STREAM] Close failed: {}", e.getMessage());
                }
            }
        }

        void lost(String reason) {
            if (lost.compareAndSet(false, true)) {
                session = null;
                onConnectionLost(this, reason);
            }
        }
    }

    /**
     * Feed endpoint, credentials and subscription.
     *
     * @param silenceWindow how long a subscribed feed may stay quiet before it counts as unhealthy
     */
    public record Settings(URI url, String apiKey, List<String> symbols, Duration silenceWindow) {
        public Settings {
            symbols = List.copyOf(symbols);
        }
    }
}
