package in.fxarena.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.fxarena.application.port.output.TradeExecutionQueue;
import in.fxarena.application.service.execution.TradeSettlementWorker;
import in.fxarena.application.service.execution.TradeSettler;
import in.fxarena.application.service.price.SpreadEstimator;
import in.fxarena.application.service.price.TieredPriceCache;
import in.fxarena.application.service.reconciliation.ReconciliationSweep;
import in.fxarena.application.service.trigger.PositionTriggerIndex;
import in.fxarena.application.service.trigger.SlTpTriggerService;
import in.fxarena.config.EngineConfig;
import in.fxarena.infrastructure.feed.FeedMessageParser;
import in.fxarena.infrastructure.feed.JdkWebSocketConnector;
import in.fxarena.infrastructure.feed.ReconnectionPolicy;
import in.fxarena.infrastructure.feed.StreamingPriceFeed;
import in.fxarena.infrastructure.metrics.PrometheusEngineMetrics;
import in.fxarena.infrastructure.metrics.PrometheusMetricsHandler;
import in.fxarena.infrastructure.persistence.PostgresClosureLedger;
import in.fxarena.infrastructure.persistence.PostgresPositionStore;
import in.fxarena.infrastructure.persistence.PostgresRiskSettingsStore;
import in.fxarena.infrastructure.persistence.PostgresSharedPriceStore;
import in.fxarena.infrastructure.queue.BufferedTradeExecutionQueue;
import in.fxarena.infrastructure.queue.InMemoryTradeExecutionQueue;
import in.fxarena.infrastructure.queue.PostgresTradeExecutionQueue;
import in.fxarena.infrastructure.upstream.RestUpstreamQuoteClient;
import in.fxarena.migration.SchemaMigration;
import in.fxarena.transport.http.EngineHandlers;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * FxArena price and risk engine.
 *
 * Wires the tiered price cache, streaming feed, SL/TP triggers, trade
 * settlement and the reconciliation sweep, then serves the operational
 * HTTP endpoints.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== FxArena Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        EngineConfig config = EngineConfig.fromEnv();
        StartupConfigValidator.validate(config);

        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = new ObjectMapper();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new SchemaMigration(dataSource).migrate();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Stores
        // ═══════════════════════════════════════════════════════════════
        PostgresPositionStore positionStore = new PostgresPositionStore(dataSource);
        PostgresRiskSettingsStore riskSettings = new PostgresRiskSettingsStore(dataSource);
        PostgresClosureLedger closureLedger = new PostgresClosureLedger(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Trade Execution Queue
        // ═══════════════════════════════════════════════════════════════
        TradeExecutionQueue queue;
        BufferedTradeExecutionQueue bufferedQueue = null;
        if (config.queueBackend() == EngineConfig.QueueBackend.POSTGRES) {
            PostgresTradeExecutionQueue pgQueue = new PostgresTradeExecutionQueue(dataSource, metrics);
            int released = pgQueue.releaseAbandoned(config.claimLease());
            if (released > 0) {
                log.warn("[QUEUE] Released {} trades abandoned in PROCESSING", released);
            }
            // Tick-path enqueues land in memory; the flusher writes them to Postgres
            bufferedQueue = new BufferedTradeExecutionQueue(pgQueue, config.queueFlushMs());
            bufferedQueue.start();
            queue = bufferedQueue;
        } else {
            queue = new InMemoryTradeExecutionQueue(metrics);
        }
        log.info("✓ Trade queue: {}", config.queueBackend());

        // ═══════════════════════════════════════════════════════════════
        // Tiered Price Cache
        // ═══════════════════════════════════════════════════════════════
        ExecutorService sharedWriter = Executors.newSingleThreadExecutor(daemon("price-shared-writer"));
        RestUpstreamQuoteClient upstream = new RestUpstreamQuoteClient(
            config.restBaseUrl(), config.feedApiKey(), config.fetchTimeout(), mapper, clock);
        TieredPriceCache cache = new TieredPriceCache(config.cacheSettings(), clock,
            new PostgresSharedPriceStore(dataSource), upstream, sharedWriter, metrics);

        // ═══════════════════════════════════════════════════════════════
        // SL/TP Triggers
        // ═══════════════════════════════════════════════════════════════
        PositionTriggerIndex index = new PositionTriggerIndex();
        SlTpTriggerService triggerService = new SlTpTriggerService(index, queue, clock, metrics);
        cache.addListener(triggerService);

        // ═══════════════════════════════════════════════════════════════
        // Trade Settlement
        // ═══════════════════════════════════════════════════════════════
        ExecutorService notifier = Executors.newSingleThreadExecutor(daemon("closure-notifier"));
        TradeSettler settler = new TradeSettler(positionStore, index, closureLedger, notifier, metrics);
        TradeSettlementWorker settlementWorker = new TradeSettlementWorker(queue, settler, metrics,
            config.settlementWorkers(), config.settlementPollMs(), config.claimLease());

        // ═══════════════════════════════════════════════════════════════
        // Reconciliation Sweep (first pass builds the trigger index)
        // ═══════════════════════════════════════════════════════════════
        ReconciliationSweep sweep = new ReconciliationSweep(positionStore, riskSettings, index, triggerService,
            cache, queue, closureLedger, metrics, clock, config.sweepInterval());
        index.markAllClosing(queue.positionsWithQueuedClose());
        sweep.sweep();

        settlementWorker.start();
        sweep.start();

        // ═══════════════════════════════════════════════════════════════
        // Streaming Price Feed
        // ═══════════════════════════════════════════════════════════════
        ScheduledExecutorService feedScheduler = Executors.newSingleThreadScheduledExecutor(daemon("feed-scheduler"));
        StreamingPriceFeed feed = null;
        if (config.feedEnabled()) {
            ExecutorService dispatcher = Executors.newSingleThreadExecutor(daemon("feed-dispatcher"));
            feed = new StreamingPriceFeed(
                new StreamingPriceFeed.Settings(URI.create(config.feedUrl()), config.feedApiKey(),
                    config.symbols(), config.feedSilence()),
                new JdkWebSocketConnector(Duration.ofSeconds(10)),
                cache, new SpreadEstimator(), new FeedMessageParser(mapper, clock), mapper,
                dispatcher, feedScheduler,
                ReconnectionPolicy.builder()
                    .initialDelay(config.reconnectBaseDelay())
                    .maxDelay(Duration.ofMinutes(5))
                    .multiplier(ReconnectionPolicy.FEED_MULTIPLIER)
                    .maxAttempts(config.reconnectMaxAttempts())
                    .clock(clock)
                    .build(),
                metrics, clock);
            feed.start();
        } else {
            log.warn("[STREAM] Streaming disabled; prices come from the shared tier and upstream fetch");
        }

        long flushSeconds = config.sharedFlushInterval().toSeconds();
        feedScheduler.scheduleAtFixedRate(cache::flushToSharedTier, flushSeconds, flushSeconds, TimeUnit.SECONDS);

        // ═══════════════════════════════════════════════════════════════
        // HTTP Server
        // ═══════════════════════════════════════════════════════════════
        EngineHandlers handlers = new EngineHandlers(cache, queue, riskSettings, index, feed, sweep, clock);

        RoutingHandler routes = Handlers.routing()
            .get("/health", handlers::health)
            .get("/api/prices", handlers::prices)
            .get("/api/queue/stats", handlers::queueStats)
            .post("/api/margin/status", handlers::marginStatus)
            .post("/api/orders/validate", handlers::validateOrder)
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "FxArena Engine\n\n" +
                    "GET  /health, /metrics, /api/prices?symbols=, /api/queue/stats\n" +
                    "POST /api/margin/status, /api/orders/validate\n"
                );
            });

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(corsHandler)
            .build();
        server.start();
        log.info("✓ HTTP server started on http://localhost:{}/", config.port());

        // ═══════════════════════════════════════════════════════════════
        // Shutdown
        // ═══════════════════════════════════════════════════════════════
        StreamingPriceFeed runningFeed = feed;
        BufferedTradeExecutionQueue runningBuffer = bufferedQueue;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("=== FxArena Engine Stopping ===");
            server.stop();
            if (runningFeed != null) {
                runningFeed.stop();
            }
            sweep.stop();
            settlementWorker.stop();
            if (runningBuffer != null) {
                runningBuffer.stop();
            }
            feedScheduler.shutdownNow();
            cache.flushToSharedTier();
            sharedWriter.shutdown();
            notifier.shutdown();
            dataSource.close();
            log.info("=== FxArena Engine Stopped ===");
        }, "shutdown"));
    }

    private static HikariDataSource createDataSource(EngineConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("fxarena-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private App() {}
}
