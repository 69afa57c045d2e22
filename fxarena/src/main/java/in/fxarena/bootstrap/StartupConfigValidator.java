package in.fxarena.bootstrap;

import in.fxarena.config.EngineConfig;
import in.fxarena.domain.price.ForexPairs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything is started. Every problem is collected and reported
 * together; the engine refuses to start with an IllegalStateException.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(EngineConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> problems = new ArrayList<>();

        if (config.port() <= 0 || config.port() > 65535) {
            problems.add("PORT must be between 1 and 65535, got " + config.port());
        }

        if (config.symbols().isEmpty()) {
            problems.add("SYMBOLS resolved to no known currency pairs");
        }
        for (String symbol : config.symbols()) {
            if (!ForexPairs.isKnown(symbol)) {
                log.warn("⚠️  {} is not in the pair catalog, default pip and spread will be used", symbol);
            }
        }

        if (config.feedEnabled()) {
            if (config.feedApiKey() == null || config.feedApiKey().isBlank()) {
                problems.add("FEED_ENABLED=true requires FEED_API_KEY");
            }
            if (config.feedUrl() == null || !(config.feedUrl().startsWith("ws://") || config.feedUrl().startsWith("wss://"))) {
                problems.add("FEED_URL must be a ws:// or wss:// URL, got '" + config.feedUrl() + "'");
            }
            if (config.reconnectMaxAttempts() <= 0) {
                problems.add("RECONNECT_MAX_ATTEMPTS must be positive");
            }
            requirePositive(problems, "RECONNECT_BASE_DELAY_MS", config.reconnectBaseDelay());
            requirePositive(problems, "FEED_SILENCE_MS", config.feedSilence());
        } else {
            log.warn("⚠️  Streaming feed DISABLED - prices come from upstream fetch and cache only");
        }

        requirePositive(problems, "STREAM_FRESH_MS", config.streamFresh());
        requirePositive(problems, "LOCAL_FRESH_MS", config.localFresh());
        requirePositive(problems, "FETCH_TIMEOUT_MS", config.fetchTimeout());
        requirePositive(problems, "STALE_AFTER_MS", config.staleAfter());
        requirePositive(problems, "SWEEP_INTERVAL_SECONDS", config.sweepInterval());
        requirePositive(problems, "SHARED_FLUSH_SECONDS", config.sharedFlushInterval());
        if (config.fetchCooldown().isNegative()) {
            problems.add("FETCH_COOLDOWN_MS cannot be negative");
        }
        if (config.localFresh().compareTo(config.streamFresh()) < 0) {
            problems.add("LOCAL_FRESH_MS (" + config.localFresh().toMillis()
                + ") must not be shorter than STREAM_FRESH_MS (" + config.streamFresh().toMillis() + ")");
        }
        if (config.staleAfter().compareTo(config.localFresh()) < 0) {
            problems.add("STALE_AFTER_MS must not be shorter than LOCAL_FRESH_MS");
        }

        if (config.settlementWorkers() <= 0) {
            problems.add("SETTLEMENT_WORKERS must be positive");
        }
        if (config.settlementPollMs() <= 0) {
            problems.add("SETTLEMENT_POLL_MS must be positive");
        }
        requirePositive(problems, "CLAIM_LEASE_SECONDS", config.claimLease());
        if (config.queueFlushMs() <= 0) {
            problems.add("QUEUE_FLUSH_MS must be positive");
        }

        if (config.dbUrl() == null || !config.dbUrl().startsWith("jdbc:postgresql:")) {
            problems.add("DB_URL must be a jdbc:postgresql: URL");
        }
        if (config.dbPoolSize() <= 0) {
            problems.add("DB_POOL_SIZE must be positive");
        }
        if (config.queueBackend() == EngineConfig.QueueBackend.MEMORY) {
            log.warn("⚠️  QUEUE_BACKEND=MEMORY - queued trades are lost on restart");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG:\n  - " + String.join("\n  - ", problems) + "\nSystem refuses to start.");
        }

        log.info("✅ Startup config validation passed ({} symbols, feed {})",
            config.symbols().size(), config.feedEnabled() ? "enabled" : "disabled");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void requirePositive(List<String> problems, String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(key + " must be positive");
        }
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
