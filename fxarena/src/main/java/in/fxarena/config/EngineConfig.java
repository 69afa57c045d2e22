package in.fxarena.config;

import in.fxarena.application.service.price.TieredPriceCache;
import in.fxarena.domain.price.ForexPairs;
import in.fxarena.util.Env;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Engine settings, read once at startup.
 */
public record EngineConfig(
    int port,

    // Streaming feed
    boolean feedEnabled,
    String feedUrl,
    String feedApiKey,
    List<String> symbols,
    Duration reconnectBaseDelay,
    int reconnectMaxAttempts,
    Duration feedSilence,

    // Upstream REST fetch
    String restBaseUrl,

    // Cache tiers
    Duration streamFresh,
    Duration localFresh,
    Duration fetchCooldown,
    Duration fetchTimeout,
    Duration staleAfter,
    Duration sharedFlushInterval,

    // Background jobs
    Duration sweepInterval,
    int settlementWorkers,
    long settlementPollMs,
    Duration claimLease,
    QueueBackend queueBackend,
    long queueFlushMs,

    // Database
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize
) {
    public enum QueueBackend {
        POSTGRES,
        MEMORY
    }

    public EngineConfig {
        symbols = List.copyOf(symbols);
    }

    public static EngineConfig fromEnv() {
        List<String> symbols = new ArrayList<>();
        for (String raw : Env.getList("SYMBOLS", ForexPairs.allSymbols())) {
            ForexPairs.canonicalize(raw).ifPresent(symbols::add);
        }

        return new EngineConfig(
            Env.getInt("PORT", 9090),
            Env.getBool("FEED_ENABLED", true),
            Env.get("FEED_URL", "wss://socket.polygon.io/forex"),
            Env.get("FEED_API_KEY", ""),
            symbols,
            Duration.ofMillis(Env.getLong("RECONNECT_BASE_DELAY_MS", 1000)),
            Env.getInt("RECONNECT_MAX_ATTEMPTS", 10),
            Duration.ofMillis(Env.getLong("FEED_SILENCE_MS", 5 * 60 * 1000)),
            Env.get("REST_BASE_URL", "https://api.polygon.io/v1"),
            Duration.ofMillis(Env.getLong("STREAM_FRESH_MS", 10_000)),
            Duration.ofMillis(Env.getLong("LOCAL_FRESH_MS", 15_000)),
            Duration.ofMillis(Env.getLong("FETCH_COOLDOWN_MS", 2_000)),
            Duration.ofMillis(Env.getLong("FETCH_TIMEOUT_MS", 5_000)),
            Duration.ofMillis(Env.getLong("STALE_AFTER_MS", 5 * 60 * 1000)),
            Duration.ofSeconds(Env.getLong("SHARED_FLUSH_SECONDS", 5)),
            Duration.ofSeconds(Env.getLong("SWEEP_INTERVAL_SECONDS", 60)),
            Env.getInt("SETTLEMENT_WORKERS", 2),
            Env.getLong("SETTLEMENT_POLL_MS", 100),
            Duration.ofSeconds(Env.getLong("CLAIM_LEASE_SECONDS", 300)),
            parseBackend(Env.get("QUEUE_BACKEND", "POSTGRES")),
            Env.getLong("QUEUE_FLUSH_MS", 50),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/fxarena"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10)
        );
    }

    public TieredPriceCache.Settings cacheSettings() {
        return new TieredPriceCache.Settings(streamFresh, localFresh, fetchCooldown, fetchTimeout, staleAfter);
    }

    private static QueueBackend parseBackend(String raw) {
        try {
            return QueueBackend.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("QUEUE_BACKEND must be POSTGRES or MEMORY, got '" + raw + "'");
        }
    }
}
