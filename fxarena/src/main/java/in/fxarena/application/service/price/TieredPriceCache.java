package in.fxarena.application.service.price;

import in.fxarena.application.port.output.SharedPriceStore;
import in.fxarena.application.port.output.UpstreamQuoteClient;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;
import in.fxarena.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tiered price cache - streaming first, graceful degradation after.
 *
 * RESOLUTION (per symbol, each tier only sees symbols still missing):
 * 1. Streaming tier, if younger than streamFresh (10s)
 * 2. Process-local tier, if younger than localFresh (15s)
 * 3. Shared tier, only on cold start (nothing received yet in this process)
 * 4. Upstream fetch, at most one per fetchCooldown (2s) system-wide;
 *    callers arriving during an in-flight fetch wait for it
 * 5. Last-known quote of any age, flagged fallback (and stale past 5 min)
 *
 * WRITES:
 * - stream   → streaming + local + last-known
 * - fetched  → local + last-known, shared asynchronously (never the
 *              streaming tier, which only holds what the feed delivered)
 * - shared   → local (fresh only) + last-known
 *
 * Accepted stream and fetched quotes are fanned out to every
 * {@link PriceTickListener}. An unknown symbol with no data anywhere is
 * simply absent from the result.
 *
 * THREAD-SAFETY:
 * Tiers are ConcurrentHashMaps written with single-key atomic operations.
 * The fetch slot is an AtomicReference to the in-flight future.
 */
public final class TieredPriceCache {
    private static final Logger log = LoggerFactory.getLogger(TieredPriceCache.class);

    private static final long NEVER = Long.MIN_VALUE;

    private final Settings settings;
    private final Clock clock;
    private final SharedPriceStore sharedStore;      // nullable
    private final UpstreamQuoteClient upstream;      // nullable
    private final Executor sharedWriter;
    private final EngineMetrics metrics;

    private final ConcurrentHashMap<String, PriceQuote> streamTier = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PriceQuote> localTier = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PriceQuote> lastKnown = new ConcurrentHashMap<>();

    private final AtomicReference<CompletableFuture<Map<String, PriceQuote>>> inFlightFetch =
        new AtomicReference<>();
    private volatile long lastFetchStartedAt = NEVER;
    private final AtomicLong fetchCount = new AtomicLong();
    private volatile Instant lastUpdate;

    private final List<PriceTickListener> listeners = new CopyOnWriteArrayList<>();

    public TieredPriceCache(Settings settings, Clock clock, SharedPriceStore sharedStore,
                            UpstreamQuoteClient upstream, Executor sharedWriter, EngineMetrics metrics) {
        this.settings = settings;
        this.clock = clock;
        this.sharedStore = sharedStore;
        this.upstream = upstream;
        this.sharedWriter = sharedWriter;
        this.metrics = metrics != null ? metrics : EngineMetrics.noop();
    }

    public void addListener(PriceTickListener listener) {
        listeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // Reads
    // ═══════════════════════════════════════════════════════════════

    /**
     * Best available quote for a symbol.
     */
    public Optional<PriceQuote> get(String symbol) {
        return Optional.ofNullable(getAll(List.of(symbol)).get(symbol));
    }

    /**
     * Best available quotes for several symbols. Symbols with no data in any
     * tier are absent from the returned map.
     */
    public Map<String, PriceQuote> getAll(Collection<String> symbols) {
        Instant now = clock.instant();
        Map<String, PriceQuote> result = new LinkedHashMap<>();
        Set<String> missing = new LinkedHashSet<>(symbols);

        // 1. Streaming tier
        resolveFromTier(streamTier, settings.streamFresh(), PriceSource.STREAM, "stream", now, missing, result);
        if (missing.isEmpty()) {
            return result;
        }

        // 2. Process-local tier
        resolveFromTier(localTier, settings.localFresh(), PriceSource.CACHED, "local", now, missing, result);
        if (missing.isEmpty()) {
            return result;
        }

        // 3. Shared tier, cold start only
        if (sharedStore != null && lastKnown.isEmpty()) {
            resolveFromSharedTier(now, missing, result);
            if (missing.isEmpty()) {
                return result;
            }
        }

        // 4. Upstream fetch
        if (upstream != null) {
            Map<String, PriceQuote> fetched = fetchFromUpstream(missing);
            for (String symbol : List.copyOf(missing)) {
                PriceQuote quote = fetched.get(symbol);
                if (quote != null) {
                    result.put(symbol, quote);
                    missing.remove(symbol);
                    metrics.recordCacheLookup("fetch");
                }
            }
            if (missing.isEmpty()) {
                return result;
            }
        }

        // 5. Last-known, any age
        for (String symbol : List.copyOf(missing)) {
            PriceQuote known = lastKnown.get(symbol);
            if (known == null) {
                metrics.recordCacheLookup("miss");
                continue;
            }
            boolean stale = known.isOlderThan(settings.staleAfter(), now);
            QuoteNormalizer.renormalize(known.asFallback(stale)).ifPresent(q -> {
                result.put(symbol, q);
                missing.remove(symbol);
                metrics.recordCacheLookup("fallback");
            });
        }
        if (!missing.isEmpty()) {
            log.debug("[PRICE CACHE] No price available for {}", missing);
        }
        return result;
    }

    private void resolveFromTier(Map<String, PriceQuote> tier, Duration maxAge, PriceSource source, String tierName,
                                 Instant now, Set<String> missing, Map<String, PriceQuote> result) {
        for (String symbol : List.copyOf(missing)) {
            PriceQuote quote = tier.get(symbol);
            if (quote == null || quote.isOlderThan(maxAge, now)) {
                continue;
            }
            Optional<PriceQuote> served = QuoteNormalizer.renormalize(quote.withSource(source));
            if (served.isPresent()) {
                result.put(symbol, served.get());
                missing.remove(symbol);
                metrics.recordCacheLookup(tierName);
            }
        }
    }

    private void resolveFromSharedTier(Instant now, Set<String> missing, Map<String, PriceQuote> result) {
        Map<String, PriceQuote> shared;
        try {
            shared = sharedStore.read(missing);
        } catch (RuntimeException e) {
            log.warn("[PRICE CACHE] Shared tier read failed: {}", e.getMessage());
            return;
        }
        log.info("[PRICE CACHE] Cold start: shared tier returned {}/{} symbols", shared.size(), missing.size());

        for (String symbol : List.copyOf(missing)) {
            PriceQuote raw = shared.get(symbol);
            if (raw == null) {
                continue;
            }
            Optional<PriceQuote> normalized = QuoteNormalizer.renormalize(raw.withSource(PriceSource.CACHED));
            if (normalized.isEmpty()) {
                metrics.recordQuoteRejected("shared_invalid");
                continue;
            }
            PriceQuote quote = normalized.get();
            lastKnown.merge(symbol, quote, TieredPriceCache::newer);
            if (!quote.isOlderThan(settings.localFresh(), now)) {
                localTier.merge(symbol, quote, TieredPriceCache::newer);
                result.put(symbol, quote);
                missing.remove(symbol);
                metrics.recordCacheLookup("shared");
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Upstream fetch (cooldown + single in-flight request)
    // ═══════════════════════════════════════════════════════════════

    private Map<String, PriceQuote> fetchFromUpstream(Collection<String> symbols) {
        CompletableFuture<Map<String, PriceQuote>> mine = new CompletableFuture<>();
        CompletableFuture<Map<String, PriceQuote>> existing = inFlightFetch.compareAndExchange(null, mine);
        if (existing != null) {
            return awaitFetch(existing);
        }

        // This caller owns the fetch slot until the finally block
        try {
            long nowMs = clock.millis();
            long last = lastFetchStartedAt;
            if (last != NEVER && nowMs - last < settings.fetchCooldown().toMillis()) {
                metrics.recordFetchSkipped();
                log.debug("[PRICE CACHE] Fetch skipped, cooldown active ({}ms since last)", nowMs - last);
                mine.complete(Map.of());
                return Map.of();
            }
            lastFetchStartedAt = nowMs;
            fetchCount.incrementAndGet();

            long started = System.nanoTime();
            try {
                Map<String, PriceQuote> fetched = upstream.fetchQuotes(List.copyOf(symbols));
                metrics.recordFetch(true, Duration.ofNanos(System.nanoTime() - started));
                // Accept before the slot is released
                Map<String, PriceQuote> accepted = new LinkedHashMap<>();
                if (fetched != null) {
                    for (PriceQuote raw : fetched.values()) {
                        acceptFetched(raw).ifPresent(q -> accepted.put(q.symbol(), q));
                    }
                }
                log.debug("[PRICE CACHE] Fetched {}/{} symbols from upstream", accepted.size(), symbols.size());
                mine.complete(accepted);
                return accepted;
            } catch (RuntimeException e) {
                metrics.recordFetch(false, Duration.ofNanos(System.nanoTime() - started));
                log.warn("[PRICE CACHE] Upstream fetch failed: {}", e.getMessage());
                mine.complete(Map.of());
                return Map.of();
            }
        } finally {
            inFlightFetch.compareAndSet(mine, null);
        }
    }

    private Map<String, PriceQuote> awaitFetch(CompletableFuture<Map<String, PriceQuote>> fetch) {
        try {
            return fetch.get(settings.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("[PRICE CACHE] Gave up waiting for in-flight fetch after {}", settings.fetchTimeout());
            return Map.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Map.of();
        } catch (ExecutionException e) {
            log.debug("[PRICE CACHE] In-flight fetch failed: {}", e.getMessage());
            return Map.of();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Writes
    // ═══════════════════════════════════════════════════════════════

    /**
     * Accept a streaming quote. Invalid quotes are rejected and the previous
     * value is kept.
     *
     * @return true if the quote was cached
     */
    public boolean put(PriceQuote quote) {
        Optional<PriceQuote> normalized = normalizeOrReject(quote, PriceSource.STREAM);
        if (normalized.isEmpty()) {
            return false;
        }
        PriceQuote q = normalized.get();
        streamTier.put(q.symbol(), q);
        writeThrough(q);
        metrics.recordQuoteAccepted("stream");
        fanOut(q);
        return true;
    }

    /**
     * Accept a streaming quote unless the cached one is newer. Used for
     * aggregate events, which can arrive behind the quote stream.
     *
     * @return true if the quote was cached
     */
    public boolean putIfNotOlder(PriceQuote quote) {
        Optional<PriceQuote> normalized = normalizeOrReject(quote, PriceSource.STREAM);
        if (normalized.isEmpty()) {
            return false;
        }
        PriceQuote q = normalized.get();
        PriceQuote winner = streamTier.merge(q.symbol(), q, TieredPriceCache::newer);
        if (winner != q) {
            log.trace("[PRICE CACHE] Ignored older aggregate for {} ({} < {})",
                q.symbol(), q.timestamp(), winner.timestamp());
            return false;
        }
        writeThrough(q);
        metrics.recordQuoteAccepted("stream");
        fanOut(q);
        return true;
    }

    /**
     * Accept a quote obtained from the upstream fetch.
     *
     * @return the normalized quote, or empty if it was rejected
     */
    public Optional<PriceQuote> acceptFetched(PriceQuote quote) {
        Optional<PriceQuote> normalized = normalizeOrReject(quote, PriceSource.FETCHED);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        PriceQuote q = normalized.get();
        writeThrough(q);
        metrics.recordQuoteAccepted("fetched");
        publishToSharedTier(List.of(q));
        fanOut(q);
        return normalized;
    }

    private Optional<PriceQuote> normalizeOrReject(PriceQuote quote, PriceSource source) {
        if (quote == null) {
            return Optional.empty();
        }
        Optional<QuoteNormalizer.Rejection> rejection = QuoteNormalizer.check(quote.bid(), quote.ask());
        if (rejection.isPresent()) {
            log.warn("[PRICE CACHE] Rejected {} quote for {}: {} (bid={}, ask={})",
                source, quote.symbol(), rejection.get(), quote.bid(), quote.ask());
            metrics.recordQuoteRejected(rejection.get().name());
            return Optional.empty();
        }
        return QuoteNormalizer.renormalize(quote.withSource(source));
    }

    private void writeThrough(PriceQuote q) {
        localTier.merge(q.symbol(), q, TieredPriceCache::newer);
        lastKnown.merge(q.symbol(), q, TieredPriceCache::newer);
        lastUpdate = clock.instant();
    }

    private static PriceQuote newer(PriceQuote existing, PriceQuote candidate) {
        return candidate.timestamp().isBefore(existing.timestamp()) ? existing : candidate;
    }

    private void fanOut(PriceQuote quote) {
        for (PriceTickListener listener : listeners) {
            try {
                listener.onQuote(quote);
            } catch (RuntimeException e) {
                log.error("[PRICE CACHE] Listener {} failed on {}: {}",
                    listener.getClass().getSimpleName(), quote.symbol(), e.getMessage(), e);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Shared tier publishing
    // ═══════════════════════════════════════════════════════════════

    /**
     * Publish the fresh part of the streaming tier to the shared tier so other
     * processes can cold-start from it.
     *
     * @return number of quotes published
     */
    public int flushToSharedTier() {
        if (sharedStore == null) {
            return 0;
        }
        Instant now = clock.instant();
        List<PriceQuote> fresh = new ArrayList<>();
        for (PriceQuote q : streamTier.values()) {
            if (!q.isOlderThan(settings.streamFresh(), now)) {
                fresh.add(q);
            }
        }
        if (fresh.isEmpty()) {
            return 0;
        }
        try {
            sharedStore.write(fresh);
            log.debug("[PRICE CACHE] Flushed {} quotes to shared tier", fresh.size());
            return fresh.size();
        } catch (RuntimeException e) {
            log.warn("[PRICE CACHE] Shared tier flush failed: {}", e.getMessage());
            return 0;
        }
    }

    private void publishToSharedTier(List<PriceQuote> quotes) {
        if (sharedStore == null) {
            return;
        }
        try {
            sharedWriter.execute(() -> {
                try {
                    sharedStore.write(quotes);
                } catch (RuntimeException e) {
                    log.warn("[PRICE CACHE] Shared tier write failed: {}", e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("[PRICE CACHE] Shared tier write not scheduled: {}", e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Monitoring
    // ═══════════════════════════════════════════════════════════════

    public CacheStats stats() {
        return new CacheStats(streamTier.size(), localTier.size(), lastKnown.size(),
            fetchCount.get(), lastUpdate);
    }

    /**
     * Tier sizes and activity counters.
     */
    public record CacheStats(int streamEntries, int localEntries, int lastKnownEntries,
                             long upstreamFetches, Instant lastUpdate) {
    }

    /**
     * Freshness windows for the cache tiers.
     */
    public record Settings(
        Duration streamFresh,
        Duration localFresh,
        Duration fetchCooldown,
        Duration fetchTimeout,
        Duration staleAfter
    ) {
        public Settings {
            if (streamFresh == null || localFresh == null || fetchCooldown == null
                    || fetchTimeout == null || staleAfter == null) {
                throw new IllegalArgumentException("Cache settings cannot be null");
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(10), Duration.ofSeconds(15), Duration.ofSeconds(2),
                Duration.ofSeconds(5), Duration.ofMinutes(5));
        }
    }
}
