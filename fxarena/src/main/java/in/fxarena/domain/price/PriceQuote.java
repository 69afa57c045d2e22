package in.fxarena.domain.price;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Immutable two-sided quote as served by the price cache.
 *
 * A newer quote supersedes an older one; quotes are never mutated. Use
 * {@link #withSource} and {@link #asFallback} to derive the served view.
 */
public record PriceQuote(
    String symbol,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal mid,
    BigDecimal spread,
    Instant timestamp,
    PriceSource source,
    boolean stale,
    boolean fallback
) {
    public PriceQuote {
        if (symbol == null || bid == null || ask == null || mid == null || spread == null || timestamp == null) {
            throw new IllegalArgumentException("PriceQuote fields cannot be null");
        }
        if (source == null) {
            source = PriceSource.STREAM;
        }
    }

    public Duration age(Instant now) {
        return Duration.between(timestamp, now);
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return age(now).compareTo(maxAge) >= 0;
    }

    public PriceQuote withSource(PriceSource newSource) {
        return new PriceQuote(symbol, bid, ask, mid, spread, timestamp, newSource, stale, fallback);
    }

    /**
     * Last-known view of this quote.
     *
     * @param isStale whether the quote is beyond the staleness horizon
     */
    public PriceQuote asFallback(boolean isStale) {
        return new PriceQuote(symbol, bid, ask, mid, spread, timestamp, PriceSource.FALLBACK, isStale, true);
    }
}
