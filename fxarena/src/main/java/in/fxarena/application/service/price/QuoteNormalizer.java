package in.fxarena.application.service.price;

import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Validates raw bid/ask pairs and derives mid and spread.
 *
 * Invariants of every quote this class returns:
 * - bid &gt; 0, ask &gt; 0, bid &lt; ask
 * - bid &lt;= mid &lt;= ask
 * - mid and spread recomputed from bid/ask, 5 decimals, HALF_UP
 */
public final class QuoteNormalizer {

    public static final int PRICE_SCALE = 5;

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Why a raw quote was refused.
     */
    public enum Rejection {
        MISSING_SIDE,
        NON_POSITIVE,
        CROSSED
    }

    /**
     * Check a raw bid/ask pair.
     *
     * @return the reason it is unusable, or empty if it is a valid quote
     */
    public static Optional<Rejection> check(BigDecimal bid, BigDecimal ask) {
        if (bid == null || ask == null) {
            return Optional.of(Rejection.MISSING_SIDE);
        }
        if (bid.signum() <= 0 || ask.signum() <= 0) {
            return Optional.of(Rejection.NON_POSITIVE);
        }
        if (bid.compareTo(ask) >= 0) {
            return Optional.of(Rejection.CROSSED);
        }
        return Optional.empty();
    }

    public static boolean isValid(BigDecimal bid, BigDecimal ask) {
        return check(bid, ask).isEmpty();
    }

    /**
     * Build a normalized quote from raw inputs.
     *
     * @return the quote, or empty if bid/ask are missing, non-positive or crossed
     */
    public static Optional<PriceQuote> normalize(String symbol, BigDecimal bid, BigDecimal ask,
                                                 Instant timestamp, PriceSource source) {
        if (symbol == null || timestamp == null || !isValid(bid, ask)) {
            return Optional.empty();
        }
        return Optional.of(new PriceQuote(symbol, bid, ask, mid(bid, ask), spread(bid, ask),
            timestamp, source, false, false));
    }

    /**
     * Recompute mid and spread of an existing quote from its bid/ask.
     *
     * @return the renormalized quote, or empty if its bid/ask are invalid
     */
    public static Optional<PriceQuote> renormalize(PriceQuote quote) {
        if (quote == null || !isValid(quote.bid(), quote.ask())) {
            return Optional.empty();
        }
        return Optional.of(new PriceQuote(quote.symbol(), quote.bid(), quote.ask(),
            mid(quote.bid(), quote.ask()), spread(quote.bid(), quote.ask()),
            quote.timestamp(), quote.source(), quote.stale(), quote.fallback()));
    }

    /**
     * (bid + ask) / 2 rounded to 5 decimals and clamped into [bid, ask].
     */
    public static BigDecimal mid(BigDecimal bid, BigDecimal ask) {
        BigDecimal mid = bid.add(ask).divide(TWO, PRICE_SCALE, RoundingMode.HALF_UP);
        if (mid.compareTo(bid) < 0) {
            return bid;
        }
        if (mid.compareTo(ask) > 0) {
            return ask;
        }
        return mid;
    }

    public static BigDecimal spread(BigDecimal bid, BigDecimal ask) {
        return ask.subtract(bid).abs().setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private QuoteNormalizer() {}
}
