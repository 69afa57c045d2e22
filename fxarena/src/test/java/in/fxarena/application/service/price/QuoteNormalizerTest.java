package in.fxarena.application.service.price;

import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QuoteNormalizerTest {

    private static final Instant TS = Instant.parse("2024-06-10T12:00:00Z");

    @Test
    void normalize_derivesMidAndSpread() {
        PriceQuote q = QuoteNormalizer.normalize("EUR/USD", bd("1.08410"), bd("1.08430"), TS, PriceSource.STREAM)
            .orElseThrow();

        assertEquals(0, bd("1.08420").compareTo(q.mid()));
        assertEquals(0, bd("0.00020").compareTo(q.spread()));
        assertEquals(5, q.mid().scale());
        assertEquals(PriceSource.STREAM, q.source());
        assertFalse(q.stale());
        assertFalse(q.fallback());
    }

    @Test
    void mid_roundsHalfUpAndStaysInsideTheQuote() {
        // (1.000001 + 1.000002) / 2 = 1.0000015 -> 1.00000, clamped up to bid
        BigDecimal bid = bd("1.000001");
        BigDecimal ask = bd("1.000002");
        BigDecimal mid = QuoteNormalizer.mid(bid, ask);

        assertTrue(mid.compareTo(bid) >= 0);
        assertTrue(mid.compareTo(ask) <= 0);
        assertEquals(0, bd("1.00001").compareTo(QuoteNormalizer.mid(bd("1.00000"), bd("1.00001"))));
    }

    @Test
    void check_reportsWhyAQuoteIsUnusable() {
        assertEquals(Optional.of(QuoteNormalizer.Rejection.MISSING_SIDE), QuoteNormalizer.check(null, bd("1.1")));
        assertEquals(Optional.of(QuoteNormalizer.Rejection.NON_POSITIVE), QuoteNormalizer.check(bd("0"), bd("1.1")));
        assertEquals(Optional.of(QuoteNormalizer.Rejection.NON_POSITIVE), QuoteNormalizer.check(bd("1.1"), bd("-1")));
        assertEquals(Optional.of(QuoteNormalizer.Rejection.CROSSED), QuoteNormalizer.check(bd("1.2"), bd("1.1")));
        assertEquals(Optional.of(QuoteNormalizer.Rejection.CROSSED), QuoteNormalizer.check(bd("1.1"), bd("1.1")));
        assertTrue(QuoteNormalizer.check(bd("1.1"), bd("1.2")).isEmpty());
    }

    @Test
    void normalize_rejectsCrossedAndLockedQuotes() {
        assertTrue(QuoteNormalizer.normalize("EUR/USD", bd("1.1"), bd("1.1"), TS, PriceSource.STREAM).isEmpty());
        assertTrue(QuoteNormalizer.normalize("EUR/USD", bd("1.2"), bd("1.1"), TS, PriceSource.STREAM).isEmpty());
        assertTrue(QuoteNormalizer.normalize(null, bd("1.1"), bd("1.2"), TS, PriceSource.STREAM).isEmpty());
    }

    @Test
    void renormalize_recomputesDerivedFieldsAndKeepsFlags() {
        PriceQuote tampered = new PriceQuote("GBP/USD", bd("1.27000"), bd("1.27040"), bd("9"), bd("9"),
            TS, PriceSource.CACHED, true, true);

        PriceQuote q = QuoteNormalizer.renormalize(tampered).orElseThrow();

        assertEquals(0, bd("1.27020").compareTo(q.mid()));
        assertEquals(0, bd("0.00040").compareTo(q.spread()));
        assertTrue(q.stale());
        assertTrue(q.fallback());
        assertEquals(PriceSource.CACHED, q.source());
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
