package in.fxarena.application.service.risk;

import in.fxarena.application.service.price.QuoteNormalizer;
import in.fxarena.domain.position.AccountBook;
import in.fxarena.domain.position.BookPosition;
import in.fxarena.domain.position.Side;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;
import in.fxarena.domain.risk.LiquidationPlan;
import in.fxarena.domain.risk.RiskThresholds;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LiquidationPlannerTest {

    private static final Instant TS = Instant.parse("2024-06-10T12:00:00Z");

    // EUR/USD long, -500 at the bid
    private final BookPosition eur = book("p-eur", "EUR/USD", Side.LONG, "1.10000", "1", "500");
    // GBP/USD long, -200 at the bid
    private final BookPosition gbp = book("p-gbp", "GBP/USD", Side.LONG, "1.30000", "1", "500");
    // USD/CHF short, +10 at the ask
    private final BookPosition chf = book("p-chf", "USD/CHF", Side.SHORT, "0.90000", "0.1", "100");

    private Map<String, PriceQuote> prices() {
        Map<String, PriceQuote> prices = new HashMap<>();
        prices.put("EUR/USD", quote("EUR/USD", "1.09500", "1.09510"));
        prices.put("GBP/USD", quote("GBP/USD", "1.29800", "1.29815"));
        prices.put("USD/CHF", quote("USD/CHF", "0.89890", "0.89900"));
        return prices;
    }

    @Test
    void closesLargestLossFirstAndStopsOnceAboveThreshold() {
        // equity 1000 - 690 = 310, used 1100, level 28.18
        AccountBook book = new AccountBook("u1", "c1", bd("1000"), null, List.of(chf, gbp, eur));

        LiquidationPlan plan = LiquidationPlanner.plan(book, prices(), RiskThresholds.defaults());

        assertEquals(1, plan.closes().size());
        LiquidationPlan.PlannedClose close = plan.closes().get(0);
        assertEquals("p-eur", close.position().position().positionId());
        assertEquals(bd("1.09500"), close.exitPrice());
        assertEquals(bd("-500.00"), close.unrealizedPnl());
        // 310 / 600
        assertEquals(51.67, plan.projectedMarginLevel());
    }

    @Test
    void keepsClosingUntilLevelRecovers() {
        // equity 800 - 690 = 110
        AccountBook book = new AccountBook("u1", "c1", bd("800"), null, List.of(eur, gbp, chf));

        LiquidationPlan plan = LiquidationPlanner.plan(book, prices(), RiskThresholds.defaults());

        assertEquals(List.of("p-eur", "p-gbp"),
            plan.closes().stream().map(c -> c.position().position().positionId()).toList());
        assertEquals(110.0, plan.projectedMarginLevel());
    }

    @Test
    void healthyBook_hasNothingToClose() {
        AccountBook book = new AccountBook("u1", "c1", bd("10000"), null, List.of(eur, gbp, chf));

        LiquidationPlan plan = LiquidationPlanner.plan(book, prices(), RiskThresholds.defaults());

        assertTrue(plan.isEmpty());
    }

    @Test
    void positionsWithoutQuote_areNeverPlanned() {
        Map<String, PriceQuote> prices = prices();
        prices.remove("EUR/USD");
        // equity 500 - 200 + 10 = 310, used 1100
        AccountBook book = new AccountBook("u1", "c1", bd("500"), null, List.of(eur, gbp, chf));

        LiquidationPlan plan = LiquidationPlanner.plan(book, prices, RiskThresholds.defaults());

        assertFalse(plan.isEmpty());
        assertTrue(plan.closes().stream().noneMatch(c -> c.position().position().positionId().equals("p-eur")));
        assertEquals("p-gbp", plan.closes().get(0).position().position().positionId());
    }

    private static BookPosition book(String id, String symbol, Side side, String entry, String qty, String margin) {
        TrackedPosition p = new TrackedPosition(id, symbol, side, bd(entry), bd(qty), null, null, "u1", "c1");
        return new BookPosition(p, bd(margin));
    }

    private static PriceQuote quote(String symbol, String bid, String ask) {
        return QuoteNormalizer.normalize(symbol, bd(bid), bd(ask), TS, PriceSource.STREAM).orElseThrow();
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
