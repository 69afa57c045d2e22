package in.fxarena.application.service.trigger;

import in.fxarena.application.service.price.QuoteNormalizer;
import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.position.Side;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TriggerEvaluatorTest {

    @Test
    void long_stopLossFiresAtOrBelowBid() {
        TrackedPosition p = position(Side.LONG, "1.08000", "1.09000");

        TriggerEvaluator.Trigger t = TriggerEvaluator.evaluate(p, quote("1.08000", "1.08020")).orElseThrow();

        assertEquals(CloseReason.STOP_LOSS, t.reason());
        assertEquals(0, bd("1.08000").compareTo(t.exitPrice()));
    }

    @Test
    void long_takeProfitUsesBidNotAsk() {
        TrackedPosition p = position(Side.LONG, "1.08000", "1.09000");

        // Ask reached TP but bid did not
        assertTrue(TriggerEvaluator.evaluate(p, quote("1.08990", "1.09010")).isEmpty());

        TriggerEvaluator.Trigger t = TriggerEvaluator.evaluate(p, quote("1.09000", "1.09020")).orElseThrow();
        assertEquals(CloseReason.TAKE_PROFIT, t.reason());
        assertEquals(0, bd("1.09000").compareTo(t.exitPrice()));
    }

    @Test
    void short_levelsAreTestedAgainstAsk() {
        TrackedPosition p = position(Side.SHORT, "1.09000", "1.08000");

        assertEquals(CloseReason.STOP_LOSS,
            TriggerEvaluator.evaluate(p, quote("1.08980", "1.09000")).orElseThrow().reason());
        Optional<TriggerEvaluator.Trigger> tp = TriggerEvaluator.evaluate(p, quote("1.07990", "1.08000"));
        assertEquals(CloseReason.TAKE_PROFIT, tp.orElseThrow().reason());
        assertEquals(0, bd("1.08000").compareTo(tp.get().exitPrice()));
        assertTrue(TriggerEvaluator.evaluate(p, quote("1.08400", "1.08420")).isEmpty());
    }

    @Test
    void stopLossWinsWhenBothLevelsAreCrossed() {
        // Inverted bracket: both conditions hold for the same bid
        TrackedPosition p = position(Side.LONG, "1.09000", "1.08000");

        assertEquals(CloseReason.STOP_LOSS,
            TriggerEvaluator.evaluate(p, quote("1.08500", "1.08520")).orElseThrow().reason());
    }

    @Test
    void otherSymbolOrNoLevels_neverFire() {
        TrackedPosition none = position(Side.LONG, null, null);
        assertTrue(TriggerEvaluator.evaluate(none, quote("0.5", "0.6")).isEmpty());

        TrackedPosition gbp = new TrackedPosition("p2", "GBP/USD", Side.LONG, bd("1.3"), bd("1"),
            bd("1.29"), null, "u1", "c1");
        assertTrue(TriggerEvaluator.evaluate(gbp, quote("1.0", "1.1")).isEmpty());
    }

    static TrackedPosition position(Side side, String stopLoss, String takeProfit) {
        return new TrackedPosition("p1", "EUR/USD", side, bd("1.08500"), bd("1"),
            stopLoss != null ? bd(stopLoss) : null, takeProfit != null ? bd(takeProfit) : null, "u1", "c1");
    }

    static PriceQuote quote(String bid, String ask) {
        return QuoteNormalizer.normalize("EUR/USD", bd(bid), bd(ask), Instant.parse("2024-06-10T12:00:00Z"),
            PriceSource.STREAM).orElseThrow();
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
