package in.fxarena.application.service.price;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class SpreadEstimatorTest {

    private SpreadEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new SpreadEstimator();
    }

    @Test
    void unobservedSymbol_usesInstrumentDefault() {
        // Major: 1.5 pips of 0.0001
        assertEquals(0, bd("0.00015").compareTo(estimator.spread("EUR/USD")));
        // Cross JPY: 3 pips of 0.01
        assertEquals(0, bd("0.03").compareTo(estimator.spread("EUR/JPY")));
        // Exotic: 40 pips
        assertEquals(0, bd("0.004").compareTo(estimator.spread("USD/ZAR")));
        // Outside the catalog
        assertEquals(0, bd("0.0002").compareTo(estimator.spread("XAU/XAG")));
        assertEquals(0, bd("0.000075").compareTo(estimator.halfSpread("EUR/USD")));
        assertTrue(estimator.observedSpread("EUR/USD").isEmpty());
    }

    @Test
    void firstObservation_isTakenAsIs() {
        estimator.observe("EUR/USD", bd("1.10000"), bd("1.10020"));

        assertEquals(0, bd("0.0002").compareTo(estimator.spread("EUR/USD")));
        assertEquals(1, estimator.trackedSymbols());
    }

    @Test
    void laterObservations_areBlendedWithNormalWeight() {
        estimator.observe("EUR/USD", bd("1.10000"), bd("1.10020"));
        estimator.observe("EUR/USD", bd("1.10000"), bd("1.10040"));

        // 0.3 * 0.0004 + 0.7 * 0.0002
        assertEquals(0, bd("0.00026").compareTo(estimator.spread("EUR/USD")));
    }

    @Test
    void outlierObservation_isDampened() {
        estimator.observe("EUR/USD", bd("1.10000"), bd("1.10020"));
        estimator.observe("EUR/USD", bd("1.10000"), bd("1.10200"));

        // ratio 10 > 5: 0.1 * 0.002 + 0.9 * 0.0002
        assertEquals(0, bd("0.00038").compareTo(estimator.spread("EUR/USD")));
    }

    @Test
    void invalidObservations_areIgnored() {
        estimator.observe("EUR/USD", bd("1.10020"), bd("1.10000"));
        estimator.observe("EUR/USD", bd("1.1"), bd("1.1"));
        estimator.observe("EUR/USD", null, bd("1.1"));
        estimator.observe(null, bd("1.1"), bd("1.2"));

        assertTrue(estimator.observedSpread("EUR/USD").isEmpty());
        assertEquals(0, estimator.trackedSymbols());
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
