package in.fxarena.domain.price;

import java.math.BigDecimal;

/**
 * Liquidity class of a currency pair. Drives the default spread used before
 * the first real bid/ask observation.
 */
public enum InstrumentClass {
    MAJOR(new BigDecimal("1.5")),
    CROSS(new BigDecimal("3")),
    EXOTIC(new BigDecimal("40"));

    private final BigDecimal defaultSpreadPips;

    InstrumentClass(BigDecimal defaultSpreadPips) {
        this.defaultSpreadPips = defaultSpreadPips;
    }

    public BigDecimal defaultSpreadPips() {
        return defaultSpreadPips;
    }
}
