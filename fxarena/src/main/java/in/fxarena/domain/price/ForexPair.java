package in.fxarena.domain.price;

import java.math.BigDecimal;

/**
 * Static instrument data for a tradable currency pair.
 *
 * @param symbol          canonical form, e.g. "EUR/USD"
 * @param pip             one pip in price units (0.0001, or 0.01 for JPY quotes)
 * @param contractSize    units per standard lot
 * @param instrumentClass liquidity class
 */
public record ForexPair(
    String symbol,
    BigDecimal pip,
    BigDecimal contractSize,
    InstrumentClass instrumentClass
) {
    public ForexPair {
        if (symbol == null || pip == null || contractSize == null || instrumentClass == null) {
            throw new IllegalArgumentException("ForexPair fields cannot be null");
        }
    }

    public String baseCurrency() {
        return symbol.substring(0, 3);
    }

    public String quoteCurrency() {
        return symbol.substring(4);
    }

    /**
     * Default spread in price units for this pair's liquidity class.
     */
    public BigDecimal defaultSpread() {
        return instrumentClass.defaultSpreadPips().multiply(pip);
    }
}
