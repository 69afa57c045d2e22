package in.fxarena.application.service.price;

import in.fxarena.domain.price.ForexPairs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-symbol smoothed bid/ask spread.
 *
 * Used to synthesize a two-sided quote from single-price aggregate events.
 * Until a symbol has a real observation its instrument-class default is
 * served. The first observation is taken as-is; later ones are blended
 * 0.3 new / 0.7 previous, or 0.1 / 0.9 when the new value differs from the
 * previous by more than 5x in either direction.
 */
public final class SpreadEstimator {
    private static final Logger log = LoggerFactory.getLogger(SpreadEstimator.class);

    static final BigDecimal OUTLIER_RATIO = new BigDecimal("5");
    static final BigDecimal NORMAL_WEIGHT = new BigDecimal("0.3");
    static final BigDecimal OUTLIER_WEIGHT = new BigDecimal("0.1");

    private static final int SPREAD_SCALE = 8;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    // Only real observations; defaults are never stored
    private final Map<String, BigDecimal> observed = new ConcurrentHashMap<>();

    /**
     * Feed a real bid/ask observation. Ignored unless bid &gt; 0, ask &gt; 0 and ask &gt; bid.
     */
    public void observe(String symbol, BigDecimal bid, BigDecimal ask) {
        if (symbol == null || !QuoteNormalizer.isValid(bid, ask)) {
            return;
        }
        BigDecimal sample = ask.subtract(bid);
        observed.merge(symbol, sample.setScale(SPREAD_SCALE, RoundingMode.HALF_UP), SpreadEstimator::blend);
    }

    static BigDecimal blend(BigDecimal previous, BigDecimal sample) {
        if (previous.signum() == 0 || sample.signum() == 0) {
            return sample;
        }
        BigDecimal ratio = sample.compareTo(previous) >= 0
            ? sample.divide(previous, MathContext.DECIMAL64)
            : previous.divide(sample, MathContext.DECIMAL64);
        boolean outlier = ratio.compareTo(OUTLIER_RATIO) > 0;
        if (outlier) {
            log.debug("[SPREAD] Outlier sample {} vs {} (ratio {})", sample, previous, ratio);
        }
        BigDecimal weight = outlier ? OUTLIER_WEIGHT : NORMAL_WEIGHT;
        return sample.multiply(weight)
            .add(previous.multiply(BigDecimal.ONE.subtract(weight)))
            .setScale(SPREAD_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Current spread estimate, or the instrument default if never observed.
     */
    public BigDecimal spread(String symbol) {
        BigDecimal value = observed.get(symbol);
        return value != null ? value : ForexPairs.defaultSpread(symbol);
    }

    public BigDecimal halfSpread(String symbol) {
        return spread(symbol).divide(TWO, SPREAD_SCALE, RoundingMode.HALF_UP);
    }

    public Optional<BigDecimal> observedSpread(String symbol) {
        return Optional.ofNullable(observed.get(symbol));
    }

    public int trackedSymbols() {
        return observed.size();
    }
}
