package in.fxarena.domain.risk;

import java.math.BigDecimal;

/**
 * Derived margin view of an account book. Never stored.
 *
 * marginLevel is a percentage and is {@link Double#POSITIVE_INFINITY} when no
 * margin is in use.
 */
public record MarginSnapshot(
    BigDecimal equity,
    BigDecimal usedMargin,
    double marginLevel,
    MarginStatus status,
    String message
) {
    public boolean hasOpenExposure() {
        return !Double.isInfinite(marginLevel);
    }
}
