package in.fxarena.domain.risk;

import java.util.Locale;

/**
 * Health of an account book, ordered from healthiest to worst.
 */
public enum MarginStatus {
    SAFE,
    WARNING,
    DANGER,       // Margin call
    LIQUIDATION;

    public boolean isAtLeast(MarginStatus other) {
        return ordinal() >= other.ordinal();
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
