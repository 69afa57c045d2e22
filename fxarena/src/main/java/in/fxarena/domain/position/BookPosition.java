package in.fxarena.domain.position;

import java.math.BigDecimal;

/**
 * An open position inside an account book, with the margin it locks.
 */
public record BookPosition(TrackedPosition position, BigDecimal marginUsed) {
    public BookPosition {
        if (position == null) {
            throw new IllegalArgumentException("position cannot be null");
        }
        if (marginUsed == null) {
            marginUsed = BigDecimal.ZERO;
        }
    }
}
