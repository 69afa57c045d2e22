package in.fxarena.domain.position;

import java.math.BigDecimal;
import java.util.List;

/**
 * One participant's open book inside one competition.
 *
 * capital is the participant's current balance (realized P&L already applied).
 * usedMargin is the sum of margin locked by the open positions.
 */
public record AccountBook(
    String userId,
    String contextId,
    BigDecimal capital,
    BigDecimal usedMargin,
    List<BookPosition> positions
) {
    public AccountBook {
        if (userId == null || capital == null) {
            throw new IllegalArgumentException("userId and capital are required");
        }
        if (usedMargin == null) {
            usedMargin = positions == null ? BigDecimal.ZERO : positions.stream()
                .map(BookPosition::marginUsed)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        }
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
