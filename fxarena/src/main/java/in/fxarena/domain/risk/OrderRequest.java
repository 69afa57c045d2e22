package in.fxarena.domain.risk;

import java.math.BigDecimal;

/**
 * Inputs needed to decide whether a new order may be placed.
 *
 * @param availableCapital     capital not tied up in margin
 * @param marginRequired       margin the new order would lock
 * @param currentOpenPositions positions already open in the book
 * @param quantity             lots
 * @param leverage             requested leverage (1:N)
 */
public record OrderRequest(
    BigDecimal availableCapital,
    BigDecimal marginRequired,
    int currentOpenPositions,
    BigDecimal quantity,
    int leverage
) {
    public OrderRequest {
        if (availableCapital == null || marginRequired == null || quantity == null) {
            throw new IllegalArgumentException("availableCapital, marginRequired and quantity are required");
        }
    }
}
