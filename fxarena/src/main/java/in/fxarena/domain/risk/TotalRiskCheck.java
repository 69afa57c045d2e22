package in.fxarena.domain.risk;

import java.math.BigDecimal;

/**
 * Result of summing stop-loss risk across a book.
 *
 * @param totalRiskPercent risk as a percentage of capital, 2 decimals
 */
public record TotalRiskCheck(boolean valid, BigDecimal totalRiskPercent, String error) {
}
