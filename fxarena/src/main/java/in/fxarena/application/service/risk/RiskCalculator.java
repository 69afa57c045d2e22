package in.fxarena.application.service.risk;

import in.fxarena.domain.position.AccountBook;
import in.fxarena.domain.position.BookPosition;
import in.fxarena.domain.position.Side;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.price.ForexPairs;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.risk.MarginSnapshot;
import in.fxarena.domain.risk.MarginStatus;
import in.fxarena.domain.risk.OrderRejection;
import in.fxarena.domain.risk.OrderRequest;
import in.fxarena.domain.risk.OrderValidationResult;
import in.fxarena.domain.risk.RiskThresholds;
import in.fxarena.domain.risk.TotalRiskCheck;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Risk Calculator - margin, equity and liquidation arithmetic.
 *
 * Pure functions only: no I/O, no clock, no shared state.
 *
 * Core formulas:
 * - unrealized = (current - entry) × qty × contractSize   (long; sign flipped for short)
 * - equity = capital + Σ unrealized
 * - marginLevel = equity / usedMargin × 100   (+∞ when usedMargin = 0)
 * - liquidationPrice = entry ∓ marginUsed / (qty × contractSize)
 *
 * Money is rounded to 2 decimals, prices to 5, margin level to 2.
 */
public final class RiskCalculator {

    private static final BigDecimal ZERO = BigDecimal.ZERO;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal LOT_STEP = new BigDecimal("0.01");
    private static final BigDecimal POSITION_COUNT_WARNING_RATIO = new BigDecimal("0.8");

    public static final BigDecimal MIN_LOT = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_MAX_TOTAL_RISK_PERCENT = BigDecimal.TEN;

    private static final int MONEY_SCALE = 2;
    private static final int PRICE_SCALE = 5;

    // ═══════════════════════════════════════════════════════════════
    // P&L
    // ═══════════════════════════════════════════════════════════════

    /**
     * Unrealized P&L of a position at a given price.
     *
     * @param quantity     lots
     * @param contractSize units per lot
     * @return P&L in account currency, 2 decimals
     */
    public static BigDecimal unrealizedPnl(Side side, BigDecimal entryPrice, BigDecimal currentPrice,
                                           BigDecimal quantity, BigDecimal contractSize) {
        BigDecimal priceChange = side == Side.LONG
            ? currentPrice.subtract(entryPrice)
            : entryPrice.subtract(currentPrice);
        return priceChange.multiply(quantity).multiply(contractSize).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Unrealized P&L marked at the side a close would execute on
     * (long at bid, short at ask).
     */
    public static BigDecimal unrealizedPnl(TrackedPosition position, PriceQuote quote) {
        return unrealizedPnl(position.side(), position.entryPrice(), closePrice(position.side(), quote),
            position.quantity(), ForexPairs.contractSize(position.symbol()));
    }

    /**
     * Price a position of this side closes at: bid for long, ask for short.
     */
    public static BigDecimal closePrice(Side side, PriceQuote quote) {
        return side == Side.LONG ? quote.bid() : quote.ask();
    }

    /**
     * P&L as a percentage of the margin it used. 0 when no margin.
     */
    public static BigDecimal pnlPercent(BigDecimal pnl, BigDecimal marginUsed) {
        if (marginUsed.signum() == 0) {
            return ZERO.setScale(MONEY_SCALE);
        }
        return pnl.multiply(HUNDRED).divide(marginUsed, MONEY_SCALE, RoundingMode.HALF_UP);
    }

    // ═══════════════════════════════════════════════════════════════
    // Margin
    // ═══════════════════════════════════════════════════════════════

    /**
     * Margin locked by opening qty lots at price with 1:leverage.
     */
    public static BigDecimal marginRequired(BigDecimal quantity, BigDecimal price, int leverage,
                                            BigDecimal contractSize) {
        if (leverage <= 0) {
            throw new IllegalArgumentException("leverage must be positive: " + leverage);
        }
        return quantity.multiply(contractSize).multiply(price)
            .divide(BigDecimal.valueOf(leverage), MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal equity(BigDecimal capital, BigDecimal totalUnrealizedPnl) {
        return capital.add(totalUnrealizedPnl).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Margin level percentage, 2 decimals. +∞ when no margin is used.
     */
    public static double marginLevel(BigDecimal equity, BigDecimal usedMargin) {
        if (usedMargin.signum() == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return equity.multiply(HUNDRED)
            .divide(usedMargin, MONEY_SCALE, RoundingMode.HALF_UP)
            .doubleValue();
    }

    /**
     * Classify a margin level. Each bound is exclusive: a level exactly at a
     * threshold belongs to the healthier band.
     */
    public static MarginStatus marginStatus(double marginLevel, RiskThresholds thresholds) {
        if (marginLevel < thresholds.liquidation()) {
            return MarginStatus.LIQUIDATION;
        }
        if (marginLevel < thresholds.marginCall()) {
            return MarginStatus.DANGER;
        }
        if (marginLevel < thresholds.warning()) {
            return MarginStatus.WARNING;
        }
        return MarginStatus.SAFE;
    }

    /**
     * Full margin view for a book.
     */
    public static MarginSnapshot marginSnapshot(BigDecimal capital, BigDecimal totalUnrealizedPnl,
                                                BigDecimal usedMargin, RiskThresholds thresholds) {
        BigDecimal equity = equity(capital, totalUnrealizedPnl);
        double level = marginLevel(equity, usedMargin);
        MarginStatus status = marginStatus(level, thresholds);
        return new MarginSnapshot(equity, usedMargin, level, status, statusMessage(status, thresholds));
    }

    /**
     * Margin view of a book marked against current quotes. Positions without
     * a quote contribute no unrealized P&L.
     */
    public static MarginSnapshot marginSnapshot(AccountBook book, Map<String, PriceQuote> prices,
                                                RiskThresholds thresholds) {
        return marginSnapshot(book.capital(), totalUnrealizedPnl(book, prices), book.usedMargin(), thresholds);
    }

    public static BigDecimal totalUnrealizedPnl(AccountBook book, Map<String, PriceQuote> prices) {
        BigDecimal total = ZERO;
        for (BookPosition bp : book.positions()) {
            PriceQuote quote = prices.get(bp.position().symbol());
            if (quote != null) {
                total = total.add(unrealizedPnl(bp.position(), quote));
            }
        }
        return total;
    }

    public static String statusMessage(MarginStatus status, RiskThresholds thresholds) {
        return switch (status) {
            case LIQUIDATION -> "LIQUIDATION: Margin level below " + percent(thresholds.liquidation())
                + " - positions will be closed automatically";
            case DANGER -> "MARGIN CALL: Margin level below " + percent(thresholds.marginCall())
                + " - add capital or close positions to avoid liquidation";
            case WARNING -> "WARNING: Margin level below " + percent(thresholds.warning())
                + " - consider reducing position sizes";
            case SAFE -> "Margin level healthy";
        };
    }

    /**
     * Price at which the position's loss equals the margin it uses, 5 decimals.
     */
    public static BigDecimal liquidationPrice(Side side, BigDecimal entryPrice, BigDecimal quantity,
                                              BigDecimal marginUsed, BigDecimal contractSize) {
        BigDecimal priceMove = marginUsed.divide(quantity.multiply(contractSize), MathContext.DECIMAL64);
        BigDecimal price = side == Side.LONG ? entryPrice.subtract(priceMove) : entryPrice.add(priceMove);
        return price.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Liquidation price for a position opened at 1:leverage. The margin used
     * already carries the leverage, so the price is the same as the
     * leverage-free form; the leverage is only validated.
     */
    public static BigDecimal liquidationPrice(Side side, BigDecimal entryPrice, BigDecimal quantity,
                                              BigDecimal marginUsed, int leverage, BigDecimal contractSize) {
        if (leverage <= 0) {
            throw new IllegalArgumentException("leverage must be positive: " + leverage);
        }
        return liquidationPrice(side, entryPrice, quantity, marginUsed, contractSize);
    }

    // ═══════════════════════════════════════════════════════════════
    // Order validation
    // ═══════════════════════════════════════════════════════════════

    /**
     * Decide whether a new order may be placed.
     *
     * Checked in order: capital, open position count, lot size, leverage.
     * The first failing check wins.
     */
    public static OrderValidationResult validateNewOrder(OrderRequest order, RiskThresholds limits) {
        if (order.marginRequired().compareTo(order.availableCapital()) > 0) {
            return OrderValidationResult.reject(OrderRejection.INSUFFICIENT_CAPITAL, String.format(
                "Insufficient capital. Need $%s, available $%s",
                money(order.marginRequired()), money(order.availableCapital())));
        }
        if (order.currentOpenPositions() >= limits.maxOpenPositions()) {
            return OrderValidationResult.reject(OrderRejection.MAX_OPEN_POSITIONS,
                "Maximum " + limits.maxOpenPositions() + " open positions allowed");
        }
        if (order.quantity().compareTo(limits.maxLotSize()) > 0) {
            return OrderValidationResult.reject(OrderRejection.MAX_LOT_SIZE,
                "Maximum position size is " + limits.maxLotSize().stripTrailingZeros().toPlainString() + " lots");
        }
        if (order.leverage() > limits.maxLeverage()) {
            return OrderValidationResult.reject(OrderRejection.MAX_LEVERAGE,
                "Maximum leverage is 1:" + limits.maxLeverage());
        }
        return OrderValidationResult.ok();
    }

    /**
     * Lot size must lie in [minLot, maxLot] and be a multiple of 0.01.
     */
    public static OrderValidationResult validateQuantity(BigDecimal quantity, BigDecimal minLot, BigDecimal maxLot) {
        if (quantity.compareTo(minLot) < 0) {
            return OrderValidationResult.reject(OrderRejection.INVALID_QUANTITY,
                "Minimum lot size is " + minLot.stripTrailingZeros().toPlainString());
        }
        if (quantity.compareTo(maxLot) > 0) {
            return OrderValidationResult.reject(OrderRejection.INVALID_QUANTITY,
                "Maximum lot size is " + maxLot.stripTrailingZeros().toPlainString());
        }
        if (quantity.remainder(LOT_STEP).signum() != 0) {
            return OrderValidationResult.reject(OrderRejection.INVALID_QUANTITY,
                "Lot size must be in increments of 0.01");
        }
        return OrderValidationResult.ok();
    }

    /**
     * Exit levels must sit on the losing/winning side of entry: for a long,
     * SL below and TP above; mirrored for a short. Null levels are allowed.
     */
    public static OrderValidationResult validateExitLevels(Side side, BigDecimal entryPrice,
                                                           BigDecimal stopLoss, BigDecimal takeProfit) {
        if (side == Side.LONG) {
            if (stopLoss != null && stopLoss.compareTo(entryPrice) >= 0) {
                return OrderValidationResult.reject(OrderRejection.INVALID_EXIT_LEVELS,
                    "Stop loss must be below entry price for long positions");
            }
            if (takeProfit != null && takeProfit.compareTo(entryPrice) <= 0) {
                return OrderValidationResult.reject(OrderRejection.INVALID_EXIT_LEVELS,
                    "Take profit must be above entry price for long positions");
            }
        } else {
            if (stopLoss != null && stopLoss.compareTo(entryPrice) <= 0) {
                return OrderValidationResult.reject(OrderRejection.INVALID_EXIT_LEVELS,
                    "Stop loss must be above entry price for short positions");
            }
            if (takeProfit != null && takeProfit.compareTo(entryPrice) >= 0) {
                return OrderValidationResult.reject(OrderRejection.INVALID_EXIT_LEVELS,
                    "Take profit must be below entry price for short positions");
            }
        }
        return OrderValidationResult.ok();
    }

    // ═══════════════════════════════════════════════════════════════
    // Sizing helpers
    // ═══════════════════════════════════════════════════════════════

    /**
     * Largest lot size the capital can carry at this leverage, floored to
     * 0.01 lots and capped at maxLotSize.
     */
    public static BigDecimal maxPositionSize(BigDecimal availableCapital, BigDecimal entryPrice, int leverage,
                                             BigDecimal contractSize, BigDecimal maxLotSize) {
        if (entryPrice.signum() <= 0 || availableCapital.signum() <= 0) {
            return ZERO.setScale(2);
        }
        BigDecimal maxValue = availableCapital.multiply(BigDecimal.valueOf(leverage));
        BigDecimal lots = maxValue.divide(entryPrice.multiply(contractSize), 2, RoundingMode.FLOOR);
        return lots.min(maxLotSize);
    }

    /**
     * One pip of movement in account currency, 2 decimals.
     */
    public static BigDecimal pipValue(BigDecimal quantity, String symbol) {
        return ForexPairs.pip(symbol).multiply(quantity).multiply(ForexPairs.contractSize(symbol))
            .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Absolute distance between two prices in pips, 1 decimal.
     */
    public static BigDecimal pipsMoved(BigDecimal entryPrice, BigDecimal currentPrice, String symbol) {
        return currentPrice.subtract(entryPrice).abs()
            .divide(ForexPairs.pip(symbol), 1, RoundingMode.HALF_UP);
    }

    /**
     * Stop-loss price that risks riskPercent of capital on this position.
     */
    public static BigDecimal recommendedStopLoss(BigDecimal entryPrice, Side side, BigDecimal riskPercent,
                                                 BigDecimal capital, BigDecimal quantity, BigDecimal contractSize) {
        BigDecimal riskAmount = capital.multiply(riskPercent).divide(HUNDRED, MathContext.DECIMAL64);
        BigDecimal priceMove = riskAmount.divide(quantity.multiply(contractSize), MathContext.DECIMAL64);
        BigDecimal stop = side == Side.LONG ? entryPrice.subtract(priceMove) : entryPrice.add(priceMove);
        return stop.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Loss at the stop as a percentage of capital, 2 decimals.
     */
    public static BigDecimal positionRiskPercent(BigDecimal entryPrice, BigDecimal stopLoss, BigDecimal quantity,
                                                 BigDecimal capital, BigDecimal contractSize) {
        BigDecimal potentialLoss = entryPrice.subtract(stopLoss).abs().multiply(quantity).multiply(contractSize);
        return potentialLoss.multiply(HUNDRED).divide(capital, MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Sum stop-loss risk over positions that have a stop. Positions without a
     * stop are not counted.
     */
    public static TotalRiskCheck validateTotalRisk(List<TrackedPosition> positions, BigDecimal capital,
                                                   BigDecimal maxTotalRiskPercent) {
        BigDecimal total = ZERO;
        for (TrackedPosition p : positions) {
            if (p.stopLoss() == null) {
                continue;
            }
            total = total.add(positionRiskPercent(p.entryPrice(), p.stopLoss(), p.quantity(), capital,
                ForexPairs.contractSize(p.symbol())));
        }
        total = total.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        if (total.compareTo(maxTotalRiskPercent) > 0) {
            return new TotalRiskCheck(false, total, String.format("Total risk %s%% exceeds maximum %s%%",
                total.setScale(1, RoundingMode.HALF_UP).toPlainString(),
                maxTotalRiskPercent.stripTrailingZeros().toPlainString()));
        }
        return new TotalRiskCheck(true, total, null);
    }

    /**
     * Reward/risk ratio of a bracket, 2 decimals. 0 when SL equals entry.
     */
    public static BigDecimal riskRewardRatio(BigDecimal entryPrice, BigDecimal stopLoss, BigDecimal takeProfit) {
        BigDecimal risk = entryPrice.subtract(stopLoss).abs();
        if (risk.signum() == 0) {
            return ZERO.setScale(MONEY_SCALE);
        }
        return takeProfit.subtract(entryPrice).abs().divide(risk, MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Human-readable warnings for a participant dashboard.
     */
    public static List<String> riskWarnings(MarginStatus status, int openPositions, int maxPositions) {
        List<String> warnings = new ArrayList<>();
        switch (status) {
            case LIQUIDATION -> warnings.add("CRITICAL: Liquidation imminent! Close positions immediately");
            case DANGER -> warnings.add("Margin call: Your positions may be liquidated");
            case WARNING -> warnings.add("Low margin level: Consider reducing risk");
            case SAFE -> { }
        }
        if (BigDecimal.valueOf(openPositions)
                .compareTo(BigDecimal.valueOf(maxPositions).multiply(POSITION_COUNT_WARNING_RATIO)) >= 0) {
            warnings.add("High position count: " + openPositions + "/" + maxPositions + " positions open");
        }
        return warnings;
    }

    private static String money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(double threshold) {
        if (threshold == Math.rint(threshold)) {
            return (long) threshold + "%";
        }
        return threshold + "%";
    }

    private RiskCalculator() {}
}
