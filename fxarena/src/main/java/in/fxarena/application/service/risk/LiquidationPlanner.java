package in.fxarena.application.service.risk;

import in.fxarena.domain.position.AccountBook;
import in.fxarena.domain.position.BookPosition;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.risk.LiquidationPlan;
import in.fxarena.domain.risk.LiquidationPlan.PlannedClose;
import in.fxarena.domain.risk.MarginSnapshot;
import in.fxarena.domain.risk.MarginStatus;
import in.fxarena.domain.risk.RiskThresholds;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Chooses which positions to force-close for a book in liquidation.
 *
 * Order: largest unrealized loss first (ties by position id). Closing turns
 * unrealized P&L into realized, so equity is unchanged while used margin
 * shrinks; the planner stops as soon as the projected margin level is back
 * at or above the liquidation threshold. Positions without a current quote
 * cannot be priced and are never planned.
 */
public final class LiquidationPlanner {

    private static final Comparator<PlannedClose> LARGEST_LOSS_FIRST =
        Comparator.comparing(PlannedClose::unrealizedPnl)
            .thenComparing(c -> c.position().position().positionId());

    public static LiquidationPlan plan(AccountBook book, Map<String, PriceQuote> prices, RiskThresholds thresholds) {
        MarginSnapshot snapshot = RiskCalculator.marginSnapshot(book, prices, thresholds);
        if (snapshot.status() != MarginStatus.LIQUIDATION) {
            return new LiquidationPlan(book.userId(), book.contextId(), List.of(), snapshot.marginLevel());
        }

        List<PlannedClose> candidates = new ArrayList<>();
        for (BookPosition bp : book.positions()) {
            PriceQuote quote = prices.get(bp.position().symbol());
            if (quote == null) {
                continue;
            }
            candidates.add(new PlannedClose(bp,
                RiskCalculator.closePrice(bp.position().side(), quote),
                RiskCalculator.unrealizedPnl(bp.position(), quote)));
        }
        candidates.sort(LARGEST_LOSS_FIRST);

        BigDecimal equity = snapshot.equity();
        BigDecimal usedMargin = book.usedMargin();
        double level = snapshot.marginLevel();
        List<PlannedClose> closes = new ArrayList<>();

        for (PlannedClose candidate : candidates) {
            if (level >= thresholds.liquidation()) {
                break;
            }
            closes.add(candidate);
            usedMargin = usedMargin.subtract(candidate.position().marginUsed()).max(BigDecimal.ZERO);
            level = RiskCalculator.marginLevel(equity, usedMargin);
        }

        return new LiquidationPlan(book.userId(), book.contextId(), closes, level);
    }

    private LiquidationPlanner() {}
}
