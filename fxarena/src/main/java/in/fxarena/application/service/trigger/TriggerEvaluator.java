package in.fxarena.application.service.trigger;

import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.position.Side;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.price.PriceQuote;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Decides whether a quote crosses a position's exit levels.
 *
 * Long positions are tested against the bid, shorts against the ask:
 * <pre>
 *   LONG : SL if bid &lt;= SL, TP if bid &gt;= TP
 *   SHORT: SL if ask &gt;= SL, TP if ask &lt;= TP
 * </pre>
 * If both levels are crossed by the same quote the stop-loss wins.
 */
public final class TriggerEvaluator {

    /**
     * @param reason    which level fired
     * @param exitPrice price the close should settle at (the tested side)
     */
    public record Trigger(CloseReason reason, BigDecimal exitPrice) {}

    public static Optional<Trigger> evaluate(TrackedPosition position, PriceQuote quote) {
        if (!position.symbol().equals(quote.symbol())) {
            return Optional.empty();
        }
        BigDecimal stopLoss = position.stopLoss();
        BigDecimal takeProfit = position.takeProfit();

        if (position.side() == Side.LONG) {
            BigDecimal bid = quote.bid();
            if (stopLoss != null && bid.compareTo(stopLoss) <= 0) {
                return Optional.of(new Trigger(CloseReason.STOP_LOSS, bid));
            }
            if (takeProfit != null && bid.compareTo(takeProfit) >= 0) {
                return Optional.of(new Trigger(CloseReason.TAKE_PROFIT, bid));
            }
        } else {
            BigDecimal ask = quote.ask();
            if (stopLoss != null && ask.compareTo(stopLoss) >= 0) {
                return Optional.of(new Trigger(CloseReason.STOP_LOSS, ask));
            }
            if (takeProfit != null && ask.compareTo(takeProfit) <= 0) {
                return Optional.of(new Trigger(CloseReason.TAKE_PROFIT, ask));
            }
        }
        return Optional.empty();
    }

    private TriggerEvaluator() {}
}
