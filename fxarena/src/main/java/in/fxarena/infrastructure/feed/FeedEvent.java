package in.fxarena.infrastructure.feed;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One parsed feed message.
 *
 * Fields used per kind:
 * - QUOTE:     symbol, bid, ask, timestamp
 * - AGGREGATE: symbol, close, timestamp (window end)
 * - STATUS:    status, message
 */
public record FeedEvent(
    Kind kind,
    String symbol,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal close,
    Instant timestamp,
    String status,
    String message
) {
    public enum Kind {
        QUOTE,
        AGGREGATE,
        STATUS
    }

    public static FeedEvent quote(String symbol, BigDecimal bid, BigDecimal ask, Instant timestamp) {
        return new FeedEvent(Kind.QUOTE, symbol, bid, ask, null, timestamp, null, null);
    }

    public static FeedEvent aggregate(String symbol, BigDecimal close, Instant timestamp) {
        return new FeedEvent(Kind.AGGREGATE, symbol, null, null, close, timestamp, null, null);
    }

    public static FeedEvent status(String status, String message) {
        return new FeedEvent(Kind.STATUS, null, null, null, null, null, status, message);
    }
}
