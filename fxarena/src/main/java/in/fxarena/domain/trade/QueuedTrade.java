package in.fxarena.domain.trade;

import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.position.TrackedPosition;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Unit of work for the settlement worker.
 *
 * The payload is a flat string map so it survives a JSON round trip through
 * the durable queue unchanged. Well-known keys are the PAYLOAD_* constants.
 */
public record QueuedTrade(
    String id,
    String userId,
    String positionId,
    TradeAction action,
    Map<String, String> payload,
    Instant timestamp,
    int retries
) {
    public static final String PAYLOAD_SYMBOL = "symbol";
    public static final String PAYLOAD_SIDE = "side";
    public static final String PAYLOAD_EXIT_PRICE = "exitPrice";
    public static final String PAYLOAD_REASON = "reason";
    public static final String PAYLOAD_CONTEXT_ID = "contextId";
    public static final String PAYLOAD_ENTRY_PRICE = "entryPrice";
    public static final String PAYLOAD_QUANTITY = "quantity";
    public static final String PAYLOAD_LEVERAGE = "leverage";
    public static final String PAYLOAD_STOP_LOSS = "stopLoss";
    public static final String PAYLOAD_TAKE_PROFIT = "takeProfit";

    public QueuedTrade {
        if (id == null || action == null || timestamp == null) {
            throw new IllegalArgumentException("id, action and timestamp are required");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries cannot be negative");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    /**
     * Close request for a position whose exit level was crossed.
     */
    public static QueuedTrade close(TrackedPosition position, BigDecimal exitPrice, CloseReason reason, Instant now) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(PAYLOAD_SYMBOL, position.symbol());
        payload.put(PAYLOAD_SIDE, position.side().wireValue());
        payload.put(PAYLOAD_EXIT_PRICE, exitPrice.toPlainString());
        payload.put(PAYLOAD_REASON, reason.code());
        if (position.contextId() != null) {
            payload.put(PAYLOAD_CONTEXT_ID, position.contextId());
        }
        return new QueuedTrade(UUID.randomUUID().toString(), position.userId(), position.positionId(),
            TradeAction.CLOSE, payload, now, 0);
    }

    public static QueuedTrade of(String userId, String positionId, TradeAction action,
                                 Map<String, String> payload, Instant now) {
        return new QueuedTrade(UUID.randomUUID().toString(), userId, positionId, action, payload, now, 0);
    }

    public QueuedTrade withRetries(int newRetries) {
        return new QueuedTrade(id, userId, positionId, action, payload, timestamp, newRetries);
    }

    public Optional<String> payloadValue(String key) {
        return Optional.ofNullable(payload.get(key));
    }

    public Optional<BigDecimal> payloadDecimal(String key) {
        String value = payload.get(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Payload field " + key + " is not a number: " + value, e);
        }
    }
}
