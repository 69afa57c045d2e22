package in.fxarena.domain.trade;

import in.fxarena.domain.position.TrackedPosition;

import java.math.BigDecimal;

/**
 * Outcome of a write against the position store.
 *
 * realizedPnl is set for applied closes; position is set for applied opens
 * and modifications.
 */
public record StoreResult(Outcome outcome, String message, BigDecimal realizedPnl, TrackedPosition position) {

    public enum Outcome {
        APPLIED,
        ALREADY_CLOSED,  // Another worker or the user got there first
        REJECTED         // Store refused (not found, invalid state); retrying will not help
    }

    public static StoreResult closed(BigDecimal realizedPnl) {
        return new StoreResult(Outcome.APPLIED, null, realizedPnl, null);
    }

    public static StoreResult applied(TrackedPosition position) {
        return new StoreResult(Outcome.APPLIED, null, null, position);
    }

    public static StoreResult alreadyClosed() {
        return new StoreResult(Outcome.ALREADY_CLOSED, "position already closed", null, null);
    }

    public static StoreResult rejected(String message) {
        return new StoreResult(Outcome.REJECTED, message, null, null);
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }
}
