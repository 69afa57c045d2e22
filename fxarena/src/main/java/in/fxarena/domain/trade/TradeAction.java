package in.fxarena.domain.trade;

/**
 * What a queued trade asks the settlement worker to do.
 */
public enum TradeAction {
    OPEN,
    CLOSE,
    MODIFY
}
