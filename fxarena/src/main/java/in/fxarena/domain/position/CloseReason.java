package in.fxarena.domain.position;

/**
 * Why the engine closed a position.
 */
public enum CloseReason {
    STOP_LOSS("stop_loss"),
    TAKE_PROFIT("take_profit"),
    MARGIN_CALL("margin_call");

    private final String code;

    CloseReason(String code) {
        this.code = code;
    }

    /** Value persisted in the position store and queue payloads. */
    public String code() {
        return code;
    }

    public static CloseReason fromCode(String code) {
        for (CloseReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code) || reason.name().equalsIgnoreCase(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown close reason: " + code);
    }
}
