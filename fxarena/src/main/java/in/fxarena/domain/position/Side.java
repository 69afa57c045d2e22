package in.fxarena.domain.position;

import java.util.Locale;

/**
 * Position direction. A long closes at the bid, a short closes at the ask.
 */
public enum Side {
    LONG,
    SHORT;

    /**
     * Parse a store or wire value ("long", "buy", "SHORT", "sell").
     */
    public static Side parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "LONG", "BUY" -> LONG;
            case "SHORT", "SELL" -> SHORT;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
