package in.fxarena.domain.price;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of tradable pairs plus symbol canonicalization.
 *
 * Feeds spell the same pair several ways ("EUR/USD", "EUR-USD", "EURUSD",
 * "C:EURUSD"). Everything inside the engine uses the slash form.
 */
public final class ForexPairs {

    public static final BigDecimal STANDARD_CONTRACT_SIZE = new BigDecimal("100000");
    public static final BigDecimal STANDARD_PIP = new BigDecimal("0.0001");
    public static final BigDecimal JPY_PIP = new BigDecimal("0.01");

    /** Spread used for a symbol outside the catalog. */
    public static final BigDecimal UNKNOWN_PAIR_SPREAD = new BigDecimal("0.0002");

    private static final Map<String, ForexPair> PAIRS;

    static {
        Map<String, ForexPair> pairs = new LinkedHashMap<>();
        for (String s : List.of("EUR/USD", "GBP/USD", "USD/JPY", "USD/CHF", "AUD/USD", "USD/CAD", "NZD/USD")) {
            pairs.put(s, pair(s, InstrumentClass.MAJOR));
        }
        for (String s : List.of(
                "EUR/GBP", "EUR/JPY", "EUR/CHF", "EUR/AUD", "EUR/CAD", "EUR/NZD",
                "GBP/JPY", "GBP/CHF", "GBP/AUD", "GBP/CAD", "GBP/NZD",
                "AUD/JPY", "AUD/CHF", "AUD/CAD", "AUD/NZD",
                "CAD/JPY", "CAD/CHF",
                "CHF/JPY",
                "NZD/JPY", "NZD/CHF", "NZD/CAD")) {
            pairs.put(s, pair(s, InstrumentClass.CROSS));
        }
        for (String s : List.of("USD/TRY", "USD/ZAR", "USD/MXN", "USD/SGD", "USD/HKD")) {
            pairs.put(s, pair(s, InstrumentClass.EXOTIC));
        }
        PAIRS = Collections.unmodifiableMap(pairs);
    }

    private static ForexPair pair(String symbol, InstrumentClass instrumentClass) {
        BigDecimal pip = symbol.endsWith("/JPY") ? JPY_PIP : STANDARD_PIP;
        return new ForexPair(symbol, pip, STANDARD_CONTRACT_SIZE, instrumentClass);
    }

    public static Optional<ForexPair> find(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PAIRS.get(symbol));
    }

    public static boolean isKnown(String symbol) {
        return symbol != null && PAIRS.containsKey(symbol);
    }

    public static List<String> allSymbols() {
        return new ArrayList<>(PAIRS.keySet());
    }

    /**
     * Contract size for a symbol, standard lot size when unknown.
     */
    public static BigDecimal contractSize(String symbol) {
        return find(symbol).map(ForexPair::contractSize).orElse(STANDARD_CONTRACT_SIZE);
    }

    /**
     * Pip size for a symbol, falling back to the JPY rule for unknown pairs.
     */
    public static BigDecimal pip(String symbol) {
        return find(symbol).map(ForexPair::pip)
            .orElse(symbol != null && symbol.toUpperCase(Locale.ROOT).endsWith("JPY") ? JPY_PIP : STANDARD_PIP);
    }

    /**
     * Default spread for a symbol before any real observation.
     */
    public static BigDecimal defaultSpread(String symbol) {
        return find(symbol).map(ForexPair::defaultSpread).orElse(UNKNOWN_PAIR_SPREAD);
    }

    /**
     * Canonicalize a feed symbol to "BASE/QUOTE".
     *
     * Accepts "EUR/USD", "EUR-USD", "EURUSD", "C:EURUSD" (case-insensitive).
     *
     * @return canonical symbol, or empty if the input cannot be a currency pair
     */
    public static Optional<String> canonicalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String s = raw.trim().toUpperCase(Locale.ROOT);
        int colon = s.indexOf(':');
        if (colon >= 0) {
            s = s.substring(colon + 1);
        }
        s = s.replace("-", "").replace("/", "");
        if (s.length() != 6 || !s.chars().allMatch(Character::isLetter)) {
            return Optional.empty();
        }
        return Optional.of(s.substring(0, 3) + "/" + s.substring(3));
    }

    private ForexPairs() {}
}
