package in.fxarena.infrastructure.feed;

import java.util.Locale;

/**
 * Lifecycle of the process-wide feed subscription.
 *
 * DISCONNECTED → CONNECTING → AUTHENTICATING → SUBSCRIBED, back to
 * DISCONNECTED on any drop. DISABLED is terminal: reconnect attempts are
 * exhausted and prices come from the fetch and fallback tiers only.
 */
public enum StreamConnectionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    SUBSCRIBED,
    DISABLED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
