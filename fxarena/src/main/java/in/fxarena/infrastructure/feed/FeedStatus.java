package in.fxarena.infrastructure.feed;

import java.time.Instant;

/**
 * Point-in-time view of the streaming feed for monitoring.
 *
 * @param lastMessageAt time of the last message received, or null if none yet
 */
public record FeedStatus(
    StreamConnectionState state,
    int reconnectAttempts,
    Instant lastMessageAt,
    long quotesReceived,
    boolean healthy
) {
}
