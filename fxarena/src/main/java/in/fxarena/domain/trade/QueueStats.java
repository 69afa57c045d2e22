package in.fxarena.domain.trade;

/**
 * Queue depth snapshot.
 */
public record QueueStats(long pending, long processing) {
}
