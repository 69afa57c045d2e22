package in.fxarena.infrastructure.feed;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reconnect backoff for the streaming price feed.
 *
 * The delay before attempt n (1-based) is
 * {@code initialDelay × multiplier^(n-1)}, capped at maxDelay. Up to
 * maxAttempts reconnects are made; a connection lost after the last of them
 * exhausts the policy and streaming stays off for the life of the process.
 * A successful authentication resets the count.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.forPriceFeed(Duration.ofSeconds(1));
 *
 * if (policy.isExhausted()) {
 *     disableStreaming();
 * } else {
 *     Duration delay = policy.getNextDelay();
 *     policy.recordFailure();
 *     scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    public static final double FEED_MULTIPLIER = 1.5;
    public static final int FEED_MAX_ATTEMPTS = 10;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Clock clock;

    private int attemptCount = 0;
    private Instant lastAttemptTime;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
                               int maxAttempts, Clock clock) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    /**
     * @return true while attempts remain
     */
    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the attempt that follows the failures recorded so far.
     */
    public synchronized Duration getNextDelay() {
        return delayForAttempt(attemptCount + 1);
    }

    /**
     * Delay before attempt n (1-based): initialDelay × multiplier^(n-1), capped.
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based: " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = clock.instant();
    }

    /**
     * Record a successful (authenticated) connection.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        lastAttemptTime = null;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    /**
     * @return true once maxAttempts consecutive failures have been recorded
     */
    public synchronized boolean isExhausted() {
        return attemptCount >= maxAttempts;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @return time of the last recorded failure, or null if none since the last success
     */
    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Streaming feed defaults: ×1.5 per attempt, 10 attempts, capped at 5 minutes.
     */
    public static ReconnectionPolicy forPriceFeed(Duration baseDelay) {
        return builder()
            .initialDelay(baseDelay)
            .maxDelay(Duration.ofMinutes(5))
            .multiplier(FEED_MULTIPLIER)
            .maxAttempts(FEED_MAX_ATTEMPTS)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = FEED_MULTIPLIER;
        private int maxAttempts = FEED_MAX_ATTEMPTS;
        private Clock clock = Clock.systemUTC();

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts, clock);
        }
    }
}
