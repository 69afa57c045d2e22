package in.fxarena.infrastructure.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxarena.application.service.price.SpreadEstimator;
import in.fxarena.application.service.price.TieredPriceCache;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class StreamingPriceFeedTest {

    private static final String AUTH_OK = "[{\"ev\":\"status\",\"status\":\"auth_success\",\"message\":\"ok\"}]";

    private MutableClock clock;
    private FakeConnector connector;
    private ScheduledExecutorService scheduler;
    private TieredPriceCache cache;
    private SpreadEstimator spreads;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-10T12:00:00Z");
        connector = new FakeConnector();
        scheduler = mock(ScheduledExecutorService.class);
        cache = new TieredPriceCache(TieredPriceCache.Settings.defaults(), clock, null, null, Runnable::run, null);
        spreads = new SpreadEstimator();
    }

    @Test
    void openSocket_authenticatesThenSubscribes() {
        StreamingPriceFeed feed = feed(ReconnectionPolicy.forPriceFeed(Duration.ofSeconds(1)));
        feed.start();
        assertEquals(StreamConnectionState.CONNECTING, feed.state());

        FakeSession session = connector.open();
        assertEquals(StreamConnectionState.AUTHENTICATING, feed.state());
        assertTrue(session.sent.get(0).contains("\"action\":\"auth\""));
        assertTrue(session.sent.get(0).contains("secret-key"));

        connector.listener().onText(AUTH_OK);

        assertEquals(StreamConnectionState.SUBSCRIBED, feed.state());
        assertEquals(2, session.sent.size());
        assertTrue(session.sent.get(1).contains("C.EUR/USD,CAS.EUR/USD,C.USD/JPY,CAS.USD/JPY"));
        assertTrue(feed.isHealthy());
    }

    @Test
    void quoteEvents_landInCacheAndFeedSpreadEstimate() {
        StreamingPriceFeed feed = subscribedFeed();

        connector.listener().onText(
            "[{\"ev\":\"C\",\"p\":\"EUR/USD\",\"b\":1.08410,\"a\":1.08430,\"t\":" + clock.millis() + "}]");

        PriceQuote q = cache.get("EUR/USD").orElseThrow();
        assertEquals(0, new BigDecimal("1.08420").compareTo(q.mid()));
        assertEquals(0, new BigDecimal("0.0002").compareTo(spreads.spread("EUR/USD")));
        assertEquals(1, feed.status().quotesReceived());
    }

    @Test
    void crossedQuote_isDroppedAndPreviousPriceKept() {
        StreamingPriceFeed feed = subscribedFeed();
        connector.listener().onText(
            "{\"ev\":\"C\",\"p\":\"EUR/USD\",\"b\":1.08410,\"a\":1.08430,\"t\":" + clock.millis() + "}");

        connector.listener().onText(
            "{\"ev\":\"C\",\"p\":\"EUR/USD\",\"b\":1.09000,\"a\":1.08000,\"t\":" + clock.millis() + "}");

        assertEquals(0, new BigDecimal("1.08410").compareTo(cache.get("EUR/USD").orElseThrow().bid()));
        assertEquals(1, feed.status().quotesReceived());
        assertTrue(spreads.observedSpread("EUR/USD").isPresent());
    }

    @Test
    void aggregate_isWidenedByHalfTheEstimatedSpread() {
        subscribedFeed();

        connector.listener().onText(
            "{\"ev\":\"CAS\",\"pair\":\"EUR/USD\",\"c\":1.08420,\"e\":" + clock.millis() + "}");

        // Default major spread 0.00015, half 0.000075
        PriceQuote q = cache.get("EUR/USD").orElseThrow();
        assertEquals(0, new BigDecimal("1.08413").compareTo(q.bid().setScale(5, java.math.RoundingMode.HALF_UP)));
        assertEquals(0, new BigDecimal("1.08420").compareTo(q.mid()));
        assertTrue(q.ask().compareTo(q.bid()) > 0);
    }

    @Test
    void droppedConnection_schedulesReconnectWithBackoff() {
        StreamingPriceFeed feed = subscribedFeed();

        connector.listener().onClosed(1006, "abnormal");

        assertEquals(StreamConnectionState.DISCONNECTED, feed.state());
        assertEquals(1, feed.status().reconnectAttempts());
        verify(scheduler).schedule(any(Runnable.class), eq(1000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void closeAndErrorOnSameConnection_countOnce() {
        StreamingPriceFeed feed = subscribedFeed();

        connector.listener().onError(new IllegalStateException("reset"));
        connector.listener().onClosed(1006, "abnormal");

        assertEquals(1, feed.status().reconnectAttempts());
        verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void failedConnect_countsAsAnAttempt() {
        connector.failNext = true;
        StreamingPriceFeed feed = feed(ReconnectionPolicy.forPriceFeed(Duration.ofSeconds(1)));

        feed.start();

        assertEquals(StreamConnectionState.DISCONNECTED, feed.state());
        verify(scheduler).schedule(any(Runnable.class), eq(1000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void authFailure_closesAndReconnects() {
        StreamingPriceFeed feed = feed(ReconnectionPolicy.forPriceFeed(Duration.ofSeconds(1)));
        feed.start();
        FakeSession session = connector.open();

        connector.listener().onText("[{\"ev\":\"status\",\"status\":\"auth_failed\",\"message\":\"bad key\"}]");

        assertTrue(session.closed);
        assertEquals(StreamConnectionState.DISCONNECTED, feed.state());
        verify(scheduler).schedule(any(Runnable.class), eq(1000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void exhaustedAttempts_disableStreamingForGood() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxAttempts(2)
            .clock(clock)
            .build();
        StreamingPriceFeed feed = feed(policy);
        feed.start();
        connector.open();
        connector.listener().onClosed(1006, "abnormal");

        ArgumentCaptor<Runnable> first = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(first.capture(), eq(1000L), eq(TimeUnit.MILLISECONDS));
        first.getValue().run();
        assertEquals(2, connector.listeners.size());

        connector.listener().onClosed(1006, "abnormal again");
        assertEquals(StreamConnectionState.DISCONNECTED, feed.state());

        ArgumentCaptor<Runnable> second = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(second.capture(), eq(1500L), eq(TimeUnit.MILLISECONDS));
        second.getValue().run();
        assertEquals(3, connector.listeners.size());

        connector.listener().onClosed(1006, "still down");

        assertEquals(StreamConnectionState.DISABLED, feed.state());
        assertFalse(feed.isHealthy());
        assertEquals(2, feed.status().reconnectAttempts());
        verify(scheduler, times(2)).schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void successfulAuth_resetsAttemptCount() {
        StreamingPriceFeed feed = subscribedFeed();
        connector.listener().onClosed(1006, "abnormal");
        assertEquals(1, feed.status().reconnectAttempts());

        ArgumentCaptor<Runnable> reconnect = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(reconnect.capture(), anyLong(), eq(TimeUnit.MILLISECONDS));
        reconnect.getValue().run();
        connector.open();
        connector.listener().onText(AUTH_OK);

        assertEquals(0, feed.status().reconnectAttempts());
        assertEquals(StreamConnectionState.SUBSCRIBED, feed.state());
    }

    @Test
    void stoppedFeed_doesNotReconnect() {
        StreamingPriceFeed feed = subscribedFeed();
        FeedSessionListener listener = connector.listener();

        feed.stop();
        listener.onClosed(1000, "bye");

        assertEquals(StreamConnectionState.DISCONNECTED, feed.state());
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    void silentFeed_isUnhealthy() {
        StreamingPriceFeed feed = subscribedFeed();
        assertTrue(feed.isHealthy());

        clock.advance(Duration.ofMinutes(6));

        assertFalse(feed.isHealthy());
        assertFalse(feed.status().healthy());
    }

    private StreamingPriceFeed subscribedFeed() {
        StreamingPriceFeed feed = feed(ReconnectionPolicy.forPriceFeed(Duration.ofSeconds(1)));
        feed.start();
        connector.open();
        connector.listener().onText(AUTH_OK);
        return feed;
    }

    private StreamingPriceFeed feed(ReconnectionPolicy policy) {
        ObjectMapper mapper = new ObjectMapper();
        StreamingPriceFeed.Settings settings = new StreamingPriceFeed.Settings(
            URI.create("wss://feed.test/forex"), "secret-key", List.of("EUR/USD", "USD/JPY"), Duration.ofMinutes(5));
        return new StreamingPriceFeed(settings, connector, cache, spreads, new FeedMessageParser(mapper, clock),
            mapper, Runnable::run, scheduler, policy, null, clock);
    }

    private static final class FakeConnector implements FeedConnector {
        final List<FeedSessionListener> listeners = new ArrayList<>();
        boolean failNext;

        @Override
        public CompletableFuture<FeedSession> connect(URI uri, FeedSessionListener listener) {
            listeners.add(listener);
            if (failNext) {
                failNext = false;
                return CompletableFuture.failedFuture(new FeedConnectionException(uri.toString(), "refused"));
            }
            return new CompletableFuture<>();
        }

        FeedSessionListener listener() {
            return listeners.get(listeners.size() - 1);
        }

        FakeSession open() {
            FakeSession session = new FakeSession();
            listener().onOpen(session);
            return session;
        }
    }

    private static final class FakeSession implements FeedSession {
        final List<String> sent = new ArrayList<>();
        boolean closed;

        @Override
        public void send(String text) {
            sent.add(text);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
