package in.fxarena.infrastructure.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxarena.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedMessageParserTest {

    private MutableClock clock;
    private FeedMessageParser parser;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-10T12:00:00Z");
        parser = new FeedMessageParser(new ObjectMapper(), clock);
    }

    @Test
    void parsesStatusEvents() {
        List<FeedEvent> events = parser.parse(
            "[{\"ev\":\"status\",\"status\":\"auth_success\",\"message\":\"authenticated\"}]");

        assertEquals(1, events.size());
        assertEquals(FeedEvent.Kind.STATUS, events.get(0).kind());
        assertEquals("auth_success", events.get(0).status());
        assertEquals("authenticated", events.get(0).message());
    }

    @Test
    void parsesQuoteBatchAndCanonicalizesSymbols() {
        List<FeedEvent> events = parser.parse("["
            + "{\"ev\":\"C\",\"p\":\"EUR/USD\",\"b\":1.0841,\"a\":1.0843,\"t\":1718020800000},"
            + "{\"ev\":\"C\",\"p\":\"C:GBPUSD\",\"b\":\"1.2700\",\"a\":\"1.2702\",\"t\":1718020801000}"
            + "]");

        assertEquals(2, events.size());
        FeedEvent first = events.get(0);
        assertEquals(FeedEvent.Kind.QUOTE, first.kind());
        assertEquals("EUR/USD", first.symbol());
        assertEquals(0, new BigDecimal("1.0841").compareTo(first.bid()));
        assertEquals(0, new BigDecimal("1.0843").compareTo(first.ask()));
        assertEquals(Instant.ofEpochMilli(1718020800000L), first.timestamp());
        assertEquals("GBP/USD", events.get(1).symbol());
        assertEquals(0, new BigDecimal("1.2700").compareTo(events.get(1).bid()));
    }

    @Test
    void parsesAggregateUsingWindowEnd() {
        List<FeedEvent> events = parser.parse(
            "{\"ev\":\"CAS\",\"pair\":\"USD/JPY\",\"c\":157.12,\"s\":1718020800000,\"e\":1718020801000}");

        assertEquals(1, events.size());
        FeedEvent agg = events.get(0);
        assertEquals(FeedEvent.Kind.AGGREGATE, agg.kind());
        assertEquals("USD/JPY", agg.symbol());
        assertEquals(0, new BigDecimal("157.12").compareTo(agg.close()));
        assertEquals(Instant.ofEpochMilli(1718020801000L), agg.timestamp());
    }

    @Test
    void missingTimestamp_usesClock() {
        FeedEvent event = parser.parse("{\"ev\":\"C\",\"p\":\"EUR/USD\",\"b\":1.0841,\"a\":1.0843}").get(0);

        assertEquals(clock.instant(), event.timestamp());
    }

    @Test
    void missingSide_isKeptAsNullForTheBoundaryToReject() {
        FeedEvent event = parser.parse("{\"ev\":\"C\",\"p\":\"EUR/USD\",\"a\":1.0843}").get(0);

        assertNull(event.bid());
    }

    @Test
    void dropsMalformedUnknownAndSymbolLessMessages() {
        assertTrue(parser.parse("not json").isEmpty());
        assertTrue(parser.parse("{\"ev\":\"T\",\"p\":\"EUR/USD\"}").isEmpty());
        assertTrue(parser.parse("{\"ev\":\"C\",\"p\":\"EURO\",\"b\":1,\"a\":2}").isEmpty());
        assertTrue(parser.parse("[1,2,3]").isEmpty());
    }
}
