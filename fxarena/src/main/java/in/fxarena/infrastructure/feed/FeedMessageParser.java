package in.fxarena.infrastructure.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxarena.domain.price.ForexPairs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw feed text into {@link FeedEvent}s.
 *
 * Messages are either one JSON object or an array of them. The "ev" field
 * selects the kind:
 * <pre>
 *   status, connected   → STATUS    (status, message)
 *   C, CQ               → QUOTE     (p|pair, b, a, t)
 *   CA, CAS             → AGGREGATE (pair|p, c, e|s|t)
 * </pre>
 * Unknown kinds and elements without a usable symbol are skipped. Malformed
 * JSON yields no events.
 */
public final class FeedMessageParser {
    private static final Logger log = LoggerFactory.getLogger(FeedMessageParser.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public FeedMessageParser(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public List<FeedEvent> parse(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[STREAM] Dropping malformed message: {}", e.getOriginalMessage());
            return List.of();
        }
        if (root == null) {
            return List.of();
        }

        List<FeedEvent> events = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode element : root) {
                parseElement(element).ifPresent(events::add);
            }
        } else {
            parseElement(root).ifPresent(events::add);
        }
        return events;
    }

    private Optional<FeedEvent> parseElement(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String ev = node.path("ev").asText("");
        return switch (ev) {
            case "status", "connected" -> Optional.of(FeedEvent.status(
                node.path("status").asText(ev), node.path("message").asText("")));
            case "C", "CQ" -> symbolOf(node, "p", "pair").map(symbol -> FeedEvent.quote(
                symbol, decimal(node, "b"), decimal(node, "a"), instant(node, "t")));
            case "CA", "CAS" -> symbolOf(node, "pair", "p").map(symbol -> FeedEvent.aggregate(
                symbol, decimal(node, "c"), instant(node, "e", "s", "t")));
            default -> {
                log.trace("[STREAM] Ignoring event type '{}'", ev);
                yield Optional.empty();
            }
        };
    }

    private static Optional<String> symbolOf(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual()) {
                Optional<String> symbol = ForexPairs.canonicalize(value.asText());
                if (symbol.isPresent()) {
                    return symbol;
                }
            }
        }
        log.debug("[STREAM] Event without a usable symbol: {}", node);
        return Optional.empty();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("[STREAM] Non-numeric {}='{}'", field, value.asText());
                return null;
            }
        }
        return null;
    }

    private Instant instant(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.canConvertToLong() && value.asLong() > 0) {
                return Instant.ofEpochMilli(value.asLong());
            }
        }
        return clock.instant();
    }
}
