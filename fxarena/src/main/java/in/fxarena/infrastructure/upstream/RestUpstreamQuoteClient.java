package in.fxarena.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxarena.application.port.output.UpstreamQuoteClient;
import in.fxarena.application.service.price.QuoteNormalizer;
import in.fxarena.domain.price.ForexPair;
import in.fxarena.domain.price.ForexPairs;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Last-quote REST client.
 *
 * One request per symbol, all in parallel:
 * <pre>
 * GET {base}/last_quote/currencies/{FROM}/{TO}?apiKey=...
 * → {"status":"success","last":{"bid":1.0841,"ask":1.0843,"timestamp":1718000000000}}
 * </pre>
 * Symbols that fail, time out or come back crossed are left out of the
 * result. The whole call is bounded by the request timeout.
 */
public final class RestUpstreamQuoteClient implements UpstreamQuoteClient {
    private static final Logger log = LoggerFactory.getLogger(RestUpstreamQuoteClient.class);

    // Anything past this is nanoseconds rather than milliseconds
    private static final long NANOS_THRESHOLD = 100_000_000_000_000L;

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Clock clock;

    public RestUpstreamQuoteClient(String baseUrl, String apiKey, Duration timeout, ObjectMapper mapper, Clock clock) {
        this(baseUrl, apiKey, timeout, HttpClient.newBuilder().connectTimeout(timeout).build(), mapper, clock);
    }

    RestUpstreamQuoteClient(String baseUrl, String apiKey, Duration timeout, HttpClient httpClient,
                            ObjectMapper mapper, Clock clock) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public Map<String, PriceQuote> fetchQuotes(Collection<String> symbols) {
        List<String> requested = new ArrayList<>();
        List<CompletableFuture<Optional<PriceQuote>>> futures = new ArrayList<>();
        for (String symbol : symbols) {
            Optional<ForexPair> pair = ForexPairs.find(symbol);
            String[] currencies = pair.map(p -> new String[]{p.baseCurrency(), p.quoteCurrency()})
                .orElseGet(() -> split(symbol));
            if (currencies == null) {
                log.debug("[UPSTREAM] Cannot price unknown symbol {}", symbol);
                continue;
            }
            requested.add(symbol);
            futures.add(fetchOne(symbol, currencies[0], currencies[1]));
        }

        Map<String, PriceQuote> quotes = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            futures.get(i).join().ifPresent(q -> quotes.put(q.symbol(), q));
        }
        if (quotes.size() < requested.size()) {
            log.warn("[UPSTREAM] Priced {}/{} symbols", quotes.size(), requested.size());
        }
        return quotes;
    }

    private CompletableFuture<Optional<PriceQuote>> fetchOne(String symbol, String from, String to) {
        URI uri = URI.create(baseUrl + "/last_quote/currencies/" + from + "/" + to
            + "?apiKey=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> {
                if (response.statusCode() == 401 || response.statusCode() == 403) {
                    log.error("[UPSTREAM] {} rejected the API key (HTTP {})", symbol, response.statusCode());
                    return Optional.<PriceQuote>empty();
                }
                if (response.statusCode() != 200) {
                    log.warn("[UPSTREAM] {} failed: HTTP {}", symbol, response.statusCode());
                    return Optional.<PriceQuote>empty();
                }
                return parse(symbol, response.body());
            })
            .exceptionally(e -> {
                log.warn("[UPSTREAM] {} request failed: {}", symbol, e.getMessage());
                return Optional.empty();
            });
    }

    Optional<PriceQuote> parse(String symbol, String body) {
        try {
            JsonNode root = mapper.readTree(body);
            String status = root.path("status").asText("");
            if (!"success".equalsIgnoreCase(status) && !"OK".equalsIgnoreCase(status)) {
                log.warn("[UPSTREAM] {} returned status '{}'", symbol, status);
                return Optional.empty();
            }
            JsonNode last = root.path("last");
            if (!last.hasNonNull("bid") || !last.hasNonNull("ask")) {
                log.warn("[UPSTREAM] {} response has no bid/ask", symbol);
                return Optional.empty();
            }
            BigDecimal bid = last.get("bid").decimalValue();
            BigDecimal ask = last.get("ask").decimalValue();
            Instant timestamp = toInstant(last.path("timestamp").asLong(0));

            Optional<PriceQuote> quote = QuoteNormalizer.normalize(symbol, bid, ask, timestamp, PriceSource.FETCHED);
            if (quote.isEmpty()) {
                log.warn("[UPSTREAM] {} returned an invalid quote (bid={}, ask={})", symbol, bid, ask);
            }
            return quote;
        } catch (Exception e) {
            log.warn("[UPSTREAM] Could not parse {} response: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    private Instant toInstant(long raw) {
        if (raw <= 0) {
            return clock.instant();
        }
        return raw > NANOS_THRESHOLD ? Instant.ofEpochMilli(raw / 1_000_000) : Instant.ofEpochMilli(raw);
    }

    private static String[] split(String symbol) {
        String[] parts = symbol.split("/");
        return parts.length == 2 && parts[0].length() == 3 && parts[1].length() == 3 ? parts : null;
    }
}
