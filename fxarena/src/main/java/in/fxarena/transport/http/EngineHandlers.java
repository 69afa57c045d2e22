package in.fxarena.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.fxarena.application.port.output.RiskSettingsStore;
import in.fxarena.application.port.output.TradeExecutionQueue;
import in.fxarena.application.service.price.TieredPriceCache;
import in.fxarena.application.service.reconciliation.ReconciliationSweep;
import in.fxarena.application.service.risk.RiskCalculator;
import in.fxarena.application.service.trigger.PositionTriggerIndex;
import in.fxarena.domain.position.Side;
import in.fxarena.domain.price.ForexPairs;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.risk.MarginSnapshot;
import in.fxarena.domain.risk.OrderRequest;
import in.fxarena.domain.risk.OrderValidationResult;
import in.fxarena.domain.risk.RiskThresholds;
import in.fxarena.domain.trade.QueueStats;
import in.fxarena.infrastructure.feed.FeedStatus;
import in.fxarena.infrastructure.feed.StreamingPriceFeed;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operational HTTP endpoints.
 *
 * - GET  /health                - feed, cache, index and last sweep
 * - GET  /api/prices?symbols=   - best available quotes (comma-separated symbols)
 * - GET  /api/queue/stats       - pending / processing trade counts
 * - POST /api/margin/status     - margin snapshot for capital, P&amp;L and used margin
 * - POST /api/orders/validate   - pre-trade risk checks
 */
public final class EngineHandlers {
    private static final Logger log = LoggerFactory.getLogger(EngineHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TieredPriceCache cache;
    private final TradeExecutionQueue queue;
    private final RiskSettingsStore riskSettings;
    private final PositionTriggerIndex index;
    private final StreamingPriceFeed feed;            // null when streaming is off
    private final ReconciliationSweep sweep;          // nullable
    private final Clock clock;

    public EngineHandlers(TieredPriceCache cache, TradeExecutionQueue queue, RiskSettingsStore riskSettings,
                          PositionTriggerIndex index, StreamingPriceFeed feed, ReconciliationSweep sweep,
                          Clock clock) {
        this.cache = cache;
        this.queue = queue;
        this.riskSettings = riskSettings;
        this.index = index;
        this.feed = feed;
        this.sweep = sweep;
        this.clock = clock;
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("ts", clock.instant().toString());

        boolean feedHealthy = true;
        ObjectNode feedNode = health.putObject("feed");
        if (feed == null) {
            feedNode.put("state", "off");
        } else {
            FeedStatus status = feed.status();
            feedHealthy = status.healthy();
            feedNode.put("state", status.state().wireValue());
            feedNode.put("healthy", status.healthy());
            feedNode.put("reconnectAttempts", status.reconnectAttempts());
            feedNode.put("quotesReceived", status.quotesReceived());
            feedNode.put("lastMessageAt", status.lastMessageAt() != null ? status.lastMessageAt().toString() : null);
        }

        TieredPriceCache.CacheStats cacheStats = cache.stats();
        ObjectNode cacheNode = health.putObject("cache");
        cacheNode.put("streamEntries", cacheStats.streamEntries());
        cacheNode.put("localEntries", cacheStats.localEntries());
        cacheNode.put("lastKnownEntries", cacheStats.lastKnownEntries());
        cacheNode.put("upstreamFetches", cacheStats.upstreamFetches());
        cacheNode.put("lastUpdate", cacheStats.lastUpdate() != null ? cacheStats.lastUpdate().toString() : null);

        PositionTriggerIndex.IndexStats indexStats = index.getStats();
        ObjectNode indexNode = health.putObject("triggerIndex");
        indexNode.put("positions", indexStats.totalPositions());
        indexNode.put("symbols", indexStats.totalSymbols());
        indexNode.put("maxPerSymbol", indexStats.maxPositionsPerSymbol());
        indexNode.put("closing", indexStats.closingPositions());

        if (sweep != null) {
            sweep.lastReport().ifPresent(report -> {
                ObjectNode sweepNode = health.putObject("lastSweep");
                sweepNode.put("indexedPositions", report.indexedPositions());
                sweepNode.put("triggersFired", report.triggersFired());
                sweepNode.put("booksChecked", report.booksChecked());
                sweepNode.put("liquidations", report.liquidations());
                sweepNode.put("errors", report.errors().size());
                sweepNode.put("elapsedMs", report.elapsed().toMillis());
            });
        }

        health.put("status", feedHealthy ? "ok" : "degraded");
        send(exchange, StatusCodes.OK, health);
    }

    /**
     * GET /api/prices?symbols=EUR/USD,GBPUSD
     */
    public void prices(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::prices);
            return;
        }
        Deque<String> param = exchange.getQueryParameters().get("symbols");
        if (param == null || param.isEmpty() || param.getFirst().isBlank()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "symbols query parameter is required");
            return;
        }

        Set<String> symbols = new LinkedHashSet<>();
        List<String> invalid = new ArrayList<>();
        for (String raw : param.getFirst().split(",")) {
            if (raw.isBlank()) {
                continue;
            }
            Optional<String> symbol = ForexPairs.canonicalize(raw.trim());
            if (symbol.isPresent()) {
                symbols.add(symbol.get());
            } else {
                invalid.add(raw.trim());
            }
        }
        if (!invalid.isEmpty()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Unrecognized symbols: " + String.join(", ", invalid));
            return;
        }

        try {
            Map<String, PriceQuote> quotes = cache.getAll(symbols);
            ObjectNode response = MAPPER.createObjectNode();
            ObjectNode prices = response.putObject("prices");
            ArrayNode missing = response.putArray("missing");
            for (String symbol : symbols) {
                PriceQuote q = quotes.get(symbol);
                if (q == null) {
                    missing.add(symbol);
                    continue;
                }
                ObjectNode node = prices.putObject(symbol);
                node.put("bid", q.bid());
                node.put("ask", q.ask());
                node.put("mid", q.mid());
                node.put("spread", q.spread());
                node.put("timestamp", q.timestamp().toEpochMilli());
                node.put("source", q.source().name().toLowerCase());
                node.put("stale", q.stale());
                node.put("fallback", q.fallback());
            }
            send(exchange, StatusCodes.OK, response);
        } catch (Exception e) {
            log.error("Failed to resolve prices for {}: {}", symbols, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to resolve prices");
        }
    }

    /**
     * GET /api/queue/stats
     */
    public void queueStats(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::queueStats);
            return;
        }
        try {
            QueueStats stats = queue.stats();
            ObjectNode response = MAPPER.createObjectNode();
            response.put("pending", stats.pending());
            response.put("processing", stats.processing());
            send(exchange, StatusCodes.OK, response);
        } catch (Exception e) {
            log.error("Failed to read queue stats: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read queue stats");
        }
    }

    /**
     * POST /api/margin/status
     *
     * Body: {"capital": 10000, "unrealizedPnl": -250.5, "usedMargin": 2000}
     */
    public void marginStatus(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                BigDecimal capital = requiredDecimal(json, "capital");
                BigDecimal unrealizedPnl = optionalDecimal(json, "unrealizedPnl", BigDecimal.ZERO);
                BigDecimal usedMargin = optionalDecimal(json, "usedMargin", BigDecimal.ZERO);
                int openPositions = json.path("openPositions").asInt(0);

                RiskThresholds thresholds = riskSettings.getRiskThresholds();
                MarginSnapshot snapshot = RiskCalculator.marginSnapshot(capital, unrealizedPnl, usedMargin, thresholds);

                ObjectNode response = MAPPER.createObjectNode();
                response.put("equity", snapshot.equity());
                response.put("usedMargin", snapshot.usedMargin());
                if (snapshot.hasOpenExposure()) {
                    response.put("marginLevel", snapshot.marginLevel());
                } else {
                    response.putNull("marginLevel");
                }
                response.put("status", snapshot.status().wireValue());
                response.put("message", snapshot.message());
                ArrayNode warnings = response.putArray("warnings");
                RiskCalculator.riskWarnings(snapshot.status(), openPositions, thresholds.maxOpenPositions())
                    .forEach(warnings::add);
                send(ex, StatusCodes.OK, response);

            } catch (IllegalArgumentException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("Failed to compute margin status: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to compute margin status");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/orders/validate
     *
     * Body: {"availableCapital": 5000, "symbol": "EUR/USD", "price": 1.085, "quantity": 0.5,
     *        "leverage": 100, "currentOpenPositions": 2, "side": "buy", "stopLoss": 1.08}
     * marginRequired may be given directly instead of symbol and price.
     */
    public void validateOrder(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                BigDecimal availableCapital = requiredDecimal(json, "availableCapital");
                BigDecimal quantity = requiredDecimal(json, "quantity");
                int leverage = json.path("leverage").asInt(1);
                int openPositions = json.path("currentOpenPositions").asInt(0);

                BigDecimal marginRequired;
                if (json.hasNonNull("marginRequired")) {
                    marginRequired = requiredDecimal(json, "marginRequired");
                } else {
                    String symbol = ForexPairs.canonicalize(json.path("symbol").asText(""))
                        .orElseThrow(() -> new IllegalArgumentException("symbol or marginRequired is required"));
                    marginRequired = RiskCalculator.marginRequired(quantity, requiredDecimal(json, "price"),
                        leverage, ForexPairs.contractSize(symbol));
                }

                RiskThresholds thresholds = riskSettings.getRiskThresholds();
                OrderValidationResult result = RiskCalculator.validateQuantity(quantity,
                    RiskCalculator.MIN_LOT, thresholds.maxLotSize());
                if (result.valid()) {
                    result = RiskCalculator.validateNewOrder(
                        new OrderRequest(availableCapital, marginRequired, openPositions, quantity, leverage),
                        thresholds);
                }
                if (result.valid() && json.hasNonNull("side") && json.hasNonNull("price")) {
                    result = RiskCalculator.validateExitLevels(Side.parse(json.get("side").asText()),
                        requiredDecimal(json, "price"),
                        optionalDecimal(json, "stopLoss", null),
                        optionalDecimal(json, "takeProfit", null));
                }

                ObjectNode response = MAPPER.createObjectNode();
                response.put("valid", result.valid());
                response.put("marginRequired", marginRequired);
                if (!result.valid()) {
                    response.put("reason", result.rejection().name());
                    response.put("error", result.error());
                }
                send(ex, StatusCodes.OK, response);

            } catch (IllegalArgumentException e) {
                sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("Failed to validate order: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to validate order");
            }
        }, StandardCharsets.UTF_8);
    }

    private static BigDecimal requiredDecimal(JsonNode json, String field) {
        BigDecimal value = optionalDecimal(json, field, null);
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static BigDecimal optionalDecimal(JsonNode json, String field, BigDecimal fallback) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be a number");
        }
    }

    private void send(HttpServerExchange exchange, int statusCode, JsonNode body) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message);
        send(exchange, statusCode, error);
    }
}
