package in.fxarena.infrastructure.persistence;

import in.fxarena.application.port.output.SharedPriceStore;
import in.fxarena.application.service.price.QuoteNormalizer;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.price.PriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared price tier in the price_cache table. An upsert never replaces a
 * newer quote with an older one.
 */
public final class PostgresSharedPriceStore implements SharedPriceStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresSharedPriceStore.class);

    private final DataSource dataSource;

    public PostgresSharedPriceStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Map<String, PriceQuote> read(Collection<String> symbols) {
        if (symbols.isEmpty()) {
            return Map.of();
        }
        String sql = "SELECT symbol, bid, ask, quote_ts FROM price_cache WHERE symbol = ANY (?)";
        Map<String, PriceQuote> quotes = new LinkedHashMap<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            Array array = conn.createArrayOf("varchar", symbols.toArray());
            ps.setArray(1, array);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String symbol = rs.getString("symbol");
                    QuoteNormalizer.normalize(symbol, rs.getBigDecimal("bid"), rs.getBigDecimal("ask"),
                            rs.getTimestamp("quote_ts").toInstant(), PriceSource.CACHED)
                        .ifPresentOrElse(q -> quotes.put(symbol, q),
                            () -> log.warn("[PRICE CACHE] Ignoring invalid shared row for {}", symbol));
                }
            }
        } catch (SQLException e) {
            log.error("[PRICE CACHE] Error reading shared tier: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to read shared price tier", e);
        }
        return quotes;
    }

    @Override
    public void write(List<PriceQuote> quotes) {
        if (quotes.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO price_cache (symbol, bid, ask, quote_ts, source, updated_at)
            VALUES (?, ?, ?, ?, ?, NOW())
            ON CONFLICT (symbol) DO UPDATE
               SET bid = EXCLUDED.bid,
                   ask = EXCLUDED.ask,
                   quote_ts = EXCLUDED.quote_ts,
                   source = EXCLUDED.source,
                   updated_at = NOW()
             WHERE price_cache.quote_ts <= EXCLUDED.quote_ts
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            for (PriceQuote q : quotes) {
                ps.setString(1, q.symbol());
                ps.setBigDecimal(2, q.bid());
                ps.setBigDecimal(3, q.ask());
                ps.setTimestamp(4, Timestamp.from(q.timestamp()));
                ps.setString(5, q.source().name());
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            log.error("[PRICE CACHE] Error writing {} quotes to shared tier: {}", quotes.size(), e.getMessage(), e);
            throw new RuntimeException("Failed to write shared price tier", e);
        }
    }
}
