package in.fxarena.infrastructure.persistence;

import in.fxarena.application.port.output.PositionStore;
import in.fxarena.application.service.risk.RiskCalculator;
import in.fxarena.domain.position.AccountBook;
import in.fxarena.domain.position.BookPosition;
import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.position.Side;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.price.ForexPairs;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.domain.trade.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Position store over the trading platform's tables.
 *
 * trading_positions: position_id, user_id, competition_id, symbol, side,
 *   entry_price, quantity, leverage, margin_used, stop_loss, take_profit,
 *   status (open | closed | liquidated), close_reason, exit_price,
 *   realized_pnl, opened_at, closed_at
 *
 * competition_participants: user_id, competition_id, current_capital,
 *   used_margin, current_open_positions, status
 *
 * Closing and opening lock the position and participant rows and update
 * both in one transaction.
 */
public final class PostgresPositionStore implements PositionStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresPositionStore.class);

    private static final String POSITION_COLUMNS = """
        position_id, user_id, competition_id, symbol, side, entry_price, quantity,
        stop_loss, take_profit, margin_used, status
        """;

    private final DataSource dataSource;

    public PostgresPositionStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<TrackedPosition> listOpenPositionsWithSlTp() {
        String sql = "SELECT " + POSITION_COLUMNS + """
              FROM trading_positions
             WHERE status = 'open'
               AND (stop_loss IS NOT NULL OR take_profit IS NOT NULL)
            """;
        List<TrackedPosition> positions = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                positions.add(mapPosition(rs));
            }
        } catch (SQLException e) {
            log.error("Error listing open positions with SL/TP: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list open positions", e);
        }
        return positions;
    }

    @Override
    public List<AccountBook> listOpenBooks() {
        String sql = """
            SELECT p.position_id, p.user_id, p.competition_id, p.symbol, p.side, p.entry_price, p.quantity,
                   p.stop_loss, p.take_profit, p.margin_used, p.status,
                   cp.current_capital, cp.used_margin
              FROM trading_positions p
              JOIN competition_participants cp
                ON cp.user_id = p.user_id AND cp.competition_id = p.competition_id
             WHERE p.status = 'open'
               AND cp.status = 'active'
             ORDER BY p.user_id, p.competition_id, p.opened_at
            """;

        Map<String, BookBuilder> books = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                TrackedPosition position = mapPosition(rs);
                String key = position.userId() + "|" + position.contextId();
                BookBuilder book = books.get(key);
                if (book == null) {
                    book = new BookBuilder(position.userId(), position.contextId(),
                        bigDecimal(rs, "current_capital"), bigDecimal(rs, "used_margin"));
                    books.put(key, book);
                }
                book.positions.add(new BookPosition(position, rs.getBigDecimal("margin_used")));
            }
        } catch (SQLException e) {
            log.error("Error listing open books: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list open books", e);
        }

        List<AccountBook> result = new ArrayList<>(books.size());
        for (BookBuilder b : books.values()) {
            result.add(new AccountBook(b.userId, b.contextId, b.capital, b.usedMargin, b.positions));
        }
        return result;
    }

    @Override
    public StoreResult closePosition(String positionId, BigDecimal exitPrice, CloseReason reason) {
        String lockSql = "SELECT " + POSITION_COLUMNS + " FROM trading_positions WHERE position_id = ? FOR UPDATE";
        String closeSql = """
            UPDATE trading_positions
               SET status = ?, close_reason = ?, exit_price = ?, realized_pnl = ?, closed_at = NOW()
             WHERE position_id = ?
            """;
        String participantSql = """
            UPDATE competition_participants
               SET current_capital = current_capital + ?,
                   used_margin = GREATEST(used_margin - ?, 0),
                   current_open_positions = GREATEST(current_open_positions - 1, 0)
             WHERE user_id = ? AND competition_id = ?
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                TrackedPosition position;
                BigDecimal marginUsed;
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    ps.setString(1, positionId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return StoreResult.rejected("position not found: " + positionId);
                        }
                        if (!"open".equals(rs.getString("status"))) {
                            conn.rollback();
                            return StoreResult.alreadyClosed();
                        }
                        position = mapPosition(rs);
                        marginUsed = bigDecimal(rs, "margin_used");
                    }
                }

                BigDecimal pnl = RiskCalculator.unrealizedPnl(position.side(), position.entryPrice(), exitPrice,
                    position.quantity(), ForexPairs.contractSize(position.symbol()));

                try (PreparedStatement ps = conn.prepareStatement(closeSql)) {
                    ps.setString(1, reason == CloseReason.MARGIN_CALL ? "liquidated" : "closed");
                    ps.setString(2, reason.code());
                    ps.setBigDecimal(3, exitPrice);
                    ps.setBigDecimal(4, pnl);
                    ps.setString(5, positionId);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(participantSql)) {
                    ps.setBigDecimal(1, pnl);
                    ps.setBigDecimal(2, marginUsed);
                    ps.setString(3, position.userId());
                    ps.setString(4, position.contextId());
                    if (ps.executeUpdate() == 0) {
                        log.warn("No participant row for user={} competition={} while closing {}",
                            position.userId(), position.contextId(), positionId);
                    }
                }
                conn.commit();
                return StoreResult.closed(pnl);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Error closing position {}: {}", positionId, e.getMessage(), e);
            throw new RuntimeException("Failed to close position", e);
        }
    }

    @Override
    public StoreResult openPosition(QueuedTrade trade) {
        String symbol = trade.payloadValue(QueuedTrade.PAYLOAD_SYMBOL)
            .orElseThrow(() -> new IllegalArgumentException("OPEN without symbol"));
        Side side = Side.parse(trade.payloadValue(QueuedTrade.PAYLOAD_SIDE)
            .orElseThrow(() -> new IllegalArgumentException("OPEN without side")));
        BigDecimal entryPrice = trade.payloadDecimal(QueuedTrade.PAYLOAD_ENTRY_PRICE)
            .orElseThrow(() -> new IllegalArgumentException("OPEN without entryPrice"));
        BigDecimal quantity = trade.payloadDecimal(QueuedTrade.PAYLOAD_QUANTITY)
            .orElseThrow(() -> new IllegalArgumentException("OPEN without quantity"));
        int leverage = trade.payloadDecimal(QueuedTrade.PAYLOAD_LEVERAGE)
            .map(BigDecimal::intValue)
            .orElseThrow(() -> new IllegalArgumentException("OPEN without leverage"));
        String contextId = trade.payloadValue(QueuedTrade.PAYLOAD_CONTEXT_ID)
            .orElseThrow(() -> new IllegalArgumentException("OPEN without contextId"));
        BigDecimal stopLoss = trade.payloadDecimal(QueuedTrade.PAYLOAD_STOP_LOSS).orElse(null);
        BigDecimal takeProfit = trade.payloadDecimal(QueuedTrade.PAYLOAD_TAKE_PROFIT).orElse(null);

        String positionId = trade.positionId() != null ? trade.positionId() : UUID.randomUUID().toString();
        TrackedPosition position = new TrackedPosition(positionId, symbol, side, entryPrice, quantity,
            stopLoss, takeProfit, trade.userId(), contextId);
        BigDecimal margin = RiskCalculator.marginRequired(quantity, entryPrice, leverage,
            ForexPairs.contractSize(symbol));

        String lockSql = """
            SELECT current_capital, used_margin
              FROM competition_participants
             WHERE user_id = ? AND competition_id = ? AND status = 'active'
               FOR UPDATE
            """;
        String insertSql = """
            INSERT INTO trading_positions (
                position_id, user_id, competition_id, symbol, side, entry_price, quantity,
                leverage, margin_used, stop_loss, take_profit, status, opened_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 'open', NOW())
            ON CONFLICT (position_id) DO NOTHING
            """;
        String participantSql = """
            UPDATE competition_participants
               SET used_margin = used_margin + ?,
                   current_open_positions = current_open_positions + 1
             WHERE user_id = ? AND competition_id = ?
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    ps.setString(1, trade.userId());
                    ps.setString(2, contextId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return StoreResult.rejected("no active participant for user " + trade.userId());
                        }
                        BigDecimal free = bigDecimal(rs, "current_capital").subtract(bigDecimal(rs, "used_margin"));
                        if (free.compareTo(margin) < 0) {
                            conn.rollback();
                            return StoreResult.rejected("insufficient free margin: need " + margin + ", free " + free);
                        }
                    }
                }

                int inserted;
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, positionId);
                    ps.setString(2, trade.userId());
                    ps.setString(3, contextId);
                    ps.setString(4, symbol);
                    ps.setString(5, side.wireValue());
                    ps.setBigDecimal(6, entryPrice);
                    ps.setBigDecimal(7, quantity);
                    ps.setInt(8, leverage);
                    ps.setBigDecimal(9, margin);
                    ps.setBigDecimal(10, stopLoss);
                    ps.setBigDecimal(11, takeProfit);
                    inserted = ps.executeUpdate();
                }
                if (inserted == 0) {
                    // Retried OPEN whose first attempt already committed
                    conn.rollback();
                    log.info("Position {} already exists, treating OPEN as applied", positionId);
                    return findPosition(conn, positionId)
                        .map(StoreResult::applied)
                        .orElseGet(() -> StoreResult.rejected("position id conflict: " + positionId));
                }
                try (PreparedStatement ps = conn.prepareStatement(participantSql)) {
                    ps.setBigDecimal(1, margin);
                    ps.setString(2, trade.userId());
                    ps.setString(3, contextId);
                    ps.executeUpdate();
                }
                conn.commit();
                return StoreResult.applied(position);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Error opening position for user {}: {}", trade.userId(), e.getMessage(), e);
            throw new RuntimeException("Failed to open position", e);
        }
    }

    @Override
    public StoreResult modifyPosition(String positionId, BigDecimal stopLoss, BigDecimal takeProfit) {
        String sql = """
            UPDATE trading_positions
               SET stop_loss = ?, take_profit = ?
             WHERE position_id = ? AND status = 'open'
            RETURNING\s""" + POSITION_COLUMNS;

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setBigDecimal(1, stopLoss);
                ps.setBigDecimal(2, takeProfit);
                ps.setString(3, positionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return StoreResult.applied(mapPosition(rs));
                    }
                }
            }
            return findPosition(conn, positionId).isPresent()
                ? StoreResult.alreadyClosed()
                : StoreResult.rejected("position not found: " + positionId);
        } catch (SQLException e) {
            log.error("Error modifying position {}: {}", positionId, e.getMessage(), e);
            throw new RuntimeException("Failed to modify position", e);
        }
    }

    private Optional<TrackedPosition> findPosition(Connection conn, String positionId) throws SQLException {
        String sql = "SELECT " + POSITION_COLUMNS + " FROM trading_positions WHERE position_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, positionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapPosition(rs)) : Optional.empty();
            }
        }
    }

    private TrackedPosition mapPosition(ResultSet rs) throws SQLException {
        return new TrackedPosition(
            rs.getString("position_id"),
            ForexPairs.canonicalize(rs.getString("symbol")).orElse(rs.getString("symbol")),
            Side.parse(rs.getString("side")),
            rs.getBigDecimal("entry_price"),
            rs.getBigDecimal("quantity"),
            rs.getBigDecimal("stop_loss"),
            rs.getBigDecimal("take_profit"),
            rs.getString("user_id"),
            rs.getString("competition_id"));
    }

    private static BigDecimal bigDecimal(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value != null ? value : BigDecimal.ZERO;
    }

    private static final class BookBuilder {
        final String userId;
        final String contextId;
        final BigDecimal capital;
        final BigDecimal usedMargin;
        final List<BookPosition> positions = new ArrayList<>();

        BookBuilder(String userId, String contextId, BigDecimal capital, BigDecimal usedMargin) {
            this.userId = userId;
            this.contextId = contextId;
            this.capital = capital;
            this.usedMargin = usedMargin;
        }
    }
}
