package in.fxarena.application.port.output;

import in.fxarena.domain.position.AccountBook;
import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.position.TrackedPosition;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.domain.trade.StoreResult;

import java.math.BigDecimal;
import java.util.List;

/**
 * System of record for positions and balances. The engine never owns this
 * data; it reads snapshots and asks the store to apply changes.
 */
public interface PositionStore {

    /** Open positions carrying a stop-loss and/or take-profit. */
    List<TrackedPosition> listOpenPositionsWithSlTp();

    /** Every participant book with at least one open position. */
    List<AccountBook> listOpenBooks();

    /**
     * Close a position at the given price. Must be idempotent: closing an
     * already-closed position returns {@link StoreResult.Outcome#ALREADY_CLOSED}.
     */
    StoreResult closePosition(String positionId, BigDecimal exitPrice, CloseReason reason);

    /** Open a position described by an OPEN trade's payload. */
    StoreResult openPosition(QueuedTrade trade);

    /** Replace the exit levels of an open position. Null clears a level. */
    StoreResult modifyPosition(String positionId, BigDecimal stopLoss, BigDecimal takeProfit);
}
