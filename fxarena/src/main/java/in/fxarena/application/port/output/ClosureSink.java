package in.fxarena.application.port.output;

import in.fxarena.domain.position.AccountBook;
import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.risk.MarginSnapshot;

import java.math.BigDecimal;

/**
 * Downstream consumer of engine outcomes (notifications, audit ledger).
 * Calls are fire-and-forget from the engine's point of view.
 */
public interface ClosureSink {

    void recordClosure(String positionId, BigDecimal pnl, CloseReason reason);

    default void marginAlert(AccountBook book, MarginSnapshot snapshot) {
    }
}
