package in.fxarena.application.service.reconciliation;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one reconciliation sweep.
 *
 * @param indexedPositions positions in the trigger index after the reload
 * @param triggersFired    SL/TP closes enqueued by the re-check
 * @param booksChecked     books whose margin was evaluated
 * @param marginAlerts     books at DANGER or worse
 * @param liquidations     MARGIN_CALL closes enqueued
 * @param errors           one line per symbol or book that failed
 */
public record SweepReport(
    int indexedPositions,
    int triggersFired,
    int booksChecked,
    int marginAlerts,
    int liquidations,
    List<String> errors,
    Duration elapsed
) {
    public SweepReport {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
