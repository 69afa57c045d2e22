package in.fxarena.application.service.reconciliation;

import in.fxarena.application.port.output.ClosureSink;
import in.fxarena.application.port.output.PositionStore;
import in.fxarena.application.port.output.RiskSettingsStore;
import in.fxarena.application.port.output.TradeExecutionQueue;
import in.fxarena.application.service.price.TieredPriceCache;
import in.fxarena.application.service.risk.LiquidationPlanner;
import in.fxarena.application.service.risk.RiskCalculator;
import in.fxarena.application.service.trigger.PositionTriggerIndex;
import in.fxarena.application.service.trigger.SlTpTriggerService;
import in.fxarena.domain.position.AccountBook;
import in.fxarena.domain.position.BookPosition;
import in.fxarena.domain.position.CloseReason;
import in.fxarena.domain.price.PriceQuote;
import in.fxarena.domain.risk.LiquidationPlan;
import in.fxarena.domain.risk.MarginSnapshot;
import in.fxarena.domain.risk.MarginStatus;
import in.fxarena.domain.risk.RiskThresholds;
import in.fxarena.domain.trade.QueuedTrade;
import in.fxarena.infrastructure.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic safety net for the tick-driven paths.
 *
 * Each sweep:
 * 1. Reloads every open position with exit levels and rebuilds the trigger index
 * 2. Re-checks triggers per indexed symbol against the best cached price
 * 3. Marks every open book to market; alerts at DANGER or worse and
 *    enqueues MARGIN_CALL closes for books in LIQUIDATION
 *
 * Positions with a close already in flight are valued as if that close had
 * settled at the current price, and are never planned for a second close.
 *
 * Stale quotes are never acted on. A failure on one symbol or book is
 * recorded in the {@link SweepReport} and the sweep carries on.
 */
public final class ReconciliationSweep {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationSweep.class);

    private final PositionStore positionStore;
    private final RiskSettingsStore riskSettings;
    private final PositionTriggerIndex index;
    private final SlTpTriggerService triggerService;
    private final TieredPriceCache cache;
    private final TradeExecutionQueue queue;
    private final ClosureSink closureSink;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    private volatile SweepReport lastReport;

    public ReconciliationSweep(PositionStore positionStore, RiskSettingsStore riskSettings,
                               PositionTriggerIndex index, SlTpTriggerService triggerService,
                               TieredPriceCache cache, TradeExecutionQueue queue, ClosureSink closureSink,
                               EngineMetrics metrics, Clock clock, Duration interval) {
        this.positionStore = positionStore;
        this.riskSettings = riskSettings;
        this.index = index;
        this.triggerService = triggerService;
        this.cache = cache;
        this.queue = queue;
        this.closureSink = closureSink;
        this.metrics = metrics != null ? metrics : EngineMetrics.noop();
        this.clock = clock;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reconciliation-sweep");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long period = interval.toSeconds();
        scheduler.scheduleAtFixedRate(this::runScheduled, period, period, TimeUnit.SECONDS);
        log.info("[SWEEP] Reconciliation sweep started: interval={}s", period);
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runScheduled() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("[SWEEP] Reconciliation sweep failed", e);
        }
    }

    /**
     * Run one full sweep on the calling thread.
     */
    public SweepReport sweep() {
        long started = System.nanoTime();
        List<String> errors = new ArrayList<>();

        reloadIndex(errors);
        int triggers = recheckTriggers(errors);
        MarginSweep margin = sweepMargins(errors);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        SweepReport report = new SweepReport(index.size(), triggers, margin.booksChecked,
            margin.alerts, margin.liquidations, errors, elapsed);
        lastReport = report;
        metrics.recordSweep(elapsed, triggers, margin.liquidations, errors.size());

        if (report.hasErrors()) {
            log.warn("[SWEEP] Completed with {} errors: indexed={}, triggers={}, books={}, alerts={}, liquidations={}, elapsed={}ms",
                errors.size(), report.indexedPositions(), triggers, margin.booksChecked, margin.alerts,
                margin.liquidations, elapsed.toMillis());
        } else {
            log.info("[SWEEP] Completed: indexed={}, triggers={}, books={}, alerts={}, liquidations={}, elapsed={}ms",
                report.indexedPositions(), triggers, margin.booksChecked, margin.alerts,
                margin.liquidations, elapsed.toMillis());
        }
        return report;
    }

    public Optional<SweepReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    // ═══════════════════════════════════════════════════════════════
    // Step 1: index reload
    // ═══════════════════════════════════════════════════════════════

    private void reloadIndex(List<String> errors) {
        try {
            index.rebuild(positionStore.listOpenPositionsWithSlTp());
        } catch (RuntimeException e) {
            // Previous index stays in place
            log.error("[SWEEP] Index reload failed: {}", e.getMessage(), e);
            errors.add("index reload: " + e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Step 2: trigger re-check
    // ═══════════════════════════════════════════════════════════════

    private int recheckTriggers(List<String> errors) {
        int fired = 0;
        for (String symbol : index.symbols()) {
            try {
                Optional<PriceQuote> quote = cache.get(symbol);
                if (quote.isEmpty()) {
                    log.debug("[SWEEP] No price for {}, skipping trigger check", symbol);
                    continue;
                }
                if (quote.get().stale()) {
                    log.debug("[SWEEP] Stale price for {} ({}), skipping trigger check",
                        symbol, quote.get().timestamp());
                    continue;
                }
                fired += triggerService.check(quote.get());
            } catch (RuntimeException e) {
                log.error("[SWEEP] Trigger check failed for {}: {}", symbol, e.getMessage(), e);
                errors.add(symbol + ": " + e.getMessage());
            }
        }
        return fired;
    }

    // ═══════════════════════════════════════════════════════════════
    // Step 3: margin sweep
    // ═══════════════════════════════════════════════════════════════

    private MarginSweep sweepMargins(List<String> errors) {
        MarginSweep result = new MarginSweep();
        List<AccountBook> books;
        RiskThresholds thresholds;
        try {
            books = positionStore.listOpenBooks();
            thresholds = riskSettings.getRiskThresholds();
        } catch (RuntimeException e) {
            log.error("[SWEEP] Margin sweep skipped: {}", e.getMessage(), e);
            errors.add("margin sweep: " + e.getMessage());
            return result;
        }

        for (AccountBook book : books) {
            try {
                result.booksChecked++;
                checkBook(book, thresholds, result);
            } catch (RuntimeException e) {
                log.error("[SWEEP] Margin check failed for user={} context={}: {}",
                    book.userId(), book.contextId(), e.getMessage(), e);
                errors.add("book " + book.userId() + "/" + book.contextId() + ": " + e.getMessage());
            }
        }
        return result;
    }

    private void checkBook(AccountBook stored, RiskThresholds thresholds, MarginSweep result) {
        Map<String, PriceQuote> prices = freshPrices(stored);
        AccountBook book = withoutClosing(stored, prices);
        MarginSnapshot snapshot = RiskCalculator.marginSnapshot(book, prices, thresholds);
        if (!snapshot.status().isAtLeast(MarginStatus.DANGER)) {
            return;
        }

        result.alerts++;
        log.warn("[SWEEP] user={} context={} margin level {}% ({}): equity={}, usedMargin={}",
            book.userId(), book.contextId(), formatLevel(snapshot.marginLevel()), snapshot.status(),
            snapshot.equity(), snapshot.usedMargin());
        notifyAlert(book, snapshot);

        if (snapshot.status() != MarginStatus.LIQUIDATION) {
            return;
        }
        LiquidationPlan plan = LiquidationPlanner.plan(book, prices, thresholds);
        Instant now = clock.instant();
        for (LiquidationPlan.PlannedClose close : plan.closes()) {
            BookPosition bp = close.position();
            String positionId = bp.position().positionId();
            if (!index.markClosing(positionId)) {
                log.debug("[SWEEP] Position {} already closing, not liquidating again", positionId);
                continue;
            }
            index.remove(positionId);
            try {
                queue.enqueue(QueuedTrade.close(bp.position(), close.exitPrice(), CloseReason.MARGIN_CALL, now));
            } catch (RuntimeException e) {
                index.release(positionId);
                throw e;
            }
            result.liquidations++;
            metrics.recordTrigger(CloseReason.MARGIN_CALL.code());
            log.warn("[SWEEP] Liquidating position={} {} {} @ {} (unrealized={})",
                bp.position().positionId(), bp.position().side(), bp.position().symbol(),
                close.exitPrice(), close.unrealizedPnl());
        }
        log.warn("[SWEEP] user={} context={}: {} positions queued for liquidation, projected margin level {}%",
            book.userId(), book.contextId(), plan.closes().size(), formatLevel(plan.projectedMarginLevel()));
    }

    /**
     * The book as it stands once every in-flight close settles at the
     * current price. Unpriced closing positions only give back their margin.
     */
    private AccountBook withoutClosing(AccountBook book, Map<String, PriceQuote> prices) {
        List<BookPosition> remaining = new ArrayList<>();
        BigDecimal capital = book.capital();
        BigDecimal usedMargin = book.usedMargin();
        for (BookPosition bp : book.positions()) {
            if (!index.isClosing(bp.position().positionId())) {
                remaining.add(bp);
                continue;
            }
            PriceQuote quote = prices.get(bp.position().symbol());
            if (quote != null) {
                capital = capital.add(RiskCalculator.unrealizedPnl(bp.position(), quote));
            }
            usedMargin = usedMargin.subtract(bp.marginUsed()).max(BigDecimal.ZERO);
        }
        if (remaining.size() == book.positions().size()) {
            return book;
        }
        return new AccountBook(book.userId(), book.contextId(), capital, usedMargin, remaining);
    }

    private Map<String, PriceQuote> freshPrices(AccountBook book) {
        Set<String> symbols = new LinkedHashSet<>();
        for (BookPosition bp : book.positions()) {
            symbols.add(bp.position().symbol());
        }
        Map<String, PriceQuote> prices = new LinkedHashMap<>();
        cache.getAll(symbols).forEach((symbol, quote) -> {
            if (!quote.stale()) {
                prices.put(symbol, quote);
            }
        });
        return prices;
    }

    private void notifyAlert(AccountBook book, MarginSnapshot snapshot) {
        try {
            closureSink.marginAlert(book, snapshot);
        } catch (RuntimeException e) {
            log.warn("[SWEEP] Margin alert delivery failed for user={}: {}", book.userId(), e.getMessage());
        }
    }

    private static String formatLevel(double level) {
        return Double.isInfinite(level) ? "∞" : String.format("%.2f", level);
    }

    private static final class MarginSweep {
        int booksChecked;
        int alerts;
        int liquidations;
    }
}
