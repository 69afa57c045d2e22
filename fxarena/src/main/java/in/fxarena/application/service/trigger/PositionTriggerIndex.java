package in.fxarena.application.service.trigger;

import in.fxarena.domain.position.TrackedPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PositionTriggerIndex - in-memory lookup of positions with exit levels.
 *
 * PURPOSE:
 * On every accepted tick we need every position on that symbol that carries
 * a stop-loss or take-profit. A store query per tick is out of the question,
 * so the index answers in O(k) for k positions on the symbol.
 *
 * STRUCTURE:
 * - Map<symbol, Map<positionId, TrackedPosition>>
 * - Map<positionId, symbol> for reverse lookup
 *
 * CLAIMING:
 * {@link #markClosing(String)} admits one caller per position. The winner
 * removes the entry and enqueues the close; the mark outlives rebuilds and
 * upserts, so a store reload that still lists the position cannot re-arm it
 * while the close is queued. The settler {@link #release(String) releases}
 * the mark once the close is settled or abandoned.
 *
 * LIFECYCLE:
 * 1. Rebuilt wholesale from the position store on startup and every sweep
 * 2. Upserted when a position opens or its exit levels change
 * 3. Marked closing and removed when a trigger fires or the position is liquidated
 * 4. Released when the queued close leaves the queue
 */
public final class PositionTriggerIndex {
    private static final Logger log = LoggerFactory.getLogger(PositionTriggerIndex.class);

    // Swapped as a unit on rebuild
    private volatile Entries entries = new Entries();

    // Positions with a close in flight; survives rebuild
    private final Set<String> closing = ConcurrentHashMap.newKeySet();

    /**
     * Replace the whole index with a fresh load. Positions without exit
     * levels are skipped.
     */
    public void rebuild(Collection<TrackedPosition> positions) {
        Entries fresh = new Entries();
        int skipped = 0;
        int inFlight = 0;
        for (TrackedPosition p : positions) {
            if (closing.contains(p.positionId())) {
                inFlight++;
            } else if (p.hasExitLevels()) {
                fresh.put(p);
            } else {
                skipped++;
            }
        }
        entries = fresh;
        log.info("[SLTP] Index rebuilt: {} symbols, {} positions ({} without exit levels, {} closing skipped)",
            fresh.bySymbol.size(), fresh.positionToSymbol.size(), skipped, inFlight);
    }

    /**
     * Add or replace a position. A position with no exit levels is removed
     * instead, since nothing can trigger it. Ignored while a close is in flight.
     */
    public void upsert(TrackedPosition position) {
        if (closing.contains(position.positionId())) {
            log.debug("[SLTP] Not indexing {}: close in flight", position.positionId());
            return;
        }
        if (!position.hasExitLevels()) {
            remove(position.positionId());
            return;
        }
        Entries current = entries;
        String previousSymbol = current.positionToSymbol.get(position.positionId());
        if (previousSymbol != null && !previousSymbol.equals(position.symbol())) {
            current.remove(position.positionId());
        }
        current.put(position);
        log.debug("[SLTP] Indexed {} on {} (SL={}, TP={})",
            position.positionId(), position.symbol(), position.stopLoss(), position.takeProfit());
    }

    /**
     * Remove a position.
     *
     * @return the removed position, only for the caller that removed it
     */
    public Optional<TrackedPosition> remove(String positionId) {
        Optional<TrackedPosition> removed = entries.remove(positionId);
        removed.ifPresent(p -> log.debug("[SLTP] Removed {} from index", positionId));
        return removed;
    }

    /**
     * Claim a position for closing.
     *
     * @return true only for the first caller; false while another close is in flight
     */
    public boolean markClosing(String positionId) {
        return closing.add(positionId);
    }

    /**
     * Drop the closing mark so the position can be indexed again.
     */
    public void release(String positionId) {
        if (closing.remove(positionId)) {
            log.debug("[SLTP] Released closing mark for {}", positionId);
        }
    }

    public boolean isClosing(String positionId) {
        return closing.contains(positionId);
    }

    /**
     * Seed closing marks, e.g. from closes still queued at startup.
     */
    public void markAllClosing(Collection<String> positionIds) {
        closing.addAll(positionIds);
        positionIds.forEach(entries::remove);
        if (!positionIds.isEmpty()) {
            log.info("[SLTP] {} positions marked closing from the queue", positionIds.size());
        }
    }

    public Set<String> closingIds() {
        return Set.copyOf(closing);
    }

    /**
     * Snapshot of positions on a symbol (safe to iterate, may be empty).
     */
    public List<TrackedPosition> forSymbol(String symbol) {
        Map<String, TrackedPosition> positions = entries.bySymbol.get(symbol);
        return positions != null ? new ArrayList<>(positions.values()) : List.of();
    }

    public Optional<TrackedPosition> get(String positionId) {
        Entries current = entries;
        String symbol = current.positionToSymbol.get(positionId);
        if (symbol == null) {
            return Optional.empty();
        }
        Map<String, TrackedPosition> positions = current.bySymbol.get(symbol);
        return positions != null ? Optional.ofNullable(positions.get(positionId)) : Optional.empty();
    }

    public boolean contains(String positionId) {
        return entries.positionToSymbol.containsKey(positionId);
    }

    public Set<String> symbols() {
        return Set.copyOf(entries.bySymbol.keySet());
    }

    public int size() {
        return entries.positionToSymbol.size();
    }

    public int symbolCount() {
        return entries.bySymbol.size();
    }

    /**
     * Get statistics for monitoring/debugging.
     */
    public IndexStats getStats() {
        Entries current = entries;
        int totalPositions = current.positionToSymbol.size();
        int totalSymbols = current.bySymbol.size();
        int maxPerSymbol = current.bySymbol.values().stream()
            .mapToInt(Map::size)
            .max()
            .orElse(0);
        return new IndexStats(totalPositions, totalSymbols, maxPerSymbol, closing.size());
    }

    /**
     * Index statistics for monitoring.
     */
    public record IndexStats(int totalPositions, int totalSymbols, int maxPositionsPerSymbol,
                             int closingPositions) {}

    private static final class Entries {
        final ConcurrentHashMap<String, Map<String, TrackedPosition>> bySymbol = new ConcurrentHashMap<>();
        final ConcurrentHashMap<String, String> positionToSymbol = new ConcurrentHashMap<>();

        void put(TrackedPosition p) {
            bySymbol.compute(p.symbol(), (symbol, positions) -> {
                Map<String, TrackedPosition> target = positions != null ? positions : new ConcurrentHashMap<>();
                target.put(p.positionId(), p);
                return target;
            });
            positionToSymbol.put(p.positionId(), p.symbol());
        }

        Optional<TrackedPosition> remove(String positionId) {
            String symbol = positionToSymbol.remove(positionId);
            if (symbol == null) {
                return Optional.empty();
            }
            TrackedPosition[] removed = new TrackedPosition[1];
            bySymbol.computeIfPresent(symbol, (s, positions) -> {
                removed[0] = positions.remove(positionId);
                // Drop empty symbol buckets
                return positions.isEmpty() ? null : positions;
            });
            return Optional.ofNullable(removed[0]);
        }
    }
}
