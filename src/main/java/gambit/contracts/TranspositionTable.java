package gambit.contracts;

import gambit.model.Position;
import gambit.records.TTEntry;

/**
 * Search-result memo keyed by the exact board, the side to move and the requested depth.
 *
 * <ul>
 *   <li>{@link #store} overwrites unconditionally; there is no replacement policy.</li>
 *   <li>An entry is only reusable when its depth is at least the requested depth.</li>
 *   <li>Nothing is evicted; {@link #clear()} is the only way to shrink the table.</li>
 * </ul>
 *
 * Implementations are not synchronized. Callers searching from several threads must serialize
 * every search call against one table.
 */
public interface TranspositionTable {

    /** Exact key for {@code pos} searched to {@code depth}. */
    String key(Position pos, int depth);

    /** @return the stored entry, or {@code null} on a miss */
    TTEntry probe(String key);

    void store(String key, int depth, int score);

    void clear();

    int size();
}
