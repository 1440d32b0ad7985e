package gambit.contracts;

import gambit.model.Position;

/**
 * Fixed-depth negamax search with alpha-beta pruning.
 */
@FunctionalInterface
public interface Searcher {

    /**
     * Scores {@code pos} from the side to move's point of view. {@code pos} is mutated during the
     * search and restored before returning.
     */
    int search(Position pos, int depth, int alpha, int beta);

    /** Searcher calls since the last {@link #resetStatistics()}. */
    default long nodes() { return 0; }

    /** Result-cache hits since the last {@link #resetStatistics()}. */
    default long cacheHits() { return 0; }

    default void resetStatistics() {}
}
