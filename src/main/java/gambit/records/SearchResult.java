package gambit.records;

import gambit.model.Move;

/**
 * Outcome of one root search.
 *
 * @param bestMove  the move chosen, never {@code null}
 * @param score     negamax score of {@code bestMove} from the mover's point of view, or
 *                  {@link gambit.constants.CoreConstants#SCORE_NONE} for an unsearched pick
 * @param depth     root depth actually searched, including any material extension
 * @param blunder   {@code true} when the move was a random pick rather than the search's choice
 * @param nodes     searcher calls made during this root search
 * @param cacheHits result-cache hits during this root search
 */
public record SearchResult(
        Move    bestMove,
        int     score,
        int     depth,
        boolean blunder,
        long    nodes,
        long    cacheHits
) {}
