package gambit.impl;

import gambit.contracts.*;
import gambit.model.Move;
import gambit.model.Position;
import gambit.model.UndoRecord;
import gambit.records.SearchResult;
import gambit.records.SearchSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.random.RandomGenerator;

import static gambit.constants.CoreConstants.*;

/**
 * Root move selection on top of a {@link Searcher}.
 *
 * <ul>
 *   <li>Root moves are MVV-LVA ordered and walked in that order.</li>
 *   <li>Before each move is searched, a draw below the blunder probability returns that move
 *       unsearched.</li>
 *   <li>When either side is ahead by more than {@link gambit.constants.CoreConstants#MATERIAL_EXTENSION_THRESHOLD}
 *       the root depth grows by {@link gambit.constants.CoreConstants#MATERIAL_EXTENSION_PLIES}.</li>
 * </ul>
 *
 * The random source is owned by this instance and reused across calls.
 */
public final class SearchImpl implements Search {

    private static final Logger logger = LoggerFactory.getLogger(SearchImpl.class);

    /* immutable engine parts */
    private final PositionFactory positionFactory;
    private final MoveGenerator   moveGenerator;
    private final Evaluator       evaluator;
    private final MoveOrderer     moveOrderer;
    private final Searcher        searcher;
    private final RandomGenerator random;

    public SearchImpl(PositionFactory pf,
                      MoveGenerator   mg,
                      Evaluator       eval,
                      MoveOrderer     orderer,
                      Searcher        searcher,
                      RandomGenerator random) {

        this.positionFactory = pf;
        this.moveGenerator   = mg;
        this.evaluator       = eval;
        this.moveOrderer     = orderer;
        this.searcher        = searcher;
        this.random          = random;
    }

    @Override
    public SearchResult search(Position pos, SearchSpec spec) {
        List<Move> moves = moveGenerator.generateLegalMoves(pos);
        if (moves.isEmpty()) {
            throw new IllegalStateException("No legal moves, the game is already over");
        }

        int depth = spec.depth() + materialExtension(pos);
        double p = spec.blunderProbability();

        moveOrderer.orderMoves(pos, moves);
        searcher.resetStatistics();

        Move best = moves.get(0);
        int bestScore = -SCORE_INF;

        for (Move m : moves) {
            if (p > 0 && random.nextDouble() < p) {
                logger.debug("Random pick {} at depth {} (p={})", m, depth, p);
                return new SearchResult(m, SCORE_NONE, depth, true, searcher.nodes(), searcher.cacheHits());
            }

            UndoRecord u = positionFactory.makeMove(pos, m);
            int score = -searcher.search(pos, depth - 1, -SCORE_INF, SCORE_INF);
            positionFactory.undoMove(pos, u);

            if (score > bestScore) {
                bestScore = score;
                best = m;
            }
        }

        logger.debug("Best {} score {} depth {} nodes {} cache hits {}",
                best, bestScore, depth, searcher.nodes(), searcher.cacheHits());
        return new SearchResult(best, bestScore, depth, false, searcher.nodes(), searcher.cacheHits());
    }

    /** Extra plies granted once the material balance is lopsided. */
    int materialExtension(Position pos) {
        return Math.abs(evaluator.evaluate(pos)) > MATERIAL_EXTENSION_THRESHOLD
                ? MATERIAL_EXTENSION_PLIES
                : 0;
    }
}
