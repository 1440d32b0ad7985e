package gambit.impl;

import gambit.contracts.*;
import gambit.model.Move;
import gambit.model.Position;
import gambit.model.UndoRecord;
import gambit.records.TTEntry;

import java.util.List;

import static gambit.constants.CoreConstants.*;

/**
 * Recursive negamax with alpha-beta pruning, MVV-LVA ordering and a depth-gated result cache.
 *
 * <p>Every node stores its result under its exact key before returning: the true score, the
 * mate/stalemate score, or the beta bound on a cutoff. Leaves (depth 0) are evaluated and never
 * stored. Not thread-safe; one instance per session.
 */
public final class AlphaBetaSearcherImpl implements Searcher {

    private final PositionFactory    positionFactory;
    private final MoveGenerator      moveGenerator;
    private final Evaluator          evaluator;
    private final MoveOrderer        moveOrderer;
    private final TranspositionTable transpositionTable;

    private long nodes;
    private long cacheHits;

    public AlphaBetaSearcherImpl(PositionFactory    pf,
                                 MoveGenerator      mg,
                                 Evaluator          eval,
                                 MoveOrderer        orderer,
                                 TranspositionTable tt) {
        this.positionFactory    = pf;
        this.moveGenerator      = mg;
        this.evaluator          = eval;
        this.moveOrderer        = orderer;
        this.transpositionTable = tt;
    }

    @Override
    public int search(Position pos, int depth, int alpha, int beta) {
        nodes++;

        String key = transpositionTable.key(pos, depth);
        TTEntry hit = transpositionTable.probe(key);
        if (hit != null && hit.depth() >= depth) {
            cacheHits++;
            return hit.score();
        }

        if (depth <= 0) {
            return evaluator.evaluate(pos);
        }

        List<Move> moves = moveGenerator.generateLegalMoves(pos);
        if (moves.isEmpty()) {
            int val = moveGenerator.isInCheck(pos, pos.sideToMove())
                    ? mateScore(depth)
                    : SCORE_STALEMATE;
            transpositionTable.store(key, depth, val);
            return val;
        }

        moveOrderer.orderMoves(pos, moves);

        int bestScore = -SCORE_INF;
        for (Move m : moves) {
            UndoRecord u = positionFactory.makeMove(pos, m);
            int score = -search(pos, depth - 1, -beta, -alpha);
            positionFactory.undoMove(pos, u);

            if (score >= beta) {
                transpositionTable.store(key, depth, beta);
                return beta;
            }
            if (score > bestScore) bestScore = score;
            if (score > alpha) alpha = score;
        }

        transpositionTable.store(key, depth, bestScore);
        return bestScore;
    }

    /**
     * Score of the side to move when it is checkmated with {@code depth} plies still to search.
     * Negated one level up this becomes {@code SCORE_MATE - depth}.
     */
    static int mateScore(int depth) {
        return -SCORE_MATE + depth;
    }

    @Override public long nodes()     { return nodes; }
    @Override public long cacheHits() { return cacheHits; }

    @Override
    public void resetStatistics() {
        nodes = 0;
        cacheHits = 0;
    }
}
