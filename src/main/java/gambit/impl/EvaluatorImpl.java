package gambit.impl;

import gambit.constants.CoreConstants;
import gambit.contracts.Evaluator;
import gambit.model.Piece;
import gambit.model.Piece.Color;
import gambit.model.Position;

/**
 * Pure material count. Stateless and thread-safe.
 */
public final class EvaluatorImpl implements Evaluator {

    @Override
    public int evaluate(Position pos) {
        int diff = 0;   // >0: White is better
        for (int sq = 0; sq < 64; ++sq) {
            Piece p = pos.get(sq);
            if (p == null) continue;
            int v = CoreConstants.pieceValue(p.type());
            diff += p.color() == Color.WHITE ? v : -v;
        }
        return pos.sideToMove() == Color.WHITE ? diff : -diff;
    }
}
