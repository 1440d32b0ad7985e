package gambit.impl;

import gambit.contracts.MoveOrderer;
import gambit.model.Move;
import gambit.model.Position;

import java.util.List;

import static gambit.constants.CoreConstants.pieceValue;

/**
 * MVV-LVA: captures keyed by victim value minus attacker value, everything else keyed 0.
 * A capture that loses material on paper (QxP) therefore sorts behind the quiet moves.
 */
public final class MoveOrdererImpl implements MoveOrderer {

    private int[] scores = new int[64];

    @Override
    public void orderMoves(Position pos, List<Move> moves) {
        int count = moves.size();
        if (scores.length < count) scores = new int[count];

        for (int i = 0; i < count; i++) {
            scores[i] = score(pos, moves.get(i));
        }

        // Stable insertion sort (descending by score)
        for (int i = 1; i < count; i++) {
            int ms = scores[i], j = i - 1;
            Move mv = moves.get(i);
            while (j >= 0 && scores[j] < ms) {
                scores[j + 1] = scores[j];
                moves.set(j + 1, moves.get(j));
                j--;
            }
            scores[j + 1] = ms;
            moves.set(j + 1, mv);
        }
    }

    @Override
    public int score(Position pos, Move move) {
        if (!move.isCapture()) return 0;
        return pieceValue(move.captured()) - pieceValue(pos.get(move.from()));
    }
}
