package gambit.contracts;

import gambit.model.Move;
import gambit.model.Position;

import java.util.List;

/**
 * Sorts a move list so that the moves most likely to cause a cutoff are searched first.
 * Ordering only; no move is ever removed.
 */
public interface MoveOrderer {

    /**
     * Sorts {@code moves} in place, best first. Moves with equal scores keep their relative order.
     *
     * @param pos   position the moves were generated from (used to look up the moving piece)
     * @param moves mutable move list
     */
    void orderMoves(Position pos, List<Move> moves);

    /** Ordering key of a single move; higher is searched earlier. */
    int score(Position pos, Move move);
}
