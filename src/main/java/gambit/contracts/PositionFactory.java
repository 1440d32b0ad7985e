package gambit.contracts;

import gambit.model.Move;
import gambit.model.Position;
import gambit.model.UndoRecord;

/**
 * Creates positions and applies / reverts moves on them in place.
 */
public interface PositionFactory {

    Position startPosition();

    /**
     * Parses the placement and active-colour fields of a FEN string. Castling, en-passant and
     * clock fields are accepted but ignored.
     *
     * @throws IllegalArgumentException if the placement or colour field is malformed
     */
    Position fromFen(String fen);

    String toFen(Position pos);

    /**
     * Moves the piece, applies any promotion, clears the source square and flips the side to
     * move.
     *
     * @return the record {@link #undoMove} needs to restore {@code pos} exactly
     */
    UndoRecord makeMove(Position pos, Move move);

    /** Exact inverse of the {@link #makeMove} call that produced {@code undo}. */
    void undoMove(Position pos, UndoRecord undo);
}
