package gambit.contracts;

import gambit.model.Move;
import gambit.model.Piece.Color;
import gambit.model.Position;

import java.util.List;

public interface MoveGenerator {

    /** Pseudo-legal moves for the side to move, in square-scan order. */
    List<Move> generateMoves(Position pos);

    /**
     * Moves that do not leave the mover's own king attacked. Probes each candidate on
     * {@code pos} and restores it, so the caller must hold exclusive access to {@code pos}.
     */
    List<Move> generateLegalMoves(Position pos);

    boolean isAttacked(Position pos, int sq, Color bySide);

    /** Square of {@code side}'s king, or {@link gambit.model.Squares#NO_SQUARE}. */
    int kingSquare(Position pos, Color side);

    boolean isInCheck(Position pos, Color side);
}
