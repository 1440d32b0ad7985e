package gambit.contracts;

import gambit.constants.Difficulty;
import gambit.model.Piece;
import gambit.model.Piece.Color;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A single game session: one position, one result cache, one difficulty.
 *
 * <p>Moves are exchanged as four-character strings made of the source and destination squares
 * ({@code "e2e4"}); promotions always produce a queen and carry no suffix.
 */
public interface Game extends AutoCloseable {

    /** Resets to the initial position and applies {@code level} (1, 2, or 3). */
    void newGame(int level);

    /** Changes the difficulty only. Clears the result cache. */
    void setDifficulty(int level);

    Difficulty difficulty();

    /** Replaces the current position. Capture lists and last-move text are reset. */
    void setPosition(String fen);

    List<String> legalMoves();

    /**
     * Applies a legal move given as {@code "e2e4"}.
     *
     * @return {@code false}, leaving the position untouched, when the string is malformed or the
     *     move is not legal
     */
    boolean applyPlayerMove(String move);

    /**
     * Searches, applies and returns the engine's move.
     *
     * @throws IllegalStateException if the game is already over
     */
    String computeAiMove();

    /** {@link #computeAiMove()} on the session's worker thread. */
    CompletableFuture<String> computeAiMoveAsync();

    /** 64 cells in index order; {@code null} marks an empty square. */
    Piece[] boardSnapshot();

    Color sideToMove();

    boolean inCheck();

    boolean isCheckmate();

    boolean isStalemate();

    List<Piece> playerCaptures();

    List<Piece> engineCaptures();

    /** Display text for the last move applied, empty before the first move. */
    String lastMove();

    String toFen();

    @Override
    void close();
}
