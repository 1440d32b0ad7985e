package gambit.constants;

import gambit.model.Piece;

/**
 * Central place for engine-wide compile-time constants.
 */
public final class CoreConstants {

    private CoreConstants() {}

    /* ─────────────── Material (centipawns) ─────────────── */
    // Indexed by Piece.Type ordinal: P, N, B, R, Q, K
    private static final int[] PIECE_VALUE = {100, 320, 330, 500, 900, 20000};

    public static int pieceValue(Piece.Type type) {
        return PIECE_VALUE[type.ordinal()];
    }

    public static int pieceValue(Piece piece) {
        return piece == null ? 0 : PIECE_VALUE[piece.type().ordinal()];
    }

    /* ─────────────── Evaluation score space ───────────── */
    public static final int SCORE_INF = 1_000_000_000;
    // dominates any material difference the board can hold
    public static final int SCORE_MATE = 100_000;
    public static final int SCORE_DRAW = 0;
    public static final int SCORE_STALEMATE = SCORE_DRAW;
    /** Reported by the root when a move was chosen without being searched. */
    public static final int SCORE_NONE = SCORE_INF + 1;

    /* ─────────────── Root depth extension ─────────────── */
    // roughly a queen plus a rook
    public static final int MATERIAL_EXTENSION_THRESHOLD = 1500;
    public static final int MATERIAL_EXTENSION_PLIES = 2;

    /* ─────────────── Positions ─────────────── */
    public static final String START_FEN =
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w - - 0 1";
}
