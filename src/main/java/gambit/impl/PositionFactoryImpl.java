package gambit.impl;

import gambit.contracts.PositionFactory;
import gambit.model.Move;
import gambit.model.Piece;
import gambit.model.Piece.Color;
import gambit.model.Position;
import gambit.model.UndoRecord;

import java.util.Objects;

import static gambit.constants.CoreConstants.START_FEN;

public final class PositionFactoryImpl implements PositionFactory {

    @Override
    public Position startPosition() {
        return fromFen(START_FEN);
    }

    /* ── FEN ───────────────────────────────────────────────────── */

    @Override
    public Position fromFen(String fen) {
        Objects.requireNonNull(fen, "FEN must not be null");
        String[] tokens = fen.trim().split("\\s+");
        if (tokens.length < 2) {
            throw new IllegalArgumentException("FEN needs at least placement and colour fields, got " + tokens.length);
        }

        Position pos = new Position();

        /* 1) board: first FEN rank is rank index 0 */
        int rank = 0, file = 0;
        String field = tokens[0];
        for (int idx = 0; idx < field.length(); ++idx) {
            char c = field.charAt(idx);
            if (c == '/') {
                if (file != 8) throw new IllegalArgumentException("Incomplete rank " + (8 - rank) + " in FEN");
                rank++;
                file = 0;
                continue;
            }
            if (rank > 7) throw new IllegalArgumentException("Too many ranks in FEN");
            if (c >= '1' && c <= '8') {
                file += c - '0';
            } else {
                if (file >= 8) throw new IllegalArgumentException("Too many files in rank " + (8 - rank));
                pos.set(rank * 8 + file, Piece.fromSymbol(c));
                file++;
            }
            if (file > 8) throw new IllegalArgumentException("Too many files in rank " + (8 - rank));
        }
        if (rank != 7 || file != 8) throw new IllegalArgumentException("Incomplete board in FEN");

        /* 2) active colour */
        switch (tokens[1]) {
            case "w" -> pos.setSideToMove(Color.WHITE);
            case "b" -> pos.setSideToMove(Color.BLACK);
            default -> throw new IllegalArgumentException("Invalid active colour: " + tokens[1]);
        }
        return pos;
    }

    @Override
    public String toFen(Position pos) {
        StringBuilder sb = new StringBuilder(80);
        for (int rank = 0; rank < 8; ++rank) {
            int empty = 0;
            for (int file = 0; file < 8; ++file) {
                Piece p = pos.get(rank * 8 + file);
                if (p == null) {
                    empty++;
                    continue;
                }
                if (empty != 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(p.symbol());
            }
            if (empty != 0) sb.append(empty);
            if (rank != 7) sb.append('/');
        }
        sb.append(' ').append(pos.sideToMove() == Color.WHITE ? 'w' : 'b').append(" - - 0 1");
        return sb.toString();
    }

    /* ── make / undo ───────────────────────────────────────────── */

    @Override
    public UndoRecord makeMove(Position pos, Move m) {
        Piece mover = pos.get(m.from());
        pos.set(m.to(), m.isPromotion() ? Piece.of(m.promotion(), mover.color()) : mover);
        pos.clear(m.from());
        pos.flipSide();
        return new UndoRecord(m);
    }

    @Override
    public void undoMove(Position pos, UndoRecord undo) {
        Move m = undo.move();
        pos.flipSide();
        Piece moved = pos.get(m.to());
        // a promoted piece goes back as a pawn of its own colour
        pos.set(m.from(), m.isPromotion() ? Piece.of(Piece.Type.PAWN, moved.color()) : moved);
        pos.set(m.to(), m.captured());
    }
}
