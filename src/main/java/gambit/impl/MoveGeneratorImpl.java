package gambit.impl;

import gambit.contracts.MoveGenerator;
import gambit.contracts.PositionFactory;
import gambit.model.Move;
import gambit.model.Piece;
import gambit.model.Piece.Color;
import gambit.model.Piece.Type;
import gambit.model.Position;
import gambit.model.UndoRecord;

import java.util.ArrayList;
import java.util.List;

import static gambit.model.Squares.*;

/**
 * Mailbox move generator over the 64-cell board.
 *
 * <p>Every offset step is validated against the file of the square it came from, so no ray or
 * jump can wrap from the h-file onto the a-file (or back). Legality is decided purely by
 * simulation: each pseudo-legal move is made, the mover's king is tested, and the move is
 * taken back.
 */
public final class MoveGeneratorImpl implements MoveGenerator {

    /* ── direction tables ───────────────────────────────────────── */
    private static final int[] KNIGHT_OFFSETS = {-17, -15, -10, -6, 6, 10, 15, 17};
    private static final int[] BISHOP_OFFSETS = {-9, -7, 7, 9};
    private static final int[] ROOK_OFFSETS   = {-8, -1, 1, 8};
    private static final int[] KING_OFFSETS   = {-9, -8, -7, -1, 1, 7, 8, 9};

    private final PositionFactory positionFactory;

    public MoveGeneratorImpl() {
        this(new PositionFactoryImpl());
    }

    public MoveGeneratorImpl(PositionFactory positionFactory) {
        this.positionFactory = positionFactory;
    }

    /* ═════════════════════════ pseudo-legal ═════════════════════════ */

    @Override
    public List<Move> generateMoves(Position pos) {
        List<Move> moves = new ArrayList<>(48);
        Color us = pos.sideToMove();

        for (int s = 0; s < 64; ++s) {
            Piece pc = pos.get(s);
            if (pc == null || pc.color() != us) continue;

            switch (pc.type()) {
                case PAWN   -> pawnMoves(pos, s, us, moves);
                case KNIGHT -> stepMoves(pos, s, us, KNIGHT_OFFSETS, 2, moves);
                case BISHOP -> slideMoves(pos, s, us, BISHOP_OFFSETS, moves);
                case ROOK   -> slideMoves(pos, s, us, ROOK_OFFSETS, moves);
                case QUEEN  -> {
                    slideMoves(pos, s, us, BISHOP_OFFSETS, moves);
                    slideMoves(pos, s, us, ROOK_OFFSETS, moves);
                }
                case KING   -> stepMoves(pos, s, us, KING_OFFSETS, 1, moves);
            }
        }
        return moves;
    }

    private static void pawnMoves(Position pos, int s, Color us, List<Move> moves) {
        int dir = us == Color.WHITE ? -8 : 8;
        int startRank = us == Color.WHITE ? 6 : 1;

        // single push, then double push from the starting rank
        int to = s + dir;
        if (isOnBoard(to) && pos.isEmpty(to)) {
            addPawnMove(pos, s, to, moves);

            int dbl = s + 2 * dir;
            if (rankOf(s) == startRank && isOnBoard(dbl) && pos.isEmpty(dbl)) {
                addMove(pos, s, dbl, null, moves);
            }
        }

        // diagonal captures
        for (int dx = -1; dx <= 1; dx += 2) {
            int cap = s + dir + dx;
            if (!isOnBoard(cap) || Math.abs(fileOf(cap) - fileOf(s)) != 1) continue;
            Piece victim = pos.get(cap);
            if (victim != null && victim.color() != us) {
                addPawnMove(pos, s, cap, moves);
            }
        }
    }

    private static void addPawnMove(Position pos, int from, int to, List<Move> moves) {
        int r = rankOf(to);
        addMove(pos, from, to, (r == 0 || r == 7) ? Type.QUEEN : null, moves);
    }

    /** Knight and king jumps; {@code maxFileDelta} rejects jumps that wrapped around an edge. */
    private static void stepMoves(Position pos, int s, Color us, int[] offsets, int maxFileDelta, List<Move> moves) {
        for (int d : offsets) {
            int t = s + d;
            if (!isOnBoard(t) || Math.abs(fileOf(s) - fileOf(t)) > maxFileDelta) continue;
            Piece target = pos.get(t);
            if (target == null || target.color() != us) {
                addMove(pos, s, t, null, moves);
            }
        }
    }

    private static void slideMoves(Position pos, int s, Color us, int[] offsets, List<Move> moves) {
        for (int d : offsets) {
            int t = s;
            while (true) {
                int prev = t;
                t += d;
                if (!stillOnRay(prev, t, d)) break;

                Piece target = pos.get(t);
                if (target == null) {
                    addMove(pos, s, t, null, moves);
                    continue;
                }
                if (target.color() != us) {
                    addMove(pos, s, t, null, moves);
                }
                break;
            }
        }
    }

    /** One step along a ray from {@code prev} to {@code t}: on the board and not wrapped. */
    private static boolean stillOnRay(int prev, int t, int d) {
        if (!isOnBoard(t)) return false;
        return d == 8 || d == -8 || Math.abs(fileOf(prev) - fileOf(t)) == 1;
    }

    /** Records the occupant of {@code to} as the capture. A move onto a king is never emitted. */
    private static void addMove(Position pos, int from, int to, Type promo, List<Move> moves) {
        Piece captured = pos.get(to);
        if (captured != null && captured.type() == Type.KING) return;
        moves.add(new Move(from, to, captured, promo));
    }

    /* ═════════════════════════ legality ═════════════════════════ */

    @Override
    public List<Move> generateLegalMoves(Position pos) {
        List<Move> pseudo = generateMoves(pos);
        List<Move> legal = new ArrayList<>(pseudo.size());
        Color mover = pos.sideToMove();

        for (Move m : pseudo) {
            UndoRecord u = positionFactory.makeMove(pos, m);
            if (!isInCheck(pos, mover)) {
                legal.add(m);
            }
            positionFactory.undoMove(pos, u);
        }
        return legal;
    }

    /* ═════════════════════════ attacks ═════════════════════════ */

    @Override
    public boolean isAttacked(Position pos, int target, Color bySide) {
        if (!isOnBoard(target)) return false;

        // pawns sit one rank behind the target, from the attacker's point of view
        int dir = bySide == Color.WHITE ? 8 : -8;
        for (int dx = -1; dx <= 1; dx += 2) {
            int sq = target + dir + dx;
            if (isOnBoard(sq) && Math.abs(fileOf(sq) - fileOf(target)) == 1
                    && is(pos.get(sq), Type.PAWN, bySide)) {
                return true;
            }
        }

        for (int d : KNIGHT_OFFSETS) {
            int sq = target + d;
            if (isOnBoard(sq) && Math.abs(fileOf(target) - fileOf(sq)) <= 2
                    && is(pos.get(sq), Type.KNIGHT, bySide)) {
                return true;
            }
        }

        if (slidingAttack(pos, target, bySide, BISHOP_OFFSETS, Type.BISHOP)) return true;
        if (slidingAttack(pos, target, bySide, ROOK_OFFSETS, Type.ROOK)) return true;

        for (int d : KING_OFFSETS) {
            int sq = target + d;
            if (isOnBoard(sq) && Math.abs(fileOf(target) - fileOf(sq)) <= 1
                    && is(pos.get(sq), Type.KING, bySide)) {
                return true;
            }
        }
        return false;
    }

    /** Walks each ray to the first occupied square; only that square can attack. */
    private static boolean slidingAttack(Position pos, int target, Color bySide, int[] offsets, Type slider) {
        for (int d : offsets) {
            int prev = target;
            for (int sq = target + d; stillOnRay(prev, sq, d); prev = sq, sq += d) {
                Piece p = pos.get(sq);
                if (p == null) continue;
                if (p.color() == bySide && (p.type() == slider || p.type() == Type.QUEEN)) {
                    return true;
                }
                break;
            }
        }
        return false;
    }

    private static boolean is(Piece p, Type type, Color color) {
        return p != null && p.type() == type && p.color() == color;
    }

    @Override
    public int kingSquare(Position pos, Color side) {
        for (int i = 0; i < 64; ++i) {
            if (is(pos.get(i), Type.KING, side)) return i;
        }
        return NO_SQUARE;
    }

    /** A side without a king is never in check. */
    @Override
    public boolean isInCheck(Position pos, Color side) {
        int k = kingSquare(pos, side);
        if (k == NO_SQUARE) return false;
        return isAttacked(pos, k, side.opposite());
    }
}
