package gambit.model;

import gambit.model.Piece.Color;

import java.util.Arrays;

/**
 * Mutable board state: 64 cells plus the side to move.
 *
 * <p>Cells hold a {@link Piece} or {@code null} for an empty square. Instances are mutated in
 * place by make/undo and are <em>not</em> thread-safe; every caller that probes moves needs
 * exclusive access for the duration of the probe.
 */
public final class Position {

  private static final char EMPTY = '.';

  private final Piece[] board;
  private Color sideToMove;

  public Position() {
    this(new Piece[64], Color.WHITE);
  }

  private Position(Piece[] board, Color sideToMove) {
    this.board = board;
    this.sideToMove = sideToMove;
  }

  /* ────── cell access ────── */
  public Piece get(int sq) {
    return board[sq];
  }

  public void set(int sq, Piece piece) {
    board[sq] = piece;
  }

  public void clear(int sq) {
    board[sq] = null;
  }

  public boolean isEmpty(int sq) {
    return board[sq] == null;
  }

  /* ────── side to move ────── */
  public Color sideToMove() {
    return sideToMove;
  }

  public void setSideToMove(Color side) {
    this.sideToMove = side;
  }

  public void flipSide() {
    sideToMove = sideToMove.opposite();
  }

  /* ────── snapshots ────── */
  public Position copy() {
    return new Position(board.clone(), sideToMove);
  }

  /** Copy of the 64 cells in index order; {@code null} marks an empty square. */
  public Piece[] snapshot() {
    return board.clone();
  }

  /** Exact 64-character board image, one FEN letter (or '.') per cell. */
  public String boardKey() {
    char[] cs = new char[64];
    for (int i = 0; i < 64; i++) {
      cs[i] = board[i] == null ? EMPTY : board[i].symbol();
    }
    return new String(cs);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Position p)) return false;
    return sideToMove == p.sideToMove && Arrays.equals(board, p.board);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(board) + sideToMove.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(80);
    for (int rank = 0; rank < 8; rank++) {
      sb.append(8 - rank).append(' ');
      for (int file = 0; file < 8; file++) {
        Piece p = board[rank * 8 + file];
        sb.append(p == null ? EMPTY : p.symbol());
      }
      sb.append('\n');
    }
    sb.append("  abcdefgh  ").append(sideToMove == Color.WHITE ? "w" : "b");
    return sb.toString();
  }
}
