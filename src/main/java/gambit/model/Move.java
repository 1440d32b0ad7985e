package gambit.model;

/**
 * A single move.
 *
 * @param from      origin square (0-63)
 * @param to        destination square (0-63)
 * @param captured  occupant of {@code to} when the move was generated, or {@code null}. This is
 *                  the only information undo needs to restore captured material.
 * @param promotion promotion kind, or {@code null} when the move does not promote
 */
public record Move(int from, int to, Piece captured, Piece.Type promotion) {

  public Move(int from, int to, Piece captured) {
    this(from, to, captured, null);
  }

  public boolean isCapture() {
    return captured != null;
  }

  public boolean isPromotion() {
    return promotion != null;
  }

  /** Source and destination squares, e.g. {@code "e2e4"}. Never carries a promotion suffix. */
  public String toUci() {
    return Squares.toAlgebraic(from) + Squares.toAlgebraic(to);
  }

  @Override
  public String toString() {
    return toUci();
  }
}
