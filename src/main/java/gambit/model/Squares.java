package gambit.model;

/**
 * Square-index helpers.
 *
 * <p>Index = rank * 8 + file. Rank index 0 is the back rank that holds Black's pieces in the
 * initial layout (algebraic rank 8); file 0 is the a-file. So a8 = 0, h8 = 7, a1 = 56, h1 = 63.
 */
public final class Squares {

  /** Returned by lookups that find nothing (e.g. a missing king). */
  public static final int NO_SQUARE = -1;

  private Squares() {}

  public static int fileOf(int sq) {
    return sq & 7;
  }

  public static int rankOf(int sq) {
    return sq >> 3;
  }

  public static boolean isOnBoard(int sq) {
    return sq >= 0 && sq < 64;
  }

  /** {@code 0 -> "a8"}, {@code 63 -> "h1"}. */
  public static String toAlgebraic(int sq) {
    return new String(new char[] {(char) ('a' + fileOf(sq)), (char) ('8' - rankOf(sq))});
  }

  /**
   * Parses a two-character square name.
   *
   * @return the square index, or {@link #NO_SQUARE} if {@code s} is not a valid square name
   */
  public static int fromAlgebraic(CharSequence s) {
    if (s == null || s.length() != 2) return NO_SQUARE;
    int file = s.charAt(0) - 'a';
    int rank = '8' - s.charAt(1);
    if (file < 0 || file > 7 || rank < 0 || rank > 7) return NO_SQUARE;
    return rank * 8 + file;
  }
}
