package gambit.model;

/**
 * Immutable identity of a chess piece: a kind plus a colour.
 *
 * <p>An empty square is represented by {@code null} wherever a {@code Piece} is expected
 * (board cells, captured-piece fields). Colour tests are plain field comparisons.
 */
public record Piece(Type type, Color color) {

  /** The six piece kinds recognised by orthodox chess. */
  public enum Type {
    PAWN('p'),
    KNIGHT('n'),
    BISHOP('b'),
    ROOK('r'),
    QUEEN('q'),
    KING('k');

    private final char letter;

    Type(char letter) {
      this.letter = letter;
    }

    /** Lower-case FEN letter. */
    public char letter() {
      return letter;
    }
  }

  /** The two sides. */
  public enum Color {
    WHITE,
    BLACK;

    public Color opposite() {
      return this == WHITE ? BLACK : WHITE;
    }
  }

  /* ────── interned instances, one per (type, colour) ────── */
  private static final Piece[][] CACHE = new Piece[2][6];

  static {
    for (Color c : Color.values()) {
      for (Type t : Type.values()) {
        CACHE[c.ordinal()][t.ordinal()] = new Piece(t, c);
      }
    }
  }

  public Piece {
    if (type == null || color == null) {
      throw new IllegalArgumentException("type and color must not be null");
    }
  }

  public static Piece of(Type type, Color color) {
    return CACHE[color.ordinal()][type.ordinal()];
  }

  /**
   * Parses a FEN letter: upper case is White, lower case Black.
   *
   * @throws IllegalArgumentException for anything that is not one of {@code pnbrqkPNBRQK}
   */
  public static Piece fromSymbol(char c) {
    char lower = Character.toLowerCase(c);
    for (Type t : Type.values()) {
      if (t.letter == lower) {
        return of(t, Character.isUpperCase(c) ? Color.WHITE : Color.BLACK);
      }
    }
    throw new IllegalArgumentException("Invalid piece letter: " + c);
  }

  /** FEN letter, upper case for White. */
  public char symbol() {
    return color == Color.WHITE ? Character.toUpperCase(type.letter) : type.letter;
  }

  public boolean isWhite() {
    return color == Color.WHITE;
  }

  @Override
  public String toString() {
    return String.valueOf(symbol());
  }
}
