package gambit.constants;

/**
 * Difficulty tiers offered to a host. Each tier is a fixed search depth plus the probability of
 * playing a deliberately unsearched root move.
 */
public enum Difficulty {
    EASY(1, 2, 0.35),
    MEDIUM(2, 4, 0.0),
    HARD(3, 6, 0.0);

    private final int level;
    private final int searchDepth;
    private final double blunderProbability;

    Difficulty(int level, int searchDepth, double blunderProbability) {
        this.level = level;
        this.searchDepth = searchDepth;
        this.blunderProbability = blunderProbability;
    }

    public int level()                 { return level; }
    public int searchDepth()           { return searchDepth; }
    public double blunderProbability() { return blunderProbability; }

    /** 1 is easy, 2 is medium, every other value is the hardest tier. */
    public static Difficulty fromLevel(int level) {
        return switch (level) {
            case 1 -> EASY;
            case 2 -> MEDIUM;
            default -> HARD;
        };
    }
}
