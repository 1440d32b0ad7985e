package gambit.records;

/**
 * Immutable set of root-search directives.
 *
 * Use the nested {@link Builder} to construct an instance of this record.
 *
 * @param depth              Nominal search depth in plies (before the material extension).
 * @param blunderProbability Per-root-move probability, in [0, 1], of returning that move
 *                           unsearched.
 */
public record SearchSpec(int depth, double blunderProbability) {

    /**
     * A builder for creating {@link SearchSpec} instances.
     */
    public static class Builder {
        private int depth = 4;
        private double blunderProbability = 0.0;

        public Builder depth(int depth) { this.depth = depth; return this; }
        public Builder blunderProbability(double p) { this.blunderProbability = p; return this; }

        public SearchSpec build() {
            if (depth < 1) {
                throw new IllegalArgumentException("depth must be >= 1, got " + depth);
            }
            if (!(blunderProbability >= 0.0 && blunderProbability <= 1.0)) {
                throw new IllegalArgumentException("blunder probability must be in [0, 1], got " + blunderProbability);
            }
            return new SearchSpec(depth, blunderProbability);
        }
    }
}
