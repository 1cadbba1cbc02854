package com.alphabeta.core.ai;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param ply   number of half-moves to look ahead; {@code 0} scores each root move statically
 * @param alpha initial lower bound of the search window, at least {@link #ALPHA}
 * @param beta  initial upper bound of the search window, at most {@link #BETA}
 */
public record SearchConstraints(int ply, int alpha, int beta) {

    /**
     * Default lower bound, strictly below any legal evaluation.
     */
    public static final int ALPHA = -100_000;

    /**
     * Default upper bound, strictly above any legal evaluation.
     */
    public static final int BETA = 100_000;

    public SearchConstraints {
        if (ply < 0) {
            throw new IllegalArgumentException("ply must not be negative");
        }
        if (alpha >= beta) {
            throw new IllegalArgumentException("alpha must be lower than beta");
        }
        if (alpha < ALPHA || beta > BETA) {
            throw new IllegalArgumentException(
                    String.format("window [%d, %d] must lie within [%d, %d]", alpha, beta, ALPHA, BETA));
        }
    }

    public static SearchConstraints ofPly(int ply) {
        return new SearchConstraints(ply, ALPHA, BETA);
    }
}
