package com.alphabeta.core.ai;

/**
 * Call-back sink for search progress. Every method has an empty default so implementations only
 * override the events they care about. Listeners observe; they cannot influence the result.
 *
 * @param <M> the move type
 */
public interface SearchListener<M> {

    /**
     * Called once before the root moves are enumerated.
     */
    default void searchStarted(int ply) {
    }

    /**
     * Called after each root move has been scored.
     *
     * @param improved {@code true} if the move became the new best move
     */
    default void rootMoveScored(M move, int score, boolean improved) {
    }

    /**
     * Called when a node stops searching its remaining children because {@code alpha >= beta}.
     */
    default void cutoff(int depthRemaining, int alpha, int beta) {
    }

    /**
     * Called exactly once per search with the final result.
     */
    default void searchCompleted(SearchResult<M> result) {
    }

    /**
     * Returns a listener that ignores every event.
     */
    static <M> SearchListener<M> none() {
        return new SearchListener<>() {
        };
    }
}
