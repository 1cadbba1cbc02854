package com.alphabeta.core.ai;

import com.alphabeta.core.Position;

/**
 * Generic interface for game tree search implementations.
 *
 * @param <M> the move type
 * @param <P> the position type
 */
public interface Searcher<M, P extends Position<M, P>> {

    /**
     * Executes a search for the best move in the provided position under the supplied
     * {@link SearchConstraints}. The position itself is never modified.
     *
     * @param position the starting position to analyse
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     */
    SearchResult<M> search(P position, SearchConstraints constraints);
}
