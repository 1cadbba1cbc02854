package com.alphabeta.core.ai;

import java.util.Objects;
import java.util.Optional;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move          the chosen move, {@code null} unless {@code status} is {@link Status#MOVED}
 * @param score         the root score of {@code move}, or the initial alpha when none was chosen
 * @param ply           the depth the search was run to
 * @param visitedNodes  number of positions visited below the root
 * @param terminalHits  number of visited positions that were terminal
 * @param cutoffs       number of alpha-beta cutoffs
 * @param status        why the search ended the way it did
 * @param <M> the move type
 */
public record SearchResult<M>(M move, int score, int ply, long visitedNodes, long terminalHits, long cutoffs,
        Status status) {

    public SearchResult {
        Objects.requireNonNull(status, "status");
        if ((move != null) != (status == Status.MOVED)) {
            throw new IllegalArgumentException("A move must be present exactly when the status is MOVED");
        }
    }

    public static <M> SearchResult<M> withoutMove(Status status, int score, int ply) {
        return new SearchResult<>(null, score, ply, 0L, 0L, 0L, status);
    }

    public Optional<M> bestMove() {
        return Optional.ofNullable(move);
    }

    public boolean hasMove() {
        return status == Status.MOVED;
    }

    /**
     * Outcome of a root search.
     */
    public enum Status {
        /** A move improved on the initial alpha and was selected. */
        MOVED,
        /** The root position offered nothing to enumerate, not even a pass. */
        NO_LEGAL_MOVES,
        /** Moves were searched but none scored above the initial alpha. */
        NO_IMPROVEMENT,
        /** The root position is terminal. */
        GAME_OVER
    }
}
