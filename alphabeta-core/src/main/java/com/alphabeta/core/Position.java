package com.alphabeta.core;

import java.util.List;

/**
 * Capability a game position must provide to be searched by the alpha-beta engine and tracked by
 * a {@link GameHistory}.
 *
 * <p>Positions are value-like: the engine never shares an instance between two branches of the
 * search tree. Every child is produced by {@link #copy()} followed by {@link #apply(Object)} on the
 * copy, so implementations may mutate themselves freely inside {@code apply}.
 *
 * @param <M> the move type of the game
 * @param <P> the concrete position type
 */
public interface Position<M, P extends Position<M, P>> {

    /**
     * Lowest value {@link #evaluate()} may return.
     */
    int MIN_EVALUATION = -99_999;

    /**
     * Highest value {@link #evaluate()} may return.
     */
    int MAX_EVALUATION = 99_999;

    /**
     * Returns a deep copy that shares no mutable state with this position.
     */
    P copy();

    /**
     * Applies the move to this position in place.
     *
     * @throws InvalidMoveException if the move is not legal here; the position is left unchanged
     */
    void apply(M move);

    /**
     * Returns {@code true} if the game is over, i.e. a draw or a win for one of the players.
     * Games without an explicit end rule may rely on this default.
     */
    default boolean isTerminal() {
        return false;
    }

    /**
     * Returns the fitness of this position for the player to move, in the closed range
     * [{@link #MIN_EVALUATION}, {@link #MAX_EVALUATION}].
     */
    int evaluate();

    /**
     * Returns the moves available to the player to move. If the game allows passing, the pass move
     * must be returned when nothing else is possible, so the list is never empty for a live game.
     */
    List<M> legalMoves();
}
