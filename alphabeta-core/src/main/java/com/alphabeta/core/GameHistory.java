package com.alphabeta.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Ordered log of the positions reached in a match and the moves that produced them, with undo.
 *
 * <p>The log always holds exactly one more position than moves; the last position is the current
 * one. Both lists change together through {@link #push} and {@link #pop} only.
 *
 * @param <M> the move type of the game
 * @param <P> the position type
 */
public final class GameHistory<M, P extends Position<M, P>> {

    private static final Logger LOGGER = Logger.getLogger(GameHistory.class.getName());

    private final Transition<M, P> transition;
    private final List<P> positions = new ArrayList<>();
    private final List<M> moves = new ArrayList<>();

    /**
     * Creates a history that applies moves to a copy of the current position.
     */
    public GameHistory(P initialPosition) {
        this(initialPosition, Transition.copyAndApply());
    }

    public GameHistory(P initialPosition, Transition<M, P> transition) {
        this.transition = Objects.requireNonNull(transition, "transition");
        reset(initialPosition);
    }

    /**
     * Discards every recorded move and restarts the log from the provided position.
     */
    public void reset(P initialPosition) {
        Objects.requireNonNull(initialPosition, "initialPosition");
        positions.clear();
        moves.clear();
        positions.add(initialPosition);
    }

    /**
     * Returns the current position. Callers must not mutate it.
     */
    public P currentPosition() {
        return positions.get(positions.size() - 1);
    }

    /**
     * Returns the most recently applied move, if any.
     */
    public Optional<M> lastMove() {
        return moves.isEmpty() ? Optional.empty() : Optional.of(moves.get(moves.size() - 1));
    }

    /**
     * Applies the move to the current position and records the result.
     *
     * @return the new current position
     * @throws InvalidMoveException if the transition rejects the move; the log is left unchanged
     */
    public P applyMove(M move) {
        P current = currentPosition();
        P next;
        try {
            next = transition.next(current, move);
        } catch (InvalidMoveException ex) {
            throw ex;
        } catch (IllegalArgumentException ex) {
            throw new InvalidMoveException(move, "Move " + move + " was rejected", ex);
        }
        if (next == null || next == current) {
            throw new InvalidMoveException(move, "Transition produced no new position for move " + move);
        }
        push(move, next);
        LOGGER.fine(() -> String.format("Applied move %s (history=%d)", move, moves.size()));
        return next;
    }

    /**
     * Reverts the last applied move.
     *
     * @return the position that is current after the undo
     * @throws NoHistoryException if no move has been applied
     */
    public P undo() {
        if (moves.isEmpty()) {
            throw new NoHistoryException("No moves to undo");
        }
        M undone = pop();
        LOGGER.fine(() -> String.format("Undid move %s (history=%d)", undone, moves.size()));
        return currentPosition();
    }

    public boolean canUndo() {
        return !moves.isEmpty();
    }

    public int moveCount() {
        return moves.size();
    }

    /**
     * Returns the applied moves, oldest first.
     */
    public List<M> moves() {
        return Collections.unmodifiableList(new ArrayList<>(moves));
    }

    /**
     * Returns every recorded position, starting with the initial one.
     */
    public List<P> positions() {
        return Collections.unmodifiableList(new ArrayList<>(positions));
    }

    private void push(M move, P position) {
        positions.add(position);
        moves.add(move);
    }

    private M pop() {
        positions.remove(positions.size() - 1);
        return moves.remove(moves.size() - 1);
    }

    /**
     * Produces the position reached by playing a move.
     *
     * @param <M> the move type
     * @param <P> the position type
     */
    @FunctionalInterface
    public interface Transition<M, P extends Position<M, P>> {

        /**
         * Returns a new position with {@code move} applied to {@code current}, which must not be
         * modified.
         *
         * @throws InvalidMoveException if the move is rejected
         */
        P next(P current, M move);

        static <M, P extends Position<M, P>> Transition<M, P> copyAndApply() {
            return (current, move) -> {
                P next = current.copy();
                next.apply(move);
                return next;
            };
        }
    }
}
