package com.alphabeta.core;

/**
 * Thrown when a position rejects a move.
 */
public class InvalidMoveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final transient Object move;

    public InvalidMoveException(Object move, String message) {
        super(message);
        this.move = move;
    }

    public InvalidMoveException(Object move, String message, Throwable cause) {
        super(message, cause);
        this.move = move;
    }

    /**
     * Returns the rejected move, possibly {@code null}.
     */
    public Object getMove() {
        return move;
    }
}
