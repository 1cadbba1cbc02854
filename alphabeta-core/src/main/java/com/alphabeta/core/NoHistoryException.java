package com.alphabeta.core;

/**
 * Thrown by {@link GameHistory#undo()} when no move has been applied yet.
 */
public class NoHistoryException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public NoHistoryException(String message) {
        super(message);
    }
}
