package com.alphabeta.core.reversi;

/**
 * A Reversi move: the coordinate a disc is placed on, or {@link #PASS}.
 *
 * @param x the row, or {@code -1} for a pass
 * @param y the column, or {@code -1} for a pass
 */
public record ReversiMove(int x, int y) {

    /**
     * Null move: changes only whose turn it is.
     */
    public static final ReversiMove PASS = new ReversiMove(-1, -1);

    public boolean isPass() {
        return x == -1 && y == -1;
    }

    @Override
    public String toString() {
        return isPass() ? "pass" : "(" + x + "," + y + ")";
    }
}
