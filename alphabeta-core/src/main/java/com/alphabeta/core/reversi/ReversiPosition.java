package com.alphabeta.core.reversi;

import com.alphabeta.core.InvalidMoveException;
import com.alphabeta.core.Position;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Mutable Reversi (Othello) position: a square board and the player to move.
 *
 * <p>Cells are addressed by row {@code x} and column {@code y}, both starting at zero. Player one
 * moves first. The game ends when neither player can place a disc.
 */
public final class ReversiPosition implements Position<ReversiMove, ReversiPosition> {

    public static final int EMPTY = 0;
    public static final int PLAYER_ONE = 1;
    public static final int PLAYER_TWO = 2;
    public static final int DEFAULT_SIZE = 8;

    private static final int[][] DIRECTIONS = {
            {-1, 0}, {1, 0}, {0, -1}, {0, 1},
            {-1, -1}, {-1, 1}, {1, 1}, {1, -1}
    };

    private final int size;
    private final int[] cells;
    private int player;

    /**
     * Creates the standard 8x8 starting position.
     */
    public ReversiPosition() {
        this(DEFAULT_SIZE);
    }

    /**
     * Creates the starting position on a board of the given even size, with the four centre discs
     * placed diagonally.
     */
    public ReversiPosition(int size) {
        this(checkSize(size), new int[size * size], PLAYER_ONE);
        int half = size / 2;
        set(half - 1, half - 1, PLAYER_ONE);
        set(half, half, PLAYER_ONE);
        set(half - 1, half, PLAYER_TWO);
        set(half, half - 1, PLAYER_TWO);
    }

    private ReversiPosition(int size, int[] cells, int player) {
        this.size = size;
        this.cells = cells;
        this.player = player;
    }

    /**
     * Creates a position from an explicit layout, {@code cells[x][y]} holding {@link #EMPTY},
     * {@link #PLAYER_ONE} or {@link #PLAYER_TWO}.
     */
    public static ReversiPosition of(int[][] cells, int playerToMove) {
        Objects.requireNonNull(cells, "cells");
        int size = checkSize(cells.length);
        checkPlayer(playerToMove);
        int[] flat = new int[size * size];
        for (int x = 0; x < size; x++) {
            if (cells[x] == null || cells[x].length != size) {
                throw new IllegalArgumentException("Board must be square, row " + x + " has the wrong length");
            }
            for (int y = 0; y < size; y++) {
                int value = cells[x][y];
                if (value != EMPTY) {
                    checkPlayer(value);
                }
                flat[x * size + y] = value;
            }
        }
        return new ReversiPosition(size, flat, playerToMove);
    }

    @Override
    public ReversiPosition copy() {
        return new ReversiPosition(size, cells.clone(), player);
    }

    public int size() {
        return size;
    }

    /**
     * Returns the player to move, {@link #PLAYER_ONE} or {@link #PLAYER_TWO}.
     */
    public int currentPlayer() {
        return player;
    }

    public int cellAt(int x, int y) {
        checkCoordinate(x, y);
        return get(x, y);
    }

    public int discCount(int owner) {
        checkPlayer(owner);
        int count = 0;
        for (int cell : cells) {
            if (cell == owner) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns {@code true} if the player to move may place a disc on the given cell: it is empty
     * and, in at least one direction, a run of opponent discs ends in one of the mover's own.
     */
    public boolean isLegal(int x, int y) {
        if (!onBoard(x, y) || get(x, y) != EMPTY) {
            return false;
        }
        for (int[] direction : DIRECTIONS) {
            if (outflanked(x, y, direction[0], direction[1], player) > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the legal placements in row-major order, or only {@link ReversiMove#PASS} if there
     * are none.
     */
    @Override
    public List<ReversiMove> legalMoves() {
        List<ReversiMove> moves = new ArrayList<>();
        for (int x = 0; x < size; x++) {
            for (int y = 0; y < size; y++) {
                if (isLegal(x, y)) {
                    moves.add(new ReversiMove(x, y));
                }
            }
        }
        if (moves.isEmpty()) {
            moves.add(ReversiMove.PASS);
        }
        return moves;
    }

    @Override
    public void apply(ReversiMove move) {
        Objects.requireNonNull(move, "move");
        int opponent = opponentOf(player);
        if (move.isPass()) {
            player = opponent;
            return;
        }

        int x = move.x();
        int y = move.y();
        if (!onBoard(x, y)) {
            throw new InvalidMoveException(move, "Move " + move + " is outside the board");
        }
        if (get(x, y) != EMPTY) {
            throw new InvalidMoveException(move, "Cell " + move + " is already occupied");
        }

        int[] runs = new int[DIRECTIONS.length];
        boolean flips = false;
        for (int d = 0; d < DIRECTIONS.length; d++) {
            runs[d] = outflanked(x, y, DIRECTIONS[d][0], DIRECTIONS[d][1], player);
            flips |= runs[d] > 0;
        }
        if (!flips) {
            throw new InvalidMoveException(move, "Move " + move + " does not outflank any disc");
        }

        for (int d = 0; d < DIRECTIONS.length; d++) {
            for (int step = 1; step <= runs[d]; step++) {
                set(x + step * DIRECTIONS[d][0], y + step * DIRECTIONS[d][1], player);
            }
        }
        set(x, y, player);
        player = opponent;
    }

    /**
     * Mobility: the number of placements available to the player to move minus those available to
     * the opponent. Passes are not counted.
     */
    @Override
    public int evaluate() {
        int mine = mobility();
        int mover = player;
        player = opponentOf(mover);
        try {
            return mine - mobility();
        } finally {
            player = mover;
        }
    }

    /**
     * Returns {@code true} once neither player can place a disc.
     */
    @Override
    public boolean isTerminal() {
        if (mobility() > 0) {
            return false;
        }
        int mover = player;
        player = opponentOf(mover);
        try {
            return mobility() == 0;
        } finally {
            player = mover;
        }
    }

    /**
     * Returns the player holding more discs, or {@link #EMPTY} for a draw.
     */
    public int winner() {
        int first = discCount(PLAYER_ONE);
        int second = discCount(PLAYER_TWO);
        if (first == second) {
            return EMPTY;
        }
        return first > second ? PLAYER_ONE : PLAYER_TWO;
    }

    public static int opponentOf(int player) {
        checkPlayer(player);
        return PLAYER_ONE + PLAYER_TWO - player;
    }

    private int mobility() {
        int count = 0;
        for (int x = 0; x < size; x++) {
            for (int y = 0; y < size; y++) {
                if (isLegal(x, y)) {
                    count++;
                }
            }
        }
        return count;
    }

    // Length of the opponent run starting next to (x, y) that is closed by one of mover's discs, or 0.
    private int outflanked(int x, int y, int dx, int dy, int mover) {
        int opponent = opponentOf(mover);
        int tx = x + dx;
        int ty = y + dy;
        int run = 0;
        while (onBoard(tx, ty) && get(tx, ty) == opponent) {
            tx += dx;
            ty += dy;
            run++;
        }
        if (run > 0 && onBoard(tx, ty) && get(tx, ty) == mover) {
            return run;
        }
        return 0;
    }

    private boolean onBoard(int x, int y) {
        return x >= 0 && x < size && y >= 0 && y < size;
    }

    private int get(int x, int y) {
        return cells[x * size + y];
    }

    private void set(int x, int y, int value) {
        cells[x * size + y] = value;
    }

    private void checkCoordinate(int x, int y) {
        if (!onBoard(x, y)) {
            throw new IllegalArgumentException("Cell (" + x + "," + y + ") is outside the board");
        }
    }

    private static int checkSize(int size) {
        if (size < 4 || size % 2 != 0) {
            throw new IllegalArgumentException("Board size must be even and at least 4: " + size);
        }
        return size;
    }

    private static void checkPlayer(int player) {
        if (player != PLAYER_ONE && player != PLAYER_TWO) {
            throw new IllegalArgumentException("Unknown player: " + player);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ReversiPosition)) {
            return false;
        }
        ReversiPosition that = (ReversiPosition) other;
        return size == that.size && player == that.player && Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * size + player) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return String.format("ReversiPosition[size=%d, player=%d, discs=%d/%d]", size, player,
                discCount(PLAYER_ONE), discCount(PLAYER_TWO));
    }
}
