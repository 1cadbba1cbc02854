package com.alphabeta.core.ai;

import com.alphabeta.core.GameHistory;
import com.alphabeta.core.MissingCapabilityException;
import com.alphabeta.core.Position;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Plays a game by alpha-beta search, keeping the sequence of reached positions so moves can be
 * undone.
 *
 * <p>Typical use:
 * <pre>{@code
 * AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(new ReversiPosition());
 * while (engine.search().isPresent()) {
 *     render(engine.currentPosition());
 * }
 * }</pre>
 *
 * @param <M> the move type
 * @param <P> the position type
 */
public final class AlphaBetaEngine<M, P extends Position<M, P>> {

    private static final Logger LOGGER = Logger.getLogger(AlphaBetaEngine.class.getName());

    public static final int DEFAULT_PLY = 2;

    private final GameHistory<M, P> history;
    private final AlphaBetaSearcher<M, P> searcher;

    private int ply;
    private SearchResult<M> lastResult;

    public AlphaBetaEngine(P initialPosition) {
        this(initialPosition, DEFAULT_PLY);
    }

    public AlphaBetaEngine(P initialPosition, int ply) {
        this(initialPosition, ply, SearchListener.none());
    }

    public AlphaBetaEngine(P initialPosition, int ply, SearchListener<M> listener) {
        checkCapability(initialPosition);
        Objects.requireNonNull(listener, "listener");
        this.ply = requireValidPly(ply);
        this.history = new GameHistory<>(initialPosition);
        this.searcher = new AlphaBetaSearcher<>(listener);
    }

    /**
     * Returns the default search depth.
     */
    public int ply() {
        return ply;
    }

    /**
     * Sets the default search depth.
     *
     * @return the previous default
     */
    public int ply(int newPly) {
        int previous = ply;
        ply = requireValidPly(newPly);
        return previous;
    }

    /**
     * Searches the current position to the default depth and plays the best move found.
     *
     * @return the resulting position, or empty if no move was played; {@link #lastResult()} tells
     *         why
     */
    public Optional<P> search() {
        return search(ply);
    }

    /**
     * Searches the current position to {@code explicitPly} without changing the default depth and
     * plays the best move found.
     *
     * @throws com.alphabeta.core.InvalidMoveException if the position rejects a move it listed as
     *         legal
     */
    public Optional<P> search(int explicitPly) {
        requireValidPly(explicitPly);
        if (explicitPly != ply) {
            LOGGER.fine(() -> String.format("Explicit ply %d overrides default (%d)", explicitPly, ply));
        }

        lastResult = null;
        SearchResult<M> result = searcher.search(history.currentPosition(), SearchConstraints.ofPly(explicitPly));

        LOGGER.info(() -> String.format("Alpha-beta explored %d nodes (depth=%d, terminal=%d, cutoffs=%d, status=%s)",
                result.visitedNodes(), result.ply(), result.terminalHits(), result.cutoffs(), result.status()));

        if (!result.hasMove()) {
            lastResult = result;
            return Optional.empty();
        }
        P next = history.applyMove(result.move());
        lastResult = result;
        return Optional.of(next);
    }

    /**
     * Returns the result of the most recent search, or {@code null} before the first one and after
     * a search whose move could not be committed.
     */
    public SearchResult<M> lastResult() {
        return lastResult;
    }

    public long getLastVisitedNodeCount() {
        return searcher.getLastVisitedNodeCount();
    }

    public long getLastTerminalHitCount() {
        return searcher.getLastTerminalHitCount();
    }

    public P currentPosition() {
        return history.currentPosition();
    }

    public Optional<M> lastMove() {
        return history.lastMove();
    }

    /**
     * Takes back the last move.
     *
     * @throws com.alphabeta.core.NoHistoryException if no move has been played
     */
    public P undo() {
        return history.undo();
    }

    public GameHistory<M, P> history() {
        return history;
    }

    private static int requireValidPly(int ply) {
        if (ply < 0) {
            throw new IllegalArgumentException("Ply must not be negative");
        }
        return ply;
    }

    private static <M, P extends Position<M, P>> void checkCapability(P position) {
        if (position == null) {
            throw new MissingCapabilityException("No initial position given");
        }
        P copy = position.copy();
        if (copy == null || copy == position) {
            throw new MissingCapabilityException(
                    position.getClass().getName() + ".copy() must return a new position instance");
        }
        if (position.legalMoves() == null) {
            throw new MissingCapabilityException(position.getClass().getName() + ".legalMoves() returned null");
        }
    }
}
