package com.alphabeta.core.ai;

import com.alphabeta.core.Position;
import java.util.List;
import java.util.Objects;

/**
 * Depth-limited negamax searcher with fail-hard alpha-beta pruning.
 *
 * <p>Root moves are searched in the order the position lists them and a later move only replaces
 * the best one if it scores strictly higher, so ties go to the first move listed. Every branch
 * works on its own copy of the position.
 *
 * <p>Instances are not thread-safe: the node counters are shared by the whole call tree of one
 * {@link #search} invocation and reset at the start of the next.
 *
 * @param <M> the move type
 * @param <P> the position type
 */
public final class AlphaBetaSearcher<M, P extends Position<M, P>> implements Searcher<M, P> {

    private final SearchListener<M> listener;

    private long visitedNodes;
    private long terminalHits;
    private long cutoffs;

    public AlphaBetaSearcher() {
        this(SearchListener.none());
    }

    public AlphaBetaSearcher(SearchListener<M> listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public SearchResult<M> search(P position, SearchConstraints constraints) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(constraints, "constraints");

        visitedNodes = 0L;
        terminalHits = 0L;
        cutoffs = 0L;

        int ply = constraints.ply();
        int alpha = constraints.alpha();
        int beta = constraints.beta();
        listener.searchStarted(ply);

        if (position.isTerminal()) {
            return complete(SearchResult.withoutMove(SearchResult.Status.GAME_OVER, alpha, ply));
        }

        List<M> moves = position.legalMoves();
        if (moves == null || moves.isEmpty()) {
            return complete(SearchResult.withoutMove(SearchResult.Status.NO_LEGAL_MOVES, alpha, ply));
        }

        M bestMove = null;
        for (M move : moves) {
            P child = child(position, move);
            int score = -negamax(child, -beta, -alpha, ply - 1);
            boolean improved = score > alpha;
            if (improved) {
                bestMove = move;
                alpha = score;
            }
            listener.rootMoveScored(move, score, improved);
        }

        SearchResult.Status status = bestMove != null
                ? SearchResult.Status.MOVED
                : SearchResult.Status.NO_IMPROVEMENT;
        return complete(new SearchResult<>(bestMove, alpha, ply, visitedNodes, terminalHits, cutoffs, status));
    }

    public long getLastVisitedNodeCount() {
        return visitedNodes;
    }

    public long getLastTerminalHitCount() {
        return terminalHits;
    }

    public long getLastCutoffCount() {
        return cutoffs;
    }

    private int negamax(P position, int alpha, int beta, int depthRemaining) {
        visitedNodes++;

        if (position.isTerminal()) {
            terminalHits++;
            return evaluate(position);
        }
        if (depthRemaining <= 0) {
            return evaluate(position);
        }

        List<M> moves = position.legalMoves();
        if (moves == null || moves.isEmpty()) {
            return evaluate(position);
        }

        for (M move : moves) {
            P child = child(position, move);
            int score = -negamax(child, -beta, -alpha, depthRemaining - 1);
            if (score > alpha) {
                alpha = score;
            }
            if (alpha >= beta) {
                cutoffs++;
                listener.cutoff(depthRemaining, alpha, beta);
                break;
            }
        }
        return alpha;
    }

    // An InvalidMoveException here means the position rejected a move it listed itself; it is
    // left to propagate and abort the search.
    private P child(P parent, M move) {
        P child = parent.copy();
        if (child == null || child == parent) {
            throw new IllegalStateException("copy() must return a new position instance");
        }
        child.apply(move);
        return child;
    }

    private int evaluate(P position) {
        int value = position.evaluate();
        if (value < Position.MIN_EVALUATION || value > Position.MAX_EVALUATION) {
            throw new IllegalStateException(String.format("evaluate() returned %d, outside [%d, %d]", value,
                    Position.MIN_EVALUATION, Position.MAX_EVALUATION));
        }
        return value;
    }

    private SearchResult<M> complete(SearchResult<M> result) {
        listener.searchCompleted(result);
        return result;
    }
}
