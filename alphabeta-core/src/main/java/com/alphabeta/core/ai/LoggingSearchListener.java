package com.alphabeta.core.ai;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a trace of the search to {@code java.util.logging}: root moves at {@code FINE}, cutoffs
 * at {@code FINEST}.
 *
 * @param <M> the move type
 */
public final class LoggingSearchListener<M> implements SearchListener<M> {

    private static final Logger LOGGER = Logger.getLogger(LoggingSearchListener.class.getName());

    @Override
    public void searchStarted(int ply) {
        LOGGER.fine(() -> String.format("Searching to depth %d", ply));
    }

    @Override
    public void rootMoveScored(M move, int score, boolean improved) {
        LOGGER.fine(() -> String.format("Move %s scored %d%s", move, score, improved ? " (new best)" : ""));
    }

    @Override
    public void cutoff(int depthRemaining, int alpha, int beta) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("Cutoff at depth %d (alpha=%d, beta=%d)", depthRemaining, alpha, beta));
        }
    }

    @Override
    public void searchCompleted(SearchResult<M> result) {
        LOGGER.fine(() -> String.format("%d nodes visited, %d terminal, %d cutoffs -> %s",
                result.visitedNodes(), result.terminalHits(), result.cutoffs(), result.status()));
    }
}
