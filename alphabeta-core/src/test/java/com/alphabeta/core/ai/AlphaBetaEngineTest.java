package com.alphabeta.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.alphabeta.core.InvalidMoveException;
import com.alphabeta.core.MissingCapabilityException;
import com.alphabeta.core.NoHistoryException;
import com.alphabeta.core.Position;
import com.alphabeta.core.reversi.ReversiMove;
import com.alphabeta.core.reversi.ReversiPosition;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AlphaBetaEngineTest {

    @Test
    void plyAccessorReturnsPreviousValue() {
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(new ReversiPosition());

        assertEquals(AlphaBetaEngine.DEFAULT_PLY, engine.ply());
        assertEquals(2, engine.ply(4));
        assertEquals(4, engine.ply());
        assertThrows(IllegalArgumentException.class, () -> engine.ply(-1));
        assertEquals(4, engine.ply());
    }

    @Test
    void explicitPlyIsNotPersisted() {
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(new ReversiPosition(), 3);

        engine.search(1);

        assertEquals(1, engine.lastResult().ply());
        assertEquals(3, engine.ply());
    }

    @Test
    void searchCommitsBestMoveToHistory() {
        ReversiPosition opening = new ReversiPosition();
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(opening);

        Optional<ReversiPosition> next = engine.search();

        assertTrue(next.isPresent());
        assertSame(next.get(), engine.currentPosition());
        assertEquals(5, next.get().discCount(ReversiPosition.PLAYER_ONE) + next.get().discCount(ReversiPosition.PLAYER_TWO));
        assertEquals(Optional.of(engine.lastResult().move()), engine.lastMove());
        assertEquals(1, engine.history().moveCount());
        assertTrue(engine.getLastVisitedNodeCount() > 0, "The search should inspect at least one node");

        assertSame(opening, engine.undo());
        assertSame(opening, engine.currentPosition());
        assertTrue(engine.lastMove().isEmpty());
    }

    @Test
    void currentPositionIsIdempotent() {
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(new ReversiPosition());
        engine.search();

        ReversiPosition first = engine.currentPosition();
        ReversiPosition second = engine.currentPosition();

        assertSame(first, second);
    }

    @Test
    void undoWithoutMovesFails() {
        ReversiPosition opening = new ReversiPosition();
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(opening);

        assertThrows(NoHistoryException.class, engine::undo);
        assertSame(opening, engine.currentPosition());
    }

    @Test
    void reportsNoLegalMovesWithoutChangingHistory() {
        ScriptedPosition empty = ScriptedPosition.of();
        AlphaBetaEngine<String, ScriptedPosition> engine = new AlphaBetaEngine<>(empty);

        assertNull(engine.lastResult());
        assertTrue(engine.search().isEmpty());
        assertEquals(SearchResult.Status.NO_LEGAL_MOVES, engine.lastResult().status());
        assertSame(empty, engine.currentPosition());
        assertEquals(0, engine.history().moveCount());
    }

    @Test
    void refusesToMoveInTerminalPosition() {
        int[][] cells = new int[4][4];
        cells[0][0] = ReversiPosition.PLAYER_ONE;
        cells[3][3] = ReversiPosition.PLAYER_ONE;
        ReversiPosition finished = ReversiPosition.of(cells, ReversiPosition.PLAYER_TWO);
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(finished);

        assertTrue(engine.search().isEmpty());
        assertEquals(SearchResult.Status.GAME_OVER, engine.lastResult().status());
        assertFalse(engine.history().canUndo());
    }

    @Test
    void selfPlayRunsToTheEndOfTheGame() {
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(new ReversiPosition(6));

        int moves = 0;
        while (engine.search().isPresent()) {
            moves++;
            assertTrue(moves <= 64, "A 6x6 game cannot last this long");
        }

        ReversiPosition last = engine.currentPosition();
        assertTrue(last.isTerminal());
        assertEquals(SearchResult.Status.GAME_OVER, engine.lastResult().status());
        assertEquals(moves, engine.history().moveCount());
        assertEquals(moves + 1, engine.history().positions().size());

        for (int i = 0; i < moves; i++) {
            engine.undo();
        }
        assertEquals(new ReversiPosition(6), engine.currentPosition());
    }

    @Test
    void forwardsEventsToListener() {
        List<String> events = new ArrayList<>();
        SearchListener<ReversiMove> listener = new SearchListener<>() {
            @Override
            public void searchStarted(int ply) {
                events.add("start " + ply);
            }

            @Override
            public void rootMoveScored(ReversiMove move, int score, boolean improved) {
                events.add("move " + move);
            }

            @Override
            public void searchCompleted(SearchResult<ReversiMove> result) {
                events.add("done " + result.status());
            }
        };
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(new ReversiPosition(), 1, listener);

        engine.search();

        assertEquals(List.of("start 1", "move (2,4)", "move (3,5)", "move (4,2)", "move (5,3)", "done MOVED"),
                events);
    }

    @Test
    void loggingListenerCanDriveASearch() {
        AlphaBetaEngine<ReversiMove, ReversiPosition> engine = new AlphaBetaEngine<>(new ReversiPosition(), 2,
                new LoggingSearchListener<>());

        assertTrue(engine.search().isPresent());
    }

    @Test
    void rejectsPositionsThatCannotBeSearched() {
        assertThrows(MissingCapabilityException.class, () -> new AlphaBetaEngine<ReversiMove, ReversiPosition>(null));
        assertThrows(MissingCapabilityException.class, () -> new AlphaBetaEngine<>(new SharedCopyPosition()));
        assertThrows(MissingCapabilityException.class, () -> new AlphaBetaEngine<>(new NullMovesPosition()));
    }

    @Test
    void uncommittedMoveLeavesNoResultBehind() {
        AlphaBetaEngine<String, SingleUsePosition> engine = new AlphaBetaEngine<>(new SingleUsePosition(), 1);

        assertThrows(InvalidMoveException.class, engine::search);

        assertNull(engine.lastResult(), "A move that history rejected must not be reported as played");
        assertEquals(0, engine.history().moveCount());
        assertTrue(engine.lastMove().isEmpty());
    }

    private static final class NullMovesPosition implements Position<Integer, NullMovesPosition> {

        @Override
        public NullMovesPosition copy() {
            return new NullMovesPosition();
        }

        @Override
        public void apply(Integer move) {
        }

        @Override
        public int evaluate() {
            return 0;
        }

        @Override
        public List<Integer> legalMoves() {
            return null;
        }
    }

    // Accepts its only move once across all copies, so the search succeeds and the commit fails.
    private static final class SingleUsePosition implements Position<String, SingleUsePosition> {

        private final int[] applies;
        private boolean played;

        SingleUsePosition() {
            this(new int[1], false);
        }

        private SingleUsePosition(int[] applies, boolean played) {
            this.applies = applies;
            this.played = played;
        }

        @Override
        public SingleUsePosition copy() {
            return new SingleUsePosition(applies, played);
        }

        @Override
        public void apply(String move) {
            if (applies[0]++ > 0) {
                throw new InvalidMoveException(move, "Already used " + move);
            }
            played = true;
        }

        @Override
        public boolean isTerminal() {
            return played;
        }

        @Override
        public int evaluate() {
            return 0;
        }

        @Override
        public List<String> legalMoves() {
            return played ? List.of() : List.of("only");
        }
    }

    private static final class SharedCopyPosition implements Position<Integer, SharedCopyPosition> {

        @Override
        public SharedCopyPosition copy() {
            return this;
        }

        @Override
        public void apply(Integer move) {
        }

        @Override
        public int evaluate() {
            return 0;
        }

        @Override
        public List<Integer> legalMoves() {
            return List.of(0);
        }
    }
}
