package com.roomhub.roomservice.games.tictactoe.domain.rule;

import com.roomhub.roomservice.games.tictactoe.domain.enums.Mark;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TicTacToeJudgeTest {

    private static Mark[] empty() {
        Mark[] cells = new Mark[9];
        Arrays.fill(cells, Mark.EMPTY);
        return cells;
    }

    @Test
    void everyLineWins() {
        assertEquals(8, TicTacToeJudge.LINES.length);
        for (int[] line : TicTacToeJudge.LINES) {
            Mark[] cells = empty();
            for (int i : line) cells[i] = Mark.O;
            assertEquals(Outcome.O_WIN, TicTacToeJudge.outcomeAfterMove(cells, Mark.O), Arrays.toString(line));
        }
    }

    @Test
    void winBeatsFullBoard() {
        // X O X / O X O / O X X  -> X 对角线
        Mark[] cells = {
                Mark.X, Mark.O, Mark.X,
                Mark.O, Mark.X, Mark.O,
                Mark.O, Mark.X, Mark.X};
        assertEquals(Outcome.X_WIN, TicTacToeJudge.outcomeAfterMove(cells, Mark.X));
    }

    @Test
    void fullBoardWithoutLineIsDraw() {
        Mark[] cells = {
                Mark.X, Mark.O, Mark.X,
                Mark.X, Mark.O, Mark.O,
                Mark.O, Mark.X, Mark.X};
        assertEquals(Outcome.DRAW, TicTacToeJudge.outcomeAfterMove(cells, Mark.X));
    }

    @Test
    void partialBoardIsOngoing() {
        Mark[] cells = empty();
        cells[4] = Mark.X;
        assertEquals(Outcome.ONGOING, TicTacToeJudge.outcomeAfterMove(cells, Mark.X));
        assertFalse(Outcome.ONGOING.terminal());
    }

    @Test
    void boundsAreZeroToEight() {
        assertTrue(TicTacToeJudge.inBounds(0));
        assertTrue(TicTacToeJudge.inBounds(8));
        assertFalse(TicTacToeJudge.inBounds(9));
        assertFalse(TicTacToeJudge.inBounds(-1));
    }
}
