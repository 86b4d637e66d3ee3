package com.roomhub.roomservice.engine.board;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardTest {

    @Test
    void rejectsNonPositiveDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new Board(0, 8));
        assertThrows(IllegalArgumentException.class, () -> new Board(8, -1));
    }

    @Test
    void indexRoundTripsForEveryCell() {
        Board board = new Board(3, 5);
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 5; c++) {
                int idx = board.toIndex(r, c);
                assertEquals(r * 5 + c, idx);
                assertEquals(Cell.of(r, c), board.fromIndex(idx));
            }
        }
    }

    @Test
    void outOfRangeCoordinatesThrow() {
        Board board = Board.standard();
        assertThrows(IndexOutOfBoundsException.class, () -> board.toIndex(-1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> board.toIndex(0, 8));
        assertThrows(IndexOutOfBoundsException.class, () -> board.fromIndex(64));
        assertThrows(IndexOutOfBoundsException.class, () -> board.fromIndex(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> board.isDarkSquare(8, 8));
    }

    @Test
    void isInsideChecksBothAxes() {
        Board board = new Board(2, 3);
        assertTrue(board.isInside(1, 2));
        assertFalse(board.isInside(2, 0));
        assertFalse(board.isInside(0, 3));
        assertFalse(board.isInside((Cell) null));
    }

    @Test
    void allCellsIsRowMajorAndRestartable() {
        Board board = new Board(2, 2);
        List<Cell> first = new ArrayList<>();
        board.allCells().forEach(first::add);
        List<Cell> second = new ArrayList<>();
        board.allCells().forEach(second::add);

        assertEquals(List.of(Cell.of(0, 0), Cell.of(0, 1), Cell.of(1, 0), Cell.of(1, 1)), first);
        assertEquals(first, second);
    }

    @Test
    void darkSquaresHaveOddCoordinateSum() {
        Board board = Board.standard();
        assertFalse(board.isDarkSquare(0, 0));
        assertTrue(board.isDarkSquare(0, 1));
        assertTrue(board.isDarkSquare(7, 0));
        assertFalse(board.isDarkSquare(7, 7));
    }
}
