package games.pegthing.unit.board;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import games.pegthing.board.Board;
import games.pegthing.board.BoardBuilder;
import games.pegthing.board.InvalidMoveException;
import games.pegthing.unit.helpers.BoardTestHelper;
import org.junit.jupiter.api.Test;

/**
 * Illegal jump coverage; each test seeds a board then asserts the jump is rejected and the
 * board it was attempted on is unchanged.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>repeatingAMoveFails</b> - Source and jumped peg are gone after the first jump</li>
 *   <li><b>occupiedDestinationAlwaysFails</b> - Every connected pair on a full board is rejected</li>
 *   <li><b>unconnectedPairFails</b> - Neighbouring holes are not a jump</li>
 *   <li><b>emptyJumpedPositionFails</b> - Nothing to jump over</li>
 *   <li><b>emptySourceFails</b> - No peg to move</li>
 *   <li><b>offBoardPositionFails</b> - attemptMove reports, never throws, for unknown positions</li>
 * </ul>
 */
class IllegalMovesTest {

    @Test
    void repeatingAMoveFails() {
        Board after = BoardTestHelper.boardEmptyAt(5, 4).makeMove(1, 4);

        InvalidMoveException e = assertThrows(InvalidMoveException.class, () -> after.makeMove(1, 4));
        assertEquals(1, e.getFrom());
        assertEquals(4, e.getTo());
        assertEquals(BoardTestHelper.boardEmptyAt(5, 4).makeMove(1, 4), after);
    }

    @Test
    void occupiedDestinationAlwaysFails() {
        Board full = BoardBuilder.newBoard(5);
        for (int pos = 1; pos <= full.maxPosition(); pos++) {
            for (int destination : full.connections(pos).keySet()) {
                int from = pos;
                assertThrows(InvalidMoveException.class, () -> full.makeMove(from, destination),
                        from + " -> " + destination);
            }
        }
        assertEquals(BoardBuilder.newBoard(5), full);
    }

    @Test
    void occupiedDestinationReason() {
        Board.MoveResult result = BoardTestHelper.boardEmptyAt(5, 4).attemptMove(1, 6);
        assertFalse(result.success);
        assertEquals("Destination f is already pegged.", result.message);
        assertNull(result.board);
        assertNull(result.jumped);
    }

    @Test
    void unconnectedPairFails() {
        Board board = BoardTestHelper.boardEmptyAt(5, 2);
        Board.MoveResult result = board.attemptMove(1, 2);
        assertFalse(result.success);
        assertEquals("No jump connects a to b.", result.message);
        assertThrows(InvalidMoveException.class, () -> board.makeMove(1, 2));
        assertEquals(BoardTestHelper.boardEmptyAt(5, 2), board);
    }

    @Test
    void emptyJumpedPositionFails() {
        Board board = BoardTestHelper.boardWithPegs(5, 1);
        Board.MoveResult result = board.attemptMove(1, 4);
        assertFalse(result.success);
        assertEquals("Jumped position b is empty.", result.message);
    }

    @Test
    void emptySourceFails() {
        Board board = BoardTestHelper.boardEmptyAt(5, 1);
        Board.MoveResult result = board.attemptMove(1, 4);
        assertFalse(result.success);
        assertEquals("Source a has no peg.", result.message);
    }

    @Test
    void offBoardPositionFails() {
        Board board = BoardTestHelper.boardEmptyAt(5, 4);
        assertEquals("Position 30 is not on the board.", board.attemptMove(1, 30).message);
        assertEquals("Position z is not on the board.", board.attemptMove(26, 4).message);
        assertThrows(InvalidMoveException.class, () -> board.makeMove(0, 4));
    }

    @Test
    void degenerateBoardRejectsEverything() {
        Board board = BoardBuilder.newBoard(0);
        assertFalse(board.attemptMove(1, 4).success);
    }
}
