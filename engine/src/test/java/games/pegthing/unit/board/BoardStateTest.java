package games.pegthing.unit.board;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.pegthing.board.Board;
import games.pegthing.board.BoardBuilder;
import games.pegthing.board.PositionOutOfRangeException;
import games.pegthing.unit.helpers.BoardTestHelper;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Board state")
class BoardStateTest {

    @Nested
    @DisplayName("Peg updates")
    class PegUpdateTests {

        @Test
        void removePegLeavesOriginalUntouched() {
            Board full = BoardBuilder.newBoard(5);
            Board emptied = full.removePeg(4);

            assertTrue(full.isPegged(4));
            assertFalse(emptied.isPegged(4));
            assertEquals(15, full.pegCount());
            assertEquals(14, emptied.pegCount());
        }

        @Test
        void placePegRestoresHole() {
            Board emptied = BoardTestHelper.boardEmptyAt(5, 4);
            Board refilled = emptied.placePeg(4);

            assertFalse(emptied.isPegged(4));
            assertTrue(refilled.isPegged(4));
            assertEquals(BoardBuilder.newBoard(5), refilled);
        }

        @Test
        void noOpUpdateReturnsSameBoard() {
            Board full = BoardBuilder.newBoard(4);
            assertSame(full, full.placePeg(3));
        }

        @Test
        void updatesKeepConnections() {
            Board full = BoardBuilder.newBoard(5);
            Board emptied = full.removePeg(1);
            assertEquals(full.connections(1), emptied.connections(1));
        }

        @Test
        void updatesOutsideBoardFail() {
            Board board = BoardBuilder.newBoard(3);
            assertThrows(PositionOutOfRangeException.class, () -> board.removePeg(0));
            assertThrows(PositionOutOfRangeException.class, () -> board.placePeg(7));
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        void outOfRangeReportsPositionAndBound() {
            Board board = BoardBuilder.newBoard(5);
            PositionOutOfRangeException e =
                    assertThrows(PositionOutOfRangeException.class, () -> board.isPegged(16));
            assertEquals(16, e.getPosition());
            assertEquals(15, e.getMaxPosition());
            assertThrows(PositionOutOfRangeException.class, () -> board.isPegged(0));
            assertThrows(PositionOutOfRangeException.class, () -> board.validMoves(-1));
        }

        @Test
        void fullBoardHasNoValidMoves() {
            Board board = BoardBuilder.newBoard(5);
            for (int pos = 1; pos <= board.maxPosition(); pos++) {
                assertTrue(board.validMoves(pos).isEmpty(), "position " + pos);
            }
            assertFalse(board.anyMoveExists());
        }

        @Test
        void validMovesIntoSingleHole() {
            Board board = BoardTestHelper.boardEmptyAt(5, 4);
            assertEquals(Map.of(4, 2), board.validMoves(1));
            assertEquals(Map.of(4, 5), board.validMoves(6));
            assertEquals(Map.of(4, 7), board.validMoves(11));
            assertEquals(Map.of(4, 8), board.validMoves(13));
            assertTrue(board.validMoves(2).isEmpty());
        }

        @Test
        void unpeggedPositionHasNoValidMoves() {
            Board board = BoardTestHelper.boardEmptyAt(5, 4);
            assertTrue(board.validMoves(4).isEmpty());
        }

        @Test
        void validMovesSkipEmptyJumpedPeg() {
            // 1 -> 4 needs a peg at 2; 1 -> 6 over 3 is fine.
            Board board = BoardTestHelper.boardWithPegs(5, 1, 3);
            Map<Integer, Integer> expected = new TreeMap<>();
            expected.put(6, 3);
            assertEquals(expected, board.validMoves(1));
        }

        @Test
        void validMoveLooksUpJumpedPosition() {
            Board board = BoardTestHelper.boardEmptyAt(5, 4);
            assertEquals(Optional.of(2), board.validMove(1, 4));
            assertEquals(Optional.empty(), board.validMove(1, 6));
            assertEquals(Optional.empty(), board.validMove(2, 4));
        }

        @Test
        void validMoveOffBoardIsEmpty() {
            Board board = BoardTestHelper.boardEmptyAt(5, 4);
            assertEquals(Optional.empty(), board.validMove(1, 99));
            assertEquals(Optional.empty(), board.validMove(0, 4));
        }

        @Test
        void rowPositionsFollowTriangularNumbers() {
            Board board = BoardBuilder.newBoard(5);
            assertEquals(List.of(1), board.rowPositions(1));
            assertEquals(List.of(4, 5, 6), board.rowPositions(3));
            assertEquals(List.of(11, 12, 13, 14, 15), board.rowPositions(5));
            assertThrows(IllegalArgumentException.class, () -> board.rowPositions(6));
        }

        @Test
        void equalityTracksPegsOnly() {
            Board a = BoardTestHelper.boardEmptyAt(5, 4);
            Board b = BoardBuilder.newBoard(5).removePeg(4);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, BoardTestHelper.boardEmptyAt(5, 5));
            assertNotEquals(BoardBuilder.newBoard(4), BoardBuilder.newBoard(5));
        }
    }

    @Nested
    @DisplayName("Game-over detection")
    class AnyMoveTests {

        @Test
        void singleHoleBoardHasMoves() {
            for (int hole = 1; hole <= 15; hole++) {
                assertTrue(BoardTestHelper.boardEmptyAt(5, hole).anyMoveExists(), "hole " + hole);
            }
        }

        @Test
        void singlePegNeverMoves() {
            for (int peg = 1; peg <= 15; peg++) {
                assertFalse(BoardTestHelper.boardWithPegs(5, peg).anyMoveExists(), "peg " + peg);
            }
        }

        @Test
        void scansEveryPeggedPosition() {
            // Only the bottom row can still move (11 over 12 into 13); the apex peg is stuck.
            Board board = BoardTestHelper.boardWithPegs(5, 1, 11, 12);
            assertTrue(board.validMoves(1).isEmpty());
            assertTrue(board.anyMoveExists());
        }

        @Test
        void isolatedPegsAreStuck() {
            Board board = BoardTestHelper.boardWithPegs(5, 1, 11, 15);
            assertFalse(board.anyMoveExists());
            assertEquals(3, board.pegCount());
        }
    }
}
