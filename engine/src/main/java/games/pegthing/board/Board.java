package games.pegthing.board;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Immutable triangular peg-solitaire board.
 * <p>
 * Positions run from {@code 1} to {@link #maxPosition()} in row-major order, top row first.
 * Each position holds a {@link Cell} recording whether it is pegged and which jumps connect it
 * to other positions. The connection graph is fixed when {@link BoardBuilder} creates the board;
 * only peg states change during play.
 * <p>
 * <strong>Value semantics:</strong> every operation that changes pegs ({@link #removePeg(int)},
 * {@link #placePeg(int)}, {@link #attemptMove(int, int)}, {@link #makeMove(int, int)}) returns a new
 * board and leaves the receiver untouched. Two boards never observe each other's changes, so a
 * rejected move always leaves the caller holding exactly the board it had before.
 * <p>
 * <strong>Jump rules:</strong> a peg at {@code from} may jump to {@code to} when a connection
 * {@code from -> to} exists, {@code to} is empty and the connection's jumped position is pegged.
 * The jump empties {@code from} and the jumped position and pegs {@code to}.
 */
public final class Board {
    private final int rows;

    /** Indexed by position; slot 0 is unused. Never mutated after construction. */
    private final Cell[] cells;

    Board(int rows, Cell[] cells) {
        this.rows = rows;
        this.cells = cells;
    }

    /**
     * Number of rows this board was built with; {@code 0} for a degenerate board.
     */
    public int rows() {
        return rows;
    }

    /**
     * Highest position on the board, {@code T(rows)}.
     */
    public int maxPosition() {
        return cells.length - 1;
    }

    /**
     * A board with no positions cannot be played; callers should refuse it rather than start a round.
     */
    public boolean isPlayable() {
        return maxPosition() > 0;
    }

    /**
     * Does the position have a peg in it?
     *
     * @throws PositionOutOfRangeException if {@code pos} is not on this board
     */
    public boolean isPegged(int pos) {
        return cell(pos).isPegged();
    }

    /**
     * Returns the board with the peg at {@code pos} removed.
     *
     * @throws PositionOutOfRangeException if {@code pos} is not on this board
     */
    public Board removePeg(int pos) {
        return withPeg(pos, false);
    }

    /**
     * Returns the board with a peg placed at {@code pos}.
     *
     * @throws PositionOutOfRangeException if {@code pos} is not on this board
     */
    public Board placePeg(int pos) {
        return withPeg(pos, true);
    }

    /**
     * Returns the cell at {@code pos}.
     *
     * @throws PositionOutOfRangeException if {@code pos} is not on this board
     */
    public Cell cell(int pos) {
        if (!contains(pos)) {
            throw new PositionOutOfRangeException(pos, maxPosition());
        }
        return cells[pos];
    }

    /**
     * Every jump leaving {@code pos}, legal or not, as destination -> jumped position.
     *
     * @throws PositionOutOfRangeException if {@code pos} is not on this board
     */
    public SortedMap<Integer, Integer> connections(int pos) {
        return cell(pos).getConnections();
    }

    public boolean contains(int pos) {
        return pos >= 1 && pos <= maxPosition();
    }

    /**
     * Legal jumps from {@code pos} on the current board, as destination -> jumped position.
     * <p>
     * Empty when {@code pos} has no peg or none of its connections is currently open.
     *
     * @throws PositionOutOfRangeException if {@code pos} is not on this board
     */
    public SortedMap<Integer, Integer> validMoves(int pos) {
        Cell source = cell(pos);
        SortedMap<Integer, Integer> moves = new TreeMap<>();
        if (!source.isPegged()) {
            return Collections.unmodifiableSortedMap(moves);
        }
        for (Map.Entry<Integer, Integer> connection : source.getConnections().entrySet()) {
            int destination = connection.getKey();
            int jumped = connection.getValue();
            if (!isPegged(destination) && isPegged(jumped)) {
                moves.put(destination, jumped);
            }
        }
        return Collections.unmodifiableSortedMap(moves);
    }

    /**
     * Position that would be jumped by moving from {@code from} to {@code to}, if that jump is legal now.
     * Positions that are not on the board simply yield no move.
     */
    public Optional<Integer> validMove(int from, int to) {
        if (!contains(from) || !contains(to)) {
            return Optional.empty();
        }
        return Optional.ofNullable(validMoves(from).get(to));
    }

    /**
     * True while any pegged position anywhere on the board still has a legal jump.
     */
    public boolean anyMoveExists() {
        return IntStream.rangeClosed(1, maxPosition())
                .filter(this::isPegged)
                .anyMatch(pos -> !validMoves(pos).isEmpty());
    }

    /**
     * Number of pegs left on the board; the player's score once no move exists.
     */
    public int pegCount() {
        return (int) IntStream.rangeClosed(1, maxPosition()).filter(this::isPegged).count();
    }

    /**
     * Positions of {@code row}, ascending.
     *
     * @param row 1-indexed row
     * @throws IllegalArgumentException if the board has no such row
     */
    public List<Integer> rowPositions(int row) {
        if (row < 1 || row > rows) {
            throw new IllegalArgumentException("Row " + row + " is outside 1.." + rows);
        }
        List<Integer> positions = new ArrayList<>(row);
        for (int pos = Triangular.rowTriangular(row - 1) + 1; pos <= Triangular.rowTriangular(row); pos++) {
            positions.add(pos);
        }
        return Collections.unmodifiableList(positions);
    }

    /**
     * Attempts the jump {@code from -> to}.
     * <p>
     * The returned {@link MoveResult} carries either the new board and the jumped position, or a
     * message explaining why the move is illegal. This board is never modified.
     *
     * @return a MoveResult; never null
     */
    public MoveResult attemptMove(int from, int to) {
        if (!contains(from)) {
            return MoveResult.failure("Position " + PositionLetters.label(from) + " is not on the board.");
        }
        if (!contains(to)) {
            return MoveResult.failure("Position " + PositionLetters.label(to) + " is not on the board.");
        }
        if (!isPegged(from)) {
            return MoveResult.failure("Source " + PositionLetters.label(from) + " has no peg.");
        }
        Integer jumped = connections(from).get(to);
        if (jumped == null) {
            return MoveResult.failure("No jump connects " + PositionLetters.label(from)
                    + " to " + PositionLetters.label(to) + ".");
        }
        if (isPegged(to)) {
            return MoveResult.failure("Destination " + PositionLetters.label(to) + " is already pegged.");
        }
        if (!isPegged(jumped)) {
            return MoveResult.failure("Jumped position " + PositionLetters.label(jumped) + " is empty.");
        }

        Cell[] next = cells.clone();
        next[jumped] = next[jumped].withPegged(false);
        next[from] = next[from].withPegged(false);
        next[to] = next[to].withPegged(true);
        return MoveResult.success(new Board(rows, next), jumped,
                "Jumped " + PositionLetters.label(from) + " over " + PositionLetters.label(jumped)
                        + " into " + PositionLetters.label(to) + ".");
    }

    /**
     * Jumps from {@code from} to {@code to}, removing the jumped peg.
     *
     * @return the board after the jump
     * @throws InvalidMoveException if the jump is not legal on this board; this board is unchanged
     */
    public Board makeMove(int from, int to) {
        MoveResult result = attemptMove(from, to);
        if (!result.success) {
            throw new InvalidMoveException(from, to, result.message);
        }
        return result.board;
    }

    private Board withPeg(int pos, boolean pegged) {
        Cell current = cell(pos);
        if (current.isPegged() == pegged) {
            return this;
        }
        Cell[] next = cells.clone();
        next[pos] = current.withPegged(pegged);
        return new Board(rows, next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        Board other = (Board) o;
        if (rows != other.rows || cells.length != other.cells.length) {
            return false;
        }
        for (int pos = 1; pos < cells.length; pos++) {
            if (cells[pos].isPegged() != other.cells[pos].isPegged()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = Objects.hash(rows);
        for (int pos = 1; pos < cells.length; pos++) {
            hash = 31 * hash + (cells[pos].isPegged() ? 1 : 0);
        }
        return hash;
    }

    @Override
    public String toString() {
        return new BoardFormatter(this).format();
    }

    /**
     * Outcome of a move attempt: success with the resulting board, or failure with a reason.
     */
    public static class MoveResult {
        /** Whether the jump was legal and applied. */
        public final boolean success;

        /** Descriptive message (what happened, or why the jump was refused). */
        public final String message;

        /** Board after the jump; null on failure. */
        public final Board board;

        /** Position whose peg was removed; null on failure. */
        public final Integer jumped;

        private MoveResult(boolean success, String message, Board board, Integer jumped) {
            this.success = success;
            this.message = message;
            this.board = board;
            this.jumped = jumped;
        }

        public static MoveResult success(Board board, int jumped, String message) {
            return new MoveResult(true, message, Objects.requireNonNull(board, "board"), jumped);
        }

        public static MoveResult failure(String message) {
            return new MoveResult(false, message, null, null);
        }
    }
}
