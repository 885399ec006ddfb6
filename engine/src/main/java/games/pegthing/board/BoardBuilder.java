package games.pegthing.board;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds fully-pegged triangular boards together with their jump-connection graph.
 * <p>
 * Positions are visited in ascending order and three connection rules are tried for each:
 * <ul>
 *   <li><strong>Right:</strong> over {@code pos+1} into {@code pos+2}, unless {@code pos} or
 *       {@code pos+1} closes its row (is triangular).</li>
 *   <li><strong>Down-left:</strong> over {@code pos+r} into {@code 1+r+neighbor}, with
 *       {@code r = rowOf(pos)}.</li>
 *   <li><strong>Down-right:</strong> over {@code pos+r+1} into {@code 2+r+neighbor}.</li>
 * </ul>
 * A rule whose destination lies past the last position records nothing. Every recorded jump is
 * stored in both directions, so the reverse jump from the destination back over the same peg
 * exists as well.
 */
public final class BoardBuilder {
    private BoardBuilder() {
    }

    /**
     * Creates a board with the given number of rows, every hole pegged.
     * <p>
     * {@code rows <= 0} produces an empty board with no positions; it is not an error, but
     * {@link Board#isPlayable()} reports it as unplayable.
     *
     * @param rows number of rows in the triangle
     * @return a new, fully-pegged board
     * @throws IllegalArgumentException if {@code rows > Triangular.MAX_ROW}
     */
    public static Board newBoard(int rows) {
        int maxPos = Triangular.rowTriangular(rows);
        List<SortedMap<Integer, Integer>> connections = new ArrayList<>(maxPos + 1);
        for (int pos = 0; pos <= maxPos; pos++) {
            connections.add(new TreeMap<>());
        }

        for (int pos = 1; pos <= maxPos; pos++) {
            connectRight(connections, maxPos, pos);
            connectDownLeft(connections, maxPos, pos);
            connectDownRight(connections, maxPos, pos);
        }

        Cell[] cells = new Cell[maxPos + 1];
        for (int pos = 1; pos <= maxPos; pos++) {
            cells[pos] = new Cell(true, connections.get(pos));
        }
        return new Board(Math.max(rows, 0), cells);
    }

    private static void connectRight(List<SortedMap<Integer, Integer>> connections, int maxPos, int pos) {
        int neighbor = pos + 1;
        int destination = neighbor + 1;
        if (!Triangular.isTriangular(pos) && !Triangular.isTriangular(neighbor)) {
            connect(connections, maxPos, pos, neighbor, destination);
        }
    }

    private static void connectDownLeft(List<SortedMap<Integer, Integer>> connections, int maxPos, int pos) {
        int row = Triangular.rowOf(pos);
        int neighbor = pos + row;
        int destination = 1 + row + neighbor;
        connect(connections, maxPos, pos, neighbor, destination);
    }

    private static void connectDownRight(List<SortedMap<Integer, Integer>> connections, int maxPos, int pos) {
        int row = Triangular.rowOf(pos);
        int neighbor = pos + row + 1;
        int destination = 2 + row + neighbor;
        connect(connections, maxPos, pos, neighbor, destination);
    }

    /**
     * Records the jump {@code pos -> destination} over {@code neighbor} and its reverse.
     */
    private static void connect(
            List<SortedMap<Integer, Integer>> connections, int maxPos, int pos, int neighbor, int destination) {
        // A wrapped-around destination is below pos.
        if (destination > maxPos || destination < pos) {
            return;
        }
        connections.get(pos).put(destination, neighbor);
        connections.get(destination).put(pos, neighbor);
    }
}
