package games.pegthing.board;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link Board} as centred rows of text for the console.
 * <p>
 * Each hole is drawn as its letter followed by {@code 0} when pegged or {@code -} when empty,
 * holes in a row are separated by a single space, and each row is indented so the triangle
 * stays centred. A five-row board with hole {@code d} empty looks like:
 * <pre>
 *       a0
 *      b0 c0
 *    d- e0 f0
 *   g0 h0 i0 j0
 * k0 l0 m0 n0 o0
 * </pre>
 */
public class BoardFormatter {
    /** Width of one rendered hole including its separator. */
    private static final int POSITION_CHARS = 3;

    private final Board board;

    /**
     * @param board the board to render; must not be null
     */
    public BoardFormatter(Board board) {
        this.board = board;
    }

    /**
     * Renders every row, joined by newlines. A board with no rows renders as an empty string.
     */
    public String format() {
        List<String> lines = new ArrayList<>(board.rows());
        for (int row = 1; row <= board.rows(); row++) {
            lines.add(renderRow(row));
        }
        return String.join("\n", lines);
    }

    /**
     * Renders one row: padding followed by the row's holes in ascending order.
     *
     * @param row 1-indexed row
     */
    public String renderRow(int row) {
        List<String> holes = new ArrayList<>();
        for (int pos : board.rowPositions(row)) {
            holes.add(renderPosition(pos));
        }
        return " ".repeat(rowPadding(row, board.rows())) + String.join(" ", holes);
    }

    /**
     * Renders a single hole, e.g. {@code a0} or {@code d-}.
     */
    public String renderPosition(int pos) {
        return PositionLetters.toLetter(pos) + (board.isPegged(pos) ? "0" : "-");
    }

    /**
     * Spaces needed to centre {@code row}: half a hole's width per missing hole, rounded up.
     */
    static int rowPadding(int row, int rows) {
        int halfWidths = (rows - row) * POSITION_CHARS;
        return (halfWidths + 1) / 2;
    }
}
