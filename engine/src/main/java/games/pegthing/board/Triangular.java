package games.pegthing.board;

import java.util.stream.IntStream;

/**
 * Triangular-number arithmetic used to delimit the rows of the board.
 * <p>
 * Row {@code r} (1-indexed) holds the positions in {@code (T(r-1), T(r)]}, where
 * {@code T(k) = k(k+1)/2} and {@code T(0) = 0}. Every row/position relationship on the
 * board is derived from these helpers; row boundaries are never stored.
 */
public final class Triangular {
    /** Largest row whose closing triangular number fits in an {@code int}: T(65535) = 2147450880. */
    public static final int MAX_ROW = 65535;

    private Triangular() {
    }

    /**
     * Returns a fresh, lazy stream of the triangular numbers {@code 1, 3, 6, 10, ...}.
     * <p>
     * Each call starts again from {@code 1}, so callers can consume it with
     * {@code limit}/{@code takeWhile} queries as often as they like. The stream ends at
     * {@code T(MAX_ROW)}, the last term an {@code int} can hold.
     *
     * @return a new stream of the partial sums of {@code 1, 2, ..., MAX_ROW}
     */
    public static IntStream sequence() {
        return IntStream.rangeClosed(1, MAX_ROW).map(Triangular::rowTriangular);
    }

    /**
     * Is {@code n} triangular? {@code 0} counts as the zero-th triangular number.
     *
     * @param n the number to test
     * @return true for {@code 0, 1, 3, 6, 10, ...}; false for everything else, including negatives
     */
    public static boolean isTriangular(int n) {
        if (n < 0) {
            return false;
        }
        int last = sequence().takeWhile(t -> t <= n).reduce(0, (a, b) -> b);
        return last == n;
    }

    /**
     * Triangular number closing row {@code row}.
     *
     * @param row 1-indexed row number
     * @return {@code row(row+1)/2}, or {@code 0} when {@code row <= 0}
     * @throws IllegalArgumentException if {@code row > MAX_ROW}
     */
    public static int rowTriangular(int row) {
        if (row <= 0) {
            return 0;
        }
        if (row > MAX_ROW) {
            throw new IllegalArgumentException("Row " + row + " is past the last int-sized row " + MAX_ROW);
        }
        return Math.toIntExact((long) row * (row + 1) / 2);
    }

    /**
     * Row containing {@code pos}: one more than the number of triangular numbers strictly below it.
     *
     * Positions past {@code T(MAX_ROW)} fall in row {@code MAX_ROW + 1}.
     *
     * @param pos a board position
     * @return the 1-indexed row of {@code pos}
     */
    public static int rowOf(int pos) {
        return 1 + (int) sequence().takeWhile(t -> t < pos).count();
    }
}
