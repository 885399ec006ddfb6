package games.pegthing.board;

/**
 * Thrown by {@link Board#makeMove(int, int)} when the requested jump is not legal.
 * <p>
 * Recoverable: the board the move was attempted on is left untouched, so callers can
 * simply ask the player again.
 */
public class InvalidMoveException extends RuntimeException {
    private final int from;
    private final int to;

    public InvalidMoveException(int from, int to, String reason) {
        super(reason);
        this.from = from;
        this.to = to;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }
}
