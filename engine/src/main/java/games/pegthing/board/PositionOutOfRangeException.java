package games.pegthing.board;

/**
 * Thrown when a position has no hole on the board being queried.
 */
public class PositionOutOfRangeException extends IndexOutOfBoundsException {
    private final int position;
    private final int maxPosition;

    public PositionOutOfRangeException(int position, int maxPosition) {
        super("Position " + position + " is outside 1.." + maxPosition);
        this.position = position;
        this.maxPosition = maxPosition;
    }

    public int getPosition() {
        return position;
    }

    /**
     * @return the highest position of the board, {@code 0} for an empty board
     */
    public int getMaxPosition() {
        return maxPosition;
    }
}
