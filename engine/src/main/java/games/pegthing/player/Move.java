package games.pegthing.player;

import games.pegthing.board.PositionLetters;

/**
 * A requested jump, parsed from what the player typed.
 *
 * <p>Only letters count: the first two letters of the input name the source and destination,
 * anything else is ignored. {@code "ad"}, {@code "A D"} and {@code "a-d"} all parse to
 * {@code a -> d}.
 *
 * @param from source position
 * @param to   destination position
 */
public record Move(int from, int to) {

    /**
     * Parses a move from raw input.
     *
     * @return the move, or null when the input holds fewer than two letters or a letter outside {@code a..z}
     */
    public static Move tryParse(String input) {
        if (input == null) {
            return null;
        }
        int[] positions = new int[2];
        int found = 0;
        for (char c : input.trim().toCharArray()) {
            if (!PositionLetters.isLetter(c)) {
                if (Character.isLetter(c)) {
                    return null;
                }
                continue;
            }
            positions[found++] = PositionLetters.toPosition(c);
            if (found == positions.length) {
                return new Move(positions[0], positions[1]);
            }
        }
        return null;
    }

    /**
     * Two-letter command a player would type for this move, e.g. {@code ad}.
     */
    public String toCommandString() {
        return PositionLetters.label(from) + PositionLetters.label(to);
    }
}
