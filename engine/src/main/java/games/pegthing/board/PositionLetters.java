package games.pegthing.board;

/**
 * Maps board positions to the letters players type and see: {@code 'a'} is position 1,
 * {@code 'b'} position 2, and so on up to {@code 'z'} (26).
 * <p>
 * Only the first 26 positions have a letter, which limits playable boards to six rows
 * ({@code T(6) = 21}); a seven-row board already has 28 positions.
 */
public final class PositionLetters {
    /** Highest position that has a letter. */
    public static final int MAX_POSITION = 26;

    private static final char FIRST_LETTER = 'a';

    private PositionLetters() {
    }

    /**
     * Converts a letter (either case) to its position.
     *
     * @param letter {@code a..z} or {@code A..Z}
     * @return position {@code 1..26}
     * @throws IllegalArgumentException if {@code letter} is not an ASCII letter
     */
    public static int toPosition(char letter) {
        if (!isLetter(letter)) {
            throw new IllegalArgumentException("Not a position letter: '" + letter + "'");
        }
        return letter <= 'Z' ? letter - 'A' + 1 : letter - FIRST_LETTER + 1;
    }

    /**
     * True for the ASCII letters {@code a..z} and {@code A..Z} only.
     */
    public static boolean isLetter(char c) {
        return (c >= FIRST_LETTER && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Converts a position to its letter.
     *
     * @throws PositionOutOfRangeException if {@code pos} is outside {@code 1..26}
     */
    public static char toLetter(int pos) {
        if (!hasLetter(pos)) {
            throw new PositionOutOfRangeException(pos, MAX_POSITION);
        }
        return (char) (FIRST_LETTER + pos - 1);
    }

    public static boolean hasLetter(int pos) {
        return pos >= 1 && pos <= MAX_POSITION;
    }

    /**
     * Human-readable name for a position: its letter where it has one, the number otherwise.
     */
    public static String label(int pos) {
        return hasLetter(pos) ? String.valueOf(toLetter(pos)) : String.valueOf(pos);
    }
}
