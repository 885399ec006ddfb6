package games.pegthing;

/**
 * Phases of one round, in the order the game loop moves through them.
 */
public enum RoundState {
    /** Waiting for the number of rows; no board exists yet. */
    AWAITING_ROW_COUNT,
    /** Fresh, fully-pegged board; waiting for the hole to empty. */
    AWAITING_EMPTY_HOLE_CHOICE,
    /** At least one legal jump exists; waiting for the next move. */
    PLAYING,
    /** No legal jump is left anywhere; the score is the remaining peg count. */
    GAME_OVER
}
