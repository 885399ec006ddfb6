package games.pegthing.player;

import games.pegthing.board.Board;

/**
 * Represents a player answering the game loop's prompts.
 */
public interface Player {

    /**
     * Provide the answer to a prompt (row count, hole to empty, jump, or replay choice).
     *
     * @param board  current board; null while no board exists yet (row-count prompt).
     * @param prompt question being asked, e.g. "Move from where to where? Enter two letters:".
     * @return raw input line, or null to signal the game should exit.
     */
    String nextInput(Board board, String prompt);
}
