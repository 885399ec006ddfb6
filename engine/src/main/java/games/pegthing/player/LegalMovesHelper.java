package games.pegthing.player;

import games.pegthing.board.Board;
import games.pegthing.board.PositionLetters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Lists the jumps currently legal on a board, ordered by source then destination.
 */
public final class LegalMovesHelper {
    private LegalMovesHelper() {
    }

    /**
     * Return all currently legal jumps as typed commands (e.g. {@code "ad"}).
     */
    public static List<String> listLegalMoves(Board board) {
        if (board == null) {
            return Collections.emptyList();
        }
        List<String> commands = new ArrayList<>();
        for (int pos = 1; pos <= board.maxPosition(); pos++) {
            for (int destination : board.validMoves(pos).keySet()) {
                commands.add(new Move(pos, destination).toCommandString());
            }
        }
        return commands;
    }

    /**
     * Same jumps as {@link #listLegalMoves(Board)}, each annotated with the peg it removes
     * (e.g. {@code "ad (jumps b)"}).
     */
    public static List<String> describeLegalMoves(Board board) {
        if (board == null) {
            return Collections.emptyList();
        }
        List<String> lines = new ArrayList<>();
        for (int pos = 1; pos <= board.maxPosition(); pos++) {
            for (Map.Entry<Integer, Integer> move : board.validMoves(pos).entrySet()) {
                lines.add(new Move(pos, move.getKey()).toCommandString()
                        + " (jumps " + PositionLetters.label(move.getValue()) + ")");
            }
        }
        return lines;
    }
}
