package games.pegthing.player;

import games.pegthing.board.Board;
import java.util.Scanner;
import org.springframework.stereotype.Component;

/**
 * Human player that reads answers from stdin (CLI).
 */
@Component
public class HumanPlayer implements Player {
    private final Scanner scanner = new Scanner(System.in);

    @Override
    public String nextInput(Board board, String prompt) {
        System.out.println(prompt);
        if (!scanner.hasNextLine()) {
            return null;
        }
        return scanner.nextLine();
    }
}
