package games.pegthing;

import games.pegthing.board.Board;
import games.pegthing.board.BoardBuilder;
import games.pegthing.board.PositionLetters;
import games.pegthing.config.PegThingProperties;
import games.pegthing.player.LegalMovesHelper;
import games.pegthing.player.Move;
import games.pegthing.player.Player;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    static final String ROWS_PROMPT_FORMAT = "How many rows? [%d]";
    static final String EMPTY_HOLE_PROMPT_FORMAT = "Remove which peg? [%s]";
    static final String MOVE_PROMPT = "Move from where to where? Enter two letters:";
    static final String REPLAY_PROMPT = "Play again? [y/n]";

    private final Player player;
    private final PegThingProperties pegProperties;

    public Game(Player player, PegThingProperties pegProperties) {
        pegProperties.validate();
        this.player = player;
        this.pegProperties = pegProperties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the results; tests call playSession() directly.
        playSession();
    }

    /**
     * Plays rounds until the player declines a replay or input runs out.
     *
     * @return one result per round that got as far as building a board, in play order
     */
    public List<GameResult> playSession() {
        List<GameResult> results = new ArrayList<>();
        int roundIndex = 0;
        while (true) {
            roundIndex++;
            GameResult result = playRound(roundIndex);
            if (result == null) {
                break;
            }
            results.add(result);
            if (EpisodeLogger.isEnabled()) {
                EpisodeLogger.logSummary(roundIndex, result);
            }
            if (!result.isFinished()) {
                break;
            }
            String again = ask(result.getFinalBoard(), REPLAY_PROMPT, "y");
            if (!"y".equalsIgnoreCase(again)) {
                log.info("Bye!");
                break;
            }
        }
        return results;
    }

    /**
     * Plays a single round: row count, hole to empty, then jumps until none is left.
     *
     * <p>The round walks through {@link RoundState} in order. An illegal jump leaves the board
     * as it was and simply asks again. The round ends early, unfinished, if the player's input
     * runs out or the per-round input cap ({@code -Dmax.moves.per.game}) is hit.
     *
     * @return the round's outcome, or null if input ran out before a board was built
     */
    public GameResult playRound(int roundIndex) {
        long startNanos = System.nanoTime();
        RoundState state = RoundState.AWAITING_ROW_COUNT;
        final int maxIterations = Integer.getInteger("max.moves.per.game", 10_000);

        Integer rows = askRows();
        if (rows == null) {
            return null;
        }
        Board board = BoardBuilder.newBoard(rows);
        state = transition(state, RoundState.AWAITING_EMPTY_HOLE_CHOICE);

        log.info("Here's your board:\n{}", board);
        Integer emptyHole = askEmptyHole(board);
        if (emptyHole == null) {
            return new GameResult(rows, 0, board, state, 0, 0, System.nanoTime() - startNanos);
        }
        board = board.removePeg(emptyHole);
        state = transition(state, board.anyMoveExists() ? RoundState.PLAYING : RoundState.GAME_OVER);

        int moves = 0;
        int invalidMoves = 0;
        int iterations = 0;
        while (state == RoundState.PLAYING) {
            log.info("\nHere's your board:\n{}", board);
            if (pegProperties.isGuidance()) {
                log.info("Legal jumps now:\n- {}", String.join("\n- ", LegalMovesHelper.describeLegalMoves(board)));
            }

            String input = player.nextInput(board, MOVE_PROMPT);
            if (input == null) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed. Abandoning round {} for player {}",
                            roundIndex, player.getClass().getSimpleName());
                }
                break;
            }
            // Move.tryParse handles case itself; lower-casing here would fold non-ASCII letters into a..z.
            input = input.trim();
            if (log.isDebugEnabled()) {
                log.debug("Received move from {}: {}", player.getClass().getSimpleName(), input);
            }

            iterations++;
            if (iterations > maxIterations) {
                if (log.isDebugEnabled()) {
                    log.debug("Maximum iteration limit reached ({}); stopping round {} to avoid runaway execution.",
                            maxIterations, roundIndex);
                }
                break;
            }

            Board before = board;
            Board.MoveResult result = applyMove(board, input);
            if (result.success) {
                board = result.board;
                moves++;
                if (log.isDebugEnabled()) {
                    log.debug("Applied move {}: {}", input, result.message);
                }
                if (!board.anyMoveExists()) {
                    state = transition(state, RoundState.GAME_OVER);
                }
            } else {
                invalidMoves++;
                log.info("\n!!! That was an invalid move. :( {}\n", result.message);
                if (log.isDebugEnabled()) {
                    log.debug("Illegal move from {}: {} ({})",
                            player.getClass().getSimpleName(), input, result.message);
                }
            }

            if (EpisodeLogger.isEnabled()) {
                EpisodeLogger.logStep(roundIndex, iterations, before, board,
                        LegalMovesHelper.listLegalMoves(before), input, result.success);
            }
        }

        if (state == RoundState.GAME_OVER) {
            log.info("Game over! You had {} pegs left:\n{}", board.pegCount(), board);
        }
        return new GameResult(rows, emptyHole, board, state, moves, invalidMoves, System.nanoTime() - startNanos);
    }

    private Board.MoveResult applyMove(Board board, String input) {
        Move move = Move.tryParse(input);
        if (move == null) {
            return Board.MoveResult.failure("Enter two position letters, e.g. 'ad'.");
        }
        return board.attemptMove(move.from(), move.to());
    }

    /**
     * Asks for the row count until a number in {@code 1..peg.max-rows} is given.
     *
     * @return the row count, or null if input ran out
     */
    private Integer askRows() {
        String prompt = String.format(ROWS_PROMPT_FORMAT, pegProperties.getDefaultRows());
        while (true) {
            String input = ask(null, prompt, String.valueOf(pegProperties.getDefaultRows()));
            if (input == null) {
                return null;
            }
            int rows;
            try {
                rows = Integer.parseInt(input);
            } catch (NumberFormatException e) {
                log.info("\n!!! \"{}\" is not a number of rows.\n", input);
                continue;
            }
            if (rows < 1 || rows > pegProperties.getMaxRows()) {
                log.info("\n!!! Pick between 1 and {} rows.\n", pegProperties.getMaxRows());
                continue;
            }
            return rows;
        }
    }

    /**
     * Asks for the hole to empty until a letter naming a position on {@code board} is given.
     *
     * @return the position, or null if input ran out
     */
    private Integer askEmptyHole(Board board) {
        String prompt = String.format(EMPTY_HOLE_PROMPT_FORMAT, pegProperties.getDefaultEmptyHole());
        while (true) {
            String input = ask(board, prompt, pegProperties.getDefaultEmptyHole());
            if (input == null) {
                return null;
            }
            int pos = firstLetterPosition(input);
            if (!board.contains(pos)) {
                log.info("\n!!! \"{}\" is not a hole on this board; use a letter from a to {}.\n",
                        input, PositionLetters.label(board.maxPosition()));
                continue;
            }
            return pos;
        }
    }

    /**
     * Position named by the first letter in {@code input}, or {@code 0} when there is none.
     */
    private static int firstLetterPosition(String input) {
        for (char c : input.toCharArray()) {
            if (PositionLetters.isLetter(c)) {
                return PositionLetters.toPosition(c);
            }
        }
        return 0;
    }

    /**
     * Asks the player and cleans the answer: trimmed, blank replaced by {@code defaultValue}.
     *
     * @return the cleaned answer, or null if input ran out
     */
    private String ask(Board board, String prompt, String defaultValue) {
        String input = player.nextInput(board, prompt);
        if (input == null) {
            if (log.isDebugEnabled()) {
                log.debug("Input closed. Exiting for player {}", player.getClass().getSimpleName());
            }
            return null;
        }
        input = input.trim();
        return input.isEmpty() ? defaultValue : input;
    }

    private static RoundState transition(RoundState from, RoundState to) {
        if (log.isDebugEnabled()) {
            log.debug("Round state {} -> {}", from, to);
        }
        return to;
    }

    public static final class GameResult {
        private final int rows;
        private final int emptyHole;
        private final Board finalBoard;
        private final RoundState finalState;
        private final int moves;
        private final int invalidMoves;
        private final long durationNanos;

        public GameResult(int rows, int emptyHole, Board finalBoard, RoundState finalState,
                          int moves, int invalidMoves, long durationNanos) {
            this.rows = rows;
            this.emptyHole = emptyHole;
            this.finalBoard = finalBoard;
            this.finalState = finalState;
            this.moves = moves;
            this.invalidMoves = invalidMoves;
            this.durationNanos = durationNanos;
        }

        public int getRows() {
            return rows;
        }

        /**
         * Position emptied before the first jump; {@code 0} if the player never chose one.
         */
        public int getEmptyHole() {
            return emptyHole;
        }

        public Board getFinalBoard() {
            return finalBoard;
        }

        public RoundState getFinalState() {
            return finalState;
        }

        /**
         * True when the round reached {@link RoundState#GAME_OVER} rather than being abandoned.
         */
        public boolean isFinished() {
            return finalState == RoundState.GAME_OVER;
        }

        public int getPegsLeft() {
            return finalBoard.pegCount();
        }

        public int getMoves() {
            return moves;
        }

        public int getInvalidMoves() {
            return invalidMoves;
        }

        public long getDurationNanos() {
            return durationNanos;
        }
    }
}
