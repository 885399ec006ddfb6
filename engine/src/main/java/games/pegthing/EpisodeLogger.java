package games.pegthing;

import games.pegthing.board.Board;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON log lines describing each round.
 *
 * <p>Lines are prefixed with {@code EPISODE_STEP} / {@code EPISODE_SUMMARY} so downstream
 * tools can filter them out of mixed console output.</p>
 */
public class EpisodeLogger {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Emit a single JSON line describing one move attempt: the jumps that were legal before it,
     * what the player typed, and the peg count before and after.
     *
     * @param boardAfter board after the attempt; same as {@code boardBefore} when it was rejected
     */
    public static void logStep(
            int roundIndex,
            int stepIndex,
            Board boardBefore,
            Board boardAfter,
            List<String> legalMoves,
            String input,
            boolean legal) {

        try {
            log.info("EPISODE_STEP {}",
                    stepJson(roundIndex, stepIndex, boardBefore, boardAfter, legalMoves, input, legal));
        } catch (Exception e) {
            // Logging must never interfere with gameplay.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode step", e);
            }
        }
    }

    /**
     * Emit a single JSON line summarising a finished or abandoned round.
     */
    public static void logSummary(int roundIndex, Game.GameResult result) {
        try {
            log.info("EPISODE_SUMMARY {}", summaryJson(roundIndex, result));
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode summary", e);
            }
        }
    }

    static String stepJson(
            int roundIndex,
            int stepIndex,
            Board boardBefore,
            Board boardAfter,
            List<String> legalMoves,
            String input,
            boolean legal) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\"type\":\"step\"");
        sb.append(",\"round_index\":").append(roundIndex);
        sb.append(",\"step_index\":").append(stepIndex);
        // Typed input first for easy spotting in logs
        sb.append(",\"input\":\"").append(escape(input)).append('"');
        sb.append(",\"legal\":").append(legal);
        sb.append(",\"rows\":").append(boardBefore.rows());
        sb.append(",\"pegs_before\":").append(boardBefore.pegCount());
        sb.append(",\"pegs_after\":").append(boardAfter.pegCount());

        sb.append(",\"pegged\":[");
        boolean first = true;
        for (int pos = 1; pos <= boardBefore.maxPosition(); pos++) {
            if (!boardBefore.isPegged(pos)) {
                continue;
            }
            if (!first) {
                sb.append(',');
            }
            sb.append(pos);
            first = false;
        }
        sb.append(']');

        sb.append(",\"legal_moves\":[");
        for (int i = 0; i < legalMoves.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append('"').append(legalMoves.get(i)).append('"');
        }
        sb.append(']');
        sb.append('}');
        return sb.toString();
    }

    static String summaryJson(int roundIndex, Game.GameResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\"type\":\"summary\"");
        sb.append(",\"round_index\":").append(roundIndex);
        sb.append(",\"rows\":").append(result.getRows());
        sb.append(",\"empty_hole\":").append(result.getEmptyHole());
        sb.append(",\"moves\":").append(result.getMoves());
        sb.append(",\"invalid_moves\":").append(result.getInvalidMoves());
        sb.append(",\"pegs_left\":").append(result.getPegsLeft());
        sb.append(",\"final_state\":\"").append(result.getFinalState()).append('"');
        sb.append(",\"duration_nanos\":").append(result.getDurationNanos());
        sb.append('}');
        return sb.toString();
    }

    private static String escape(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
