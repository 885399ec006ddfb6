package games.pegthing.config;

import games.pegthing.board.PositionLetters;
import games.pegthing.board.Triangular;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for board setup defaults and guidance.
 *
 * Defaults apply when the player just presses enter at a prompt. The row limit exists because
 * positions are typed as single letters: six rows (21 holes) is the largest board that fits
 * in {@code a..z}. With {@code peg.guidance=true} every move prompt is preceded by the jumps
 * that are legal on the current board.
 *
 * Usage:
 * {@code java -jar engine/target/peg-thing-engine-1.0.0.jar --peg.default-rows=4 --peg.default-empty-hole=a --peg.guidance=true}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "peg")
public class PegThingProperties {
  /** Largest row count whose positions all have a letter. */
  public static final int LETTERED_ROWS_LIMIT = 6;

  private int defaultRows = 5;
  private int maxRows = LETTERED_ROWS_LIMIT;
  private String defaultEmptyHole = "e";
  private boolean guidance = false;

  public int getDefaultRows() {
    return defaultRows;
  }

  public void setDefaultRows(int defaultRows) {
    if (defaultRows < 1) {
      throw new IllegalArgumentException("peg.default-rows must be at least 1, was " + defaultRows);
    }
    this.defaultRows = defaultRows;
  }

  public int getMaxRows() {
    return maxRows;
  }

  /**
   * Sets the largest board players may ask for.
   * @param maxRows 1..6
   * @throws IllegalArgumentException if the board would have positions without a letter
   */
  public void setMaxRows(int maxRows) {
    if (maxRows < 1 || maxRows > LETTERED_ROWS_LIMIT
        || Triangular.rowTriangular(maxRows) > PositionLetters.MAX_POSITION) {
      throw new IllegalArgumentException(
          "peg.max-rows must be between 1 and " + LETTERED_ROWS_LIMIT + ", was " + maxRows);
    }
    this.maxRows = maxRows;
  }

  public String getDefaultEmptyHole() {
    return defaultEmptyHole;
  }

  /**
   * Sets the hole emptied when the player just presses enter.
   * @param defaultEmptyHole a single letter {@code a..z}, either case; stored lower-cased
   * @throws IllegalArgumentException for anything else
   */
  public void setDefaultEmptyHole(String defaultEmptyHole) {
    String hole = defaultEmptyHole == null ? "" : defaultEmptyHole.trim();
    if (hole.length() != 1 || !PositionLetters.isLetter(hole.charAt(0))) {
      throw new IllegalArgumentException(
          "peg.default-empty-hole must be a single letter a..z, was '" + defaultEmptyHole + "'");
    }
    this.defaultEmptyHole = PositionLetters.label(PositionLetters.toPosition(hole.charAt(0)));
  }

  /**
   * Returns whether legal jumps are listed before each move prompt.
   * @return true if guidance is on
   */
  public boolean isGuidance() {
    return guidance;
  }

  public void setGuidance(boolean guidance) {
    this.guidance = guidance;
  }

  /**
   * Checks the rules that span more than one property. Binding order is not fixed, so these
   * cannot live in the setters.
   * @throws IllegalArgumentException if {@code default-rows} is above {@code max-rows}
   */
  public void validate() {
    if (defaultRows > maxRows) {
      throw new IllegalArgumentException(
          "peg.default-rows (" + defaultRows + ") must not exceed peg.max-rows (" + maxRows + ")");
    }
  }
}
