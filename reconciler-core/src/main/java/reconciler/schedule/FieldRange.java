package reconciler.schedule;

import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of calendar field values with a step, as understood by the scheduler.
 */
public record FieldRange(int start, int end, int step) {

  public FieldRange {
    if (end < start) {
      throw new IllegalArgumentException("end must be >= start, got: " + start + "-" + end);
    }
    if (step < 1) {
      throw new IllegalArgumentException("step must be >= 1, got: " + step);
    }
  }

  public static FieldRange single(int value) {
    return new FieldRange(value, value, 1);
  }

  /**
   * Parses a comma separated list of {@code start[-end][/step]} terms.
   *
   * @throws IllegalArgumentException if a term is malformed
   */
  public static List<FieldRange> parseList(String expression) {
    List<FieldRange> ranges = new ArrayList<>();
    for (String term : expression.split(",")) {
      String trimmed = term.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int step = 1;
      int slash = trimmed.indexOf('/');
      if (slash >= 0) {
        step = parseInt(trimmed.substring(slash + 1), expression);
        trimmed = trimmed.substring(0, slash);
      }
      int dash = trimmed.indexOf('-');
      int start;
      int end;
      if (dash > 0) {
        start = parseInt(trimmed.substring(0, dash), expression);
        end = parseInt(trimmed.substring(dash + 1), expression);
      } else {
        start = parseInt(trimmed, expression);
        end = start;
      }
      ranges.add(new FieldRange(start, end, step));
    }
    if (ranges.isEmpty()) {
      throw new IllegalArgumentException("Empty range expression: '" + expression + "'");
    }
    return List.copyOf(ranges);
  }

  private static int parseInt(String value, String expression) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid range expression: '" + expression + "'", e);
    }
  }

  @Override
  public String toString() {
    if (start == end) {
      return Integer.toString(start);
    }
    return step == 1 ? start + "-" + end : start + "-" + end + "/" + step;
  }
}
