package reconciler.schedule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldRangeTest {

  @Test
  void parsesSingleValuesRangesAndSteps() {
    assertEquals(List.of(
        FieldRange.single(7),
        new FieldRange(1, 5, 1),
        new FieldRange(0, 30, 15)),
        FieldRange.parseList("7, 1-5, 0-30/15"));
  }

  @Test
  void toStringIsCompact() {
    assertEquals("7", FieldRange.single(7).toString());
    assertEquals("1-5", new FieldRange(1, 5, 1).toString());
    assertEquals("0-30/15", new FieldRange(0, 30, 15).toString());
  }

  @Test
  void rejectsMalformedExpressions() {
    assertThrows(IllegalArgumentException.class, () -> FieldRange.parseList(""));
    assertThrows(IllegalArgumentException.class, () -> FieldRange.parseList("mon"));
    assertThrows(IllegalArgumentException.class, () -> FieldRange.parseList("5-1"));
    assertThrows(IllegalArgumentException.class, () -> FieldRange.parseList("1-5/0"));
  }
}
