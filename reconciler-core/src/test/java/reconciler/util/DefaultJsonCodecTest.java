package reconciler.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void toJsonWithEmptyMapReturnsNull() {
    assertNull(codec.toJson(Map.of()));
    assertNull(codec.toJson(null));
  }

  @Test
  void toJsonKeepsInsertionOrder() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("entityType", "reminder");
    map.put("entityId", "42");

    assertEquals("{\"entityType\":\"reminder\",\"entityId\":\"42\"}", codec.toJson(map));
  }

  @Test
  void toJsonEscapesSpecialCharacters() {
    String json = codec.toJson(Map.of("msg", "say \"hi\"\n\\"));

    assertEquals("{\"msg\":\"say \\\"hi\\\"\\n\\\\\"}", json);
  }

  @Test
  void parseReadsEscapesAndDropsNulls() {
    Map<String, String> parsed = codec.parseObject(
        "{ \"kind\" : \"cron\", \"cron\": \"0 9 * * *\\u003b0 18 * * *\", \"tz\": null }");

    assertEquals(Map.of("kind", "cron", "cron", "0 9 * * *;0 18 * * *"), parsed);
  }

  @Test
  void parseOfBlankOrNullIsEmpty() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
    assertTrue(codec.parseObject("{}").isEmpty());
  }

  @Test
  void parseRejectsNonFlatOrTruncatedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"every_seconds\": 60}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\": {\"b\": \"c\"}}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\": \"b\""));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\": \"b\"} extra"));
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[]"));
  }
}
