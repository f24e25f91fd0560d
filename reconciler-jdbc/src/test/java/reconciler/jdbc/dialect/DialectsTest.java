package reconciler.jdbc.dialect;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import reconciler.jdbc.spi.Dialect;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialectsTest {

  @Test
  void allReturnsBuiltInDialects() {
    List<Dialect> dialects = Dialects.all();

    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("postgresql")));
    assertTrue(dialects.stream().anyMatch(d -> d.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("postgresql", Dialects.get("PostgreSQL").name());
    assertEquals("h2", Dialects.get("H2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown dialect: oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("postgresql", Dialects.detect("jdbc:postgresql://localhost:5432/reminders").name());
    assertEquals("h2", Dialects.detect("jdbc:h2:mem:test").name());
  }

  @Test
  void detectRejectsUnknownOrEmptyUrl() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Dialects.detect("jdbc:mysql://localhost/db"));
    assertTrue(ex.getMessage().contains("jdbc:postgresql:"));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect(""));
    assertThrows(IllegalArgumentException.class, () -> Dialects.detect((String) null));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dialects_detect");

    assertEquals("h2", Dialects.detect(ds).name());
  }
}
